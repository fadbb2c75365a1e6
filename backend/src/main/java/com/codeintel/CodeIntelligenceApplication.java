package com.codeintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeIntelligenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeIntelligenceApplication.class, args);
    }
}
