package com.codeintel.config;

import com.codeintel.service.CodeIntelligenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the code index before the application reports itself ready.
 * A load failure propagates and aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeIndexInitializer implements ApplicationRunner {

    private final CodeIntelligenceService codeService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Initializing code index...");
        codeService.loadCodes();
        log.info("Code index ready: {} codes", codeService.getStats().totalCodes());
    }
}
