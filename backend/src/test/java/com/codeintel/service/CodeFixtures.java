package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.source.SingleFileCodeSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

/**
 * Builds engine components over the datasets under src/test/resources/fixtures.
 */
public final class CodeFixtures {

    /**
     * APC used by fixture code C9600 so that its HOPD payment is exactly 10000.
     */
    public static final String TEST_APC = "0001";

    private CodeFixtures() {
    }

    public static EngineProperties properties() {
        EngineProperties properties = new EngineProperties();
        properties.getCms().getApcRates().put(TEST_APC, 10_000L);
        return properties;
    }

    public static SingleFileCodeSource singleFile(String fixture) {
        return new SingleFileCodeSource(new ClassPathResource("fixtures/" + fixture + "/codes_2025.json"),
            new ObjectMapper());
    }

    public static CodeIndex emptyIndex(EngineProperties properties) {
        return new CodeIndex(new PaymentDeriver(properties));
    }

    public static CodeIndex loadedIndex(EngineProperties properties) {
        CodeIndex index = emptyIndex(properties);
        index.load(singleFile("single"));
        return index;
    }

    public static CodeIndex loadedIndex() {
        return loadedIndex(properties());
    }
}
