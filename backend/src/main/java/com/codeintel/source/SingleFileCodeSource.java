package com.codeintel.source;

import com.codeintel.model.code.RawCodeRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Whole dataset in one JSON array file.
 */
@Slf4j
public class SingleFileCodeSource implements CodeSource {

    static final TypeReference<List<RawCodeRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Resource file;
    private final ObjectMapper objectMapper;

    public SingleFileCodeSource(Resource file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public CodeBatch read() throws IOException {
        if (!file.exists()) {
            throw new FileNotFoundException("Code data file not found: " + file.getDescription());
        }
        long start = System.currentTimeMillis();
        List<RawCodeRecord> records;
        try (InputStream in = file.getInputStream()) {
            records = objectMapper.readValue(in, RECORD_LIST);
        }
        if (records == null) {
            throw new IOException("Code data file is empty: " + file.getDescription());
        }
        log.info("Loaded {} codes from {} in {}ms", records.size(), file.getDescription(),
            System.currentTimeMillis() - start);
        return new CodeBatch(records, CodeBatch.SINGLE_FILE, null);
    }

    @Override
    public String describe() {
        return "single file " + file.getDescription();
    }
}
