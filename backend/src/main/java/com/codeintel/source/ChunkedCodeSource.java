package com.codeintel.source;

import com.codeintel.model.code.RawCodeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Dataset split into several JSON array files listed by a manifest.
 * Chunks are concatenated in manifest order.
 */
@Slf4j
public class ChunkedCodeSource implements CodeSource {

    public static final String MANIFEST_FILE = "manifest.json";

    private final Resource chunksDirectory;
    private final ObjectMapper objectMapper;

    /**
     * @param chunksDirectory directory resource; its location must end with '/'
     */
    public ChunkedCodeSource(Resource chunksDirectory, ObjectMapper objectMapper) {
        this.chunksDirectory = chunksDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public CodeBatch read() throws IOException {
        long start = System.currentTimeMillis();
        CodeManifest manifest = readManifest();
        log.info("Manifest: {} chunks, {} total codes", manifest.chunkCount(), manifest.totalCodes());

        List<RawCodeRecord> records = new ArrayList<>();
        for (CodeManifest.Chunk chunk : manifest.chunks()) {
            if (chunk.fileName() == null || chunk.fileName().isBlank()) {
                throw new IOException("Manifest lists a chunk without fileName");
            }
            Resource chunkFile = chunksDirectory.createRelative(chunk.fileName());
            if (!chunkFile.exists()) {
                throw new FileNotFoundException("Chunk file not found: " + chunkFile.getDescription());
            }
            long chunkStart = System.currentTimeMillis();
            List<RawCodeRecord> chunkRecords;
            try (InputStream in = chunkFile.getInputStream()) {
                chunkRecords = objectMapper.readValue(in, SingleFileCodeSource.RECORD_LIST);
            }
            if (chunkRecords == null) {
                throw new IOException("Chunk file is empty: " + chunk.fileName());
            }
            records.addAll(chunkRecords);
            log.info("  Loaded {}: {} codes ({}ms)", chunk.fileName(), chunkRecords.size(),
                System.currentTimeMillis() - chunkStart);
        }

        if (manifest.totalCodes() > 0 && manifest.totalCodes() != records.size()) {
            log.warn("Manifest declares {} codes but chunks contained {}", manifest.totalCodes(), records.size());
        }
        log.info("Loaded {} codes from {} chunks in {}ms", records.size(), manifest.chunks().size(),
            System.currentTimeMillis() - start);
        return new CodeBatch(records, CodeBatch.CHUNKED, manifest);
    }

    @Override
    public String describe() {
        return "chunked files in " + chunksDirectory.getDescription();
    }

    boolean hasManifest() throws IOException {
        return chunksDirectory.createRelative(MANIFEST_FILE).exists();
    }

    private CodeManifest readManifest() throws IOException {
        Resource manifestFile = chunksDirectory.createRelative(MANIFEST_FILE);
        if (!manifestFile.exists()) {
            throw new FileNotFoundException("Chunk manifest not found: " + manifestFile.getDescription());
        }
        CodeManifest manifest;
        try (InputStream in = manifestFile.getInputStream()) {
            manifest = objectMapper.readValue(in, CodeManifest.class);
        }
        if (manifest == null || manifest.chunks() == null) {
            throw new IOException("Chunk manifest has no chunks: " + manifestFile.getDescription());
        }
        return manifest;
    }
}
