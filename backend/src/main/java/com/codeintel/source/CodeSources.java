package com.codeintel.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

/**
 * Picks the dataset layout under a data directory: chunked when
 * {@code <chunks>/manifest.json} exists, otherwise the single file.
 */
public final class CodeSources {

    private CodeSources() {
    }

    public static CodeSource resolve(ResourceLoader resourceLoader, String location, String chunksDirectory,
                                     String singleFileName, ObjectMapper objectMapper) throws IOException {
        Resource dataDirectory = resourceLoader.getResource(asDirectory(location));
        ChunkedCodeSource chunked =
            new ChunkedCodeSource(dataDirectory.createRelative(asDirectory(chunksDirectory)), objectMapper);
        if (chunked.hasManifest()) {
            return chunked;
        }
        return new SingleFileCodeSource(dataDirectory.createRelative(singleFileName), objectMapper);
    }

    // Resource.createRelative drops the last path segment unless it ends with '/'
    static String asDirectory(String location) {
        return location.endsWith("/") ? location : location + "/";
    }
}
