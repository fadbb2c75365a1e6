package com.codeintel.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * manifest.json written by the dataset chunking script.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeManifest(
    int chunkCount,
    long totalCodes,
    Double targetChunkSizeMB,
    String createdAt,
    List<Chunk> chunks
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chunk(String fileName, Integer codeCount) {}
}
