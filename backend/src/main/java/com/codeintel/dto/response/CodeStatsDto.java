package com.codeintel.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for code index statistics.
 *
 * @param chunks present only when the index was loaded from the chunked layout
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodeStatsDto(
    int totalCodes,
    @JsonProperty("isLoaded") boolean isLoaded,
    Map<String, Integer> types,
    String loadMethod,
    ChunkInfo chunks
) {

    public record ChunkInfo(int count, Double targetSizeMB, String createdAt) {}
}
