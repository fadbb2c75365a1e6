package com.codeintel.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param message set only when the query was too short to run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodeSearchResponse(
    List<CodeSummaryDto> data,
    int total,
    String query,
    String message
) {}
