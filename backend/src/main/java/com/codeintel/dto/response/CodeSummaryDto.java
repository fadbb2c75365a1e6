package com.codeintel.dto.response;

import java.util.List;

/**
 * Lightweight code view for listings and search results.
 */
public record CodeSummaryDto(
    String code,
    String description,
    String category,
    String type,
    List<String> labels
) {}
