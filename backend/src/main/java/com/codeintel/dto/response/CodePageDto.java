package com.codeintel.dto.response;

import java.util.List;

/**
 * One page of a code listing.
 */
public record CodePageDto(
    List<CodeSummaryDto> codes,
    int total,
    int limit,
    int offset,
    boolean hasMore
) {}
