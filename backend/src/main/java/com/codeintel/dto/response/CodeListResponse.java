package com.codeintel.dto.response;

import java.util.List;

/**
 * Paged listing as returned by GET /api/codes.
 *
 * @param page 1-based page number derived from offset and limit
 */
public record CodeListResponse(
    List<CodeSummaryDto> data,
    int total,
    int limit,
    int offset,
    int page,
    int totalPages,
    boolean hasMore
) {

    public static CodeListResponse of(CodePageDto page) {
        int limit = page.limit();
        return new CodeListResponse(
            page.codes(),
            page.total(),
            limit,
            page.offset(),
            page.offset() / limit + 1,
            (int) Math.ceil((double) page.total() / limit),
            page.hasMore()
        );
    }
}
