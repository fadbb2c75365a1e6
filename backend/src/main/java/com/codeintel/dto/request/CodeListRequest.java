package com.codeintel.dto.request;

/**
 * Listing parameters as received from the caller. Every field is optional.
 */
public record CodeListRequest(
    Integer limit,
    Integer offset,
    String type,
    String sortBy,
    String sortOrder
) {

    public static CodeListRequest defaults() {
        return new CodeListRequest(null, null, null, null, null);
    }
}
