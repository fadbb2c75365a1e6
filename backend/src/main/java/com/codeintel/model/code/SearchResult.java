package com.codeintel.model.code;

import java.util.List;

/**
 * Ranked search hits.
 *
 * @param total number of matching records before the limit was applied
 * @param query the query exactly as the caller sent it
 */
public record SearchResult(List<CodeRecord> records, int total, String query) {

    public static SearchResult empty(String query) {
        return new SearchResult(List.of(), 0, query);
    }
}
