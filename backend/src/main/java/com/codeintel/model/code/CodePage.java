package com.codeintel.model.code;

import java.util.List;

/**
 * One page of a sorted code listing.
 */
public record CodePage(List<CodeRecord> records, int total, int limit, int offset) {

    public CodePage {
        records = List.copyOf(records);
    }

    public boolean hasMore() {
        return (long) offset + limit < total;
    }
}
