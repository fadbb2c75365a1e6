package com.codeintel.model.code;

import com.codeintel.model.enums.CodeSortField;
import com.codeintel.model.enums.CodeType;
import com.codeintel.model.enums.SortOrder;

/**
 * Page request for a code listing.
 *
 * @param type null lists every code system
 */
public record CodeQuery(int limit, int offset, CodeType type, CodeSortField sortBy, SortOrder sortOrder) {

    public static final int DEFAULT_LIMIT = 50;

    public CodeQuery {
        sortBy = sortBy == null ? CodeSortField.CODE : sortBy;
        sortOrder = sortOrder == null ? SortOrder.ASC : sortOrder;
    }
}
