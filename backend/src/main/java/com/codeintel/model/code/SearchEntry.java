package com.codeintel.model.code;

import com.codeintel.model.enums.CodeType;

import java.util.Locale;

/**
 * Flattened search corpus row: the record plus its pre-lowercased match strings.
 *
 * @param searchText lower-cased "code description"
 */
public record SearchEntry(CodeRecord record, String codeLower, String searchText, CodeType type) {

    public static SearchEntry of(CodeRecord record) {
        return new SearchEntry(
            record,
            record.code().toLowerCase(Locale.ROOT),
            (record.code() + " " + record.description()).toLowerCase(Locale.ROOT),
            record.type()
        );
    }
}
