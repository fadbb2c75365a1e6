package com.codeintel.model.enums;

import com.codeintel.model.code.CodeRecord;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.Function;

/**
 * Fields a code listing can be ordered by.
 */
public enum CodeSortField {
    CODE("code", CodeRecord::code),
    DESCRIPTION("description", CodeRecord::description),
    TYPE("type", record -> record.type().getValue()),
    CATEGORY("category", CodeRecord::category);

    private final String value;
    private final Function<CodeRecord, String> extractor;

    CodeSortField(String value, Function<CodeRecord, String> extractor) {
        this.value = value;
        this.extractor = extractor;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String extract(CodeRecord record) {
        String key = extractor.apply(record);
        return key == null ? "" : key;
    }

    public static CodeSortField fromValue(String value) {
        for (CodeSortField field : values()) {
            if (field.value.equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + value);
    }
}
