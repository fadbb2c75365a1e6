package com.codeintel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Billing code systems held in the code index.
 * Raw dataset labels DX and PCS normalize to ICD10 and ICD10-PCS.
 */
public enum CodeType {
    CPT("CPT"),
    HCPCS("HCPCS"),
    ICD10("ICD10"),
    ICD10_PCS("ICD10-PCS"),
    OTHER("OTHER");

    private final String value;

    CodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for the code systems that carry physician fee schedule / OPPS rate data.
     */
    public boolean isPayable() {
        return this == CPT || this == HCPCS;
    }

    /**
     * Normalize a raw type label from the dataset. Never returns null;
     * missing or unrecognized labels map to OTHER.
     */
    public static CodeType normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("DX")) return ICD10;
        if (upper.equals("PCS")) return ICD10_PCS;
        for (CodeType type : values()) {
            if (type.value.equals(upper)) {
                return type;
            }
        }
        return OTHER;
    }

    /**
     * Resolve a query filter. Empty when the label names no known code system,
     * so an unknown filter matches nothing instead of the OTHER bucket.
     */
    public static Optional<CodeType> fromFilter(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        CodeType type = normalize(value);
        if (type == OTHER && !OTHER.value.equalsIgnoreCase(value.trim())) {
            return Optional.empty();
        }
        return Optional.of(type);
    }
}
