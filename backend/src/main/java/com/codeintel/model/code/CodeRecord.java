package com.codeintel.model.code;

import com.codeintel.model.enums.CodeType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A billing code (CPT, HCPCS, ICD-10 or ICD-10-PCS) with its rate-setting metadata.
 * Built once while the index loads and never mutated afterwards.
 */
public record CodeRecord(
    String code,
    String description,
    String rawType,
    CodeType type,
    List<String> labels,
    RateMetadata rateMetadata,
    JsonNode rawMetadata
) {

    public CodeRecord {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        labels = labels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(labels));
        rateMetadata = rateMetadata == null ? RateMetadata.EMPTY : rateMetadata;
    }

    /**
     * Validate and convert a dataset row.
     *
     * @throws IllegalArgumentException if the row has no code or carries unparseable rate data
     */
    public static CodeRecord fromRaw(RawCodeRecord raw) {
        if (raw == null || raw.code() == null || raw.code().isBlank()) {
            throw new IllegalArgumentException("Invalid code data: code is required");
        }
        CodeType type = CodeType.normalize(raw.type());
        RateMetadata rates;
        try {
            rates = RateMetadata.select(raw.metadata(), raw.type(), type.getValue());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid metadata for code " + raw.code() + ": " + e.getMessage(), e);
        }
        return new CodeRecord(raw.code(), raw.description(), raw.type(), type, raw.labels(), rates, raw.metadata());
    }

    /**
     * Display category: the first label when present, otherwise derived from the code system.
     */
    public String category() {
        if (!labels.isEmpty()) {
            return labels.get(0);
        }
        return switch (type) {
            case CPT -> cptSection();
            case HCPCS -> "HCPCS Level II";
            case ICD10 -> "ICD-10 Diagnosis";
            case ICD10_PCS -> "ICD-10 Procedure";
            case OTHER -> type.getValue();
        };
    }

    private String cptSection() {
        if (code.endsWith("F")) return "Category II - Performance Measurement";
        if (code.endsWith("T")) return "Category III - Emerging Technology";

        int number = leadingNumber(code);
        if (number >= 10000 && number <= 19999) return "Integumentary System";
        if (number >= 20000 && number <= 29999) return "Musculoskeletal System";
        if (number >= 30000 && number <= 32999) return "Respiratory System";
        if (number >= 33000 && number <= 37999) return "Cardiovascular System";
        if (number >= 38000 && number <= 38999) return "Hemic and Lymphatic Systems";
        if (number >= 40000 && number <= 49999) return "Digestive System";
        if (number >= 50000 && number <= 53999) return "Urinary System";
        if (number >= 54000 && number <= 55999) return "Male Genital System";
        if (number >= 56000 && number <= 59999) return "Female Genital System";
        if (number >= 60000 && number <= 60999) return "Endocrine System";
        if (number >= 61000 && number <= 64999) return "Nervous System";
        if (number >= 65000 && number <= 68999) return "Eye and Ocular Adnexa";
        if (number >= 69000 && number <= 69999) return "Auditory System";
        if (number >= 70000 && number <= 79999) return "Radiology";
        if (number >= 80000 && number <= 89999) return "Pathology and Laboratory";
        if (number >= 90000 && number <= 99999) return "Medicine";
        return "CPT";
    }

    // Leading digits as an int, -1 when the code does not start with a digit
    private static int leadingNumber(String code) {
        int end = 0;
        while (end < code.length() && end < 9 && Character.isDigit(code.charAt(end))) {
            end++;
        }
        return end == 0 ? -1 : Integer.parseInt(code.substring(0, end));
    }
}
