package com.codeintel.model.code;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed view of the rate-setting block attached to a code
 * (RVUs, APC assignment, status indicator and friends).
 */
public record RateMetadata(
    double facilityRvu,
    double nonFacilityRvu,
    String apc,
    String si,
    String rank,
    String mueUnit,
    List<String> modifiers,
    String effectiveDate,
    String guidelines
) {

    public static final RateMetadata EMPTY =
        new RateMetadata(0, 0, null, null, null, null, List.of(), null, null);

    public RateMetadata {
        modifiers = modifiers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(modifiers));
    }

    /**
     * Pick the rate block for a code. The block is keyed by the raw type label,
     * falling back to the normalized label, then CPT, then HCPCS.
     */
    public static RateMetadata select(JsonNode metadata, String rawType, String normalizedType) {
        if (metadata == null || !metadata.isObject()) {
            return EMPTY;
        }
        for (String key : new String[] {rawType, normalizedType, "CPT", "HCPCS"}) {
            if (key != null && metadata.hasNonNull(key)) {
                return from(metadata.get(key));
            }
        }
        return EMPTY;
    }

    /**
     * Parse one rate block.
     *
     * @throws IllegalArgumentException if an RVU field holds non-numeric text
     */
    public static RateMetadata from(JsonNode block) {
        if (block == null || !block.isObject()) {
            return EMPTY;
        }
        return new RateMetadata(
            number(block, "FACILITY_RVU"),
            number(block, "NONFACILITY_RVU"),
            identifier(block.get("APC")),
            text(block.get("SI")),
            identifier(block.get("RANK")),
            identifier(block.get("MUE_UNIT")),
            stringList(block.get("MODIFIERS")),
            text(block.get("EFFECTIVE_DATE")),
            text(block.get("GUIDELINES"))
        );
    }

    private static double number(JsonNode block, String field) {
        JsonNode node = block.get(field);
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return 0;
        }
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not numeric: " + text, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(field + " is not numeric: " + text);
        }
        return value;
    }

    // APC 5193 may arrive as 5193, 5193.0 or "5193"
    private static String identifier(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            if (value == Math.rint(value)) {
                return String.valueOf((long) value);
            }
            return node.asText();
        }
        return text(node);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String value = text(item);
                if (value != null) {
                    values.add(value);
                }
            });
        } else {
            String value = text(node);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
