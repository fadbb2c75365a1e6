package com.codeintel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Profitability bucket of a reimbursement scenario.
 */
public enum MarginClassification {
    PROFITABLE("profitable", "Profitable", "green"),
    BREAK_EVEN("break-even", "Break-Even", "yellow"),
    LOSS("loss", "Loss", "red");

    private final String value;
    private final String label;
    private final String color;

    MarginClassification(String value, String label, String color) {
        this.value = value;
        this.label = label;
        this.color = color;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public String getColor() {
        return color;
    }
}
