package com.codeintel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall outcome of an NTAP or TPT eligibility check.
 */
public enum EligibilityStatus {
    LIKELY_ELIGIBLE("likely_eligible", "Likely Eligible"),
    NEEDS_REVIEW("needs_review", "Needs Review"),
    NOT_ELIGIBLE("not_eligible", "Not Eligible");

    private final String value;
    private final String label;

    EligibilityStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Shared status rule for both programs.
     *
     * @param gatesMet     every gating criterion (newness, cost / category) is met
     * @param reviewForced some criterion requires manual CMS verification
     */
    public static EligibilityStatus resolve(boolean gatesMet, boolean reviewForced) {
        if (!gatesMet) {
            return NOT_ELIGIBLE;
        }
        return reviewForced ? NEEDS_REVIEW : LIKELY_ELIGIBLE;
    }
}
