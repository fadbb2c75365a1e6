package com.codeintel.model.reimbursement;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One labelled line of a scenario breakdown. Carries either a source or a formula.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreakdownItem(String label, double value, String source, String formula) {

    public static BreakdownItem sourced(String label, double value, String source) {
        return new BreakdownItem(label, value, source, null);
    }

    public static BreakdownItem derived(String label, double value, String formula) {
        return new BreakdownItem(label, value, null, formula);
    }
}
