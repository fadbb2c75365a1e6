package com.codeintel.model.eligibility;

import com.codeintel.model.enums.EligibilityStatus;

import java.util.List;

/**
 * Outcome of an NTAP or TPT eligibility check.
 *
 * @param eligibilityCriteria criteria in evaluation order
 * @param potentialPayment    null when the status is not_eligible
 * @param <P>                 program specific payment calculation
 */
public record EligibilityResult<P>(
    EligibilityStatus status,
    String statusLabel,
    TechnologyInfo technology,
    List<CriterionResult> eligibilityCriteria,
    int criteriaMetCount,
    int totalCriteria,
    P potentialPayment,
    List<String> recommendations
) {}
