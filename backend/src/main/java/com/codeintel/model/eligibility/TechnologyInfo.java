package com.codeintel.model.eligibility;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;

/**
 * Echo of the technology an eligibility check was run for.
 *
 * @param category TPT only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TechnologyInfo(
    String name,
    String manufacturer,
    double deviceCost,
    String category,
    LocalDate fdaApprovalDate,
    String fdaApprovalType
) {}
