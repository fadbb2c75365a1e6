package com.codeintel.model.eligibility;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param maxDuration pass-through duration in years; TPT only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovedTechnologyList(
    String fiscalYear,
    String lastUpdated,
    Double maxDuration,
    List<ApprovedTechnology> technologies,
    int totalCount
) {}
