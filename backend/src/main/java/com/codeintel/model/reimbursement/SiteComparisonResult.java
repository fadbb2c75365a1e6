package com.codeintel.model.reimbursement;

import java.util.List;

/**
 * Every site of service for one code, best margin first.
 */
public record SiteComparisonResult(
    String code,
    String description,
    double deviceCost,
    double ntapAddOn,
    List<SiteComparison> comparisons,
    SiteComparison bestSite,
    SiteComparison worstSite
) {}
