package com.codeintel.model.reimbursement;

import com.codeintel.model.enums.MarginClassification;

/**
 * Financial outcome of billing one code at one site of service.
 *
 * @param siteOfService    display name of the site
 * @param siteKey          canonical site key (IPPS, HOPD, ASC, OBL)
 * @param marginPercentage margin / total payment x 100 with one decimal; "0.0" when total payment is zero
 */
public record ScenarioResult(
    String code,
    String description,
    String siteOfService,
    String siteKey,
    long basePayment,
    double addOnPayment,
    double totalPayment,
    double deviceCost,
    double margin,
    String marginPercentage,
    MarginClassification classification,
    ScenarioBreakdown breakdown,
    ScenarioCodeDetails codeDetails
) {}
