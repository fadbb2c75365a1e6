package com.codeintel.model.reimbursement;

import com.codeintel.model.enums.MarginClassification;

public record SiteComparison(
    String site,
    String siteKey,
    long basePayment,
    double totalPayment,
    double margin,
    String marginPercentage,
    MarginClassification classification
) {

    public static SiteComparison of(ScenarioResult result) {
        return new SiteComparison(
            result.siteOfService(),
            result.siteKey(),
            result.basePayment(),
            result.totalPayment(),
            result.margin(),
            result.marginPercentage(),
            result.classification()
        );
    }
}
