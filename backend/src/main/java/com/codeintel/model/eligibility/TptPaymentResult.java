package com.codeintel.model.eligibility;

/**
 * Transitional pass-through calculation.
 *
 * @param packagedAmount share of the APC payment assumed to already cover the device
 */
public record TptPaymentResult(
    double deviceCost,
    String apcCode,
    double apcPayment,
    long packagedAmount,
    long passThroughPayment,
    long totalReimbursement,
    Breakdown breakdown
) {

    public record Breakdown(double baseApcPayment, long devicePassThrough, long total) {}
}
