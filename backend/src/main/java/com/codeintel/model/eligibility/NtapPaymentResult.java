package com.codeintel.model.eligibility;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * NTAP add-on calculation. When the device cost does not exceed the DRG payment only
 * {@code eligible}, the inputs, {@code costDifference}, {@code ntapPayment} (0) and {@code reason} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NtapPaymentResult(
    boolean eligible,
    double deviceCost,
    String drgCode,
    double drgPayment,
    double costDifference,
    Double ntapPercentage,
    Long calculatedNtap,
    Long maxCap,
    long ntapPayment,
    Long totalReimbursement,
    Breakdown breakdown,
    String reason
) {

    public record Breakdown(double baseDrgPayment, long ntapAddOn, long total) {}
}
