package com.codeintel.dto.request;

/**
 * @param drgPayment overrides the reference DRG base payment when positive
 */
public record NtapPaymentRequest(
    Double deviceCost,
    String drgCode,
    Double drgPayment
) {}
