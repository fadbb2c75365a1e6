package com.codeintel.dto.request;

/**
 * @param apcPayment overrides the reference APC base payment when positive
 */
public record TptPaymentRequest(
    Double deviceCost,
    String apcCode,
    Double apcPayment
) {}
