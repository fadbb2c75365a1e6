package com.codeintel.model.eligibility;

/**
 * One DRG or APC with its base payment.
 */
public record BasePaymentRate(String code, long payment) {}
