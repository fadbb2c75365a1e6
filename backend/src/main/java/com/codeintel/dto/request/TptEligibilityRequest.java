package com.codeintel.dto.request;

import java.time.LocalDate;

/**
 * Request DTO for a TPT eligibility check.
 *
 * @param category device, drug or biological; defaults to device
 */
public record TptEligibilityRequest(
    String deviceName,
    String manufacturer,
    Double deviceCost,
    String apcCode,
    Double apcPayment,
    LocalDate fdaApprovalDate,
    String fdaApprovalType,
    String category
) {}
