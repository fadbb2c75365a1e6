package com.codeintel.dto.request;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for an NTAP eligibility check.
 */
public record NtapEligibilityRequest(
    String deviceName,
    String manufacturer,
    Double deviceCost,
    String drgCode,
    Double drgPayment,
    LocalDate fdaApprovalDate,
    String fdaApprovalType,
    List<String> clinicalImprovements
) {}
