package com.codeintel.model.eligibility;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A technology CMS has already granted NTAP or pass-through status.
 * NTAP entries carry DRG codes and a maximum add-on; TPT entries carry an APC, HCPCS code and category.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApprovedTechnology(
    String name,
    String manufacturer,
    String description,
    Double deviceCost,
    Long maxNtapPayment,
    Long passThroughPayment,
    List<String> drgCodes,
    String apcCode,
    String hcpcsCode,
    String category,
    String fdaApprovalDate,
    String effectiveDate,
    String expirationDate
) {}
