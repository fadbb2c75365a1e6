package com.codeintel.dto.request;

/**
 * Request DTO for a single-site reimbursement scenario.
 * Fields are boxed so that missing values can be reported individually.
 */
public record ScenarioRequest(
    String code,
    String siteOfService,
    Double deviceCost,
    Double ntapAddOn
) {}
