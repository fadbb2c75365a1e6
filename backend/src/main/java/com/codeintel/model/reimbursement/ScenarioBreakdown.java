package com.codeintel.model.reimbursement;

public record ScenarioBreakdown(
    BreakdownItem basePayment,
    BreakdownItem addOnPayment,
    BreakdownItem totalPayment,
    BreakdownItem deviceCost,
    BreakdownItem margin
) {}
