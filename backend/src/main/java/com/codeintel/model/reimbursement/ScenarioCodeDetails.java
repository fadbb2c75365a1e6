package com.codeintel.model.reimbursement;

import com.codeintel.model.code.PaymentSet;

/**
 * Code context echoed with a scenario so callers can see the other sites' payments.
 */
public record ScenarioCodeDetails(String type, String category, PaymentSet allPayments, String apc) {}
