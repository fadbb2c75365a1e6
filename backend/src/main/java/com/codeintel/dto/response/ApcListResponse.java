package com.codeintel.dto.response;

import com.codeintel.model.eligibility.BasePaymentRate;

import java.util.List;

public record ApcListResponse(List<BasePaymentRate> apcs) {}
