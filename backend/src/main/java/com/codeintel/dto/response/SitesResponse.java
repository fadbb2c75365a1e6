package com.codeintel.dto.response;

import com.codeintel.model.reimbursement.ClassificationThreshold;
import com.codeintel.model.reimbursement.SiteInfo;

import java.util.List;
import java.util.Map;

public record SitesResponse(List<SiteInfo> sites, Map<String, ClassificationThreshold> thresholds) {}
