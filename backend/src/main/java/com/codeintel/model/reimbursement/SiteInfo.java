package com.codeintel.model.reimbursement;

import com.codeintel.model.enums.SiteOfService;

public record SiteInfo(String key, String name, String description) {

    public static SiteInfo of(SiteOfService site) {
        return new SiteInfo(site.getKey(), site.getDisplayName(), site.getDescription());
    }
}
