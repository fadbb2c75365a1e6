package com.codeintel.model.code;

import com.codeintel.model.enums.SiteOfService;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimated whole-dollar payment per site of service.
 * Zero means "not applicable or unknown", never "free".
 */
public record PaymentSet(long ipps, long hopd, long asc, long obl) {

    public static final PaymentSet ZERO = new PaymentSet(0, 0, 0, 0);

    public PaymentSet {
        if (ipps < 0 || hopd < 0 || asc < 0 || obl < 0) {
            throw new IllegalArgumentException("Payments must be non-negative");
        }
    }

    public long forSite(SiteOfService site) {
        return switch (site) {
            case IPPS -> ipps;
            case HOPD -> hopd;
            case ASC -> asc;
            case OBL -> obl;
        };
    }

    /**
     * Serialized as {"IPPS": .., "HOPD": .., "ASC": .., "OBL": ..}.
     */
    @JsonValue
    public Map<String, Long> asMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        for (SiteOfService site : SiteOfService.values()) {
            map.put(site.getKey(), forSite(site));
        }
        return Collections.unmodifiableMap(map);
    }
}
