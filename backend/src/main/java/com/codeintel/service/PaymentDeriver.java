package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.code.RateMetadata;
import org.springframework.stereotype.Component;

/**
 * Payment Deriver
 *
 * Estimates what each site of service pays for a CPT/HCPCS code from its RVUs and APC:
 * - OBL:  non-facility RVU x non-facility conversion factor
 * - HOPD: APC rate when the APC is known, else facility RVU x facility CF x 35
 * - ASC:  65% of HOPD, else facility RVU x 50 x 20
 * - IPPS: HOPD x IPPS multiplier, else facility RVU x facility CF x 50
 *
 * This is an estimation scheme, not an authoritative CMS fee lookup.
 * Every other code system derives all-zero payments.
 */
@Component
public class PaymentDeriver {

    static final int HOPD_RVU_SCALE = 35;
    static final double ASC_SHARE_OF_HOPD = 0.65;
    static final int ASC_RVU_RATE = 50 * 20;
    static final int IPPS_RVU_SCALE = 50;

    private final EngineProperties.Cms cms;

    public PaymentDeriver(EngineProperties properties) {
        this.cms = properties.getCms();
    }

    public PaymentSet derive(CodeRecord record) {
        if (!record.type().isPayable()) {
            return PaymentSet.ZERO;
        }
        RateMetadata rates = record.rateMetadata();
        double facilityRvu = rates.facilityRvu();
        double nonFacilityRvu = rates.nonFacilityRvu();

        long obl = nonFacilityRvu > 0
            ? Math.round(nonFacilityRvu * cms.getNonFacilityConversionFactor())
            : 0;

        // HOPD first: ASC and IPPS derive from it
        long hopd = 0;
        Long apcRate = rates.apc() != null ? cms.getApcRates().get(rates.apc()) : null;
        if (apcRate != null) {
            hopd = apcRate;
        } else if (facilityRvu > 0) {
            hopd = Math.round(facilityRvu * cms.getFacilityConversionFactor() * HOPD_RVU_SCALE);
        }

        long asc = 0;
        if (hopd > 0) {
            asc = Math.round(hopd * ASC_SHARE_OF_HOPD);
        } else if (facilityRvu > 0) {
            asc = Math.round(facilityRvu * ASC_RVU_RATE);
        }

        long ipps = 0;
        if (hopd > 0) {
            ipps = Math.round(hopd * cms.getIppsMultiplier());
        } else if (facilityRvu > 0) {
            ipps = Math.round(facilityRvu * cms.getFacilityConversionFactor() * IPPS_RVU_SCALE);
        }

        return new PaymentSet(Math.max(0, ipps), Math.max(0, hopd), Math.max(0, asc), Math.max(0, obl));
    }
}
