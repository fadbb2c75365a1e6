package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.code.RawCodeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-site payment estimation.
 */
class PaymentDeriverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PaymentDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new PaymentDeriver(new EngineProperties());
    }

    private CodeRecord record(String code, String type, String metadataJson) throws Exception {
        return CodeRecord.fromRaw(new RawCodeRecord(code, "test", type, List.of(), objectMapper.readTree(metadataJson)));
    }

    @Test
    void derive_withKnownApc_shouldUseApcRateForHopd() throws Exception {
        CodeRecord record = record("36903", "CPT",
            "{\"CPT\": {\"FACILITY_RVU\": 8.2, \"NONFACILITY_RVU\": 135.7, \"APC\": 5193}}");

        PaymentSet payments = deriver.derive(record);

        assertEquals(11639, payments.hopd());
        assertEquals(7565, payments.asc());
        assertEquals(17459, payments.ipps());
        assertEquals(4599, payments.obl());
    }

    @Test
    void derive_withUnknownApc_shouldEstimateHopdFromFacilityRvu() throws Exception {
        CodeRecord record = record("33208", "CPT",
            "{\"CPT\": {\"FACILITY_RVU\": \"13.64\", \"NONFACILITY_RVU\": 13.64, \"APC\": \"5223\"}}");

        PaymentSet payments = deriver.derive(record);

        assertEquals(16179, payments.hopd());
        assertEquals(10516, payments.asc());
        assertEquals(24269, payments.ipps());
        assertEquals(462, payments.obl());
    }

    @Test
    void derive_withRvusOnly_shouldRoundHalfUp() throws Exception {
        CodeRecord record = record("99213", "CPT", "{\"CPT\": {\"FACILITY_RVU\": 1.92, \"NONFACILITY_RVU\": 2.68}}");

        PaymentSet payments = deriver.derive(record);

        assertEquals(2277, payments.hopd());
        assertEquals(1480, payments.asc());
        // 2277 x 1.5 = 3415.5
        assertEquals(3416, payments.ipps());
        assertEquals(91, payments.obl());
    }

    @Test
    void derive_hcpcsWithApcOnly_shouldLeaveOblZero() throws Exception {
        CodeRecord record = record("C1831", "HCPCS", "{\"HCPCS\": {\"APC\": 5054}}");

        PaymentSet payments = deriver.derive(record);

        assertEquals(2850, payments.hopd());
        assertEquals(1853, payments.asc());
        assertEquals(4275, payments.ipps());
        assertEquals(0, payments.obl());
    }

    @Test
    void derive_withoutRateData_shouldBeZero() throws Exception {
        assertEquals(PaymentSet.ZERO, deriver.derive(record("99214", "CPT", "{}")));
        assertEquals(PaymentSet.ZERO, deriver.derive(record("99215", "CPT", "{\"CPT\": {\"FACILITY_RVU\": -1}}")));
    }

    @Test
    void derive_nonPayableTypes_shouldAlwaysBeZero() throws Exception {
        String rates = "{\"DX\": {\"FACILITY_RVU\": 5, \"APC\": 5193}}";

        assertEquals(PaymentSet.ZERO, deriver.derive(record("I25.10", "DX", rates)));
        assertEquals(PaymentSet.ZERO, deriver.derive(record("02H63JZ", "PCS", rates)));
        assertEquals(PaymentSet.ZERO, deriver.derive(record("X1", null, rates)));
    }

    @Test
    void derive_shouldFollowConfiguredConversionFactors() throws Exception {
        EngineProperties properties = new EngineProperties();
        properties.getCms().setNonFacilityConversionFactor(10);
        properties.getCms().setIppsMultiplier(2.0);
        PaymentDeriver custom = new PaymentDeriver(properties);

        PaymentSet payments = custom.derive(record("36903", "CPT",
            "{\"CPT\": {\"NONFACILITY_RVU\": 3.5, \"APC\": 5193}}"));

        assertEquals(35, payments.obl());
        assertEquals(23278, payments.ipps());
    }

    @Test
    void derive_shouldPreferRawTypeBlockOverOthers() throws Exception {
        CodeRecord record = record("C9999", "HCPCS",
            "{\"CPT\": {\"APC\": 5193}, \"HCPCS\": {\"APC\": 5054}}");

        assertEquals(2850, deriver.derive(record).hopd());
    }
}
