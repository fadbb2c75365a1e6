package com.codeintel.service.eligibility;

import com.codeintel.exception.ReferenceDataException;
import com.codeintel.model.eligibility.BasePaymentRate;
import com.codeintel.model.eligibility.ProgramReferenceData;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Program Reference Data
 *
 * CMS reference tables for the NTAP and TPT engines, read once from the classpath:
 * - approved technologies per program
 * - DRG base payments (NTAP)
 * - APC base payments (TPT)
 */
@Slf4j
@Service
public class ProgramReferenceDataService {

    static final String NTAP_RESOURCE = "data/ntap_approved.json";
    static final String TPT_RESOURCE = "data/tpt_approved.json";

    private final ProgramReferenceData ntapData;
    private final ProgramReferenceData tptData;

    public ProgramReferenceDataService(ObjectMapper objectMapper) {
        this.ntapData = load(objectMapper, new ClassPathResource(NTAP_RESOURCE));
        this.tptData = load(objectMapper, new ClassPathResource(TPT_RESOURCE));
    }

    private static ProgramReferenceData load(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            ProgramReferenceData data = objectMapper.readValue(in, ProgramReferenceData.class);
            log.info("Loaded {}: FY {} ({} technologies, {} base payments)",
                resource.getDescription(), data.fiscalYear(), data.technologies().size(), data.basePayments().size());
            return data;
        } catch (IOException e) {
            throw new ReferenceDataException("Cannot read program reference data from " + resource.getDescription(), e);
        }
    }

    // ========================================================================
    // NTAP
    // ========================================================================

    public Optional<Long> getDrgPayment(String drgCode) {
        return drgCode == null ? Optional.empty() : Optional.ofNullable(ntapData.basePayments().get(drgCode));
    }

    public List<BasePaymentRate> getAvailableDrgs() {
        return toRates(ntapData);
    }

    public ProgramReferenceData getNtapData() {
        return ntapData;
    }

    // ========================================================================
    // TPT
    // ========================================================================

    public Optional<Long> getApcPayment(String apcCode) {
        return apcCode == null ? Optional.empty() : Optional.ofNullable(tptData.basePayments().get(apcCode));
    }

    public List<BasePaymentRate> getAvailableApcs() {
        return toRates(tptData);
    }

    public ProgramReferenceData getTptData() {
        return tptData;
    }

    private static List<BasePaymentRate> toRates(ProgramReferenceData data) {
        return data.basePayments().entrySet().stream()
            .map(entry -> new BasePaymentRate(entry.getKey(), entry.getValue()))
            .toList();
    }
}
