package com.codeintel.model.eligibility;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of ntap_approved.json or tpt_approved.json.
 *
 * @param basePayments DRG base payments for NTAP, APC base payments for TPT, keyed by code
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgramReferenceData(
    String fiscalYear,
    String lastUpdated,
    List<ApprovedTechnology> technologies,
    @JsonAlias({"drgBasePayments", "apcBasePayments"})
    Map<String, Long> basePayments
) {

    public ProgramReferenceData {
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
        basePayments = basePayments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(basePayments));
    }
}
