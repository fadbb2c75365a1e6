package com.codeintel.service.eligibility;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

final class EligibilityFixtures {

    static final LocalDate TODAY = LocalDate.of(2025, 6, 1);
    static final LocalDate RECENT_APPROVAL = LocalDate.of(2024, 1, 1);
    static final LocalDate OLD_APPROVAL = LocalDate.of(2019, 1, 1);

    private EligibilityFixtures() {
    }

    static Clock clock() {
        return Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
    }

    static ProgramReferenceDataService referenceData() {
        return new ProgramReferenceDataService(new ObjectMapper());
    }
}
