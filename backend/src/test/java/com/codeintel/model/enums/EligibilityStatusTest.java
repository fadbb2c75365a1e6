package com.codeintel.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EligibilityStatusTest {

    @Test
    void resolve_shouldRankGatesBeforeReview() {
        assertEquals(EligibilityStatus.NOT_ELIGIBLE, EligibilityStatus.resolve(false, false));
        assertEquals(EligibilityStatus.NOT_ELIGIBLE, EligibilityStatus.resolve(false, true));
        assertEquals(EligibilityStatus.NEEDS_REVIEW, EligibilityStatus.resolve(true, true));
        assertEquals(EligibilityStatus.LIKELY_ELIGIBLE, EligibilityStatus.resolve(true, false));
    }
}
