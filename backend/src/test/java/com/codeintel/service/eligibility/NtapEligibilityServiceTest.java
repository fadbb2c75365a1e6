package com.codeintel.service.eligibility;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.request.NtapEligibilityRequest;
import com.codeintel.dto.request.NtapPaymentRequest;
import com.codeintel.exception.FieldError;
import com.codeintel.exception.RequestValidationException;
import com.codeintel.model.eligibility.ApprovedTechnologyList;
import com.codeintel.model.eligibility.CriterionResult;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.NtapPaymentResult;
import com.codeintel.model.enums.EligibilityStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NtapEligibilityService against the bundled FY2025 reference data.
 */
class NtapEligibilityServiceTest {

    private NtapEligibilityService service;

    @BeforeEach
    void setUp() {
        service = new NtapEligibilityService(EligibilityFixtures.referenceData(), new EngineProperties(),
            EligibilityFixtures.clock());
    }

    private NtapEligibilityRequest request(double deviceCost, LocalDate approval, List<String> claims) {
        return new NtapEligibilityRequest("Leadless Pacer", "Acme Medical", deviceCost, "460", null,
            approval, "PMA", claims);
    }

    // ========================================================================
    // Payment
    // ========================================================================

    @Test
    void calculateNtapPayment_costAboveDrg_shouldPaySixtyFivePercentOfDifference() {
        // When
        NtapPaymentResult result = service.calculateNtapPayment(new NtapPaymentRequest(100_000.0, null, 40_000.0));

        // Then
        assertTrue(result.eligible());
        assertEquals(60_000.0, result.costDifference());
        assertEquals(Double.valueOf(65.0), result.ntapPercentage());
        assertEquals(Long.valueOf(39_000L), result.calculatedNtap());
        assertEquals(39_000L, result.ntapPayment());
        assertEquals(Long.valueOf(79_000L), result.totalReimbursement());
        assertEquals(39_000L, result.breakdown().ntapAddOn());
        assertNull(result.reason());
    }

    @Test
    void calculateNtapPayment_largeDifference_shouldApplyCap() {
        NtapPaymentResult result = service.calculateNtapPayment(new NtapPaymentRequest(500_000.0, null, 40_000.0));

        assertEquals(Long.valueOf(299_000L), result.calculatedNtap());
        assertEquals(150_000L, result.ntapPayment());
        assertEquals(Long.valueOf(150_000L), result.maxCap());
        assertEquals(Long.valueOf(190_000L), result.totalReimbursement());
    }

    @Test
    void calculateNtapPayment_costBelowReferenceDrg_shouldNotBeEligible() {
        // Given DRG 216 pays 45000 in the reference data
        NtapPaymentRequest request = new NtapPaymentRequest(32_500.0, "216", null);

        // When
        NtapPaymentResult result = service.calculateNtapPayment(request);

        // Then
        assertFalse(result.eligible());
        assertEquals(45_000.0, result.drgPayment());
        assertEquals(-12_500.0, result.costDifference());
        assertEquals(0L, result.ntapPayment());
        assertEquals("Device cost does not exceed DRG payment", result.reason());
        assertNull(result.breakdown());
    }

    @Test
    void calculateNtapPayment_suppliedPayment_shouldOverrideReference() {
        NtapPaymentResult result = service.calculateNtapPayment(new NtapPaymentRequest(50_000.0, "216", 30_000.0));

        assertEquals(30_000.0, result.drgPayment());
        assertEquals(13_000L, result.ntapPayment());
    }

    @Test
    void calculateNtapPayment_unknownDrgAndNoPayment_shouldUseZero() {
        NtapPaymentResult result = service.calculateNtapPayment(new NtapPaymentRequest(1_000.0, "999", null));

        assertEquals(0.0, result.drgPayment());
        assertEquals(650L, result.ntapPayment());
    }

    @Test
    void calculateNtapPayment_nonPositiveCost_shouldFailValidation() {
        assertThrows(RequestValidationException.class,
            () -> service.calculateNtapPayment(new NtapPaymentRequest(0.0, "216", null)));
        assertThrows(RequestValidationException.class,
            () -> service.calculateNtapPayment(new NtapPaymentRequest(null, "216", null)));
    }

    // ========================================================================
    // Eligibility
    // ========================================================================

    @Test
    void checkNtapEligibility_allCriteriaMet_shouldNeedReview() {
        // When
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(100_000, EligibilityFixtures.RECENT_APPROVAL, List.of("reduced mortality")));

        // Then
        assertEquals(EligibilityStatus.NEEDS_REVIEW, result.status());
        assertEquals("Needs Review", result.statusLabel());
        assertEquals(4, result.criteriaMetCount());
        assertEquals(4, result.totalCriteria());
        assertEquals(39_000L, result.potentialPayment().ntapPayment());
        assertTrue(result.recommendations().isEmpty());
        assertEquals("Leadless Pacer", result.technology().name());
    }

    @Test
    void checkNtapEligibility_shouldReportCriteriaInOrder() {
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(100_000, EligibilityFixtures.RECENT_APPROVAL, List.of("Reduced mortality")));

        List<CriterionResult> criteria = result.eligibilityCriteria();
        assertEquals(List.of("Newness", "Cost Threshold", "Not in Current Weights",
                "Substantial Clinical Improvement"),
            criteria.stream().map(CriterionResult::criterion).toList());
        assertEquals("Approved 1.4 years ago - within timeframe", criteria.get(0).details());
        assertEquals("Device cost ($100,000) exceeds threshold ($40,000)", criteria.get(1).details());
        assertEquals("Claims: Reduced mortality", criteria.get(3).details());
    }

    @Test
    void checkNtapEligibility_withoutClinicalClaims_shouldNeedReviewWithGuidance() {
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(100_000, EligibilityFixtures.RECENT_APPROVAL, List.of("faster setup")));

        assertEquals(EligibilityStatus.NEEDS_REVIEW, result.status());
        assertEquals(3, result.criteriaMetCount());
        assertEquals(List.of(
                "Compile clinical trial data demonstrating improvement over existing treatments",
                "Document specific clinical benefits (mortality, complications, outcomes)"),
            result.recommendations());
        assertNotNull(result.potentialPayment());
    }

    @Test
    void checkNtapEligibility_oldApproval_shouldNotBeEligible() {
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(100_000, EligibilityFixtures.OLD_APPROVAL, List.of("reduced mortality")));

        assertEquals(EligibilityStatus.NOT_ELIGIBLE, result.status());
        assertNull(result.potentialPayment());
        assertFalse(result.eligibilityCriteria().get(0).met());
        assertTrue(result.eligibilityCriteria().get(0).details().endsWith("may not qualify as \"new\""));
        assertEquals(List.of("Consider applying in next fiscal year if technology becomes newly eligible"),
            result.recommendations());
    }

    @Test
    void checkNtapEligibility_withoutApprovalDate_shouldFailNewness() {
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(100_000, null, List.of("reduced mortality")));

        CriterionResult newness = result.eligibilityCriteria().get(0);
        assertFalse(newness.met());
        assertEquals("FDA approval date not provided - newness cannot be established", newness.details());
        assertEquals(EligibilityStatus.NOT_ELIGIBLE, result.status());
    }

    @Test
    void checkNtapEligibility_costBelowDrg_shouldNotBeEligible() {
        EligibilityResult<NtapPaymentResult> result = service.checkNtapEligibility(
            request(30_000, EligibilityFixtures.RECENT_APPROVAL, List.of("reduced mortality")));

        assertEquals(EligibilityStatus.NOT_ELIGIBLE, result.status());
        assertEquals("Device cost ($30,000) does not exceed threshold ($40,000)",
            result.eligibilityCriteria().get(1).details());
        assertTrue(result.recommendations()
            .contains("Review device pricing or identify additional costs that may be included"));
    }

    @Test
    void checkNtapEligibility_missingNameAndCost_shouldReportBoth() {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
            () -> service.checkNtapEligibility(new NtapEligibilityRequest(" ", null, -1.0, "460", null,
                null, null, null)));

        assertEquals(List.of("deviceName", "deviceCost"), ex.getErrors().stream().map(FieldError::field).toList());
    }

    // ========================================================================
    // Claims and reference data
    // ========================================================================

    @Test
    void matchingClaims_shouldMatchSubstringsEitherWay() {
        List<String> matched = NtapEligibilityService.matchingClaims(
            List.of("mortality", "Reduced complications after surgery", "better branding", " "));

        assertEquals(List.of("mortality", "Reduced complications after surgery"), matched);
        assertTrue(NtapEligibilityService.matchingClaims(null).isEmpty());
    }

    @Test
    void getApprovedList_shouldCountTechnologies() {
        ApprovedTechnologyList list = service.getApprovedList();

        assertEquals("FY2025", list.fiscalYear());
        assertEquals(4, list.totalCount());
        assertNull(list.maxDuration());
    }

    @Test
    void getClinicalImprovementCategories_shouldListSixCategories() {
        assertEquals(6, service.getClinicalImprovementCategories().size());
    }
}
