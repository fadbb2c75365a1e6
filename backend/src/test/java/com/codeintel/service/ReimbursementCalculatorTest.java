package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.mapper.CodeMapper;
import com.codeintel.dto.request.ScenarioRequest;
import com.codeintel.exception.CodeNotFoundException;
import com.codeintel.exception.FieldError;
import com.codeintel.exception.RequestValidationException;
import com.codeintel.model.enums.MarginClassification;
import com.codeintel.model.reimbursement.ClassificationThreshold;
import com.codeintel.model.reimbursement.ScenarioResult;
import com.codeintel.model.reimbursement.SiteComparison;
import com.codeintel.model.reimbursement.SiteComparisonResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReimbursementCalculator. Fixture code C9600 pays exactly 10000 at HOPD,
 * 15000 at IPPS, 6500 at ASC and nothing at OBL.
 */
class ReimbursementCalculatorTest {

    private ReimbursementCalculator calculator;

    @BeforeEach
    void setUp() {
        EngineProperties properties = CodeFixtures.properties();
        CodeIndex index = CodeFixtures.loadedIndex(properties);
        CodeIntelligenceService codeService = new CodeIntelligenceService(index, new CodeSearchService(index),
            new CodeMapper(), properties, new DefaultResourceLoader(), new ObjectMapper());
        calculator = new ReimbursementCalculator(codeService, index, properties);
    }

    private ScenarioResult hopd(double deviceCost) {
        return calculator.calculateScenario(new ScenarioRequest("C9600", "HOPD", deviceCost, null));
    }

    // ========================================================================
    // Single scenario
    // ========================================================================

    @Test
    void calculateScenario_withLowDeviceCost_shouldBeProfitable() {
        // When
        ScenarioResult result = hopd(5000);

        // Then
        assertEquals("C9600", result.code());
        assertEquals("HOPD", result.siteKey());
        assertEquals("Hospital Outpatient (OPPS)", result.siteOfService());
        assertEquals(10000, result.basePayment());
        assertEquals(10000.0, result.totalPayment());
        assertEquals(5000.0, result.margin());
        assertEquals("50.0", result.marginPercentage());
        assertEquals(MarginClassification.PROFITABLE, result.classification());
        assertEquals("HCPCS", result.codeDetails().type());
        assertEquals(CodeFixtures.TEST_APC, result.codeDetails().apc());
    }

    @Test
    void calculateScenario_shouldAddNtapToTotal() {
        ScenarioResult result = calculator.calculateScenario(new ScenarioRequest("C9600", "HOPD", 12000.0, 3000.0));

        assertEquals(3000.0, result.addOnPayment());
        assertEquals(13000.0, result.totalPayment());
        assertEquals(1000.0, result.margin());
        assertEquals("7.7", result.marginPercentage());
        assertEquals(MarginClassification.BREAK_EVEN, result.classification());
        assertEquals("New Technology Add-on Payment", result.breakdown().addOnPayment().source());
        assertEquals("Total Payment - Device Cost", result.breakdown().margin().formula());
    }

    @Test
    void calculateScenario_withoutAddOn_shouldMarkItNotApplied() {
        ScenarioResult result = hopd(5000);

        assertEquals(0.0, result.addOnPayment());
        assertEquals("Not applied", result.breakdown().addOnPayment().source());
        assertEquals("C9600 @ Hospital Outpatient (OPPS)", result.breakdown().basePayment().source());
    }

    @Test
    void calculateScenario_classificationBoundaries_shouldBeInclusive() {
        assertEquals(MarginClassification.PROFITABLE, hopd(9000).classification());
        assertEquals(MarginClassification.BREAK_EVEN, hopd(9001).classification());
        assertEquals(MarginClassification.BREAK_EVEN, hopd(10500).classification());
        assertEquals(MarginClassification.LOSS, hopd(10501).classification());
    }

    @Test
    void calculateScenario_withSiteAlias_shouldResolveSite() {
        ScenarioResult result = calculator.calculateScenario(
            new ScenarioRequest("c9600", "hospital_outpatient", 0.0, null));

        assertEquals("HOPD", result.siteKey());
        assertEquals(10000, result.basePayment());
    }

    @Test
    void calculateScenario_withZeroPayment_shouldUseZeroPercentage() {
        ScenarioResult free = calculator.calculateScenario(new ScenarioRequest("99214", "OBL", 0.0, null));
        ScenarioResult costly = calculator.calculateScenario(new ScenarioRequest("99214", "OBL", 100.0, null));

        assertEquals("0.0", free.marginPercentage());
        assertEquals(MarginClassification.BREAK_EVEN, free.classification());
        assertEquals("0.0", costly.marginPercentage());
        assertEquals(MarginClassification.LOSS, costly.classification());
    }

    @Test
    void calculateScenario_marginShouldNotIncreaseWithDeviceCost() {
        double previous = Double.MAX_VALUE;
        for (double cost = 0; cost <= 20000; cost += 2500) {
            double margin = hopd(cost).margin();
            assertTrue(margin <= previous);
            previous = margin;
        }
    }

    @Test
    void calculateScenario_withMissingFields_shouldReportEachOne() {
        // When
        RequestValidationException ex = assertThrows(RequestValidationException.class,
            () -> calculator.calculateScenario(new ScenarioRequest(null, " ", null, -1.0)));

        // Then
        assertEquals(List.of("Code is required", "Site of service is required", "Device cost is required",
                "NTAP add-on must be a non-negative number"),
            ex.getErrors().stream().map(FieldError::message).toList());
    }

    @Test
    void calculateScenario_withInvalidSiteAndNegativeCost_shouldReportBoth() {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
            () -> calculator.calculateScenario(new ScenarioRequest("C9600", "MOON", -5.0, null)));

        assertEquals(List.of("Invalid site of service: MOON (valid: IPPS, HOPD, ASC, OBL)",
                "Device cost must be a non-negative number"),
            ex.getErrors().stream().map(FieldError::message).toList());
    }

    @Test
    void calculateScenario_withUnknownCode_shouldThrowNotFound() {
        assertThrows(CodeNotFoundException.class,
            () -> calculator.calculateScenario(new ScenarioRequest("00000", "HOPD", 10.0, null)));
    }

    // ========================================================================
    // Site comparison
    // ========================================================================

    @Test
    void compareAllSites_shouldOrderByMarginDescending() {
        // When
        SiteComparisonResult result = calculator.compareAllSites("C9600", 5000.0, null);

        // Then
        assertEquals(List.of("IPPS", "HOPD", "ASC", "OBL"),
            result.comparisons().stream().map(SiteComparison::siteKey).toList());
        assertEquals(List.of(10000.0, 5000.0, 1500.0, -5000.0),
            result.comparisons().stream().map(SiteComparison::margin).toList());
        assertEquals("IPPS", result.bestSite().siteKey());
        assertEquals("OBL", result.worstSite().siteKey());
        assertEquals(0.0, result.ntapAddOn());
        assertEquals(MarginClassification.LOSS, result.worstSite().classification());
    }

    @Test
    void compareAllSites_withEqualMargins_shouldKeepSiteOrder() {
        SiteComparisonResult result = calculator.compareAllSites("99214", 0.0, 0.0);

        assertEquals(List.of("IPPS", "HOPD", "ASC", "OBL"),
            result.comparisons().stream().map(SiteComparison::siteKey).toList());
        assertEquals("IPPS", result.bestSite().siteKey());
        assertEquals("OBL", result.worstSite().siteKey());
    }

    @Test
    void compareAllSites_withUnknownCode_shouldThrowNotFound() {
        assertThrows(CodeNotFoundException.class, () -> calculator.compareAllSites("00000", 0.0, null));
    }

    // ========================================================================
    // Reference data
    // ========================================================================

    @Test
    void getThresholds_shouldDescribeConfiguredBoundaries() {
        Map<String, ClassificationThreshold> thresholds = calculator.getThresholds();

        assertEquals(List.of("profitable", "break-even", "loss"), List.copyOf(thresholds.keySet()));
        assertEquals("Margin >= 10% of Total Payment", thresholds.get("profitable").condition());
        assertEquals("Margin between -5% and 10%", thresholds.get("break-even").condition());
        assertEquals("Margin < -5% of Total Payment", thresholds.get("loss").condition());
        assertEquals("green", thresholds.get("profitable").color());
    }

    @Test
    void getValidSites_shouldListFourSites() {
        assertEquals(List.of("IPPS", "HOPD", "ASC", "OBL"),
            calculator.getValidSites().stream().map(site -> site.key()).toList());
    }

    @Test
    void classify_shouldDependOnlyOnRatio() {
        assertEquals(calculator.classify(500, 10_000), calculator.classify(5, 100));
        assertEquals(calculator.classify(-2_000, 10_000), calculator.classify(-20, 100));
        assertEquals(MarginClassification.LOSS, calculator.classify(-20, 100));
    }

    @Test
    void marginPercentage_shouldRoundToOneDecimal() {
        assertEquals("33.3", ReimbursementCalculator.marginPercentage(1, 3));
        assertEquals("-5.0", ReimbursementCalculator.marginPercentage(-500, 10000));
    }
}
