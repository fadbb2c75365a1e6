package com.codeintel.service.eligibility;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.request.NtapEligibilityRequest;
import com.codeintel.dto.request.NtapPaymentRequest;
import com.codeintel.exception.FieldError;
import com.codeintel.model.eligibility.ApprovedTechnology;
import com.codeintel.model.eligibility.ApprovedTechnologyList;
import com.codeintel.model.eligibility.BasePaymentRate;
import com.codeintel.model.eligibility.CriterionResult;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.NtapPaymentResult;
import com.codeintel.model.eligibility.ProgramReferenceData;
import com.codeintel.model.eligibility.TechnologyInfo;
import com.codeintel.model.enums.EligibilityStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * NTAP Eligibility Engine
 *
 * New Technology Add-on Payment for inpatient (IPPS) stays:
 *   NTAP = min(percentage x (deviceCost - drgPayment), maxCap)
 *
 * Criteria, evaluated in order:
 * 1. Newness - FDA approval no older than the configured window
 * 2. Cost Threshold - device cost above DRG payment x multiplier
 * 3. Not in Current Weights - always met, always needs CMS verification
 * 4. Substantial Clinical Improvement - at least one recognised claim
 *
 * Criteria 1 and 2 gate eligibility. Criterion 3 always forces review, so
 * the best reachable status is needs_review unless weights data is added.
 */
@Slf4j
@Service
public class NtapEligibilityService extends EligibilityEngine {

    static final String COST_THRESHOLD = "Cost Threshold";
    static final String NOT_IN_WEIGHTS = "Not in Current Weights";
    static final String CLINICAL_IMPROVEMENT = "Substantial Clinical Improvement";

    public static final List<String> CLINICAL_IMPROVEMENT_CATEGORIES = List.of(
        "Reduced mortality",
        "Reduced complications",
        "Reduced hospital stay",
        "Improved patient outcomes",
        "Reduced readmissions",
        "Treatment for unmet need"
    );

    private final ProgramReferenceDataService referenceData;
    private final EngineProperties.Ntap settings;

    public NtapEligibilityService(ProgramReferenceDataService referenceData, EngineProperties properties, Clock clock) {
        super(clock);
        this.referenceData = referenceData;
        this.settings = properties.getNtap();
    }

    // ========================================================================
    // Payment
    // ========================================================================

    /**
     * @throws com.codeintel.exception.RequestValidationException if the device cost is missing or not positive
     */
    public NtapPaymentResult calculateNtapPayment(NtapPaymentRequest request) {
        List<FieldError> errors = new ArrayList<>();
        requirePositiveCost(request.deviceCost(), errors);
        throwIfInvalid(errors);

        double deviceCost = request.deviceCost();
        double drgPayment = resolvePayment(request.drgPayment(),
            referenceData.getDrgPayment(request.drgCode()).orElse(null));
        double costDifference = deviceCost - drgPayment;

        if (costDifference <= 0) {
            return new NtapPaymentResult(false, deviceCost, request.drgCode(), drgPayment, costDifference,
                null, null, null, 0, null, null, "Device cost does not exceed DRG payment");
        }

        double calculated = costDifference * settings.getPercentage();
        double capped = Math.min(calculated, settings.getMaxCap());
        long ntapPayment = Math.round(capped);
        long total = Math.round(drgPayment + capped);

        return new NtapPaymentResult(
            true,
            deviceCost,
            request.drgCode(),
            drgPayment,
            costDifference,
            settings.getPercentage() * 100,
            Math.round(calculated),
            settings.getMaxCap(),
            ntapPayment,
            total,
            new NtapPaymentResult.Breakdown(drgPayment, ntapPayment, total),
            null
        );
    }

    // ========================================================================
    // Eligibility
    // ========================================================================

    /**
     * @throws com.codeintel.exception.RequestValidationException if the device name or a positive cost is missing
     */
    public EligibilityResult<NtapPaymentResult> checkNtapEligibility(NtapEligibilityRequest request) {
        throwIfInvalid(checkTechnology(request.deviceName(), request.deviceCost()));

        double deviceCost = request.deviceCost();
        double drgPayment = resolvePayment(request.drgPayment(),
            referenceData.getDrgPayment(request.drgCode()).orElse(null));

        List<CriterionResult> criteria = new ArrayList<>();

        CriterionResult newness = newness(
            "FDA approval within qualifying timeframe (2-3 years)",
            yearsSince(request.fdaApprovalDate()),
            settings.getNewnessYears(),
            "within timeframe",
            "may not qualify as \"new\"");
        criteria.add(newness);

        double threshold = drgPayment * settings.getCostThresholdMultiplier();
        boolean exceeds = deviceCost > threshold;
        CriterionResult cost = new CriterionResult(
            COST_THRESHOLD,
            "Device cost exceeds DRG payment threshold",
            exceeds,
            "Device cost (" + usd(deviceCost) + ") " + (exceeds ? "exceeds" : "does not exceed")
                + " threshold (" + usd(threshold) + ")");
        criteria.add(cost);

        criteria.add(new CriterionResult(
            NOT_IN_WEIGHTS,
            "Technology not yet reflected in DRG payment weights",
            true,
            "Requires CMS verification - assumed not in current weights for new FDA approvals"));

        List<String> claims = matchingClaims(request.clinicalImprovements());
        CriterionResult clinical = new CriterionResult(
            CLINICAL_IMPROVEMENT,
            "Demonstrates meaningful clinical benefit over existing treatments",
            !claims.isEmpty(),
            claims.isEmpty()
                ? "No clinical improvement claims provided - documentation required"
                : "Claims: " + String.join(", ", claims));
        criteria.add(clinical);

        boolean gatesMet = newness.met() && cost.met();
        // Not in Current Weights cannot be verified locally
        boolean reviewForced = true;
        EligibilityStatus status = EligibilityStatus.resolve(gatesMet, reviewForced || !clinical.met());

        log.debug("NTAP eligibility for {}: {} ({} of {} criteria met)",
            request.deviceName(), status.getValue(), criteria.stream().filter(CriterionResult::met).count(),
            criteria.size());

        NtapPaymentResult payment = status == EligibilityStatus.NOT_ELIGIBLE
            ? null
            : calculateNtapPayment(new NtapPaymentRequest(deviceCost, request.drgCode(), request.drgPayment()));

        TechnologyInfo technology = new TechnologyInfo(request.deviceName(), request.manufacturer(), deviceCost,
            null, request.fdaApprovalDate(), request.fdaApprovalType());
        return assemble(status, technology, criteria, payment, recommendations(criteria, status));
    }

    /**
     * Claims that match a canonical category, compared case-insensitively as substrings in either direction.
     * Blank claims are ignored.
     */
    static List<String> matchingClaims(List<String> claims) {
        if (claims == null) {
            return List.of();
        }
        List<String> matched = new ArrayList<>();
        for (String claim : claims) {
            if (claim == null || claim.isBlank()) {
                continue;
            }
            String needle = claim.trim().toLowerCase(Locale.ROOT);
            boolean recognised = CLINICAL_IMPROVEMENT_CATEGORIES.stream()
                .map(category -> category.toLowerCase(Locale.ROOT))
                .anyMatch(category -> category.contains(needle) || needle.contains(category));
            if (recognised) {
                matched.add(claim);
            }
        }
        return matched;
    }

    static List<String> recommendations(List<CriterionResult> criteria, EligibilityStatus status) {
        List<String> recommendations = new ArrayList<>();
        for (CriterionResult criterion : criteria) {
            if (criterion.met()) {
                continue;
            }
            switch (criterion.criterion()) {
                case NEWNESS -> recommendations.add(
                    "Consider applying in next fiscal year if technology becomes newly eligible");
                case COST_THRESHOLD -> recommendations.add(
                    "Review device pricing or identify additional costs that may be included");
                case CLINICAL_IMPROVEMENT -> {
                    recommendations.add(
                        "Compile clinical trial data demonstrating improvement over existing treatments");
                    recommendations.add("Document specific clinical benefits (mortality, complications, outcomes)");
                }
                default -> {
                }
            }
        }
        if (status == EligibilityStatus.LIKELY_ELIGIBLE) {
            recommendations.add("Prepare formal NTAP application for CMS submission");
            recommendations.add("Gather supporting clinical documentation and cost data");
        }
        return recommendations;
    }

    // ========================================================================
    // Reference
    // ========================================================================

    public ApprovedTechnologyList getApprovedList() {
        ProgramReferenceData data = referenceData.getNtapData();
        List<ApprovedTechnology> technologies = data.technologies();
        return new ApprovedTechnologyList(data.fiscalYear(), data.lastUpdated(), null, technologies,
            technologies.size());
    }

    public List<BasePaymentRate> getDrgs() {
        return referenceData.getAvailableDrgs();
    }

    public List<String> getClinicalImprovementCategories() {
        return CLINICAL_IMPROVEMENT_CATEGORIES;
    }
}
