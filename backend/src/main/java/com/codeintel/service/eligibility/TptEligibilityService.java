package com.codeintel.service.eligibility;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.request.TptEligibilityRequest;
import com.codeintel.dto.request.TptPaymentRequest;
import com.codeintel.exception.FieldError;
import com.codeintel.model.eligibility.ApprovedTechnology;
import com.codeintel.model.eligibility.ApprovedTechnologyList;
import com.codeintel.model.eligibility.BasePaymentRate;
import com.codeintel.model.eligibility.CriterionResult;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.ProgramReferenceData;
import com.codeintel.model.eligibility.TechnologyInfo;
import com.codeintel.model.eligibility.TptPaymentResult;
import com.codeintel.model.enums.EligibilityStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * TPT Eligibility Engine
 *
 * Transitional pass-through payment for outpatient (OPPS) devices, drugs and biologicals:
 *   packagedAmount     = round(apcPayment x packagedFraction)
 *   passThroughPayment = max(0, deviceCost - packagedAmount)
 *
 * Newness and category gate eligibility. A failed cost significance check only
 * forces review; Not Packaged always does.
 */
@Slf4j
@Service
public class TptEligibilityService extends EligibilityEngine {

    static final String ELIGIBLE_CATEGORY = "Eligible Category";
    static final String COST_SIGNIFICANCE = "Cost Significance";
    static final String NOT_PACKAGED = "Not Packaged";

    public static final String DEFAULT_CATEGORY = "device";
    public static final List<String> VALID_CATEGORIES = List.of("device", "drug", "biological");

    private final ProgramReferenceDataService referenceData;
    private final EngineProperties.Tpt settings;

    public TptEligibilityService(ProgramReferenceDataService referenceData, EngineProperties properties, Clock clock) {
        super(clock);
        this.referenceData = referenceData;
        this.settings = properties.getTpt();
    }

    // ========================================================================
    // Payment
    // ========================================================================

    /**
     * @throws com.codeintel.exception.RequestValidationException if the device cost is missing or not positive
     */
    public TptPaymentResult calculateTptPayment(TptPaymentRequest request) {
        List<FieldError> errors = new ArrayList<>();
        requirePositiveCost(request.deviceCost(), errors);
        throwIfInvalid(errors);

        double deviceCost = request.deviceCost();
        double apcPayment = resolvePayment(request.apcPayment(),
            referenceData.getApcPayment(request.apcCode()).orElse(null));

        long packagedAmount = Math.round(apcPayment * settings.getPackagedFraction());
        long passThrough = Math.round(Math.max(0, deviceCost - packagedAmount));
        long total = Math.round(apcPayment + passThrough);

        return new TptPaymentResult(
            deviceCost,
            request.apcCode(),
            apcPayment,
            packagedAmount,
            passThrough,
            total,
            new TptPaymentResult.Breakdown(apcPayment, passThrough, total)
        );
    }

    // ========================================================================
    // Eligibility
    // ========================================================================

    /**
     * @throws com.codeintel.exception.RequestValidationException if the device name or a positive cost is missing
     */
    public EligibilityResult<TptPaymentResult> checkTptEligibility(TptEligibilityRequest request) {
        throwIfInvalid(checkTechnology(request.deviceName(), request.deviceCost()));

        double deviceCost = request.deviceCost();
        double apcPayment = resolvePayment(request.apcPayment(),
            referenceData.getApcPayment(request.apcCode()).orElse(null));
        String category = request.category() == null || request.category().isBlank()
            ? DEFAULT_CATEGORY
            : request.category().trim();
        String window = formatYears(settings.getMaxPassThroughDuration());

        List<CriterionResult> criteria = new ArrayList<>();

        CriterionResult newness = newness(
            "Recent FDA approval (within " + window + "-year window)",
            yearsSince(request.fdaApprovalDate()),
            settings.getMaxPassThroughDuration(),
            "within " + window + "-year window",
            "exceeds pass-through duration");
        criteria.add(newness);

        boolean validCategory = VALID_CATEGORIES.contains(category.toLowerCase(Locale.ROOT));
        CriterionResult categoryCheck = new CriterionResult(
            ELIGIBLE_CATEGORY,
            "Must be a device, drug, or biological",
            validCategory,
            "Category: " + category + " - " + (validCategory ? "Valid" : "Invalid"));
        criteria.add(categoryCheck);

        boolean significant = deviceCost > apcPayment * settings.getCostSignificanceRatio();
        criteria.add(new CriterionResult(
            COST_SIGNIFICANCE,
            "Device cost represents significant portion of procedure cost",
            significant,
            apcPayment > 0
                ? String.format(Locale.ROOT, "Device cost (%s) is %.1f%% of APC payment",
                    usd(deviceCost), deviceCost / apcPayment * 100)
                : "APC payment not specified"));

        criteria.add(new CriterionResult(
            NOT_PACKAGED,
            "Device/drug not already packaged into APC payment",
            true,
            "Requires CMS verification - assumed not currently packaged for new approvals"));

        boolean gatesMet = newness.met() && categoryCheck.met();
        // Not Packaged cannot be verified locally
        boolean reviewForced = true;
        EligibilityStatus status = EligibilityStatus.resolve(gatesMet, reviewForced || !significant);

        log.debug("TPT eligibility for {}: {}", request.deviceName(), status.getValue());

        TptPaymentResult payment = status == EligibilityStatus.NOT_ELIGIBLE
            ? null
            : calculateTptPayment(new TptPaymentRequest(deviceCost, request.apcCode(), request.apcPayment()));

        TechnologyInfo technology = new TechnologyInfo(request.deviceName(), request.manufacturer(), deviceCost,
            category, request.fdaApprovalDate(), request.fdaApprovalType());
        return assemble(status, technology, criteria, payment, recommendations(criteria, status));
    }

    static List<String> recommendations(List<CriterionResult> criteria, EligibilityStatus status) {
        List<String> recommendations = new ArrayList<>();
        for (CriterionResult criterion : criteria) {
            if (criterion.met()) {
                continue;
            }
            if (NEWNESS.equals(criterion.criterion())) {
                recommendations.add("Pass-through status may have expired - verify with CMS");
            } else if (COST_SIGNIFICANCE.equals(criterion.criterion())) {
                recommendations.add("Consider if separate payment is warranted given cost relative to APC");
            }
        }
        if (status != EligibilityStatus.NOT_ELIGIBLE) {
            recommendations.add("Prepare HCPCS code application if not already assigned");
            recommendations.add("Submit pass-through application to CMS with supporting cost data");
        }
        return recommendations;
    }

    // 3.0 -> "3", 2.5 -> "2.5"
    private static String formatYears(double years) {
        return years == Math.rint(years) ? String.valueOf((long) years) : String.valueOf(years);
    }

    // ========================================================================
    // Reference
    // ========================================================================

    public ApprovedTechnologyList getApprovedList() {
        ProgramReferenceData data = referenceData.getTptData();
        List<ApprovedTechnology> technologies = data.technologies();
        return new ApprovedTechnologyList(data.fiscalYear(), data.lastUpdated(),
            settings.getMaxPassThroughDuration(), technologies, technologies.size());
    }

    public List<BasePaymentRate> getApcs() {
        return referenceData.getAvailableApcs();
    }

    public List<String> getValidCategories() {
        return VALID_CATEGORIES;
    }
}
