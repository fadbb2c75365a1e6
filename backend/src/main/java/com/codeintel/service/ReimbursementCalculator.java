package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.request.ScenarioRequest;
import com.codeintel.exception.FieldError;
import com.codeintel.exception.RequestValidationException;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.enums.MarginClassification;
import com.codeintel.model.enums.SiteOfService;
import com.codeintel.model.reimbursement.BreakdownItem;
import com.codeintel.model.reimbursement.ClassificationThreshold;
import com.codeintel.model.reimbursement.ScenarioBreakdown;
import com.codeintel.model.reimbursement.ScenarioCodeDetails;
import com.codeintel.model.reimbursement.ScenarioResult;
import com.codeintel.model.reimbursement.SiteComparison;
import com.codeintel.model.reimbursement.SiteComparisonResult;
import com.codeintel.model.reimbursement.SiteInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reimbursement Calculator
 *
 * Combines a code's estimated site payment with a device cost and optional NTAP add-on:
 *   totalPayment = basePayment + ntapAddOn
 *   margin       = totalPayment - deviceCost
 *
 * Classification uses margin / totalPayment against the configured thresholds,
 * both boundaries inclusive.
 */
@Slf4j
@Service
public class ReimbursementCalculator {

    private final CodeIntelligenceService codeService;
    private final CodeIndex codeIndex;
    private final EngineProperties.Reimbursement thresholds;

    public ReimbursementCalculator(
            CodeIntelligenceService codeService,
            CodeIndex codeIndex,
            EngineProperties properties) {
        this.codeService = codeService;
        this.codeIndex = codeIndex;
        this.thresholds = properties.getReimbursement();
    }

    // ========================================================================
    // Scenarios
    // ========================================================================

    /**
     * Evaluate one code at one site of service.
     *
     * @throws RequestValidationException with every invalid field
     * @throws com.codeintel.exception.CodeNotFoundException if the code is not indexed
     */
    public ScenarioResult calculateScenario(ScenarioRequest request) {
        SiteOfService site = validate(request);
        CodeRecord record = codeService.resolveRecord(request.code());
        PaymentSet payments = codeIndex.paymentsFor(record);

        long basePayment = payments.forSite(site);
        double addOnPayment = request.ntapAddOn() == null ? 0 : request.ntapAddOn();
        double deviceCost = request.deviceCost();
        double totalPayment = basePayment + addOnPayment;
        double margin = totalPayment - deviceCost;
        MarginClassification classification = classify(margin, totalPayment);

        log.debug("Scenario {} @ {}: total={} margin={} -> {}",
            record.code(), site, totalPayment, margin, classification.getValue());

        ScenarioBreakdown breakdown = new ScenarioBreakdown(
            BreakdownItem.sourced("Base Payment", basePayment, record.code() + " @ " + site.getDisplayName()),
            BreakdownItem.sourced("NTAP Add-On", addOnPayment,
                addOnPayment > 0 ? "New Technology Add-on Payment" : "Not applied"),
            BreakdownItem.derived("Total Payment", totalPayment, "Base + Add-On"),
            BreakdownItem.sourced("Device Cost", deviceCost, "User provided"),
            BreakdownItem.derived("Margin", margin, "Total Payment - Device Cost")
        );

        return new ScenarioResult(
            record.code(),
            record.description(),
            site.getDisplayName(),
            site.getKey(),
            basePayment,
            addOnPayment,
            totalPayment,
            deviceCost,
            margin,
            marginPercentage(margin, totalPayment),
            classification,
            breakdown,
            new ScenarioCodeDetails(record.type().getValue(), record.category(), payments,
                record.rateMetadata().apc())
        );
    }

    /**
     * Evaluate the code at every site of service, highest margin first.
     * Sites with equal margins keep the IPPS, HOPD, ASC, OBL order.
     */
    public SiteComparisonResult compareAllSites(String code, Double deviceCost, Double ntapAddOn) {
        List<SiteComparison> comparisons = new ArrayList<>();
        String description = null;
        for (SiteOfService site : SiteOfService.values()) {
            ScenarioResult result = calculateScenario(new ScenarioRequest(code, site.getKey(), deviceCost, ntapAddOn));
            description = result.description();
            comparisons.add(SiteComparison.of(result));
        }
        comparisons.sort(Comparator.comparingDouble(SiteComparison::margin).reversed());

        return new SiteComparisonResult(
            code,
            description,
            deviceCost,
            ntapAddOn == null ? 0 : ntapAddOn,
            List.copyOf(comparisons),
            comparisons.get(0),
            comparisons.get(comparisons.size() - 1)
        );
    }

    // ========================================================================
    // Classification
    // ========================================================================

    /**
     * Classify a margin relative to total payment. With no payment at all,
     * a non-negative margin is break-even and anything else is a loss.
     */
    public MarginClassification classify(double margin, double totalPayment) {
        if (totalPayment == 0) {
            return margin >= 0 ? MarginClassification.BREAK_EVEN : MarginClassification.LOSS;
        }
        double ratio = margin / totalPayment;
        if (ratio >= thresholds.getProfitableMinMargin()) {
            return MarginClassification.PROFITABLE;
        }
        if (ratio >= thresholds.getBreakEvenMinMargin()) {
            return MarginClassification.BREAK_EVEN;
        }
        return MarginClassification.LOSS;
    }

    static String marginPercentage(double margin, double totalPayment) {
        if (totalPayment == 0) {
            return "0.0";
        }
        return String.format(Locale.ROOT, "%.1f", margin / totalPayment * 100);
    }

    // ========================================================================
    // Reference
    // ========================================================================

    public List<SiteInfo> getValidSites() {
        return Arrays.stream(SiteOfService.values()).map(SiteInfo::of).toList();
    }

    /**
     * Human-readable classification rules keyed by classification value.
     */
    public Map<String, ClassificationThreshold> getThresholds() {
        String profitable = percent(thresholds.getProfitableMinMargin());
        String breakEven = percent(thresholds.getBreakEvenMinMargin());

        Map<String, ClassificationThreshold> result = new LinkedHashMap<>();
        result.put(MarginClassification.PROFITABLE.getValue(), threshold(MarginClassification.PROFITABLE,
            "Margin >= " + profitable + "% of Total Payment"));
        result.put(MarginClassification.BREAK_EVEN.getValue(), threshold(MarginClassification.BREAK_EVEN,
            "Margin between " + breakEven + "% and " + profitable + "%"));
        result.put(MarginClassification.LOSS.getValue(), threshold(MarginClassification.LOSS,
            "Margin < " + breakEven + "% of Total Payment"));
        return result;
    }

    private static ClassificationThreshold threshold(MarginClassification classification, String condition) {
        return new ClassificationThreshold(condition, classification.getColor(), classification.getLabel());
    }

    // 0.10 -> "10", -0.05 -> "-5"
    private static String percent(double fraction) {
        return BigDecimal.valueOf(fraction).movePointRight(2).stripTrailingZeros().toPlainString();
    }

    // ========================================================================
    // Validation
    // ========================================================================

    private SiteOfService validate(ScenarioRequest request) {
        List<FieldError> errors = new ArrayList<>();
        SiteOfService site = null;

        if (request.code() == null || request.code().isBlank()) {
            errors.add(new FieldError("code", "Code is required"));
        }
        if (request.siteOfService() == null || request.siteOfService().isBlank()) {
            errors.add(new FieldError("siteOfService", "Site of service is required"));
        } else {
            site = SiteOfService.normalize(request.siteOfService()).orElse(null);
            if (site == null) {
                errors.add(new FieldError("siteOfService", "Invalid site of service: " + request.siteOfService()
                    + " (valid: IPPS, HOPD, ASC, OBL)"));
            }
        }
        if (request.deviceCost() == null) {
            errors.add(new FieldError("deviceCost", "Device cost is required"));
        } else if (request.deviceCost() < 0 || request.deviceCost().isNaN()) {
            errors.add(new FieldError("deviceCost", "Device cost must be a non-negative number"));
        }
        if (request.ntapAddOn() != null && (request.ntapAddOn() < 0 || request.ntapAddOn().isNaN())) {
            errors.add(new FieldError("ntapAddOn", "NTAP add-on must be a non-negative number"));
        }

        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
        return site;
    }
}
