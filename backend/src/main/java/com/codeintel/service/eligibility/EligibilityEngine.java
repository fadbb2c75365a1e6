package com.codeintel.service.eligibility;

import com.codeintel.exception.FieldError;
import com.codeintel.exception.RequestValidationException;
import com.codeintel.model.eligibility.CriterionResult;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.TechnologyInfo;
import com.codeintel.model.enums.EligibilityStatus;

import java.text.NumberFormat;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared mechanics of the NTAP and TPT engines: approval age, input checks,
 * money formatting and assembling the final result.
 */
abstract class EligibilityEngine {

    static final String NEWNESS = "Newness";

    private static final double DAYS_PER_YEAR = 365.25;

    private final Clock clock;

    protected EligibilityEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Years elapsed since the approval date, null when no date was supplied.
     */
    protected Double yearsSince(LocalDate approvalDate) {
        if (approvalDate == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(approvalDate, LocalDate.now(clock));
        return days / DAYS_PER_YEAR;
    }

    protected static CriterionResult newness(String description, Double years, double maxYears,
                                             String withinDetail, String outsideDetail) {
        if (years == null) {
            return new CriterionResult(NEWNESS, description, false,
                "FDA approval date not provided - newness cannot be established");
        }
        boolean met = years <= maxYears;
        String age = String.format(Locale.ROOT, "Approved %.1f years ago - ", years);
        return new CriterionResult(NEWNESS, description, met, age + (met ? withinDetail : outsideDetail));
    }

    protected static void requirePositiveCost(Double deviceCost, List<FieldError> errors) {
        if (deviceCost == null || deviceCost.isNaN() || deviceCost <= 0) {
            errors.add(new FieldError("deviceCost", "Device cost is required and must be positive"));
        }
    }

    protected static void throwIfInvalid(List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
    }

    protected static List<FieldError> checkTechnology(String deviceName, Double deviceCost) {
        List<FieldError> errors = new ArrayList<>();
        if (deviceName == null || deviceName.isBlank()) {
            errors.add(new FieldError("deviceName", "Device name is required"));
        }
        requirePositiveCost(deviceCost, errors);
        return errors;
    }

    /**
     * Supplied payment when positive, else the reference table value, else zero.
     */
    protected static double resolvePayment(Double supplied, Long reference) {
        if (supplied != null && supplied > 0) {
            return supplied;
        }
        return reference == null ? 0 : reference;
    }

    // 1234567.5 -> "$1,234,567.5"
    protected static String usd(double amount) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMaximumFractionDigits(2);
        return "$" + format.format(amount);
    }

    protected static <P> EligibilityResult<P> assemble(EligibilityStatus status, TechnologyInfo technology,
                                                       List<CriterionResult> criteria, P potentialPayment,
                                                       List<String> recommendations) {
        int met = (int) criteria.stream().filter(CriterionResult::met).count();
        return new EligibilityResult<>(
            status,
            status.getLabel(),
            technology,
            List.copyOf(criteria),
            met,
            criteria.size(),
            status == EligibilityStatus.NOT_ELIGIBLE ? null : potentialPayment,
            List.copyOf(recommendations)
        );
    }
}
