package com.codeintel.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunable constants of the reimbursement engine, bound from the {@code engine.*} properties.
 * Defaults are the approximate CY2025 CMS values; they are estimates, not an authoritative rate source.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    @Valid
    private DataSource data = new DataSource();
    @Valid
    private Cms cms = new Cms();
    @Valid
    private Reimbursement reimbursement = new Reimbursement();
    @Valid
    private Ntap ntap = new Ntap();
    @Valid
    private Tpt tpt = new Tpt();

    @Data
    public static class DataSource {
        /**
         * Directory holding either codes_chunks/manifest.json or codes_2025.json.
         */
        @NotBlank
        private String location = "classpath:data/";
        @NotBlank
        private String singleFileName = "codes_2025.json";
        @NotBlank
        private String chunksDirectory = "codes_chunks";
    }

    @Data
    public static class Cms {
        @Positive
        private double facilityConversionFactor = 33.89;
        @Positive
        private double nonFacilityConversionFactor = 33.89;
        @Positive
        private double ippsMultiplier = 1.5;
        @NotNull
        private Map<String, Long> apcRates = new LinkedHashMap<>(Map.of(
            "5193", 11639L,
            "5054", 2850L,
            "5055", 4200L,
            "5056", 6500L,
            "5183", 8500L,
            "5192", 9200L,
            "5194", 14500L
        ));
    }

    @Data
    public static class Reimbursement {
        private double profitableMinMargin = 0.10;
        private double breakEvenMinMargin = -0.05;

        @AssertTrue(message = "break-even-min-margin must be below profitable-min-margin")
        public boolean isThresholdOrderValid() {
            return breakEvenMinMargin < profitableMinMargin;
        }
    }

    @Data
    public static class Ntap {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double percentage = 0.65;
        @PositiveOrZero
        private long maxCap = 150_000L;
        @Positive
        private double costThresholdMultiplier = 1.0;
        @Positive
        private double newnessYears = 3;
    }

    @Data
    public static class Tpt {
        @Positive
        private double maxPassThroughDuration = 3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double packagedFraction = 0.10;
        @PositiveOrZero
        private double costSignificanceRatio = 0.15;
    }
}
