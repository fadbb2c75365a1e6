package com.codeintel.config;

import com.codeintel.dto.response.CodeStatsDto;
import com.codeintel.service.CodeIndex;
import com.codeintel.service.CodeIntelligenceService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the code index as the {@code codeIndex} health component: DOWN until loaded,
 * with the load failure attached when there was one.
 */
@Component
public class CodeIndexHealthIndicator implements HealthIndicator {

    private final CodeIntelligenceService codeService;
    private final CodeIndex codeIndex;

    public CodeIndexHealthIndicator(CodeIntelligenceService codeService, CodeIndex codeIndex) {
        this.codeService = codeService;
        this.codeIndex = codeIndex;
    }

    @Override
    public Health health() {
        if (!codeService.isReady()) {
            Health.Builder builder = Health.down().withDetail("isLoaded", false);
            codeIndex.getLoadError().ifPresent(error -> builder.withDetail("error", error.getMessage()));
            return builder.build();
        }
        CodeStatsDto stats = codeService.getStats();
        return Health.up()
            .withDetail("isLoaded", true)
            .withDetail("totalCodes", stats.totalCodes())
            .withDetail("loadMethod", stats.loadMethod())
            .build();
    }
}
