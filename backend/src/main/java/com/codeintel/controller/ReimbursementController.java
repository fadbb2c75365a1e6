package com.codeintel.controller;

import com.codeintel.dto.request.ScenarioRequest;
import com.codeintel.dto.response.SitesResponse;
import com.codeintel.model.reimbursement.ScenarioResult;
import com.codeintel.model.reimbursement.SiteComparisonResult;
import com.codeintel.service.ReimbursementCalculator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for site-of-service reimbursement scenarios.
 */
@RestController
@RequestMapping("/api/reimbursement")
public class ReimbursementController {

    private final ReimbursementCalculator calculator;

    public ReimbursementController(ReimbursementCalculator calculator) {
        this.calculator = calculator;
    }

    @PostMapping("/scenario")
    public ResponseEntity<ScenarioResult> calculateScenario(@RequestBody ScenarioRequest request) {
        return ResponseEntity.ok(calculator.calculateScenario(request));
    }

    /**
     * Compare all four sites of service for one code, best margin first.
     */
    @GetMapping("/compare/{code}")
    public ResponseEntity<SiteComparisonResult> compareAllSites(
            @PathVariable String code,
            @RequestParam(defaultValue = "0") Double deviceCost,
            @RequestParam(defaultValue = "0") Double ntapAddOn) {
        return ResponseEntity.ok(calculator.compareAllSites(code, deviceCost, ntapAddOn));
    }

    @GetMapping("/sites")
    public ResponseEntity<SitesResponse> getValidSites() {
        return ResponseEntity.ok(new SitesResponse(calculator.getValidSites(), calculator.getThresholds()));
    }
}
