package com.codeintel.controller;

import com.codeintel.dto.request.TptEligibilityRequest;
import com.codeintel.dto.request.TptPaymentRequest;
import com.codeintel.dto.response.ApcListResponse;
import com.codeintel.model.eligibility.ApprovedTechnologyList;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.TptPaymentResult;
import com.codeintel.service.eligibility.TptEligibilityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for Transitional Pass-Through payment calculations.
 */
@RestController
@RequestMapping("/api/tpt")
public class TptController {

    private final TptEligibilityService tptService;

    public TptController(TptEligibilityService tptService) {
        this.tptService = tptService;
    }

    @PostMapping("/calculate")
    public ResponseEntity<TptPaymentResult> calculatePayment(@RequestBody TptPaymentRequest request) {
        return ResponseEntity.ok(tptService.calculateTptPayment(request));
    }

    @PostMapping("/eligibility")
    public ResponseEntity<EligibilityResult<TptPaymentResult>> checkEligibility(
            @RequestBody TptEligibilityRequest request) {
        return ResponseEntity.ok(tptService.checkTptEligibility(request));
    }

    @GetMapping("/approved-list")
    public ResponseEntity<ApprovedTechnologyList> getApprovedList() {
        return ResponseEntity.ok(tptService.getApprovedList());
    }

    @GetMapping("/apcs")
    public ResponseEntity<ApcListResponse> getApcs() {
        return ResponseEntity.ok(new ApcListResponse(tptService.getApcs()));
    }

    @GetMapping("/categories")
    public ResponseEntity<List<String>> getValidCategories() {
        return ResponseEntity.ok(tptService.getValidCategories());
    }
}
