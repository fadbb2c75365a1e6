package com.codeintel.controller;

import com.codeintel.dto.request.NtapEligibilityRequest;
import com.codeintel.dto.request.NtapPaymentRequest;
import com.codeintel.dto.response.DrgListResponse;
import com.codeintel.model.eligibility.ApprovedTechnologyList;
import com.codeintel.model.eligibility.EligibilityResult;
import com.codeintel.model.eligibility.NtapPaymentResult;
import com.codeintel.service.eligibility.NtapEligibilityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for New Technology Add-on Payment calculations.
 */
@RestController
@RequestMapping("/api/ntap")
public class NtapController {

    private final NtapEligibilityService ntapService;

    public NtapController(NtapEligibilityService ntapService) {
        this.ntapService = ntapService;
    }

    @PostMapping("/calculate")
    public ResponseEntity<NtapPaymentResult> calculatePayment(@RequestBody NtapPaymentRequest request) {
        return ResponseEntity.ok(ntapService.calculateNtapPayment(request));
    }

    @PostMapping("/eligibility")
    public ResponseEntity<EligibilityResult<NtapPaymentResult>> checkEligibility(
            @RequestBody NtapEligibilityRequest request) {
        return ResponseEntity.ok(ntapService.checkNtapEligibility(request));
    }

    @GetMapping("/approved-list")
    public ResponseEntity<ApprovedTechnologyList> getApprovedList() {
        return ResponseEntity.ok(ntapService.getApprovedList());
    }

    @GetMapping("/drgs")
    public ResponseEntity<DrgListResponse> getDrgs() {
        return ResponseEntity.ok(new DrgListResponse(ntapService.getDrgs()));
    }

    @GetMapping("/clinical-improvements")
    public ResponseEntity<List<String>> getClinicalImprovementCategories() {
        return ResponseEntity.ok(ntapService.getClinicalImprovementCategories());
    }
}
