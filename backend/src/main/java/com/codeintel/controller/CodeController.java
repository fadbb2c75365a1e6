package com.codeintel.controller;

import com.codeintel.dto.request.CodeListRequest;
import com.codeintel.dto.response.CodeDetailDto;
import com.codeintel.dto.response.CodeListResponse;
import com.codeintel.dto.response.CodeSearchResponse;
import com.codeintel.dto.response.CodeSearchResultDto;
import com.codeintel.dto.response.CodeStatsDto;
import com.codeintel.exception.CodeNotFoundException;
import com.codeintel.service.CodeIntelligenceService;
import com.codeintel.service.CodeSearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for code lookup, listing and search.
 */
@RestController
@RequestMapping("/api/codes")
public class CodeController {

    private final CodeIntelligenceService codeService;

    public CodeController(CodeIntelligenceService codeService) {
        this.codeService = codeService;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * Paged listing, optionally filtered by code system.
     */
    @GetMapping
    public ResponseEntity<CodeListResponse> getCodes(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {

        CodeListRequest request = new CodeListRequest(limit, offset, type, sortBy, sortOrder);
        return ResponseEntity.ok(CodeListResponse.of(codeService.getAllCodes(request)));
    }

    /**
     * Ranked search over code and description.
     */
    @GetMapping("/search")
    public ResponseEntity<CodeSearchResponse> searchCodes(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String type) {

        if (query == null || query.trim().length() < CodeSearchService.MIN_QUERY_LENGTH) {
            return ResponseEntity.ok(new CodeSearchResponse(List.of(), 0, query == null ? "" : query,
                "Query must be at least " + CodeSearchService.MIN_QUERY_LENGTH + " characters"));
        }

        CodeSearchResultDto result = codeService.searchCodes(query, limit, type);
        return ResponseEntity.ok(new CodeSearchResponse(result.codes(), result.total(), result.query(), null));
    }

    @GetMapping("/stats")
    public ResponseEntity<CodeStatsDto> getStats() {
        return ResponseEntity.ok(codeService.getStats());
    }

    /**
     * Get a single code with its estimated payments.
     */
    @GetMapping("/{code}")
    public ResponseEntity<CodeDetailDto> getCode(@PathVariable String code) {
        return codeService.getCode(code)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new CodeNotFoundException(code));
    }
}
