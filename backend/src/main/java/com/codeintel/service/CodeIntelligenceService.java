package com.codeintel.service;

import com.codeintel.config.EngineProperties;
import com.codeintel.dto.mapper.CodeMapper;
import com.codeintel.dto.request.CodeListRequest;
import com.codeintel.dto.response.CodeDetailDto;
import com.codeintel.dto.response.CodePageDto;
import com.codeintel.dto.response.CodeSearchResultDto;
import com.codeintel.dto.response.CodeStatsDto;
import com.codeintel.exception.CodeLoadException;
import com.codeintel.exception.CodeNotFoundException;
import com.codeintel.exception.FieldError;
import com.codeintel.exception.RequestValidationException;
import com.codeintel.model.code.CodePage;
import com.codeintel.model.code.CodeQuery;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.SearchResult;
import com.codeintel.model.enums.CodeSortField;
import com.codeintel.model.enums.CodeType;
import com.codeintel.model.enums.SortOrder;
import com.codeintel.source.CodeManifest;
import com.codeintel.source.CodeSource;
import com.codeintel.source.CodeSources;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for code lookups: loading, detail views, listings, search and statistics.
 */
@Slf4j
@Service
public class CodeIntelligenceService {

    private final CodeIndex codeIndex;
    private final CodeSearchService searchService;
    private final CodeMapper codeMapper;
    private final EngineProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public CodeIntelligenceService(
            CodeIndex codeIndex,
            CodeSearchService searchService,
            CodeMapper codeMapper,
            EngineProperties properties,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        this.codeIndex = codeIndex;
        this.searchService = searchService;
        this.codeMapper = codeMapper;
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    // ========================================================================
    // Loading
    // ========================================================================

    /**
     * Load the configured dataset into the index. No-op once loaded.
     *
     * @throws CodeLoadException if the dataset cannot be located, read or parsed
     */
    public void loadCodes() {
        if (codeIndex.isReady()) {
            return;
        }
        EngineProperties.DataSource data = properties.getData();
        CodeSource source;
        try {
            source = CodeSources.resolve(resourceLoader, data.getLocation(), data.getChunksDirectory(),
                data.getSingleFileName(), objectMapper);
        } catch (IOException e) {
            throw new CodeLoadException("Cannot resolve code data under " + data.getLocation(), e);
        }
        codeIndex.load(source);
    }

    public boolean isReady() {
        return codeIndex.isReady();
    }

    // ========================================================================
    // Lookups
    // ========================================================================

    /**
     * Detail view of one code, including its estimated payments.
     */
    public Optional<CodeDetailDto> getCode(String code) {
        return codeIndex.getByCode(code)
            .map(record -> codeMapper.toDetailDto(record, codeIndex.paymentsFor(record)));
    }

    /**
     * Resolve a code for the calculators.
     *
     * @throws CodeNotFoundException if the code is not in the index
     */
    public CodeRecord resolveRecord(String code) {
        return codeIndex.getByCode(code).orElseThrow(() -> new CodeNotFoundException(code));
    }

    /**
     * Sorted, paginated listing.
     *
     * @throws RequestValidationException for a non-positive limit, negative offset or unknown sort option
     */
    public CodePageDto getAllCodes(CodeListRequest request) {
        List<FieldError> errors = new ArrayList<>();
        int limit = request.limit() == null ? CodeQuery.DEFAULT_LIMIT : request.limit();
        int offset = request.offset() == null ? 0 : request.offset();
        if (limit <= 0) {
            errors.add(new FieldError("limit", "must be a positive integer"));
        }
        if (offset < 0) {
            errors.add(new FieldError("offset", "must be zero or greater"));
        }
        CodeSortField sortBy = null;
        SortOrder sortOrder = null;
        try {
            sortBy = request.sortBy() == null ? CodeSortField.CODE : CodeSortField.fromValue(request.sortBy());
        } catch (IllegalArgumentException e) {
            errors.add(new FieldError("sortBy", e.getMessage()));
        }
        try {
            sortOrder = request.sortOrder() == null ? SortOrder.ASC : SortOrder.fromValue(request.sortOrder());
        } catch (IllegalArgumentException e) {
            errors.add(new FieldError("sortOrder", e.getMessage()));
        }
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }

        boolean filtered = request.type() != null && !request.type().isBlank();
        Optional<CodeType> type = CodeType.fromFilter(request.type());
        if (filtered && type.isEmpty()) {
            codeIndex.requireReady();
            return new CodePageDto(List.of(), 0, limit, offset, false);
        }

        CodePage page = codeIndex.listByType(new CodeQuery(limit, offset, type.orElse(null), sortBy, sortOrder));
        return new CodePageDto(
            codeMapper.toSummaryDtoList(page.records()),
            page.total(),
            page.limit(),
            page.offset(),
            page.hasMore()
        );
    }

    /**
     * Ranked text search. Queries shorter than two characters return an empty result.
     */
    public CodeSearchResultDto searchCodes(String query, Integer limit, String type) {
        int effectiveLimit = limit == null ? CodeQuery.DEFAULT_LIMIT : limit;
        if (effectiveLimit <= 0) {
            throw RequestValidationException.of("limit", "must be a positive integer");
        }
        boolean filtered = type != null && !type.isBlank();
        Optional<CodeType> codeType = CodeType.fromFilter(type);
        if (filtered && codeType.isEmpty()) {
            codeIndex.requireReady();
            return new CodeSearchResultDto(List.of(), 0, query);
        }
        SearchResult result = searchService.search(query, codeType.orElse(null), effectiveLimit);
        return new CodeSearchResultDto(codeMapper.toSummaryDtoList(result.records()), result.total(), result.query());
    }

    // ========================================================================
    // Statistics
    // ========================================================================

    /**
     * Index statistics. Safe to call before loading completes.
     */
    public CodeStatsDto getStats() {
        if (!codeIndex.isReady()) {
            return new CodeStatsDto(0, false, Map.of(), null, null);
        }
        Map<String, Integer> types = new LinkedHashMap<>();
        codeIndex.typeCounts().forEach((type, count) -> types.put(type.getValue(), count));

        CodeStatsDto.ChunkInfo chunks = codeIndex.manifest()
            .map(CodeIntelligenceService::toChunkInfo)
            .orElse(null);
        return new CodeStatsDto(codeIndex.size(), true, types, codeIndex.loadMethod(), chunks);
    }

    private static CodeStatsDto.ChunkInfo toChunkInfo(CodeManifest manifest) {
        return new CodeStatsDto.ChunkInfo(manifest.chunkCount(), manifest.targetChunkSizeMB(), manifest.createdAt());
    }
}
