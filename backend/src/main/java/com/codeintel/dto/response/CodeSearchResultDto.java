package com.codeintel.dto.response;

import java.util.List;

public record CodeSearchResultDto(
    List<CodeSummaryDto> codes,
    int total,
    String query
) {}
