package com.codeintel.dto.response;

import com.codeintel.model.code.PaymentSet;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Full code view including estimated payments per site of service.
 */
public record CodeDetailDto(
    String code,
    String description,
    String category,
    String type,
    List<String> labels,
    PaymentSet payments,
    OptionalFields optional,
    JsonNode rawMetadata
) {

    /**
     * Rate-setting attributes that many codes do not carry. DRG is always null:
     * procedure codes are not mapped to DRGs in the dataset.
     */
    public record OptionalFields(
        String drg,
        String apc,
        String si,
        String rank,
        List<String> modifiers,
        String effectiveDate
    ) {}
}
