package com.codeintel.model.code;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One row of the source dataset exactly as it appears in the JSON files.
 * Converted into a {@link CodeRecord} while the index is built.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCodeRecord(
    String code,
    String description,
    String type,
    List<String> labels,
    JsonNode metadata
) {}
