package com.codeintel.model.eligibility;

public record CriterionResult(String criterion, String description, boolean met, String details) {}
