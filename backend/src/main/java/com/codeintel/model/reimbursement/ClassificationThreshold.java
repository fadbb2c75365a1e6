package com.codeintel.model.reimbursement;

public record ClassificationThreshold(String condition, String color, String label) {}
