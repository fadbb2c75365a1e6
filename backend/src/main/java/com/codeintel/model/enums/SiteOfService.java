package com.codeintel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The four CMS payment systems a procedure can be billed under.
 */
public enum SiteOfService {
    IPPS("Inpatient (DRG)", "Inpatient Prospective Payment System"),
    HOPD("Hospital Outpatient (OPPS)", "Outpatient Prospective Payment System"),
    ASC("Ambulatory Surgical Center", "ASC Payment System"),
    OBL("Office-Based Lab", "Physician Fee Schedule (Non-Facility)");

    // Keys are upper-case letters only; see normalize()
    private static final Map<String, SiteOfService> ALIASES = Map.ofEntries(
        Map.entry("IPPS", IPPS),
        Map.entry("INPATIENT", IPPS),
        Map.entry("DRG", IPPS),
        Map.entry("HOPD", HOPD),
        Map.entry("OPPS", HOPD),
        Map.entry("HOSPITALOUTPATIENT", HOPD),
        Map.entry("ASC", ASC),
        Map.entry("AMBULATORY", ASC),
        Map.entry("OBL", OBL),
        Map.entry("OFFICE", OBL),
        Map.entry("NONFACILITY", OBL),
        Map.entry("PHYSICIAN", OBL)
    );

    private final String displayName;
    private final String description;

    SiteOfService(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String getKey() {
        return name();
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolve user input through the alias table. Case and any non-letter
     * characters are ignored, so "hospital_outpatient" and "Non-Facility" both resolve.
     */
    public static Optional<SiteOfService> normalize(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String key = input.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        return Optional.ofNullable(ALIASES.get(key));
    }
}
