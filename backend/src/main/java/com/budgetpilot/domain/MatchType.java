package com.budgetpilot.domain;

import java.util.Locale;

/**
 * How a rule keyword is matched against a transaction description.
 */
public enum MatchType {
    CONTAINS,
    EXACT;

    /** Lower-case form used on the wire ("contains", "exact"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire form, case-insensitive. Null or blank defaults to CONTAINS.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static MatchType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return CONTAINS;
        }
        return MatchType.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
