package com.github.dominikschlosser.federation.correlation;

import java.util.Locale;

/** Resolution modes of a correlation policy. Neither mode ever creates a principal. */
public enum CorrelationMode {

    /** Exactly one existing principal must match. */
    MATCH_EXISTING_ONLY,

    /** Exactly one existing principal must match, and it must be active. */
    MATCH_EXISTING_OR_REJECT;

    /** Accepts {@code MATCH_EXISTING_ONLY} as well as {@code match-existing-only}. */
    public static CorrelationMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return MATCH_EXISTING_ONLY;
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
