package com.z254.argus.domain.model;

import java.util.Locale;

/**
 * Alert severity as reported by the upstream collector.
 */
public enum Severity {
    CRITICAL(5.0),
    WARNING(3.0),
    INFO(2.0),
    DEBUG(1.0);

    /** Score used for severities the collector reports that are not in this set. */
    public static final double UNKNOWN_SCORE = 2.0;

    private final double score;

    Severity(double score) {
        this.score = score;
    }

    /**
     * Numeric weight used by the noise ranker's service features.
     */
    public double score() {
        return score;
    }

    /**
     * Lowercase name as used in group keys and rule values.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity leniently; unknown or blank values map to {@link #INFO}.
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "ERROR", "HIGH", "PAGE" -> {
                return CRITICAL;
            }
            case "WARN", "MEDIUM" -> {
                return WARNING;
            }
            case "LOW" -> {
                return INFO;
            }
            default -> {
                for (Severity severity : values()) {
                    if (severity.name().equals(normalized)) {
                        return severity;
                    }
                }
                return INFO;
            }
        }
    }
}
