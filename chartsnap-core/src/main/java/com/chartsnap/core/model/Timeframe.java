package com.chartsnap.core.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Chart timeframes, named the way the charting host names its periods.
 */
public enum Timeframe {
    M1("M1", Duration.ofMinutes(1)),
    M5("M5", Duration.ofMinutes(5)),
    M15("M15", Duration.ofMinutes(15)),
    M30("M30", Duration.ofMinutes(30)),
    H1("H1", Duration.ofHours(1)),
    H4("H4", Duration.ofHours(4)),
    D1("D1", Duration.ofDays(1)),
    W1("W1", Duration.ofDays(7)),
    MN1("MN1", Duration.ofDays(30));

    private final String label;
    private final Duration period;

    Timeframe(String label, Duration period) {
        this.label = label;
        this.period = period;
    }

    public String getLabel() {
        return label;
    }

    public Duration getPeriod() {
        return period;
    }

    /**
     * Parse a timeframe label such as "H4" or "m15" (case-insensitive).
     *
     * @throws IllegalArgumentException if the label names no known timeframe
     */
    public static Timeframe parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Timeframe label must not be blank");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Timeframe tf : values()) {
            if (tf.label.equals(normalized)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
