package com.chartsnap.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * OHLCV candle backing a chart surface.
 * Stored as CSV in {dataDir}/SYMBOL/TIMEFRAME.csv
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Parse a CSV line into a Candle.
     * Format: timestamp,open,high,low,close[,volume]
     * Volume is optional; hosts that export price-only series omit it.
     */
    public static Candle fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 5) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }

        long timestamp = Long.parseLong(parts[0].trim());
        double open = Double.parseDouble(parts[1].trim());
        double high = Double.parseDouble(parts[2].trim());
        double low = Double.parseDouble(parts[3].trim());
        double close = Double.parseDouble(parts[4].trim());
        double volume = 0;

        if (parts.length >= 6) {
            try {
                volume = Double.parseDouble(parts[5].trim());
            } catch (NumberFormatException e) {
                // Volume column present but empty
            }
        }

        return new Candle(timestamp, open, high, low, close, volume);
    }

    /**
     * Convert to CSV format.
     */
    public String toCsv() {
        return String.format(java.util.Locale.ROOT, "%d,%.8f,%.8f,%.8f,%.8f,%.8f",
            timestamp, open, high, low, close, volume);
    }

    /**
     * Check if this is a bullish candle (close > open)
     */
    @JsonIgnore
    public boolean isBullish() {
        return close > open;
    }
}
