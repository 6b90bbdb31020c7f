package com.chartsnap.core.model;

import java.util.List;

/**
 * Summary of one capture cycle.
 */
public record CycleReport(
    String symbol,
    Outcome outcome,
    List<CaptureResult> results
) {
    public enum Outcome {
        /** No request marker present; nothing ran. */
        IDLE,
        /** Marker present but unreadable; left in place. */
        REQUEST_UNREADABLE,
        /** Every timeframe failed (or the engine is read-only); marker left for a retry. */
        NO_CAPTURES_SUCCEEDED,
        /** Captures exist but the completion descriptor could not be written. */
        REPORT_WRITE_FAILED,
        /** Descriptor written and marker consumed. */
        COMPLETED
    }

    public CycleReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static CycleReport idle(String symbol) {
        return new CycleReport(symbol, Outcome.IDLE, List.of());
    }

    public int successCount() {
        return (int) results.stream().filter(CaptureResult::success).count();
    }

    public List<String> attemptedTimeframes() {
        return results.stream().map(r -> r.timeframe().getLabel()).toList();
    }

    public String toSummary() {
        return String.format("%s %s: %d/%d captured", symbol, outcome, successCount(), results.size());
    }
}
