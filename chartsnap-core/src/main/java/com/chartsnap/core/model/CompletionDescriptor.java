package com.chartsnap.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Completion descriptor written once per successful capture cycle.
 *
 * <pre>{@code
 * {"symbol":"XAUUSDp","count":5,"timeframes":["D1","H4","M15","M5","M1"],
 *  "timestamp":"2026-10-19T14:03:07","prefix":"chart_XAUUSDp_","terminal_path":"..."}
 * }</pre>
 */
@JsonPropertyOrder({"symbol", "count", "timeframes", "timestamp", "prefix", "terminal_path"})
public record CompletionDescriptor(
    String symbol,
    int count,
    List<String> timeframes,
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime timestamp,
    String prefix,
    @JsonProperty("terminal_path") String terminalPath
) {
}
