package com.chartsnap.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Exported set of user-authored horizontal lines for one symbol.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"symbol", "timestamp", "lines"})
public record LineExport(
    String symbol,
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime timestamp,
    List<ExportedLine> lines
) {
    public LineExport {
        lines = lines != null ? List.copyOf(lines) : List.of();
    }

    public static LineExport empty() {
        return new LineExport("", null, List.of());
    }

    /**
     * One exported line.
     *
     * @param name  line name disambiguated with its chart handle
     * @param price price with two fixed decimals
     * @param color "#RRGGBB"
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"name", "price", "color"})
    public record ExportedLine(String name, BigDecimal price, String color) {
    }
}
