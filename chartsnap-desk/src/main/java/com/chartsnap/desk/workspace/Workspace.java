package com.chartsnap.desk.workspace;

import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.LineStyle;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The user's chart workspace: which charts are open and the lines drawn on them.
 * Stored in ~/.chartsnap/workspace.yaml
 *
 * <pre>
 * charts:
 *   - symbol: XAUUSDp
 *     timeframe: H4
 *     lines:
 *       - name: Support
 *         price: 2650.0
 *         color: "#00FF00"
 *         style: DASH
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Workspace {

    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);
        YAML = new ObjectMapper(factory);
    }

    private List<ChartEntry> charts = new ArrayList<>();

    public Workspace() {
    }

    public List<ChartEntry> getCharts() {
        return charts;
    }

    public void setCharts(List<ChartEntry> charts) {
        this.charts = charts != null ? charts : new ArrayList<>();
    }

    public static Workspace load(Path file) throws IOException {
        return YAML.readValue(file.toFile(), Workspace.class);
    }

    public void save(Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        YAML.writeValue(file.toFile(), this);
    }

    /**
     * One chart in the workspace.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChartEntry {
        private String symbol;
        private String timeframe;
        private List<LineEntry> lines = new ArrayList<>();

        public ChartEntry() {
        }

        public ChartEntry(String symbol, String timeframe) {
            this.symbol = symbol;
            this.timeframe = timeframe;
        }

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }

        public String getTimeframe() { return timeframe; }
        public void setTimeframe(String timeframe) { this.timeframe = timeframe; }

        public List<LineEntry> getLines() { return lines; }
        public void setLines(List<LineEntry> lines) { this.lines = lines != null ? lines : new ArrayList<>(); }
    }

    /**
     * One user-drawn horizontal line.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LineEntry {
        private String name;
        private double price;
        private String color = "#FF0000";
        private int width = 1;
        private String style = "SOLID";
        private String label = "";

        public LineEntry() {
        }

        public LineEntry(String name, double price, String color) {
            this.name = name;
            this.price = price;
            this.color = color;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public double getPrice() { return price; }
        public void setPrice(double price) { this.price = price; }

        public String getColor() { return color; }
        public void setColor(String color) { this.color = color; }

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }

        public String getStyle() { return style; }
        public void setStyle(String style) { this.style = style; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }

        /**
         * Convert to a chart line. Unknown styles fall back to solid.
         */
        @JsonIgnore
        public HorizontalLine toLine() {
            LineStyle lineStyle;
            try {
                lineStyle = style != null ? LineStyle.valueOf(style.trim().toUpperCase(Locale.ROOT)) : LineStyle.SOLID;
            } catch (IllegalArgumentException e) {
                lineStyle = LineStyle.SOLID;
            }
            return new HorizontalLine(name, price, HorizontalLine.parseHex(color), width, lineStyle, label, false);
        }
    }
}
