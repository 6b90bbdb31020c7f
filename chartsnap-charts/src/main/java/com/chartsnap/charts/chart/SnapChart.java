package com.chartsnap.charts.chart;

import com.chartsnap.charts.overlay.HorizontalLineOverlay;
import com.chartsnap.charts.util.ChartStyles;
import com.chartsnap.core.host.CaptureAlignment;
import com.chartsnap.core.model.Candle;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.Surface;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.AxisLocation;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.CandlestickRenderer;
import org.jfree.data.xy.DefaultHighLowDataset;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Off-screen candlestick chart behind one surface.
 *
 * <p>Holds the candles, the horizontal lines keyed by name and the
 * JFreeChart they are drawn on. Captures show a fixed window of the most
 * recent (or the oldest) bars.</p>
 */
public class SnapChart {

    public static final int DEFAULT_VISIBLE_BARS = 150;

    private static final double RANGE_MARGIN = 0.05;

    private final Surface surface;
    private final List<Candle> candles;
    private final int visibleBars;
    private final Map<String, HorizontalLineOverlay> lines = new LinkedHashMap<>();
    private final JFreeChart chart;

    public SnapChart(Surface surface, List<Candle> candles) {
        this(surface, candles, DEFAULT_VISIBLE_BARS);
    }

    public SnapChart(Surface surface, List<Candle> candles, int visibleBars) {
        this.surface = surface;
        this.candles = List.copyOf(candles);
        this.visibleBars = Math.max(1, visibleBars);
        this.chart = createChart();
        ChartStyles.stylizeChart(chart, surface.symbol() + ", " + surface.timeframe().getLabel());
    }

    private JFreeChart createChart() {
        DateAxis domainAxis = new DateAxis("");
        NumberAxis rangeAxis = new NumberAxis("");
        rangeAxis.setAutoRangeIncludesZero(false);

        XYPlot plot = new XYPlot(createDataset(), domainAxis, rangeAxis, createRenderer());
        plot.setRangeAxisLocation(AxisLocation.TOP_OR_RIGHT);

        return new JFreeChart(null, null, plot, false);
    }

    // Bodies filled up/down, wicks in one neutral color, no volume bars
    static CandlestickRenderer createRenderer() {
        CandlestickRenderer renderer = new CandlestickRenderer();
        renderer.setUpPaint(ChartStyles.CANDLE_UP_COLOR);
        renderer.setDownPaint(ChartStyles.CANDLE_DOWN_COLOR);
        renderer.setSeriesPaint(0, ChartStyles.CANDLE_WICK_COLOR);
        renderer.setUseOutlinePaint(false);
        renderer.setDrawVolume(false);
        renderer.setAutoWidthMethod(CandlestickRenderer.WIDTHMETHOD_SMALLEST);
        return renderer;
    }

    private DefaultHighLowDataset createDataset() {
        int size = candles.size();
        Date[] dates = new Date[size];
        double[] high = new double[size];
        double[] low = new double[size];
        double[] open = new double[size];
        double[] close = new double[size];
        double[] volume = new double[size];

        for (int i = 0; i < size; i++) {
            Candle c = candles.get(i);
            dates[i] = new Date(c.timestamp());
            high[i] = c.high();
            low[i] = c.low();
            open[i] = c.open();
            close[i] = c.close();
            volume[i] = c.volume();
        }

        return new DefaultHighLowDataset(surface.symbol(), dates, high, low, open, close, volume);
    }

    // ===== Lines =====

    public List<HorizontalLine> getLines() {
        List<HorizontalLine> result = new ArrayList<>(lines.size());
        for (HorizontalLineOverlay overlay : lines.values()) {
            result.add(overlay.getLine());
        }
        return result;
    }

    public Optional<HorizontalLine> findLine(String name) {
        HorizontalLineOverlay overlay = lines.get(name);
        return overlay != null ? Optional.of(overlay.getLine()) : Optional.empty();
    }

    public boolean hasLine(String name) {
        return lines.containsKey(name);
    }

    /**
     * Draw a new line. The caller checks that the name is free.
     */
    public void addLine(HorizontalLine line) {
        HorizontalLineOverlay overlay = new HorizontalLineOverlay(line);
        overlay.apply(getPlot());
        lines.put(line.name(), overlay);
    }

    public boolean removeLine(String name) {
        HorizontalLineOverlay overlay = lines.remove(name);
        if (overlay == null) {
            return false;
        }
        overlay.remove();
        return true;
    }

    public boolean moveLine(String name, double price) {
        HorizontalLineOverlay overlay = lines.get(name);
        if (overlay == null) {
            return false;
        }
        overlay.update(overlay.getLine().withPrice(price));
        return true;
    }

    // ===== Rendering =====

    /**
     * Mark the chart dirty so the next render picks up every change.
     */
    public void refresh() {
        chart.fireChartChanged();
    }

    /**
     * Show the visible window anchored to the newest (RIGHT) or oldest (LEFT) bar.
     */
    public void align(CaptureAlignment alignment) {
        if (candles.isEmpty()) {
            return;
        }
        int from;
        int to;
        if (alignment == CaptureAlignment.RIGHT) {
            to = candles.size() - 1;
            from = Math.max(0, to - visibleBars + 1);
        } else {
            from = 0;
            to = Math.min(candles.size() - 1, visibleBars - 1);
        }

        long period = surface.timeframe().getPeriod().toMillis();
        long start = candles.get(from).timestamp() - period;
        long end = candles.get(to).timestamp() + period;
        getDomainAxis().setRange(new Date(start), new Date(end));

        double low = Double.MAX_VALUE;
        double high = -Double.MAX_VALUE;
        for (int i = from; i <= to; i++) {
            low = Math.min(low, candles.get(i).low());
            high = Math.max(high, candles.get(i).high());
        }
        double margin = Math.max((high - low) * RANGE_MARGIN, Math.abs(high) * 0.0005);
        if (margin <= 0) {
            margin = 1.0;
        }
        getPlot().getRangeAxis().setRange(low - margin, high + margin);
    }

    /**
     * Render to an image file; JPEG when the extension is jpg/jpeg, PNG otherwise.
     */
    public void render(Path output, int width, int height, CaptureAlignment alignment) throws IOException {
        align(alignment);
        Path dir = output.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        if (isJpeg(output)) {
            ChartUtils.saveChartAsJPEG(output.toFile(), chart, width, height);
        } else {
            ChartUtils.saveChartAsPNG(output.toFile(), chart, width, height);
        }
    }

    /**
     * Render to an in-memory image.
     */
    public BufferedImage renderImage(int width, int height, CaptureAlignment alignment) {
        align(alignment);
        return chart.createBufferedImage(width, height);
    }

    private static boolean isJpeg(Path output) {
        String name = output.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jpg") || name.endsWith(".jpeg");
    }

    // ===== Accessors =====

    public Surface getSurface() {
        return surface;
    }

    public List<Candle> getCandles() {
        return candles;
    }

    public JFreeChart getChart() {
        return chart;
    }

    public XYPlot getPlot() {
        return chart.getXYPlot();
    }

    public DateAxis getDomainAxis() {
        return (DateAxis) getPlot().getDomainAxis();
    }
}
