package com.chartsnap.charts.host;

import com.chartsnap.charts.chart.SnapChart;
import com.chartsnap.charts.data.CandleSource;
import com.chartsnap.core.host.CaptureAlignment;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.host.LineChangeEvent;
import com.chartsnap.core.host.LineChangeListener;
import com.chartsnap.core.model.Candle;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chart host backed by off-screen JFreeChart charts.
 *
 * <p>Each open chart is a {@link SnapChart} drawn from the candle source.
 * Handles are assigned in opening order and never reused. Line listeners
 * are notified synchronously on the calling thread.</p>
 */
public class JFreeChartHost implements ChartHost {

    private static final Logger log = LoggerFactory.getLogger(JFreeChartHost.class);

    private final CandleSource candleSource;
    private final int visibleBars;
    private final Map<Long, SnapChart> charts = new ConcurrentSkipListMap<>();
    private final List<LineChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextHandle = new AtomicLong(1);

    public JFreeChartHost(CandleSource candleSource) {
        this(candleSource, SnapChart.DEFAULT_VISIBLE_BARS);
    }

    public JFreeChartHost(CandleSource candleSource, int visibleBars) {
        this.candleSource = candleSource;
        this.visibleBars = visibleBars;
    }

    // ===== Charts =====

    @Override
    public List<Surface> openSurfaces() {
        List<Surface> result = new ArrayList<>(charts.size());
        for (SnapChart chart : charts.values()) {
            result.add(chart.getSurface());
        }
        return result;
    }

    @Override
    public Surface open(String symbol, Timeframe timeframe) throws HostException {
        List<Candle> candles;
        try {
            candles = candleSource.load(symbol, timeframe);
        } catch (IOException e) {
            throw new HostException(HostException.CHART_CANNOT_OPEN,
                "Cannot load candles for " + symbol + " " + timeframe + ": " + e.getMessage(), e);
        }
        if (candles.isEmpty()) {
            throw new HostException(HostException.CHART_CANNOT_OPEN,
                "No price data for " + symbol + " " + timeframe);
        }

        Surface surface = new Surface(nextHandle.getAndIncrement(), symbol, timeframe);
        charts.put(surface.handle(), new SnapChart(surface, candles, visibleBars));
        log.debug("Opened {} with {} candles", surface.describe(), candles.size());
        return surface;
    }

    @Override
    public void close(long handle) throws HostException {
        SnapChart chart = charts.remove(handle);
        if (chart == null) {
            throw new HostException(HostException.CHART_WRONG_ID, "No open chart #" + handle);
        }
        log.debug("Closed {}", chart.getSurface().describe());
    }

    // ===== Lines =====

    @Override
    public List<HorizontalLine> lines(long handle) throws HostException {
        return chart(handle).getLines();
    }

    @Override
    public Optional<HorizontalLine> findLine(long handle, String name) throws HostException {
        return chart(handle).findLine(name);
    }

    @Override
    public void createLine(long handle, HorizontalLine line) throws HostException {
        SnapChart chart = chart(handle);
        if (chart.hasLine(line.name())) {
            throw new HostException(HostException.OBJECT_ALREADY_EXISTS,
                "Line '" + line.name() + "' already exists on chart #" + handle);
        }
        chart.addLine(line);
        fire(LineChangeEvent.Type.CREATE, handle, line.name());
    }

    @Override
    public boolean deleteLine(long handle, String name) throws HostException {
        boolean removed = chart(handle).removeLine(name);
        if (removed) {
            fire(LineChangeEvent.Type.DELETE, handle, name);
        }
        return removed;
    }

    @Override
    public void moveLine(long handle, String name, double price) throws HostException {
        if (!chart(handle).moveLine(name, price)) {
            throw new HostException(HostException.OBJECT_NOT_FOUND,
                "No line '" + name + "' on chart #" + handle);
        }
        fire(LineChangeEvent.Type.MOVE, handle, name);
    }

    // ===== Rendering =====

    @Override
    public void redraw(long handle) throws HostException {
        chart(handle).refresh();
    }

    @Override
    public void captureImage(long handle, Path output, int width, int height, CaptureAlignment alignment)
            throws HostException {
        SnapChart chart = chart(handle);
        try {
            chart.render(output, width, height, alignment);
        } catch (IOException | RuntimeException e) {
            throw new HostException(HostException.CHART_SCREENSHOT_FAILED,
                "Cannot render " + chart.getSurface().describe() + " to " + output + ": " + e.getMessage(), e);
        }
    }

    // ===== Listeners =====

    @Override
    public void addLineListener(LineChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeLineListener(LineChangeListener listener) {
        listeners.remove(listener);
    }

    private void fire(LineChangeEvent.Type type, long handle, String name) {
        LineChangeEvent event = new LineChangeEvent(type, handle, name);
        for (LineChangeListener listener : listeners) {
            try {
                listener.onLineChanged(event);
            } catch (RuntimeException e) {
                log.warn("Line listener failed on {}: {}", event, e.getMessage());
            }
        }
    }

    private SnapChart chart(long handle) throws HostException {
        SnapChart chart = charts.get(handle);
        if (chart == null) {
            throw new HostException(HostException.CHART_WRONG_ID, "No open chart #" + handle);
        }
        return chart;
    }

    /**
     * The chart behind a handle, for callers that need the JFreeChart itself.
     */
    public Optional<SnapChart> getChart(long handle) {
        return Optional.ofNullable(charts.get(handle));
    }
}
