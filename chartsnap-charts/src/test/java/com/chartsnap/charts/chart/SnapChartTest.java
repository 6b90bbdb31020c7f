package com.chartsnap.charts.chart;

import com.chartsnap.charts.util.ChartStyles;
import com.chartsnap.core.host.CaptureAlignment;
import com.chartsnap.core.model.Candle;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.jfree.chart.renderer.xy.CandlestickRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapChart.
 */
class SnapChartTest {

    private static final long START = 1_700_000_000_000L;
    private static final long HOUR = Timeframe.H1.getPeriod().toMillis();

    private static List<Candle> candles(int count) {
        List<Candle> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double open = 100 + i;
            result.add(new Candle(START + i * HOUR, open, open + 2, open - 1, open + 1, 10));
        }
        return result;
    }

    @Test
    @DisplayName("Candles use the chart palette without volume bars or outlines")
    void candleRenderer() {
        SnapChart chart = new SnapChart(new Surface(1, "XAUUSDp", Timeframe.H1), candles(10));

        CandlestickRenderer renderer = assertInstanceOf(CandlestickRenderer.class, chart.getPlot().getRenderer());
        assertEquals(ChartStyles.CANDLE_UP_COLOR, renderer.getUpPaint());
        assertEquals(ChartStyles.CANDLE_DOWN_COLOR, renderer.getDownPaint());
        assertEquals(ChartStyles.CANDLE_WICK_COLOR, renderer.getSeriesPaint(0));
        assertFalse(renderer.getDrawVolume());
        assertFalse(renderer.getUseOutlinePaint());
        assertEquals(CandlestickRenderer.WIDTHMETHOD_SMALLEST, renderer.getAutoWidthMethod());
    }

    @Test
    @DisplayName("Right alignment shows the newest bars with a margin around their price range")
    void alignRight() {
        // Given
        SnapChart chart = new SnapChart(new Surface(1, "XAUUSDp", Timeframe.H1), candles(50), 20);

        // When
        chart.align(CaptureAlignment.RIGHT);

        // Then
        long newest = START + 49 * HOUR;
        long oldestVisible = START + 30 * HOUR;
        assertEquals(newest + HOUR, chart.getDomainAxis().getMaximumDate().getTime());
        assertEquals(oldestVisible - HOUR, chart.getDomainAxis().getMinimumDate().getTime());

        double lowest = 100 + 30 - 1;
        double highest = 100 + 49 + 2;
        assertTrue(chart.getPlot().getRangeAxis().getLowerBound() < lowest);
        assertTrue(chart.getPlot().getRangeAxis().getUpperBound() > highest);
    }

    @Test
    @DisplayName("Left alignment shows the oldest bars")
    void alignLeft() {
        SnapChart chart = new SnapChart(new Surface(1, "XAUUSDp", Timeframe.H1), candles(50), 20);

        chart.align(CaptureAlignment.LEFT);

        assertEquals(START - HOUR, chart.getDomainAxis().getMinimumDate().getTime());
        assertEquals(START + 20 * HOUR, chart.getDomainAxis().getMaximumDate().getTime());
    }
}
