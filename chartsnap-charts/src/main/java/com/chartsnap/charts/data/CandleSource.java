package com.chartsnap.charts.data;

import com.chartsnap.core.model.Candle;
import com.chartsnap.core.model.Timeframe;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the price series a chart is drawn from.
 */
public interface CandleSource {

    /**
     * Candles for a symbol/timeframe in ascending time order. Empty if none exist.
     */
    List<Candle> load(String symbol, Timeframe timeframe) throws IOException;
}
