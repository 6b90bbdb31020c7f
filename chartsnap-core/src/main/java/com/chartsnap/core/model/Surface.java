package com.chartsnap.core.model;

/**
 * A live chart for one symbol/timeframe pair, identified by the host's handle.
 */
public record Surface(
    long handle,
    String symbol,
    Timeframe timeframe
) {
    public boolean shows(String otherSymbol) {
        return symbol.equals(otherSymbol);
    }

    public boolean matches(String otherSymbol, Timeframe otherTimeframe) {
        return symbol.equals(otherSymbol) && timeframe == otherTimeframe;
    }

    public String describe() {
        return symbol + " " + timeframe.getLabel() + " #" + handle;
    }
}
