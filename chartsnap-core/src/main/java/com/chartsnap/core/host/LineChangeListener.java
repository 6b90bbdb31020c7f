package com.chartsnap.core.host;

/**
 * Receives horizontal-line change notifications from a {@link ChartHost}.
 */
@FunctionalInterface
public interface LineChangeListener {

    void onLineChanged(LineChangeEvent event);
}
