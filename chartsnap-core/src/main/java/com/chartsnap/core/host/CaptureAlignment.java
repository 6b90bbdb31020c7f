package com.chartsnap.core.host;

/**
 * Edge of the price history a capture is anchored to.
 */
public enum CaptureAlignment {
    /** Oldest bars at the left edge. */
    LEFT,
    /** Latest bar at the right edge. */
    RIGHT
}
