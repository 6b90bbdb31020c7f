package com.chartsnap.core.model;

/**
 * Stroke style of a horizontal line.
 */
public enum LineStyle {
    SOLID(null),
    DASH(new float[]{6.0f, 3.0f}),
    DOT(new float[]{1.0f, 3.0f}),
    DASH_DOT(new float[]{6.0f, 3.0f, 1.0f, 3.0f}),
    DASH_DOT_DOT(new float[]{6.0f, 3.0f, 1.0f, 3.0f, 1.0f, 3.0f});

    private final float[] dashPattern;

    LineStyle(float[] dashPattern) {
        this.dashPattern = dashPattern;
    }

    /**
     * Dash pattern for a {@link java.awt.BasicStroke}, or null for a solid line.
     */
    public float[] getDashPattern() {
        return dashPattern != null ? dashPattern.clone() : null;
    }
}
