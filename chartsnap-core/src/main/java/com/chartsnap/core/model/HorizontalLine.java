package com.chartsnap.core.model;

import java.awt.Color;
import java.util.Locale;
import java.util.Objects;

/**
 * Horizontal price-level annotation living on a chart.
 *
 * <p>Names are unique per chart. A line is either user-authored or a mirror
 * created by {@link com.chartsnap.core.engine.AnnotationSynchronizer}; mirrors
 * are recognized purely by their name (see {@link com.chartsnap.core.engine.MirrorNames}).</p>
 *
 * @param name       unique name on the owning chart
 * @param price      price level
 * @param color      line color
 * @param width      stroke width in pixels
 * @param style      stroke style
 * @param label      label text (may be empty)
 * @param background true if drawn behind the price series and not selectable
 */
public record HorizontalLine(
    String name,
    double price,
    Color color,
    int width,
    LineStyle style,
    String label,
    boolean background
) {
    public static final Color DEFAULT_COLOR = Color.RED;

    public HorizontalLine {
        Objects.requireNonNull(name, "name");
        if (color == null) color = DEFAULT_COLOR;
        if (style == null) style = LineStyle.SOLID;
        if (label == null) label = "";
        if (width < 1) width = 1;
    }

    /**
     * Create a solid, one pixel, foreground line.
     */
    public static HorizontalLine of(String name, double price, Color color) {
        return new HorizontalLine(name, price, color, 1, LineStyle.SOLID, "", false);
    }

    public HorizontalLine withName(String newName) {
        return new HorizontalLine(newName, price, color, width, style, label, background);
    }

    public HorizontalLine withPrice(double newPrice) {
        return new HorizontalLine(name, newPrice, color, width, style, label, background);
    }

    public HorizontalLine withBackground(boolean newBackground) {
        return new HorizontalLine(name, price, color, width, style, label, newBackground);
    }

    /**
     * Color as a "#RRGGBB" hex triplet (alpha dropped).
     */
    public String colorHex() {
        return toHex(color);
    }

    public static String toHex(Color color) {
        return String.format(Locale.ROOT, "#%02X%02X%02X", color.getRed(), color.getGreen(), color.getBlue());
    }

    /**
     * Parse "#RRGGBB" (or "RRGGBB"). Falls back to {@link #DEFAULT_COLOR} on malformed input.
     */
    public static Color parseHex(String hex) {
        if (hex == null) return DEFAULT_COLOR;
        String s = hex.trim();
        if (s.startsWith("#")) s = s.substring(1);
        if (s.length() != 6) return DEFAULT_COLOR;
        try {
            return new Color(Integer.parseInt(s, 16));
        } catch (NumberFormatException e) {
            return DEFAULT_COLOR;
        }
    }
}
