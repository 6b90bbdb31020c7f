package com.chartsnap.charts.overlay;

import com.chartsnap.charts.util.ChartStyles;
import com.chartsnap.core.model.HorizontalLine;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.ui.LengthAdjustmentType;
import org.jfree.chart.ui.Layer;
import org.jfree.chart.ui.RectangleAnchor;
import org.jfree.chart.ui.TextAnchor;

import java.awt.BasicStroke;
import java.text.DecimalFormat;

/**
 * Draws one horizontal line as a range marker.
 *
 * <p>Background lines go on the background layer, behind the candles, so
 * mirrored levels never hide price action.</p>
 */
public class HorizontalLineOverlay {

    private final DecimalFormat priceFormat = new DecimalFormat("#,##0.00");

    private HorizontalLine line;
    private ValueMarker marker;
    private XYPlot plot;

    public HorizontalLineOverlay(HorizontalLine line) {
        this.line = line;
    }

    public HorizontalLine getLine() {
        return line;
    }

    /**
     * Add the marker to a plot, replacing any marker this overlay drew before.
     */
    public void apply(XYPlot target) {
        remove();

        marker = new ValueMarker(line.price());
        marker.setPaint(line.color());
        marker.setStroke(createStroke(line));

        marker.setLabel(labelText());
        marker.setLabelFont(ChartStyles.LABEL_FONT);
        marker.setLabelPaint(ChartStyles.contrastingText(line.color()));
        marker.setLabelBackgroundColor(line.color());
        marker.setLabelAnchor(RectangleAnchor.RIGHT);
        marker.setLabelTextAnchor(TextAnchor.CENTER_RIGHT);
        marker.setLabelOffsetType(LengthAdjustmentType.EXPAND);

        target.addRangeMarker(marker, layer());
        plot = target;
    }

    /**
     * Swap in a changed line, e.g. after a move, and redraw it on the same plot.
     */
    public void update(HorizontalLine changed) {
        this.line = changed;
        if (plot != null) {
            apply(plot);
        }
    }

    public void remove() {
        if (plot != null && marker != null) {
            plot.removeRangeMarker(marker, layer());
        }
        marker = null;
        plot = null;
    }

    /**
     * The marker currently on the plot, or null.
     */
    public ValueMarker getMarker() {
        return marker;
    }

    private Layer layer() {
        return line.background() ? Layer.BACKGROUND : Layer.FOREGROUND;
    }

    private String labelText() {
        String price = priceFormat.format(line.price());
        return line.label().isEmpty() ? price : line.label() + " " + price;
    }

    static BasicStroke createStroke(HorizontalLine line) {
        float[] dash = line.style().getDashPattern();
        if (dash == null) {
            return new BasicStroke(line.width());
        }
        // Scale the dash pattern with the width so thick lines keep their look
        float[] scaled = new float[dash.length];
        for (int i = 0; i < dash.length; i++) {
            scaled[i] = dash[i] * line.width();
        }
        return new BasicStroke(line.width(), BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10.0f, scaled, 0.0f);
    }
}
