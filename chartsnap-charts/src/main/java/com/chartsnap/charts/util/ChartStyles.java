package com.chartsnap.charts.util;

import org.jfree.chart.JFreeChart;
import org.jfree.chart.annotations.XYTitleAnnotation;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.title.TextTitle;
import org.jfree.chart.ui.RectangleAnchor;

import java.awt.*;
import java.text.DecimalFormat;
import java.text.SimpleDateFormat;

/**
 * Central styling constants and methods for captured charts.
 * Captures are rendered off-screen, so the palette is fixed to a dark theme.
 */
public final class ChartStyles {

    private ChartStyles() {} // Prevent instantiation

    // ===== Background Colors =====

    public static final Color BACKGROUND_COLOR = new Color(30, 30, 35);
    public static final Color PLOT_BACKGROUND_COLOR = new Color(22, 22, 26);
    public static final Color GRIDLINE_COLOR = new Color(60, 60, 65);
    public static final Color TEXT_COLOR = new Color(200, 200, 205);
    public static final Color AXIS_LABEL_COLOR = new Color(150, 150, 155);

    // ===== Price Colors =====

    public static final Color CANDLE_UP_COLOR = new Color(76, 175, 80);
    public static final Color CANDLE_DOWN_COLOR = new Color(244, 67, 54);
    public static final Color CANDLE_WICK_COLOR = new Color(140, 140, 145);

    // ===== Line Labels =====

    public static final Color LABEL_TEXT_COLOR = Color.WHITE;
    public static final Font LABEL_FONT = new Font(Font.SANS_SERIF, Font.BOLD, 10);

    // Consistent axis tick label font
    private static final Font AXIS_TICK_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 10);

    /**
     * Apply the dark styling to a chart and add its title in the top-left corner.
     */
    public static void stylizeChart(JFreeChart chart, String title) {
        chart.setBackgroundPaint(BACKGROUND_COLOR);
        chart.setAntiAlias(true);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(PLOT_BACKGROUND_COLOR);
        plot.setDomainGridlinePaint(GRIDLINE_COLOR);
        plot.setRangeGridlinePaint(GRIDLINE_COLOR);
        plot.setOutlineVisible(false);

        if (plot.getDomainAxis() instanceof DateAxis dateAxis) {
            dateAxis.setDateFormatOverride(new SimpleDateFormat("MM-dd HH:mm"));
            dateAxis.setTickLabelPaint(AXIS_LABEL_COLOR);
            dateAxis.setTickLabelFont(AXIS_TICK_FONT);
            dateAxis.setAxisLineVisible(false);
        }

        if (plot.getRangeAxis() instanceof NumberAxis rangeAxis) {
            styleNumberAxis(rangeAxis);
        }

        addChartTitleAnnotation(plot, title);
    }

    /**
     * Apply consistent styling to a NumberAxis.
     */
    public static void styleNumberAxis(NumberAxis axis) {
        axis.setTickLabelPaint(AXIS_LABEL_COLOR);
        axis.setTickLabelFont(AXIS_TICK_FONT);
        axis.setAxisLineVisible(false);
        axis.setFixedDimension(60);
        axis.setNumberFormatOverride(new DecimalFormat("#,##0.00###"));
        axis.setTickMarksVisible(false);
    }

    /**
     * Add title annotation to chart plot.
     */
    public static void addChartTitleAnnotation(XYPlot plot, String title) {
        TextTitle textTitle = new TextTitle(title, new Font(Font.SANS_SERIF, Font.PLAIN, 11));
        textTitle.setPaint(TEXT_COLOR);
        textTitle.setBackgroundPaint(null);
        XYTitleAnnotation titleAnnotation = new XYTitleAnnotation(0.01, 0.98, textTitle, RectangleAnchor.TOP_LEFT);
        plot.addAnnotation(titleAnnotation);
    }

    /**
     * Pick a readable label text color for a given background.
     */
    public static Color contrastingText(Color background) {
        double luminance = (0.299 * background.getRed() + 0.587 * background.getGreen()
            + 0.114 * background.getBlue()) / 255;
        return luminance > 0.6 ? Color.BLACK : LABEL_TEXT_COLOR;
    }
}
