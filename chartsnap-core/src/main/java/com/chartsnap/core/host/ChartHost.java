package com.chartsnap.core.host;

import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The charting platform the capture engine runs inside.
 *
 * <p>Exposes open charts, their horizontal-line namespace and the native
 * capture primitive. The host offers no transactions or locks: every write to
 * a chart's line namespace is a plain create or delete by name.</p>
 *
 * <p>Callers invoke the host only from the serialized callback thread
 * (see {@link HostLoop}).</p>
 */
public interface ChartHost {

    /**
     * All currently open charts.
     */
    List<Surface> openSurfaces();

    /**
     * Open a new chart.
     *
     * @throws HostException with {@link HostException#CHART_CANNOT_OPEN} if the chart cannot be opened
     */
    Surface open(String symbol, Timeframe timeframe) throws HostException;

    /**
     * Close an open chart.
     *
     * @throws HostException with {@link HostException#CHART_WRONG_ID} for an unknown handle
     */
    void close(long handle) throws HostException;

    /**
     * All horizontal lines on a chart, in creation order.
     */
    List<HorizontalLine> lines(long handle) throws HostException;

    /**
     * Look up a line by name.
     */
    Optional<HorizontalLine> findLine(long handle, String name) throws HostException;

    /**
     * Create a line.
     *
     * @throws HostException with {@link HostException#OBJECT_ALREADY_EXISTS} if the name is taken
     */
    void createLine(long handle, HorizontalLine line) throws HostException;

    /**
     * Delete a line by name.
     *
     * @return true if a line was removed
     */
    boolean deleteLine(long handle, String name) throws HostException;

    /**
     * Move an existing line to a new price.
     *
     * @throws HostException with {@link HostException#OBJECT_NOT_FOUND} if no such line exists
     */
    void moveLine(long handle, String name, double price) throws HostException;

    /**
     * Force a redraw. Rendering may complete asynchronously.
     */
    void redraw(long handle) throws HostException;

    /**
     * Capture the chart as an image file.
     *
     * @param handle    chart handle
     * @param output    destination image (format taken from the extension)
     * @param width     pixel width
     * @param height    pixel height
     * @param alignment which edge of the price history the image is anchored to
     * @throws HostException with {@link HostException#CHART_SCREENSHOT_FAILED} on failure
     */
    void captureImage(long handle, Path output, int width, int height, CaptureAlignment alignment) throws HostException;

    /**
     * Register for line change notifications.
     */
    void addLineListener(LineChangeListener listener);

    /**
     * Unregister a line change listener.
     */
    void removeLineListener(LineChangeListener listener);
}
