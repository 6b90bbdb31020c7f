package com.chartsnap.core.engine;

import com.chartsnap.core.exception.CaptureFailedException;
import com.chartsnap.core.host.CaptureAlignment;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.model.Surface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Redraws a chart, waits for rendering to settle and captures it to an image file.
 * Never retries; that is the orchestrator's call.
 */
public class ChartCapturer {

    private static final Logger log = LoggerFactory.getLogger(ChartCapturer.class);

    private final ChartHost host;
    private final Sleeper sleeper;
    private final long settleDelayMs;

    public ChartCapturer(ChartHost host, Sleeper sleeper, long settleDelayMs) {
        this.host = host;
        this.sleeper = sleeper;
        this.settleDelayMs = settleDelayMs;
    }

    /**
     * Capture a chart, anchored to the latest bar.
     *
     * @return the written image path
     * @throws CaptureFailedException if redraw or capture fails
     */
    public Path capture(Surface surface, int width, int height, Path output) throws CaptureFailedException {
        try {
            host.redraw(surface.handle());
            settle();
            host.captureImage(surface.handle(), output, width, height, CaptureAlignment.RIGHT);
        } catch (HostException e) {
            throw new CaptureFailedException(
                "Capture of " + surface.describe() + " failed: " + e.getMessage(), e.getErrorCode(), e);
        }
        log.info("Captured {} to {} ({}x{})", surface.describe(), output.getFileName(), width, height);
        return output;
    }

    private void settle() {
        try {
            sleeper.sleep(settleDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
