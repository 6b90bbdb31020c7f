package com.chartsnap.core.engine;

import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the charts a cycle opened, after a grace delay so an in-flight capture is not cut short.
 * Charts that were already open before the cycle are never closed.
 */
public class SurfaceReaper {

    private static final Logger log = LoggerFactory.getLogger(SurfaceReaper.class);

    private final ChartHost host;
    private final Sleeper sleeper;
    private final long graceMs;

    public SurfaceReaper(ChartHost host, Sleeper sleeper, long graceMs) {
        this.host = host;
        this.sleeper = sleeper;
        this.graceMs = graceMs;
    }

    /**
     * Close every chart owned by the cycle and clear the ownership set.
     *
     * @return number of charts closed
     */
    public int cleanup(CycleContext context) {
        if (context.getCreatedHandles().isEmpty()) {
            return 0;
        }

        try {
            sleeper.sleep(graceMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int closed = 0;
        for (Long handle : context.getCreatedHandles()) {
            try {
                host.close(handle);
                closed++;
            } catch (HostException e) {
                log.warn("Cannot close chart #{} (error {}): {}", handle, e.getErrorCode(), e.getMessage());
            }
        }
        context.clearCreated();
        log.info("Closed {} charts opened for {}", closed, context.getSymbol());
        return closed;
    }
}
