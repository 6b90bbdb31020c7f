package com.chartsnap.core.engine;

import com.chartsnap.core.exception.SurfaceUnavailableException;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.model.ResolvedSurface;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;

/**
 * Finds an open chart for a symbol/timeframe, or opens one.
 *
 * <p>When several open charts match, the one with the lowest handle wins, so
 * the same environment always resolves to the same chart. Charts opened here
 * are recorded in the cycle context for the reaper.</p>
 */
public class SurfaceResolver {

    private static final Logger log = LoggerFactory.getLogger(SurfaceResolver.class);

    private final ChartHost host;

    public SurfaceResolver(ChartHost host) {
        this.host = host;
    }

    /**
     * Resolve a chart for the given symbol and timeframe.
     *
     * @throws SurfaceUnavailableException if no chart is open and one cannot be opened
     */
    public ResolvedSurface resolve(String symbol, Timeframe timeframe, CycleContext context)
            throws SurfaceUnavailableException {
        Optional<Surface> existing = findOpen(symbol, timeframe);
        if (existing.isPresent()) {
            log.debug("Using open chart {}", existing.get().describe());
            return new ResolvedSurface(existing.get(), false);
        }

        try {
            Surface created = host.open(symbol, timeframe);
            context.markCreated(created);
            log.info("Opened chart {}", created.describe());
            return new ResolvedSurface(created, true);
        } catch (HostException e) {
            throw new SurfaceUnavailableException(
                "Cannot open chart " + symbol + " " + timeframe + ": " + e.getMessage(),
                timeframe, e.getErrorCode(), e);
        }
    }

    /**
     * Find an already open chart without opening one.
     */
    public Optional<Surface> findOpen(String symbol, Timeframe timeframe) {
        return host.openSurfaces().stream()
            .filter(s -> s.matches(symbol, timeframe))
            .min(Comparator.comparingLong(Surface::handle));
    }
}
