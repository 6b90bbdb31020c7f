package com.chartsnap.core.engine;

import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.Surface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Mirrors user-authored horizontal lines from every chart of a symbol onto one destination chart.
 *
 * <p>The host has no transactions or locks, so correctness rests on the naming
 * convention in {@link MirrorNames} and on delete-then-recreate writes:</p>
 * <ol>
 *   <li>Purge every mirror already on the destination, so a mirror whose
 *       source line was deleted does not survive.</li>
 *   <li>For every user-authored line on every other chart of the same symbol,
 *       delete any line named {@code mirrorName(source, handle)} on the
 *       destination and create a fresh copy at the source price with the
 *       source's color, width, style and label, drawn in the background.</li>
 * </ol>
 * <p>Running {@link #sync(Surface)} twice with no line changes in between
 * yields the same mirror set. Mirrors are never used as sources and
 * user-authored lines are never touched.</p>
 */
public class AnnotationSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(AnnotationSynchronizer.class);

    private final ChartHost host;

    public AnnotationSynchronizer(ChartHost host) {
        this.host = host;
    }

    /**
     * Synchronize mirrors onto the destination chart.
     *
     * @return number of mirrors created
     */
    public int sync(Surface destination) {
        int purged = purgeMirrors(destination);

        List<Surface> sources = host.openSurfaces().stream()
            .filter(s -> s.shows(destination.symbol()))
            .filter(s -> s.handle() != destination.handle())
            .sorted(Comparator.comparingLong(Surface::handle))
            .toList();

        int copied = 0;
        for (Surface source : sources) {
            List<HorizontalLine> lines;
            try {
                lines = host.lines(source.handle());
            } catch (HostException e) {
                log.warn("Cannot read lines of {} (error {}): {}",
                    source.describe(), e.getErrorCode(), e.getMessage());
                continue;
            }

            for (HorizontalLine line : lines) {
                if (MirrorNames.isMirror(line.name())) {
                    continue;
                }
                if (mirror(line, source, destination)) {
                    copied++;
                }
            }
        }

        log.debug("Synced {}: purged {} stale mirrors, created {} from {} charts",
            destination.describe(), purged, copied, sources.size());
        return copied;
    }

    private boolean mirror(HorizontalLine line, Surface source, Surface destination) {
        String name = MirrorNames.mirrorName(line.name(), source.handle());
        try {
            if (host.findLine(destination.handle(), name).isPresent()) {
                host.deleteLine(destination.handle(), name);
            }
            host.createLine(destination.handle(), line.withName(name).withBackground(true));
            return true;
        } catch (HostException e) {
            log.warn("Cannot mirror {} from {} onto {} (error {}): {}",
                line.name(), source.describe(), destination.describe(), e.getErrorCode(), e.getMessage());
            return false;
        }
    }

    /**
     * Delete every mirror on a chart.
     *
     * @return number of mirrors deleted
     */
    public int purgeMirrors(Surface surface) {
        List<HorizontalLine> lines;
        try {
            lines = host.lines(surface.handle());
        } catch (HostException e) {
            log.warn("Cannot read lines of {} (error {}): {}",
                surface.describe(), e.getErrorCode(), e.getMessage());
            return 0;
        }

        int deleted = 0;
        for (HorizontalLine line : lines) {
            if (!MirrorNames.isMirror(line.name())) {
                continue;
            }
            try {
                if (host.deleteLine(surface.handle(), line.name())) {
                    deleted++;
                }
            } catch (HostException e) {
                log.warn("Cannot delete mirror {} on {} (error {}): {}",
                    line.name(), surface.describe(), e.getErrorCode(), e.getMessage());
            }
        }
        return deleted;
    }
}
