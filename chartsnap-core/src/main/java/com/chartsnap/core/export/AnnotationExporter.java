package com.chartsnap.core.export;

import com.chartsnap.core.engine.MirrorNames;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.host.HostLoop;
import com.chartsnap.core.host.LineChangeEvent;
import com.chartsnap.core.host.LineChangeListener;
import com.chartsnap.core.io.JsonFiles;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.LineExport;
import com.chartsnap.core.model.LineExport.ExportedLine;
import com.chartsnap.core.model.Surface;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the horizontal-line export file in step with the charts of one symbol.
 *
 * <p>Exports on every line change notification and on a fixed timer. Only
 * user-authored lines are exported; mirrors are skipped by name. Each line is
 * named {@code <name>_<handle>} so equal names on different charts stay
 * distinct. The line count is logged only when it changes, so the timer does
 * not flood the log. Change notifications are coalesced: at most one export
 * waits on the host loop at a time.</p>
 */
public class AnnotationExporter implements LineChangeListener {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExporter.class);
    private static final int PRICE_SCALE = 2;

    private final ChartHost host;
    private final String symbol;
    private final Path exportFile;
    private final Clock clock;
    private final ObjectMapper mapper = JsonFiles.createMapper();

    private HostLoop loop;
    private ScheduledFuture<?> timer;
    private int lastCount = -1;
    private final AtomicBoolean exportQueued = new AtomicBoolean(false);

    public AnnotationExporter(ChartHost host, String symbol, Path exportFile, Clock clock) {
        this.host = host;
        this.symbol = symbol;
        this.exportFile = exportFile;
        this.clock = clock;
    }

    /**
     * Start exporting on the host loop: once now, then on every tick and line change.
     */
    public void start(HostLoop hostLoop, Duration interval) {
        if (timer != null) {
            return;
        }
        this.loop = hostLoop;
        host.addLineListener(this);
        timer = hostLoop.scheduleRepeating("line-export", this::export, Duration.ZERO, interval);
        log.info("Exporting {} lines to {} every {}s", symbol, exportFile, interval.toSeconds());
    }

    public void stop() {
        host.removeLineListener(this);
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    @Override
    public void onLineChanged(LineChangeEvent event) {
        if (loop == null || loop.isShutdown()) {
            export();
            return;
        }
        if (exportQueued.compareAndSet(false, true)) {
            loop.submit("line-export", this::runQueuedExport);
        }
    }

    private void runQueuedExport() {
        // Cleared first so a change made during this export queues another one
        exportQueued.set(false);
        export();
    }

    /**
     * Collect the current user-authored lines and overwrite the export file.
     *
     * @return the written export, or null if it could not be written
     */
    public LineExport export() {
        LineExport export = collect();
        try {
            JsonFiles.writeAtomically(mapper, exportFile, export);
        } catch (IOException e) {
            log.error("Failed to write line export {}: {}", exportFile, e.getMessage());
            return null;
        }

        int count = export.lines().size();
        if (count != lastCount) {
            log.info("Exported {} horizontal lines for {} (was {})", count, symbol, Math.max(lastCount, 0));
            lastCount = count;
        }
        return export;
    }

    /**
     * Build the export without writing it.
     */
    public LineExport collect() {
        List<Surface> surfaces = host.openSurfaces().stream()
            .filter(s -> s.shows(symbol))
            .sorted(Comparator.comparingLong(Surface::handle))
            .toList();

        Map<String, ExportedLine> byName = new LinkedHashMap<>();
        for (Surface surface : surfaces) {
            List<HorizontalLine> lines;
            try {
                lines = host.lines(surface.handle());
            } catch (HostException e) {
                log.warn("Cannot read lines of {} (error {}): {}",
                    surface.describe(), e.getErrorCode(), e.getMessage());
                continue;
            }
            for (HorizontalLine line : lines) {
                if (MirrorNames.isMirror(line.name())) {
                    continue;
                }
                String name = line.name() + "_" + surface.handle();
                byName.putIfAbsent(name, new ExportedLine(name, roundPrice(line.price()), line.colorHex()));
            }
        }

        return new LineExport(symbol,
            LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS),
            new ArrayList<>(byName.values()));
    }

    static BigDecimal roundPrice(double price) {
        return BigDecimal.valueOf(price).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Line count of the last successful export, -1 before the first one.
     */
    public int getLastCount() {
        return lastCount;
    }

    public Path getExportFile() {
        return exportFile;
    }
}
