package com.chartsnap.desk.workspace;

import com.chartsnap.core.engine.MirrorNames;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.model.HorizontalLine;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a workspace to the chart host.
 *
 * <p>Opens the listed charts and reconciles their user-drawn lines with the
 * workspace: missing lines are created, moved lines are moved, changed lines
 * are redrawn and lines no longer listed are deleted. Mirrored lines are never
 * touched. Charts the loader opened earlier and that are no longer listed are
 * closed; charts opened by anyone else are left alone.</p>
 */
public class WorkspaceLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLoader.class);

    private final ChartHost host;
    private final Set<Long> openedByWorkspace = new LinkedHashSet<>();

    public WorkspaceLoader(ChartHost host) {
        this.host = host;
    }

    /**
     * Apply a workspace.
     *
     * @return the charts the workspace now shows
     */
    public List<Surface> apply(Workspace workspace) {
        Map<Long, Surface> applied = new LinkedHashMap<>();

        for (Workspace.ChartEntry entry : workspace.getCharts()) {
            Timeframe timeframe;
            try {
                timeframe = Timeframe.parse(entry.getTimeframe());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping workspace chart {} {}: {}", entry.getSymbol(), entry.getTimeframe(), e.getMessage());
                continue;
            }
            if (entry.getSymbol() == null || entry.getSymbol().isBlank()) {
                log.warn("Skipping workspace chart without a symbol");
                continue;
            }

            Optional<Surface> surface = openChart(entry.getSymbol(), timeframe);
            if (surface.isEmpty()) {
                continue;
            }
            reconcileLines(surface.get(), entry.getLines());
            applied.put(surface.get().handle(), surface.get());
        }

        closeDropped(applied.keySet());
        log.info("Workspace applied: {} charts", applied.size());
        return new ArrayList<>(applied.values());
    }

    private Optional<Surface> openChart(String symbol, Timeframe timeframe) {
        Optional<Surface> existing = host.openSurfaces().stream()
            .filter(s -> s.matches(symbol, timeframe))
            .min(Comparator.comparingLong(Surface::handle));
        if (existing.isPresent()) {
            return existing;
        }
        try {
            Surface opened = host.open(symbol, timeframe);
            openedByWorkspace.add(opened.handle());
            log.info("Opened workspace chart {}", opened.describe());
            return Optional.of(opened);
        } catch (HostException e) {
            log.warn("Cannot open workspace chart {} {} (error {}): {}",
                symbol, timeframe, e.getErrorCode(), e.getMessage());
            return Optional.empty();
        }
    }

    private void reconcileLines(Surface surface, List<Workspace.LineEntry> entries) {
        long handle = surface.handle();
        Map<String, HorizontalLine> desired = new LinkedHashMap<>();
        for (Workspace.LineEntry entry : entries) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                log.warn("Skipping unnamed line on {}", surface.describe());
                continue;
            }
            if (MirrorNames.isMirror(entry.getName())) {
                log.warn("Skipping line '{}' on {}: name is reserved for mirrors", entry.getName(), surface.describe());
                continue;
            }
            desired.putIfAbsent(entry.getName(), entry.toLine());
        }

        try {
            Set<String> seen = new HashSet<>();
            for (HorizontalLine current : host.lines(handle)) {
                if (MirrorNames.isMirror(current.name())) {
                    continue;
                }
                seen.add(current.name());
                HorizontalLine wanted = desired.get(current.name());
                if (wanted == null) {
                    host.deleteLine(handle, current.name());
                } else if (wanted.equals(current)) {
                    continue;
                } else if (wanted.equals(current.withPrice(wanted.price()))) {
                    host.moveLine(handle, current.name(), wanted.price());
                } else {
                    host.deleteLine(handle, current.name());
                    host.createLine(handle, wanted);
                }
            }
            for (HorizontalLine wanted : desired.values()) {
                if (!seen.contains(wanted.name())) {
                    host.createLine(handle, wanted);
                }
            }
        } catch (HostException e) {
            log.warn("Cannot update lines on {} (error {}): {}",
                surface.describe(), e.getErrorCode(), e.getMessage());
        }
    }

    private void closeDropped(Set<Long> keep) {
        List<Long> dropped = new ArrayList<>();
        for (Long handle : openedByWorkspace) {
            if (!keep.contains(handle)) {
                dropped.add(handle);
            }
        }
        for (Long handle : dropped) {
            openedByWorkspace.remove(handle);
            try {
                host.close(handle);
                log.info("Closed chart #{} removed from the workspace", handle);
            } catch (HostException e) {
                log.debug("Chart #{} already closed: {}", handle, e.getMessage());
            }
        }
    }

    /**
     * Handles of charts this loader opened and still owns.
     */
    public Set<Long> getOpenedByWorkspace() {
        return Set.copyOf(openedByWorkspace);
    }
}
