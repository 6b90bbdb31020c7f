package com.chartsnap.desk;

import com.chartsnap.charts.data.CsvCandleSource;
import com.chartsnap.charts.host.JFreeChartHost;
import com.chartsnap.core.config.SnapConfig;
import com.chartsnap.core.engine.CaptureOrchestrator;
import com.chartsnap.core.engine.Sleeper;
import com.chartsnap.core.export.AnnotationExporter;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.host.HostLoop;
import com.chartsnap.core.watch.RequestWatcher;
import com.chartsnap.desk.workspace.Workspace;
import com.chartsnap.desk.workspace.WorkspaceLoader;
import com.chartsnap.desk.workspace.WorkspaceWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * ChartSnap - headless chart host with on-request multi-timeframe capture.
 *
 * Architecture:
 * - Charts: off-screen JFreeChart charts fed from {dataDir}/SYMBOL/TF.csv
 * - Workspace: ~/.chartsnap/workspace.yaml, the user's charts and lines
 * - Requests: marker file in the common dir, answered with a completion JSON
 * - Export: user lines of the configured symbol, rewritten on every change
 *
 * Every host callback runs on one {@link HostLoop} thread.
 */
public class ChartSnapApp {

    private static final Logger log = LoggerFactory.getLogger(ChartSnapApp.class);

    private final SnapConfig config;
    private final ChartHost host;
    private final HostLoop loop;
    private final WorkspaceLoader workspaceLoader;
    private final WorkspaceWatcher workspaceWatcher;
    private final CaptureOrchestrator orchestrator;
    private final RequestWatcher requestWatcher;
    private final AnnotationExporter exporter;

    public ChartSnapApp(SnapConfig config) {
        this(config, new JFreeChartHost(new CsvCandleSource(config.getDataPath())), Sleeper.SYSTEM,
            Clock.systemDefaultZone());
    }

    public ChartSnapApp(SnapConfig config, ChartHost host, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.host = host;
        this.loop = new HostLoop();
        this.workspaceLoader = new WorkspaceLoader(host);
        this.workspaceWatcher = new WorkspaceWatcher(config.getWorkspacePath(),
            () -> loop.submit("workspace-reload", this::reloadWorkspace));
        this.orchestrator = new CaptureOrchestrator(config, host, sleeper, clock);
        this.requestWatcher = new RequestWatcher(config.getRequestMarkerPath(), orchestrator::runCycle);
        this.exporter = new AnnotationExporter(host, config.getSymbol(), config.getExportPath(), clock);
    }

    /**
     * Start the application.
     */
    public void start() {
        log.info("Starting ChartSnap for {}...", config.getSymbol());
        if (!config.isCanCreateSurfaces()) {
            log.warn("Read-only mode: capture requests are left for a capable engine");
        }

        ensureDirectories();

        // Open the user's charts before anything else touches the host
        loop.submit("workspace-load", this::reloadWorkspace);

        Duration poll = Duration.ofSeconds(Math.max(1, config.getPollIntervalSeconds()));
        requestWatcher.start(loop, poll);
        exporter.start(loop, poll);
        workspaceWatcher.start();

        log.info("ChartSnap started (captures to {})", config.getOutputPath());
    }

    private void ensureDirectories() {
        for (Path dir : new Path[]{config.getCommonPath(), config.getOutputPath(), config.getDataPath()}) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                log.error("Failed to create {}: {}", dir, e.getMessage());
            }
        }
    }

    /**
     * Load the workspace file and apply it. Runs on the host loop.
     */
    void reloadWorkspace() {
        Path file = config.getWorkspacePath();
        if (!Files.exists(file)) {
            log.info("No workspace at {}, no charts opened", file);
            return;
        }
        try {
            workspaceLoader.apply(Workspace.load(file));
        } catch (IOException e) {
            log.error("Failed to load workspace {}: {}", file, e.getMessage());
        }
    }

    /**
     * Shutdown the application.
     */
    public void shutdown() {
        log.info("Shutting down ChartSnap...");

        workspaceWatcher.stop();
        requestWatcher.stop();
        exporter.stop();
        loop.close();

        log.info("ChartSnap shutdown complete");
    }

    public ChartHost getHost() {
        return host;
    }

    public HostLoop getLoop() {
        return loop;
    }

    /**
     * Main entry point. An optional argument names the config file.
     */
    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        log.info("ChartSnap v1.0");

        SnapConfig config = args.length > 0 ? SnapConfig.load(Path.of(args[0])) : SnapConfig.load();

        ChartSnapApp app = new ChartSnapApp(config);
        app.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered");
            app.shutdown();
        }, "chartsnap-shutdown"));

        // Host threads are daemons; keep the process alive until interrupted
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
