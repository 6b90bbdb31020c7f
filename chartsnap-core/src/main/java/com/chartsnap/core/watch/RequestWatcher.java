package com.chartsnap.core.watch;

import com.chartsnap.core.host.HostLoop;
import com.chartsnap.core.model.CycleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Triggers a capture cycle when the request marker appears.
 *
 * <p>Polls for the marker on the host loop at a fixed rate, and additionally
 * watches the marker's directory so a newly created marker is picked up
 * without waiting for the next tick. A tick that arrives while a cycle is
 * still running is skipped.</p>
 */
public class RequestWatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestWatcher.class);

    private final Path markerFile;
    private final Supplier<CycleReport> cycle;
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);

    private HostLoop loop;
    private ScheduledFuture<?> pollTask;
    private FileChangeWatcher fileWatcher;
    private volatile boolean running = false;

    public RequestWatcher(Path markerFile, Supplier<CycleReport> cycle) {
        this.markerFile = markerFile;
        this.cycle = cycle;
    }

    /**
     * Start polling on the host loop and watching the marker directory.
     */
    public void start(HostLoop hostLoop, Duration pollInterval) {
        if (running) {
            return;
        }
        this.loop = hostLoop;
        pollTask = hostLoop.scheduleRepeating("request-poll", this::tick, pollInterval, pollInterval);
        running = true;
        startDirectoryWatch();
        log.info("Watching for capture requests at {} (poll every {}s)", markerFile, pollInterval.toSeconds());
    }

    private void startDirectoryWatch() {
        fileWatcher = new FileChangeWatcher(markerFile, "RequestWatcher", path -> onMarkerWritten());
        try {
            fileWatcher.start();
        } catch (IOException e) {
            // Polling alone still detects requests
            log.warn("Cannot watch {}, relying on polling: {}", markerFile.toAbsolutePath().getParent(), e.getMessage());
            fileWatcher = null;
        }
    }

    private void onMarkerWritten() {
        if (loop != null && !loop.isShutdown()) {
            loop.submit("request-event", this::tick);
        }
    }

    /**
     * One check for a pending request. Runs a cycle if the marker exists and no cycle is in progress.
     *
     * @return the cycle report, or null if nothing ran
     */
    public CycleReport tick() {
        if (!Files.exists(markerFile)) {
            return null;
        }
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Capture cycle already running, skipping tick");
            return null;
        }
        try {
            return cycle.get();
        } finally {
            cycleRunning.set(false);
        }
    }

    public void stop() {
        running = false;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (fileWatcher != null) {
            fileWatcher.stop();
            fileWatcher = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }
}
