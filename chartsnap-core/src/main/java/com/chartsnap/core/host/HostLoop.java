package com.chartsnap.core.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single serialized callback thread of the host.
 *
 * <p>Timer ticks, line-change notifications and file-watch events are all
 * dispatched here, so no two callbacks ever run concurrently. A callback that
 * throws is logged and does not cancel its schedule.</p>
 */
public class HostLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HostLoop.class);

    private final ScheduledExecutorService scheduler;

    public HostLoop() {
        this("chartsnap-host");
    }

    public HostLoop(String threadName) {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a callback on the loop as soon as possible.
     */
    public Future<?> submit(String name, Runnable callback) {
        return scheduler.submit(guarded(name, callback));
    }

    /**
     * Run a callback on a fixed timer. Ticks fire at the given rate whether or
     * not the previous callback has finished; a late tick runs right after it.
     */
    public ScheduledFuture<?> scheduleRepeating(String name, Runnable callback, Duration initialDelay, Duration period) {
        log.debug("Scheduling {} every {} ms", name, period.toMillis());
        return scheduler.scheduleAtFixedRate(guarded(name, callback),
            initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Runnable guarded(String name, Runnable callback) {
        return () -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Callback {} failed: {}", name, e.getMessage(), e);
            }
        };
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    /**
     * Stop dispatching and wait briefly for a running callback to finish.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Host loop did not stop within 5s, interrupting");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
