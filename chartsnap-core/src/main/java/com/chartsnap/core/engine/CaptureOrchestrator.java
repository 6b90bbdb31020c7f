package com.chartsnap.core.engine;

import com.chartsnap.core.config.SnapConfig;
import com.chartsnap.core.exception.CaptureFailedException;
import com.chartsnap.core.exception.ReportWriteException;
import com.chartsnap.core.exception.RequestUnreadableException;
import com.chartsnap.core.exception.SurfaceUnavailableException;
import com.chartsnap.core.host.ChartHost;
import com.chartsnap.core.io.RequestMarker;
import com.chartsnap.core.model.CaptureResult;
import com.chartsnap.core.model.CycleReport;
import com.chartsnap.core.model.CycleReport.Outcome;
import com.chartsnap.core.model.ResolvedSurface;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Runs one capture cycle per detected request.
 *
 * <pre>
 * Idle -> RequestDetected -> (Resolving -> Syncing -> Capturing) x N -> Reporting -> Cleanup -> Idle
 * </pre>
 *
 * <p>Timeframes are processed strictly in configured order, one at a time. A
 * timeframe whose chart cannot be resolved or captured is skipped; the cycle
 * always attempts every timeframe. The completion descriptor is written only
 * when at least one capture succeeded; otherwise the request marker is left in
 * place so a capable engine (or a later attempt) can pick it up. A descriptor
 * that cannot be written ends the request: the marker is consumed and the
 * request is not retried.</p>
 *
 * <p>An orchestrator built with {@code canCreateSurfaces=false} is the
 * read-only variant: it captures nothing and always defers.</p>
 */
public class CaptureOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CaptureOrchestrator.class);

    private final SnapConfig config;
    private final RequestMarker marker;
    private final SurfaceResolver resolver;
    private final AnnotationSynchronizer synchronizer;
    private final ChartCapturer capturer;
    private final CompletionReporter reporter;
    private final SurfaceReaper reaper;
    private final Sleeper sleeper;

    public CaptureOrchestrator(SnapConfig config, ChartHost host, Sleeper sleeper, Clock clock) {
        this(config, new RequestMarker(config.getRequestMarkerPath()), host, sleeper, clock);
    }

    private CaptureOrchestrator(SnapConfig config, RequestMarker marker, ChartHost host, Sleeper sleeper, Clock clock) {
        this(config,
            marker,
            new SurfaceResolver(host),
            new AnnotationSynchronizer(host),
            new ChartCapturer(host, sleeper, config.getRenderSettleDelayMs()),
            new CompletionReporter(config.getCompletionPath(), marker, config.getOutputPrefix(),
                config.getTerminalDir().toString(), clock),
            new SurfaceReaper(host, sleeper, config.getReaperGraceMs()),
            sleeper);
    }

    public CaptureOrchestrator(SnapConfig config, RequestMarker marker, SurfaceResolver resolver,
                               AnnotationSynchronizer synchronizer, ChartCapturer capturer,
                               CompletionReporter reporter, SurfaceReaper reaper, Sleeper sleeper) {
        this.config = config;
        this.marker = marker;
        this.resolver = resolver;
        this.synchronizer = synchronizer;
        this.capturer = capturer;
        this.reporter = reporter;
        this.reaper = reaper;
        this.sleeper = sleeper;
    }

    /**
     * Run a cycle if a request marker is present.
     */
    public CycleReport runCycle() {
        String symbol = config.getSymbol();
        if (!marker.isPresent()) {
            return CycleReport.idle(symbol);
        }

        String request;
        try {
            request = marker.read();
        } catch (RequestUnreadableException e) {
            log.error("Capture request for {} ignored: {}", symbol, e.getMessage());
            return new CycleReport(symbol, Outcome.REQUEST_UNREADABLE, List.of());
        }
        log.info("Capture request detected for {}: '{}'", symbol, request);

        CycleContext context = new CycleContext(symbol);
        List<Timeframe> timeframes = config.getTimeframeSet();
        CycleReport report;
        try {
            ensureOutputDir();
            for (Timeframe timeframe : timeframes) {
                context.addResult(captureTimeframe(context, timeframe));
            }
            report = finish(context);
        } finally {
            // Charts opened by this cycle are closed whatever the outcome
            reaper.cleanup(context);
        }
        log.info("Capture cycle finished: {}", report.toSummary());
        return report;
    }

    private CaptureResult captureTimeframe(CycleContext context, Timeframe timeframe) {
        String symbol = context.getSymbol();
        if (!config.isCanCreateSurfaces()) {
            log.info("Read-only engine, deferring {} {} to a capable engine", symbol, timeframe);
            return CaptureResult.failed(timeframe, 0, 0, "read-only");
        }

        // Resolving
        Surface surface;
        try {
            ResolvedSurface resolved = resolver.resolve(symbol, timeframe, context);
            surface = resolved.surface();
        } catch (SurfaceUnavailableException e) {
            log.warn("Skipping {} {}: chart unavailable (error {}): {}",
                symbol, timeframe, e.getErrorCode(), e.getMessage());
            return CaptureResult.failed(timeframe, 0, e.getErrorCode(), "surface unavailable");
        }

        // Syncing
        int mirrored = synchronizer.sync(surface);
        settle(config.getMirrorSettleDelayMs());

        // Capturing
        Path output = config.artifactPath(symbol, timeframe);
        try {
            capturer.capture(surface, config.getImageWidth(), config.getImageHeight(), output);
            return CaptureResult.captured(timeframe, output, mirrored);
        } catch (CaptureFailedException e) {
            log.warn("Capture of {} {} failed (error {}): {}",
                symbol, timeframe, e.getErrorCode(), e.getMessage());
            return CaptureResult.failed(timeframe, mirrored, e.getErrorCode(), "capture failed");
        }
    }

    private CycleReport finish(CycleContext context) {
        String symbol = context.getSymbol();
        int successCount = context.getSuccessCount();
        List<CaptureResult> results = context.getResults();

        if (successCount == 0) {
            log.warn("No captures succeeded for {}; request marker left for retry", symbol);
            return new CycleReport(symbol, Outcome.NO_CAPTURES_SUCCEEDED, results);
        }

        List<String> attempted = results.stream().map(r -> r.timeframe().getLabel()).toList();
        try {
            reporter.report(symbol, successCount, attempted);
        } catch (ReportWriteException e) {
            // Fatal for this cycle; the request is consumed so polling does not repeat it
            log.error("Captures for {} exist but completion was not reported: {}", symbol, e.getMessage());
            consumeMarker();
            return new CycleReport(symbol, Outcome.REPORT_WRITE_FAILED, results);
        }
        return new CycleReport(symbol, Outcome.COMPLETED, results);
    }

    private void consumeMarker() {
        try {
            marker.consume();
        } catch (IOException e) {
            log.warn("Request marker {} could not be deleted: {}", marker.getPath(), e.getMessage());
        }
    }

    private void ensureOutputDir() {
        try {
            Files.createDirectories(config.getOutputPath());
        } catch (IOException e) {
            log.warn("Cannot create output dir {}: {}", config.getOutputPath(), e.getMessage());
        }
    }

    private void settle(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
