package com.chartsnap.core.engine;

import com.chartsnap.core.exception.ReportWriteException;
import com.chartsnap.core.io.JsonFiles;
import com.chartsnap.core.io.RequestMarker;
import com.chartsnap.core.model.CompletionDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Writes the completion descriptor and consumes the request marker.
 *
 * <p>The descriptor is the authoritative success signal. A marker that
 * cannot be deleted afterwards is only logged.</p>
 */
public class CompletionReporter {

    private static final Logger log = LoggerFactory.getLogger(CompletionReporter.class);

    private final Path completionFile;
    private final RequestMarker marker;
    private final String outputPrefix;
    private final String terminalPath;
    private final Clock clock;
    private final ObjectMapper mapper = JsonFiles.createMapper();

    public CompletionReporter(Path completionFile, RequestMarker marker, String outputPrefix,
                              String terminalPath, Clock clock) {
        this.completionFile = completionFile;
        this.marker = marker;
        this.outputPrefix = outputPrefix;
        this.terminalPath = terminalPath;
        this.clock = clock;
    }

    /**
     * Write the descriptor, then delete the request marker.
     *
     * @throws ReportWriteException if the descriptor cannot be written; the marker is not touched
     */
    public CompletionDescriptor report(String symbol, int successCount, List<String> timeframes)
            throws ReportWriteException {
        CompletionDescriptor descriptor = new CompletionDescriptor(
            symbol,
            successCount,
            List.copyOf(timeframes),
            LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS),
            outputPrefix + symbol + "_",
            terminalPath
        );

        try {
            JsonFiles.writeAtomically(mapper, completionFile, descriptor);
        } catch (IOException e) {
            throw new ReportWriteException("Cannot write completion descriptor " + completionFile + ": " + e.getMessage(), e);
        }
        log.info("Wrote completion for {}: {} captures {}", symbol, successCount, timeframes);

        try {
            marker.consume();
        } catch (IOException e) {
            log.warn("Completion written but request marker {} could not be deleted: {}",
                marker.getPath(), e.getMessage());
        }
        return descriptor;
    }

    public Path getCompletionFile() {
        return completionFile;
    }
}
