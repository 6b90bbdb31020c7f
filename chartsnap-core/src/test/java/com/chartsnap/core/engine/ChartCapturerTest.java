package com.chartsnap.core.engine;

import com.chartsnap.core.exception.CaptureFailedException;
import com.chartsnap.core.host.HostException;
import com.chartsnap.core.host.InMemoryChartHost;
import com.chartsnap.core.model.Surface;
import com.chartsnap.core.model.Timeframe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChartCapturer.
 */
class ChartCapturerTest {

    @TempDir
    Path tempDir;

    private InMemoryChartHost host;
    private RecordingSleeper sleeper;
    private ChartCapturer capturer;

    @BeforeEach
    void setUp() {
        host = new InMemoryChartHost();
        sleeper = new RecordingSleeper();
        capturer = new ChartCapturer(host, sleeper, 500);
    }

    @Test
    @DisplayName("Redraws, settles, then captures right-aligned at the requested size")
    void redrawSettleCapture() throws Exception {
        // Given
        Surface chart = host.addSurface(42, "XAUUSDp", Timeframe.H4);
        Path output = tempDir.resolve("chart_XAUUSDp_H4.png");

        // When
        Path written = capturer.capture(chart, 1920, 1080, output);

        // Then
        assertEquals(output, written);
        assertTrue(Files.exists(output));
        assertEquals(List.of("redraw:42", "capture:42:1920x1080:RIGHT"), host.getCalls());
        assertEquals(List.of(500L), sleeper.getDelays());
    }

    @Test
    @DisplayName("Fails with the host error code and does not retry")
    void failureIsNotRetried() {
        // Given
        Surface chart = host.addSurface(42, "XAUUSDp", Timeframe.M1);
        host.failCapture(Timeframe.M1, HostException.CHART_SCREENSHOT_FAILED);
        Path output = tempDir.resolve("chart_XAUUSDp_M1.png");

        // When
        CaptureFailedException e = assertThrows(CaptureFailedException.class,
            () -> capturer.capture(chart, 800, 600, output));

        // Then
        assertEquals(HostException.CHART_SCREENSHOT_FAILED, e.getErrorCode());
        assertEquals(1, host.getCalls().stream().filter(c -> c.startsWith("capture:")).count());
        assertFalse(Files.exists(output));
    }

    @Test
    @DisplayName("Fails when the chart has been closed")
    void closedChartFails() throws Exception {
        // Given
        Surface chart = host.addSurface(42, "XAUUSDp", Timeframe.M1);
        host.close(42);

        // When/Then
        CaptureFailedException e = assertThrows(CaptureFailedException.class,
            () -> capturer.capture(chart, 800, 600, tempDir.resolve("x.png")));
        assertEquals(HostException.CHART_WRONG_ID, e.getErrorCode());
    }
}
