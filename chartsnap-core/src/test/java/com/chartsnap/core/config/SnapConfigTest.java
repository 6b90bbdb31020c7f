package com.chartsnap.core.config;

import com.chartsnap.core.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapConfig.
 */
class SnapConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Captures five timeframes from daily down to one minute")
        void defaultTimeframes() {
            SnapConfig config = new SnapConfig();

            assertEquals(List.of(Timeframe.D1, Timeframe.H4, Timeframe.M15, Timeframe.M5, Timeframe.M1),
                config.getTimeframeSet());
            assertEquals("XAUUSDp", config.getSymbol());
            assertEquals(1920, config.getImageWidth());
            assertEquals(1080, config.getImageHeight());
            assertEquals(1, config.getPollIntervalSeconds());
            assertEquals(500, config.getRenderSettleDelayMs());
            assertEquals(700, config.getMirrorSettleDelayMs());
            assertTrue(config.isCanCreateSurfaces());
        }

        @Test
        @DisplayName("Shared files live in the common dir, captures under the terminal files dir")
        void derivedPaths() {
            SnapConfig config = new SnapConfig();
            config.setTerminalPath(tempDir.resolve("terminal").toString());
            config.setCommonDir(tempDir.resolve("common").toString());

            assertEquals(tempDir.resolve("common/screenshot_request.txt"), config.getRequestMarkerPath());
            assertEquals(tempDir.resolve("common/screenshot_complete.json"), config.getCompletionPath());
            assertEquals(tempDir.resolve("common/horizontal_lines.json"), config.getExportPath());
            assertEquals(tempDir.resolve("terminal/files/chart_XAUUSDp_H4.png"),
                config.artifactPath("XAUUSDp", Timeframe.H4));
        }

        @Test
        @DisplayName("Expands ~ to the home directory")
        void expandsHome() {
            SnapConfig config = new SnapConfig();
            config.setDataDir("~/charts");

            assertEquals(Path.of(System.getProperty("user.home"), "charts"), config.getDataPath());
        }
    }

    @Nested
    @DisplayName("Timeframes and formats")
    class TimeframesAndFormats {

        @Test
        @DisplayName("Skips unknown names and repeats, keeping configured order")
        void filtersTimeframes() {
            SnapConfig config = new SnapConfig();
            config.setTimeframes(List.of("M1", "H2", "h1", "M1", "D1"));

            assertEquals(List.of(Timeframe.M1, Timeframe.H1, Timeframe.D1), config.getTimeframeSet());
        }

        @Test
        @DisplayName("Falls back to the defaults when nothing valid is configured")
        void emptyFallsBack() {
            SnapConfig config = new SnapConfig();
            config.setTimeframes(List.of("bogus"));

            assertEquals(5, config.getTimeframeSet().size());
        }

        @Test
        @DisplayName("Uses jpg for jpeg formats and png otherwise")
        void imageExtension() {
            SnapConfig config = new SnapConfig();
            config.setOutputDir(tempDir.toString());

            config.setImageFormat("JPEG");
            assertEquals("jpg", config.getImageExtension());
            assertEquals(tempDir.resolve("chart_EURUSD_M5.jpg"), config.artifactPath("EURUSD", Timeframe.M5));

            config.setImageFormat("bmp");
            assertEquals("png", config.getImageExtension());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("Loads values from YAML and keeps defaults for the rest")
        void loadsYaml() throws Exception {
            // Given
            Path file = tempDir.resolve("snap-config.yaml");
            Files.writeString(file, String.join("\n",
                "symbol: EURUSD",
                "imageWidth: 1280",
                "timeframes: [H1, M5]",
                "canCreateSurfaces: false",
                "someFutureKey: 42",
                ""));

            // When
            SnapConfig config = SnapConfig.load(file);

            // Then
            assertEquals("EURUSD", config.getSymbol());
            assertEquals(1280, config.getImageWidth());
            assertEquals(1080, config.getImageHeight());
            assertEquals(List.of(Timeframe.H1, Timeframe.M5), config.getTimeframeSet());
            assertFalse(config.isCanCreateSurfaces());
        }

        @Test
        @DisplayName("Reads timeframeSet as the list of timeframes to capture")
        void loadsTimeframeSetKey() throws Exception {
            // Given
            Path file = tempDir.resolve("snap-config.yaml");
            Files.writeString(file, String.join("\n",
                "symbol: XAUUSDp",
                "timeframeSet: [H1]",
                ""));

            // When
            SnapConfig config = SnapConfig.load(file);

            // Then
            assertEquals(List.of(Timeframe.H1), config.getTimeframeSet());
            assertEquals(List.of("H1"), config.getTimeframes());
        }

        @Test
        @DisplayName("Saves timeframes under a single key")
        void savesTimeframesOnce() throws Exception {
            // Given
            Path file = tempDir.resolve("snap-config.yaml");
            SnapConfig config = new SnapConfig();
            config.setTimeframeSet(List.of("M15", "M1"));

            // When
            config.save(file);
            String yaml = Files.readString(file);

            // Then
            assertTrue(yaml.contains("timeframes:"));
            assertFalse(yaml.contains("timeframeSet"));
            assertEquals(List.of(Timeframe.M15, Timeframe.M1), SnapConfig.load(file).getTimeframeSet());
        }

        @Test
        @DisplayName("Missing or malformed files yield defaults")
        void missingOrMalformed() throws Exception {
            assertEquals("XAUUSDp", SnapConfig.load(tempDir.resolve("absent.yaml")).getSymbol());

            Path broken = tempDir.resolve("broken.yaml");
            Files.writeString(broken, "symbol: [unclosed");
            assertEquals("XAUUSDp", SnapConfig.load(broken).getSymbol());
        }

        @Test
        @DisplayName("Saved config loads back")
        void saveAndLoad() {
            // Given
            Path file = tempDir.resolve("conf/snap-config.yaml");
            SnapConfig config = new SnapConfig();
            config.setSymbol("BTCUSD");
            config.setTimeframes(List.of("H4"));
            config.setReaperGraceMs(250);

            // When
            config.save(file);
            SnapConfig loaded = SnapConfig.load(file);

            // Then
            assertEquals("BTCUSD", loaded.getSymbol());
            assertEquals(List.of(Timeframe.H4), loaded.getTimeframeSet());
            assertEquals(250, loaded.getReaperGraceMs());
        }
    }
}
