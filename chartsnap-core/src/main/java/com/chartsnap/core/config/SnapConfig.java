package com.chartsnap.core.config;

import com.chartsnap.core.model.Timeframe;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for ChartSnap.
 * Stored in ~/.chartsnap/snap-config.yaml
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapConfig.class);
    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);
        YAML = new ObjectMapper(factory);
    }

    public static final Path SNAP_DIR = Path.of(System.getProperty("user.home"), ".chartsnap");
    public static final Path CONFIG_FILE = SNAP_DIR.resolve("snap-config.yaml");

    public static final List<String> DEFAULT_TIMEFRAMES = List.of("D1", "H4", "M15", "M5", "M1");

    // Instrument whose charts are captured and exported
    private String symbol = "XAUUSDp";

    // Host storage: terminal root (reported to consumers), shared dir for marker/descriptor/export
    private String terminalPath = "~/.chartsnap/terminal";
    private String commonDir = "~/.chartsnap/common";
    // Capture artifacts; blank means <terminalPath>/files
    private String outputDir = "";
    private String dataDir = "~/.chartsnap/data";
    private String workspaceFile = "~/.chartsnap/workspace.yaml";

    private int pollIntervalSeconds = 1;

    // Capture
    private int imageWidth = 1920;
    private int imageHeight = 1080;
    private String imageFormat = "png";
    private String outputPrefix = "chart_";
    private List<String> timeframes = new ArrayList<>(DEFAULT_TIMEFRAMES);

    // File names in the common dir
    private String requestMarkerName = "screenshot_request.txt";
    private String completionFileName = "screenshot_complete.json";
    private String exportFileName = "horizontal_lines.json";

    // Timing
    private long renderSettleDelayMs = 500;
    private long mirrorSettleDelayMs = 700;
    private long reaperGraceMs = 1000;

    // False for a read-only engine that cannot open charts and always defers
    private boolean canCreateSurfaces = true;

    public SnapConfig() {
    }

    // ===== Properties =====

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getTerminalPath() {
        return terminalPath;
    }

    public void setTerminalPath(String terminalPath) {
        this.terminalPath = terminalPath;
    }

    public String getCommonDir() {
        return commonDir;
    }

    public void setCommonDir(String commonDir) {
        this.commonDir = commonDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getWorkspaceFile() {
        return workspaceFile;
    }

    public void setWorkspaceFile(String workspaceFile) {
        this.workspaceFile = workspaceFile;
    }

    public int getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(int pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public void setImageWidth(int imageWidth) {
        this.imageWidth = imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    public void setImageHeight(int imageHeight) {
        this.imageHeight = imageHeight;
    }

    public String getImageFormat() {
        return imageFormat;
    }

    public void setImageFormat(String imageFormat) {
        this.imageFormat = imageFormat;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    public void setOutputPrefix(String outputPrefix) {
        this.outputPrefix = outputPrefix;
    }

    public List<String> getTimeframes() {
        return timeframes;
    }

    public void setTimeframes(List<String> timeframes) {
        this.timeframes = timeframes;
    }

    /**
     * Accepts {@code timeframeSet} as a synonym for {@code timeframes} when reading config.
     */
    @JsonProperty("timeframeSet")
    public void setTimeframeSet(List<String> timeframeSet) {
        this.timeframes = timeframeSet;
    }

    public String getRequestMarkerName() {
        return requestMarkerName;
    }

    public void setRequestMarkerName(String requestMarkerName) {
        this.requestMarkerName = requestMarkerName;
    }

    public String getCompletionFileName() {
        return completionFileName;
    }

    public void setCompletionFileName(String completionFileName) {
        this.completionFileName = completionFileName;
    }

    public String getExportFileName() {
        return exportFileName;
    }

    public void setExportFileName(String exportFileName) {
        this.exportFileName = exportFileName;
    }

    public long getRenderSettleDelayMs() {
        return renderSettleDelayMs;
    }

    public void setRenderSettleDelayMs(long renderSettleDelayMs) {
        this.renderSettleDelayMs = renderSettleDelayMs;
    }

    public long getMirrorSettleDelayMs() {
        return mirrorSettleDelayMs;
    }

    public void setMirrorSettleDelayMs(long mirrorSettleDelayMs) {
        this.mirrorSettleDelayMs = mirrorSettleDelayMs;
    }

    public long getReaperGraceMs() {
        return reaperGraceMs;
    }

    public void setReaperGraceMs(long reaperGraceMs) {
        this.reaperGraceMs = reaperGraceMs;
    }

    public boolean isCanCreateSurfaces() {
        return canCreateSurfaces;
    }

    public void setCanCreateSurfaces(boolean canCreateSurfaces) {
        this.canCreateSurfaces = canCreateSurfaces;
    }

    // ===== Derived values =====

    /**
     * Configured timeframes in capture order. Unknown names are skipped with a
     * warning and repeats are dropped; an empty result falls back to the defaults.
     */
    @JsonIgnore
    public List<Timeframe> getTimeframeSet() {
        Set<Timeframe> parsed = new LinkedHashSet<>();
        if (timeframes != null) {
            for (String name : timeframes) {
                try {
                    parsed.add(Timeframe.parse(name));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring timeframe '{}': {}", name, e.getMessage());
                }
            }
        }
        if (parsed.isEmpty()) {
            return DEFAULT_TIMEFRAMES.stream().map(Timeframe::parse).toList();
        }
        return List.copyOf(parsed);
    }

    @JsonIgnore
    public Path getTerminalDir() {
        return expand(terminalPath);
    }

    @JsonIgnore
    public Path getCommonPath() {
        return expand(commonDir);
    }

    @JsonIgnore
    public Path getOutputPath() {
        if (outputDir == null || outputDir.isBlank()) {
            return getTerminalDir().resolve("files");
        }
        return expand(outputDir);
    }

    @JsonIgnore
    public Path getDataPath() {
        return expand(dataDir);
    }

    @JsonIgnore
    public Path getWorkspacePath() {
        return expand(workspaceFile);
    }

    @JsonIgnore
    public Path getRequestMarkerPath() {
        return getCommonPath().resolve(requestMarkerName);
    }

    @JsonIgnore
    public Path getCompletionPath() {
        return getCommonPath().resolve(completionFileName);
    }

    @JsonIgnore
    public Path getExportPath() {
        return getCommonPath().resolve(exportFileName);
    }

    /**
     * Image file extension, "png" unless "jpg"/"jpeg" is configured.
     */
    @JsonIgnore
    public String getImageExtension() {
        String format = imageFormat != null ? imageFormat.trim().toLowerCase() : "";
        return switch (format) {
            case "jpg", "jpeg" -> "jpg";
            default -> "png";
        };
    }

    /**
     * Filename prefix for one symbol's captures, e.g. "chart_XAUUSDp_".
     */
    public String symbolPrefix(String forSymbol) {
        return outputPrefix + forSymbol + "_";
    }

    /**
     * Capture artifact path, e.g. files/chart_XAUUSDp_H4.png
     */
    public Path artifactPath(String forSymbol, Timeframe timeframe) {
        return getOutputPath().resolve(symbolPrefix(forSymbol) + timeframe.getLabel() + "." + getImageExtension());
    }

    private static Path expand(String path) {
        // Expand ~ if present
        if (path.startsWith("~")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return Path.of(path);
    }

    // ===== Persistence =====

    /**
     * Load config from the default file or create it with defaults.
     */
    public static SnapConfig load() {
        try {
            if (Files.exists(CONFIG_FILE)) {
                return YAML.readValue(CONFIG_FILE.toFile(), SnapConfig.class);
            }
        } catch (IOException e) {
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
        }
        return createDefault();
    }

    /**
     * Load config from a specific file. Missing or malformed files yield defaults.
     */
    public static SnapConfig load(Path file) {
        try {
            if (Files.exists(file)) {
                return YAML.readValue(file.toFile(), SnapConfig.class);
            }
            log.warn("Config {} not found, using defaults", file);
        } catch (IOException e) {
            log.warn("Failed to load config {}, using defaults: {}", file, e.getMessage());
        }
        return new SnapConfig();
    }

    /**
     * Save config to a file.
     */
    public void save(Path file) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            YAML.writeValue(file.toFile(), this);
        } catch (IOException e) {
            log.error("Failed to save config: {}", e.getMessage());
        }
    }

    /**
     * Create and save default config.
     */
    public static SnapConfig createDefault() {
        SnapConfig config = new SnapConfig();
        config.save(CONFIG_FILE);
        return config;
    }
}
