package com.chartsnap.core.export;

import com.chartsnap.core.engine.MirrorNames;
import com.chartsnap.core.io.HostText;
import com.chartsnap.core.io.JsonFiles;
import com.chartsnap.core.model.LineExport;
import com.chartsnap.core.model.LineExport.ExportedLine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a horizontal-line export back for consumers.
 *
 * <p>Skips mirrored lines and lines whose price, rounded to two decimals,
 * repeats an earlier line. Accepts UTF-8 (with or without BOM) and UTF-16
 * files. A missing or unreadable file yields {@link LineExport#empty()}.</p>
 */
public class AnnotationExportReader {

    private static final Logger log = LoggerFactory.getLogger(AnnotationExportReader.class);

    private final Path file;
    private final ObjectMapper mapper = JsonFiles.createMapper();

    public AnnotationExportReader(Path file) {
        this.file = file;
    }

    public LineExport read() {
        if (!Files.exists(file)) {
            log.warn("Horizontal lines file not found: {}", file);
            return LineExport.empty();
        }

        LineExport raw;
        try {
            raw = mapper.readValue(HostText.read(file), LineExport.class);
        } catch (IOException e) {
            log.error("Cannot read horizontal lines from {}: {}", file, e.getMessage());
            return LineExport.empty();
        }

        List<ExportedLine> kept = new ArrayList<>();
        Set<BigDecimal> seenPrices = new HashSet<>();
        for (ExportedLine line : raw.lines()) {
            if (line.name() == null || MirrorNames.isMirror(line.name()) || line.price() == null) {
                continue;
            }
            BigDecimal priceKey = line.price().setScale(2, RoundingMode.HALF_UP);
            if (!seenPrices.add(priceKey)) {
                continue;
            }
            kept.add(line);
        }

        log.debug("Loaded {} horizontal lines from {}", kept.size(), file);
        return new LineExport(raw.symbol(), raw.timestamp(), kept);
    }

    public Path getFile() {
        return file;
    }
}
