package com.chartsnap.charts.data;

import com.chartsnap.core.model.Candle;
import com.chartsnap.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads candles from CSV files laid out as {dataDir}/SYMBOL/TIMEFRAME.csv
 * Format: timestamp,open,high,low,close[,volume] with an optional header line.
 */
public class CsvCandleSource implements CandleSource {

    private static final Logger log = LoggerFactory.getLogger(CsvCandleSource.class);

    private final Path dataDir;

    public CsvCandleSource(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path fileFor(String symbol, Timeframe timeframe) {
        return dataDir.resolve(symbol).resolve(timeframe.getLabel() + ".csv");
    }

    @Override
    public List<Candle> load(String symbol, Timeframe timeframe) throws IOException {
        Path file = fileFor(symbol, timeframe);
        if (!Files.exists(file)) {
            log.debug("No candle file at {}", file);
            return List.of();
        }

        List<Candle> candles = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            boolean firstLine = true;

            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;

                // Skip header line
                if (firstLine && line.startsWith("timestamp")) {
                    firstLine = false;
                    continue;
                }
                firstLine = false;

                try {
                    candles.add(Candle.fromCsv(line));
                } catch (IllegalArgumentException e) {
                    skipped++;
                }
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} invalid lines in {}", skipped, file);
        }
        candles.sort(Comparator.comparingLong(Candle::timestamp));
        return candles;
    }
}
