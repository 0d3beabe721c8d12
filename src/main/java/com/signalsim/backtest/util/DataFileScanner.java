package com.signalsim.backtest.util;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Scans data directory for bar CSV files.
 * Supports pattern: bars_SYMBOL_TIMEFRAME.csv
 */
@Slf4j
public class DataFileScanner {

    public static final String DEFAULT_TIMEFRAME = "1d";

    // Pattern: bars_SYMBOL_TIMEFRAME.csv (e.g., bars_AAPL_1d.csv)
    // Also supports: bars_SYMBOL.csv (defaults to 1d)
    private static final Pattern FILENAME_PATTERN = Pattern.compile("bars_([A-Za-z0-9.\\-]+)(?:_([a-zA-Z0-9]+))?\\.csv");

    /**
     * Scan directory for bar files
     * @param dataDir data directory path
     * @return list of discovered data files
     */
    public List<DataFileInfo> scanDataDirectory(Path dataDir) throws IOException {
        if (!Files.exists(dataDir)) {
            log.warn("Data directory does not exist: {}", dataDir);
            return new ArrayList<>();
        }

        if (!Files.isDirectory(dataDir)) {
            log.error("Path is not a directory: {}", dataDir);
            return new ArrayList<>();
        }

        List<DataFileInfo> dataFiles = new ArrayList<>();

        try (Stream<Path> files = Files.list(dataDir)) {
            files.filter(Files::isRegularFile)
                .forEach(path -> {
                    String filename = path.getFileName().toString();
                    Matcher matcher = FILENAME_PATTERN.matcher(filename);

                    if (matcher.matches()) {
                        String timeframe = matcher.group(2) != null ? matcher.group(2) : DEFAULT_TIMEFRAME;
                        dataFiles.add(DataFileInfo.builder()
                            .filePath(path)
                            .symbol(matcher.group(1))
                            .timeframe(timeframe)
                            .build());
                        log.debug("Found data file: {} - {} timeframe {}", filename, matcher.group(1), timeframe);
                    } else {
                        log.debug("Skipping non-matching file: {}", filename);
                    }
                });
        }

        dataFiles.sort(Comparator.comparing(DataFileInfo::getSymbol)
            .thenComparing(DataFileInfo::getTimeframe));

        log.info("Discovered {} data files in {}", dataFiles.size(), dataDir);

        return dataFiles;
    }

    /**
     * Information about a discovered data file
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DataFileInfo {
        private Path filePath;
        private String symbol;
        private String timeframe;

        /**
         * @return label used for reports, e.g. AAPL_1d
         */
        public String getLabel() {
            return symbol + "_" + timeframe;
        }

        @Override
        public String toString() {
            return String.format("%s - %s (%s)", symbol, timeframe, filePath);
        }
    }
}
