package com.signalsim.backtest.util;

import com.signalsim.backtest.model.Bar;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads bars with their signal from CSV files.
 * Expected header: timestamp,open,high,low,close,volume,signal
 * (an extra datetime_utc column is ignored).
 * Timestamp can be milliseconds, an ISO instant, ISO date-time,
 * yyyy-MM-dd HH:mm:ss or yyyy-MM-dd, all read as UTC.
 * <p>
 * Rows are returned in file order; use {@link BarSeriesValidator#clean(List)}
 * to sort and filter them.
 */
@Slf4j
public class CsvBarLoader {

    private static final DateTimeFormatter DATETIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");
    private static final List<String> REQUIRED_COLUMNS =
        List.of("timestamp", "open", "high", "low", "close", "volume", "signal");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
        Instant::parse,
        s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
        s -> LocalDateTime.parse(s, DATETIME_FORMATTER).toInstant(ZoneOffset.UTC),
        s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    /**
     * Load bars from CSV file
     * @param filePath path to CSV file
     * @return list of bars
     */
    public List<Bar> loadBars(Path filePath) throws IOException {
        log.info("Loading bars from: {}", filePath);

        List<Bar> bars = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(filePath);
             CSVParser csvParser = new CSVParser(reader, CSVFormat.DEFAULT
                 .builder()
                 .setHeader()
                 .setSkipHeaderRecord(true)
                 .setIgnoreHeaderCase(true)
                 .setTrim(true)
                 .build())) {

            Set<String> header = csvParser.getHeaderNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
            List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> !header.contains(column))
                .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new IOException("Missing columns " + missing + " in " + filePath);
            }

            for (CSVRecord record : csvParser) {
                try {
                    bars.add(Bar.builder()
                        .timestamp(parseTimestamp(record.get("timestamp")))
                        .open(Double.parseDouble(record.get("open")))
                        .high(Double.parseDouble(record.get("high")))
                        .low(Double.parseDouble(record.get("low")))
                        .close(Double.parseDouble(record.get("close")))
                        .volume(Double.parseDouble(record.get("volume")))
                        .signal(parseSignal(record.get("signal")))
                        .build());
                } catch (IllegalArgumentException | IllegalStateException e) {
                    log.warn("Failed to parse record at line {}: {}", record.getRecordNumber(), e.getMessage());
                }
            }
        }

        log.info("Loaded {} bars from {}", bars.size(), filePath);

        return bars;
    }

    /**
     * Parse signal column; accepts "1", "-1", "0" and their decimal forms
     */
    private int parseSignal(String value) {
        double parsed = Double.parseDouble(value);
        if (parsed != Math.rint(parsed)) {
            throw new IllegalArgumentException("Signal is not a whole number: " + value);
        }
        return (int) parsed;
    }

    /**
     * Parse timestamp from string
     * @param timestampStr timestamp string
     * @return timestamp in milliseconds
     */
    long parseTimestamp(String timestampStr) {
        if (EPOCH_MILLIS.matcher(timestampStr).matches()) {
            return Long.parseLong(timestampStr);
        }
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(timestampStr).toEpochMilli();
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new IllegalArgumentException("Invalid timestamp format: " + timestampStr, lastError);
    }
}
