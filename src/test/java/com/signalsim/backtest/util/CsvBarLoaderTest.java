package com.signalsim.backtest.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signalsim.backtest.model.Bar;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvBarLoaderTest {

    @TempDir
    Path dir;

    private final CsvBarLoader loader = new CsvBarLoader();

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void loadBars_readsRowsInFileOrder() throws IOException {
        Path file = write("bars_AAPL_1d.csv",
                "timestamp,open,high,low,close,volume,signal\n"
                        + "1704153600000,101,103,100,102,1500,-1\n"
                        + "1704067200000,100,102,99,101,1200,1\n");

        List<Bar> bars = loader.loadBars(file);

        assertThat(bars).hasSize(2);
        Bar first = bars.get(0);
        assertThat(first.getTimestamp()).isEqualTo(1_704_153_600_000L);
        assertThat(first.getOpen()).isEqualTo(101);
        assertThat(first.getHigh()).isEqualTo(103);
        assertThat(first.getLow()).isEqualTo(100);
        assertThat(first.getClose()).isEqualTo(102);
        assertThat(first.getVolume()).isEqualTo(1500);
        assertThat(first.getSignal()).isEqualTo(-1);
        assertThat(bars.get(1).getSignal()).isEqualTo(1);
    }

    @Test
    void loadBars_acceptsDecimalSignalsAndExtraColumns() throws IOException {
        Path file = write("bars.csv",
                "Timestamp,datetime_utc,Open,High,Low,Close,Volume,Signal\n"
                        + "2024-01-01,2024-01-01 00:00:00,100,101,99,100,10,1.0\n"
                        + "2024-01-02,2024-01-02 00:00:00,100,101,99,100,10,-0.0\n");

        List<Bar> bars = loader.loadBars(file);

        assertThat(bars).extracting(Bar::getSignal).containsExactly(1, 0);
    }

    @Test
    void loadBars_skipsUnparseableRows() throws IOException {
        Path file = write("bars.csv",
                "timestamp,open,high,low,close,volume,signal\n"
                        + "1704067200000,100,101,99,100,10,1\n"
                        + "not-a-date,100,101,99,100,10,1\n"
                        + "1704153600000,abc,101,99,100,10,1\n"
                        + "1704240000000,100,101,99,100,10,0.5\n"
                        + "1704326400000,100,101,99,100,10,0\n");

        List<Bar> bars = loader.loadBars(file);

        assertThat(bars).extracting(Bar::getTimestamp)
                .containsExactly(1_704_067_200_000L, 1_704_326_400_000L);
    }

    @Test
    void loadBars_failsWhenRequiredColumnIsMissing() throws IOException {
        Path file = write("bars.csv",
                "timestamp,open,high,low,close,volume\n"
                        + "1704067200000,100,101,99,100,10\n");

        assertThatThrownBy(() -> loader.loadBars(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("signal");
    }

    @Test
    void parseTimestamp_supportsAllFormatsAsUtc() {
        long expected = 1_704_067_200_000L;

        assertThat(loader.parseTimestamp("1704067200000")).isEqualTo(expected);
        assertThat(loader.parseTimestamp("2024-01-01T00:00:00Z")).isEqualTo(expected);
        assertThat(loader.parseTimestamp("2024-01-01T00:00:00")).isEqualTo(expected);
        assertThat(loader.parseTimestamp("2024-01-01 00:00:00")).isEqualTo(expected);
        assertThat(loader.parseTimestamp("2024-01-01")).isEqualTo(expected);
        assertThat(loader.parseTimestamp("2024-01-01 09:30:00")).isEqualTo(expected + 34_200_000L);
    }

    @Test
    void parseTimestamp_rejectsUnknownFormat() {
        assertThatThrownBy(() -> loader.parseTimestamp("01/02/2024"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("01/02/2024");
    }
}
