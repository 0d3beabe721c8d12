package com.signalsim.backtest.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BarTest {

    private static Bar.BarBuilder valid() {
        return Bar.builder()
                .timestamp(1_704_067_200_000L)
                .open(100).high(105).low(95).close(102)
                .volume(1_000)
                .signal(1);
    }

    @Test
    void isValid_acceptsWellFormedBar() {
        assertThat(valid().build().isValid()).isTrue();
        assertThat(valid().volume(0).build().isValid()).isTrue();
    }

    @Test
    void isFinite_rejectsNonFiniteAndNonPositiveValues() {
        assertThat(valid().close(Double.NaN).build().isFinite()).isFalse();
        assertThat(valid().high(Double.POSITIVE_INFINITY).build().isFinite()).isFalse();
        assertThat(valid().low(0).build().isFinite()).isFalse();
        assertThat(valid().volume(-1).build().isFinite()).isFalse();
    }

    @Test
    void isConsistent_requiresHighAndLowToBoundOpenAndClose() {
        assertThat(valid().high(101).build().isConsistent()).isFalse();
        assertThat(valid().low(101).build().isConsistent()).isFalse();
        assertThat(valid().high(90).low(95).build().isConsistent()).isFalse();
        assertThat(valid().open(105).close(95).build().isConsistent()).isTrue();
    }

    @Test
    void hasValidSignal_acceptsOnlyMinusOneZeroOne() {
        assertThat(valid().signal(-1).build().hasValidSignal()).isTrue();
        assertThat(valid().signal(0).build().hasValidSignal()).isTrue();
        assertThat(valid().signal(2).build().hasValidSignal()).isFalse();
        assertThat(valid().signal(-2).build().isValid()).isFalse();
    }

    @Test
    void direction_fromSignalMapsSigns() {
        assertThat(Direction.fromSignal(1)).isEqualTo(Direction.LONG);
        assertThat(Direction.fromSignal(-1)).isEqualTo(Direction.SHORT);
        assertThat(Direction.SHORT.getSign()).isEqualTo(-1);
        assertThatThrownBy(() -> Direction.fromSignal(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void openTrade_closeCarriesEntryFieldsAndComputesReturn() {
        OpenTrade open = OpenTrade.builder()
                .entryDate(1L)
                .entryPrice(50)
                .direction(Direction.SHORT)
                .shares(20)
                .tradeValue(1_000)
                .entryCommission(1)
                .build();

        CompletedTrade closed = open.close(2L, 45, ExitReason.TAKE_PROFIT, 0.9, 99.1, 3);

        assertThat(closed.isCompleted()).isTrue();
        assertThat(closed.getDirection()).isEqualTo(Direction.SHORT);
        assertThat(closed.getEntryCommission()).isEqualTo(1);
        assertThat(closed.getReturnPct()).isEqualTo(99.1 / 1_000);
        assertThat(closed.isWinner()).isTrue();
        assertThat(closed.getExitReason().getLabel()).isEqualTo("Take Profit");
        assertThat(open.isCompleted()).isFalse();
    }
}
