package com.signalsim.backtest.model;

import com.signalsim.backtest.config.SimulationConfig;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Output of one simulation run: one row per input bar and every trade in
 * the order it was opened.
 */
@Value
@Builder
public class SimulationResult {

    SimulationConfig config;

    @Singular
    List<ResultRow> rows;

    @Singular
    List<Trade> trades;

    public double getInitialCapital() {
        return config.getInitialCapital();
    }

    /**
     * Get final equity
     * @return equity of the last row
     */
    public double getFinalEquity() {
        return rows.isEmpty() ? config.getInitialCapital() : rows.get(rows.size() - 1).getEquity();
    }

    public double[] getEquityCurve() {
        return rows.stream().mapToDouble(ResultRow::getEquity).toArray();
    }

    public double[] getReturns() {
        return rows.stream().mapToDouble(ResultRow::getReturns).toArray();
    }

    /**
     * Closed trades in chronological order
     * @return completed trades
     */
    public List<CompletedTrade> getCompletedTrades() {
        return trades.stream()
            .filter(Trade::isCompleted)
            .map(CompletedTrade.class::cast)
            .collect(Collectors.toList());
    }

    /**
     * The trade still open at the end of the run, if any
     * @return open trade
     */
    public Optional<OpenTrade> getOpenTrade() {
        if (trades.isEmpty()) {
            return Optional.empty();
        }
        Trade last = trades.get(trades.size() - 1);
        return last.isCompleted() ? Optional.empty() : Optional.of((OpenTrade) last);
    }
}
