package com.signalsim.backtest.engine;

import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.model.Bar;
import com.signalsim.backtest.model.CompletedTrade;
import com.signalsim.backtest.model.Direction;
import com.signalsim.backtest.model.ExitReason;
import com.signalsim.backtest.model.OpenTrade;
import com.signalsim.backtest.model.ResultRow;
import com.signalsim.backtest.model.SimulationResult;
import com.signalsim.backtest.model.Trade;
import com.signalsim.backtest.util.BarSeriesValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Core backtesting engine: replays bars against their signals one at a time,
 * keeping a single position and the account cash in step.
 * <p>
 * The simulator keeps no per-run state in fields, so one instance can serve
 * concurrent runs.
 */
@Slf4j
public class PositionSimulator {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.of("UTC"));

    private final BarSeriesValidator validator;

    public PositionSimulator() {
        this(new BarSeriesValidator());
    }

    public PositionSimulator(BarSeriesValidator validator) {
        this.validator = validator;
    }

    /**
     * Run the simulation
     * @param bars strictly time-ordered bars with signals
     * @param config simulation settings
     * @return one row per bar and all trades in opening order
     * @throws ConfigException if the config is invalid or there are no bars
     * @throws DataException if a bar breaks the input contract
     */
    public SimulationResult run(List<Bar> bars, SimulationConfig config) {
        if (config == null) {
            throw new ConfigException("simulation config is required");
        }
        config.validate();
        if (bars == null || bars.isEmpty()) {
            throw new ConfigException("bar series must not be empty");
        }
        validator.validate(bars);

        log.info("Starting simulation: {} bars, initial capital {}", bars.size(), config.getInitialCapital());

        TradeState state = TradeState.flat(config.getInitialCapital());
        List<ResultRow> rows = new ArrayList<>(bars.size());
        List<Trade> trades = new ArrayList<>();
        double previousEquity = config.getInitialCapital();

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            int signal = bar.getSignal();
            ResultRow.ResultRowBuilder row = ResultRow.builder()
                .timestamp(bar.getTimestamp())
                .close(bar.getClose())
                .signal(signal);
            double barCommission = 0.0;

            if (state.isInPosition()) {
                state.incrementHoldingPeriods();
            }

            ExitReason trigger = checkExit(state, bar.getClose(), config);

            if (state.isInPosition() && (trigger != null || signal == -state.getPosition() || signal == 0)) {
                CompletedTrade closed = closePosition(state, bar, trigger != null ? trigger : ExitReason.SIGNAL, config);
                trades.set(trades.size() - 1, closed);
                row.exitPrice(closed.getExitPrice())
                    .exitDate(closed.getExitDate())
                    .exitReason(closed.getExitReason())
                    .tradeProfit(closed.getProfit());
                barCommission += closed.getExitCommission();
            }

            if (!state.isInPosition() && signal != 0) {
                OpenTrade opened = openPosition(state, bar, Direction.fromSignal(signal), config);
                trades.add(opened);
                row.entryPrice(opened.getEntryPrice())
                    .entryDate(opened.getEntryDate())
                    .shares(opened.getShares())
                    .tradeValue(opened.getTradeValue());
                barCommission += opened.getEntryCommission();
            }

            state.setCurrentEquity(state.getCurrentCapital() + state.getUnrealizedProfit(bar.getClose()));

            double returns = 0.0;
            if (i > 0 && previousEquity > 0) {
                returns = state.getCurrentEquity() / previousEquity - 1;
            }
            previousEquity = state.getCurrentEquity();

            rows.add(row
                .position(state.getPosition())
                .holdingPeriods(state.getHoldingPeriods())
                .capital(state.getCurrentCapital())
                .equity(state.getCurrentEquity())
                .returns(returns)
                .commission(barCommission)
                .build());
        }

        SimulationResult result = SimulationResult.builder()
            .config(config)
            .rows(rows)
            .trades(trades)
            .build();

        log.info("Simulation completed: {} trades, final equity {}",
            trades.size(), String.format("%.2f", result.getFinalEquity()));

        return result;
    }

    /**
     * Evaluate exit rules in priority order; the first match wins
     * @return fired rule, or null if none fired or the account is flat
     */
    private ExitReason checkExit(TradeState state, double close, SimulationConfig config) {
        if (!state.isInPosition()) {
            return null;
        }
        if (config.getStopLossPct() != null && state.isStopLossHit(close, config.getStopLossPct())) {
            return ExitReason.STOP_LOSS;
        }
        if (config.getTakeProfitPct() != null && state.isTakeProfitHit(close, config.getTakeProfitPct())) {
            return ExitReason.TAKE_PROFIT;
        }
        if (config.getMaxHoldingPeriods() != null && state.getHoldingPeriods() >= config.getMaxHoldingPeriods()) {
            return ExitReason.MAX_HOLDING_PERIOD;
        }
        return null;
    }

    /**
     * Open a new position at the bar close, slippage against the new holder
     */
    private OpenTrade openPosition(TradeState state, Bar bar, Direction direction, SimulationConfig config) {
        double entryPrice = direction == Direction.LONG
            ? bar.getClose() * (1 + config.getSlippagePct())
            : bar.getClose() * (1 - config.getSlippagePct());

        double sizingCapital = config.isEnableCompound() ? state.getCurrentCapital() : config.getInitialCapital();
        double targetValue = sizingCapital * config.getPositionSize();
        long shares = targetValue > 0 ? (long) Math.floor(targetValue / entryPrice) : 0L;
        double entryValue = shares * entryPrice;
        double commission = commission(entryValue, config);

        if (direction == Direction.LONG) {
            state.setCurrentCapital(state.getCurrentCapital() - (entryValue + commission));
        } else {
            state.setCurrentCapital(state.getCurrentCapital() + (entryValue - commission));
        }

        OpenTrade trade = OpenTrade.builder()
            .entryDate(bar.getTimestamp())
            .entryPrice(entryPrice)
            .direction(direction)
            .shares(shares)
            .tradeValue(entryValue)
            .entryCommission(commission)
            .build();
        state.open(trade);

        log.debug("Opened {} at {} | price {} | shares {} | commission {}",
            direction, format(bar.getTimestamp()), entryPrice, shares, commission);

        return trade;
    }

    /**
     * Close the open position at the bar close, slippage against the holder
     */
    private CompletedTrade closePosition(TradeState state, Bar bar, ExitReason exitReason, SimulationConfig config) {
        boolean isLong = state.getPosition() == 1;
        double exitPrice = isLong
            ? bar.getClose() * (1 - config.getSlippagePct())
            : bar.getClose() * (1 + config.getSlippagePct());

        double exitValue = state.getShares() * exitPrice;
        double commission = commission(exitValue, config);

        double profit;
        if (isLong) {
            state.setCurrentCapital(state.getCurrentCapital() + (exitValue - commission));
            profit = exitValue - state.getEntryValue() - commission;
        } else {
            state.setCurrentCapital(state.getCurrentCapital() - (exitValue + commission));
            profit = state.getEntryValue() - exitValue - commission;
        }

        CompletedTrade trade = state.getOpenTrade().close(
            bar.getTimestamp(), exitPrice, exitReason, commission, profit, state.getHoldingPeriods());

        log.debug("Closed {} at {} | price {} | reason {} | profit {}",
            trade.getDirection(), format(bar.getTimestamp()), exitPrice, exitReason,
            String.format("%.2f", profit));

        state.reset();
        return trade;
    }

    private static double commission(double tradeValue, SimulationConfig config) {
        return Math.max(tradeValue * config.getCommissionPct(), config.getMinCommission());
    }

    private static String format(long timestamp) {
        return DATE_FORMATTER.format(Instant.ofEpochMilli(timestamp));
    }
}
