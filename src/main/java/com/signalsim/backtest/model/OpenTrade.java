package com.signalsim.backtest.model;

import lombok.Builder;
import lombok.Value;

/**
 * A position that hasn't been closed yet.
 */
@Value
@Builder
public class OpenTrade implements Trade {

    long entryDate;
    double entryPrice;
    Direction direction;
    long shares;
    double tradeValue;
    double entryCommission;

    @Override
    public boolean isCompleted() {
        return false;
    }

    /**
     * Close this trade and produce its completed record.
     * @param exitDate exit timestamp
     * @param exitPrice exit fill price, slippage included
     * @param exitReason rule or signal that closed the trade
     * @param exitCommission commission charged on exit
     * @param profit realized profit after exit commission
     * @param holdingPeriods bars held
     * @return completed trade
     */
    public CompletedTrade close(long exitDate, double exitPrice, ExitReason exitReason,
                                double exitCommission, double profit, int holdingPeriods) {
        return CompletedTrade.builder()
            .entryDate(entryDate)
            .entryPrice(entryPrice)
            .direction(direction)
            .shares(shares)
            .tradeValue(tradeValue)
            .entryCommission(entryCommission)
            .exitDate(exitDate)
            .exitPrice(exitPrice)
            .exitReason(exitReason)
            .exitCommission(exitCommission)
            .profit(profit)
            .returnPct(tradeValue > 0 ? profit / tradeValue : 0.0)
            .holdingPeriods(holdingPeriods)
            .build();
    }
}
