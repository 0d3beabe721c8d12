package com.signalsim.backtest.util;

import com.signalsim.backtest.engine.DataException;
import com.signalsim.backtest.model.Bar;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bar series quality checks.
 * <p>
 * {@link #clean(List)} is the provider-side pre-processing step: it repairs a
 * raw series by dropping unusable bars and ordering the rest.
 * {@link #validate(List)} is the strict contract check run before a simulation;
 * it never repairs anything.
 */
@Slf4j
public class BarSeriesValidator {

    /**
     * Drop non-finite, inconsistent and unknown-signal bars, sort by time and
     * drop duplicate timestamps (first one wins).
     * @param rawBars bars as loaded
     * @return clean, strictly time-ordered bars
     */
    public List<Bar> clean(List<Bar> rawBars) {
        if (rawBars == null || rawBars.isEmpty()) {
            log.warn("Received empty bar series");
            return new ArrayList<>();
        }

        int nonFinite = 0;
        int inconsistent = 0;
        int badSignal = 0;
        List<Bar> kept = new ArrayList<>(rawBars.size());

        for (Bar bar : rawBars) {
            if (bar == null || !bar.isFinite()) {
                nonFinite++;
            } else if (!bar.isConsistent()) {
                inconsistent++;
            } else if (!bar.hasValidSignal()) {
                badSignal++;
            } else {
                kept.add(bar);
            }
        }

        if (nonFinite > 0) {
            log.warn("Dropped {} bars with non-finite or non-positive values", nonFinite);
        }
        if (inconsistent > 0) {
            log.warn("Dropped {} bars violating high/low consistency", inconsistent);
        }
        if (badSignal > 0) {
            log.warn("Dropped {} bars with a signal outside -1/0/1", badSignal);
        }

        kept.sort(Comparator.comparingLong(Bar::getTimestamp));

        List<Bar> cleaned = new ArrayList<>(kept.size());
        int duplicates = 0;
        for (Bar bar : kept) {
            if (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).getTimestamp() == bar.getTimestamp()) {
                duplicates++;
                continue;
            }
            cleaned.add(bar);
        }
        if (duplicates > 0) {
            log.warn("Dropped {} bars with duplicate timestamps", duplicates);
        }

        log.info("Bar pre-processing complete: {} of {} bars kept", cleaned.size(), rawBars.size());
        return cleaned;
    }

    /**
     * Fail on the first bar breaking the simulator's input contract.
     * @param bars bars about to be simulated
     * @throws DataException naming the offending bar
     */
    public void validate(List<Bar> bars) {
        long previousTimestamp = Long.MIN_VALUE;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new DataException(i, "bar is null");
            }
            if (!bar.isFinite()) {
                throw new DataException(i, "non-finite or non-positive value " + bar);
            }
            if (!bar.isConsistent()) {
                throw new DataException(i, "OHLC values are inconsistent " + bar);
            }
            if (!bar.hasValidSignal()) {
                throw new DataException(i, "signal must be -1, 0 or 1, got " + bar.getSignal());
            }
            if (i > 0 && bar.getTimestamp() <= previousTimestamp) {
                throw new DataException(i, "timestamp " + bar.getTimestamp()
                    + " is not after previous " + previousTimestamp);
            }
            previousTimestamp = bar.getTimestamp();
        }
    }
}
