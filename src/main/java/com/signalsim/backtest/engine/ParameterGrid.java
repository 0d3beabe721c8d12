package com.signalsim.backtest.engine;

import com.signalsim.backtest.config.SimulationConfig;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Cartesian grid of simulation parameters applied on top of a base config.
 * Axes are expanded in declaration order with the last axis varying fastest.
 * A {@code null} value on an optional axis means "rule disabled".
 */
public class ParameterGrid {

    private final List<Axis<?>> axes = new ArrayList<>();

    /**
     * Add an axis
     * @param name parameter name used in results
     * @param values candidate values, at least one
     * @param setter applies one value to a config builder
     * @return this grid
     */
    public <T> ParameterGrid axis(String name, List<T> values,
                                  BiFunction<SimulationConfig.SimulationConfigBuilder, T, SimulationConfig.SimulationConfigBuilder> setter) {
        if (values == null || values.isEmpty()) {
            throw new ConfigException("grid axis " + name + " has no values");
        }
        axes.add(new Axis<>(name, Collections.unmodifiableList(new ArrayList<>(values)), setter));
        return this;
    }

    public ParameterGrid positionSize(Double... values) {
        return axis("positionSize", Arrays.asList(values), SimulationConfig.SimulationConfigBuilder::positionSize);
    }

    public ParameterGrid stopLossPct(Double... values) {
        return axis("stopLossPct", Arrays.asList(values), SimulationConfig.SimulationConfigBuilder::stopLossPct);
    }

    public ParameterGrid takeProfitPct(Double... values) {
        return axis("takeProfitPct", Arrays.asList(values), SimulationConfig.SimulationConfigBuilder::takeProfitPct);
    }

    public ParameterGrid maxHoldingPeriods(Integer... values) {
        return axis("maxHoldingPeriods", Arrays.asList(values), SimulationConfig.SimulationConfigBuilder::maxHoldingPeriods);
    }

    /**
     * @return number of parameter combinations
     */
    public int size() {
        long total = 1L;
        for (Axis<?> axis : axes) {
            total *= axis.getValues().size();
            if (total > Integer.MAX_VALUE) {
                throw new ConfigException("parameter grid is too large");
            }
        }
        return (int) total;
    }

    /**
     * Expand the grid
     * @param base config every combination starts from
     * @return one parameter set per combination; the base alone when the grid has no axes
     */
    public List<ParameterSet> combinations(SimulationConfig base) {
        int total = size();
        int[] strides = buildStrides();
        List<ParameterSet> sets = new ArrayList<>(total);

        for (int index = 0; index < total; index++) {
            SimulationConfig.SimulationConfigBuilder builder = base.toBuilder();
            Map<String, Object> params = new LinkedHashMap<>();
            for (int i = 0; i < axes.size(); i++) {
                Axis<?> axis = axes.get(i);
                int coord = (index / strides[i]) % axis.getValues().size();
                builder = axis.apply(builder, coord);
                params.put(axis.getName(), axis.getValues().get(coord));
            }
            sets.add(new ParameterSet(Collections.unmodifiableMap(params), builder.build()));
        }
        return sets;
    }

    private int[] buildStrides() {
        int[] strides = new int[axes.size()];
        int stride = 1;
        for (int i = axes.size() - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= axes.get(i).getValues().size();
        }
        return strides;
    }

    /**
     * One grid combination: the chosen values by name and the resulting config
     */
    @Value
    public static class ParameterSet {
        Map<String, Object> params;
        SimulationConfig config;
    }

    @Value
    private static class Axis<T> {
        String name;
        List<T> values;
        BiFunction<SimulationConfig.SimulationConfigBuilder, T, SimulationConfig.SimulationConfigBuilder> setter;

        SimulationConfig.SimulationConfigBuilder apply(SimulationConfig.SimulationConfigBuilder builder, int coord) {
            return setter.apply(builder, values.get(coord));
        }
    }
}
