package com.signalsim.backtest.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.engine.ParameterGrid.ParameterSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterGridTest {

    @Test
    void combinations_expandsCartesianProductWithLastAxisFastest() {
        SimulationConfig base = SimulationConfig.builder().commissionPct(0.002).build();
        ParameterGrid grid = new ParameterGrid()
                .positionSize(0.5, 1.0)
                .stopLossPct(null, 0.05, 0.1);

        List<ParameterSet> sets = grid.combinations(base);

        assertThat(grid.size()).isEqualTo(6);
        assertThat(sets).hasSize(6);
        assertThat(sets.get(0).getParams()).containsExactly(entry("positionSize", 0.5), entry("stopLossPct", null));
        assertThat(sets.get(1).getParams()).containsExactly(entry("positionSize", 0.5), entry("stopLossPct", 0.05));
        assertThat(sets.get(5).getParams()).containsExactly(entry("positionSize", 1.0), entry("stopLossPct", 0.1));

        SimulationConfig last = sets.get(5).getConfig();
        assertThat(last.getPositionSize()).isEqualTo(1.0);
        assertThat(last.getStopLossPct()).isEqualTo(0.1);
        assertThat(last.getCommissionPct()).isEqualTo(0.002);
        assertThat(sets.get(0).getConfig().getStopLossPct()).isNull();
    }

    @Test
    void combinations_withoutAxesYieldsBaseConfig() {
        SimulationConfig base = SimulationConfig.defaults();

        List<ParameterSet> sets = new ParameterGrid().combinations(base);

        assertThat(sets).hasSize(1);
        assertThat(sets.get(0).getConfig()).isEqualTo(base);
        assertThat(sets.get(0).getParams()).isEmpty();
    }

    @Test
    void axis_acceptsCustomSetters() {
        ParameterGrid grid = new ParameterGrid()
                .axis("enableCompound", List.of(true, false), SimulationConfig.SimulationConfigBuilder::enableCompound)
                .maxHoldingPeriods(5, 10)
                .takeProfitPct(0.2);

        List<ParameterSet> sets = grid.combinations(SimulationConfig.defaults());

        assertThat(sets).hasSize(4);
        assertThat(sets.get(3).getConfig().isEnableCompound()).isFalse();
        assertThat(sets.get(3).getConfig().getMaxHoldingPeriods()).isEqualTo(10);
        assertThat(sets.get(3).getConfig().getTakeProfitPct()).isEqualTo(0.2);
    }

    @Test
    void axis_rejectsEmptyValues() {
        assertThatThrownBy(() -> new ParameterGrid().positionSize())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("positionSize");
    }
}
