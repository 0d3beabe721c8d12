package com.signalsim.backtest.engine;

import com.signalsim.backtest.analyzer.BacktestResultValidator;
import com.signalsim.backtest.analyzer.PerformanceAnalyzer;
import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.model.BacktestReport;
import com.signalsim.backtest.model.Bar;
import com.signalsim.backtest.model.Metrics;
import com.signalsim.backtest.model.SimulationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Simulate and analyze in one call.
 */
@Slf4j
public class Backtester {

    private final PositionSimulator simulator;
    private final PerformanceAnalyzer analyzer;
    private final BacktestResultValidator resultValidator;

    public Backtester() {
        this(new PositionSimulator(), new PerformanceAnalyzer());
    }

    public Backtester(PositionSimulator simulator, PerformanceAnalyzer analyzer) {
        this(simulator, analyzer, new BacktestResultValidator());
    }

    public Backtester(PositionSimulator simulator, PerformanceAnalyzer analyzer,
                      BacktestResultValidator resultValidator) {
        this.simulator = simulator;
        this.analyzer = analyzer;
        this.resultValidator = resultValidator;
    }

    public BacktestReport backtest(String symbol, List<Bar> bars, SimulationConfig config) {
        return backtest(symbol, bars, config, AnalysisSettings.defaults());
    }

    /**
     * Run a backtest
     * @param symbol instrument label carried into the report
     * @param bars validated bars
     * @param config simulation settings
     * @param settings metric settings
     * @return simulation output with metrics and result warnings
     */
    public BacktestReport backtest(String symbol, List<Bar> bars, SimulationConfig config, AnalysisSettings settings) {
        settings.validate();
        log.info("Backtesting {}", symbol);

        SimulationResult result = simulator.run(bars, config);
        Metrics metrics = analyzer.summarize(result, settings);

        List<String> warnings = resultValidator.check(metrics, settings);
        for (String warning : warnings) {
            log.warn("{}: {}", symbol, warning);
        }

        return BacktestReport.builder()
            .symbol(symbol)
            .result(result)
            .metrics(metrics)
            .warnings(warnings)
            .build();
    }
}
