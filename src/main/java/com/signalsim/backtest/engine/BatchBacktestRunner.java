package com.signalsim.backtest.engine;

import com.signalsim.backtest.config.AnalysisSettings;
import com.signalsim.backtest.config.SimulationConfig;
import com.signalsim.backtest.model.BacktestReport;
import com.signalsim.backtest.model.Bar;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs independent backtests concurrently. Each job gets its own simulation
 * state; only the immutable configs and bar lists are shared.
 */
@Slf4j
public class BatchBacktestRunner {

    private final Backtester backtester;
    private final int parallelism;

    public BatchBacktestRunner(Backtester backtester, int parallelism) {
        if (parallelism < 1) {
            throw new ConfigException("parallelism must be at least 1, got " + parallelism);
        }
        this.backtester = backtester;
        this.parallelism = parallelism;
    }

    /**
     * Run all jobs; a failed job does not stop the others
     * @param jobs jobs to run
     * @param settings metric settings shared by every job
     * @return one outcome per job, in submission order
     */
    public List<BatchOutcome> runAll(List<BacktestJob> jobs, AnalysisSettings settings) {
        if (jobs.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(parallelism, jobs.size());
        log.info("Running {} backtest job(s) on {} thread(s)", jobs.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<BacktestReport>> futures = new ArrayList<>(jobs.size());
            for (BacktestJob job : jobs) {
                futures.add(executor.submit(() ->
                    backtester.backtest(job.getName(), job.getBars(), job.getConfig(), settings)));
            }

            List<BatchOutcome> outcomes = new ArrayList<>(jobs.size());
            for (int i = 0; i < jobs.size(); i++) {
                BacktestJob job = jobs.get(i);
                try {
                    outcomes.add(BatchOutcome.success(job, futures.get(i).get()));
                } catch (ExecutionException e) {
                    log.error("Backtest job {} failed: {}", job.getName(), e.getCause().getMessage());
                    outcomes.add(BatchOutcome.failure(job, e.getCause()));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BacktestException(BacktestException.ErrorCode.EXECUTION_FAILED, "Batch backtest interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Build one job per config over the same bars, for parameter sweeps
     * @param name base job name
     * @param bars shared bar series
     * @param configs configs to try
     * @return jobs named {@code name#index}
     */
    public static List<BacktestJob> sweep(String name, List<Bar> bars, List<SimulationConfig> configs) {
        List<BacktestJob> jobs = new ArrayList<>(configs.size());
        for (int i = 0; i < configs.size(); i++) {
            jobs.add(BacktestJob.builder()
                .name(name + "#" + i)
                .bars(bars)
                .config(configs.get(i))
                .build());
        }
        return jobs;
    }

    /**
     * One backtest to run
     */
    @Value
    @Builder
    public static class BacktestJob {
        String name;
        List<Bar> bars;
        SimulationConfig config;
    }

    /**
     * Result of one job: a report, or the error that stopped it
     */
    @Value
    public static class BatchOutcome {
        BacktestJob job;
        BacktestReport report;
        Throwable error;

        static BatchOutcome success(BacktestJob job, BacktestReport report) {
            return new BatchOutcome(job, report, null);
        }

        static BatchOutcome failure(BacktestJob job, Throwable error) {
            return new BatchOutcome(job, null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
