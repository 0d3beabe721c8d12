package com.signalsim.backtest.config;

import io.github.cdimascio.dotenv.Dotenv;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration loader from .env file.
 * Singleton pattern for global access to configuration; tests and embedding
 * code may build their own instance from a specific directory.
 */
@Getter
public class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);
    private static Config instance;

    private final Dotenv dotenv;

    private final String dataDir;
    private final String reportsDir;
    private final int parallelism;

    private final SimulationConfig simulationConfig;
    private final AnalysisSettings analysisSettings;

    Config(Dotenv dotenv) {
        this.dotenv = dotenv;

        this.dataDir = getEnv("DATA_DIR", "./data/bars");
        this.reportsDir = getEnv("REPORTS_DIR", "./data/reports");
        this.parallelism = Math.max(1, getEnvInt("PARALLELISM", Runtime.getRuntime().availableProcessors()));

        this.simulationConfig = SimulationConfig.builder()
                .initialCapital(getEnvDouble("INITIAL_CAPITAL", SimulationConfig.DEFAULT_INITIAL_CAPITAL))
                .positionSize(getEnvDouble("POSITION_SIZE", SimulationConfig.DEFAULT_POSITION_SIZE))
                .commissionPct(getEnvDouble("COMMISSION_PCT", SimulationConfig.DEFAULT_COMMISSION_PCT))
                .slippagePct(getEnvDouble("SLIPPAGE_PCT", SimulationConfig.DEFAULT_SLIPPAGE_PCT))
                .minCommission(getEnvDouble("MIN_COMMISSION", SimulationConfig.DEFAULT_MIN_COMMISSION))
                .stopLossPct(getOptionalDouble("STOP_LOSS_PCT"))
                .takeProfitPct(getOptionalDouble("TAKE_PROFIT_PCT"))
                .maxHoldingPeriods(getOptionalInt("MAX_HOLDING_PERIODS"))
                .enableCompound(getEnvBoolean("ENABLE_COMPOUND", true))
                .build();

        this.analysisSettings = AnalysisSettings.builder()
                .riskFreeRate(getEnvDouble("RISK_FREE_RATE", AnalysisSettings.DEFAULT_RISK_FREE_RATE))
                .tradingPeriodsPerYear(getEnvInt("TRADING_PERIODS_PER_YEAR",
                        AnalysisSettings.DEFAULT_TRADING_PERIODS_PER_YEAR))
                .minTrades(getEnvInt("MIN_TRADES", AnalysisSettings.DEFAULT_MIN_TRADES))
                .maxDrawdownThreshold(getEnvDouble("MAX_DRAWDOWN_THRESHOLD",
                        AnalysisSettings.DEFAULT_MAX_DRAWDOWN_THRESHOLD))
                .maxVolatilityThreshold(getEnvDouble("MAX_VOLATILITY_THRESHOLD",
                        AnalysisSettings.DEFAULT_MAX_VOLATILITY_THRESHOLD))
                .build();

        log.info("Configuration loaded successfully");
        logConfiguration();
    }

    /**
     * Get singleton instance, loaded from .env in the working directory
     *
     * @return Config instance
     */
    public static synchronized Config getInstance() {
        if (instance == null) {
            instance = new Config(Dotenv.configure()
                    .ignoreIfMissing()
                    .load());
        }
        return instance;
    }

    /**
     * Load configuration from a .env file in the given directory
     *
     * @param directory directory holding the .env file
     * @return new Config instance
     */
    public static Config fromDirectory(Path directory) {
        return new Config(Dotenv.configure()
                .directory(directory.toString())
                .ignoreIfMissing()
                .load());
    }

    /**
     * Get string from env with default
     */
    private String getEnv(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }

    /**
     * Get int from env with default
     */
    private int getEnvInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Get double from env with default
     */
    private double getEnvDouble(String key, double defaultValue) {
        String value = dotenv.get(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid double for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Get boolean from env with default
     */
    private boolean getEnvBoolean(String key, boolean defaultValue) {
        String value = dotenv.get(key);
        if (value == null || value.trim().isEmpty())
            return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Get optional double, null when absent, blank or "none"
     */
    private Double getOptionalDouble(String key) {
        String value = dotenv.get(key);
        if (isUnset(value))
            return null;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid double for {}: {}, leaving it unset", key, value);
            return null;
        }
    }

    /**
     * Get optional int, null when absent, blank or "none"
     */
    private Integer getOptionalInt(String key) {
        String value = dotenv.get(key);
        if (isUnset(value))
            return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: {}, leaving it unset", key, value);
            return null;
        }
    }

    private boolean isUnset(String value) {
        return value == null || value.trim().isEmpty() || "none".equalsIgnoreCase(value.trim());
    }

    /**
     * Log current configuration
     */
    private void logConfiguration() {
        log.info("=== BACKTESTING CONFIGURATION ===");
        log.info("Data Directory: {}", dataDir);
        log.info("Reports Directory: {}", reportsDir);
        log.info("Parallelism: {}", parallelism);
        log.info("Capital: initial={}, positionSize={}, compound={}",
                simulationConfig.getInitialCapital(), simulationConfig.getPositionSize(),
                simulationConfig.isEnableCompound());
        log.info("Costs: commission={}, minCommission={}, slippage={}",
                simulationConfig.getCommissionPct(), simulationConfig.getMinCommission(),
                simulationConfig.getSlippagePct());
        log.info("Exits: stopLoss={}, takeProfit={}, maxHoldingPeriods={}",
                describe(simulationConfig.getStopLossPct()), describe(simulationConfig.getTakeProfitPct()),
                describe(simulationConfig.getMaxHoldingPeriods()));
        log.info("Analysis: riskFreeRate={}, periodsPerYear={}",
                analysisSettings.getRiskFreeRate(), analysisSettings.getTradingPeriodsPerYear());
        log.info("Result checks: minTrades={}, maxDrawdown={}, maxVolatility={}",
                analysisSettings.getMinTrades(), analysisSettings.getMaxDrawdownThreshold(),
                analysisSettings.getMaxVolatilityThreshold());
        log.info("================================");
    }

    private static String describe(Number value) {
        return value == null ? "OFF" : value.toString();
    }
}
