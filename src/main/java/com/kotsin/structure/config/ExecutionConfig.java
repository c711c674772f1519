package com.kotsin.structure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Execution scaffold, store and trigger configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
public class ExecutionConfig {

    /**
     * Batch worker pool size
     */
    private int workerPoolSize = 4;

    /**
     * A symbol still running after this many seconds is reported as timed out
     */
    private long symbolTimeoutSeconds = 30;

    /**
     * Written with every snapshot record
     */
    private String modelVersion = "structure-core-v1";

    /**
     * Emit a heartbeat line every N processed symbols (0 disables)
     */
    private int heartbeatSymbols = 25;

    /**
     * Exchange time zone used to derive the trading date of a snapshot time
     */
    private String marketZone = "America/New_York";

    /**
     * Bars loaded before the prior evaluated-through date as detector lookback
     */
    private int historyPaddingDays = 180;

    /**
     * Bars loaded when a symbol has no prior regime state
     */
    private int initialHistoryDays = 730;

    private TriggerConfig trigger = new TriggerConfig();

    private CollectionsConfig collections = new CollectionsConfig();

    private RetryConfig retry = new RetryConfig();

    @Data
    public static class TriggerConfig {
        private String topic = "structure-execution-triggers";

        private String groupId = "market-structure-core-v1";

        private String autoOffsetReset = "latest";
    }

    @Data
    public static class CollectionsConfig {
        private String snapshots = "daily_snapshots";

        private String regimeState = "wyckoff_regime_state";

        private String ohlcv = "ohlcv";

        private String optionsChains = "options_chains";

        private String symbols = "symbols";
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;

        private long initialDelayMs = 250;

        private double multiplier = 2.0;

        private long maxDelayMs = 2_000;
    }
}
