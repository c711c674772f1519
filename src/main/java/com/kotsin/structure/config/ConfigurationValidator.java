package com.kotsin.structure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator: fail fast on nonsensical thresholds.
 *
 * Runs on ApplicationStartedEvent so a batch run never starts with a broken
 * configuration.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final DealerMetricsConfig dealerConfig;
    private final WyckoffConfig wyckoffConfig;
    private final ExecutionConfig executionConfig;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    @Value("${spring.data.mongodb.uri:}")
    private String mongoUri;

    @EventListener(ApplicationStartedEvent.class)
    public void validateConfiguration() {
        // Skip validation in test mode
        if ("test".equals(activeProfile)) {
            log.info("[CONFIG] Skipping configuration validation in test mode");
            return;
        }

        List<String> errors = validate();
        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("[CONFIG] Configuration validation passed");
        logConfigurationSummary();
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();

        DealerMetricsConfig.FilterDefaults filter = dealerConfig.getFilter();
        if (filter.getMaxDteDays() < 0) {
            errors.add("dealer.filter.max-dte-days must be >= 0");
        }
        if (filter.getMinOpenInterest() < 0) {
            errors.add("dealer.filter.min-open-interest must be >= 0");
        }
        if (filter.getMinVolume() < 0) {
            errors.add("dealer.filter.min-volume must be >= 0");
        }
        if (filter.getWallsTopN() < 1) {
            errors.add("dealer.filter.walls-top-n must be >= 1");
        }
        if (filter.getGexSlopeRangePct() <= 0 || filter.getGexSlopeRangePct() > 1) {
            errors.add("dealer.filter.gex-slope-range-pct must be in (0, 1]");
        }
        if (dealerConfig.getExposure().getContractMultiplier() <= 0) {
            errors.add("dealer.exposure.contract-multiplier must be > 0");
        }
        if (dealerConfig.getDgpi().getBound() <= 0) {
            errors.add("dealer.dgpi.bound must be > 0");
        }
        if (dealerConfig.getDgpi().getIvRankDivisor() <= 0) {
            errors.add("dealer.dgpi.iv-rank-divisor must be > 0");
        }
        if (dealerConfig.getPosition().getNeutralThreshold() < 0) {
            errors.add("dealer.position.neutral-threshold must be >= 0");
        }
        if (dealerConfig.getStatus().getLimitedMinEligible() < 1
                || dealerConfig.getStatus().getFullMinEligible() < dealerConfig.getStatus().getLimitedMinEligible()) {
            errors.add("dealer.status thresholds must satisfy 1 <= limited-min-eligible <= full-min-eligible");
        }

        if (wyckoffConfig.getLookbackBars() < 2) {
            errors.add("wyckoff.lookback-bars must be >= 2");
        }
        if (wyckoffConfig.getMinBars() < wyckoffConfig.getLookbackBars()) {
            errors.add("wyckoff.min-bars must be >= wyckoff.lookback-bars");
        }
        if (wyckoffConfig.getMomentumBars() < 1) {
            errors.add("wyckoff.momentum-bars must be >= 1");
        }
        if (wyckoffConfig.getSpring().getRecoveryBars() < 0) {
            errors.add("wyckoff.spring.recovery-bars must be >= 0");
        }
        if (wyckoffConfig.getWeights().getClimax().max() <= 0 || wyckoffConfig.getWeights().getSpring().max() <= 0) {
            errors.add("wyckoff.weights must sum to a positive value");
        }

        if (executionConfig.getWorkerPoolSize() < 1) {
            errors.add("execution.worker-pool-size must be >= 1");
        }
        if (executionConfig.getSymbolTimeoutSeconds() < 1) {
            errors.add("execution.symbol-timeout-seconds must be >= 1");
        }
        if (isNullOrEmpty(executionConfig.getTrigger().getTopic())) {
            errors.add("execution.trigger.topic is not configured");
        }
        if (isNullOrEmpty(executionConfig.getModelVersion())) {
            errors.add("execution.model-version is not configured");
        }
        if (executionConfig.getRetry().getMaxAttempts() < 1) {
            errors.add("execution.retry.max-attempts must be >= 1");
        }
        try {
            ZoneId.of(executionConfig.getMarketZone());
        } catch (Exception e) {
            errors.add("Invalid execution.market-zone: " + e.getMessage());
        }
        return errors;
    }

    private void logConfigurationSummary() {
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Dealer filter: {}", dealerConfig.getFilter());
        log.info("  Exposure: sign={}, scaling={}, multiplier={}",
                dealerConfig.getExposure().getSignConvention(),
                dealerConfig.getExposure().getScaling(),
                dealerConfig.getExposure().getContractMultiplier());
        log.info("  Wyckoff: minBars={}, lookback={}, sequenceMaxDays={}",
                wyckoffConfig.getMinBars(), wyckoffConfig.getLookbackBars(), wyckoffConfig.getSequenceMaxDays());
        log.info("  Execution: pool={}, timeout={}s, model={}, topic={}",
                executionConfig.getWorkerPoolSize(), executionConfig.getSymbolTimeoutSeconds(),
                executionConfig.getModelVersion(), executionConfig.getTrigger().getTopic());
        log.info("  MongoDB URI: {}", maskUri(mongoUri));
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    private String maskUri(String uri) {
        if (isNullOrEmpty(uri)) {
            return "not configured";
        }
        // Mask password in URI
        return uri.replaceAll(":[^:@]+@", ":****@");
    }
}
