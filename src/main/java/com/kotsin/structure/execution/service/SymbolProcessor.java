package com.kotsin.structure.execution.service;

import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.dealer.calculator.DealerMetricsCalculator;
import com.kotsin.structure.dealer.model.DealerMetrics;
import com.kotsin.structure.dealer.model.FilterConfig;
import com.kotsin.structure.execution.model.ExecutionContext;
import com.kotsin.structure.execution.model.SymbolOutcome;
import com.kotsin.structure.logging.TraceContext;
import com.kotsin.structure.options.model.OptionChainSnapshot;
import com.kotsin.structure.options.model.SpotResolution;
import com.kotsin.structure.persistence.RegimeStateStore;
import com.kotsin.structure.persistence.SnapshotRecord;
import com.kotsin.structure.persistence.SnapshotStore;
import com.kotsin.structure.source.MarketDataSource;
import com.kotsin.structure.source.SpotPriceResolver;
import com.kotsin.structure.wyckoff.detector.WyckoffEventDetector;
import com.kotsin.structure.wyckoff.detector.WyckoffSummarizer;
import com.kotsin.structure.wyckoff.model.DetectionResult;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * SymbolProcessor - the per-symbol unit of work.
 *
 * Flow (under the symbol lock):
 * 1. Prior regime state: latest version before the trading date
 * 2. Bars from the prior evaluated-through date minus padding (or the initial window) through the trading date
 * 3. Option chain at the snapshot time, spot resolution
 * 4. Dealer metrics and Wyckoff detection, independent of each other
 * 5. Snapshot upsert and regime state save, skipped in dry-run
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SymbolProcessor {

    private final MarketDataSource dataSource;
    private final SpotPriceResolver spotPriceResolver;
    private final DealerMetricsCalculator dealerCalculator;
    private final WyckoffEventDetector eventDetector;
    private final WyckoffSummarizer summarizer;
    private final SnapshotStore snapshotStore;
    private final RegimeStateStore regimeStateStore;
    private final SymbolLocks symbolLocks;
    private final WyckoffConfig wyckoffConfig;
    private final ExecutionConfig executionConfig;

    public SymbolOutcome process(String symbol, ExecutionContext context, FilterConfig filter, LocalDate tradingDate) {
        return symbolLocks.withLock(symbol, () -> processLocked(symbol, context, filter, tradingDate));
    }

    private SymbolOutcome processLocked(String symbol, ExecutionContext context, FilterConfig filter, LocalDate tradingDate) {
        String prefix = TraceContext.getPrefix();

        RegimeState prior = regimeStateStore.findLatestBefore(symbol, tradingDate)
                .orElseGet(() -> RegimeState.initial(symbol));
        LocalDate evaluatedThrough = prior.lastEvaluatedDate();
        LocalDate from = evaluatedThrough != null
                ? evaluatedThrough.minusDays(executionConfig.getHistoryPaddingDays())
                : tradingDate.minusDays(executionConfig.getInitialHistoryDays());

        List<OhlcvBar> bars = dataSource.loadBars(symbol, from, tradingDate);
        OptionChainSnapshot chain = dataSource.loadOptionChain(symbol, context.getSnapshotTime(), tradingDate);
        if (bars.isEmpty() && chain.isEmpty()) {
            log.info("{} [EXECUTION] No bars and no option rows, skipping", prefix);
            return SymbolOutcome.skipped(symbol);
        }

        SpotResolution spot = spotPriceResolver.resolve(symbol, context.getSnapshotTime(), tradingDate, bars,
                context.getOverrides().getSpotOverride());
        DealerMetrics metrics = dealerCalculator.compute(chain, spot, filter);
        log.debug("{} [DEALER] status={} reason={} gex_net={} flip={} diagnostics={}", prefix,
                metrics.getStatus(), metrics.getStatusReason(), metrics.getGexNet(), metrics.getGammaFlip(),
                metrics.getDiagnostics());

        DetectionResult detection = eventDetector.detect(bars, prior, wyckoffConfig);
        // Version key only; evaluated_through stays at the last bar actually seen
        RegimeState newState = detection.newState().withAsOf(tradingDate);
        DetectionResult stamped = new DetectionResult(detection.events(), newState);
        WyckoffSummary summary = summarizer.summarize(bars, stamped, tradingDate, wyckoffConfig);
        log.debug("{} [WYCKOFF] bars={} new_events={} regime={}", prefix,
                bars.size(), detection.events().size(), newState.getCurrentRegime());

        SnapshotRecord record = SnapshotRecord.builder()
                .symbol(symbol)
                .time(context.getSnapshotTime())
                .tradingDate(tradingDate)
                .dealerMetrics(metrics)
                .wyckoffEvents(detection.events())
                .regimeState(newState)
                .wyckoffSummary(summary)
                .modelVersion(executionConfig.getModelVersion())
                .build();

        if (context.isDryRun()) {
            log.debug("{} [EXECUTION] Dry-run, not persisting", prefix);
        } else {
            snapshotStore.upsert(record);
            regimeStateStore.save(newState);
        }

        log.info("{} [EXECUTION] done: dealer_status={} regime={} new_events={}{}", prefix,
                metrics.getStatus(), newState.getCurrentRegime(), detection.events().size(),
                context.isDryRun() ? " (dry-run)" : "");
        return SymbolOutcome.success(symbol, record);
    }
}
