package com.kotsin.structure.execution.service;

import com.kotsin.structure.config.DealerMetricsConfig;
import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.dealer.model.FilterConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.execution.model.ExecutionContext;
import com.kotsin.structure.execution.model.ExecutionResult;
import com.kotsin.structure.execution.model.OutcomeStatus;
import com.kotsin.structure.execution.model.SymbolOutcome;
import com.kotsin.structure.logging.TraceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ExecutionScaffold - the single entry point for event and batch runs.
 *
 * 1. Validate the context (no collaborator is touched before this passes)
 * 2. Merge filter overrides over the configured defaults
 * 3. Submit every symbol to the worker pool and wait on each with the per-symbol timeout
 * 4. Tally outcomes: a failed or timed-out symbol never stops its siblings,
 *    a SystemicException aborts the run
 *
 * No retries here; the stores own them.
 */
@Slf4j
@Component
public class ExecutionScaffold {

    private final ContextValidator contextValidator;
    private final SymbolProcessor symbolProcessor;
    private final LogLevelOverride logLevelOverride;
    private final DealerMetricsConfig dealerConfig;
    private final ExecutionConfig executionConfig;
    private final AsyncTaskExecutor symbolExecutor;

    public ExecutionScaffold(ContextValidator contextValidator,
                             SymbolProcessor symbolProcessor,
                             LogLevelOverride logLevelOverride,
                             DealerMetricsConfig dealerConfig,
                             ExecutionConfig executionConfig,
                             @Qualifier("symbolExecutor") AsyncTaskExecutor symbolExecutor) {
        this.contextValidator = contextValidator;
        this.symbolProcessor = symbolProcessor;
        this.logLevelOverride = logLevelOverride;
        this.dealerConfig = dealerConfig;
        this.executionConfig = executionConfig;
        this.symbolExecutor = symbolExecutor;
    }

    public ExecutionResult execute(ExecutionContext context) {
        contextValidator.validate(context);

        long startMs = System.currentTimeMillis();
        String mode = context.getMode().label();
        Runnable restoreLogLevel = logLevelOverride.apply(context.getOverrides().getLogLevel());
        TraceContext.start(context.getTraceId(), mode, null);
        try {
            FilterConfig filter = context.getOverrides().applyTo(dealerConfig.defaultFilterConfig());
            LocalDate tradingDate = context.getSnapshotTime()
                    .atZone(ZoneId.of(executionConfig.getMarketZone()))
                    .toLocalDate();

            log.info("{} [EXECUTION] START mode={} scope={} snapshot_time={} trading_date={} dry_run={} filter={} spot_override={}",
                    TraceContext.getPrefix(), mode, context.getScope(), context.getSnapshotTime(), tradingDate,
                    context.isDryRun(), filter, context.getOverrides().getSpotOverride());
            if (context.isDryRun()) {
                log.info("{} [EXECUTION] DRY-RUN: computing {} symbols, nothing will be persisted",
                        TraceContext.getPrefix(), context.getScope().size());
            }

            List<SymbolOutcome> outcomes = new ArrayList<>(context.getScope().size());
            try {
                runAll(context, filter, tradingDate, outcomes);
            } catch (SystemicException e) {
                log.error("{} [EXECUTION] END ABORTED mode={} duration_ms={} symbols={} completed={} succeeded={} failed={} timed_out={} dry_run={} cause={}",
                        TraceContext.getPrefix(), mode, System.currentTimeMillis() - startMs, context.getScope().size(),
                        outcomes.size(), countOf(outcomes, OutcomeStatus.SUCCESS), countOf(outcomes, OutcomeStatus.FAILED),
                        countOf(outcomes, OutcomeStatus.TIMED_OUT), context.isDryRun(), e.getMessage());
                throw e;
            }

            ExecutionResult result = ExecutionResult.builder()
                    .traceId(context.getTraceId())
                    .mode(context.getMode())
                    .snapshotTime(context.getSnapshotTime())
                    .dryRun(context.isDryRun())
                    .outcomes(List.copyOf(outcomes))
                    .durationMs(System.currentTimeMillis() - startMs)
                    .build();

            log.info("{} [EXECUTION] END mode={} duration_ms={} symbols={} succeeded={} failed={} timed_out={} skipped={} dry_run={}",
                    TraceContext.getPrefix(), mode, result.getDurationMs(), outcomes.size(), result.succeeded(),
                    result.count(OutcomeStatus.FAILED), result.count(OutcomeStatus.TIMED_OUT),
                    result.count(OutcomeStatus.SKIPPED_NO_HISTORY), context.isDryRun());
            return result;
        } finally {
            TraceContext.clear();
            restoreLogLevel.run();
        }
    }

    /**
     * Fans the scope out to the worker pool and collects outcomes in scope order.
     * Outcomes gathered before a systemic abort stay in {@code outcomes}.
     */
    private void runAll(ExecutionContext context, FilterConfig filter, LocalDate tradingDate,
                        List<SymbolOutcome> outcomes) {
        String mode = context.getMode().label();
        List<String> scope = context.getScope();

        List<Future<SymbolOutcome>> futures = new ArrayList<>(scope.size());
        for (String symbol : scope) {
            futures.add(symbolExecutor.submit(() -> {
                TraceContext.start(context.getTraceId(), mode, symbol);
                try {
                    return symbolProcessor.process(symbol, context, filter, tradingDate);
                } finally {
                    TraceContext.clear();
                }
            }));
        }

        long timeoutSeconds = executionConfig.getSymbolTimeoutSeconds();
        int heartbeat = executionConfig.getHeartbeatSymbols();
        for (int i = 0; i < scope.size(); i++) {
            String symbol = scope.get(i);
            Future<SymbolOutcome> future = futures.get(i);
            try {
                outcomes.add(future.get(timeoutSeconds, TimeUnit.SECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} [EXECUTION] {} timed out after {}s", TraceContext.getPrefix(), symbol, timeoutSeconds);
                outcomes.add(SymbolOutcome.timedOut(symbol, timeoutSeconds));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof SystemicException systemic) {
                    log.error("{} [EXECUTION] Systemic failure on {}, aborting run: {}",
                            TraceContext.getPrefix(), symbol, systemic.getMessage(), systemic);
                    cancelRemaining(futures, i + 1);
                    throw systemic;
                }
                log.warn("{} [EXECUTION] {} failed: {}: {}", TraceContext.getPrefix(), symbol,
                        cause.getClass().getSimpleName(), cause.getMessage());
                outcomes.add(SymbolOutcome.failed(symbol, cause.getClass().getSimpleName() + ": " + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRemaining(futures, i);
                log.error("{} [EXECUTION] Interrupted while waiting on {}, aborting run", TraceContext.getPrefix(), symbol);
                throw new SystemicException("Execution interrupted", e);
            }

            if (heartbeat > 0 && (i + 1) % heartbeat == 0 && i + 1 < scope.size()) {
                log.info("{} [EXECUTION] heartbeat: {}/{} symbols processed", TraceContext.getPrefix(), i + 1, scope.size());
            }
        }
    }

    private static long countOf(List<SymbolOutcome> outcomes, OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    private static void cancelRemaining(List<Future<SymbolOutcome>> futures, int from) {
        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }
}
