package com.kotsin.structure.execution.service;

import com.kotsin.structure.execution.model.ExecutionContext;
import com.kotsin.structure.execution.model.ExecutionMode;
import com.kotsin.structure.execution.model.ExecutionTrigger;
import com.kotsin.structure.execution.model.ParameterOverrides;
import com.kotsin.structure.logging.TraceContext;
import com.kotsin.structure.source.MarketDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Resolves either trigger variant to an {@link ExecutionContext}.
 *
 * A batch without symbols runs the active universe; a batch without a snapshot
 * time runs the latest options time. An event trigger is taken as given, so a
 * missing snapshot time is left for the validator to reject.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionContextFactory {

    private final MarketDataSource dataSource;

    public ExecutionContext fromTrigger(ExecutionTrigger trigger) {
        ExecutionContext.ExecutionContextBuilder builder = ExecutionContext.builder()
                .dryRun(trigger.dryRun())
                .overrides(trigger.overrides() != null ? trigger.overrides() : ParameterOverrides.NONE)
                .traceId(isBlank(trigger.traceId()) ? TraceContext.generateTraceId() : trigger.traceId());

        if (trigger instanceof ExecutionTrigger.EventTrigger event) {
            List<String> scope = new ArrayList<>();
            scope.add(event.symbol());
            return builder
                    .mode(ExecutionMode.EVENT)
                    .scope(normalize(scope))
                    .snapshotTime(event.snapshotTime())
                    .build();
        }

        ExecutionTrigger.BatchTrigger batch = (ExecutionTrigger.BatchTrigger) trigger;
        Collection<String> symbols = batch.symbols();
        if (symbols.isEmpty()) {
            symbols = dataSource.activeSymbols();
            log.info("[EXECUTION] Batch scope not given, using {} active symbols", symbols.size());
        }
        Instant snapshotTime = batch.snapshotTime();
        if (snapshotTime == null) {
            snapshotTime = dataSource.latestOptionsTime().orElse(null);
            log.info("[EXECUTION] Batch snapshot time not given, using latest options time {}", snapshotTime);
        }
        return builder
                .mode(ExecutionMode.BATCH)
                .scope(normalize(symbols))
                .snapshotTime(snapshotTime)
                .build();
    }

    /**
     * Trim, upper-case, de-duplicate and sort. Null entries become "" so the validator reports them.
     */
    static List<String> normalize(Collection<String> symbols) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String symbol : symbols) {
            normalized.add(symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT));
        }
        return List.copyOf(normalized);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
