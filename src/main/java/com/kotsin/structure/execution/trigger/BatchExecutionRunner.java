package com.kotsin.structure.execution.trigger;

import com.kotsin.structure.config.ExecutionConfig;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.exception.ValidationException;
import com.kotsin.structure.execution.model.ExecutionResult;
import com.kotsin.structure.execution.model.ExecutionTrigger;
import com.kotsin.structure.execution.model.ParameterOverrides;
import com.kotsin.structure.execution.service.ExecutionContextFactory;
import com.kotsin.structure.execution.service.ExecutionScaffold;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Batch mode entry point: one run over the symbols given on the command line.
 *
 * java -jar market-structure-core.jar --mode=batch --symbols=AAPL,MSFT
 *      --snapshot-time=2024-05-01T20:00:00Z --dry-run=true --min-open-interest=50
 *
 * Exit codes: 0 all symbols ok, 1 some symbols failed, 2 invalid invocation, 3 systemic failure.
 */
@Component
@ConditionalOnProperty(name = "mode", havingValue = "batch")
@Slf4j
public class BatchExecutionRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_SYMBOL_FAILURES = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_SYSTEMIC = 3;

    private final ExecutionContextFactory contextFactory;
    private final ExecutionScaffold scaffold;
    private final ExecutionConfig executionConfig;

    @Value("${symbols:}")
    private String symbols;

    @Value("${snapshot-time:}")
    private String snapshotTime;

    @Value("${dry-run:false}")
    private boolean dryRun;

    @Value("${trace-id:}")
    private String traceId;

    @Value("${max-dte-days:#{null}}")
    private Integer maxDteDays;

    @Value("${min-open-interest:#{null}}")
    private Long minOpenInterest;

    @Value("${min-volume:#{null}}")
    private Long minVolume;

    @Value("${max-spread-pct:#{null}}")
    private Double maxSpreadPct;

    @Value("${walls-top-n:#{null}}")
    private Integer wallsTopN;

    @Value("${gex-slope-range-pct:#{null}}")
    private Double gexSlopeRangePct;

    @Value("${spot-override:#{null}}")
    private Double spotOverride;

    @Value("${log-level:#{null}}")
    private String logLevel;

    private volatile int exitCode = EXIT_OK;

    public BatchExecutionRunner(ExecutionContextFactory contextFactory,
                                ExecutionScaffold scaffold,
                                ExecutionConfig executionConfig) {
        this.contextFactory = contextFactory;
        this.scaffold = scaffold;
        this.executionConfig = executionConfig;
    }

    @Override
    public void run(String... args) {
        try {
            ExecutionTrigger.BatchTrigger trigger = new ExecutionTrigger.BatchTrigger(
                    parseSymbols(symbols), parseSnapshotTime(snapshotTime), dryRun, overrides(), traceId);
            ExecutionResult result = scaffold.execute(contextFactory.fromTrigger(trigger));
            exitCode = result.hasFailures() ? EXIT_SYMBOL_FAILURES : EXIT_OK;
        } catch (ValidationException e) {
            log.error("[BATCH] Invalid invocation: {}", e.getViolations());
            exitCode = EXIT_INVALID;
        } catch (SystemicException e) {
            log.error("[BATCH] Run aborted: {}", e.getMessage(), e);
            exitCode = EXIT_SYSTEMIC;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    ParameterOverrides overrides() {
        return ParameterOverrides.builder()
                .maxDteDays(maxDteDays)
                .minOpenInterest(minOpenInterest)
                .minVolume(minVolume)
                .maxSpreadPct(maxSpreadPct)
                .wallsTopN(wallsTopN)
                .gexSlopeRangePct(gexSlopeRangePct)
                .spotOverride(spotOverride)
                .logLevel(logLevel)
                .build();
    }

    static List<String> parseSymbols(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * ISO instant, or an ISO date meaning the end of that day in the market zone. Blank means latest.
     */
    Instant parseSnapshotTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            try {
                ZoneId zone = ZoneId.of(executionConfig.getMarketZone());
                return LocalDate.parse(value.trim()).plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
            } catch (DateTimeParseException ignored) {
                throw new ValidationException("snapshot-time '" + value + "' is neither an ISO instant nor an ISO date");
            }
        }
    }
}
