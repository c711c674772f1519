package com.kotsin.structure.execution.service;

import com.kotsin.structure.exception.ValidationException;
import com.kotsin.structure.execution.model.ExecutionContext;
import com.kotsin.structure.execution.model.ExecutionMode;
import com.kotsin.structure.execution.model.ParameterOverrides;
import org.springframework.boot.logging.LogLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Schema check of an execution context. Collects every violation and raises
 * them together; never touches a collaborator.
 */
@Component
public class ContextValidator {

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9.\\-]{1,15}$");

    public void validate(ExecutionContext context) {
        if (context == null) {
            throw new ValidationException("execution context is required");
        }
        List<String> violations = new ArrayList<>();

        if (context.getMode() == null) {
            violations.add("mode is required");
        }
        if (context.getSnapshotTime() == null) {
            violations.add("snapshot_time is required");
        }
        if (context.getTraceId() == null || context.getTraceId().isBlank()) {
            violations.add("trace_id is required");
        }

        List<String> scope = context.getScope();
        if (scope == null || scope.isEmpty()) {
            violations.add("scope must name at least one symbol");
        } else {
            for (String symbol : scope) {
                if (symbol == null || !SYMBOL.matcher(symbol).matches()) {
                    violations.add("invalid symbol '" + symbol + "'");
                }
            }
            if (context.getMode() == ExecutionMode.EVENT && scope.size() != 1) {
                violations.add("event mode takes exactly one symbol, got " + scope.size());
            }
        }

        ParameterOverrides overrides = context.getOverrides();
        if (overrides == null) {
            violations.add("overrides must not be null");
        } else {
            validateOverrides(overrides, violations);
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void validateOverrides(ParameterOverrides overrides, List<String> violations) {
        if (overrides.getMaxDteDays() != null && overrides.getMaxDteDays() < 0) {
            violations.add("max_dte_days must be >= 0");
        }
        if (overrides.getMinOpenInterest() != null && overrides.getMinOpenInterest() < 0) {
            violations.add("min_open_interest must be >= 0");
        }
        if (overrides.getMinVolume() != null && overrides.getMinVolume() < 0) {
            violations.add("min_volume must be >= 0");
        }
        if (overrides.getWallsTopN() != null && overrides.getWallsTopN() < 1) {
            violations.add("walls_top_n must be >= 1");
        }
        Double range = overrides.getGexSlopeRangePct();
        if (range != null && (range.isNaN() || range <= 0 || range > 1)) {
            violations.add("gex_slope_range_pct must be in (0, 1]");
        }
        if (overrides.getMaxSpreadPct() != null && overrides.getMaxSpreadPct().isNaN()) {
            violations.add("max_spread_pct must be a number");
        }
        Double spot = overrides.getSpotOverride();
        if (spot != null && (spot.isNaN() || spot.isInfinite() || spot <= 0)) {
            violations.add("spot_override must be > 0");
        }
        if (overrides.getLogLevel() != null && !isLogLevel(overrides.getLogLevel())) {
            violations.add("unknown log_level '" + overrides.getLogLevel() + "'");
        }
    }

    private static boolean isLogLevel(String value) {
        try {
            LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
