package com.kotsin.structure.execution.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggerConfiguration;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Applies the per-run log level to this service's loggers and hands back the restore action.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogLevelOverride {

    static final String ROOT_PACKAGE = "com.kotsin.structure";

    private final LoggingSystem loggingSystem;

    public Runnable apply(String level) {
        if (level == null || level.isBlank()) {
            return () -> { };
        }
        LoggerConfiguration current = loggingSystem.getLoggerConfiguration(ROOT_PACKAGE);
        LogLevel previous = current != null ? current.getConfiguredLevel() : null;
        LogLevel requested = LogLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));

        loggingSystem.setLogLevel(ROOT_PACKAGE, requested);
        log.debug("[EXECUTION] Log level for {} set to {} (was {})", ROOT_PACKAGE, requested, previous);
        return () -> loggingSystem.setLogLevel(ROOT_PACKAGE, previous);
    }
}
