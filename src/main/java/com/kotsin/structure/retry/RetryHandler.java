package com.kotsin.structure.retry;

import com.kotsin.structure.config.ExecutionConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff, used at the persistence boundary only.
 *
 * Attempts, initial delay, multiplier and cap come from {@code execution.retry.*}.
 * Non-retryable failures are rethrown on the first attempt.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryHandler {

    private final ExecutionConfig executionConfig;

    /**
     * Execute operation with the configured attempt count
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, executionConfig.getRetry().getMaxAttempts());
    }

    /**
     * Execute operation with custom retry count
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts) {
        int attempt = 0;
        RuntimeException lastException = null;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                attempt++;

                if (!isRetryable(e)) {
                    log.warn("[RETRY] Operation '{}' failed with non-retryable {}: {}",
                        operationName, e.getClass().getSimpleName(), e.getMessage());
                    throw e;
                }

                if (attempt >= maxAttempts) {
                    log.error("[RETRY] Operation '{}' failed after {} attempts", operationName, maxAttempts);
                    break;
                }

                long delayMs = calculateBackoffDelay(attempt);
                log.warn("[RETRY] Operation '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operationName, attempt, ie);
                }
            }
        }

        throw new RetryExhaustedException(operationName, maxAttempts, lastException);
    }

    /**
     * Execute operation with retry logic (void return)
     */
    public void executeWithRetry(Runnable operation, String operationName) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName);
    }

    /**
     * Calculate backoff delay using exponential backoff
     */
    long calculateBackoffDelay(int attempt) {
        ExecutionConfig.RetryConfig retry = executionConfig.getRetry();
        long delay = (long) (retry.getInitialDelayMs() * Math.pow(retry.getMultiplier(), attempt - 1));
        return Math.min(delay, retry.getMaxDelayMs());
    }

    /**
     * Check if exception is retryable
     */
    public boolean isRetryable(Throwable e) {
        if (e instanceof TransientDataAccessException) {
            return true;
        }
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof java.net.SocketTimeoutException ||
                cause instanceof java.net.ConnectException ||
                cause instanceof java.io.IOException) {
                return true;
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }

        // Check exception message for common transient errors
        String message = e.getMessage();
        if (message != null) {
            String lower = message.toLowerCase();
            return lower.contains("timeout") ||
                   lower.contains("connection refused") ||
                   lower.contains("temporarily unavailable");
        }

        return false;
    }

    /**
     * Raised when every attempt failed; the cause is the last failure.
     */
    public static class RetryExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryExhaustedException(String operationName, int attempts, Throwable cause) {
            super(String.format("Operation '%s' failed after %d attempts", operationName, attempts), cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
