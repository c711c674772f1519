package com.kotsin.structure.exception;

/**
 * Root of the failures raised by the analytics core.
 *
 * Data-quality problems are never raised; they end up as diagnostics on an
 * INVALID dealer result.
 */
public abstract class StructureException extends RuntimeException {

    protected StructureException(String message) {
        super(message);
    }

    protected StructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
