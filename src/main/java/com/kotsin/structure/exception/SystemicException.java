package com.kotsin.structure.exception;

/**
 * Store unreachable or similar. Aborts the whole run.
 */
public class SystemicException extends StructureException {

    public SystemicException(String message, Throwable cause) {
        super(message, cause);
    }
}
