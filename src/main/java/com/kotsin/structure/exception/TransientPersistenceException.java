package com.kotsin.structure.exception;

/**
 * Write failure that survived the store's retries. Fails the current symbol only.
 */
public class TransientPersistenceException extends StructureException {

    public TransientPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
