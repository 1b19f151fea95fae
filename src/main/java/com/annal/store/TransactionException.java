package com.annal.store;

/**
 * A transaction could not be committed. Nothing it staged has been applied.
 */
public class TransactionException extends RuntimeException {
    public TransactionException(String message) {
        super(message);
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
