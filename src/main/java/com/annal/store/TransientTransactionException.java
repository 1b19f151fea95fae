package com.annal.store;

/**
 * A transaction attempt lost a race with a concurrent writer. The store
 * retries the whole callback when it sees this.
 */
public class TransientTransactionException extends TransactionException {
    public TransientTransactionException(String message) {
        super(message);
    }
}
