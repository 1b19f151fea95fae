package com.annal.store;

/**
 * A document store that can run several operations atomically.
 */
public interface DocumentStore extends DocumentOperations {

    /**
     * Runs the callback so that either all of its writes apply or none do.
     * The callback may be invoked more than once when the attempt conflicts
     * with a concurrent writer, so it must read everything it depends on
     * through the session it is given.
     *
     * @throws TransactionException when the attempts are exhausted or the commit fails
     */
    <T> T runInTransaction(TransactionCallback<T> callback, TransactionOptions options);
}
