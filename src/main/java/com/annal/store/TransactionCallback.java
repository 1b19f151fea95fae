package com.annal.store;

@FunctionalInterface
public interface TransactionCallback<T> {
    T execute(DocumentOperations session);
}
