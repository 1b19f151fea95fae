package com.annal.store;

/**
 * Raised when an insert reuses an {@code _id} already present in the collection.
 */
public class DuplicateKeyException extends RuntimeException {
    private final String collection;
    private final String id;

    public DuplicateKeyException(String collection, String id) {
        super("duplicate _id '" + id + "' in collection '" + collection + "'");
        this.collection = collection;
        this.id = id;
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }
}
