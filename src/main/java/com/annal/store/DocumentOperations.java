package com.annal.store;

import com.annal.query.Filter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD surface over named collections. Implemented both by a store itself
 * (each call commits on its own) and by the session handed to a
 * {@link TransactionCallback} (calls are staged until the transaction commits).
 */
public interface DocumentOperations {

    /** First document matching the filter, in insertion order. */
    Optional<Document> findOne(String collection, Filter filter);

    List<Document> find(String collection, Filter filter);

    /**
     * Inserts a document. A document without {@code _id} is assigned a fresh one.
     *
     * @throws DuplicateKeyException if the collection already holds the id
     */
    InsertResult insertOne(String collection, Document document);

    /** Replaces the first match, keeping its {@code _id}. */
    UpdateResult replaceOne(String collection, Filter filter, Document replacement);

    /**
     * Sets every given (dotted) path on all matching documents.
     */
    UpdateResult updateMany(String collection, Filter filter, Map<String, ?> setFields);

    DeleteResult deleteMany(String collection, Filter filter);
}
