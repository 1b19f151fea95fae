package com.annal.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Primary-key fields are missing from a record, or two records compared with
 * each other disagree on a primary-key value.
 */
public class KeyConsistencyException extends RuntimeException {
    private final String field;
    private final List<Object> values;

    private KeyConsistencyException(String message, String field, List<Object> values) {
        super(message);
        this.field = field;
        this.values = values;
    }

    static KeyConsistencyException missing(String field, String recordType) {
        return new KeyConsistencyException(
                "primary-key field '" + field + "' is not present in the " + recordType + " record",
                field, Collections.emptyList());
    }

    static KeyConsistencyException mismatch(String field, List<Object> values) {
        return new KeyConsistencyException(
                "records disagree on primary-key field '" + field + "': " + values,
                field, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /** The offending primary-key field. */
    public String getField() {
        return field;
    }

    /** The conflicting values, empty when the field was missing. */
    public List<Object> getValues() {
        return values;
    }
}
