package com.annal.store;

import java.time.Duration;

/**
 * Consistency settings for {@link DocumentStore#runInTransaction}.
 *
 * @param readConcern  isolation of reads made inside the transaction
 * @param writeConcern acknowledgment required at commit, with its maximum wait
 * @param maxAttempts  how many times a conflicting callback is run before giving up
 */
public record TransactionOptions(ReadConcern readConcern, WriteConcern writeConcern, int maxAttempts) {

    public TransactionOptions {
        if (readConcern == null || writeConcern == null) {
            throw new IllegalArgumentException("read and write concern must be non-null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    /** Local reads, majority commit with a one second wait, five attempts. */
    public static TransactionOptions defaults() {
        return new TransactionOptions(ReadConcern.LOCAL, WriteConcern.majority(Duration.ofSeconds(1)), 5);
    }

    public TransactionOptions withMaxAttempts(int attempts) {
        return new TransactionOptions(readConcern, writeConcern, attempts);
    }

    public TransactionOptions withCommitTimeout(Duration timeout) {
        return new TransactionOptions(readConcern, new WriteConcern(writeConcern.acknowledgment(), timeout), maxAttempts);
    }

    public enum ReadConcern {
        /** Latest committed data, no snapshot across reads. */
        LOCAL,
        MAJORITY,
        SNAPSHOT
    }

    public record WriteConcern(String acknowledgment, Duration timeout) {
        public static final String MAJORITY = "majority";

        public WriteConcern {
            if (acknowledgment == null || acknowledgment.isBlank()) {
                throw new IllegalArgumentException("acknowledgment must be non-blank");
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("write concern timeout must be positive");
            }
        }

        public static WriteConcern majority(Duration timeout) {
            return new WriteConcern(MAJORITY, timeout);
        }
    }
}
