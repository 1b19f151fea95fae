package com.annal.store;

public record UpdateResult(long matchedCount, long modifiedCount) {
    public static final UpdateResult NONE = new UpdateResult(0, 0);
}
