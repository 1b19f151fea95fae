package com.annal.store;

public record DeleteResult(long deletedCount) {
}
