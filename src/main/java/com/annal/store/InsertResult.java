package com.annal.store;

public record InsertResult(String insertedId) {
}
