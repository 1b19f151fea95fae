package com.annal.version;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class DiffEngineTest {
    private static final String KEY = "__meta";
    private final DiffEngine engine = new DiffEngine(RecordType.of("people", "id"), KEY);

    @Test
    public void testDiffDescribesWayBack() {
        Map<String, Object> newer = Map.of("id", 1, "a", 2, "b", 9);
        Map<String, Object> older = Map.of("id", 1, "a", 1, "c", "gone");

        Deltas deltas = engine.diff(newer, older, List.of());

        assertEquals(Map.of("c", "gone"), deltas.added());
        assertEquals(Map.of("a", 1), deltas.updated());
        assertEquals(Set.of("b"), deltas.removed());

        Map<String, Object> working = new HashMap<>(newer);
        deltas.applyTo(working, Logger.getLogger(DiffEngineTest.class.getName()));
        assertEquals(older, working);
    }

    @Test
    public void testIdAndHeaderAreNeverCompared() {
        Map<String, Object> newer = Map.of("id", 1, "_id", "x", KEY, Map.of("version", 2), "a", 1);
        Map<String, Object> older = Map.of("id", 1, "_id", "y", "a", 1);
        assertTrue(engine.diff(newer, older, null).isEmpty());
    }

    @Test
    public void testIgnoredFieldsAreSkipped() {
        Deltas deltas = engine.diff(Map.of("id", 1, "seen", 2), Map.of("id", 1, "seen", 1), List.of("seen"));
        assertTrue(deltas.isEmpty());
    }

    @Test
    public void testNumbersCompareByValue() {
        assertTrue(engine.updates(Map.of("id", 1, "n", 3), Map.of("id", 1, "n", 3L), List.of()).isEmpty());
        assertTrue(engine.updates(Map.of("id", 1, "n", List.of(1, 2)), Map.of("id", 1, "n", List.of(1L, 2L)), List.of()).isEmpty());
    }

    @Test
    public void testRemovingAbsentFieldLeavesRecordUnchanged() {
        Deltas deltas = new Deltas(Map.of(), Map.of(), Set.of("ghost"));
        Map<String, Object> working = new HashMap<>(Map.of("id", 1, "a", 2));

        deltas.applyTo(working, Logger.getLogger(DiffEngineTest.class.getName()));

        assertEquals(Map.of("id", 1, "a", 2), working);
    }

    @Test
    public void testMismatchedKeysAreRejected() {
        KeyConsistencyException e = assertThrows(KeyConsistencyException.class,
                () -> engine.diff(Map.of("id", 1), Map.of("id", 2), List.of()));
        assertEquals("id", e.getField());
        assertEquals(List.of(1, 2), e.getValues());
    }

    @Test
    public void testMissingKeyIsRejected() {
        KeyConsistencyException e = assertThrows(KeyConsistencyException.class,
                () -> engine.checkKeys(Map.of("id", 1), Map.of("name", "x")));
        assertEquals("id", e.getField());
        assertTrue(e.getValues().isEmpty());
    }
}
