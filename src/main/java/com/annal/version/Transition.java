package com.annal.version;

import java.util.Locale;

/**
 * The kind of write that produced the current state of a live record.
 */
public enum Transition {
    CREATED,
    PATCHED,
    SNAPSHOTTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    static Transition fromTag(String tag) {
        for (Transition t : values()) {
            if (t.tag().equals(tag)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown transition '" + tag + "'");
    }
}
