package com.annal.version;

public enum DeltaType {
    SNAPSHOT("snapshot"),
    PATCH("patch");

    private final String tag;

    DeltaType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    static DeltaType fromTag(Object tag) {
        for (DeltaType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown delta type '" + tag + "'");
    }
}
