package com.annal.version;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code major.minor} record version. Major moves on each checkpoint
 * snapshot, minor on each patch since the last checkpoint.
 */
public record Version(int major, int minor) implements Comparable<Version> {
    /** Tag of the origin snapshot written when a record is first created. */
    public static final Version ORIGIN = new Version(0, 0);
    /** Version of a freshly created live record. */
    public static final Version INITIAL = new Version(1, 0);

    public Version {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("version components must be non-negative: " + major + "." + minor);
        }
    }

    public Version nextMinor() {
        return new Version(major, minor + 1);
    }

    public Version nextMajor() {
        return new Version(major + 1, 0);
    }

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MetadataFields.MAJOR, major);
        fields.put(MetadataFields.MINOR, minor);
        return fields;
    }

    static Version fromFields(Object value) {
        if (value instanceof Map<?, ?> map
                && map.get(MetadataFields.MAJOR) instanceof Number major
                && map.get(MetadataFields.MINOR) instanceof Number minor) {
            return new Version(major.intValue(), minor.intValue());
        }
        throw new IllegalArgumentException("malformed version: " + value);
    }

    @Override
    public int compareTo(Version other) {
        int cmp = Integer.compare(major, other.major);
        return cmp != 0 ? cmp : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
