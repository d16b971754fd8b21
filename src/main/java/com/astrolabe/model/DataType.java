package com.astrolabe.model;

import java.util.Locale;

/**
 * Scalar datatypes a schema field may declare. The tag is the literal used in the
 * fields resource file.
 */
public enum DataType {
    INTEGER("integer"),
    DOUBLE("double"),
    STRING("string"),
    DATE("date");

    private final String tag;

    DataType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /** Returns the datatype for the given tag, or null when the tag is not one of ours. */
    public static DataType fromTag(String tag) {
        if (tag == null) return null;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (DataType dt : values()) {
            if (dt.tag.equals(t)) return dt;
        }
        return null;
    }
}
