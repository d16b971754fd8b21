package com.astrolabe.model;

import java.util.Objects;

/**
 * One line of the fields resource: canonical ObsCore key, datatype tag, required flag
 * and default literal. Immutable.
 */
public class SchemaEntry {

    /** Default literal marking a field with no default (its value is found or computed). */
    public static final String NO_DEFAULT_VALUE = "*";

    private final String canonicalKey;
    private final String datatypeTag;
    private final boolean required;
    private final String defaultLiteral;

    public SchemaEntry(String canonicalKey, String datatypeTag, boolean required, String defaultLiteral) {
        this.canonicalKey = Objects.requireNonNull(canonicalKey, "canonicalKey");
        this.datatypeTag = datatypeTag;
        this.required = required;
        this.defaultLiteral = (defaultLiteral == null) ? NO_DEFAULT_VALUE : defaultLiteral;
    }

    public String getCanonicalKey() { return canonicalKey; }

    /** The datatype tag as written in the resource; may name an unknown type. */
    public String getDatatypeTag() { return datatypeTag; }

    /** The parsed datatype, or null if the tag is unknown. */
    public DataType getDataType() { return DataType.fromTag(datatypeTag); }

    public boolean isRequired() { return required; }

    public String getDefaultLiteral() { return defaultLiteral; }

    public boolean hasDefault() {
        return !NO_DEFAULT_VALUE.equals(defaultLiteral);
    }

    @Override
    public String toString() {
        return canonicalKey + "[" + datatypeTag + (required ? ", required" : "") + ", default=" + defaultLiteral + "]";
    }
}
