package com.astrolabe.model;

/**
 * Working state for a single field while one file is being resolved. The schema part is
 * fixed; the header attachment and the resolved value are filled in by the pipeline.
 * A resolved value of null means "unset".
 */
public class FieldRecord {

    private final SchemaEntry entry;
    private String sourceHeaderKey;
    private String sourceValueString;
    private Object value;

    public FieldRecord(SchemaEntry entry) {
        this.entry = entry;
    }

    public SchemaEntry getEntry() { return entry; }

    public String getKey() { return entry.getCanonicalKey(); }

    public String getSourceHeaderKey() { return sourceHeaderKey; }

    public String getSourceValueString() { return sourceValueString; }

    public boolean hasSourceValue() { return sourceValueString != null; }

    /** Records the header card this field was aliased from. A later card replaces an earlier one. */
    public void attachHeader(String headerKey, String valueString) {
        this.sourceHeaderKey = headerKey;
        this.sourceValueString = valueString;
    }

    public Object getValue() { return value; }

    public boolean hasValue() { return value != null; }

    /**
     * Sets the resolved value unless one is already present.
     * @return true if the value was stored
     */
    public boolean setValueIfAbsent(Object newValue) {
        if (value != null || newValue == null) return false;
        value = newValue;
        return true;
    }

    @Override
    public String toString() {
        return getKey() + "=" + value + (sourceHeaderKey != null ? " (from " + sourceHeaderKey + "='" + sourceValueString + "')" : "");
    }
}
