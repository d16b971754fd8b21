package com.astrolabe.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The per-file field table, keyed by canonical key in schema order. Records are created
 * from the schema once and never added or removed afterwards.
 */
public class FieldsInfo {

    private final Map<String, FieldRecord> fields = new LinkedHashMap<>();

    private FieldsInfo() {
    }

    /** Builds a fresh table, with no values, from the given schema entries. */
    public static FieldsInfo fromSchema(Map<String, SchemaEntry> schema) {
        FieldsInfo info = new FieldsInfo();
        for (SchemaEntry entry : schema.values()) {
            info.fields.put(entry.getCanonicalKey(), new FieldRecord(entry));
        }
        return info;
    }

    public FieldRecord get(String key) {
        return fields.get(key);
    }

    public boolean contains(String key) {
        return fields.containsKey(key);
    }

    public boolean containsAll(Collection<String> keys) {
        return fields.keySet().containsAll(keys);
    }

    /** Value of the named field, or null when the field is absent or unset. */
    public Object getValueFor(String key) {
        FieldRecord rec = fields.get(key);
        return (rec != null) ? rec.getValue() : null;
    }

    public boolean hasValueFor(String key) {
        return getValueFor(key) != null;
    }

    /** Sets the named field unless it is absent or already has a value. */
    public boolean setValueIfAbsent(String key, Object value) {
        FieldRecord rec = fields.get(key);
        return rec != null && rec.setValueIfAbsent(value);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public Collection<FieldRecord> records() {
        return Collections.unmodifiableCollection(fields.values());
    }

    /** The fields that have a value, in schema order. */
    public Map<String, Object> valued() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (FieldRecord rec : fields.values()) {
            if (rec.hasValue()) out.put(rec.getKey(), rec.getValue());
        }
        return out;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return fields.values().toString();
    }
}
