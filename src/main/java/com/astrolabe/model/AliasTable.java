package com.astrolabe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapping of FITS header keywords to ObsCore keys. Read-only once built, so one
 * instance is shared by every file of a run.
 */
public class AliasTable {

    private final Map<String, String> aliases;

    public AliasTable(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /** Returns the ObsCore key for the given header keyword, or null if none. */
    public String canonicalKeyFor(String headerKey) {
        return aliases.get(headerKey);
    }

    public Map<String, String> asMap() {
        return aliases;
    }

    public int size() {
        return aliases.size();
    }
}
