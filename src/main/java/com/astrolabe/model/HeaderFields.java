package com.astrolabe.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyword to value-string pairs of one FITS header unit, in card order.
 */
public class HeaderFields {

    private final Map<String, String> cards;

    public HeaderFields(Map<String, String> cards) {
        this.cards = Collections.unmodifiableMap(new LinkedHashMap<>(cards));
    }

    public String get(String keyword) {
        return cards.get(keyword);
    }

    public boolean has(String keyword) {
        return cards.containsKey(keyword);
    }

    public Map<String, String> asMap() {
        return cards;
    }

    public int size() {
        return cards.size();
    }

    @Override
    public String toString() {
        return cards.toString();
    }
}
