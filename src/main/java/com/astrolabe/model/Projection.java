package com.astrolabe.model;

/**
 * The tangent-plane projections we can process, identified by the CTYPE1 value.
 * The tag tells which reference value (CRVAL1 or CRVAL2) holds right ascension.
 */
public enum Projection {
    RA_TAN("RA---TAN", true),
    DEC_TAN("DEC--TAN", false);

    private final String ctype;
    private final boolean raOnFirstAxis;

    Projection(String ctype, boolean raOnFirstAxis) {
        this.ctype = ctype;
        this.raOnFirstAxis = raOnFirstAxis;
    }

    public String getCtype() { return ctype; }

    public boolean isRaOnFirstAxis() { return raOnFirstAxis; }

    /** Returns the projection for a CTYPE1 value, or null if it is not supported. */
    public static Projection fromCtype1(String ctype1) {
        if (ctype1 == null) return null;
        String t = ctype1.trim();
        for (Projection p : values()) {
            if (p.ctype.equals(t)) return p;
        }
        return null;
    }
}
