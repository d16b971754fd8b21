package com.astrolabe.model;

public class CelestialPoint {
    public final double ra;
    public final double dec;

    public CelestialPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    public double getRa() { return ra; }

    public double getDec() { return dec; }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "(%.8f, %.8f)", ra, dec);
    }
}
