package com.astrolabe.model;

// Bounding box of an image footprint, in degrees.
public class SpatialLimits {
    public final double raMin;
    public final double raMax;
    public final double decMin;
    public final double decMax;

    public SpatialLimits(double raMin, double raMax, double decMin, double decMax) {
        this.raMin = raMin;
        this.raMax = raMax;
        this.decMin = decMin;
        this.decMax = decMax;
    }
}
