package com.astrolabe.service;

import com.astrolabe.model.CelestialPoint;
import java.util.Optional;

/**
 * Maps 1-based FITS pixel coordinates to sky coordinates (degrees).
 */
public interface SkyTransform {

    /** Returns the sky position of the pixel, or empty if the transform fails for it. */
    Optional<CelestialPoint> pixelToSky(double x, double y);
}
