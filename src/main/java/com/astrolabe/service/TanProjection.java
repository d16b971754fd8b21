package com.astrolabe.service;

import com.astrolabe.model.CelestialPoint;
import com.astrolabe.model.HeaderFields;
import com.astrolabe.model.Projection;
import java.util.Optional;

/**
 * Gnomonic (TAN) pixel to sky transform built from the linear WCS keywords of a header:
 * CRPIX, CRVAL, and either the CD matrix or CDELT scales. Native longitude of the pole
 * is the zenithal default of 180 degrees.
 */
public class TanProjection implements SkyTransform {

    private final double crpix1, crpix2;
    private final double cd11, cd12, cd21, cd22;
    private final double ra0, dec0;          // radians
    private final boolean raOnFirstAxis;

    public TanProjection(Projection projection, double crpix1, double crpix2, double crval1, double crval2,
                         double cd11, double cd12, double cd21, double cd22) {
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.raOnFirstAxis = projection.isRaOnFirstAxis();
        this.ra0 = Math.toRadians(raOnFirstAxis ? crval1 : crval2);
        this.dec0 = Math.toRadians(raOnFirstAxis ? crval2 : crval1);
    }

    /**
     * Builds a transform from header keywords. Returns empty when a needed keyword is
     * missing or unparsable.
     */
    public static Optional<TanProjection> fromHeader(Projection projection, HeaderFields header, TypeCoercionService coercion) {
        Double crpix1 = coercion.toDouble(header.get("CRPIX1"));
        Double crpix2 = coercion.toDouble(header.get("CRPIX2"));
        Double crval1 = coercion.toDouble(header.get("CRVAL1"));
        Double crval2 = coercion.toDouble(header.get("CRVAL2"));
        if (crpix1 == null || crpix2 == null || crval1 == null || crval2 == null) return Optional.empty();

        Double cd11 = coercion.toDouble(header.get("CD1_1"));
        Double cd12 = coercion.toDouble(header.get("CD1_2"));
        Double cd21 = coercion.toDouble(header.get("CD2_1"));
        Double cd22 = coercion.toDouble(header.get("CD2_2"));
        if (cd11 == null || cd22 == null) {
            // no CD matrix: fall back to a diagonal from CDELTi
            Double cdelt1 = coercion.toDouble(header.get("CDELT1"));
            Double cdelt2 = coercion.toDouble(header.get("CDELT2"));
            if (cdelt1 == null || cdelt2 == null) return Optional.empty();
            cd11 = cdelt1;
            cd22 = cdelt2;
            cd12 = 0.0;
            cd21 = 0.0;
        }
        return Optional.of(new TanProjection(projection, crpix1, crpix2, crval1, crval2,
                cd11, (cd12 != null) ? cd12 : 0.0, (cd21 != null) ? cd21 : 0.0, cd22));
    }

    @Override
    public Optional<CelestialPoint> pixelToSky(double x, double y) {
        double dx = x - crpix1;
        double dy = y - crpix2;
        // intermediate world coordinates, degrees
        double w1 = cd11 * dx + cd12 * dy;
        double w2 = cd21 * dx + cd22 * dy;
        double xi = Math.toRadians(raOnFirstAxis ? w1 : w2);
        double eta = Math.toRadians(raOnFirstAxis ? w2 : w1);

        double r = Math.hypot(xi, eta);
        double phi = (r == 0.0) ? 0.0 : Math.atan2(xi, -eta);
        double theta = Math.atan2(1.0, r);

        double sinT = Math.sin(theta), cosT = Math.cos(theta);
        double sinD0 = Math.sin(dec0), cosD0 = Math.cos(dec0);
        double sinP = Math.sin(phi), cosP = Math.cos(phi);

        double dec = Math.asin(sinT * sinD0 - cosT * cosD0 * cosP);
        double ra = ra0 + Math.atan2(cosT * sinP, sinT * cosD0 + cosT * sinD0 * cosP);

        double raDeg = Math.toDegrees(ra) % 360.0;
        if (raDeg < 0) raDeg += 360.0;
        double decDeg = Math.toDegrees(dec);
        if (Double.isNaN(raDeg) || Double.isNaN(decDeg) || Double.isInfinite(raDeg) || Double.isInfinite(decDeg)) {
            return Optional.empty();
        }
        return Optional.of(new CelestialPoint(raDeg, decDeg));
    }
}
