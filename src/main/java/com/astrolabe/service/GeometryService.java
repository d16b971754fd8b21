package com.astrolabe.service;

import com.astrolabe.model.CelestialPoint;
import com.astrolabe.model.HeaderFields;
import com.astrolabe.model.Projection;
import com.astrolabe.model.SpatialLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Geometry derived from the WCS keywords of an image header: reference coordinates,
 * footprint corners, spatial limits, plate scale, pixel type and filter resolution.
 */
public class GeometryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeometryService.class);

    /** Spatial resolutions (arcsec) for NIRCam filters, keyed by filter name. */
    static final Map<String, Double> FILTER_RESOLUTIONS;
    static {
        Map<String, Double> m = new HashMap<>();
        m.put("F070W", 0.030);  m.put("F090W", 0.034);  m.put("F115W", 0.040);  m.put("F140M", 0.048);
        m.put("F150W", 0.050);  m.put("F162M", 0.055);  m.put("F164N", 0.056);  m.put("F150W2", 0.046);
        m.put("F182M", 0.062);  m.put("F187N", 0.064);  m.put("F200W", 0.066);  m.put("F210M", 0.071);
        m.put("F212N", 0.072);  m.put("F250M", 0.084);  m.put("F277W", 0.091);  m.put("F300M", 0.100);
        m.put("F322W2", 0.097); m.put("F323N", 0.108);  m.put("F335M", 0.111);  m.put("F356W", 0.115);
        m.put("F360M", 0.120);  m.put("F405N", 0.136);  m.put("F410M", 0.137);  m.put("F430M", 0.145);
        m.put("F444W", 0.145);  m.put("F460M", 0.155);  m.put("F466N", 0.158);  m.put("F470N", 0.160);
        m.put("F480M", 0.162);
        FILTER_RESOLUTIONS = Collections.unmodifiableMap(m);
    }

    /** ObsCore pixel type names keyed by BITPIX. */
    static final Map<Long, String> PIXTYPE_TABLE;
    static {
        Map<Long, String> m = new HashMap<>();
        m.put(8L, "byte");
        m.put(16L, "short");
        m.put(32L, "int");
        m.put(64L, "long");
        m.put(-32L, "float");
        m.put(-64L, "double");
        PIXTYPE_TABLE = Collections.unmodifiableMap(m);
    }

    public static final String UNKNOWN_PIXTYPE = "UNKNOWN";

    public static final List<String> CORNER_KEYS = Collections.unmodifiableList(Arrays.asList(
            "im_ra1", "im_dec1", "im_ra2", "im_dec2", "im_ra3", "im_dec3", "im_ra4", "im_dec4"));

    private final TypeCoercionService coercion;

    public GeometryService(TypeCoercionService coercion) {
        this.coercion = coercion;
    }

    /**
     * Plate scale in arcsec/pixel from the CD matrix:
     * {@code 3600 * sqrt(cd1_1^2 + cd1_2^2 + cd2_1^2 + cd2_2^2 / 2)}.
     */
    public Optional<Double> calcPlateScale(HeaderFields header) {
        Double cd11 = coercion.toDouble(header.get("CD1_1"));
        Double cd12 = coercion.toDouble(header.get("CD1_2"));
        Double cd21 = coercion.toDouble(header.get("CD2_1"));
        Double cd22 = coercion.toDouble(header.get("CD2_2"));
        if (cd11 == null || cd12 == null || cd21 == null || cd22 == null) return Optional.empty();
        return Optional.of(plateScale(cd11, cd12, cd21, cd22));
    }

    public static double plateScale(double cd11, double cd12, double cd21, double cd22) {
        return 3600.0 * Math.sqrt(cd11 * cd11 + cd12 * cd12 + cd21 * cd21 + (cd22 * cd22) / 2.0);
    }

    /** Pixel type for the header's BITPIX; empty only when BITPIX is missing. */
    public Optional<String> calcPixtype(HeaderFields header) {
        String bitpix = header.get("BITPIX");
        if (bitpix == null || bitpix.trim().isEmpty()) return Optional.empty();
        Long code;
        try {
            code = Long.parseLong(bitpix.trim());
        } catch (NumberFormatException e) {
            code = null;
        }
        return Optional.of(pixelType(code));
    }

    public static String pixelType(Long bitpix) {
        String type = (bitpix != null) ? PIXTYPE_TABLE.get(bitpix) : null;
        return (type != null) ? type : UNKNOWN_PIXTYPE;
    }

    public Optional<Double> spatialResolution(String filter) {
        if (filter == null) return Optional.empty();
        return Optional.ofNullable(FILTER_RESOLUTIONS.get(filter.trim()));
    }

    /**
     * Returns the projection named by CTYPE1.
     * @throws AbortFileProcessingException if CTYPE1 is present but not a tangent plane projection
     */
    public Optional<Projection> projectionOf(HeaderFields header) {
        String ctype1 = header.get("CTYPE1");
        if (ctype1 == null) return Optional.empty();
        Projection p = Projection.fromCtype1(ctype1);
        if (p == null) {
            throw new AbortFileProcessingException(
                "This program currently only handles Tangent Plane projection and cannot yet process files with CTYPE1 of '"
                + ctype1.trim() + "'.");
        }
        return Optional.of(p);
    }

    /**
     * Celestial coordinates of the reference pixel. Needs CTYPE1, CTYPE2, CRVAL1 and CRVAL2;
     * CTYPE1 decides which reference value is right ascension.
     * @throws AbortFileProcessingException for an unsupported projection
     */
    public Optional<CelestialPoint> calcReferenceCoords(HeaderFields header) {
        Double crval1 = coercion.toDouble(header.get("CRVAL1"));
        Double crval2 = coercion.toDouble(header.get("CRVAL2"));
        if (header.get("CTYPE1") == null || header.get("CTYPE2") == null || crval1 == null || crval2 == null) {
            return Optional.empty();
        }
        Projection p = projectionOf(header).get();
        return Optional.of(p.isRaOnFirstAxis() ? new CelestialPoint(crval1, crval2) : new CelestialPoint(crval2, crval1));
    }

    /**
     * Sky coordinates of the four image corners: lower-left (1,1), upper-left (1,NAXIS2),
     * upper-right (NAXIS1,NAXIS2), lower-right (NAXIS1,1). An element is null when its
     * transform failed. Returns an empty list when the header lacks the WCS keywords.
     * @throws AbortFileProcessingException for an unsupported projection
     */
    public List<CelestialPoint> calcCorners(HeaderFields header) {
        Optional<Projection> projection = projectionOf(header);
        Double naxis1 = coercion.toDouble(header.get("NAXIS1"));
        Double naxis2 = coercion.toDouble(header.get("NAXIS2"));
        if (!projection.isPresent() || naxis1 == null || naxis2 == null) return Collections.emptyList();

        Optional<TanProjection> trans = TanProjection.fromHeader(projection.get(), header, coercion);
        if (!trans.isPresent()) return Collections.emptyList();
        return calcCorners(trans.get(), naxis1, naxis2);
    }

    public List<CelestialPoint> calcCorners(SkyTransform trans, double naxis1, double naxis2) {
        double[][] pixelCorners = { {1.0, 1.0}, {1.0, naxis2}, {naxis1, naxis2}, {naxis1, 1.0} };
        List<CelestialPoint> corners = new ArrayList<>(4);
        for (double[] pix : pixelCorners) {
            Optional<CelestialPoint> sky;
            try {
                sky = trans.pixelToSky(pix[0], pix[1]);
            } catch (RuntimeException e) {
                LOGGER.debug("Transform failed for pixel ({}, {}): {}", pix[0], pix[1], e.getMessage());
                sky = Optional.empty();
            }
            corners.add(sky.orElse(null));
        }
        return corners;
    }

    /** Min/max of RA and Dec over the corners; empty unless all four corners are known. */
    public Optional<SpatialLimits> calcSpatialLimits(List<CelestialPoint> corners) {
        if (corners == null || corners.size() != 4 || corners.contains(null)) return Optional.empty();
        double raMin = Double.POSITIVE_INFINITY, raMax = Double.NEGATIVE_INFINITY;
        double decMin = Double.POSITIVE_INFINITY, decMax = Double.NEGATIVE_INFINITY;
        // TODO: footprints crossing RA 0/360 get a box spanning the whole sky, and s_ra (raw CRVAL)
        // is not normalized like the corners are; needs one wraparound rule for both
        for (CelestialPoint c : corners) {
            raMin = Math.min(raMin, c.ra);
            raMax = Math.max(raMax, c.ra);
            decMin = Math.min(decMin, c.dec);
            decMax = Math.max(decMax, c.dec);
        }
        return Optional.of(new SpatialLimits(raMin, raMax, decMin, decMax));
    }
}
