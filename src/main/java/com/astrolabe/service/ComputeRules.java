package com.astrolabe.service;

import com.astrolabe.model.CelestialPoint;
import com.astrolabe.model.SpatialLimits;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The table of computed fields, keyed by canonical key.
 */
public final class ComputeRules {

    /** File name prefixes and the survey target they belong to. */
    static final Map<String, String> TARGET_PREFIXES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("goods_s", "goods_south");
        m.put("goods_n", "goods_north");
        m.put("hudf", "hudf");
        m.put("udf", "hudf");
        TARGET_PREFIXES = Collections.unmodifiableMap(m);
    }

    static final String INSTRUMENT = "NIRCam";

    private ComputeRules() {
    }

    public static Map<String, ComputeRule> defaultRules() {
        Map<String, ComputeRule> rules = new LinkedHashMap<>();

        // --- coordinates of the reference pixel ---
        rules.put("s_ra", ctx -> ctx.referenceCoords().map(CelestialPoint::getRa));
        rules.put("s_dec", ctx -> ctx.referenceCoords().map(CelestialPoint::getDec));

        // --- footprint ---
        for (int i = 0; i < 4; i++) {
            final int idx = i;
            rules.put("im_ra" + (i + 1), ctx -> ctx.corner(idx).map(CelestialPoint::getRa));
            rules.put("im_dec" + (i + 1), ctx -> ctx.corner(idx).map(CelestialPoint::getDec));
        }
        rules.put("spat_lolimit1", limit(l -> l.raMin));
        rules.put("spat_hilimit1", limit(l -> l.raMax));
        rules.put("spat_lolimit2", limit(l -> l.decMin));
        rules.put("spat_hilimit2", limit(l -> l.decMax));

        rules.put("im_scale", ctx -> ctx.getGeometry().calcPlateScale(ctx.getHeader()));
        rules.put("im_pixtype", ctx -> ctx.getGeometry().calcPixtype(ctx.getHeader()));
        rules.put("s_resolution", ctx -> {
            Object filter = ctx.valueFor("filter");
            return (filter != null) ? ctx.getGeometry().spatialResolution(filter.toString()) : Optional.empty();
        });

        rules.put("im_naxis1", ctx -> Optional.ofNullable(ctx.valueFor("s_xel1")));
        rules.put("im_naxis2", ctx -> Optional.ofNullable(ctx.valueFor("s_xel2")));

        rules.put("access_url", ComputeRules::accessUrl);
        rules.put("instrument_name", ComputeRules::instrumentName);
        rules.put("target_name", ComputeRules::targetName);

        return Collections.unmodifiableMap(rules);
    }

    private static ComputeRule limit(Function<SpatialLimits, Double> pick) {
        return ctx -> ctx.spatialLimits().map(pick);
    }

    static Optional<String> accessUrl(ResolutionContext ctx) {
        Object path = ctx.valueFor("file_path");
        return (path != null) ? Optional.of("file://" + path) : Optional.empty();
    }

    static Optional<String> instrumentName(ResolutionContext ctx) {
        Object module = ctx.valueFor("nircam_module");
        return Optional.of((module != null) ? INSTRUMENT + "-" + module.toString().trim() : INSTRUMENT);
    }

    static Optional<String> targetName(ResolutionContext ctx) {
        Object name = ctx.valueFor("file_name");
        if (name == null) return Optional.empty();
        return targetFromFileName(name.toString());
    }

    static Optional<String> targetFromFileName(String fileName) {
        String lower = fileName.toLowerCase(java.util.Locale.ROOT);
        for (Map.Entry<String, String> e : TARGET_PREFIXES.entrySet()) {
            if (lower.startsWith(e.getKey())) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }
}
