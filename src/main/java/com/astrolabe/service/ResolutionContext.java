package com.astrolabe.service;

import com.astrolabe.model.CelestialPoint;
import com.astrolabe.model.FieldsInfo;
import com.astrolabe.model.HeaderFields;
import com.astrolabe.model.SpatialLimits;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Inputs shared by the compute rules while one file is resolved. Geometry needed by
 * several fields (reference coordinates, corners, limits) is computed once and kept here.
 */
public class ResolutionContext {
    private final Path file;
    private final HeaderFields header;
    private final FieldsInfo fieldsInfo;
    private final GeometryService geometry;

    private Optional<CelestialPoint> referenceCoords;
    private List<CelestialPoint> corners;

    public ResolutionContext(Path file, HeaderFields header, FieldsInfo fieldsInfo, GeometryService geometry) {
        this.file = file;
        this.header = header;
        this.fieldsInfo = fieldsInfo;
        this.geometry = geometry;
    }

    public Path getFile() { return file; }

    public HeaderFields getHeader() { return header; }

    public FieldsInfo getFieldsInfo() { return fieldsInfo; }

    public GeometryService getGeometry() { return geometry; }

    public Object valueFor(String key) {
        return fieldsInfo.getValueFor(key);
    }

    public Optional<CelestialPoint> referenceCoords() {
        if (referenceCoords == null) referenceCoords = geometry.calcReferenceCoords(header);
        return referenceCoords;
    }

    /**
     * The four footprint corners, or empty when any corner is unavailable or the schema does
     * not hold all eight corner fields.
     */
    public Optional<List<CelestialPoint>> corners() {
        if (corners == null) {
            if (!fieldsInfo.containsAll(GeometryService.CORNER_KEYS)) {
                corners = Collections.emptyList();
            } else {
                corners = geometry.calcCorners(header);
            }
        }
        if (corners.size() != 4 || corners.contains(null)) return Optional.empty();
        return Optional.of(corners);
    }

    public Optional<CelestialPoint> corner(int index) {
        return corners().map(c -> c.get(index));
    }

    public Optional<SpatialLimits> spatialLimits() {
        return corners().flatMap(geometry::calcSpatialLimits);
    }
}
