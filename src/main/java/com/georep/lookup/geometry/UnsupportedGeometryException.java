package com.georep.lookup.geometry;

/**
 * Thrown when a geometry carries a type other than Polygon or MultiPolygon.
 */
public class UnsupportedGeometryException extends GeometryException {

    private final String geometryType;

    public UnsupportedGeometryException(String geometryType) {
        super("Unsupported geometry type: " + geometryType);
        this.geometryType = geometryType;
    }

    public String getGeometryType() {
        return geometryType;
    }
}
