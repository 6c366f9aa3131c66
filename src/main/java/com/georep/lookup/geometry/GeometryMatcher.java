package com.georep.lookup.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.georep.lookup.geometry.GeoJsonCoordinates.MULTI_POLYGON;
import static com.georep.lookup.geometry.GeoJsonCoordinates.POLYGON;

/**
 * Point-in-geometry test over GeoJSON Polygon and MultiPolygon objects.
 *
 * Geometries are the Jackson trees exactly as loaded from the boundary
 * files, e.g.
 * <pre>{@code
 * {"type": "Polygon", "coordinates": [[[77.50, 12.90], [77.70, 12.90], ...]]}
 * }</pre>
 * Each ring is handed to {@link RingTester}.
 */
@Component
public class GeometryMatcher {

    /**
     * @param p        the query point
     * @param geometry a GeoJSON geometry object
     * @return {@code true} if the geometry contains the point
     * @throws UnsupportedGeometryException if the type is missing or not
     *         Polygon/MultiPolygon
     * @throws MalformedGeometryException   if the coordinates cannot be read
     */
    public boolean contains(Point p, JsonNode geometry) {
        String type = GeoJsonCoordinates.typeOf(geometry);

        if (POLYGON.equals(type)) {
            return polygonContains(p, GeoJsonCoordinates.coordinatesOf(geometry));
        }
        if (MULTI_POLYGON.equals(type)) {
            for (JsonNode polygon : GeoJsonCoordinates.coordinatesOf(geometry)) {
                if (polygonContains(p, polygon)) {
                    return true;
                }
            }
            return false;
        }
        throw new UnsupportedGeometryException(type);
    }

    /**
     * Exterior ring must contain the point and no hole may.
     */
    boolean polygonContains(Point p, JsonNode rings) {
        GeoJsonCoordinates.requireArray(rings, "polygon");
        if (rings.isEmpty()) {
            return false;
        }

        List<Point> exterior = GeoJsonCoordinates.readRing(rings.get(0));
        if (!RingTester.contains(p, exterior)) {
            return false;
        }

        for (int i = 1; i < rings.size(); i++) {
            if (RingTester.contains(p, GeoJsonCoordinates.readRing(rings.get(i)))) {
                return false;
            }
        }
        return true;
    }
}
