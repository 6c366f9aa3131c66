package com.georep.lookup.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads GeoJSON coordinate arrays into {@link Point} lists.
 *
 * Positions are {@code [lon, lat]} or {@code [lon, lat, alt]}; any extra
 * ordinates are ignored.
 */
public final class GeoJsonCoordinates {

    public static final String POLYGON = "Polygon";
    public static final String MULTI_POLYGON = "MultiPolygon";

    private GeoJsonCoordinates() {}

    public static String typeOf(JsonNode geometry) {
        if (geometry == null || !geometry.isObject()) {
            return null;
        }
        JsonNode type = geometry.get("type");
        return type != null && type.isTextual() ? type.asText() : null;
    }

    public static JsonNode coordinatesOf(JsonNode geometry) {
        JsonNode coordinates = geometry.get("coordinates");
        if (coordinates == null || !coordinates.isArray()) {
            throw new MalformedGeometryException("Geometry has no coordinate array");
        }
        return coordinates;
    }

    public static List<Point> readRing(JsonNode ringNode) {
        requireArray(ringNode, "ring");
        List<Point> ring = new ArrayList<>(ringNode.size());
        for (JsonNode position : ringNode) {
            ring.add(readPosition(position));
        }
        return ring;
    }

    public static Point readPosition(JsonNode position) {
        if (position == null || !position.isArray() || position.size() < 2
            || !position.get(0).isNumber() || !position.get(1).isNumber()) {
            throw new MalformedGeometryException("Invalid position: " + position);
        }
        return new Point(position.get(0).asDouble(), position.get(1).asDouble());
    }

    static void requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new MalformedGeometryException("Expected " + what + " array but found: " + node);
        }
    }

    /**
     * Bounding box over every exterior and hole vertex of a Polygon or
     * MultiPolygon.
     *
     * @return the envelope, or {@code null} if the geometry is unsupported,
     *         malformed or has no vertices
     */
    public static Envelope envelopeOf(JsonNode geometry) {
        String type = typeOf(geometry);
        Envelope envelope = new Envelope();
        try {
            if (POLYGON.equals(type)) {
                expand(envelope, coordinatesOf(geometry));
            } else if (MULTI_POLYGON.equals(type)) {
                for (JsonNode polygon : coordinatesOf(geometry)) {
                    requireArray(polygon, "polygon");
                    expand(envelope, polygon);
                }
            } else {
                return null;
            }
        } catch (MalformedGeometryException e) {
            return null;
        }
        return envelope.isNull() ? null : envelope;
    }

    private static void expand(Envelope envelope, JsonNode rings) {
        for (JsonNode ringNode : rings) {
            for (Point p : readRing(ringNode)) {
                envelope.expandToInclude(p.x(), p.y());
            }
        }
    }
}
