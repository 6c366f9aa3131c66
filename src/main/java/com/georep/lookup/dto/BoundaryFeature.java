package com.georep.lookup.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Envelope;

/**
 * One administrative boundary loaded from a GeoJSON FeatureCollection.
 *
 * Held in dataset order and never mutated after load, so instances are
 * shared freely across request threads.
 *
 * @param name       boundary name taken from the property bag
 * @param properties the feature's original property bag
 * @param geometry   the feature's GeoJSON geometry object
 * @param envelope   bounding box of every vertex, or {@code null} when the
 *                   coordinates could not be read at load time
 */
public record BoundaryFeature(
    String name,
    JsonNode properties,
    JsonNode geometry,
    Envelope envelope
) {

    public BoundaryFeature {
        envelope = envelope != null ? new Envelope(envelope) : null;
    }

    /**
     * Bounding box of the geometry, as a copy so callers cannot widen or
     * shrink the one used by {@link #mayContain}.
     */
    @Override
    public Envelope envelope() {
        return envelope != null ? new Envelope(envelope) : null;
    }

    /**
     * Whether the point may lie inside this feature. Features without an
     * envelope always answer {@code true} so the full test still runs.
     */
    public boolean mayContain(double x, double y) {
        return envelope == null || envelope.covers(x, y);
    }

    /**
     * Returns the first non-blank textual property among the candidate keys.
     */
    public String firstProperty(Iterable<String> candidateKeys) {
        if (properties == null) {
            return null;
        }
        for (String key : candidateKeys) {
            JsonNode value = properties.get(key);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    /**
     * Renders this feature back into a GeoJSON Feature object.
     */
    public ObjectNode toGeoJson() {
        ObjectNode feature = JsonNodeFactory.instance.objectNode();
        feature.put("type", "Feature");
        feature.set("properties", properties != null ? properties.deepCopy() : JsonNodeFactory.instance.objectNode());
        feature.set("geometry", geometry != null ? geometry.deepCopy() : null);
        return feature;
    }

    public String toLogString() {
        return String.format("BoundaryFeature[name=%s, type=%s]",
            name, geometry != null && geometry.has("type") ? geometry.get("type").asText() : null);
    }
}
