package com.georep.lookup.geometry;

/**
 * Thrown when a supported geometry has coordinates that cannot be read:
 * missing arrays, wrong nesting, or positions with fewer than two ordinates.
 */
public class MalformedGeometryException extends GeometryException {

    public MalformedGeometryException(String message) {
        super(message);
    }
}
