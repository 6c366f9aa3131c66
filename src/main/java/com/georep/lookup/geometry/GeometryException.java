package com.georep.lookup.geometry;

/**
 * Base type for boundary geometry that cannot be evaluated.
 *
 * A geometry problem is a data-integrity issue, never a negative lookup
 * result, so it is signalled with an exception rather than {@code false}.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }
}
