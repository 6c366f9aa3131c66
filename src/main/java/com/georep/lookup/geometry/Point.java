package com.georep.lookup.geometry;

import java.util.Locale;

/**
 * A planar query point.
 *
 * Coordinates follow GeoJSON order: {@code x} is longitude and {@code y} is
 * latitude, both in decimal degrees. Callers that hold a (lat, lon) pair
 * should go through {@link #ofLatLon(double, double)} so the axes are never
 * swapped by accident.
 *
 * @param x longitude
 * @param y latitude
 */
public record Point(double x, double y) {

    public static Point ofLatLon(double latitude, double longitude) {
        return new Point(longitude, latitude);
    }

    public double latitude() {
        return y;
    }

    public double longitude() {
        return x;
    }

    public String toLogString() {
        return String.format(Locale.ROOT, "Point[lat=%.6f, lon=%.6f]", y, x);
    }
}
