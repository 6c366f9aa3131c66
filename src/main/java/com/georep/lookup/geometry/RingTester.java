package com.georep.lookup.geometry;

import java.util.List;

/**
 * Point-in-ring test for a single closed polygon ring.
 */
public final class RingTester {

    static final int MIN_RING_SIZE = 3;

    private RingTester() {}

    /**
     * Determines whether a point lies inside a ring using the
     * <b>ray-casting</b> (even-odd) rule.
     * <p>
     * A horizontal ray is cast from the point towards positive x. Every edge
     * the ray crosses toggles the inside flag; an odd number of crossings
     * means the point is inside.
     * </p>
     *
     * <pre>
     *          (3) •─────• (2)
     *               │     │
     *    point →  ● │     │   ──── ray ────▶
     *               │     │
     *          (4) •─────• (1)
     * </pre>
     *
     * An edge {@code (j → i)} counts as crossed when its endpoints straddle
     * the point's y ({@code (yi > y) != (yj > y)}) and the edge meets that
     * horizontal line to the right of the point. Horizontal edges never pass
     * the straddle test, so the division below never sees {@code yj == yi}.
     * <p>
     * The loop {@code for (i = 0, j = n - 1; i < n; j = i++)} visits every
     * edge including last-to-first, so an unclosed ring behaves as if it
     * were closed. Points lying exactly on an edge get whichever answer the
     * arithmetic produces.
     * </p>
     *
     * @param p    the test point
     * @param ring ring vertices, closed or not
     * @return {@code true} if the point is inside; {@code false} for rings
     *         with fewer than three vertices
     */
    public static boolean contains(Point p, List<Point> ring) {
        int n = ring.size();
        if (n < MIN_RING_SIZE) {
            return false;
        }

        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = ring.get(i).x(), yi = ring.get(i).y();
            double xj = ring.get(j).x(), yj = ring.get(j).y();
            boolean intersect = ((yi > p.y()) != (yj > p.y())) &&
                (p.x() < (xj - xi) * (p.y() - yi) / (yj - yi) + xi);
            if (intersect) inside = !inside;
        }
        return inside;
    }
}
