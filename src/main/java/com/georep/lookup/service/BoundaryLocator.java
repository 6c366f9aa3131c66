package com.georep.lookup.service;

import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.geometry.GeometryMatcher;
import com.georep.lookup.geometry.MalformedGeometryException;
import com.georep.lookup.geometry.Point;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Linear scan of boundary features for the ones containing a point.
 *
 * Feature order is significant: {@link #locate} returns the first match in
 * dataset order, not the smallest or best one. The scan is linear on
 * purpose; the datasets hold a few dozen constituencies.
 *
 * Per feature:
 * 1. Envelope pre-check (cheap rejection of far-away features)
 * 2. Full ring test via {@link GeometryMatcher}
 * 3. Malformed coordinates: logged, counted, treated as non-matching
 * 4. Unsupported geometry types: propagated to the caller
 */
@Slf4j
@RequiredArgsConstructor
public class BoundaryLocator {

    private final GeometryMatcher geometryMatcher;
    private final LongAdder malformedSkips = new LongAdder();

    public Optional<BoundaryFeature> locate(Point point, List<BoundaryFeature> features) {
        for (BoundaryFeature feature : features) {
            if (matches(point, feature)) {
                log.debug("Boundary found: {}", feature.name());
                return Optional.of(feature);
            }
        }
        log.debug("No boundary contains {}", point.toLogString());
        return Optional.empty();
    }

    public List<BoundaryFeature> locateAll(Point point, List<BoundaryFeature> features) {
        List<BoundaryFeature> matched = new ArrayList<>();
        for (BoundaryFeature feature : features) {
            if (matches(point, feature)) {
                matched.add(feature);
            }
        }
        return matched;
    }

    private boolean matches(Point point, BoundaryFeature feature) {
        if (!feature.mayContain(point.x(), point.y())) {
            return false;
        }
        try {
            return geometryMatcher.contains(point, feature.geometry());
        } catch (MalformedGeometryException e) {
            malformedSkips.increment();
            log.warn("Skipping malformed boundary {}: {}", feature.toLogString(), e.getMessage());
            return false;
        }
    }

    /**
     * Number of feature checks skipped because of malformed coordinates
     * since startup.
     */
    public long malformedSkips() {
        return malformedSkips.sum();
    }
}
