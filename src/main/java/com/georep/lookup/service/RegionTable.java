package com.georep.lookup.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable boundary name → region name index.
 *
 * The table is authored the way delimitation orders publish it, region →
 * list of boundary names, and inverted here so lookups are a single map
 * access. A second index keyed by normalized name tolerates spelling
 * variants of reserved constituencies.
 */
public final class RegionTable {

    private final Map<String, String> regionByBoundary;
    private final Map<String, String> regionByNormalizedBoundary;

    private RegionTable(Map<String, String> regionByBoundary, Map<String, String> regionByNormalizedBoundary) {
        this.regionByBoundary = regionByBoundary;
        this.regionByNormalizedBoundary = regionByNormalizedBoundary;
    }

    /**
     * Inverts an authored region → boundary names table.
     *
     * @throws IllegalArgumentException if a boundary name appears twice, or
     *         two names normalize to the same key under different regions
     */
    public static RegionTable fromAuthored(Map<String, List<String>> boundariesByRegion, NameNormalizer normalizer) {
        Map<String, String> byBoundary = new LinkedHashMap<>();
        Map<String, String> byNormalized = new LinkedHashMap<>();

        boundariesByRegion.forEach((region, boundaries) -> {
            for (String boundary : boundaries) {
                String key = boundary.trim();
                String previous = byBoundary.putIfAbsent(key, region);
                if (previous != null) {
                    throw new IllegalArgumentException(String.format(
                        "Boundary '%s' is authored under both '%s' and '%s'", key, previous, region));
                }
                String normalized = normalizer.normalize(key);
                String previousNormalized = byNormalized.putIfAbsent(normalized, region);
                if (previousNormalized != null && !previousNormalized.equals(region)) {
                    throw new IllegalArgumentException(String.format(
                        "Boundary '%s' normalizes to '%s', already authored under '%s', but is listed under '%s'",
                        key, normalized, previousNormalized, region));
                }
            }
        });

        return new RegionTable(
            Collections.unmodifiableMap(byBoundary),
            Collections.unmodifiableMap(byNormalized));
    }

    public Optional<String> regionOf(String boundaryName) {
        return Optional.ofNullable(regionByBoundary.get(boundaryName));
    }

    public Optional<String> regionOfNormalized(String normalizedName) {
        return Optional.ofNullable(regionByNormalizedBoundary.get(normalizedName));
    }

    public int size() {
        return regionByBoundary.size();
    }
}
