package com.georep.lookup.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Maps a matched assembly constituency to its parliamentary constituency.
 */
@Slf4j
@RequiredArgsConstructor
public class RegionMapper {

    private final RegionTable regionTable;
    private final NameNormalizer normalizer;

    /**
     * @return the parent region, or empty when the table has no entry
     */
    public Optional<String> mapToRegion(String boundaryName) {
        if (boundaryName == null || boundaryName.isBlank()) {
            return Optional.empty();
        }

        String trimmed = boundaryName.trim();
        Optional<String> region = regionTable.regionOf(trimmed)
            .or(() -> regionTable.regionOfNormalized(normalizer.normalize(trimmed)));

        if (region.isEmpty()) {
            log.warn("No region mapping for boundary: '{}'", trimmed);
        } else {
            log.debug("Region: {} -> {}", trimmed, region.get());
        }
        return region;
    }
}
