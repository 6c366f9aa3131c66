package com.georep.lookup.repository;

import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.dto.RepresentativeRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the lookup needs, loaded once at startup.
 *
 * All collections are unmodifiable copies that keep file order; the
 * locator's first-match-wins policy depends on feature order.
 *
 * @param acFeatures assembly constituency boundaries
 * @param pcFeatures parliamentary constituency boundaries
 * @param acData     MLA records keyed by assembly constituency name
 * @param pcData     MP records keyed by parliamentary constituency name
 */
public record BoundaryDataset(
    List<BoundaryFeature> acFeatures,
    List<BoundaryFeature> pcFeatures,
    Map<String, RepresentativeRecord> acData,
    Map<String, RepresentativeRecord> pcData
) {

    public BoundaryDataset {
        acFeatures = List.copyOf(acFeatures);
        pcFeatures = List.copyOf(pcFeatures);
        acData = Collections.unmodifiableMap(new LinkedHashMap<>(acData));
        pcData = Collections.unmodifiableMap(new LinkedHashMap<>(pcData));
    }

    public static BoundaryDataset empty() {
        return new BoundaryDataset(List.of(), List.of(), Map.of(), Map.of());
    }

    public boolean isReady() {
        return !acFeatures.isEmpty();
    }
}
