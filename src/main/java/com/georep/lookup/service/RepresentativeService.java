package com.georep.lookup.service;

import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.dto.LookupResult;
import com.georep.lookup.dto.RepresentativeRecord;
import com.georep.lookup.geometry.Point;
import com.georep.lookup.repository.BoundaryDataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Resolves coordinates to the MLA and MP representing them.
 *
 * Flow:
 * 1. Cache lookup by rounded coordinates (hit returns immediately)
 * 2. First assembly constituency whose polygon contains the point
 * 3. MLA record for that constituency
 * 4. Parent parliamentary constituency via the delimitation table
 * 5. MP record for that constituency
 * 6. Result stored in the cache, including "outside every boundary"
 */
@Slf4j
@RequiredArgsConstructor
public class RepresentativeService {

    public static final String UNMAPPED_REGION = "Unmapped";

    private final BoundaryDataset dataset;
    private final BoundaryLocator boundaryLocator;
    private final RegionMapper regionMapper;
    private final MetadataResolver metadataResolver;
    private final LookupCache lookupCache;
    private final List<String> constituencyNumberKeys;

    /**
     * @param latitude  query latitude
     * @param longitude query longitude
     * @return the lookup result; {@link LookupResult#isFound()} is false when
     *         the point lies outside every assembly constituency
     * @throws DatasetNotReadyException if no boundaries were loaded
     * @throws com.georep.lookup.geometry.UnsupportedGeometryException if a
     *         boundary has a geometry type other than Polygon/MultiPolygon
     */
    public LookupResult resolvePoint(double latitude, double longitude) {
        requireReady();
        return lookupCache.getOrCompute(latitude, longitude, () -> computeLookup(latitude, longitude));
    }

    LookupResult computeLookup(double latitude, double longitude) {
        Point point = Point.ofLatLon(latitude, longitude);

        Optional<BoundaryFeature> match = boundaryLocator.locate(point, dataset.acFeatures());
        if (match.isEmpty()) {
            log.info("No assembly constituency contains {}", point.toLogString());
            return LookupResult.notFound();
        }

        BoundaryFeature feature = match.get();
        RepresentativeRecord mla = buildMla(feature);
        RepresentativeRecord mp = buildMp(feature.name());

        LookupResult result = new LookupResult(feature.name(), mla, mp);
        log.debug("Resolved {} -> {}", point.toLogString(), result.toLogString());
        return result;
    }

    private RepresentativeRecord buildMla(BoundaryFeature feature) {
        RepresentativeRecord mla = metadataResolver.resolve(feature.name(), dataset.acData());
        if (mla.constituencyNumber() == null) {
            String number = feature.firstProperty(constituencyNumberKeys);
            if (number != null) {
                mla = mla.withConstituencyNumber(number);
            }
        }
        return mla;
    }

    private RepresentativeRecord buildMp(String acName) {
        return regionMapper.mapToRegion(acName)
            .map(pcName -> metadataResolver.resolve(pcName, dataset.pcData()))
            .orElseGet(() -> RepresentativeRecord.unavailable(UNMAPPED_REGION));
    }

    /**
     * @return every loaded assembly constituency name, sorted
     */
    public List<String> listKnownBoundaries() {
        requireReady();
        return dataset.acFeatures().stream()
            .map(BoundaryFeature::name)
            .sorted()
            .toList();
    }

    /**
     * @return every parliamentary constituency with MP data, sorted
     */
    public List<String> listKnownRegions() {
        requireReady();
        return dataset.pcData().keySet().stream()
            .sorted()
            .toList();
    }

    /**
     * Case-insensitive exact name match, first in dataset order.
     */
    public Optional<BoundaryFeature> getBoundaryGeometry(String name) {
        requireReady();
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return dataset.acFeatures().stream()
            .filter(feature -> feature.name().equalsIgnoreCase(wanted))
            .findFirst();
    }

    public boolean isReady() {
        return dataset.isReady();
    }

    public BoundaryDataset dataset() {
        return dataset;
    }

    public long malformedBoundarySkips() {
        return boundaryLocator.malformedSkips();
    }

    private void requireReady() {
        if (!dataset.isReady()) {
            throw new DatasetNotReadyException();
        }
    }
}
