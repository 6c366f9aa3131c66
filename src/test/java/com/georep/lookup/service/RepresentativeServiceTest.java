package com.georep.lookup.service;

import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.dto.LookupResult;
import com.georep.lookup.dto.RepresentativeRecord;
import com.georep.lookup.geometry.GeometryMatcher;
import com.georep.lookup.geometry.UnsupportedGeometryException;
import com.georep.lookup.repository.BoundaryDataset;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.georep.lookup.TestGeometries.SQUARE;
import static com.georep.lookup.TestGeometries.feature;
import static com.georep.lookup.TestGeometries.json;
import static com.georep.lookup.TestGeometries.square;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepresentativeServiceTest {

    private static final RepresentativeRecord MLA = new RepresentativeRecord(
        "Rizwan Arshad", "INC", "Shivajinagar", "157", "+91-80-22866530",
        "rizwanarshad.mla@karnataka.gov.in", null);

    private static final RepresentativeRecord MP = new RepresentativeRecord(
        "PC Mohan", "BJP", "Bangalore Central", "25", "+91-11-23034660",
        "pcmohan@sansad.nic.in", "335-C, Parliament House Annexe, New Delhi - 110001");

    private final NameNormalizer normalizer = new NameNormalizer(List.of("SC", "ST"));
    private final BoundaryLocator locator = new BoundaryLocator(new GeometryMatcher());

    private RepresentativeService serviceFor(List<BoundaryFeature> features) {
        BoundaryDataset dataset = new BoundaryDataset(
            features,
            List.of(),
            Map.of("Shivajinagar", MLA),
            Map.of("Bangalore Central", MP));
        return new RepresentativeService(
            dataset,
            locator,
            new RegionMapper(RegionTable.fromAuthored(
                Map.of("Bangalore Central", List.of("Shivajinagar")), normalizer), normalizer),
            new MetadataResolver(normalizer),
            new LookupCache(Clock.systemUTC(), Duration.ofMinutes(5)),
            List.of("AC_Code", "AC_NO"));
    }

    @Test
    void shouldResolveBothTiersForPointInsideBoundary() {
        RepresentativeService service = serviceFor(List.of(feature("Shivajinagar", SQUARE)));

        LookupResult result = service.resolvePoint(12.9716, 77.5946);

        assertThat(result.isFound()).isTrue();
        assertThat(result.boundaryName()).isEqualTo("Shivajinagar");
        assertThat(result.boundaryMatch()).isEqualTo(MLA);
        assertThat(result.regionMatch()).isEqualTo(MP);
    }

    @Test
    void shouldReturnNullMatchesOutsideEveryBoundary() {
        RepresentativeService service = serviceFor(List.of(feature("Shivajinagar", SQUARE)));

        LookupResult result = service.resolvePoint(12.80, 77.60);

        assertThat(result.isFound()).isFalse();
        assertThat(result.boundaryMatch()).isNull();
        assertThat(result.regionMatch()).isNull();
    }

    @Test
    void shouldUsePlaceholdersForMissingMetadataAndUnmappedRegion() {
        RepresentativeService service = serviceFor(List.of(feature("Atlantis", SQUARE)));

        LookupResult result = service.resolvePoint(12.9716, 77.5946);

        assertThat(result.boundaryMatch()).isEqualTo(RepresentativeRecord.unavailable("Atlantis"));
        assertThat(result.regionMatch()).isEqualTo(RepresentativeRecord.unavailable(RepresentativeService.UNMAPPED_REGION));
    }

    @Test
    void shouldFillConstituencyNumberFromFeatureProperties() {
        BoundaryFeature numbered = new BoundaryFeature("Atlantis",
            json("{\"AC_NAME\": \"Atlantis\", \"AC_NO\": 999}"), json(SQUARE), null);
        RepresentativeService service = serviceFor(List.of(numbered));

        assertThat(service.resolvePoint(12.9716, 77.5946).boundaryMatch().constituencyNumber()).isEqualTo("999");
    }

    @Test
    void shouldSurfaceUnsupportedGeometryAndCacheNothing() {
        BoundaryFeature line = new BoundaryFeature("Road", null,
            json("{\"type\": \"LineString\", \"coordinates\": [[77.5, 12.9], [77.7, 13.0]]}"), null);
        RepresentativeService service = serviceFor(List.of(line));

        assertThatThrownBy(() -> service.resolvePoint(12.9716, 77.5946))
            .isInstanceOf(UnsupportedGeometryException.class);
        assertThatThrownBy(() -> service.resolvePoint(12.9716, 77.5946))
            .isInstanceOf(UnsupportedGeometryException.class);
    }

    @Test
    void shouldListBoundariesSorted() {
        RepresentativeService service = serviceFor(List.of(
            feature("Shivajinagar", SQUARE),
            feature("Chickpet", square(0, 0, 1, 1)),
            feature("Hebbal", square(2, 2, 3, 3))));

        assertThat(service.listKnownBoundaries()).containsExactly("Chickpet", "Hebbal", "Shivajinagar");
        assertThat(service.listKnownRegions()).containsExactly("Bangalore Central");
    }

    @Test
    void shouldFindGeometryIgnoringCase() {
        BoundaryFeature shivajinagar = feature("Shivajinagar", SQUARE);
        RepresentativeService service = serviceFor(List.of(shivajinagar));

        assertThat(service.getBoundaryGeometry("SHIVAJINAGAR")).contains(shivajinagar);
        assertThat(service.getBoundaryGeometry("shivajinagar")).contains(shivajinagar);
        assertThat(service.getBoundaryGeometry("Shivaji")).isEmpty();
    }

    @Test
    void shouldRejectRequestsWhenNoBoundariesLoaded() {
        RepresentativeService service = serviceFor(List.of());

        assertThat(service.isReady()).isFalse();
        assertThatThrownBy(() -> service.resolvePoint(12.9716, 77.5946))
            .isInstanceOf(DatasetNotReadyException.class);
        assertThatThrownBy(service::listKnownBoundaries)
            .isInstanceOf(DatasetNotReadyException.class);
    }
}
