package com.georep.lookup.service;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionMapperTest {

    private final NameNormalizer normalizer = new NameNormalizer(List.of("SC", "ST"));

    private RegionMapper mapperFor(Map<String, List<String>> authored) {
        return new RegionMapper(RegionTable.fromAuthored(authored, normalizer), normalizer);
    }

    @Test
    void shouldMapEveryAuthoredBoundaryToItsRegion() {
        Map<String, List<String>> authored = new LinkedHashMap<>();
        authored.put("North", List.of("Hebbal", "Yelahanka"));
        authored.put("Central", List.of("Shivajinagar", "Chickpet", "Mahadevapura"));

        RegionTable table = RegionTable.fromAuthored(authored, normalizer);
        RegionMapper mapper = new RegionMapper(table, normalizer);

        assertThat(table.size()).isEqualTo(5);
        authored.forEach((region, boundaries) ->
            boundaries.forEach(b -> assertThat(mapper.mapToRegion(b)).contains(region)));
    }

    @Test
    void shouldReturnEmptyForUnknownName() {
        RegionMapper mapper = mapperFor(Map.of("North", List.of("Hebbal")));

        assertThat(mapper.mapToRegion("Atlantis")).isEmpty();
        assertThat(mapper.mapToRegion("")).isEmpty();
        assertThat(mapper.mapToRegion(null)).isEmpty();
    }

    @Test
    void shouldTrimIncidentalWhitespace() {
        RegionMapper mapper = mapperFor(Map.of("North", List.of("Hebbal")));

        assertThat(mapper.mapToRegion("  Hebbal ")).contains("North");
    }

    @Test
    void shouldTolerateReservationSuffixSpellings() {
        RegionMapper mapper = mapperFor(Map.of(
            "North", List.of("Pulakeshinagar(SC)"),
            "Rural", List.of("Anekal (SC)")));

        assertThat(mapper.mapToRegion("Pulakeshinagar (SC)")).contains("North");
        assertThat(mapper.mapToRegion("Pulakeshinagar")).contains("North");
        assertThat(mapper.mapToRegion("Anekal(SC)")).contains("Rural");
    }

    @Test
    void shouldRejectBoundaryAuthoredUnderTwoRegions() {
        Map<String, List<String>> authored = new LinkedHashMap<>();
        authored.put("North", List.of("Hebbal"));
        authored.put("Central", List.of("Hebbal"));

        assertThatThrownBy(() -> RegionTable.fromAuthored(authored, normalizer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Hebbal");
    }

    @Test
    void shouldRejectSpellingVariantsAuthoredUnderDifferentRegions() {
        Map<String, List<String>> authored = new LinkedHashMap<>();
        authored.put("Rural", List.of("Anekal (SC)"));
        authored.put("South", List.of("Anekal"));

        assertThatThrownBy(() -> RegionTable.fromAuthored(authored, normalizer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Anekal")
            .hasMessageContaining("Rural")
            .hasMessageContaining("South");
    }

    @Test
    void shouldAllowSpellingVariantsUnderTheSameRegion() {
        RegionMapper mapper = mapperFor(Map.of("Rural", List.of("Anekal (SC)", "Anekal")));

        assertThat(mapper.mapToRegion("Anekal(SC)")).contains("Rural");
        assertThat(mapper.mapToRegion("Anekal")).contains("Rural");
    }

    @Test
    void shouldPlaceBangaloreSouthAssemblyUnderRural() {
        RegionMapper mapper = mapperFor(BangaloreDelimitation.ASSEMBLY_BY_PARLIAMENTARY);

        assertThat(mapper.mapToRegion("Bangalore South")).contains("Bangalore Rural");
        assertThat(mapper.mapToRegion("Jayanagar")).contains("Bangalore South");
        assertThat(mapper.mapToRegion("Shivajinagar")).contains("Bangalore Central");
        assertThat(mapper.mapToRegion("C.V. Raman Nagar (SC)")).contains("Bangalore Central");
    }
}
