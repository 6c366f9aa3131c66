package com.georep.lookup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.georep.lookup.geometry.GeometryMatcher;
import com.georep.lookup.repository.BoundaryDataset;
import com.georep.lookup.repository.BoundaryDatasetLoader;
import com.georep.lookup.service.BangaloreDelimitation;
import com.georep.lookup.service.BoundaryLocator;
import com.georep.lookup.service.LookupCache;
import com.georep.lookup.service.MetadataResolver;
import com.georep.lookup.service.NameNormalizer;
import com.georep.lookup.service.RegionMapper;
import com.georep.lookup.service.RegionTable;
import com.georep.lookup.service.RepresentativeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the lookup pipeline.
 *
 * Every piece is an explicitly constructed bean: the dataset is loaded here
 * once, before any request can arrive, and handed to the service together
 * with its own cache instance.
 */
@Configuration
@Slf4j
public class LookupConfig {

    @Value("${lookup.data.ac-boundaries:classpath:data/ac_bangalore.geojson}")
    private Resource acBoundaries;

    @Value("${lookup.data.pc-boundaries:classpath:data/pc_bangalore.geojson}")
    private Resource pcBoundaries;

    @Value("${lookup.data.ac-representatives:classpath:data/ac_data.json}")
    private Resource acRepresentatives;

    @Value("${lookup.data.pc-representatives:classpath:data/pc_data.json}")
    private Resource pcRepresentatives;

    @Value("${lookup.names.ac-keys:AC_NAME,AC_Name,ac_name}")
    private List<String> acNameKeys;

    @Value("${lookup.names.pc-keys:PC_NAME,PC_Name,pc_name}")
    private List<String> pcNameKeys;

    @Value("${lookup.names.ac-number-keys:AC_Code,AC_NO}")
    private List<String> acNumberKeys;

    @Value("${lookup.names.reservation-suffixes:SC,ST}")
    private List<String> reservationSuffixes;

    @Value("${lookup.cache.ttl-seconds:300}")
    private long cacheTtlSeconds;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NameNormalizer nameNormalizer() {
        return new NameNormalizer(reservationSuffixes);
    }

    @Bean
    public RegionTable regionTable(NameNormalizer nameNormalizer) {
        RegionTable table = RegionTable.fromAuthored(BangaloreDelimitation.ASSEMBLY_BY_PARLIAMENTARY, nameNormalizer);
        log.info("Region table built: {} assembly constituencies in {} parliamentary constituencies",
            table.size(), BangaloreDelimitation.ASSEMBLY_BY_PARLIAMENTARY.size());
        return table;
    }

    @Bean
    public RegionMapper regionMapper(RegionTable regionTable, NameNormalizer nameNormalizer) {
        return new RegionMapper(regionTable, nameNormalizer);
    }

    @Bean
    public MetadataResolver metadataResolver(NameNormalizer nameNormalizer) {
        return new MetadataResolver(nameNormalizer);
    }

    @Bean
    public BoundaryLocator boundaryLocator(GeometryMatcher geometryMatcher) {
        return new BoundaryLocator(geometryMatcher);
    }

    @Bean
    public LookupCache lookupCache(Clock clock) {
        return new LookupCache(clock, Duration.ofSeconds(cacheTtlSeconds));
    }

    @Bean
    public BoundaryDatasetLoader boundaryDatasetLoader(ObjectMapper objectMapper) {
        return new BoundaryDatasetLoader(objectMapper, acNameKeys, pcNameKeys);
    }

    @Bean
    public BoundaryDataset boundaryDataset(BoundaryDatasetLoader loader) {
        BoundaryDataset dataset = loader.load(acBoundaries, pcBoundaries, acRepresentatives, pcRepresentatives);
        if (!dataset.isReady()) {
            log.error("No assembly constituency boundaries loaded; lookups will be rejected");
        }
        return dataset;
    }

    @Bean
    public RepresentativeService representativeService(BoundaryDataset dataset,
                                                       BoundaryLocator boundaryLocator,
                                                       RegionMapper regionMapper,
                                                       MetadataResolver metadataResolver,
                                                       LookupCache lookupCache) {
        return new RepresentativeService(dataset, boundaryLocator, regionMapper,
            metadataResolver, lookupCache, acNumberKeys);
    }
}
