package com.georep.lookup.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.dto.LookupResult;
import com.georep.lookup.service.LookupCache;
import com.georep.lookup.service.RepresentativeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for representative lookups.
 *
 * Example:
 * GET /api/v1/lookup?lat=12.9716&lon=77.5946
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Lookup", description = "Coordinate to MLA/MP lookup")
public class RepresentativeController {

    private final RepresentativeService representativeService;
    private final LookupCache lookupCache;

    @Operation(
            summary = "Find the MLA and MP for a coordinate",
            description = "Runs a ray-casting point-in-polygon test against the assembly constituency " +
                    "boundaries, then maps the matched constituency to its parliamentary constituency."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Representatives found",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = "{\"latitude\":12.9716,\"longitude\":77.5946," +
                                            "\"mla\":{\"name\":\"Rizwan Arshad\",\"party\":\"INC\",\"constituency\":\"Shivajinagar\"}," +
                                            "\"mp\":{\"name\":\"PC Mohan\",\"party\":\"BJP\",\"constituency\":\"Bangalore Central\"}}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "404", description = "Point is outside every known constituency"),
            @ApiResponse(responseCode = "422", description = "Missing or out-of-range coordinates")
    })
    @GetMapping("/lookup")
    public ResponseEntity<?> lookup(
        @Parameter(description = "Latitude (12.7 - 13.2)", example = "12.9716")
        @RequestParam @DecimalMin("12.7") @DecimalMax("13.2") double lat,
        @Parameter(description = "Longitude (77.3 - 77.9)", example = "77.5946")
        @RequestParam @DecimalMin("77.3") @DecimalMax("77.9") double lon
    ) {
        LookupResult result = representativeService.resolvePoint(lat, lon);

        if (!result.isFound()) {
            log.warn("No representatives found for ({}, {})", lat, lon);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "detail", String.format(Locale.ROOT,
                    "No representatives found for coordinates (%s, %s). " +
                    "Ensure the point falls within Bangalore city limits.", lat, lon)
            ));
        }

        log.info("Lookup ({}, {}) -> AC: {} | PC: {}", lat, lon,
            result.boundaryMatch().constituency(), result.regionMatch().constituency());
        return ResponseEntity.ok(Map.of(
            "latitude", lat,
            "longitude", lon,
            "mla", result.boundaryMatch(),
            "mp", result.regionMatch()
        ));
    }

    @Operation(summary = "List all loaded assembly and parliamentary constituencies")
    @GetMapping("/constituencies")
    public ResponseEntity<?> listConstituencies() {
        return ResponseEntity.ok(Map.of(
            "assembly_constituencies", representativeService.listKnownBoundaries(),
            "parliamentary_constituencies", representativeService.listKnownRegions()
        ));
    }

    @Operation(
            summary = "GeoJSON for one assembly constituency",
            description = "Case-insensitive name match. Used by the map to highlight the matched boundary."
    )
    @GetMapping(value = "/constituencies/geojson/{acName}", produces = "application/json")
    public ResponseEntity<?> getConstituencyGeoJson(@PathVariable String acName) {
        Optional<BoundaryFeature> feature = representativeService.getBoundaryGeometry(acName);

        if (feature.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "detail", "Assembly constituency '" + acName + "' not found."
            ));
        }

        ObjectNode collection = JsonNodeFactory.instance.objectNode();
        collection.put("type", "FeatureCollection");
        collection.putArray("features").add(feature.get().toGeoJson());
        return ResponseEntity.ok(collection);
    }

    @Operation(summary = "Lookup cache statistics")
    @GetMapping("/cache/stats")
    public ResponseEntity<?> getCacheStats() {
        return ResponseEntity.ok(cacheStatsBody(lookupCache));
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<?> clearCache() {
        lookupCache.clear();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "message", "Cache cleared"
        ));
    }

    static Map<String, Object> cacheStatsBody(LookupCache cache) {
        LookupCache.CacheStats stats = cache.stats();
        return Map.of(
            "size", stats.size(),
            "hits", stats.hits(),
            "misses", stats.misses(),
            "evictions", stats.evictions(),
            "hitRate", String.format(Locale.ROOT, "%.1f%%", stats.hitRate()),
            "ttlSeconds", cache.ttl().toSeconds()
        );
    }
}
