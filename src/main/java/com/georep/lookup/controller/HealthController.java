package com.georep.lookup.controller;

import com.georep.lookup.repository.BoundaryDataset;
import com.georep.lookup.service.DatasetNotReadyException;
import com.georep.lookup.service.LookupCache;
import com.georep.lookup.service.RepresentativeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final RepresentativeService representativeService;
    private final LookupCache lookupCache;

    @GetMapping("/")
    public ResponseEntity<?> root() {
        return ResponseEntity.ok(Map.of(
            "status", "ok",
            "message", "Geo-Representative Lookup API is running."
        ));
    }

    @Operation(summary = "Loaded constituency counts and cache health")
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        if (!representativeService.isReady()) {
            throw new DatasetNotReadyException();
        }
        BoundaryDataset dataset = representativeService.dataset();
        return ResponseEntity.ok(Map.of(
            "status", "ok",
            "ac_constituencies_loaded", dataset.acFeatures().size(),
            "pc_constituencies_loaded", dataset.pcData().size(),
            "malformed_boundary_skips", representativeService.malformedBoundarySkips(),
            "cache", RepresentativeController.cacheStatsBody(lookupCache)
        ));
    }
}
