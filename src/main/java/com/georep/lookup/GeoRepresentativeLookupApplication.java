package com.georep.lookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Geo-Representative Lookup service.
 *
 * Flow:
 * 1. Boundary GeoJSON and representative JSON files are loaded at startup
 * 2. A coordinate arrives at /api/v1/lookup
 * 3. The assembly constituency containing it is found by ray casting
 * 4. The parliamentary constituency comes from the delimitation table
 * 5. MLA and MP records are returned, and the result is cached
 *
 * - @EnableScheduling: drives the optional expired-lookup sweep
 */
@SpringBootApplication
@EnableScheduling
public class GeoRepresentativeLookupApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoRepresentativeLookupApplication.class, args);
    }
}
