package com.georep.lookup.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.georep.lookup.dto.BoundaryFeature;
import com.georep.lookup.dto.RepresentativeRecord;
import com.georep.lookup.geometry.GeoJsonCoordinates;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads boundary GeoJSON and representative JSON files.
 *
 * Loading is forgiving in the same way for every file: a missing file or
 * unparseable JSON is logged and produces an empty collection, so the
 * service still starts and reports itself as not ready.
 */
@Slf4j
public class BoundaryDatasetLoader {

    static final String UNKNOWN_NAME = "Unknown";

    private static final TypeReference<LinkedHashMap<String, RepresentativeRecord>> RECORD_MAP =
        new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final List<String> acNameKeys;
    private final List<String> pcNameKeys;

    public BoundaryDatasetLoader(ObjectMapper objectMapper, List<String> acNameKeys, List<String> pcNameKeys) {
        this.objectMapper = objectMapper;
        this.acNameKeys = List.copyOf(acNameKeys);
        this.pcNameKeys = List.copyOf(pcNameKeys);
    }

    public BoundaryDataset load(Resource acBoundaries,
                                Resource pcBoundaries,
                                Resource acRepresentatives,
                                Resource pcRepresentatives) {
        long startTime = System.currentTimeMillis();

        BoundaryDataset dataset = new BoundaryDataset(
            loadFeatures(acBoundaries, acNameKeys),
            loadFeatures(pcBoundaries, pcNameKeys),
            loadRecords(acRepresentatives),
            loadRecords(pcRepresentatives)
        );

        log.info("Dataset loaded in {}ms: {} AC features, {} PC features, {} MLA records, {} MP records",
            System.currentTimeMillis() - startTime,
            dataset.acFeatures().size(), dataset.pcFeatures().size(),
            dataset.acData().size(), dataset.pcData().size());
        return dataset;
    }

    /**
     * Parses a FeatureCollection, preserving feature order.
     */
    public List<BoundaryFeature> loadFeatures(Resource resource, List<String> nameKeys) {
        JsonNode collection = readTree(resource);
        if (collection == null) {
            return List.of();
        }

        JsonNode features = collection.get("features");
        if (features == null || !features.isArray()) {
            log.warn("No feature array found in {}", resource.getDescription());
            return List.of();
        }

        List<BoundaryFeature> loaded = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            BoundaryFeature boundary = toBoundaryFeature(feature, nameKeys);
            if (boundary != null) {
                loaded.add(boundary);
            }
        }
        log.info("Loaded {} features from {}", loaded.size(), resource.getDescription());
        return loaded;
    }

    BoundaryFeature toBoundaryFeature(JsonNode feature, List<String> nameKeys) {
        JsonNode properties = feature.get("properties");
        JsonNode geometry = feature.get("geometry");

        BoundaryFeature draft = new BoundaryFeature(null, properties, geometry, null);
        String name = draft.firstProperty(nameKeys);
        if (name == null) {
            name = UNKNOWN_NAME;
        }

        if (geometry == null || !geometry.isObject()) {
            log.warn("Skipping feature '{}' without a geometry object", name);
            return null;
        }

        Envelope envelope = GeoJsonCoordinates.envelopeOf(geometry);
        if (envelope == null) {
            log.warn("Feature '{}' has no readable {} coordinates; it will be checked without a bounding box",
                name, GeoJsonCoordinates.typeOf(geometry));
        }
        return new BoundaryFeature(name, properties, geometry, envelope);
    }

    /**
     * Parses a JSON object of name → representative record, keeping file order.
     */
    public Map<String, RepresentativeRecord> loadRecords(Resource resource) {
        if (!resource.exists()) {
            log.error("Data file not found: {}", resource.getDescription());
            return Map.of();
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, RepresentativeRecord> records = objectMapper.readValue(in, RECORD_MAP);
            if (records == null) {
                log.warn("Data file {} contains no records", resource.getDescription());
                return Map.of();
            }
            if (records.values().removeIf(Objects::isNull)) {
                log.warn("Dropped null records from {}", resource.getDescription());
            }
            log.info("Loaded {} records from {}", records.size(), resource.getDescription());
            return records;
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON in {}: {}", resource.getDescription(), e.getOriginalMessage());
            return Map.of();
        } catch (IOException e) {
            log.error("Failed to read {}", resource.getDescription(), e);
            return Map.of();
        }
    }

    private JsonNode readTree(Resource resource) {
        if (!resource.exists()) {
            log.error("GeoJSON file not found: {}", resource.getDescription());
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON in {}: {}", resource.getDescription(), e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.error("Failed to read {}", resource.getDescription(), e);
            return null;
        }
    }
}
