package com.georep.lookup.service;

import com.georep.lookup.dto.RepresentativeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Finds the representative record for a constituency name.
 *
 * Lookup tiers, first hit wins:
 * <ol>
 *   <li>exact key</li>
 *   <li>key with the reservation qualifier stripped ({@link NameNormalizer})</li>
 *   <li>case-insensitive comparison of every key against the stripped name</li>
 * </ol>
 * A total miss yields {@link RepresentativeRecord#unavailable(String)}, so
 * {@link #resolve} never returns {@code null}.
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataResolver {

    private final NameNormalizer normalizer;

    public RepresentativeRecord resolve(String name, Map<String, RepresentativeRecord> records) {
        String raw = name != null ? name.trim() : "";

        RepresentativeRecord exact = records.get(raw);
        if (exact != null) {
            return withConstituency(exact, raw);
        }

        String normalized = normalizer.normalize(raw);
        if (!normalized.isEmpty()) {
            RepresentativeRecord stripped = records.get(normalized);
            if (stripped != null) {
                log.debug("Resolved '{}' via normalized key '{}'", raw, normalized);
                return withConstituency(stripped, normalized);
            }

            for (Map.Entry<String, RepresentativeRecord> entry : records.entrySet()) {
                if (entry.getKey().trim().equalsIgnoreCase(normalized)) {
                    log.debug("Resolved '{}' via case-insensitive key '{}'", raw, entry.getKey());
                    return withConstituency(entry.getValue(), entry.getKey());
                }
            }
        }

        log.warn("No representative data for '{}'", raw);
        return RepresentativeRecord.unavailable(normalized.isEmpty() ? raw : normalized);
    }

    private static RepresentativeRecord withConstituency(RepresentativeRecord record, String key) {
        if (record.constituency() == null || record.constituency().isBlank()) {
            return record.withConstituency(key);
        }
        return record;
    }
}
