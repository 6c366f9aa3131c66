package com.georep.lookup.service;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips reservation qualifiers from constituency names.
 *
 * Constituencies reserved for a category carry a trailing parenthetical
 * such as {@code "Anekal (SC)"} or {@code "Pulakeshinagar(SC)"}, and the
 * boundary files and representative files do not agree on whether (or how)
 * it is written. Normalizing both sides to {@code "Anekal"} lets them meet.
 */
public class NameNormalizer {

    private final Pattern suffixPattern;

    /**
     * @param reservationSuffixes qualifiers to strip, without parentheses,
     *                            matched case-insensitively (e.g. {@code SC})
     */
    public NameNormalizer(List<String> reservationSuffixes) {
        if (reservationSuffixes.isEmpty()) {
            throw new IllegalArgumentException("At least one reservation suffix is required");
        }
        String alternatives = reservationSuffixes.stream()
            .map(String::trim)
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        this.suffixPattern = Pattern.compile("\\s*\\(\\s*(?:" + alternatives + ")\\s*\\)\\s*$",
            Pattern.CASE_INSENSITIVE);
    }

    /**
     * @return the trimmed name without a trailing reservation qualifier;
     *         empty string for {@code null}
     */
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        return suffixPattern.matcher(name.trim()).replaceFirst("").trim();
    }
}
