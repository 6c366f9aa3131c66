package com.georep.lookup.dto;

/**
 * Outcome of resolving one coordinate.
 *
 * {@code boundaryMatch} is {@code null} only when the point lies outside
 * every known boundary; in that case {@code regionMatch} and
 * {@code boundaryName} are {@code null} too. Any lookup miss after a
 * boundary matched yields a placeholder record instead.
 *
 * @param boundaryName  name of the matched assembly constituency
 * @param boundaryMatch MLA record for the matched constituency
 * @param regionMatch   MP record for the parent parliamentary constituency
 */
public record LookupResult(
    String boundaryName,
    RepresentativeRecord boundaryMatch,
    RepresentativeRecord regionMatch
) {

    public static LookupResult notFound() {
        return new LookupResult(null, null, null);
    }

    public boolean isFound() {
        return boundaryMatch != null;
    }

    public String toLogString() {
        return String.format("LookupResult[ac=%s, pc=%s]",
            boundaryMatch != null ? boundaryMatch.constituency() : null,
            regionMatch != null ? regionMatch.constituency() : null);
    }
}
