package com.georep.lookup.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata describing the elected representative of a constituency.
 *
 * The same shape is used for real records read from the representative data
 * files and for placeholders produced when no record exists, so callers
 * never branch on which one they got.
 *
 * @param name               representative's name
 * @param party              party affiliation
 * @param constituency       constituency display name
 * @param constituencyNumber official constituency number
 * @param contact            phone number
 * @param email              email address
 * @param officeAddress      office postal address
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepresentativeRecord(
    String name,
    String party,
    String constituency,
    @JsonProperty("constituency_number") String constituencyNumber,
    String contact,
    String email,
    @JsonProperty("office_address") String officeAddress
) {

    public static final String NOT_AVAILABLE_NAME = "Data not available";
    public static final String NOT_AVAILABLE_PARTY = "N/A";

    /**
     * Placeholder for a constituency that has no representative data.
     */
    public static RepresentativeRecord unavailable(String constituency) {
        return new RepresentativeRecord(
            NOT_AVAILABLE_NAME,
            NOT_AVAILABLE_PARTY,
            constituency,
            null,
            null,
            null,
            null
        );
    }

    public boolean isPlaceholder() {
        return NOT_AVAILABLE_NAME.equals(name) && NOT_AVAILABLE_PARTY.equals(party)
            && constituencyNumber == null && contact == null && email == null && officeAddress == null;
    }

    public RepresentativeRecord withConstituency(String value) {
        return new RepresentativeRecord(name, party, value, constituencyNumber, contact, email, officeAddress);
    }

    public RepresentativeRecord withConstituencyNumber(String value) {
        return new RepresentativeRecord(name, party, constituency, value, contact, email, officeAddress);
    }
}
