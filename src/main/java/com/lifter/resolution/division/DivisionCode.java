package com.lifter.resolution.division;

/**
 * A resolved division listing.
 *
 * @param name     the division name as listed, including the "(Inactive) " prefix when present
 * @param code     the ranking site's numeric code
 * @param inactive whether this is the inactive (pre-cutover) listing
 */
public record DivisionCode(String name, int code, boolean inactive) {
}
