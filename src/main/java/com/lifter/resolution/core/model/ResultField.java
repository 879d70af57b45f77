package com.lifter.resolution.core.model;

/**
 * Result attributes harvested from the division rankings.
 */
public enum ResultField {
    CLUB,
    WSO,
    COMPETITION_AGE,
    NATIONAL_RANK,
    GENDER
}
