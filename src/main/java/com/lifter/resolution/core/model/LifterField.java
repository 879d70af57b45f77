package com.lifter.resolution.core.model;

/**
 * Lifter attributes that may be filled in after creation.
 * The normalized name and the lifter id are never enrichable.
 */
public enum LifterField {
    STABLE_ID,
    MEMBERSHIP_NUMBER,
    COUNTRY_CODE,
    COUNTRY_NAME,
    BIRTH_YEAR,
    GENDER
}
