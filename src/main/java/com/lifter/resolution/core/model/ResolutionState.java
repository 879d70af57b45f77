package com.lifter.resolution.core.model;

/**
 * States of the resolver. The path taken for a row is recorded on its result.
 */
public enum ResolutionState {
    START,
    STABLE_ID_LOOKUP,
    NAME_LOOKUP,
    ZERO,
    ONE,
    MANY,
    VERIFY,
    RESOLVED,
    CREATE_NEW
}
