package com.lifter.resolution.rules;

/**
 * Input validation for rows entering the resolver.
 * Rejects names the normalizer and the store cannot safely handle.
 */
public final class InputValidator {

    /** Maximum allowed length for athlete names. */
    public static final int MAX_NAME_LENGTH = 200;

    private InputValidator() {
        // utility class
    }

    /**
     * Validates a raw athlete name.
     *
     * @param name the name to validate
     * @throws IllegalArgumentException if the name is null, blank, too long or contains control characters
     */
    public static void validateLifterName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Lifter name must not be null or blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Lifter name exceeds maximum length of " + MAX_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException("Lifter name must not contain control characters");
        }
    }

    /**
     * Validates a stable id supplied with a row.
     *
     * @throws IllegalArgumentException if the id is not positive
     */
    public static void validateStableId(Long stableId) {
        if (stableId != null && stableId <= 0) {
            throw new IllegalArgumentException("Stable id must be positive, got: " + stableId);
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
