package com.lifter.resolution.decision;

import java.util.Locale;

/**
 * Coarse age bracket read from an age category label such as "Junior Men's" or
 * "Youth Women's". Labels naming none of the brackets are {@link #OTHER}.
 */
public enum AgeBracket {
    YOUTH,
    JUNIOR,
    SENIOR,
    OTHER;

    public static AgeBracket of(String ageCategory) {
        if (ageCategory == null) {
            return OTHER;
        }
        String label = ageCategory.toLowerCase(Locale.ROOT);
        if (label.contains("youth")) {
            return YOUTH;
        }
        if (label.contains("junior")) {
            return JUNIOR;
        }
        if (label.contains("senior")) {
            return SENIOR;
        }
        return OTHER;
    }

    /**
     * True when one category is youth or junior and the other senior.
     */
    public static boolean crossesSeniorBoundary(String first, String second) {
        AgeBracket a = of(first);
        AgeBracket b = of(second);
        return (a.isUnderSenior() && b == SENIOR) || (b.isUnderSenior() && a == SENIOR);
    }

    private boolean isUnderSenior() {
        return this == YOUTH || this == JUNIOR;
    }
}
