package com.lifter.resolution.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes athlete names to the "Given FAMILY [Suffix]" form used as the lookup key.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>remove a federation code leaked into an international "FAMILY Given CODE" name, e.g.
 *       {@code "WANG Hao CHN"} or {@code "WANG Hao (CHN)"}; only codes known to {@link CountryCodes}
 *       are removed</li>
 *   <li>extract a generational suffix (Jr, Sr, II to XII) from the last word, dropping a trailing dot</li>
 *   <li>move a leading upper-case family name ({@code "FELIX DA SILVA Thiago"}) behind the given names</li>
 *   <li>collapse whitespace and re-append the suffix</li>
 * </ol>
 *
 * <p>The function is pure, deterministic and idempotent. Names already in "Given Family" order,
 * including "Min KIM", pass through unchanged apart from whitespace.</p>
 */
public class NameNormalizer {

    // Jr and Sr in any case, roman numerals upper-case only
    private static final Pattern SUFFIX = Pattern.compile("(?i:Jr|Sr)\\.?|II|III|IV|V|VI|VII|VIII|IX|X|XI|XII");
    private static final Pattern BRACKETED_CODE = Pattern.compile("\\(([A-Za-z]{3})\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // Mixed-case family names such as "AlQAHTANI" carry an upper-case run
    private static final Pattern EMBEDDED_UPPER_RUN = Pattern.compile("[A-Z]{3,}");

    private final CountryCodes countryCodes;

    public NameNormalizer() {
        this(BundledCodes.CODES);
    }

    public NameNormalizer(CountryCodes countryCodes) {
        this.countryCodes = Objects.requireNonNull(countryCodes, "countryCodes");
    }

    /**
     * Normalizes a raw name. Returns an empty string for null or blank input.
     */
    public String normalize(String rawName) {
        if (rawName == null) {
            return "";
        }
        List<String> parts = new ArrayList<>(Arrays.asList(WHITESPACE.split(rawName.trim())));
        parts.removeIf(String::isEmpty);
        if (parts.isEmpty()) {
            return "";
        }

        removeFederationCode(parts);

        String suffix = null;
        if (parts.size() > 1 && SUFFIX.matcher(parts.get(parts.size() - 1)).matches()) {
            suffix = parts.remove(parts.size() - 1);
            if (suffix.endsWith(".")) {
                suffix = suffix.substring(0, suffix.length() - 1);
            }
            removeFederationCode(parts);
        }

        if (parts.size() == 1) {
            return withSuffix(parts.get(0), suffix);
        }

        int familyEnd = familyNameEnd(parts);
        String ordered;
        if (familyEnd > 0 && familyEnd < parts.size()) {
            String family = String.join(" ", parts.subList(0, familyEnd));
            String given = String.join(" ", parts.subList(familyEnd, parts.size()));
            ordered = given + " " + family;
        } else {
            ordered = String.join(" ", parts);
        }
        return withSuffix(ordered, suffix);
    }

    /**
     * Drops a known code from the end of a name. A bracketed code is always a code; a bare one
     * only in "FAMILY Given CODE" form, where the family name leads and a given name follows it.
     */
    private void removeFederationCode(List<String> parts) {
        if (parts.size() < 2) {
            return;
        }
        String last = parts.get(parts.size() - 1);
        Matcher bracketed = BRACKETED_CODE.matcher(last);
        if (bracketed.matches() && countryCodes.nameFor(bracketed.group(1)).isPresent()) {
            parts.remove(parts.size() - 1);
            last = parts.get(parts.size() - 1);
        }
        if (parts.size() < 3 || last.length() != 3 || !isAllUpper(last) || countryCodes.nameFor(last).isEmpty()) {
            return;
        }
        int familyEnd = familyNameEnd(parts.subList(0, parts.size() - 1));
        if (familyEnd > 0 && familyEnd < parts.size() - 1) {
            parts.remove(parts.size() - 1);
        }
    }

    /**
     * Case-insensitive comparison key for a normalized name.
     */
    public String matchKey(String normalizedName) {
        return normalizedName == null ? "" : normalizedName.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * True when both raw names normalize to the same key.
     */
    public boolean sameName(String a, String b) {
        return matchKey(normalize(a)).equals(matchKey(normalize(b)));
    }

    private int familyNameEnd(List<String> parts) {
        String first = parts.get(0);
        if (hasLower(first) && EMBEDDED_UPPER_RUN.matcher(first).find()) {
            return 1;
        }
        int end = 0;
        for (String part : parts) {
            if (part.length() > 1 && isAllUpper(part)) {
                end++;
            } else {
                break;
            }
        }
        return end;
    }

    private static boolean isAllUpper(String word) {
        return word.equals(word.toUpperCase(Locale.ROOT)) && !word.equals(word.toLowerCase(Locale.ROOT));
    }

    private static boolean hasLower(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLowerCase(word.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String withSuffix(String name, String suffix) {
        return suffix != null ? name + " " + suffix : name;
    }

    private static final class BundledCodes {
        private static final CountryCodes CODES = CountryCodes.load();
    }
}
