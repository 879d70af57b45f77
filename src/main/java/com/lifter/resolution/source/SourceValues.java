package com.lifter.resolution.source;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Lenient parsing of the text values the ranking site renders. Placeholders such as
 * {@code "---"} or an empty cell become null.
 */
final class SourceValues {

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    private SourceValues() {
    }

    static Double parseDouble(String value) {
        String v = clean(value);
        if (v == null) {
            return null;
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer parseInt(String value) {
        Double d = parseDouble(value);
        return d != null ? (int) Math.round(d) : null;
    }

    static Long parseLong(String value) {
        String v = clean(value);
        if (v == null) {
            return null;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static LocalDate parseDate(String value) {
        String v = clean(value);
        if (v == null) {
            return null;
        }
        try {
            return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(v, US_DATE);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (v.isEmpty() || v.equals("-") || v.equals("---")) {
            return null;
        }
        return v;
    }
}
