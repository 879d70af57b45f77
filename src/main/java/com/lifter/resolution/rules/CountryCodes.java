package com.lifter.resolution.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps 3-letter federation codes (USA, CHN, GBR, ...) to country names.
 * Loaded from a JSON object of {@code "CODE": "Country Name"} pairs.
 */
public class CountryCodes {

    public static final String DEFAULT_RESOURCE = "/country-codes.json";

    private final Map<String, String> names;

    public CountryCodes(Map<String, String> names) {
        Map<String, String> upper = new HashMap<>();
        names.forEach((code, name) -> upper.put(code.toUpperCase(Locale.ROOT), name));
        this.names = Map.copyOf(upper);
    }

    /**
     * Loads the bundled code table from the classpath.
     */
    public static CountryCodes load() {
        try (InputStream in = CountryCodes.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Country code resource not found: " + DEFAULT_RESOURCE);
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static CountryCodes fromJson(InputStream json) throws IOException {
        Map<String, String> names = new ObjectMapper().readValue(json, new TypeReference<Map<String, String>>() {});
        return new CountryCodes(names);
    }

    /**
     * Returns the country name for a code, case-insensitively.
     */
    public Optional<String> nameFor(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(names.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    public int size() {
        return names.size();
    }
}
