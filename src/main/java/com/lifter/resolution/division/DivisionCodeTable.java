package com.lifter.resolution.division;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup from division name ({@code "<age category> <weight class>"}) to the ranking
 * site's division code.
 *
 * <p>Weight classes retired at the cutover date stay listed under
 * {@code "(Inactive) <division>"}. For a meet before the cutover the inactive listing is tried
 * first; on or after it, the active one.</p>
 *
 * <p>The JSON source has the form {@code {"division_codes": {"Open Women's 63kg": 123, ...}}}.</p>
 */
public class DivisionCodeTable {
    private static final Logger log = LoggerFactory.getLogger(DivisionCodeTable.class);

    public static final String INACTIVE_PREFIX = "(Inactive) ";

    private final Map<String, Integer> codes;
    private final LocalDate cutover;

    public DivisionCodeTable(Map<String, Integer> codes, LocalDate cutover) {
        this.codes = Map.copyOf(codes);
        this.cutover = cutover;
    }

    public static DivisionCodeTable empty(LocalDate cutover) {
        return new DivisionCodeTable(Map.of(), cutover);
    }

    public static DivisionCodeTable fromJson(InputStream json, LocalDate cutover) throws IOException {
        JsonNode root = new ObjectMapper().readTree(json);
        JsonNode node = root != null ? root.get("division_codes") : null;
        if (node == null || !node.isObject()) {
            throw new IOException("Missing 'division_codes' object");
        }
        Map<String, Integer> codes = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.canConvertToInt() || (value.isTextual() && value.asText().matches("\\d+"))) {
                codes.put(field.getKey(), value.asInt());
            } else {
                log.warn("division.codeIgnored name='{}' value={}", field.getKey(), value);
            }
        }
        log.info("division.codesLoaded count={}", codes.size());
        return new DivisionCodeTable(codes, cutover);
    }

    /**
     * Loads a table from the classpath.
     */
    public static DivisionCodeTable fromResource(String resource, LocalDate cutover) {
        try (InputStream in = DivisionCodeTable.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Division code resource not found: " + resource);
            }
            return fromJson(in, cutover);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    public static String divisionName(String ageCategory, String weightClass) {
        return ageCategory.trim() + " " + weightClass.trim();
    }

    public Optional<Integer> codeFor(String divisionName) {
        return Optional.ofNullable(codes.get(divisionName));
    }

    /**
     * Listings to query for a division on a meet date, preferred one first. Empty when the
     * division is unknown.
     */
    public List<DivisionCode> candidateCodes(String ageCategory, String weightClass, LocalDate meetDate) {
        String active = divisionName(ageCategory, weightClass);
        String inactive = INACTIVE_PREFIX + active;
        boolean beforeCutover = meetDate.isBefore(cutover);

        List<DivisionCode> result = new ArrayList<>(2);
        if (beforeCutover) {
            addIfPresent(result, inactive, true);
            addIfPresent(result, active, false);
        } else {
            addIfPresent(result, active, false);
            addIfPresent(result, inactive, true);
        }
        return result;
    }

    public LocalDate getCutover() {
        return cutover;
    }

    public int size() {
        return codes.size();
    }

    private void addIfPresent(List<DivisionCode> result, String name, boolean inactive) {
        Integer code = codes.get(name);
        if (code != null) {
            result.add(new DivisionCode(name, code, inactive));
        }
    }
}
