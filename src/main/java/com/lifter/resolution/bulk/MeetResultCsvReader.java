package com.lifter.resolution.bulk;

import com.lifter.resolution.core.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a meet results file.
 *
 * <p>Expected format: pipe-delimited, first line is the header.</p>
 * <pre>
 * Meet|Date|Age Category|Weight Class|Lifter|Body Weight (Kg)|Snatch Lift 1|...|Total|Club|Membership Number|Internal_ID
 * Spring Open|2024-03-10|Open Women's|63kg|Jane Smith|61.5|80|83|-85|83|100|104|-107|104|187|Barbell Club|12345|1234
 * </pre>
 *
 * <p>Columns are matched by header name, so their order does not matter and unknown columns are
 * ignored. Blank lines and rows without a lifter name are skipped. Numbers that do not parse
 * become null. The optional {@code Gender}, {@code Country} and {@code Birth Year} columns are
 * read when present.</p>
 */
public class MeetResultCsvReader {
    private static final Logger log = LoggerFactory.getLogger(MeetResultCsvReader.class);

    public static final String DELIMITER = "|";
    private static final Pattern CELL_SPLIT = Pattern.compile(Pattern.quote(DELIMITER));

    static final String LIFTER = "Lifter";
    static final String MEET = "Meet";
    static final String DATE = "Date";
    static final String AGE_CATEGORY = "Age Category";
    static final String WEIGHT_CLASS = "Weight Class";
    static final String BODY_WEIGHT = "Body Weight (Kg)";
    static final String TOTAL = "Total";
    static final String CLUB = "Club";
    static final String MEMBERSHIP_NUMBER = "Membership Number";
    static final String INTERNAL_ID = "Internal_ID";
    static final String GENDER = "Gender";
    static final String COUNTRY = "Country";
    static final String BIRTH_YEAR = "Birth Year";

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/yyyy");

    /**
     * Reads all rows of a meet file.
     *
     * @param input    the file contents, UTF-8
     * @param meetId   id of the meet the file belongs to
     * @param meetName meet name used when a row has no {@code Meet} value
     * @throws MeetFileException if the file cannot be read or has no lifter column
     */
    public List<ResultRow> read(InputStream input, long meetId, String meetName) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), meetId, meetName);
    }

    public List<ResultRow> read(Reader reader, long meetId, String meetName) {
        List<ResultRow> rows = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                throw new MeetFileException("Meet file is empty: meetId=" + meetId);
            }
            Map<String, Integer> columns = parseHeader(headerLine);
            if (!columns.containsKey(LIFTER)) {
                throw new MeetFileException("Meet file has no '" + LIFTER + "' column: meetId=" + meetId);
            }

            String line;
            long lineNumber = 1;
            long skipped = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = CELL_SPLIT.split(line, -1);
                String lifter = cell(cells, columns, LIFTER);
                if (lifter == null) {
                    skipped++;
                    log.debug("csv.skipped line={} reason=noLifterName", lineNumber);
                    continue;
                }
                rows.add(toRow(cells, columns, lineNumber, lifter, meetId, meetName));
            }
            log.info("csv.read meetId={} rows={} skipped={}", meetId, rows.size(), skipped);
            return rows;
        } catch (IOException e) {
            throw new MeetFileException("Failed to read meet file: meetId=" + meetId, e);
        }
    }

    private ResultRow toRow(String[] cells, Map<String, Integer> columns, long lineNumber, String lifter,
                            long meetId, String meetName) {
        String meet = cell(cells, columns, MEET);
        return ResultRow.builder()
                .lineNumber(lineNumber)
                .lifterName(lifter)
                .meetId(meetId)
                .meetName(meet != null ? meet : meetName)
                .date(parseDate(cell(cells, columns, DATE)))
                .ageCategory(cell(cells, columns, AGE_CATEGORY))
                .weightClass(cell(cells, columns, WEIGHT_CLASS))
                .bodyweightKg(parseDouble(cell(cells, columns, BODY_WEIGHT)))
                .snatchLifts(cell(cells, columns, "Snatch Lift 1"), cell(cells, columns, "Snatch Lift 2"),
                        cell(cells, columns, "Snatch Lift 3"))
                .bestSnatch(cell(cells, columns, "Best Snatch"))
                .cleanJerkLifts(cell(cells, columns, "C&J Lift 1"), cell(cells, columns, "C&J Lift 2"),
                        cell(cells, columns, "C&J Lift 3"))
                .bestCleanJerk(cell(cells, columns, "Best C&J"))
                .total(parseDouble(cell(cells, columns, TOTAL)))
                .club(cell(cells, columns, CLUB))
                .membershipNumber(cell(cells, columns, MEMBERSHIP_NUMBER))
                .stableId(parseStableId(cell(cells, columns, INTERNAL_ID)))
                .gender(cell(cells, columns, GENDER))
                .countryCode(cell(cells, columns, COUNTRY))
                .birthYear(parseInt(cell(cells, columns, BIRTH_YEAR)))
                .build();
    }

    private static Map<String, Integer> parseHeader(String headerLine) {
        String header = headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine;
        String[] names = CELL_SPLIT.split(header, -1);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(unquote(names[i].trim()), i);
        }
        return columns;
    }

    private static String cell(String[] cells, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= cells.length) {
            return null;
        }
        String value = unquote(cells[index].trim()).trim();
        return value.isEmpty() ? null : value;
    }

    private static String unquote(String field) {
        if (field.length() >= 2 && field.startsWith("\"") && field.endsWith("\"")) {
            return field.substring(1, field.length() - 1).replace("\"\"", "\"");
        }
        return field;
    }

    static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Integer parseInt(String value) {
        Double d = parseDouble(value);
        return d != null ? (int) Math.round(d) : null;
    }

    static Long parseStableId(String value) {
        Double d = parseDouble(value);
        if (d == null || d <= 0 || d != Math.floor(d)) {
            return null;
        }
        return d.longValue();
    }

    static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value, US_DATE);
            } catch (DateTimeParseException notUsFormat) {
                log.debug("csv.unparsedDate value='{}'", value);
                return null;
            }
        }
    }
}
