package com.lifter.resolution.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifter.resolution.core.model.AthleteSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DivisionRankingSource} backed by the ranking site's JSON listing endpoint.
 *
 * <p>The query filter is a JSON object
 * {@code {"date_range_start": "...", "date_range_end": "...", "weight_class": code}},
 * base64-encoded into the {@code filters} query parameter. A 5xx answer, a response flagged
 * {@code truncated}, or a page holding {@code maxRows} rows or more is reported as DEGRADED so
 * the caller can narrow the window.</p>
 *
 * <pre>
 * DivisionRankingSource source = HttpDivisionRankingSource.builder()
 *     .baseUrl("https://rankings.example.org")
 *     .timeout(Duration.ofSeconds(30))
 *     .session(session)
 *     .build();
 * </pre>
 */
public class HttpDivisionRankingSource implements DivisionRankingSource {
    private static final Logger log = LoggerFactory.getLogger(HttpDivisionRankingSource.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_ROWS = 1000;
    private static final String RANKINGS_PATH = "/public/rankings/all";

    private final String baseUrl;
    private final Duration timeout;
    private final int maxRows;
    private final SourceSession session;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpDivisionRankingSource(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.maxRows = builder.maxRows;
        this.session = builder.session;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public DivisionQueryResult query(int divisionCode, LocalDate from, LocalDate to) {
        URI uri = buildQueryUri(divisionCode, from, to);
        String operation = "division.query code=" + divisionCode + " range=" + from + ".." + to;
        if (session != null) {
            return session.call(operation, () -> fetch(uri));
        }
        return fetch(uri);
    }

    /**
     * Builds the listing URI for one division and date range.
     */
    public URI buildQueryUri(int divisionCode, LocalDate from, LocalDate to) {
        return URI.create(baseUrl + RANKINGS_PATH + "?filters="
                + URLEncoder.encode(encodeFilter(divisionCode, from, to), StandardCharsets.UTF_8));
    }

    /**
     * Encodes the filter object as base64 JSON.
     */
    public String encodeFilter(int divisionCode, LocalDate from, LocalDate to) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("date_range_start", from.toString());
        filter.put("date_range_end", to.toString());
        filter.put("weight_class", divisionCode);
        try {
            byte[] json = objectMapper.writeValueAsBytes(filter);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode division filter", e);
        }
    }

    private DivisionQueryResult fetch(URI uri) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException("Division rankings unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Division rankings request interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 500) {
            log.info("division.degraded uri={} status={}", uri, status);
            return DivisionQueryResult.degraded();
        }
        if (status != 200) {
            throw new SourceUnavailableException("Division rankings returned status " + status);
        }

        RankingsResponse body;
        try {
            body = objectMapper.readValue(response.body(), RankingsResponse.class);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Unreadable division rankings response", e);
        }

        List<AthleteSummary> athletes = new ArrayList<>();
        if (body.data() != null) {
            for (RankingRow row : body.data()) {
                if (row.athleteName() != null && !row.athleteName().isBlank()) {
                    athletes.add(row.toSummary());
                }
            }
        }
        log.debug("division.fetched uri={} rows={} truncated={}", uri, athletes.size(), body.truncated());

        if (body.truncated() || (maxRows > 0 && athletes.size() >= maxRows)) {
            return DivisionQueryResult.degraded(athletes);
        }
        return DivisionQueryResult.ok(athletes);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private int maxRows = DEFAULT_MAX_ROWS;
        private SourceSession session;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Row count at which a response is treated as truncated. 0 disables the check.
         */
        public Builder maxRows(int maxRows) {
            if (maxRows < 0) {
                throw new IllegalArgumentException("maxRows must be >= 0");
            }
            this.maxRows = maxRows;
            return this;
        }

        public Builder session(SourceSession session) {
            this.session = session;
            return this;
        }

        public HttpDivisionRankingSource build() {
            return new HttpDivisionRankingSource(this);
        }
    }

    // Response DTOs

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RankingsResponse(
            @JsonProperty("data") List<RankingRow> data,
            @JsonProperty("truncated") boolean truncated
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RankingRow(
            @JsonProperty("athlete_name") String athleteName,
            @JsonProperty("internal_id") String internalId,
            @JsonProperty("national_rank") String nationalRank,
            @JsonProperty("lifter_age") String lifterAge,
            @JsonProperty("club") String club,
            @JsonProperty("lift_date") String liftDate,
            @JsonProperty("level") String level,
            @JsonProperty("wso") String wso,
            @JsonProperty("total") String total,
            @JsonProperty("gender") String gender
    ) {
        AthleteSummary toSummary() {
            return new AthleteSummary(
                    athleteName.trim(),
                    SourceValues.parseLong(internalId),
                    SourceValues.clean(club),
                    SourceValues.parseInt(lifterAge),
                    SourceValues.parseInt(nationalRank),
                    SourceValues.clean(gender),
                    SourceValues.clean(wso),
                    SourceValues.clean(level),
                    SourceValues.parseDouble(total),
                    SourceValues.parseDate(liftDate));
        }
    }
}
