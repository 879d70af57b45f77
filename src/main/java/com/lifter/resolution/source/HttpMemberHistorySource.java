package com.lifter.resolution.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifter.resolution.core.model.HistoryEntry;
import com.lifter.resolution.rules.NameNormalizer;
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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * {@link MemberHistorySource} backed by the ranking site's member endpoints.
 *
 * <p>History pages are read from {@code /public/rankings/member/{id}?page=n}, name searches
 * from {@code /public/rankings/search?name=...}. A member page that does not exist is
 * returned as an empty last page.</p>
 */
public class HttpMemberHistorySource implements MemberHistorySource {
    private static final Logger log = LoggerFactory.getLogger(HttpMemberHistorySource.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Duration timeout;
    private final SourceSession session;
    private final NameNormalizer nameNormalizer;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpMemberHistorySource(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.session = builder.session;
        this.nameNormalizer = builder.nameNormalizer != null ? builder.nameNormalizer : new NameNormalizer();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public HistoryPage getHistory(long stableId, int page) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        URI uri = URI.create(baseUrl + "/public/rankings/member/" + stableId + "?page=" + page);
        return call("history.page stableId=" + stableId + " page=" + page, () -> fetchHistory(uri, page));
    }

    @Override
    public Optional<Long> searchByName(String name) {
        URI uri = URI.create(baseUrl + "/public/rankings/search?name="
                + URLEncoder.encode(name, StandardCharsets.UTF_8));
        return call("history.search name=" + name, () -> fetchSearch(uri, name));
    }

    private <T> T call(String operation, Callable<T> call) {
        if (session != null) {
            return session.call(operation, call);
        }
        try {
            return call.call();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new SourceUnavailableException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private HistoryPage fetchHistory(URI uri, int page) {
        HttpResponse<String> response = send(uri);
        if (response.statusCode() == 404) {
            return HistoryPage.last(page, List.of());
        }
        requireOk(response);

        HistoryResponse body = read(response.body(), HistoryResponse.class);
        List<HistoryEntry> entries = new ArrayList<>();
        if (body.data() != null) {
            for (HistoryRow row : body.data()) {
                entries.add(new HistoryEntry(
                        row.meetName() != null ? row.meetName().trim() : null,
                        SourceValues.parseDate(row.date()),
                        SourceValues.parseDouble(row.bodyWeight()),
                        SourceValues.parseDouble(row.total())));
            }
        }
        int lastPage = body.lastPage() != null ? body.lastPage() : page;
        log.debug("history.fetched uri={} entries={} lastPage={}", uri, entries.size(), lastPage);
        return new HistoryPage(page, entries, page < lastPage);
    }

    private Optional<Long> fetchSearch(URI uri, String name) {
        HttpResponse<String> response = send(uri);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireOk(response);

        SearchResponse body = read(response.body(), SearchResponse.class);
        String wanted = nameNormalizer.matchKey(nameNormalizer.normalize(name));
        Set<Long> ids = new LinkedHashSet<>();
        if (body.data() != null) {
            for (SearchRow row : body.data()) {
                Long id = SourceValues.parseLong(row.internalId());
                String key = nameNormalizer.matchKey(nameNormalizer.normalize(row.athleteName()));
                if (id != null && key.equals(wanted)) {
                    ids.add(id);
                }
            }
        }
        if (ids.size() > 1) {
            log.info("history.searchAmbiguous name='{}' ids={}", name, ids);
            return Optional.empty();
        }
        return ids.stream().findFirst();
    }

    private HttpResponse<String> send(URI uri) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException("Member history unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Member history request interrupted", e);
        }
    }

    private static void requireOk(HttpResponse<String> response) {
        if (response.statusCode() != 200) {
            throw new SourceUnavailableException("Member history returned status " + response.statusCode());
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Unreadable member history response", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private SourceSession session;
        private NameNormalizer nameNormalizer;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder session(SourceSession session) {
            this.session = session;
            return this;
        }

        public Builder nameNormalizer(NameNormalizer nameNormalizer) {
            this.nameNormalizer = nameNormalizer;
            return this;
        }

        public HttpMemberHistorySource build() {
            return new HttpMemberHistorySource(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record HistoryResponse(
            @JsonProperty("page") Integer page,
            @JsonProperty("last_page") Integer lastPage,
            @JsonProperty("data") List<HistoryRow> data
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record HistoryRow(
            @JsonProperty("meet_name") String meetName,
            @JsonProperty("date") String date,
            @JsonProperty("body_weight") String bodyWeight,
            @JsonProperty("total") String total
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchResponse(
            @JsonProperty("data") List<SearchRow> data
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchRow(
            @JsonProperty("internal_id") String internalId,
            @JsonProperty("athlete_name") String athleteName
    ) {}
}
