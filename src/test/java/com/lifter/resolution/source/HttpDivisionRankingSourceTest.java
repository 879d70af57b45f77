package com.lifter.resolution.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifter.resolution.core.model.AthleteSummary;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpDivisionRankingSourceTest {

    private static final LocalDate FROM = LocalDate.of(2024, 2, 25);
    private static final LocalDate TO = LocalDate.of(2024, 3, 6);

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{\"data\":[]}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/public/rankings/all", this::respond);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(HttpExchange exchange) throws IOException {
        lastQuery.set(exchange.getRequestURI().getRawQuery());
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpDivisionRankingSource source() {
        return HttpDivisionRankingSource.builder().baseUrl(baseUrl).timeout(Duration.ofSeconds(5)).build();
    }

    @Test
    @DisplayName("Should parse ranking rows into athletes")
    void testParseRows() {
        body = """
                {"data":[
                  {"athlete_name":" Jane Smith ","internal_id":"1234","national_rank":"3","lifter_age":"25",
                   "club":"Barbell Club","lift_date":"2024-03-01","level":"National","wso":"Carolina",
                   "total":"187","gender":"F","unknown_field":"x"},
                  {"athlete_name":"","internal_id":"9"},
                  {"athlete_name":"John Doe","internal_id":777,"club":"  "}
                ]}
                """;

        DivisionQueryResult result = source().query(101, FROM, TO);

        assertFalse(result.isDegraded());
        assertEquals(2, result.athletes().size());
        AthleteSummary jane = result.athletes().get(0);
        assertEquals("Jane Smith", jane.name());
        assertEquals(1234L, jane.stableId());
        assertEquals(3, jane.nationalRank());
        assertEquals(25, jane.competitionAge());
        assertEquals("Carolina", jane.wso());
        assertEquals(187.0, jane.total());
        assertEquals(LocalDate.of(2024, 3, 1), jane.liftDate());
        assertEquals(777L, result.athletes().get(1).stableId());
        assertNull(result.athletes().get(1).club());
    }

    @Test
    @DisplayName("Should send the division and window as a base64 JSON filter")
    void testFilterParameter() throws IOException {
        source().query(101, FROM, TO);

        String query = lastQuery.get();
        assertTrue(query.startsWith("filters="));
        String encoded = URLDecoder.decode(query.substring("filters=".length()), StandardCharsets.UTF_8);
        JsonNode filter = new ObjectMapper().readTree(Base64.getDecoder().decode(encoded));
        assertEquals("2024-02-25", filter.get("date_range_start").asText());
        assertEquals("2024-03-06", filter.get("date_range_end").asText());
        assertEquals(101, filter.get("weight_class").asInt());
    }

    @Test
    @DisplayName("Should report a server error as degraded")
    void testServerErrorDegraded() {
        status = 503;
        body = "busy";

        DivisionQueryResult result = source().query(101, FROM, TO);

        assertTrue(result.isDegraded());
        assertTrue(result.athletes().isEmpty());
    }

    @Test
    @DisplayName("Should report a truncated or full response as degraded")
    void testTruncatedDegraded() {
        body = "{\"truncated\":true,\"data\":[{\"athlete_name\":\"Jane Smith\"}]}";
        assertTrue(source().query(101, FROM, TO).isDegraded());

        body = "{\"data\":[{\"athlete_name\":\"Jane Smith\"},{\"athlete_name\":\"John Doe\"}]}";
        HttpDivisionRankingSource capped = HttpDivisionRankingSource.builder().baseUrl(baseUrl).maxRows(2).build();
        DivisionQueryResult result = capped.query(101, FROM, TO);
        assertTrue(result.isDegraded());
        assertEquals(2, result.athletes().size());
    }

    @Test
    @DisplayName("Should fail on client errors and unreadable bodies")
    void testUnavailable() {
        status = 403;
        assertThrows(SourceUnavailableException.class, () -> source().query(101, FROM, TO));

        status = 200;
        body = "<html>maintenance</html>";
        assertThrows(SourceUnavailableException.class, () -> source().query(101, FROM, TO));
    }

    @Test
    @DisplayName("Should fail when the site cannot be reached")
    void testUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpDivisionRankingSource unreachable = HttpDivisionRankingSource.builder()
                .baseUrl("http://127.0.0.1:" + closedPort)
                .build();

        assertThrows(SourceUnavailableException.class, () -> unreachable.query(101, FROM, TO));
    }

    @Test
    @DisplayName("Should run calls through a session")
    void testSession() {
        body = "{\"data\":[{\"athlete_name\":\"Jane Smith\",\"internal_id\":\"1234\"}]}";
        try (SourceSession session = new SourceSession("rankings", Duration.ofSeconds(5))) {
            HttpDivisionRankingSource viaSession = HttpDivisionRankingSource.builder()
                    .baseUrl(baseUrl)
                    .session(session)
                    .build();

            assertEquals(1, viaSession.query(101, FROM, TO).athletes().size());
        }
    }

    @Test
    @DisplayName("Should require a base url")
    void testBaseUrlRequired() {
        assertThrows(IllegalArgumentException.class, () -> HttpDivisionRankingSource.builder().build());
        assertThrows(IllegalArgumentException.class, () -> HttpDivisionRankingSource.builder().maxRows(-1));
    }
}
