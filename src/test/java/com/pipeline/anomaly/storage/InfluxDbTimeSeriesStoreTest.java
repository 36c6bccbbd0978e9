package com.pipeline.anomaly.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.anomaly.exception.PartialWriteException;
import com.pipeline.anomaly.exception.StoreException;
import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.model.StoreConfig;
import com.pipeline.anomaly.model.TimeRange;
import com.pipeline.anomaly.model.Window;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InfluxDbTimeSeriesStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void writesOneLinePerReadingWithTokenAuth() throws Exception {
        List<String> bodies = new CopyOnWriteArrayList<>();
        AtomicReference<String> query = new AtomicReference<>();
        AtomicReference<String> auth = new AtomicReference<>();
        startServer("/api/v2/write", exchange -> {
            bodies.add(readBody(exchange));
            query.set(exchange.getRequestURI().getRawQuery());
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            writeResponse(exchange, 204, "");
        });

        InfluxDbTimeSeriesStore store = newStore(endpoint());
        store.write("Fabrica", List.of(
                new Reading(NOW.minusSeconds(60), "Fabrica", 23.1, 60.5),
                new Reading(NOW, "Fabrica", 23.4, 61.0)));

        assertEquals(List.of(
                "sensores,local=Fabrica temperatura=23.1,umidade=60.5 1772366340000000000",
                "sensores,local=Fabrica temperatura=23.4,umidade=61.0 1772366400000000000"), bodies);
        assertEquals("org=acme&bucket=sensores&precision=ns", query.get());
        assertEquals("Token secret", auth.get());
    }

    @Test
    void rejectedPointStopsBatchAndReportsProgress() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        startServer("/api/v2/write", exchange -> {
            readBody(exchange);
            if (calls.incrementAndGet() <= 2) {
                writeResponse(exchange, 204, "");
            } else {
                writeResponse(exchange, 400, "{\"code\":\"invalid\",\"message\":\"unable to parse point\"}");
            }
        });

        InfluxDbTimeSeriesStore store = newStore(endpoint());
        List<Reading> batch = List.of(
                new Reading(NOW.minusSeconds(3), "Fabrica", 23.0, 60.0),
                new Reading(NOW.minusSeconds(2), "Fabrica", 23.1, 60.1),
                new Reading(NOW.minusSeconds(1), "Fabrica", 23.2, 60.2),
                new Reading(NOW, "Fabrica", 23.3, 60.3));

        PartialWriteException e = assertThrows(PartialWriteException.class, () -> store.write("Fabrica", batch));

        assertEquals(2, e.getFailedIndex());
        assertEquals(2, e.getWrittenCount());
        assertEquals(3, calls.get());
        assertTrue(e.getMessage().contains("HTTP 400 invalid: unable to parse point"), e.getMessage());
    }

    @Test
    void queryConcatenatesTablesIntoSortedWindow() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        String csv = readFixture();
        startServer("/api/v2/query", exchange -> {
            requestBody.set(readBody(exchange));
            accept.set(exchange.getRequestHeaders().getFirst("Accept"));
            writeResponse(exchange, 200, csv);
        });

        Window window = newStore(endpoint()).query(1);

        assertEquals(3, window.size());
        assertEquals(Instant.parse("2026-03-01T11:05:00Z"), window.getReadings().get(0).getTimestamp());
        assertEquals(Instant.parse("2026-03-01T11:20:00Z"), window.getReadings().get(2).getTimestamp());
        assertEquals(new TimeRange(NOW.minusSeconds(3600), NOW).toString(), window.getRange().toString());

        assertEquals("application/csv", accept.get());
        JsonNode body = new ObjectMapper().readTree(requestBody.get());
        assertEquals("flux", body.path("type").asText());
        String flux = body.path("query").asText();
        assertTrue(flux.startsWith("from(bucket: \"sensores\")"), flux);
        assertFalse(flux.contains("r[\"local\"]"), flux);
    }

    @Test
    void queryFailureCarriesStatusAndServerMessage() throws Exception {
        startServer("/api/v2/query", exchange -> {
            readBody(exchange);
            writeResponse(exchange, 401, "{\"code\":\"unauthorized\",\"message\":\"unauthorized access\"}");
        });

        StoreException e = assertThrows(StoreException.class, () -> newStore(endpoint()).query(1));

        assertEquals(StoreException.QUERY, e.getOperation());
        assertEquals("query failed: HTTP 401 unauthorized: unauthorized access", e.getMessage());
    }

    @Test
    void malformedResponseIsQueryFailure() throws Exception {
        startServer("/api/v2/query", exchange -> {
            readBody(exchange);
            writeResponse(exchange, 200, ",result,table,_time\n,_result,0,2026-03-01T11:00:00Z\n");
        });

        StoreException e = assertThrows(StoreException.class, () -> newStore(endpoint()).query(1));

        assertEquals(StoreException.QUERY, e.getOperation());
        assertTrue(e.getMessage().contains("malformed response"), e.getMessage());
    }

    @Test
    void unreachableEndpointIsQueryFailure() {
        StoreException e = assertThrows(StoreException.class, () -> newStore("http://127.0.0.1:1").query(1));

        assertEquals(StoreException.QUERY, e.getOperation());
    }

    @Test
    void invalidEndpointIsWriteFailure() {
        List<Reading> batch = List.of(new Reading(NOW, "Fabrica", 23.0, 60.0));

        StoreException e = assertThrows(StoreException.class,
                () -> newStore("http://bad host:8086").write("Fabrica", batch));

        assertEquals(StoreException.WRITE, e.getOperation());
        assertTrue(e.getMessage().contains("invalid endpoint"), e.getMessage());
    }

    @Test
    void lineProtocolEscapesTagAndKeepsNanoseconds() {
        Reading reading = new Reading(NOW.plusNanos(123), "Sala 1,A=B", 23.5, 60.0);

        assertEquals("sensores,local=Sala\\ 1\\,A\\=B temperatura=23.5,umidade=60.0 1772366400000000123",
                InfluxDbTimeSeriesStore.toLineProtocol("Sala 1,A=B", reading));
    }

    @Test
    void lineProtocolRejectsNonFiniteValues() {
        Reading reading = new Reading(NOW, "Fabrica", Double.NaN, 60.0);

        assertThrows(IllegalArgumentException.class, () -> InfluxDbTimeSeriesStore.toLineProtocol("Fabrica", reading));
    }

    @Test
    void fluxFiltersLocationAndClosesRangeInclusively() {
        TimeRange range = new TimeRange(NOW.minusSeconds(3600), NOW);

        String flux = InfluxDbTimeSeriesStore.buildFlux("sensores", "Fabrica", range);

        assertTrue(flux.contains("range(start: 2026-03-01T11:00:00Z, stop: 2026-03-01T12:00:00.000000001Z)"), flux);
        assertTrue(flux.contains("r[\"_measurement\"] == \"sensores\""), flux);
        assertTrue(flux.contains("r[\"local\"] == \"Fabrica\""), flux);
        assertTrue(flux.contains("pivot(rowKey: [\"_time\"], columnKey: [\"_field\"], valueColumn: \"_value\")"), flux);
    }

    private InfluxDbTimeSeriesStore newStore(String endpoint) {
        StoreConfig config = new StoreConfig(endpoint, "secret", "acme", "sensores");
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build();
        return new InfluxDbTimeSeriesStore(config, client, Duration.ofSeconds(5), CLOCK);
    }

    private String endpoint() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    private void startServer(String path, Handler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext(path, exchange -> handler.handle(exchange));
        server.start();
    }

    private static String readFixture() throws IOException {
        try (Reader reader = FluxCsvParserTest.fixture("multi-table.csv")) {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void writeResponse(HttpExchange exchange, int code, String body) throws IOException {
        if (body.isEmpty()) {
            exchange.sendResponseHeaders(code, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
