package com.pipeline.anomaly.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.PartialWriteException;
import com.pipeline.anomaly.exception.StoreException;
import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.model.StoreConfig;
import com.pipeline.anomaly.model.TimeRange;
import com.pipeline.anomaly.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * InfluxDB v2 HTTP API 存储实现。
 *
 * 写入：每条读数编码为一行 line protocol，逐点调用 /api/v2/write（纳秒精度），
 * 服务端返回 204 视为确认。
 * 查询：向 /api/v2/query 提交 Flux 脚本，按测量名、字段名（及可选位置标签）过滤，
 * 以 _time 为行键透视字段，响应为 annotated CSV，多张结果表拼接为一个窗口。
 */
public class InfluxDbTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(InfluxDbTimeSeriesStore.class);

    private final StoreConfig config;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public InfluxDbTimeSeriesStore(StoreConfig config, HttpClient httpClient, Duration requestTimeout, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        log.info("InfluxDbTimeSeriesStore initialized. {}", config);
    }

    // ==================== 写入 ====================

    @Override
    public void write(String location, List<Reading> readings) {
        URI uri;
        try {
            uri = endpoint("/api/v2/write?org=" + encode(config.getOrganization())
                    + "&bucket=" + encode(config.getBucket()) + "&precision=ns");
        } catch (IllegalArgumentException e) {
            log.error("Write for location '{}' failed, invalid endpoint '{}': {}",
                    location, config.getEndpoint(), e.getMessage());
            throw new StoreException(StoreException.WRITE, "invalid endpoint: " + e.getMessage(), e);
        }

        int written = 0;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            try {
                String line = toLineProtocol(location, reading);
                HttpRequest request = HttpRequest.newBuilder(uri)
                        .timeout(requestTimeout)
                        .header("Authorization", "Token " + config.getCredential())
                        .header("Content-Type", "text/plain; charset=utf-8")
                        .POST(HttpRequest.BodyPublishers.ofString(line, StandardCharsets.UTF_8))
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 != 2) {
                    throw new StoreException(StoreException.WRITE, describeError(response));
                }
                written++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PartialWriteException(i, reading.getTimestamp(), written, e);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to write point #{} ({}) for location '{}': {}",
                        i, reading.getTimestamp(), location, describeCause(e));
                throw new PartialWriteException(i, reading.getTimestamp(), written, e);
            }
        }
        log.debug("Wrote {} point(s) for location '{}'.", written, location);
    }

    /**
     * 编码为 line protocol：{@code sensores,local=<loc> temperatura=<t>,umidade=<h> <ns>}
     */
    static String toLineProtocol(String location, Reading reading) {
        return MEASUREMENT
                + "," + LOCATION_TAG + "=" + escapeTag(location)
                + " " + TEMPERATURE_FIELD + "=" + formatField(reading.getTemperature())
                + "," + HUMIDITY_FIELD + "=" + formatField(reading.getHumidity())
                + " " + Timestamps.toEpochNanos(reading.getTimestamp());
    }

    private static String escapeTag(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Location tag must not be empty");
        }
        return value.replace("\\", "\\\\")
                .replace(",", "\\,")
                .replace("=", "\\=")
                .replace(" ", "\\ ");
    }

    private static String formatField(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Field value must be finite, got: " + value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    // ==================== 查询 ====================

    @Override
    public Window query(int lookbackHours) {
        return query(null, lookbackHours);
    }

    @Override
    public Window query(String location, int lookbackHours) {
        TimeRange range = TimeRange.lookback(clock, lookbackHours);
        String flux = buildFlux(config.getBucket(), location, range);

        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("query", flux);
            body.put("type", "flux");
            ObjectNode dialect = body.putObject("dialect");
            dialect.put("header", true);
            dialect.put("delimiter", ",");
            dialect.putArray("annotations").add("datatype").add("group").add("default");

            HttpRequest request = HttpRequest.newBuilder(endpoint("/api/v2/query?org=" + encode(config.getOrganization())))
                    .timeout(requestTimeout)
                    .header("Authorization", "Token " + config.getCredential())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/csv")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new StoreException(StoreException.QUERY, describeError(response));
            }

            List<Reading> rows;
            try {
                rows = FluxCsvParser.parse(new StringReader(response.body()));
            } catch (IllegalArgumentException e) {
                throw new StoreException(StoreException.QUERY, "malformed response: " + e.getMessage(), e);
            }
            return new Window(range, rows);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(StoreException.QUERY, "interrupted", e);
        } catch (StoreException e) {
            log.error("Query over {} failed: {}", range, e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            log.error("Query over {} failed, invalid endpoint '{}': {}", range, config.getEndpoint(), e.getMessage());
            throw new StoreException(StoreException.QUERY, "invalid endpoint: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("Query over {} failed: {}", range, describeCause(e));
            throw new StoreException(StoreException.QUERY, describeCause(e), e);
        }
    }

    static String buildFlux(String bucket, String location, TimeRange range) {
        StringBuilder flux = new StringBuilder()
                .append("from(bucket: \"").append(escapeFluxString(bucket)).append("\")\n")
                .append("  |> range(start: ").append(range.getStart())
                // range 的 stop 为开区间
                .append(", stop: ").append(range.getEnd().plusNanos(1)).append(")\n")
                .append("  |> filter(fn: (r) => r[\"_measurement\"] == \"").append(MEASUREMENT).append("\")\n")
                .append("  |> filter(fn: (r) => r[\"_field\"] == \"").append(TEMPERATURE_FIELD)
                .append("\" or r[\"_field\"] == \"").append(HUMIDITY_FIELD).append("\")\n");
        if (location != null) {
            flux.append("  |> filter(fn: (r) => r[\"").append(LOCATION_TAG).append("\"] == \"")
                    .append(escapeFluxString(location)).append("\")\n");
        }
        flux.append("  |> pivot(rowKey: [\"_time\"], columnKey: [\"_field\"], valueColumn: \"_value\")");
        return flux.toString();
    }

    private static String escapeFluxString(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // ==================== 内部工具方法 ====================

    private URI endpoint(String pathAndQuery) {
        String base = config.getEndpoint();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + pathAndQuery);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** 解析 InfluxDB 错误响应体 {"code": ..., "message": ...} */
    private String describeError(HttpResponse<String> response) {
        String detail = response.body();
        try {
            JsonNode error = objectMapper.readTree(response.body());
            if (error != null && error.hasNonNull("message")) {
                detail = error.path("code").asText("error") + ": " + error.path("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return "HTTP " + response.statusCode() + " " + detail;
    }

    private static String describeCause(Exception e) {
        if (e instanceof HttpTimeoutException) {
            return "timeout: " + e.getMessage();
        }
        if (e instanceof StoreException) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    @Override
    public void close() {
        // java.net.http.HttpClient 在 JDK 17 上无需显式关闭
        log.info("InfluxDbTimeSeriesStore closed.");
    }
}
