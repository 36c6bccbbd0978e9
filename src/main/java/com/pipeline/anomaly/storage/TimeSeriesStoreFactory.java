package com.pipeline.anomaly.storage;

import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.ConfigIncompleteException;
import com.pipeline.anomaly.model.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 存储客户端工厂。
 * 先校验连接配置四项齐备，再按 endpoint 协议选择实现：
 * http/https 对接 InfluxDB，sqlite:&lt;目录&gt; 使用本地嵌入式存储。
 */
public final class TimeSeriesStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesStoreFactory.class);

    public static final String SQLITE_SCHEME = "sqlite:";

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final long sqliteTimeWindowMs;
    private final Clock clock;

    public TimeSeriesStoreFactory(Duration connectTimeout, Duration requestTimeout,
                                  long sqliteTimeWindowMs, Clock clock) {
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.sqliteTimeWindowMs = sqliteTimeWindowMs;
        this.clock = clock;
    }

    public static TimeSeriesStoreFactory withDefaults(Clock clock) {
        return new TimeSeriesStoreFactory(Duration.ofSeconds(5), Duration.ofSeconds(30),
                24 * 60 * 60 * 1000L, clock);
    }

    /**
     * @throws ConfigIncompleteException 任一配置项为空
     * @throws IllegalArgumentException  endpoint 协议不受支持
     */
    public TimeSeriesStore create(StoreConfig config) {
        List<String> missing = config.missingFields();
        if (!missing.isEmpty()) {
            throw new ConfigIncompleteException(missing);
        }

        String endpoint = config.getEndpoint().trim();
        String lower = endpoint.toLowerCase(Locale.ROOT);
        if (lower.startsWith(SQLITE_SCHEME)) {
            Path root = Path.of(endpoint.substring(SQLITE_SCHEME.length()));
            log.info("Using embedded SQLite store at {}", root);
            return new SQLiteTimeSeriesStore(root, config.getBucket(), sqliteTimeWindowMs, clock);
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .build();
            return new InfluxDbTimeSeriesStore(config, httpClient, requestTimeout, clock);
        }
        throw new IllegalArgumentException("Unsupported store endpoint '" + endpoint
                + "', expected http(s)://host:port or " + SQLITE_SCHEME + "<directory>");
    }
}
