package com.pipeline.anomaly.storage;

import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.PartialWriteException;
import com.pipeline.anomaly.exception.StoreException;
import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.model.TimeRange;
import com.pipeline.anomaly.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于SQLite的嵌入式时序存储实现，用于本地运行和测试。
 *
 * 核心设计：
 * - 按时间窗口分库（每个库对应一个SQLite文件），范围查询跨越所有重叠分库
 * - 一个bucket一张表，以 (local, timestamp) 为主键，同一位置同一时刻的重复写入覆盖旧值
 * - 时间戳B-tree索引
 * - 时间戳以纳秒精度存储
 */
public class SQLiteTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTimeSeriesStore.class);

    /** 存储根目录 */
    private final Path storageRoot;

    private final String tableName;

    /** 时间窗口大小（毫秒），默认1天 */
    private final long timeWindowMs;

    private final Clock clock;

    /** 分库连接：dbKey -> Connection */
    private final Map<String, Connection> connections = new HashMap<>();

    public SQLiteTimeSeriesStore(Path storageRoot, String bucket, Clock clock) {
        this(storageRoot, bucket, 24 * 60 * 60 * 1000L, clock);
    }

    public SQLiteTimeSeriesStore(Path storageRoot, String bucket, long timeWindowMs, Clock clock) {
        if (timeWindowMs <= 0) {
            throw new IllegalArgumentException("Time window must be positive, got: " + timeWindowMs);
        }
        this.storageRoot = storageRoot;
        this.tableName = sanitizeTableName(bucket);
        this.timeWindowMs = timeWindowMs;
        this.clock = clock;

        try {
            Files.createDirectories(storageRoot);
        } catch (IOException e) {
            throw new StoreException(StoreException.OPEN, "failed to create storage directory " + storageRoot, e);
        }
        log.info("SQLiteTimeSeriesStore initialized. Root: {}, Table: {}, TimeWindow: {}ms",
                storageRoot, tableName, timeWindowMs);
    }

    // ==================== 写入 ====================

    @Override
    public void write(String location, List<Reading> readings) {
        int written = 0;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            try {
                writePoint(location, reading);
                written++;
            } catch (SQLException | ArithmeticException e) {
                // ArithmeticException: 时间戳超出纳秒 long 可表示范围
                log.error("Failed to write point #{} ({}) for location '{}': {}",
                        i, reading.getTimestamp(), location, e.getMessage(), e);
                throw new PartialWriteException(i, reading.getTimestamp(), written, e);
            }
        }
        log.debug("Wrote {} point(s) for location '{}'.", written, location);
    }

    private void writePoint(String location, Reading reading) throws SQLException {
        long timestampNanos = Timestamps.toEpochNanos(reading.getTimestamp());
        long timestampMs = reading.getTimestamp().toEpochMilli();
        Connection conn = connection(getDbKey(timestampMs));
        ensureTableExists(conn);

        String sql = "INSERT OR REPLACE INTO " + tableName
                + " (" + LOCATION_TAG + ", timestamp, " + TEMPERATURE_FIELD + ", " + HUMIDITY_FIELD + ")"
                + " VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, location);
            stmt.setLong(2, timestampNanos);
            stmt.setDouble(3, reading.getTemperature());
            stmt.setDouble(4, reading.getHumidity());
            stmt.executeUpdate();
        }
    }

    // ==================== 查询 ====================

    @Override
    public Window query(int lookbackHours) {
        return query(null, lookbackHours);
    }

    @Override
    public Window query(String location, int lookbackHours) {
        TimeRange range = TimeRange.lookback(clock, lookbackHours);
        long startMs = range.getStart().toEpochMilli();
        long endMs = range.getEnd().toEpochMilli();

        List<Reading> rows = new ArrayList<>();
        for (long windowStart = alignToWindow(startMs); windowStart <= endMs; windowStart += timeWindowMs) {
            String dbKey = getDbKey(windowStart);
            // 分库文件不存在说明该时间窗口无数据
            if (!connections.containsKey(dbKey) && !Files.exists(dbPath(dbKey))) {
                continue;
            }
            try {
                rows.addAll(queryShard(connection(dbKey), location, range));
            } catch (SQLException e) {
                log.error("Failed to query shard '{}' for range {}: {}", dbKey, range, e.getMessage(), e);
                throw new StoreException(StoreException.QUERY, "shard " + dbKey + ": " + e.getMessage(), e);
            }
        }

        return new Window(range, rows);
    }

    private List<Reading> queryShard(Connection conn, String location, TimeRange range) throws SQLException {
        List<Reading> rows = new ArrayList<>();
        if (!tableExists(conn)) {
            return rows;
        }

        String sql = "SELECT " + LOCATION_TAG + ", timestamp, " + TEMPERATURE_FIELD + ", " + HUMIDITY_FIELD
                + " FROM " + tableName
                + " WHERE timestamp >= ? AND timestamp <= ?"
                + (location != null ? " AND " + LOCATION_TAG + " = ?" : "")
                + " ORDER BY timestamp ASC";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, Timestamps.toEpochNanos(range.getStart()));
            stmt.setLong(2, Timestamps.toEpochNanos(range.getEnd()));
            if (location != null) {
                stmt.setString(3, location);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new Reading(
                            Timestamps.fromEpochNanos(rs.getLong("timestamp")),
                            rs.getString(LOCATION_TAG),
                            rs.getDouble(TEMPERATURE_FIELD),
                            rs.getDouble(HUMIDITY_FIELD)));
                }
            }
        }
        return rows;
    }

    // ==================== 内部工具方法 ====================

    private Connection connection(String dbKey) throws SQLException {
        Connection conn = connections.get(dbKey);
        if (conn == null) {
            conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath(dbKey));
            conn.setAutoCommit(true);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
            connections.put(dbKey, conn);
        }
        return conn;
    }

    private void ensureTableExists(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + tableName + " ("
                    + LOCATION_TAG + " TEXT NOT NULL, "
                    + "timestamp INTEGER NOT NULL, "
                    + TEMPERATURE_FIELD + " REAL NOT NULL, "
                    + HUMIDITY_FIELD + " REAL NOT NULL, "
                    + "PRIMARY KEY (" + LOCATION_TAG + ", timestamp))");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_" + tableName + "_ts ON " + tableName + " (timestamp)");
        }
    }

    private boolean tableExists(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type='table' AND name=?")) {
            stmt.setString(1, tableName);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private Path dbPath(String dbKey) {
        return storageRoot.resolve(dbKey + ".db");
    }

    /** 时间戳对齐到时间窗口起点 */
    private long alignToWindow(long timestampMs) {
        return Math.floorDiv(timestampMs, timeWindowMs) * timeWindowMs;
    }

    /** 根据时间戳生成分库键名 */
    private String getDbKey(long timestampMs) {
        return "ts_" + alignToWindow(timestampMs);
    }

    /** 将bucket名转为合法的SQLite表名 */
    static String sanitizeTableName(String bucket) {
        return "m_" + bucket.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    /** 关闭所有分库连接 */
    @Override
    public void close() {
        connections.forEach((key, conn) -> {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("Failed to close connection for db '{}': {}", key, e.getMessage());
            }
        });
        connections.clear();
        log.info("SQLiteTimeSeriesStore shut down.");
    }
}
