package com.pipeline.anomaly.storage;

import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * InfluxDB 查询响应（annotated CSV）解析器。
 *
 * 响应可能包含多张结果表：每张表由可选的 # 注释行、一行表头和若干数据行组成，
 * 表之间以空行分隔。所有表的数据行被拼接为一个读数列表，排序由调用方负责。
 * 表头含 error 列时表示服务端在流中报告了查询错误。
 */
public final class FluxCsvParser {

    private static final Logger log = LoggerFactory.getLogger(FluxCsvParser.class);

    static final String TIME_COLUMN = "_time";

    private FluxCsvParser() {}

    /**
     * @throws IllegalArgumentException 响应格式不合法或包含服务端错误
     * @throws IOException              读取失败
     */
    public static List<Reading> parse(Reader source) throws IOException {
        List<Reading> readings = new ArrayList<>();
        BufferedReader reader = new BufferedReader(source);

        Map<String, Integer> header = null;
        int tables = 0;
        int skipped = 0;
        int lineNo = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                header = null;
                continue;
            }
            if (line.startsWith("#")) {
                header = null;
                continue;
            }

            List<String> cells = splitCsvLine(line);
            if (header == null) {
                header = indexHeader(cells, lineNo);
                tables++;
                continue;
            }

            if (header.containsKey("error")) {
                throw new IllegalArgumentException("query error reported by server: " + cell(cells, header, "error"));
            }

            String time = cell(cells, header, TIME_COLUMN);
            String temperature = cell(cells, header, TimeSeriesStore.TEMPERATURE_FIELD);
            String humidity = cell(cells, header, TimeSeriesStore.HUMIDITY_FIELD);
            if (temperature.isEmpty() || humidity.isEmpty()) {
                // 透视后某时刻缺少其中一个字段
                skipped++;
                continue;
            }

            try {
                readings.add(new Reading(
                        Instant.parse(time),
                        emptyToNull(cell(cells, header, TimeSeriesStore.LOCATION_TAG)),
                        Double.parseDouble(temperature),
                        Double.parseDouble(humidity)));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new IllegalArgumentException("malformed row at line " + lineNo + ": " + line, e);
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} row(s) missing '{}' or '{}'.", skipped,
                    TimeSeriesStore.TEMPERATURE_FIELD, TimeSeriesStore.HUMIDITY_FIELD);
        }
        log.debug("Parsed {} reading(s) from {} result table(s).", readings.size(), tables);
        return readings;
    }

    private static Map<String, Integer> indexHeader(List<String> cells, int lineNo) {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            header.put(cells.get(i), i);
        }
        if (header.containsKey("error")) {
            return header;
        }
        for (String required : new String[]{TIME_COLUMN,
                TimeSeriesStore.TEMPERATURE_FIELD, TimeSeriesStore.HUMIDITY_FIELD}) {
            if (!header.containsKey(required)) {
                throw new IllegalArgumentException("result table header at line " + lineNo
                        + " lacks column '" + required + "': " + cells);
            }
        }
        return header;
    }

    private static String cell(List<String> cells, Map<String, Integer> header, String column) {
        Integer idx = header.get(column);
        if (idx == null || idx >= cells.size()) {
            return "";
        }
        return cells.get(idx);
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }

    /** RFC 4180 单行切分，支持双引号包裹及 "" 转义 */
    static List<String> splitCsvLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString());
                current.setLength(0);
            } else if (c != '\r') {
                current.append(c);
            }
        }
        cells.add(current.toString());
        return cells;
    }
}
