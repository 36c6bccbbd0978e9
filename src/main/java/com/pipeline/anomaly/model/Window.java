package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 查询窗口：某时间范围内的读数序列，按时间戳升序排列。
 * 每次检测请求重新查询生成，不做持久化。
 */
public class Window implements Serializable {
    private final TimeRange range;
    private final List<Reading> readings;

    public Window(TimeRange range) {
        this.range = range;
        this.readings = new ArrayList<>();
    }

    public Window(TimeRange range, List<Reading> readings) {
        this.range = range;
        this.readings = new ArrayList<>(readings);
        this.readings.sort(Comparator.comparing(Reading::getTimestamp));
    }

    public TimeRange getRange() { return range; }

    public List<Reading> getReadings() {
        return Collections.unmodifiableList(readings);
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }
}
