package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 样例数据批次：生成的读数及注入异常的下标。
 * 注入下标仅供测试校验使用，下游业务逻辑不应依赖。
 */
public class GeneratedBatch implements Serializable {
    private final List<Reading> readings;
    private final Set<Integer> anomalyIndices;

    public GeneratedBatch(List<Reading> readings, Set<Integer> anomalyIndices) {
        this.readings = new ArrayList<>(readings);
        this.anomalyIndices = new TreeSet<>(anomalyIndices);
    }

    public List<Reading> getReadings() {
        return Collections.unmodifiableList(readings);
    }

    public Set<Integer> getAnomalyIndices() {
        return Collections.unmodifiableSet(anomalyIndices);
    }

    public int size() {
        return readings.size();
    }
}
