package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 单次窗口检测的结果：与输入窗口等长、同序的带标记读数序列，以及异常总数。
 */
public class DetectionResult implements Serializable {
    private final String detectorId;
    private final TimeRange range;
    private final List<LabeledReading> labeledReadings;
    private final int anomalyCount;

    public DetectionResult(String detectorId, TimeRange range, List<LabeledReading> labeledReadings) {
        this.detectorId = detectorId;
        this.range = range;
        this.labeledReadings = new ArrayList<>(labeledReadings);
        int count = 0;
        for (LabeledReading lr : labeledReadings) {
            if (lr.isAnomaly()) count++;
        }
        this.anomalyCount = count;
    }

    public String getDetectorId() { return detectorId; }
    public TimeRange getRange() { return range; }

    public List<LabeledReading> getLabeledReadings() {
        return Collections.unmodifiableList(labeledReadings);
    }

    public int size() { return labeledReadings.size(); }
    public int getAnomalyCount() { return anomalyCount; }

    /** 按输入顺序返回各读数的异常标记 */
    public boolean[] getFlags() {
        boolean[] flags = new boolean[labeledReadings.size()];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = labeledReadings.get(i).isAnomaly();
        }
        return flags;
    }

    public List<Reading> getAnomalies() {
        return labeledReadings.stream()
                .filter(LabeledReading::isAnomaly)
                .map(LabeledReading::getReading)
                .collect(Collectors.toList());
    }
}
