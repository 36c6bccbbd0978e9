package com.pipeline.anomaly.model;

import java.io.Serializable;

/**
 * 读数与其异常标记的一一配对。标记仅在产生它的窗口内有效。
 */
public final class LabeledReading implements Serializable {
    private final Reading reading;
    private final boolean anomaly;

    public LabeledReading(Reading reading, boolean anomaly) {
        this.reading = reading;
        this.anomaly = anomaly;
    }

    public Reading getReading() { return reading; }
    public boolean isAnomaly() { return anomaly; }

    @Override
    public String toString() {
        return (anomaly ? "ANOMALY " : "normal  ") + reading;
    }
}
