package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.AnomalyDetector;
import com.pipeline.anomaly.core.AnomalyPipeline;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.generator.SyntheticReadingGenerator;
import com.pipeline.anomaly.model.DetectionResult;
import com.pipeline.anomaly.model.GeneratedBatch;
import com.pipeline.anomaly.model.Reading;
import com.pipeline.anomaly.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 管道编排默认实现。
 * 同步、单线程：每一步执行完毕后才进入下一步，失败原样抛给调用方，不做重试。
 */
public class DefaultAnomalyPipeline implements AnomalyPipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultAnomalyPipeline.class);

    private final SyntheticReadingGenerator generator;
    private final TimeSeriesStore store;
    private final AnomalyDetector detector;

    public DefaultAnomalyPipeline(SyntheticReadingGenerator generator,
                                  TimeSeriesStore store,
                                  AnomalyDetector detector) {
        this.generator = generator;
        this.store = store;
        this.detector = detector;
    }

    @Override
    public GeneratedBatch produceSampleBatch(int sampleCount) {
        GeneratedBatch batch = generator.generate(sampleCount);
        log.info("Generated {} sample reading(s) for '{}', {} injected anomalies.",
                batch.size(), generator.getLocation(), batch.getAnomalyIndices().size());

        store.write(generator.getLocation(), batch.getReadings());
        log.info("Sample batch written to store.");
        return batch;
    }

    @Override
    public void ingest(String location, List<Reading> readings) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Location must not be blank");
        }
        if (readings.isEmpty()) {
            return;
        }
        store.write(location, readings);
        log.debug("Ingested {} reading(s) for '{}'.", readings.size(), location);
    }

    @Override
    public DetectionResult refresh(int lookbackHours) {
        return refresh(null, lookbackHours);
    }

    @Override
    public DetectionResult refresh(String location, int lookbackHours) {
        Window window = (location == null)
                ? store.query(lookbackHours)
                : store.query(location, lookbackHours);
        log.info("Queried {} reading(s) over {} ({}h lookback{}).", window.size(), window.getRange(),
                lookbackHours, location != null ? ", location '" + location + "'" : "");

        DetectionResult result = detector.detect(window);
        log.info("Detector '{}' flagged {} of {} reading(s).",
                result.getDetectorId(), result.getAnomalyCount(), result.size());
        return result;
    }
}
