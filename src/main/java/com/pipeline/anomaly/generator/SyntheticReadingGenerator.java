package com.pipeline.anomaly.generator;

import com.pipeline.anomaly.model.GeneratedBatch;
import com.pipeline.anomaly.model.Reading;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 样例读数生成器。
 * 从"当前时刻"开始按固定间隔向过去生成读数，温湿度服从以基准值为中心的正态分布，
 * 并在随机选取的若干位置以更大的离散度重新抽样，模拟传感器毛刺。
 *
 * 随机源与时钟由外部注入，测试可固定种子和时间。
 *
 * 典型用法：
 * <pre>
 * SyntheticReadingGenerator generator = new SyntheticReadingGenerator(new Random(7), Clock.systemUTC(), "Fabrica")
 *     .setTemperature(23.0, 1.0, 5.0)
 *     .setHumidity(60.0, 2.0, 10.0);
 * GeneratedBatch batch = generator.generate(100);
 * </pre>
 */
public class SyntheticReadingGenerator {

    private final Random random;
    private final Clock clock;
    private final String location;

    private Duration interval = Duration.ofMinutes(1);
    private int anomalyCount = 5;

    private double temperatureBaseline = 23.0;
    private double temperatureSpread = 1.0;
    private double temperatureAnomalySpread = 5.0;

    private double humidityBaseline = 60.0;
    private double humiditySpread = 2.0;
    private double humidityAnomalySpread = 10.0;

    public SyntheticReadingGenerator(Random random, Clock clock, String location) {
        this.random = random;
        this.clock = clock;
        this.location = location;
    }

    public SyntheticReadingGenerator setInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive, got: " + interval);
        }
        this.interval = interval;
        return this;
    }

    public SyntheticReadingGenerator setAnomalyCount(int anomalyCount) {
        if (anomalyCount < 0) {
            throw new IllegalArgumentException("Anomaly count must be >= 0, got: " + anomalyCount);
        }
        this.anomalyCount = anomalyCount;
        return this;
    }

    public SyntheticReadingGenerator setTemperature(double baseline, double spread, double anomalySpread) {
        this.temperatureBaseline = baseline;
        this.temperatureSpread = spread;
        this.temperatureAnomalySpread = anomalySpread;
        return this;
    }

    public SyntheticReadingGenerator setHumidity(double baseline, double spread, double anomalySpread) {
        this.humidityBaseline = baseline;
        this.humiditySpread = spread;
        this.humidityAnomalySpread = anomalySpread;
        return this;
    }

    /**
     * 生成 n 条读数，第 i 条的时间戳为 now - i * interval（严格递减）。
     *
     * @param n 读数数量，必须 &gt;= 1
     * @return 读数批次及注入异常的下标
     */
    public GeneratedBatch generate(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Sample count must be >= 1, got: " + n);
        }

        Instant now = clock.instant();
        Set<Integer> anomalyIndices = pickDistinctIndices(n, Math.min(anomalyCount, n));

        List<Reading> readings = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Instant timestamp = now.minus(interval.multipliedBy(i));
            double temperature = temperatureBaseline + random.nextGaussian() * temperatureSpread;
            double humidity = humidityBaseline + random.nextGaussian() * humiditySpread;
            readings.add(new Reading(timestamp, location, temperature, humidity));
        }

        // 在选中位置以相同均值、更大离散度重新抽样
        for (int idx : anomalyIndices) {
            Reading normal = readings.get(idx);
            double temperature = temperatureBaseline + random.nextGaussian() * temperatureAnomalySpread;
            double humidity = humidityBaseline + random.nextGaussian() * humidityAnomalySpread;
            readings.set(idx, new Reading(normal.getTimestamp(), location, temperature, humidity));
        }

        return new GeneratedBatch(readings, anomalyIndices);
    }

    /** 部分Fisher-Yates洗牌，无放回等概率抽取 k 个下标 */
    private Set<Integer> pickDistinctIndices(int n, int k) {
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) pool[i] = i;

        Set<Integer> picked = new HashSet<>();
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
            picked.add(pool[i]);
        }
        return picked;
    }

    public String getLocation() {
        return location;
    }
}
