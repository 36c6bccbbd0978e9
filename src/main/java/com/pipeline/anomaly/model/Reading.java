package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 单条传感器读数：时间戳 + 位置标签 + 温度 + 湿度。
 * 创建后不可变。
 */
public final class Reading implements Serializable {
    private final Instant timestamp;
    private final String location;
    private final double temperature;
    private final double humidity;

    public Reading(Instant timestamp, String location, double temperature, double humidity) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.location = location;
        this.temperature = temperature;
        this.humidity = humidity;
    }

    public Instant getTimestamp() { return timestamp; }
    public String getLocation() { return location; }
    public double getTemperature() { return temperature; }
    public double getHumidity() { return humidity; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reading)) return false;
        Reading other = (Reading) o;
        return Double.compare(temperature, other.temperature) == 0
                && Double.compare(humidity, other.humidity) == 0
                && timestamp.equals(other.timestamp)
                && Objects.equals(location, other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, location, temperature, humidity);
    }

    @Override
    public String toString() {
        return "Reading{" + timestamp
                + ", location='" + location + "'"
                + ", temperature=" + temperature
                + ", humidity=" + humidity + "}";
    }
}
