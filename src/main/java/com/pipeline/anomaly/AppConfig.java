package com.pipeline.anomaly;

import com.pipeline.anomaly.model.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数，每一项都有默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String CLASSPATH_CONFIG = "application.properties";

    // ---- 时序存储 ----
    private String storeEndpoint = "";
    private String storeToken = "";
    private String storeOrg = "";
    private String storeBucket = "";
    private long storeConnectTimeoutMs = 5000;
    private long storeRequestTimeoutMs = 30000;
    private long sqliteTimeWindowMs = 24 * 60 * 60 * 1000L;

    // ---- 传感器 ----
    private String sensorLocation = "Fabrica";

    // ---- 样例数据生成 ----
    private int generatorSamples = 100;
    private long generatorIntervalSeconds = 60;
    private double temperatureBaseline = 23.0;
    private double temperatureSpread = 1.0;
    private double temperatureAnomalySpread = 5.0;
    private double humidityBaseline = 60.0;
    private double humiditySpread = 2.0;
    private double humidityAnomalySpread = 10.0;
    private int generatorAnomalyCount = 5;

    // ---- 异常检测 ----
    private double detectorContamination = 0.1;
    private int detectorTrees = 100;
    private int detectorMaxSamples = 256;
    private long detectorSeed = 42;
    private boolean detectorStandardize = false;

    private int lookbackHours = 1;

    // ---- Kafka ----
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaInputTopic = "sensor-readings";
    private String kafkaGroupId = "anomaly-ingest";

    /**
     * 从文件加载配置；路径为null时读取类路径下的 application.properties。
     * 读取失败时记录错误并使用默认值。
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = (configPath != null)
                ? new FileInputStream(configPath)
                : AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in == null) {
                throw new IOException("'" + CLASSPATH_CONFIG + "' not found in the classpath");
            }
            props.load(in);
        } catch (IOException e) {
            log.error("Failed to load config from {}, using defaults. Error: {}",
                    configPath != null ? configPath : CLASSPATH_CONFIG, e.getMessage());
        }
        return fromProperties(props);
    }

    /**
     * @throws NumberFormatException 数值型配置项格式错误
     */
    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();

        config.storeEndpoint = props.getProperty("store.endpoint", "").trim();
        config.storeToken = props.getProperty("store.token", "").trim();
        config.storeOrg = props.getProperty("store.org", "").trim();
        config.storeBucket = props.getProperty("store.bucket", "").trim();
        config.storeConnectTimeoutMs = Long.parseLong(
                props.getProperty("store.connect.timeout.ms", "5000"));
        config.storeRequestTimeoutMs = Long.parseLong(
                props.getProperty("store.request.timeout.ms", "30000"));
        config.sqliteTimeWindowMs = Long.parseLong(
                props.getProperty("store.sqlite.time.window.ms", String.valueOf(24 * 60 * 60 * 1000L)));

        config.sensorLocation = props.getProperty("sensor.location", "Fabrica");

        config.generatorSamples = Integer.parseInt(
                props.getProperty("generator.samples", "100"));
        config.generatorIntervalSeconds = Long.parseLong(
                props.getProperty("generator.interval.seconds", "60"));
        config.temperatureBaseline = Double.parseDouble(
                props.getProperty("generator.temperature.baseline", "23.0"));
        config.temperatureSpread = Double.parseDouble(
                props.getProperty("generator.temperature.spread", "1.0"));
        config.temperatureAnomalySpread = Double.parseDouble(
                props.getProperty("generator.temperature.anomaly.spread", "5.0"));
        config.humidityBaseline = Double.parseDouble(
                props.getProperty("generator.humidity.baseline", "60.0"));
        config.humiditySpread = Double.parseDouble(
                props.getProperty("generator.humidity.spread", "2.0"));
        config.humidityAnomalySpread = Double.parseDouble(
                props.getProperty("generator.humidity.anomaly.spread", "10.0"));
        config.generatorAnomalyCount = Integer.parseInt(
                props.getProperty("generator.anomaly.count", "5"));

        config.detectorContamination = Double.parseDouble(
                props.getProperty("detector.contamination", "0.1"));
        config.detectorTrees = Integer.parseInt(
                props.getProperty("detector.trees", "100"));
        config.detectorMaxSamples = Integer.parseInt(
                props.getProperty("detector.max.samples", "256"));
        config.detectorSeed = Long.parseLong(
                props.getProperty("detector.seed", "42"));
        config.detectorStandardize = Boolean.parseBoolean(
                props.getProperty("detector.standardize", "false").trim());

        config.lookbackHours = Integer.parseInt(
                props.getProperty("pipeline.lookback.hours", "1"));

        config.kafkaBootstrapServers = props.getProperty(
                "kafka.bootstrap.servers", "localhost:9092");
        config.kafkaInputTopic = props.getProperty(
                "kafka.input.topic", "sensor-readings");
        config.kafkaGroupId = props.getProperty(
                "kafka.group.id", "anomaly-ingest");

        return config;
    }

    public StoreConfig toStoreConfig() {
        return new StoreConfig(storeEndpoint, storeToken, storeOrg, storeBucket);
    }

    /** 检测器参数表，键名与检测器元数据中的参数定义一致 */
    public Map<String, Object> toDetectorParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("contamination", detectorContamination);
        params.put("numTrees", detectorTrees);
        params.put("maxSamples", detectorMaxSamples);
        params.put("seed", detectorSeed);
        params.put("standardize", detectorStandardize);
        return params;
    }

    // ---- Getters ----
    public long getStoreConnectTimeoutMs() { return storeConnectTimeoutMs; }
    public long getStoreRequestTimeoutMs() { return storeRequestTimeoutMs; }
    public long getSqliteTimeWindowMs() { return sqliteTimeWindowMs; }
    public String getSensorLocation() { return sensorLocation; }
    public int getGeneratorSamples() { return generatorSamples; }
    public long getGeneratorIntervalSeconds() { return generatorIntervalSeconds; }
    public double getTemperatureBaseline() { return temperatureBaseline; }
    public double getTemperatureSpread() { return temperatureSpread; }
    public double getTemperatureAnomalySpread() { return temperatureAnomalySpread; }
    public double getHumidityBaseline() { return humidityBaseline; }
    public double getHumiditySpread() { return humiditySpread; }
    public double getHumidityAnomalySpread() { return humidityAnomalySpread; }
    public int getGeneratorAnomalyCount() { return generatorAnomalyCount; }
    public int getLookbackHours() { return lookbackHours; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaInputTopic() { return kafkaInputTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "AppConfig{store=" + toStoreConfig()
                + ", location='" + sensorLocation + "'"
                + ", samples=" + generatorSamples
                + ", contamination=" + detectorContamination
                + ", lookback=" + lookbackHours + "h"
                + ", kafka='" + kafkaBootstrapServers + "'}";
    }
}
