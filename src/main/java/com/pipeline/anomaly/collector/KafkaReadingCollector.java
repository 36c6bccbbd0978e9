package com.pipeline.anomaly.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.anomaly.core.AnomalyPipeline;
import com.pipeline.anomaly.exception.StoreException;
import com.pipeline.anomaly.model.Reading;
import org.apache.kafka.clients.consumer.*;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka实时读数采集消费者。
 * 从Kafka Topic消费现场传感器推送的读数，按位置分组后经管道写入时序存储，
 * 作为样例生成器之外的实时数据源。
 *
 * 消息格式约定（JSON）：
 * {"location":"Fabrica","timestamp":1708128000000,"temperature":23.4,"humidity":61.2}
 * timestamp 可为毫秒时间戳或 ISO-8601 字符串。
 */
public class KafkaReadingCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KafkaReadingCollector.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

    private final String bootstrapServers;
    private final String topic;
    private final String groupId;
    private final AnomalyPipeline pipeline;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Consumer<String, String> consumer;

    public KafkaReadingCollector(String bootstrapServers, String topic, String groupId, AnomalyPipeline pipeline) {
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
        this.groupId = groupId;
        this.pipeline = pipeline;
    }

    KafkaReadingCollector(Consumer<String, String> consumer, String topic, AnomalyPipeline pipeline) {
        this(null, topic, null, pipeline);
        this.consumer = consumer;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaReadingCollector is already running.");
            return;
        }

        if (consumer == null) {
            Properties props = new Properties();
            props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
            props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
            props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
            props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
            props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
            props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1000");
            consumer = new KafkaConsumer<>(props);
        }
        consumer.subscribe(Collections.singletonList(topic));

        Thread collectorThread = new Thread(this, "kafka-reading-collector");
        collectorThread.setDaemon(true);
        collectorThread.start();

        log.info("KafkaReadingCollector started. Topic: {}, Group: {}", topic, groupId);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                pollOnce(POLL_TIMEOUT);
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } catch (Exception e) {
            log.error("KafkaReadingCollector encountered fatal error", e);
        } finally {
            consumer.close();
            log.info("KafkaReadingCollector stopped.");
        }
    }

    /**
     * 拉取一批消息并写入存储。
     *
     * @return 成功写入的读数条数
     */
    int pollOnce(Duration timeout) {
        ConsumerRecords<String, String> records = consumer.poll(timeout);
        if (records.isEmpty()) {
            return 0;
        }

        // 按位置分组，保持到达顺序
        Map<String, List<Reading>> byLocation = new LinkedHashMap<>();
        for (ConsumerRecord<String, String> record : records) {
            try {
                Reading reading = parseReading(record.value());
                byLocation.computeIfAbsent(reading.getLocation(), k -> new ArrayList<>()).add(reading);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed record at offset {}: {}", record.offset(), e.getMessage());
            }
        }

        int ingested = 0;
        for (Map.Entry<String, List<Reading>> entry : byLocation.entrySet()) {
            try {
                pipeline.ingest(entry.getKey(), entry.getValue());
                ingested += entry.getValue().size();
            } catch (StoreException e) {
                log.error("Failed to ingest {} reading(s) for '{}': {}",
                        entry.getValue().size(), entry.getKey(), e.getMessage(), e);
            } catch (RuntimeException e) {
                // 单个位置的异常不影响同批其他位置，也不终止消费循环
                log.error("Unexpected error ingesting {} reading(s) for '{}'",
                        entry.getValue().size(), entry.getKey(), e);
            }
        }
        return ingested;
    }

    Reading parseReading(String json) {
        if (json == null) {
            throw new IllegalArgumentException("empty message");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }

        String location = node.path("location").asText("");
        if (location.isBlank()) {
            throw new IllegalArgumentException("missing 'location'");
        }
        JsonNode temperature = node.path("temperature");
        JsonNode humidity = node.path("humidity");
        if (!temperature.isNumber() || !humidity.isNumber()) {
            throw new IllegalArgumentException("'temperature' and 'humidity' must be numbers");
        }

        return new Reading(parseTimestamp(node.path("timestamp")), location,
                temperature.asDouble(), humidity.asDouble());
    }

    private static Instant parseTimestamp(JsonNode timestamp) {
        if (timestamp.isIntegralNumber()) {
            return Instant.ofEpochMilli(timestamp.asLong());
        }
        if (timestamp.isTextual()) {
            try {
                return Instant.parse(timestamp.asText());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid 'timestamp': " + timestamp.asText(), e);
            }
        }
        throw new IllegalArgumentException("missing 'timestamp'");
    }

    public void stop() {
        running.set(false);
        if (consumer != null) {
            consumer.wakeup();
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
