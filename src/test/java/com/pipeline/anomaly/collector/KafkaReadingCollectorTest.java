package com.pipeline.anomaly.collector;

import com.pipeline.anomaly.core.AnomalyPipeline;
import com.pipeline.anomaly.exception.PartialWriteException;
import com.pipeline.anomaly.model.Reading;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KafkaReadingCollectorTest {

    private static final String TOPIC = "sensor-readings";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private MockConsumer<String, String> consumer;
    private AnomalyPipeline pipeline;
    private KafkaReadingCollector collector;
    private long offset;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        pipeline = mock(AnomalyPipeline.class);
        collector = new KafkaReadingCollector(consumer, TOPIC, pipeline);
    }

    private void assignAndSend(String... values) {
        consumer.assign(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        for (String value : values) {
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset++, null, value));
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void groupsRecordsByLocationAndSkipsMalformed() {
        assignAndSend(
                "{\"location\":\"Fabrica\",\"timestamp\":1772366400000,\"temperature\":23.4,\"humidity\":61.2}",
                "{\"location\":\"Lab\",\"timestamp\":\"2026-03-01T12:00:01Z\",\"temperature\":19.0,\"humidity\":45.0}",
                "not json",
                "{\"location\":\"Fabrica\",\"timestamp\":1772366402000,\"temperature\":23.5,\"humidity\":61.0}");

        int ingested = collector.pollOnce(Duration.ofMillis(10));

        assertEquals(3, ingested);
        ArgumentCaptor<List<Reading>> fabrica = ArgumentCaptor.forClass(List.class);
        verify(pipeline).ingest(eq("Fabrica"), fabrica.capture());
        assertEquals(2, fabrica.getValue().size());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), fabrica.getValue().get(0).getTimestamp());
        verify(pipeline).ingest(eq("Lab"), anyList());
        verifyNoMoreInteractions(pipeline);
    }

    @Test
    void storeFailureForOneLocationDoesNotStopOthers() {
        doThrow(new PartialWriteException(0, Instant.EPOCH, 0, new RuntimeException("down")))
                .when(pipeline).ingest(eq("Fabrica"), anyList());
        assignAndSend(
                "{\"location\":\"Fabrica\",\"timestamp\":1772366400000,\"temperature\":23.4,\"humidity\":61.2}",
                "{\"location\":\"Lab\",\"timestamp\":1772366400000,\"temperature\":19.0,\"humidity\":45.0}");

        assertEquals(1, collector.pollOnce(Duration.ofMillis(10)));
        verify(pipeline).ingest(eq("Lab"), anyList());
    }

    @Test
    void unexpectedFailureForOneLocationKeepsCollecting() {
        doThrow(new ArithmeticException("long overflow"))
                .when(pipeline).ingest(eq("Bad"), anyList());
        assignAndSend(
                "{\"location\":\"Bad\",\"timestamp\":100000000000000000,\"temperature\":23.4,\"humidity\":61.2}",
                "{\"location\":\"Good\",\"timestamp\":1772366400000,\"temperature\":19.0,\"humidity\":45.0}");

        assertEquals(1, collector.pollOnce(Duration.ofMillis(10)));
        verify(pipeline).ingest(eq("Good"), anyList());

        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset++, null,
                "{\"location\":\"Good\",\"timestamp\":1772366460000,\"temperature\":19.1,\"humidity\":45.1}"));
        assertEquals(1, collector.pollOnce(Duration.ofMillis(10)));
        verify(pipeline, times(2)).ingest(eq("Good"), anyList());
    }

    @Test
    void emptyPollIngestsNothing() {
        assignAndSend();

        assertEquals(0, collector.pollOnce(Duration.ofMillis(10)));
        verifyNoInteractions(pipeline);
    }

    @Test
    void parsesEpochMillisAndIsoTimestamps() {
        Reading millis = collector.parseReading(
                "{\"location\":\"Fabrica\",\"timestamp\":1772366400000,\"temperature\":23,\"humidity\":60.5}");
        Reading iso = collector.parseReading(
                "{\"location\":\"Fabrica\",\"timestamp\":\"2026-03-01T12:00:00Z\",\"temperature\":23,\"humidity\":60.5}");

        assertEquals(millis, iso);
        assertEquals(23.0, millis.getTemperature());
    }

    @Test
    void rejectsIncompleteMessages() {
        assertThrows(IllegalArgumentException.class, () -> collector.parseReading(
                "{\"timestamp\":1772366400000,\"temperature\":23,\"humidity\":60}"));
        assertThrows(IllegalArgumentException.class, () -> collector.parseReading(
                "{\"location\":\"Fabrica\",\"temperature\":23,\"humidity\":60}"));
        assertThrows(IllegalArgumentException.class, () -> collector.parseReading(
                "{\"location\":\"Fabrica\",\"timestamp\":1772366400000,\"temperature\":\"hot\",\"humidity\":60}"));
        assertThrows(IllegalArgumentException.class, () -> collector.parseReading("[1,2,3]"));
        assertThrows(IllegalArgumentException.class, () -> collector.parseReading(null));
    }

    @Test
    void stopEndsPollingLoopAndClosesConsumer() throws InterruptedException {
        collector.start();
        assertTrue(collector.isRunning());

        collector.stop();

        assertFalse(collector.isRunning());
        long deadline = System.currentTimeMillis() + 5000;
        while (!consumer.closed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(consumer.closed());
    }
}
