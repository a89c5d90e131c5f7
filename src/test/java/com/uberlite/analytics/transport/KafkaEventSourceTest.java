package com.uberlite.analytics.transport;

import com.uberlite.analytics.config.KafkaSettings;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.pipeline.FatalPipelineException;
import com.uberlite.analytics.pipeline.TransientIOException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KafkaEventSourceTest {

    private static final String TOPIC = "ride-events";
    private static final TopicPartition TP = new TopicPartition(TOPIC, 0);

    private MockConsumer<String, byte[]> consumer;
    private PipelineMetrics metrics;
    private KafkaEventSource source;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        metrics  = new PipelineMetrics();
        source   = new KafkaEventSource(consumer, TOPIC, metrics);
        consumer.rebalance(List.of(TP));
        consumer.updateBeginningOffsets(Map.of(TP, 0L));
    }

    private void addRecord(long offset, String json) {
        byte[] value = json == null ? null : json.getBytes(StandardCharsets.UTF_8);
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, "key", value));
    }

    @Test
    void poll_decodesSnakeCaseJsonAndIgnoresUnknownFields() throws Exception {
        addRecord(0, """
            {"event_id":"e1","ride_id":"r1","driver_id":"d1","timestamp":"1700000000000",
             "pickup_lat":40.75,"pickup_lon":-73.98,"fare":23.5,"status":"COMPLETED",
             "surge_multiplier":1.4}
            """);

        var events = source.poll(Duration.ofMillis(10));

        assertEquals(1, events.size());
        var e = events.get(0);
        assertEquals("e1", e.eventId());
        assertEquals("1700000000000", e.timestamp());
        assertEquals(40.75, e.pickupLat());
        assertEquals(0, new BigDecimal("23.5").compareTo(e.fare()));
        assertNull(e.dropoffLat());
    }

    @Test
    void undecodablePayloads_areCountedAndSkipped() throws Exception {
        addRecord(0, "{not json");
        addRecord(1, null);
        addRecord(2, "{\"event_id\":\"e2\",\"timestamp\":1000}");

        var events = source.poll(Duration.ofMillis(10));

        assertEquals(1, events.size());
        assertEquals("1000", events.get(0).timestamp());
        assertEquals(2, metrics.getDecodeFailures());
    }

    @Test
    void commit_storesPositionAfterPolledRecords() throws Exception {
        addRecord(0, "{\"event_id\":\"e1\"}");
        addRecord(1, "{\"event_id\":\"e2\"}");
        source.poll(Duration.ofMillis(10));

        source.commit();

        assertEquals(2L, consumer.committed(Set.of(TP)).get(TP).offset());
    }

    @Test
    void retriableKafkaError_isTransient() {
        consumer.setPollException(new TimeoutException("fetch timed out"));
        assertThrows(TransientIOException.class, () -> source.poll(Duration.ofMillis(10)));
    }

    @Test
    void nonRetriableKafkaError_isFatal() {
        consumer.setPollException(new KafkaException("unknown topic"));
        assertThrows(FatalPipelineException.class, () -> source.poll(Duration.ofMillis(10)));
    }

    @Test
    void wakeup_returnsEmptyBatch() throws Exception {
        source.wakeup();
        assertTrue(source.poll(Duration.ofMillis(10)).isEmpty());
    }

    @Test
    void consumerConfig_disablesAutoCommit() {
        var props = KafkaEventSource.consumerConfig(new KafkaSettings(
            "broker:9092", TOPIC, "out", "group", 3));
        assertEquals(false, props.get("enable.auto.commit"));
        assertEquals("earliest", props.get("auto.offset.reset"));
        assertEquals("group", props.get("group.id"));
    }
}
