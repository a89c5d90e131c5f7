package com.uberlite.analytics.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uberlite.analytics.config.KafkaSettings;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.model.RawEvent;
import com.uberlite.analytics.pipeline.FatalPipelineException;
import com.uberlite.analytics.pipeline.TransientIOException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Consumes JSON ride events from the input topic.
 *
 * Auto-commit is off: offsets only move when the pipeline calls {@link #commit()}
 * after the batch's rows reached every sink. Payloads that do not decode are
 * counted and skipped, a poison record must not stall the partition.
 */
public class KafkaEventSource implements EventSource {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Consumer<String, byte[]> consumer;
    private final PipelineMetrics metrics;

    public KafkaEventSource(Consumer<String, byte[]> consumer, String topic, PipelineMetrics metrics) {
        this.consumer = consumer;
        this.metrics  = metrics;
        consumer.subscribe(List.of(topic));
        log.info("Subscribed to topic {}", topic);
    }

    public static KafkaEventSource create(KafkaSettings settings, PipelineMetrics metrics) {
        return new KafkaEventSource(new KafkaConsumer<>(consumerConfig(settings)), settings.inputTopic(), metrics);
    }

    @Override
    public List<RawEvent> poll(Duration timeout) throws TransientIOException {
        ConsumerRecords<String, byte[]> records;
        try {
            records = consumer.poll(timeout);
        } catch (WakeupException e) {
            return List.of();
        } catch (RetriableException e) {
            throw new TransientIOException("poll failed", e);
        } catch (KafkaException e) {
            throw new FatalPipelineException("Kafka consumer failed: " + e.getMessage(), e);
        }

        var events = new ArrayList<RawEvent>(records.count());
        for (ConsumerRecord<String, byte[]> record : records) {
            var event = decode(record);
            if (event != null) events.add(event);
        }
        return events;
    }

    @Override
    public void commit() throws TransientIOException {
        try {
            consumer.commitSync();
        } catch (RetriableException e) {
            throw new TransientIOException("offset commit failed", e);
        } catch (KafkaException e) {
            throw new FatalPipelineException("Offset commit failed: " + e.getMessage(), e);
        }
    }

    /** Interrupts a blocking poll from another thread; the poll returns an empty batch. */
    public void wakeup() {
        consumer.wakeup();
    }

    @Override
    public void close() {
        consumer.close(Duration.ofSeconds(5));
        log.info("Kafka event source closed");
    }

    private RawEvent decode(ConsumerRecord<String, byte[]> record) {
        if (record.value() == null) {
            metrics.recordDecodeFailure();
            return null;
        }
        try {
            return MAPPER.readValue(record.value(), RawEvent.class);
        } catch (IOException e) {
            metrics.recordDecodeFailure();
            log.debug("Undecodable payload at {}-{}@{}: {}",
                      record.topic(), record.partition(), record.offset(), e.getMessage());
            return null;
        }
    }

    static Properties consumerConfig(KafkaSettings settings) {
        var props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,        settings.bootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG,                 settings.groupId());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,   StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG,       false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,        "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG,         5_000);
        props.put(ConsumerConfig.FETCH_MIN_BYTES_CONFIG,          1_024);
        props.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG,        200);
        return props;
    }
}
