package com.uberlite.analytics.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uberlite.analytics.config.KafkaSettings;
import com.uberlite.analytics.model.OutputRow;
import com.uberlite.analytics.pipeline.FatalPipelineException;
import com.uberlite.analytics.pipeline.TransientIOException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Publishes rows as JSON to the analytics topic, keyed by window key so the
 * compacted topic keeps the latest row per (cell, window).
 *
 * A write sends the whole batch asynchronously, flushes, then waits on every
 * future; any failed send fails the write and the caller retries all of it.
 */
public class KafkaRowSink implements RowSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaRowSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Producer<String, byte[]> producer;
    private final String topic;

    public KafkaRowSink(Producer<String, byte[]> producer, String topic) {
        this.producer = producer;
        this.topic    = topic;
    }

    public static KafkaRowSink create(KafkaSettings settings) {
        return new KafkaRowSink(new KafkaProducer<>(producerConfig(settings)), settings.outputTopic());
    }

    @Override
    public void write(List<OutputRow> rows) throws TransientIOException {
        if (rows.isEmpty()) return;
        var futures = new ArrayList<Future<RecordMetadata>>(rows.size());
        try {
            for (OutputRow row : rows) {
                futures.add(producer.send(new ProducerRecord<>(topic, row.windowKey().asKey(), serialize(row))));
            }
            producer.flush();
            for (Future<RecordMetadata> f : futures) {
                f.get();
            }
        } catch (ExecutionException e) {
            throw new TransientIOException("send to " + topic + " failed", e.getCause());
        } catch (KafkaException e) {
            throw new TransientIOException("send to " + topic + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalPipelineException("Interrupted while writing to " + topic, e);
        }
        log.debug("Wrote {} rows to {}", rows.size(), topic);
    }

    @Override
    public String name() {
        return "kafka:" + topic;
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(5));
    }

    static byte[] serialize(OutputRow row) {
        try {
            return MAPPER.writeValueAsBytes(row);
        } catch (JsonProcessingException e) {
            throw new FatalPipelineException("Failed to serialize row " + row.windowKey().asKey(), e);
        }
    }

    static Properties producerConfig(KafkaSettings settings) {
        var props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,      settings.bootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,   StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        // Idempotent producer: broker-side retries cannot duplicate or reorder rows
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG,     true);
        props.put(ProducerConfig.ACKS_CONFIG,                   "all");
        props.put(ProducerConfig.LINGER_MS_CONFIG,              5);
        props.put(ProducerConfig.BATCH_SIZE_CONFIG,             65_536);
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG,       "lz4");
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,    30_000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG,     10_000);
        return props;
    }
}
