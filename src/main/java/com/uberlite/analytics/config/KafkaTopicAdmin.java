package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.FatalPipelineException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Creates the ride-event input topic and the compacted analytics output topic
 * when they are missing.
 */
public class KafkaTopicAdmin {

    private static final Logger log = LoggerFactory.getLogger(KafkaTopicAdmin.class);
    public static final short REPLICATION_FACTOR = 1; // Single broker for local dev

    public static void ensureTopics(KafkaSettings kafka) {
        var props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.bootstrapServers());
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, "10000");

        try (var admin = AdminClient.create(props)) {
            ensureTopics(admin, kafka);
        }
    }

    static void ensureTopics(Admin admin, KafkaSettings kafka) {
        try {
            Set<String> existing = admin.listTopics().names().get(15, TimeUnit.SECONDS);
            var toCreate = new ArrayList<NewTopic>();

            if (!existing.contains(kafka.inputTopic())) {
                toCreate.add(new NewTopic(kafka.inputTopic(), kafka.partitions(), REPLICATION_FACTOR));
            }
            if (!existing.contains(kafka.outputTopic())) {
                // Rows are upserts keyed by window: keep only the latest per key
                var output = new NewTopic(kafka.outputTopic(), kafka.partitions(), REPLICATION_FACTOR);
                output.configs(Map.of(TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_COMPACT));
                toCreate.add(output);
            }

            if (toCreate.isEmpty()) {
                log.info("Topics '{}' and '{}' already exist", kafka.inputTopic(), kafka.outputTopic());
                return;
            }
            admin.createTopics(toCreate).all().get(15, TimeUnit.SECONDS);
            for (NewTopic topic : toCreate) {
                log.info("Created topic '{}' with {} partitions", topic.name(), topic.numPartitions());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalPipelineException("Interrupted while creating Kafka topics", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new FatalPipelineException("Failed to create Kafka topics", e);
        }
    }
}
