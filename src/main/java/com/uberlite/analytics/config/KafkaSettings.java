package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;

public record KafkaSettings(
    String bootstrapServers,
    String inputTopic,
    String outputTopic,
    String groupId,
    int    partitions
) {
    public KafkaSettings {
        requireText("kafka.bootstrap-servers", bootstrapServers);
        requireText("kafka.input-topic", inputTopic);
        requireText("kafka.output-topic", outputTopic);
        requireText("kafka.group-id", groupId);
        if (partitions < 1) {
            throw new ConfigException("kafka.partitions", "must be at least 1, got " + partitions);
        }
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(key, "must not be blank");
        }
    }
}
