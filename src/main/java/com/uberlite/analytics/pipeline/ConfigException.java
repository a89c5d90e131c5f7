package com.uberlite.analytics.pipeline;

/**
 * Invalid configuration value.
 */
public class ConfigException extends FatalPipelineException {

    private final String key;

    public ConfigException(String key, String message) {
        super("Invalid configuration '" + key + "': " + message);
        this.key = key;
    }

    public ConfigException(String key, String message, Throwable cause) {
        super("Invalid configuration '" + key + "': " + message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
