package dev.epwbatch.error;

import java.util.List;

public class ConfigurationException extends EpwBatchException {
    private final List<String> invalidKeys;

    public ConfigurationException(String message) {
        this(message, null, List.of(), null);
    }

    public ConfigurationException(String message, String configFile, Throwable cause) {
        this(message, configFile, List.of(), cause);
    }

    public ConfigurationException(String message, String configFile, List<String> invalidKeys, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message,
                context("config_file", configFile, "invalid_keys", invalidKeys.isEmpty() ? null : invalidKeys),
                cause);
        this.invalidKeys = List.copyOf(invalidKeys);
    }

    public List<String> getInvalidKeys() {
        return invalidKeys;
    }
}
