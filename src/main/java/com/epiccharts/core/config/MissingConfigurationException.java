package com.epiccharts.core.config;

import java.util.List;

/**
 * Thrown at startup when one or more required settings are absent.
 */
public class MissingConfigurationException extends RuntimeException {

    private final List<String> missing;

    public MissingConfigurationException(List<String> missing) {
        super("Missing required environment variables: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
