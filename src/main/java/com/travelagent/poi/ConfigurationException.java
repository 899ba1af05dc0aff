package com.travelagent.poi;

import java.util.Collection;

/** Thrown when configuration properties are missing or cannot be parsed. Lists every offending key at once. */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException forKeys (Collection<String> keys) {
        return new ConfigurationException("Missing or invalid configuration properties: " + String.join(", ", keys));
    }

}
