package com.qubi.controlhub.core.error;

public class ConfigurationException extends ControlHubException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
