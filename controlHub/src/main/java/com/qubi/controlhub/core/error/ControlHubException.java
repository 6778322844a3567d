package com.qubi.controlhub.core.error;

/**
 * Base de todas las fallas del pipeline de statements.
 */
public class ControlHubException extends RuntimeException {
    public ControlHubException() {
    }

    public ControlHubException(String message) {
        super(message);
    }

    public ControlHubException(String message, Throwable cause) {
        super(message, cause);
    }

    public ControlHubException(Throwable cause) {
        super(cause);
    }
}
