package com.qubi.controlhub.core.error;

/**
 * A un artefacto de reconocimiento le falta algo que la combinación necesita. La combinación se aborta entera.
 */
public class InvalidArtifactException extends ControlHubException {
    public InvalidArtifactException(String message) {
        super(message);
    }

    public InvalidArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
