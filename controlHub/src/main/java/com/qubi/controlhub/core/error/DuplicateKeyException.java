package com.qubi.controlhub.core.error;

public class DuplicateKeyException extends ControlHubException {
    private final String key;

    public DuplicateKeyException(String key, String container) {
        super("Duplicate key " + key + " in " + container);
        this.key = key;
    }

    public String key() { return key; }
}
