package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Cómo se implementa un control, según un documento fuente. Al salir de un lector el control
 * viene como se extrajo ({@code RA-3}); en los artefactos va con su clave canónica ({@code ra-3}).
 */
@JsonPropertyOrder({"control", "text"})
public record ControlStatement(
        @JsonProperty("control") String control,
        @JsonProperty("text") String text
) {
    public ControlStatement {
        Objects.requireNonNull(control, "control");
        Objects.requireNonNull(text, "text");
    }
}
