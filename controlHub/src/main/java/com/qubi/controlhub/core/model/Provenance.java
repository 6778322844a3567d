package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Texto de un statement junto con el documento del que salió.
 */
@JsonPropertyOrder({"source", "text"})
public record Provenance(
        @JsonProperty("source") String source,
        @JsonProperty("text") String text
) {}
