package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"component", "statements"})
public record ComponentStatements(
        @JsonProperty("component") String component,
        @JsonProperty("statements") List<Provenance> statements
) {
    public ComponentStatements {
        statements = List.copyOf(statements);
    }
}
