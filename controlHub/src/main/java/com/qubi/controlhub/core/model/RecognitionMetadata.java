package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Cabecera de un artefacto de reconocimiento. Para combinar sólo hacen falta {@code source} y {@code catalog}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"source", "catalog", "remarks", "created", "command"})
public record RecognitionMetadata(
        @JsonProperty("source") String source,
        @JsonProperty("catalog") String catalog,
        @JsonProperty("remarks") String remarks,
        @JsonProperty("created") OffsetDateTime created,   // UTC, al segundo
        @JsonProperty("command") String command
) {
    public static RecognitionMetadata create(String source, String catalog, String remarks, String command, Clock clock) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return new RecognitionMetadata(source, catalog, remarks == null ? "" : remarks,
                now.atOffset(ZoneOffset.UTC), command == null ? "" : command);
    }
}
