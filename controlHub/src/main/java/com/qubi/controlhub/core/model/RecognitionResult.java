package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statements de un documento agrupados por el componente al que se atribuyeron.
 * Los componentes quedan en el orden en que aparecieron por primera vez.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"metadata", "components"})
public record RecognitionResult(
        @JsonProperty("metadata") RecognitionMetadata metadata,
        @JsonProperty("components") Map<String, List<ControlStatement>> components
) {
    public RecognitionResult {
        Map<String, List<ControlStatement>> copy = new LinkedHashMap<>();
        if (components != null) {
            components.forEach((name, statements) ->
                    copy.put(name, statements == null ? List.of() : List.copyOf(statements)));
        }
        components = Collections.unmodifiableMap(copy);
    }
}
