package com.qubi.controlhub.core.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Patrones de frase para un reconocedor de diccionario: cada nombre canónico y cada alias,
 * todos con el nombre canónico como id.
 */
public final class ComponentPatterns {

    @JsonPropertyOrder({"label", "pattern", "id"})
    public record ComponentPattern(
            @JsonProperty("label") String label,
            @JsonProperty("pattern") String pattern,
            @JsonProperty("id") String id
    ) {}

    private ComponentPatterns() {}

    public static List<ComponentPattern> of(ComponentSpec spec, String entityLabel) {
        List<ComponentPattern> patterns = new ArrayList<>();
        if (spec == null || spec.components == null) return patterns;
        for (String name : spec.components.keySet()) {
            patterns.add(new ComponentPattern(entityLabel, name, name));
            for (String aka : spec.aliases(name)) {
                patterns.add(new ComponentPattern(entityLabel, aka, name));
            }
        }
        return patterns;
    }
}
