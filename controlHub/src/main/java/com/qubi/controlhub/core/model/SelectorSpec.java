package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Grupos con nombre de controles deseados por catálogo: {@code selectors.<selector>.<catalog> = [control, ...]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SelectorSpec(
        @JsonProperty("selectors") Map<String, Map<String, List<String>>> selectors
) {
    public SelectorSpec {
        Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
        if (selectors != null) {
            selectors.forEach((selector, catalogs) -> {
                Map<String, List<String>> cats = new LinkedHashMap<>();
                if (catalogs != null) {
                    catalogs.forEach((catalog, controls) ->
                            cats.put(catalog, controls == null ? List.of() : List.copyOf(controls)));
                }
                copy.put(selector, Collections.unmodifiableMap(cats));
            });
        }
        selectors = Collections.unmodifiableMap(copy);
    }

    /** Controles deseados de un par; vacío si el par no está definido. */
    public Set<String> desired(String selector, String catalog) {
        Map<String, List<String>> catalogs = selectors.get(selector);
        if (catalogs == null) return Set.of();
        List<String> controls = catalogs.get(catalog);
        return controls == null ? Set.of() : new LinkedHashSet<>(controls);
    }
}
