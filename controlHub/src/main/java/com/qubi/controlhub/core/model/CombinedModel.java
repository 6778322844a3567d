package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qubi.controlhub.core.error.ControlHubException;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;

import java.util.*;

/**
 * Statements de muchos documentos, por componente → catálogo → control.
 *
 * <p>Cada nivel conserva el orden de inserción. Las consultas nunca crean entradas; sólo
 * {@link #ensureControl(String, String, String)} lo hace, y guarda el control con su clave
 * canónica ({@link ControlIdNormalizer#canonicalKey}).
 */
@JsonPropertyOrder({"metadata", "components"})
public final class CombinedModel {
    private final List<RecognitionMetadata> metadata;
    private final Map<String, Map<String, Map<String, List<Provenance>>>> components;

    public CombinedModel() {
        this.metadata = new ArrayList<>();
        this.components = new LinkedHashMap<>();
    }

    @JsonCreator
    CombinedModel(
            @JsonProperty("metadata") List<RecognitionMetadata> metadata,
            @JsonProperty("components") Map<String, Map<String, Map<String, List<Provenance>>>> components
    ) {
        this();
        if (metadata != null) this.metadata.addAll(metadata);
        if (components != null) {
            components.forEach((component, catalogs) ->
                    catalogs.forEach((catalog, controls) ->
                            controls.forEach((control, entries) ->
                                    ensureControl(component, catalog, control).addAll(entries))));
        }
    }

    @JsonProperty("metadata")
    public List<RecognitionMetadata> metadata() {
        return Collections.unmodifiableList(metadata);
    }

    @JsonProperty("components")
    public Map<String, Map<String, Map<String, List<Provenance>>>> components() {
        return Collections.unmodifiableMap(components);
    }

    public void addMetadata(RecognitionMetadata m) {
        metadata.add(Objects.requireNonNull(m, "metadata"));
    }

    /** Lista de procedencias del camino; crea los niveles que falten. */
    public List<Provenance> ensureControl(String component, String catalog, String control) {
        return components
                .computeIfAbsent(component, k -> new LinkedHashMap<>())
                .computeIfAbsent(catalog, k -> new LinkedHashMap<>())
                .computeIfAbsent(ControlIdNormalizer.canonicalKey(control), k -> new ArrayList<>());
    }

    public Set<String> componentNames() {
        return Collections.unmodifiableSet(components.keySet());
    }

    public Set<String> catalogs(String component) {
        Map<String, Map<String, List<Provenance>>> catalogs = components.get(component);
        return catalogs == null ? Set.of() : Collections.unmodifiableSet(catalogs.keySet());
    }

    /** Controles de un componente en un catálogo; vacío si falta cualquiera de los dos. */
    public Map<String, List<Provenance>> controls(String component, String catalog) {
        Map<String, Map<String, List<Provenance>>> catalogs = components.get(component);
        if (catalogs == null) return Map.of();
        Map<String, List<Provenance>> controls = catalogs.get(catalog);
        return controls == null ? Map.of() : Collections.unmodifiableMap(controls);
    }

    /** Copia con la misma metadata y sólo los componentes nombrados, en el orden dado. */
    public CombinedModel restrictTo(Collection<String> names) {
        CombinedModel out = new CombinedModel();
        out.metadata.addAll(metadata);
        for (String name : names) {
            Map<String, Map<String, List<Provenance>>> catalogs = components.get(name);
            if (catalogs == null) throw new ControlHubException("Unknown component: " + name);
            catalogs.forEach((catalog, controls) ->
                    controls.forEach((control, entries) ->
                            out.ensureControl(name, catalog, control).addAll(entries)));
        }
        return out;
    }
}
