package com.qubi.controlhub.core.assemble;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qubi.controlhub.core.error.DuplicateKeyException;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * Árbol de definición de componentes que se entrega al generador de documentos. Componentes por uuid,
 * statements por id de statement; agregar cualquiera dos veces es un error.
 */
@JsonPropertyOrder({"uuid", "metadata", "components"})
public final class ComponentDefinition {
    private final UUID uuid;
    private final Metadata metadata;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final Map<String, Component> components = new LinkedHashMap<>();

    public ComponentDefinition(UUID uuid, Metadata metadata) {
        this.uuid = uuid;
        this.metadata = metadata;
    }

    public ComponentDefinition addComponent(Component component) {
        String key = component.uuid.toString();
        if (components.containsKey(key)) {
            throw new DuplicateKeyException(key + " (" + component.title + ")", "component definition " + metadata.title);
        }
        components.put(key, component);
        return this;
    }

    public UUID uuid() { return uuid; }
    public Metadata metadata() { return metadata; }
    public Map<String, Component> components() { return Collections.unmodifiableMap(components); }

    /** Envuelve la definición como la espera el formato de documento en el nivel superior. */
    public Map<String, ComponentDefinition> asDocument() {
        return Map.of("component-definition", this);
    }

    @JsonPropertyOrder({"title", "version", "oscal-version", "published", "last-modified"})
    public record Metadata(
            @JsonProperty("title") String title,
            @JsonProperty("version") String version,
            @JsonProperty("oscal-version") String oscalVersion,
            @JsonProperty("published") OffsetDateTime published,
            @JsonProperty("last-modified") OffsetDateTime lastModified
    ) {}

    @JsonPropertyOrder({"uuid", "title", "type", "description", "control-implementations"})
    public static final class Component {
        private final UUID uuid;
        private final String title;
        private final String type = "software";
        private final String description;
        @JsonProperty("control-implementations")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final List<ControlImplementation> controlImplementations = new ArrayList<>();

        public Component(UUID uuid, String title, String description) {
            this.uuid = uuid;
            this.title = title;
            this.description = description;
        }

        public Component add(ControlImplementation implementation) {
            controlImplementations.add(implementation);
            return this;
        }

        public UUID uuid() { return uuid; }
        public String title() { return title; }
        public List<ControlImplementation> controlImplementations() { return Collections.unmodifiableList(controlImplementations); }
    }

    @JsonPropertyOrder({"uuid", "source", "description", "implemented-requirements"})
    public static final class ControlImplementation {
        private final UUID uuid;
        private final String source;
        private final String description;
        @JsonProperty("implemented-requirements")
        private final List<ImplementedRequirement> implementedRequirements = new ArrayList<>();

        public ControlImplementation(UUID uuid, String source, String description) {
            this.uuid = uuid;
            this.source = source;
            this.description = description;
        }

        public ControlImplementation add(ImplementedRequirement requirement) {
            implementedRequirements.add(requirement);
            return this;
        }

        public String source() { return source; }
        public List<ImplementedRequirement> implementedRequirements() { return Collections.unmodifiableList(implementedRequirements); }
    }

    @JsonPropertyOrder({"uuid", "control-id", "description", "remarks", "statements"})
    public static final class ImplementedRequirement {
        private final UUID uuid;
        @JsonProperty("control-id")
        private final String controlId;
        private final String description;
        private final String remarks;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final Map<String, Statement> statements = new LinkedHashMap<>();

        public ImplementedRequirement(UUID uuid, String controlId, String description, String remarks) {
            this.uuid = uuid;
            this.controlId = controlId;
            this.description = description;
            this.remarks = remarks;
        }

        public ImplementedRequirement addStatement(String statementId, Statement statement) {
            if (statements.containsKey(statementId)) {
                throw new DuplicateKeyException(statementId, "implemented requirement " + controlId);
            }
            statements.put(statementId, statement);
            return this;
        }

        public String controlId() { return controlId; }
        public String description() { return description; }
        public String remarks() { return remarks; }
        public Map<String, Statement> statements() { return Collections.unmodifiableMap(statements); }
    }

    @JsonPropertyOrder({"uuid", "description"})
    public record Statement(
            @JsonProperty("uuid") UUID uuid,
            @JsonProperty("description") String description
    ) {}
}
