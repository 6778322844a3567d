package com.qubi.controlhub.core.component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qubi.controlhub.core.model.JsonSupport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Archivo de componentes conocidos, en JSON o YAML:
 * <pre>
 * components:
 *   Active Directory:
 *     aka: [AD, "Microsoft AD"]
 * not_components: [Chicken]
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComponentSpec {
    /** Nombre canónico → alias. */
    public Map<String, KnownComponent> components = new LinkedHashMap<>();

    /** Términos que el reconocedor suele reportar y que no son componentes. */
    @JsonProperty("not_components")
    public List<String> notComponents = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KnownComponent {
        public List<String> aka = new ArrayList<>();

        public KnownComponent() {}

        public KnownComponent(List<String> aka) {
            this.aka = new ArrayList<>(aka);
        }
    }

    public static ComponentSpec empty() {
        return new ComponentSpec();
    }

    public static ComponentSpec load(Path file) throws IOException {
        ComponentSpec spec = JsonSupport.read(file, ComponentSpec.class);
        return spec == null ? empty() : spec;
    }

    /** Alias de un componente; vacío si no tiene o no se conoce. */
    public List<String> aliases(String component) {
        KnownComponent known = components.get(component);
        return known == null || known.aka == null ? List.of() : known.aka;
    }
}
