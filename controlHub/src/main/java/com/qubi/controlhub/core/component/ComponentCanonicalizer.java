package com.qubi.controlhub.core.component;

import com.qubi.controlhub.core.spi.ComponentFilter;

import java.util.*;

/**
 * Descarta falsos positivos conocidos y lleva los alias al nombre canónico del componente.
 * Las comparaciones ignoran mayúsculas; los nombres desconocidos pasan sin cambios.
 *
 * <p>Aplicar el filtro dos veces da lo mismo que aplicarlo una.
 */
public class ComponentCanonicalizer implements ComponentFilter {
    private final Set<String> excluded = new HashSet<>();
    private final Map<String, String> canonicalNames = new HashMap<>();

    /** @param spec componentes conocidos, o {@code null} para dejar pasar todo */
    public ComponentCanonicalizer(ComponentSpec spec) {
        if (spec == null) return;
        if (spec.notComponents != null) {
            for (String term : spec.notComponents) excluded.add(fold(term));
        }
        if (spec.components != null) {
            for (String name : spec.components.keySet()) {
                canonicalNames.put(fold(name), name);
                for (String aka : spec.aliases(name)) canonicalNames.put(fold(aka), name);
            }
        }
    }

    @Override
    public Set<String> filter(Set<String> candidates) {
        Set<String> out = new TreeSet<>();
        if (candidates == null) return out;
        for (String candidate : candidates) {
            if (!maybeComponent(candidate)) continue;
            String name = canonicalName(candidate);
            if (maybeComponent(name)) out.add(name);
        }
        return out;
    }

    public boolean maybeComponent(String candidate) {
        return !excluded.contains(fold(candidate));
    }

    public String canonicalName(String candidate) {
        return canonicalNames.getOrDefault(fold(candidate), candidate);
    }

    // mayúsculas y después minúsculas: pliega ß y similares como espera una comparación sin caso
    static String fold(String s) {
        return s.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
