package com.qubi.controlhub.core.select;

import com.fasterxml.jackson.annotation.JsonValue;
import com.qubi.controlhub.core.model.ComponentStatements;
import com.qubi.controlhub.core.model.Provenance;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Statements encontrados por selector, catálogo y control, con la cobertura de cada par
 * (selector, catálogo). Todos los niveles van ordenados por clave.
 *
 * <p>Un par pedido que no encontró nada queda con un mapa vacío; así un catálogo o control mal
 * escrito aparece como cobertura faltante.
 */
public final class SelectionResult {
    private final SortedMap<String, SortedMap<String, SortedMap<String, List<ComponentStatements>>>> selected = new TreeMap<>();
    private final Map<String, Map<String, Set<String>>> desired = new HashMap<>();

    void put(String selector, String catalog, Set<String> desiredControls,
             SortedMap<String, List<ComponentStatements>> matched) {
        selected.computeIfAbsent(selector, k -> new TreeMap<>()).put(catalog, matched);
        desired.computeIfAbsent(selector, k -> new HashMap<>()).put(catalog, new TreeSet<>(desiredControls));
    }

    @JsonValue
    public Map<String, SortedMap<String, SortedMap<String, List<ComponentStatements>>>> selected() {
        return Collections.unmodifiableMap(selected);
    }

    public Set<String> selectors() {
        return Collections.unmodifiableSet(selected.keySet());
    }

    public Set<String> catalogs(String selector) {
        SortedMap<String, ?> catalogs = selected.get(selector);
        return catalogs == null ? Set.of() : Collections.unmodifiableSet(catalogs.keySet());
    }

    public SortedSet<String> matched(String selector, String catalog) {
        SortedMap<String, SortedMap<String, List<ComponentStatements>>> catalogs = selected.get(selector);
        if (catalogs == null || !catalogs.containsKey(catalog)) return new TreeSet<>();
        return new TreeSet<>(catalogs.get(catalog).keySet());
    }

    /** Controles deseados del par que ningún componente cubre. */
    public SortedSet<String> missing(String selector, String catalog) {
        SortedSet<String> missing = new TreeSet<>(desired.getOrDefault(selector, Map.of()).getOrDefault(catalog, Set.of()));
        missing.removeAll(matched(selector, catalog));
        return missing;
    }

    /**
     * Una línea por par: {@code selector/catalog  +AC-1, +AC-3 | -AC-2}.
     */
    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        selected.forEach((selector, catalogs) -> catalogs.keySet().forEach(catalog -> {
            String matchStr = matched(selector, catalog).stream().map(c -> "+" + c).collect(Collectors.joining(", "));
            String missingStr = missing(selector, catalog).stream().map(c -> "-" + c).collect(Collectors.joining(", "));
            lines.add(String.format("%-30s %s | %s", selector + "/" + catalog, matchStr, missingStr));
        }));
        return lines;
    }

    /**
     * Vista de reporte de un selector: catálogo → control → componente → statements.
     */
    public SortedMap<String, SortedMap<String, SortedMap<String, List<Provenance>>>> document(String selector) {
        SortedMap<String, SortedMap<String, SortedMap<String, List<Provenance>>>> doc = new TreeMap<>();
        SortedMap<String, SortedMap<String, List<ComponentStatements>>> catalogs = selected.get(selector);
        if (catalogs == null) return doc;
        catalogs.forEach((catalog, controls) -> {
            SortedMap<String, SortedMap<String, List<Provenance>>> byControl = new TreeMap<>();
            controls.forEach((control, components) -> {
                SortedMap<String, List<Provenance>> byComponent = new TreeMap<>();
                for (ComponentStatements cs : components) byComponent.put(cs.component(), cs.statements());
                byControl.put(control, byComponent);
            });
            doc.put(catalog, byControl);
        });
        return doc;
    }
}
