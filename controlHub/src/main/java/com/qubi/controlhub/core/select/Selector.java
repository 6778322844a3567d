package com.qubi.controlhub.core.select;

import com.qubi.controlhub.core.model.*;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reagrupa un {@link CombinedModel} según los controles que pide cada selector, por catálogo.
 *
 * <p>Los controles pedidos se buscan por su clave canónica, así {@code AC-1} encuentra lo que un
 * documento escribió como {@code AC-01}. El resultado los muestra tal como los escribe el selector.
 */
public class Selector {
    private static final Logger log = LoggerFactory.getLogger(Selector.class);

    private final CombinedModel model;
    private final SelectorSpec spec;

    public Selector(CombinedModel model, SelectorSpec spec) {
        this.model = Objects.requireNonNull(model, "model");
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    /**
     * @param catalogFilter  sólo este catálogo, o {@code null} para todos
     * @param selectorFilter sólo este selector, o {@code null} para todos
     */
    public SelectionResult select(String catalogFilter, String selectorFilter) {
        SelectionResult result = new SelectionResult();
        List<String> components = new ArrayList<>(model.componentNames());
        Collections.sort(components);

        spec.selectors().forEach((selector, catalogs) -> {
            if (!accepts(selectorFilter, selector)) return;
            catalogs.forEach((catalog, controls) -> {
                if (!accepts(catalogFilter, catalog)) return;
                Set<String> desired = new TreeSet<>(controls);
                SortedMap<String, List<ComponentStatements>> matched = new TreeMap<>();
                for (String component : components) {
                    Map<String, List<Provenance>> available = model.controls(component, catalog);
                    for (String control : desired) {
                        List<Provenance> statements = available.get(ControlIdNormalizer.canonicalKey(control));
                        if (statements != null) {
                            matched.computeIfAbsent(control, k -> new ArrayList<>())
                                    .add(new ComponentStatements(component, statements));
                        }
                    }
                }
                result.put(selector, catalog, desired, matched);
                log.debug("{}/{}: {} of {} control(s) matched", selector, catalog, matched.size(), desired.size());
            });
        });
        return result;
    }

    private static boolean accepts(String filter, String value) {
        return filter == null || filter.equals(value);
    }
}
