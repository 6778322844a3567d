package com.qubi.controlhub.core.runtime;

import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.Provenance;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;

import java.util.*;

/**
 * Alinea los statements que varios documentos etiquetados dan para un mismo control.
 * Las entradas de un control siguen el orden de las etiquetas; la clave es la canónica.
 */
public final class ControlCollator {
    private ControlCollator() {}

    /** @param statementsByTag statements de cada documento, en orden de etiqueta */
    public static SortedMap<String, List<Provenance>> collate(Map<String, List<ControlStatement>> statementsByTag) {
        SortedMap<String, List<Provenance>> byControl = new TreeMap<>();
        statementsByTag.forEach((tag, statements) -> {
            for (ControlStatement s : statements) {
                byControl.computeIfAbsent(ControlIdNormalizer.canonicalKey(s.control()), k -> new ArrayList<>()).add(new Provenance(tag, s.text()));
            }
        });
        return byControl;
    }
}
