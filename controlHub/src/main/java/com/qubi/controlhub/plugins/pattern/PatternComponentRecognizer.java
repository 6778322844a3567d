package com.qubi.controlhub.plugins.pattern;

import com.qubi.controlhub.core.component.ComponentPatterns.ComponentPattern;
import com.qubi.controlhub.core.spi.ComponentRecognizer;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Reconocedor de diccionario: reporta el id de cada patrón que aparece en el texto como frase completa.
 * Distingue mayúsculas, igual que los patrones de frase de los que sale.
 */
public class PatternComponentRecognizer implements ComponentRecognizer {
    private final List<Compiled> patterns;

    public PatternComponentRecognizer(List<ComponentPattern> patterns) {
        List<Compiled> list = new ArrayList<>();
        for (ComponentPattern p : patterns) {
            if (p.pattern() == null || p.pattern().isBlank()) continue;
            list.add(new Compiled(p.id(), Pattern.compile("(?<!\\w)" + Pattern.quote(p.pattern()) + "(?!\\w)")));
        }
        this.patterns = List.copyOf(list);
    }

    @Override
    public Set<String> recognize(String text) {
        Set<String> found = new TreeSet<>();
        if (text == null) return found;
        for (Compiled c : patterns) {
            if (c.phrase.matcher(text).find()) found.add(c.id);
        }
        return found;
    }

    private record Compiled(String id, Pattern phrase) {}
}
