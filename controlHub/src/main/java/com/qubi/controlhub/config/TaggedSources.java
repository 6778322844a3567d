package com.qubi.controlhub.config;

import com.qubi.controlhub.core.error.ConfigurationException;

import java.nio.file.Path;
import java.util.*;

/**
 * Documentos fuente etiquetados por quien llama, como {@code tag=path}. Las etiquetas no pueden
 * repetirse ni ir en blanco; se valida todo antes de abrir el primer documento.
 */
public final class TaggedSources {

    public record TaggedSource(String tag, Path path) {}

    private final List<TaggedSource> sources;

    private TaggedSources(List<TaggedSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public static TaggedSources parse(List<String> specs) {
        List<TaggedSource> out = new ArrayList<>();
        for (String spec : specs) {
            int eq = spec.indexOf('=');
            if (eq < 0) throw new ConfigurationException("Expected tag=path, got: " + spec);
            out.add(new TaggedSource(spec.substring(0, eq).trim(), Path.of(spec.substring(eq + 1).trim())));
        }
        return of(out);
    }

    public static TaggedSources of(List<TaggedSource> sources) {
        Set<String> seen = new HashSet<>();
        for (TaggedSource s : sources) {
            if (s.tag() == null || s.tag().isBlank()) {
                throw new ConfigurationException("Blank tag for " + s.path());
            }
            if (!seen.add(s.tag())) throw new ConfigurationException("Duplicate source tag " + s.tag());
        }
        return new TaggedSources(sources);
    }

    public List<TaggedSource> sources() { return sources; }
}
