package com.qubi.controlhub.core.runtime;

import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.RecognitionMetadata;
import com.qubi.controlhub.core.model.RecognitionResult;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;
import com.qubi.controlhub.core.spi.ComponentFilter;
import com.qubi.controlhub.core.spi.ComponentRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Archiva cada statement de un documento bajo los componentes reconocidos en su texto.
 * Un statement puede quedar bajo varios componentes; si el filtro no deja ninguno va a
 * {@link #UNKNOWN_COMPONENT}. La clave de control se guarda en forma canónica.
 */
public class StatementCollator {
    private static final Logger log = LoggerFactory.getLogger(StatementCollator.class);

    public static final String UNKNOWN_COMPONENT = "UNKNOWN";

    private final ComponentRecognizer recognizer;
    private final ComponentFilter filter;

    public StatementCollator(ComponentRecognizer recognizer, ComponentFilter filter) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    public Map<String, List<ControlStatement>> collate(List<ControlStatement> statements) {
        Map<String, List<ControlStatement>> byComponent = new LinkedHashMap<>();
        for (ControlStatement read : statements) {
            ControlStatement statement = new ControlStatement(ControlIdNormalizer.canonicalKey(read.control()), read.text());
            Set<String> components = new TreeSet<>(filter.filter(recognizer.recognize(statement.text())));
            if (log.isTraceEnabled()) log.trace("control {}: {}", statement.control(), components);
            if (components.isEmpty()) components = Set.of(UNKNOWN_COMPONENT);
            for (String component : components) {
                byComponent.computeIfAbsent(component, k -> new ArrayList<>()).add(statement);
            }
        }
        return byComponent;
    }

    public RecognitionResult recognize(List<ControlStatement> statements, RecognitionMetadata metadata) {
        Map<String, List<ControlStatement>> byComponent = collate(statements);
        log.info("{}: {} statement(s) filed under {} component(s)", metadata.source(), statements.size(), byComponent.size());
        return new RecognitionResult(metadata, byComponent);
    }
}
