package com.qubi.controlhub.core.combine;

import com.qubi.controlhub.core.error.InvalidArtifactException;
import com.qubi.controlhub.core.model.*;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Une los artefactos de reconocimiento de muchos documentos en un {@link CombinedModel}.
 *
 * <p>No se deduplica nada: el mismo texto en dos documentos queda como dos entradas.
 * Entradas y metadata siguen el orden de los artefactos. Todos se validan antes de unir
 * el primero, así un artefacto malo nunca deja un modelo a medias.
 *
 * <p>Los controles se guardan con {@link ControlIdNormalizer#canonicalKey}: {@code AC-01} y
 * {@code ac-1} de dos documentos caen en la misma clave.
 */
public class Combiner {
    private static final Logger log = LoggerFactory.getLogger(Combiner.class);

    public CombinedModel combine(List<RecognitionResult> artifacts) {
        for (int i = 0; i < artifacts.size(); i++) {
            validate(artifacts.get(i), "artifact #" + (i + 1));
        }

        CombinedModel combined = new CombinedModel();
        int entries = 0;
        for (RecognitionResult artifact : artifacts) {
            RecognitionMetadata metadata = artifact.metadata();
            combined.addMetadata(metadata);
            for (var component : artifact.components().entrySet()) {
                for (ControlStatement statement : component.getValue()) {
                    if (log.isDebugEnabled() && ControlIdNormalizer.dialectOf(statement.control()) == Dialect.UNRECOGNIZED) {
                        log.debug("{}: control id '{}' matches no known dialect", metadata.source(), statement.control());
                    }
                    combined.ensureControl(component.getKey(), metadata.catalog(), statement.control())
                            .add(new Provenance(metadata.source(), statement.text()));
                    entries++;
                }
            }
        }
        log.info("Combined {} artifact(s) into {} component(s), {} statement(s)",
                artifacts.size(), combined.componentNames().size(), entries);
        return combined;
    }

    /** Lee y combina archivos de artefactos, en el orden dado. */
    public CombinedModel combineFiles(List<Path> files) {
        List<RecognitionResult> artifacts = new ArrayList<>();
        for (Path file : files) {
            RecognitionResult artifact;
            try {
                artifact = JsonSupport.read(file, RecognitionResult.class);
            } catch (IOException e) {
                throw new InvalidArtifactException("Could not read artifact " + file + ": " + e.getMessage(), e);
            }
            if (artifact == null) throw new InvalidArtifactException("Empty artifact " + file);
            validate(artifact, file.toString());
            artifacts.add(artifact);
        }
        return combine(artifacts);
    }

    private static void validate(RecognitionResult artifact, String name) {
        RecognitionMetadata metadata = artifact.metadata();
        if (metadata == null) throw new InvalidArtifactException(name + " has no metadata");
        require(metadata.source(), "source", name);
        require(metadata.catalog(), "catalog", name);
    }

    private static void require(String value, String key, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidArtifactException(name + " is missing metadata." + key);
        }
    }
}
