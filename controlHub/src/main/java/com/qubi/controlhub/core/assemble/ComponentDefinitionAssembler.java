package com.qubi.controlhub.core.assemble;

import com.qubi.controlhub.core.model.CombinedModel;
import com.qubi.controlhub.core.model.Provenance;
import com.qubi.controlhub.core.normalize.ControlIdNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Arma definiciones de componentes a partir de un modelo combinado.
 *
 * <p>Las claves que comparten control canónico ({@code ac-1.a}, {@code ac-1.b}) son statements de un
 * mismo requisito implementado; las que comparten statement canónico se funden en uno solo.
 * Los uuid salen de los nombres y la fecha del reloj, así la misma entrada da la misma salida.
 */
public class ComponentDefinitionAssembler {
    private static final Logger log = LoggerFactory.getLogger(ComponentDefinitionAssembler.class);

    public static final String OSCAL_VERSION = "1.0.0-rc1";

    private final Clock clock;
    private final String version;

    public ComponentDefinitionAssembler(Clock clock, String version) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.version = Objects.requireNonNull(version, "version");
    }

    public ComponentDefinition assemble(CombinedModel model, String title) {
        OffsetDateTime now = clock.instant().truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC);
        ComponentDefinition definition = new ComponentDefinition(
                uuid("definition", title),
                new ComponentDefinition.Metadata(title, version, OSCAL_VERSION, now, now));

        for (String name : model.componentNames()) {
            ComponentDefinition.Component component = new ComponentDefinition.Component(uuid("component", name), name, name);
            definition.addComponent(component);
            for (String catalog : model.catalogs(name)) {
                component.add(implementation(name, catalog, model.controls(name, catalog)));
            }
        }
        log.debug("Assembled '{}' with {} component(s)", title, definition.components().size());
        return definition;
    }

    /**
     * Una definición por lote de {@code batchSize} componentes, en orden de nombre, con título {@code "title: n"}.
     *
     * @param selected componentes a incluir; todos si está vacío
     */
    public List<ComponentDefinition> assembleBatches(CombinedModel model, String title, Set<String> selected, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be positive");
        List<String> names = new ArrayList<>(selected == null || selected.isEmpty() ? model.componentNames() : selected);
        Collections.sort(names);
        List<ComponentDefinition> batches = new ArrayList<>();
        for (int from = 0, batch = 0; from < names.size(); from += batchSize, batch++) {
            List<String> chunk = names.subList(from, Math.min(from + batchSize, names.size()));
            batches.add(assemble(model.restrictTo(chunk), title + ": " + batch));
        }
        return batches;
    }

    private ComponentDefinition.ControlImplementation implementation(String component, String catalog,
                                                                     Map<String, List<Provenance>> controls) {
        ComponentDefinition.ControlImplementation implementation =
                new ComponentDefinition.ControlImplementation(uuid("implementation", component, catalog), catalog, catalog);

        // control canónico → statement canónico → procedencias, en orden de aparición
        Map<String, Map<String, List<Provenance>>> byControlId = new LinkedHashMap<>();
        controls.forEach((key, entries) -> byControlId
                .computeIfAbsent(ControlIdNormalizer.canonicalControlId(key), k -> new LinkedHashMap<>())
                .computeIfAbsent(ControlIdNormalizer.canonicalStatementId(key), k -> new ArrayList<>())
                .addAll(entries));

        byControlId.forEach((controlId, statements) -> {
            List<Provenance> all = statements.values().stream().flatMap(List::stream).collect(Collectors.toList());
            ComponentDefinition.ImplementedRequirement requirement = new ComponentDefinition.ImplementedRequirement(
                    uuid("requirement", component, catalog, controlId),
                    controlId,
                    describe(all),
                    "From: " + all.stream().map(Provenance::source).collect(Collectors.joining(", ")));
            statements.forEach((statementId, entries) -> requirement.addStatement(statementId,
                    new ComponentDefinition.Statement(uuid("statement", component, catalog, statementId), describe(entries))));
            implementation.add(requirement);
        });
        return implementation;
    }

    private static String describe(List<Provenance> entries) {
        return entries.stream().map(Provenance::text).collect(Collectors.joining("\n\n"));
    }

    private static UUID uuid(String kind, String... names) {
        return UUID.nameUUIDFromBytes((kind + "/" + String.join("/", names)).getBytes(StandardCharsets.UTF_8));
    }
}
