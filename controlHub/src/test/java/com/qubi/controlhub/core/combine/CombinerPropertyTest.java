package com.qubi.controlhub.core.combine;

import com.qubi.controlhub.core.model.*;
import net.jqwik.api.*;

import java.time.OffsetDateTime;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class CombinerPropertyTest {

    private final Combiner combiner = new Combiner();

    @Property(tries = 50)
    void orderOnlyAffectsEntryOrder(@ForAll("artifacts") List<RecognitionResult> artifacts, @ForAll Random random) {
        List<RecognitionResult> shuffled = new ArrayList<>(artifacts);
        Collections.shuffle(shuffled, random);

        assertEquals(entries(combiner.combine(artifacts)), entries(combiner.combine(shuffled)));
    }

    @Property(tries = 50)
    void sameOrderIsByteIdentical(@ForAll("artifacts") List<RecognitionResult> artifacts) {
        assertArrayEquals(JsonSupport.toBytes(combiner.combine(artifacts)), JsonSupport.toBytes(combiner.combine(artifacts)));
    }

    // componente/catálogo/control → multiconjunto de entradas
    private static Map<String, Map<Provenance, Integer>> entries(CombinedModel model) {
        Map<String, Map<Provenance, Integer>> out = new HashMap<>();
        for (String component : model.componentNames()) {
            for (String catalog : model.catalogs(component)) {
                model.controls(component, catalog).forEach((control, list) -> {
                    Map<Provenance, Integer> counts = out.computeIfAbsent(component + "/" + catalog + "/" + control, k -> new HashMap<>());
                    for (Provenance p : list) counts.merge(p, 1, Integer::sum);
                });
            }
        }
        return out;
    }

    @Provide
    Arbitrary<List<RecognitionResult>> artifacts() {
        Arbitrary<ControlStatement> statement = Combinators.combine(
                Arbitraries.of("AC-1", "AC-2", "IA-2"),
                Arbitraries.of("text one", "text two")
        ).as(ControlStatement::new);
        Arbitrary<Map<String, List<ControlStatement>>> components = Arbitraries.maps(
                Arbitraries.of("Okta", "Splunk", "Jira"),
                statement.list().ofMinSize(1).ofMaxSize(3)
        ).ofMaxSize(3);
        Arbitrary<RecognitionResult> artifact = Combinators.combine(
                Arbitraries.of("ssp-a", "ssp-b", "ssp-c"),
                Arbitraries.of("NIST_SP-800-53_rev4", "NIST_SP-800-53_rev5"),
                components
        ).as((source, catalog, map) -> new RecognitionResult(
                new RecognitionMetadata(source, catalog, "", OffsetDateTime.parse("2024-01-01T00:00:00Z"), "test"), map));
        return artifact.list().ofMaxSize(5);
    }
}
