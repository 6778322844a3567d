package com.qubi.controlhub.core.component;

import net.jqwik.api.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ComponentCanonicalizerPropertyTest {

    private static final ComponentCanonicalizer FILTER = new ComponentCanonicalizer(spec());

    private static ComponentSpec spec() {
        ComponentSpec spec = new ComponentSpec();
        spec.components.put("A", new ComponentSpec.KnownComponent(List.of("Microsoft A")));
        spec.components.put("B", new ComponentSpec.KnownComponent(List.of("Cisco B", "Cisco B System")));
        spec.notComponents.add("Chicken");
        return spec;
    }

    @Property
    void filteringTwiceChangesNothing(@ForAll("candidates") Set<String> candidates) {
        Set<String> once = FILTER.filter(candidates);
        assertEquals(once, FILTER.filter(once), "el segundo filtrado cambió " + once);
    }

    @Property
    void excludedTermsNeverSurvive(@ForAll("candidates") Set<String> candidates) {
        for (String name : FILTER.filter(candidates)) {
            assertTrue(FILTER.maybeComponent(name), name);
        }
    }

    @Example
    void aliasOfAnExcludedNameIsDropped() {
        ComponentSpec spec = new ComponentSpec();
        spec.components.put("Chicken", new ComponentSpec.KnownComponent(List.of("Hen")));
        spec.notComponents.add("chicken");
        ComponentCanonicalizer filter = new ComponentCanonicalizer(spec);

        assertEquals(Set.of(), filter.filter(Set.of("Hen")));
    }

    @Provide
    Arbitrary<Set<String>> candidates() {
        Arbitrary<String> name = Arbitraries.of(
                "A", "a", "Microsoft A", "MICROSOFT A", "B", "b", "Cisco B", "cisco b system",
                "Chicken", "chicken", "CHICKEN", "Okta", "okta", "Splunk");
        return name.set().ofMaxSize(8);
    }
}
