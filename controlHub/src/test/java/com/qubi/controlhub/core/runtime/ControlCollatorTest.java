package com.qubi.controlhub.core.runtime;

import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.Provenance;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ControlCollatorTest {

    @Test
    void linesUpDocumentsByControl() {
        Map<String, List<ControlStatement>> byTag = new LinkedHashMap<>();
        byTag.put("ssp-b", List.of(new ControlStatement("AC-2", "b2"), new ControlStatement("AC-1", "b1")));
        byTag.put("ssp-a", List.of(new ControlStatement("AC-1", "a1")));

        SortedMap<String, List<Provenance>> collated = ControlCollator.collate(byTag);

        assertEquals(List.of("ac-1", "ac-2"), new ArrayList<>(collated.keySet()));
        assertEquals(List.of(new Provenance("ssp-b", "b1"), new Provenance("ssp-a", "a1")), collated.get("ac-1"));
        assertEquals(List.of(new Provenance("ssp-b", "b2")), collated.get("ac-2"));
    }

    @Test
    void differentSpellingsLineUp() {
        Map<String, List<ControlStatement>> byTag = new LinkedHashMap<>();
        byTag.put("ssp-a", List.of(new ControlStatement("AC-01", "a1")));
        byTag.put("ssp-b", List.of(new ControlStatement("ac-1", "b1")));

        SortedMap<String, List<Provenance>> collated = ControlCollator.collate(byTag);

        assertEquals(List.of("ac-1"), new ArrayList<>(collated.keySet()), "AC-01 y ac-1 son el mismo control");
    }
}
