package com.qubi.controlhub.plugins.pattern;

import com.qubi.controlhub.core.component.ComponentPatterns;
import com.qubi.controlhub.core.component.ComponentSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatternComponentRecognizerTest {

    private static PatternComponentRecognizer recognizer() {
        ComponentSpec spec = new ComponentSpec();
        spec.components.put("Active Directory", new ComponentSpec.KnownComponent(List.of("AD")));
        spec.components.put("Splunk", new ComponentSpec.KnownComponent());
        return new PatternComponentRecognizer(ComponentPatterns.of(spec, "S-Component"));
    }

    @Test
    void reportsCanonicalIdsOfPhrasesFound() {
        assertEquals(Set.of("Active Directory", "Splunk"),
                recognizer().recognize("Accounts live in AD and logins are forwarded to Splunk."));
    }

    @Test
    void matchesWholePhrasesOnly() {
        assertEquals(Set.of(), recognizer().recognize("ADFS and Splunkd are not listed"));
    }

    @Test
    void nothingFoundInPlainText() {
        assertTrue(recognizer().recognize("Policies are reviewed yearly.").isEmpty());
        assertTrue(recognizer().recognize(null).isEmpty());
    }
}
