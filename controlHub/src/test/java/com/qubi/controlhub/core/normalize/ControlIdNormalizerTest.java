package com.qubi.controlhub.core.normalize;

import com.qubi.controlhub.core.normalize.ControlIdNormalizer.Dialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ControlIdNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "ac-1       | ac-1",
            "AC-1       | ac-1",
            "AC-01      | ac-1",
            "AC-1(2)    | ac-1.2",
            "AC-1 (2)   | ac-1.2",
            "AC-01(2)   | ac-1.2",
            "AC-01 (2)  | ac-1.2",
            "AC-2.a     | ac-2",
            "AC-02.a    | ac-2",
            "AC-1(2).b  | ac-1.2",
            "AC-01(2).b | ac-1.2",
            "3.2.1      | 3.2.1",
            "3.2.3.4    | 3.2.3.4",
    })
    void canonicalControlId(String raw, String expected) {
        assertEquals(expected, ControlIdNormalizer.canonicalControlId(raw), raw);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "ac-1        | ac-1_smt",
            "AC-1        | ac-1_smt",
            "AC-01       | ac-1_smt",
            "AC-1(2)     | ac-1.2_smt",
            "AC-01(2)    | ac-1.2_smt",
            "AC-1 (2)    | ac-1.2_smt",
            "AC-01 (2)   | ac-1.2_smt",
            "AC-1.a      | ac-1_smt.a",
            "AC-01.a     | ac-1_smt.a",
            "AC-1(2).b   | ac-1.2_smt.b",
            "AC-01(2).b  | ac-1.2_smt.b",
            "AC-1 (2).b  | ac-1.2_smt.b",
            "AC-01 (2).b | ac-1.2_smt.b",
            "3.2         | 3.2_smt",
            "3.1.1       | 3.1.1_smt",
            "3.2.3.4     | 3.2.3.4_smt",
    })
    void canonicalStatementId(String raw, String expected) {
        assertEquals(expected, ControlIdNormalizer.canonicalStatementId(raw), raw);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "AC-01        | ac-1",
            "ac-1         | ac-1",
            "AC-1 (2)     | ac-1(2)",
            "AC-01(02)    | ac-1(2)",
            "AC-1.a       | ac-1.a",
            "AC-01.B      | ac-1.b",
            "AC-01(2).B   | ac-1(2).b",
            "AC-1 (2).b   | ac-1(2).b",
            "3.2.1        | 3.2.1",
            "'  Foo Bar ' | foo bar",
    })
    void canonicalKey(String raw, String expected) {
        assertEquals(expected, ControlIdNormalizer.canonicalKey(raw), raw);
    }

    @Test
    void keyKeepsPartAndEnhancement() {
        String key = ControlIdNormalizer.canonicalKey("AC-01 (2).B");
        assertEquals(ControlIdNormalizer.canonicalControlId("AC-01 (2).B"), ControlIdNormalizer.canonicalControlId(key));
        assertEquals(ControlIdNormalizer.canonicalStatementId("AC-01 (2).B"), ControlIdNormalizer.canonicalStatementId(key));
        assertNotEquals(ControlIdNormalizer.canonicalKey("AC-1.a"), ControlIdNormalizer.canonicalKey("AC-1.b"));
    }

    @Test
    void unrecognizedIdsAreTrimmedAndLowerCased() {
        assertEquals("policy section 4", ControlIdNormalizer.canonicalControlId("  Policy Section 4 "));
        assertEquals("policy section 4_smt", ControlIdNormalizer.canonicalStatementId("Policy Section 4"));
        assertEquals("ac-3(a)", ControlIdNormalizer.canonicalControlId("AC-3(a)"));
        assertEquals("", ControlIdNormalizer.canonicalControlId(""));
        assertEquals("", ControlIdNormalizer.canonicalControlId(null));
    }

    @Test
    void partsShareTheirParentControl() {
        assertEquals(ControlIdNormalizer.canonicalControlId("AC-1.a"), ControlIdNormalizer.canonicalControlId("ac-01.b"));
        assertNotEquals(ControlIdNormalizer.canonicalStatementId("AC-1.a"), ControlIdNormalizer.canonicalStatementId("AC-1.b"));
    }

    @Test
    void hugeNumbersDoNotOverflow() {
        assertEquals("ac-123456789012345678901234567890",
                ControlIdNormalizer.canonicalControlId("AC-000123456789012345678901234567890"));
    }

    @Test
    void dialects() {
        assertEquals(Dialect.DECIMAL, ControlIdNormalizer.dialectOf("3.1.1"));
        assertEquals(Dialect.SIMPLE, ControlIdNormalizer.dialectOf("AC-01"));
        assertEquals(Dialect.EXTENDED, ControlIdNormalizer.dialectOf("AC-1 (2)"));
        assertEquals(Dialect.PART, ControlIdNormalizer.dialectOf("AC-1.a"));
        assertEquals(Dialect.EXTENDED_PART, ControlIdNormalizer.dialectOf("AC-1(2).b"));
        assertEquals(Dialect.UNRECOGNIZED, ControlIdNormalizer.dialectOf("AC3"));
    }
}
