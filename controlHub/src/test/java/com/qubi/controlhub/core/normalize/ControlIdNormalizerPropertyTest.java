package com.qubi.controlhub.core.normalize;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;

import static org.junit.jupiter.api.Assertions.*;

class ControlIdNormalizerPropertyTest {

    @Property
    void canonicalControlIdIsIdempotent(@ForAll("controlIds") String raw) {
        String once = ControlIdNormalizer.canonicalControlId(raw);
        assertEquals(once, ControlIdNormalizer.canonicalControlId(once));
    }

    @Property
    void canonicalKeyIsIdempotent(@ForAll("controlIds") String raw) {
        String key = ControlIdNormalizer.canonicalKey(raw);
        assertEquals(key, ControlIdNormalizer.canonicalKey(key));
    }

    @Property
    void keyResolvesLikeTheRawId(@ForAll("controlIds") String raw) {
        String key = ControlIdNormalizer.canonicalKey(raw);
        assertEquals(ControlIdNormalizer.canonicalControlId(raw), ControlIdNormalizer.canonicalControlId(key));
        assertEquals(ControlIdNormalizer.canonicalStatementId(raw), ControlIdNormalizer.canonicalStatementId(key));
    }

    @Property
    void neverFails(@ForAll @StringLength(max = 40) String raw) {
        assertNotNull(ControlIdNormalizer.canonicalControlId(raw));
        assertTrue(ControlIdNormalizer.canonicalStatementId(raw).contains(ControlIdNormalizer.STATEMENT_SUFFIX));
    }

    @Property
    void leadingZerosAreIgnored(@ForAll @IntRange(min = 0, max = 999) int number,
                                @ForAll @IntRange(min = 0, max = 3) int zeros) {
        String padded = "AC-" + "0".repeat(zeros) + number;
        assertEquals("ac-" + number, ControlIdNormalizer.canonicalControlId(padded));
    }

    @Provide
    Arbitrary<String> controlIds() {
        Arbitrary<String> family = Arbitraries.strings().withCharRange('a', 'z').withCharRange('A', 'Z').ofLength(2);
        Arbitrary<Integer> number = Arbitraries.integers().between(0, 300);
        Arbitrary<String> enhancement = Arbitraries.integers().between(0, 30)
                .map(n -> "(" + n + ")").injectNull(0.5).map(s -> s == null ? "" : s);
        Arbitrary<String> part = Arbitraries.strings().withCharRange('a', 'z').ofLength(1)
                .map(p -> "." + p).injectNull(0.5).map(s -> s == null ? "" : s);
        Arbitrary<String> dashed = Combinators.combine(family, number, enhancement, part)
                .as((f, n, e, p) -> f + "-" + n + e + p);
        Arbitrary<String> decimal = Arbitraries.integers().between(1, 20).list().ofMinSize(1).ofMaxSize(4)
                .map(parts -> String.join(".", parts.stream().map(String::valueOf).toList()));
        return Arbitraries.oneOf(dashed, decimal);
    }
}
