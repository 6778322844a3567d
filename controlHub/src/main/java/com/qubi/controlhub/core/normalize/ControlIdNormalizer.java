package com.qubi.controlhub.core.normalize;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identificadores canónicos de control y de statement para los dialectos que aparecen en los documentos.
 *
 * <p>Los dialectos se prueban en orden fijo contra el id recortado y en minúsculas; gana el primero que
 * calza completo:
 * <ul>
 *   <li>{@code 3.1.2} decimal jerárquico, se deja igual</li>
 *   <li>{@code ac-01} familia y número</li>
 *   <li>{@code ac-2(1)} o {@code ac-2 (1)} con mejora (enhancement)</li>
 *   <li>{@code ac-1.a} con parte</li>
 *   <li>{@code ac-2(1).b} con mejora y parte</li>
 * </ul>
 * Los números pierden los ceros a la izquierda. Cualquier otra cosa vuelve recortada y en minúsculas, nunca se rechaza.
 *
 * <p>Tres formas por id:
 * <ul>
 *   <li>{@link #canonicalKey}: la clave con que se guarda un control; conserva mejora y parte ({@code ac-1(2).b})</li>
 *   <li>{@link #canonicalControlId}: el control padre, sin parte ({@code ac-1.2})</li>
 *   <li>{@link #canonicalStatementId}: el statement, con la parte después de {@link #STATEMENT_SUFFIX} ({@code ac-1.2_smt.b})</li>
 * </ul>
 * Cada forma da lo mismo aplicada a la clave canónica que al id crudo.
 */
public final class ControlIdNormalizer {
    public static final String STATEMENT_SUFFIX = "_smt";

    public enum Dialect { DECIMAL, SIMPLE, EXTENDED, PART, EXTENDED_PART, UNRECOGNIZED }

    private static final List<Rule> RULES = List.of(
            new Rule(Dialect.DECIMAL, "\\d+(\\.\\d+)*",
                    m -> m.group(),
                    m -> m.group(),
                    m -> m.group() + STATEMENT_SUFFIX),
            new Rule(Dialect.SIMPLE, "([a-z]{2})-(\\d+)",
                    m -> control(m),
                    m -> control(m),
                    m -> control(m) + STATEMENT_SUFFIX),
            new Rule(Dialect.EXTENDED, "([a-z]{2})-(\\d+)\\s*\\((\\d+)\\)",
                    m -> control(m) + "(" + number(m.group(3)) + ")",
                    m -> enhancement(m),
                    m -> enhancement(m) + STATEMENT_SUFFIX),
            new Rule(Dialect.PART, "([a-z]{2})-(\\d+)\\.([a-z]+)",
                    m -> control(m) + "." + m.group(3),
                    m -> control(m),
                    m -> control(m) + STATEMENT_SUFFIX + "." + m.group(3)),
            new Rule(Dialect.EXTENDED_PART, "([a-z]{2})-(\\d+)\\s*\\((\\d+)\\)\\.([a-z]+)",
                    m -> control(m) + "(" + number(m.group(3)) + ")." + m.group(4),
                    m -> enhancement(m),
                    m -> enhancement(m) + STATEMENT_SUFFIX + "." + m.group(4))
    );

    private ControlIdNormalizer() {}

    /** Forma de almacenamiento: {@code "AC-01 (2).B"} da {@code "ac-1(2).b"}. */
    public static String canonicalKey(String raw) {
        return resolve(raw, Rule::key, id -> id);
    }

    public static String canonicalControlId(String raw) {
        return resolve(raw, Rule::controlId, id -> id);
    }

    public static String canonicalStatementId(String raw) {
        return resolve(raw, Rule::statementId, id -> id + STATEMENT_SUFFIX);
    }

    public static Dialect dialectOf(String raw) {
        String id = clean(raw);
        for (Rule r : RULES) {
            if (r.pattern.matcher(id).matches()) return r.dialect;
        }
        return Dialect.UNRECOGNIZED;
    }

    private static String resolve(String raw, Function<Rule, Function<Matcher, String>> form,
                                  Function<String, String> unrecognized) {
        String id = clean(raw);
        for (Rule r : RULES) {
            Matcher m = r.pattern.matcher(id);
            if (m.matches()) return form.apply(r).apply(m);
        }
        return unrecognized.apply(id);
    }

    private static String clean(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    private static String control(Matcher m) {
        return m.group(1) + "-" + number(m.group(2));
    }

    private static String enhancement(Matcher m) {
        return control(m) + "." + number(m.group(3));
    }

    // BigInteger: números absurdamente largos no desbordan
    private static String number(String digits) {
        return new BigInteger(digits).toString();
    }

    private record Rule(Dialect dialect, Pattern pattern, Function<Matcher, String> key,
                        Function<Matcher, String> controlId, Function<Matcher, String> statementId) {
        Rule(Dialect dialect, String regex, Function<Matcher, String> key,
             Function<Matcher, String> controlId, Function<Matcher, String> statementId) {
            this(dialect, Pattern.compile(regex), key, controlId, statementId);
        }
    }
}
