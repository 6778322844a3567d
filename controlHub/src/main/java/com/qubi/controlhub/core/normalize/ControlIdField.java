package com.qubi.controlhub.core.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Saca la clave de control de una columna libre: {@code "[AC-3] Access"} da {@code AC-3}.
 */
public final class ControlIdField {
    private static final Pattern LEADING_ID = Pattern.compile("\\[?([\\w.\\-()]+)");

    private ControlIdField() {}

    /** Primer tramo de caracteres de id tras un {@code [} opcional; si no hay, el campo recortado. */
    public static String extract(String field) {
        if (field == null) return "";
        String trimmed = field.trim();
        Matcher m = LEADING_ID.matcher(trimmed);
        if (m.lookingAt()) return m.group(1).trim();
        return trimmed;
    }
}
