package com.qubi.controlhub;

import com.qubi.controlhub.core.error.ConfigurationException;

import java.util.*;

/**
 * {@code command [--key=value | --flag]... [argument]...}
 */
record CommandLine(String command, Map<String, String> options, List<String> arguments, List<String> words) {

    static CommandLine parse(String[] args) {
        if (args.length == 0) throw new ConfigurationException("No command given");
        Map<String, String> options = new LinkedHashMap<>();
        List<String> arguments = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--") && arg.length() > 2) {
                int eq = arg.indexOf('=');
                if (eq < 0) options.put(arg.substring(2), "true");
                else options.put(arg.substring(2, eq), arg.substring(eq + 1));
            } else {
                arguments.add(arg);
            }
        }
        return new CommandLine(args[0], options, arguments, List.of(args));
    }

    String option(String name) {
        return options.get(name);
    }

    boolean flag(String name) {
        return Boolean.parseBoolean(options.getOrDefault(name, "false"));
    }

    int intOption(String name, int fallback) {
        String value = options.get(name);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " expects a number, got " + value);
        }
    }

    /** Valores de una opción separados por coma; vacío si no está. */
    Set<String> listOption(String name) {
        Set<String> values = new LinkedHashSet<>();
        String value = options.get(name);
        if (value == null) return values;
        for (String v : value.split(",")) {
            if (!v.isBlank()) values.add(v.trim());
        }
        return values;
    }

    String argument(int index, String what) {
        if (arguments.size() <= index) throw new ConfigurationException("Missing argument: " + what);
        return arguments.get(index);
    }
}
