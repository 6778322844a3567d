package com.qubi.controlhub.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.qubi.controlhub.core.error.ControlHubException;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class JsonSupport {
    private JsonSupport(){}

    /** Artefactos: indentados, fechas ISO-8601, siempre con el mismo orden de claves. */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    /** Configuración y archivo de componentes conocidos. También lee JSON (YAML lo contiene). */
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static final CsvMapper CSV = new CsvMapper();

    public static byte[] toBytes(Object o){
        try { return MAPPER.writeValueAsBytes(o); }
        catch (JsonProcessingException e){ throw new ControlHubException("Could not serialize " + o.getClass().getSimpleName(), e); }
    }

    public static <T> T read(Path path, Class<T> cls) throws IOException {
        return mapperFor(path).readValue(path.toFile(), cls);
    }

    /** YAML para {@code .yaml}/{@code .yml}, JSON para el resto. */
    public static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : MAPPER;
    }

    public static void write(Object o, Path path) throws IOException {
        Files.write(path, toBytes(o));
    }

    /** Escribe {@code o} y un salto de línea; el writer queda abierto. */
    public static void write(Object o, Writer out) throws IOException {
        out.write(MAPPER.writeValueAsString(o));
        out.write(System.lineSeparator());
        out.flush();
    }
}
