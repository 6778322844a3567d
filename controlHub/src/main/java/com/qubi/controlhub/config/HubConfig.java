package com.qubi.controlhub.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.qubi.controlhub.core.error.ConfigurationException;
import com.qubi.controlhub.core.model.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class HubConfig {
    public static final String DEFAULT_RESOURCE = "controlhub.yaml";

    public ReaderConfig reader = new ReaderConfig();
    public RecognitionConfig recognition = new RecognitionConfig();
    public AssembleConfig assemble = new AssembleConfig();

    /** Catálogos con que se puede marcar un artefacto; el primero es el default. */
    public List<String> catalogs = new ArrayList<>(List.of(
            "NIST_SP-800-53_rev4", "NIST_SP-800-53_rev5", "NIST_SP-800-171_rev1"));

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReaderConfig {
        /** csv | psv | json-l */
        public String format = "psv";
        /** Columna con el id de control (formatos delimitados). */
        public int controlIdColumn = 0;
        /** Columna con el texto del statement (formatos delimitados). */
        public int statementColumn = 1;
        /** Filas (delimitados) o líneas (json-l) iniciales a ignorar. */
        public int skipLines = 0;
        public String encoding = "UTF-8";

        public Charset charset() {
            return Charset.forName(encoding);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecognitionConfig {
        /** Etiqueta de los patrones de componente. */
        public String componentEntityLabel = "S-Component";
        // opcional: archivo de componentes conocidos
        public String componentsFile;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssembleConfig {
        public int batchSize = 10;
        public String version = "1.0";
    }

    /** Valores por defecto del classpath. */
    public static HubConfig defaults() {
        try (InputStream in = HubConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            HubConfig cfg = in == null ? new HubConfig() : JsonSupport.YAML.readValue(in, HubConfig.class);
            cfg.validate();
            return cfg;
        } catch (IOException e) {
            throw new ConfigurationException("Error loading " + DEFAULT_RESOURCE, e);
        }
    }

    public static HubConfig load(Path file) {
        try {
            HubConfig cfg = JsonSupport.read(file, HubConfig.class);
            if (cfg == null) cfg = new HubConfig();
            cfg.validate();
            return cfg;
        } catch (IOException e) {
            throw new ConfigurationException("Error loading configuration " + file, e);
        }
    }

    public void validate() {
        if (reader == null) reader = new ReaderConfig();
        if (recognition == null) recognition = new RecognitionConfig();
        if (assemble == null) assemble = new AssembleConfig();
        if (reader.controlIdColumn < 0 || reader.statementColumn < 0) {
            throw new ConfigurationException("Column indexes must not be negative");
        }
        if (reader.skipLines < 0) throw new ConfigurationException("skipLines must not be negative");
        if (!supported(reader.encoding)) throw new ConfigurationException("Unsupported encoding: " + reader.encoding);
        if (assemble.batchSize < 1) throw new ConfigurationException("batchSize must be positive");
        if (catalogs == null || catalogs.isEmpty()) throw new ConfigurationException("At least one catalog is required");
    }

    private static boolean supported(String encoding) {
        try {
            return encoding != null && Charset.isSupported(encoding);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** El catálogo pedido, o el default si {@code requested} es null. */
    public String catalog(String requested) {
        if (requested == null) return catalogs.get(0);
        if (!catalogs.contains(requested)) {
            throw new ConfigurationException("Unknown catalog " + requested + ", expected one of " + catalogs);
        }
        return requested;
    }
}
