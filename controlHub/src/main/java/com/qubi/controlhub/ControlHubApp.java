package com.qubi.controlhub;

import com.qubi.controlhub.config.HubConfig;
import com.qubi.controlhub.config.TaggedSources;
import com.qubi.controlhub.core.assemble.ComponentDefinition;
import com.qubi.controlhub.core.assemble.ComponentDefinitionAssembler;
import com.qubi.controlhub.core.combine.Combiner;
import com.qubi.controlhub.core.component.AcceptAllComponentFilter;
import com.qubi.controlhub.core.component.ComponentCanonicalizer;
import com.qubi.controlhub.core.component.ComponentPatterns;
import com.qubi.controlhub.core.component.ComponentSpec;
import com.qubi.controlhub.core.error.ConfigurationException;
import com.qubi.controlhub.core.error.ControlHubException;
import com.qubi.controlhub.core.model.*;
import com.qubi.controlhub.core.runtime.*;
import com.qubi.controlhub.core.select.SelectionResult;
import com.qubi.controlhub.core.select.Selector;
import com.qubi.controlhub.core.spi.ComponentFilter;
import com.qubi.controlhub.core.spi.ComponentRecognizer;
import com.qubi.controlhub.core.spi.StatementReader;
import com.qubi.controlhub.plugins.pattern.PatternComponentRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;

/**
 * Punto de entrada de línea de comandos.
 *
 * <pre>
 * convert   [--format=csv|psv|json-l] FILE
 * match     --components=FILE [--catalog=NAME] [--remarks=TEXT] FILE
 * recognize [--components=FILE] [--catalog=NAME] [--remarks=TEXT] FILE
 * combine   ARTIFACT...
 * select    [--catalog=NAME] [--selector=NAME] [--summary | --output-dir=DIR] SPEC COMBINED
 * assemble  --title=TITLE [--component=A,B] [--batch-size=N --batch-output=DIR] COMBINED
 * collate   TAG=FILE...
 * </pre>
 * Opciones de lectura para todos los comandos: {@code --config=FILE --reader=FORMAT --control-id-col=N
 * --statement-col=N --skip-lines=N --encoding=NAME}. Los resultados salen por la salida estándar.
 */
public final class ControlHubApp {
    private static final Logger log = LoggerFactory.getLogger(ControlHubApp.class);

    private final Writer out;
    private final Clock clock;

    public ControlHubApp(Writer out, Clock clock) {
        this.out = out;
        this.clock = clock;
    }

    public static void main(String[] args) {
        Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        System.exit(new ControlHubApp(stdout, Clock.systemUTC()).run(args));
    }

    /** @return código de salida del proceso */
    public int run(String[] args) {
        try {
            CommandLine cmd = CommandLine.parse(args);
            HubConfig config = config(cmd);
            switch (cmd.command()) {
                case "convert" -> convert(cmd, config);
                case "match" -> recognize(cmd, config, true);
                case "recognize" -> recognize(cmd, config, false);
                case "combine" -> combine(cmd);
                case "select" -> select(cmd);
                case "assemble" -> assemble(cmd, config);
                case "collate" -> collate(cmd, config);
                default -> throw new ConfigurationException("Unknown command " + cmd.command());
            }
            out.flush();
            return 0;
        } catch (ControlHubException e) {
            log.error(e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            return 2;
        }
    }

    private static HubConfig config(CommandLine cmd) {
        String file = cmd.option("config");
        HubConfig config = file == null ? HubConfig.defaults() : HubConfig.load(Path.of(file));
        HubConfig.ReaderConfig reader = config.reader;
        if (cmd.option("reader") != null) reader.format = cmd.option("reader");
        reader.controlIdColumn = cmd.intOption("control-id-col", reader.controlIdColumn);
        reader.statementColumn = cmd.intOption("statement-col", reader.statementColumn);
        reader.skipLines = cmd.intOption("skip-lines", reader.skipLines);
        if (cmd.option("encoding") != null) reader.encoding = cmd.option("encoding");
        if (cmd.option("components") != null) config.recognition.componentsFile = cmd.option("components");
        config.validate();
        return config;
    }

    private void convert(CommandLine cmd, HubConfig config) throws IOException {
        List<ControlStatement> statements = StatementReaders.create(config.reader).read(Path.of(cmd.argument(0, "FILE")));
        StatementWriters.create(cmd.options().getOrDefault("format", StatementReaders.PSV)).write(statements, out);
    }

    /**
     * {@code match} da por canónicos los ids de los patrones; {@code recognize} pasa lo que reporte el reconocedor
     * del classpath (o el de patrones) por las reglas de alias y exclusión.
     */
    private void recognize(CommandLine cmd, HubConfig config, boolean patternsOnly) throws IOException {
        String file = cmd.argument(0, "FILE");
        String catalog = config.catalog(cmd.option("catalog"));
        String componentsFile = config.recognition.componentsFile;
        if (patternsOnly && componentsFile == null) throw new ConfigurationException("match needs --components");
        ComponentSpec spec = componentsFile == null ? ComponentSpec.empty() : ComponentSpec.load(Path.of(componentsFile));

        ComponentRecognizer recognizer;
        ComponentFilter filter;
        if (patternsOnly) {
            recognizer = patternRecognizer(spec, config);
            filter = new AcceptAllComponentFilter();
        } else {
            recognizer = ServiceLoader.load(ComponentRecognizer.class).findFirst()
                    .orElseGet(() -> patternRecognizer(spec, config));
            filter = new ComponentCanonicalizer(componentsFile == null ? null : spec);
        }
        log.info("Recognizing components in {} with {}", file, recognizer.getClass().getSimpleName());

        List<ControlStatement> statements = StatementReaders.create(config.reader).read(Path.of(file));
        RecognitionMetadata metadata = RecognitionMetadata.create(file, catalog, cmd.option("remarks"),
                "controlhub " + String.join(" ", cmd.words()), clock);
        JsonSupport.write(new StatementCollator(recognizer, filter).recognize(statements, metadata), out);
    }

    private static ComponentRecognizer patternRecognizer(ComponentSpec spec, HubConfig config) {
        return new PatternComponentRecognizer(ComponentPatterns.of(spec, config.recognition.componentEntityLabel));
    }

    private void combine(CommandLine cmd) throws IOException {
        if (cmd.arguments().isEmpty()) throw new ConfigurationException("combine needs at least one artifact");
        List<Path> files = cmd.arguments().stream().map(Path::of).toList();
        JsonSupport.write(new Combiner().combineFiles(files), out);
    }

    private void select(CommandLine cmd) throws IOException {
        SelectorSpec spec = JsonSupport.read(Path.of(cmd.argument(0, "SPEC")), SelectorSpec.class);
        CombinedModel combined = JsonSupport.read(Path.of(cmd.argument(1, "COMBINED")), CombinedModel.class);
        SelectionResult result = new Selector(combined, spec).select(cmd.option("catalog"), cmd.option("selector"));

        if (cmd.flag("summary")) {
            for (String line : result.summary()) {
                out.write(line);
                out.write('\n');
            }
        } else if (cmd.option("output-dir") != null) {
            Path dir = Files.createDirectories(Path.of(cmd.option("output-dir")));
            for (String selector : result.selectors()) {
                Path target = dir.resolve(slug(selector) + ".json");
                JsonSupport.write(Map.of(selector, result.document(selector)), target);
                log.info("Wrote {}", target);
            }
        } else {
            JsonSupport.write(result, out);
        }
    }

    private void assemble(CommandLine cmd, HubConfig config) throws IOException {
        String title = cmd.option("title");
        if (title == null) throw new ConfigurationException("assemble needs --title");
        CombinedModel combined = JsonSupport.read(Path.of(cmd.argument(0, "COMBINED")), CombinedModel.class);
        Set<String> selected = cmd.listOption("component");
        ComponentDefinitionAssembler assembler = new ComponentDefinitionAssembler(clock, config.assemble.version);

        String batchOutput = cmd.option("batch-output");
        if (batchOutput == null) {
            CombinedModel model = selected.isEmpty() ? combined : combined.restrictTo(selected);
            JsonSupport.write(assembler.assemble(model, title).asDocument(), out);
            return;
        }
        Path dir = Files.createDirectories(Path.of(batchOutput));
        int batchSize = cmd.intOption("batch-size", config.assemble.batchSize);
        if (batchSize < 1) throw new ConfigurationException("--batch-size must be positive");
        List<ComponentDefinition> batches = assembler.assembleBatches(combined, title, selected, batchSize);
        for (int i = 0; i < batches.size(); i++) {
            JsonSupport.write(batches.get(i).asDocument(), dir.resolve("COMPONENTS-BATCH-" + i + ".json"));
        }
        log.info("Wrote {} batch(es) to {}", batches.size(), dir);
    }

    private void collate(CommandLine cmd, HubConfig config) throws IOException {
        TaggedSources sources = TaggedSources.parse(cmd.arguments());
        StatementReader reader = StatementReaders.create(config.reader);
        Map<String, List<ControlStatement>> byTag = new LinkedHashMap<>();
        for (TaggedSources.TaggedSource source : sources.sources()) {
            byTag.put(source.tag(), reader.read(source.path()));
        }
        JsonSupport.write(ControlCollator.collate(byTag), out);
    }

    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "selector" : slug;
    }
}
