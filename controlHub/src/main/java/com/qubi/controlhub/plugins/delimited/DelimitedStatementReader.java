package com.qubi.controlhub.plugins.delimited;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.JsonSupport;
import com.qubi.controlhub.core.normalize.ControlIdField;
import com.qubi.controlhub.core.spi.StatementReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lee statements de exportaciones separadas por coma o por pipe. Los campos pueden ir entre comillas dobles.
 *
 * <p>Las exportaciones vienen de muchas organizaciones y casi nunca están limpias, así que ninguna fila
 * es fatal:
 * <ul>
 *   <li>cada registro se parsea por separado; uno que Jackson no acepta ({@code "Policy" is ...},
 *       comillas sin cerrar) se parte a mano, como lo haría un lector CSV tolerante</li>
 *   <li>una fila sin las columnas configuradas se descarta</li>
 *   <li>con {@code splitOnWhitespace}, una fila que no se partió (falta el separador) se parte en el
 *       primer espacio en control y texto</li>
 * </ul>
 * Un registro puede ocupar varias líneas si un campo entre comillas trae saltos de línea; si las
 * comillas no cierran antes del fin del archivo, la línea se toma sola.
 */
public class DelimitedStatementReader implements StatementReader {
    private static final Logger log = LoggerFactory.getLogger(DelimitedStatementReader.class);

    private static final char QUOTE = '"';
    private static final Pattern FIRST_WHITESPACE = Pattern.compile("(\\S+)\\s+(.*)", Pattern.DOTALL);
    private static final ObjectReader ROWS = JsonSupport.CSV
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY);

    private final char delimiter;
    private final int controlColumn;
    private final int textColumn;
    private final int skipRows;
    private final Charset encoding;
    private final boolean splitOnWhitespace;
    private final ObjectReader rows;

    public DelimitedStatementReader(char delimiter, int controlColumn, int textColumn, int skipRows,
                                    Charset encoding, boolean splitOnWhitespace) {
        this.delimiter = delimiter;
        this.controlColumn = controlColumn;
        this.textColumn = textColumn;
        this.skipRows = skipRows;
        this.encoding = encoding;
        this.splitOnWhitespace = splitOnWhitespace;
        this.rows = ROWS.with(CsvSchema.emptySchema().withColumnSeparator(delimiter));
    }

    public static DelimitedStatementReader csv(int controlColumn, int textColumn, int skipRows, Charset encoding) {
        return new DelimitedStatementReader(',', controlColumn, textColumn, skipRows, encoding, false);
    }

    public static DelimitedStatementReader psv(int controlColumn, int textColumn, int skipRows, Charset encoding) {
        return new DelimitedStatementReader('|', controlColumn, textColumn, skipRows, encoding, true);
    }

    @Override
    public Charset encoding() {
        return encoding;
    }

    @Override
    public List<ControlStatement> read(Reader in, String source) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader br = in instanceof BufferedReader b ? b : new BufferedReader(in);
        for (String line = br.readLine(); line != null; line = br.readLine()) lines.add(line);

        List<ControlStatement> statements = new ArrayList<>();
        int row = 0;
        int dropped = 0;
        for (int i = 0; i < lines.size(); i++) {
            int last = recordEnd(lines, i);
            String record = String.join("\n", lines.subList(i, last + 1));
            int firstLine = i + 1;
            i = last;
            row++;
            if (row <= skipRows) continue;

            ControlStatement statement = statement(fields(record, source, firstLine));
            if (statement == null) {
                dropped++;
                log.debug("{}: dropped line {}", source, firstLine);
            } else {
                statements.add(statement);
            }
        }
        log.debug("{}: read {} statement(s), dropped {} row(s)", source, statements.size(), dropped);
        return statements;
    }

    /** Última línea del registro que empieza en {@code first}: avanza mientras las comillas queden abiertas. */
    private static int recordEnd(List<String> lines, int first) {
        int quotes = count(lines.get(first));
        int last = first;
        while (quotes % 2 != 0 && last + 1 < lines.size()) {
            last++;
            quotes += count(lines.get(last));
        }
        return quotes % 2 == 0 ? last : first;
    }

    private static int count(String line) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == QUOTE) n++;
        }
        return n;
    }

    String[] fields(String record, String source, int lineNumber) throws IOException {
        if (record.isBlank()) return new String[0];
        try {
            MappingIterator<String[]> it = rows.readValues(record);
            return it.hasNextValue() ? it.nextValue() : new String[0];
        } catch (JsonProcessingException e) {
            log.debug("{}: line {} is not clean CSV ({}), splitting leniently", source, lineNumber, e.getOriginalMessage());
            return lenientSplit(record);
        }
    }

    /**
     * Parte en el separador fuera de comillas. Las comillas se quitan donde aparezcan y {@code ""} dentro
     * de comillas queda como una comilla; lo que siga a un campo entre comillas se pega al campo.
     */
    String[] lenientSplit(String record) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (c == QUOTE) {
                if (quoted && i + 1 < record.length() && record.charAt(i + 1) == QUOTE) {
                    field.append(QUOTE);
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == delimiter && !quoted) {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields.toArray(new String[0]);
    }

    ControlStatement statement(String[] fields) {
        if (fields == null || fields.length == 0) return null;
        if (fields.length == 1) {
            if (!splitOnWhitespace) return null;
            Matcher m = FIRST_WHITESPACE.matcher(fields[0].trim());
            if (!m.matches()) return null;
            return new ControlStatement(ControlIdField.extract(m.group(1)), m.group(2).trim());
        }
        if (fields.length <= Math.max(controlColumn, textColumn)) return null;
        return new ControlStatement(ControlIdField.extract(fields[controlColumn]), fields[textColumn].trim());
    }
}
