package com.qubi.controlhub.plugins.jsonl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.qubi.controlhub.core.error.StatementParseException;
import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.JsonSupport;
import com.qubi.controlhub.core.spi.StatementReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee un objeto {@code {"control": ..., "text": ...}} por línea. Estos archivos son generados,
 * así que una línea que no decodifica (o que trae algo después del objeto) es corrupción y aborta la lectura.
 */
public class LineRecordStatementReader implements StatementReader {
    private static final Logger log = LoggerFactory.getLogger(LineRecordStatementReader.class);

    private static final ObjectReader LINE = JsonSupport.MAPPER.reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final int skipLines;
    private final Charset encoding;

    public LineRecordStatementReader(int skipLines, Charset encoding) {
        this.skipLines = skipLines;
        this.encoding = encoding;
    }

    @Override
    public Charset encoding() {
        return encoding;
    }

    @Override
    public List<ControlStatement> read(Reader in, String source) throws IOException {
        BufferedReader lines = in instanceof BufferedReader br ? br : new BufferedReader(in);
        List<ControlStatement> statements = new ArrayList<>();
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (lineNumber <= skipLines) continue;
            statements.add(decode(line, source, lineNumber));
        }
        log.debug("{}: read {} statement(s)", source, statements.size());
        return statements;
    }

    private static ControlStatement decode(String line, String source, int lineNumber) {
        JsonNode node;
        try {
            node = LINE.readTree(line);
        } catch (JsonProcessingException e) {
            throw new StatementParseException(source, lineNumber, e);
        }
        if (node == null || !node.isObject()) {
            throw new StatementParseException(source, lineNumber, "not a JSON object");
        }
        return new ControlStatement(field(node, "control", source, lineNumber), field(node, "text", source, lineNumber));
    }

    private static String field(JsonNode node, String name, String source, int lineNumber) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual()) {
            throw new StatementParseException(source, lineNumber, "missing string field '" + name + "'");
        }
        return value.textValue();
    }
}
