package com.qubi.controlhub.plugins.delimited;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.JsonSupport;
import com.qubi.controlhub.core.spi.StatementWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Escribe filas {@code control,text}, con comillas donde el texto las necesita.
 */
public class CsvStatementWriter implements StatementWriter {
    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("control")
            .addColumn("text")
            .build()
            .withoutHeader();

    private final ObjectWriter writer = JsonSupport.CSV
            .writer(SCHEMA)
            .forType(ControlStatement.class)
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void write(List<ControlStatement> statements, Writer out) throws IOException {
        try (SequenceWriter rows = writer.writeValues(out)) {
            rows.writeAll(statements);
        }
        out.flush();
    }
}
