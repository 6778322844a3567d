package com.qubi.controlhub.plugins.jsonl;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.model.JsonSupport;
import com.qubi.controlhub.core.spi.StatementWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/** Un objeto JSON compacto por línea. */
public class LineRecordStatementWriter implements StatementWriter {
    private final ObjectWriter writer = JsonSupport.MAPPER.writerFor(ControlStatement.class)
            .without(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void write(List<ControlStatement> statements, Writer out) throws IOException {
        for (ControlStatement s : statements) {
            out.write(writer.writeValueAsString(s));
            out.write('\n');
        }
        out.flush();
    }
}
