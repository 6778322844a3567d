package com.qubi.controlhub.plugins.delimited;

import com.qubi.controlhub.core.model.ControlStatement;
import com.qubi.controlhub.core.spi.StatementWriter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Escribe {@code control | text}, un statement por línea. Los saltos de línea del texto pasan a espacios.
 */
public class PipeStatementWriter implements StatementWriter {
    @Override
    public void write(List<ControlStatement> statements, Writer out) throws IOException {
        for (ControlStatement s : statements) {
            out.write(s.control() + " | " + s.text().replaceAll("\\R", " ").strip());
            out.write('\n');
        }
        out.flush();
    }
}
