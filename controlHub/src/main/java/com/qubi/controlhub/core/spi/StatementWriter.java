package com.qubi.controlhub.core.spi;

import com.qubi.controlhub.core.model.ControlStatement;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

@FunctionalInterface
public interface StatementWriter {
    void write(List<ControlStatement> statements, Writer out) throws IOException;
}
