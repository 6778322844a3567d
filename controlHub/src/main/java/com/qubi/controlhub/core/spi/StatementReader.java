package com.qubi.controlhub.core.spi;

import com.qubi.controlhub.core.model.ControlStatement;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parsea un documento fuente en sus statements, en el orden del documento. El id de control se
 * devuelve tal como se extrajo ({@code RA-3}); la forma canónica la aplica quien lo guarda.
 */
public interface StatementReader {

    /** Codificación que usa {@link #read(Path)}. */
    Charset encoding();

    /**
     * @param in     contenido del documento
     * @param source nombre del documento, para los mensajes de error
     */
    List<ControlStatement> read(Reader in, String source) throws IOException;

    default List<ControlStatement> read(Path source) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(source, encoding())) {
            return read(in, source.toString());
        }
    }
}
