package com.qubi.controlhub.core.error;

/**
 * No se pudo decodificar una línea de una fuente de statements autodescriptiva.
 */
public class StatementParseException extends ControlHubException {
    private final String source;
    private final int lineNumber;

    public StatementParseException(String source, int lineNumber, String reason) {
        super("Malformed statement record in " + source + " at line " + lineNumber + ": " + reason);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public StatementParseException(String source, int lineNumber, Throwable cause) {
        super("Malformed statement record in " + source + " at line " + lineNumber + ": " + cause.getMessage(), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public String source() { return source; }

    /** Desde 1, contando las líneas salteadas. */
    public int lineNumber() { return lineNumber; }
}
