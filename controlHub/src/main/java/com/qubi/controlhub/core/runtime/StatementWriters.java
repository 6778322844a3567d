package com.qubi.controlhub.core.runtime;

import com.qubi.controlhub.core.error.ConfigurationException;
import com.qubi.controlhub.core.spi.StatementWriter;
import com.qubi.controlhub.plugins.delimited.CsvStatementWriter;
import com.qubi.controlhub.plugins.delimited.PipeStatementWriter;
import com.qubi.controlhub.plugins.jsonl.LineRecordStatementWriter;

public final class StatementWriters {
    private StatementWriters() {}

    public static StatementWriter create(String format) {
        return switch (format == null ? "" : format) {
            case StatementReaders.CSV -> new CsvStatementWriter();
            case StatementReaders.PSV -> new PipeStatementWriter();
            case StatementReaders.JSON_L -> new LineRecordStatementWriter();
            default -> throw new ConfigurationException("Unknown output format " + format
                    + ", expected one of " + StatementReaders.FORMATS);
        };
    }
}
