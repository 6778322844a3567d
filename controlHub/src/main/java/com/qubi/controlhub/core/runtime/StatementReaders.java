package com.qubi.controlhub.core.runtime;

import com.qubi.controlhub.config.HubConfig;
import com.qubi.controlhub.core.error.ConfigurationException;
import com.qubi.controlhub.core.spi.StatementReader;
import com.qubi.controlhub.plugins.delimited.DelimitedStatementReader;
import com.qubi.controlhub.plugins.jsonl.LineRecordStatementReader;

import java.util.List;

/**
 * Lector según etiqueta de formato: {@code csv}, {@code psv} o {@code json-l}.
 */
public final class StatementReaders {
    public static final String CSV = "csv";
    public static final String PSV = "psv";
    public static final String JSON_L = "json-l";

    public static final List<String> FORMATS = List.of(CSV, PSV, JSON_L);

    private StatementReaders() {}

    public static StatementReader create(HubConfig.ReaderConfig cfg) {
        String format = cfg.format == null ? "" : cfg.format.toLowerCase(java.util.Locale.ROOT);
        return switch (format) {
            case CSV -> DelimitedStatementReader.csv(cfg.controlIdColumn, cfg.statementColumn, cfg.skipLines, cfg.charset());
            case PSV -> DelimitedStatementReader.psv(cfg.controlIdColumn, cfg.statementColumn, cfg.skipLines, cfg.charset());
            case JSON_L -> new LineRecordStatementReader(cfg.skipLines, cfg.charset());
            default -> throw new ConfigurationException("Unknown reader format " + cfg.format + ", expected one of " + FORMATS);
        };
    }
}
