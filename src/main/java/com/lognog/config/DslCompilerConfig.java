package com.lognog.config;

import com.lognog.query.ast.Span;
import com.lognog.query.codegen.ClickHouseDialect;
import com.lognog.query.codegen.SqlCodeGenerator;
import com.lognog.query.codegen.SqlDialect;
import com.lognog.query.codegen.SqliteDialect;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.schema.FieldSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Configuration for the query compiler
 * Selects the SQL dialect and the defaults applied to compiled queries
 */
@Configuration
public class DslCompilerConfig {
    private static final Logger logger = LoggerFactory.getLogger(DslCompilerConfig.class);

    @Value("${lognog.dsl.dialect:clickhouse}")
    private String dialect;

    // empty means the dialect's own table
    @Value("${lognog.dsl.table:}")
    private String table;

    @Value("${lognog.dsl.default-limit:1000}")
    private long defaultLimit;

    @Value("${lognog.dsl.timechart.default-span:1h}")
    private String defaultSpan;

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.standard();
    }

    @Bean
    public FieldSchema logFieldSchema() {
        return FieldSchema.defaultLogSchema();
    }

    @Bean
    public SqlDialect sqlDialect() {
        return dialectFor(dialect);
    }

    /**
     * Create the SQL generator for the configured store
     */
    @Bean
    public SqlCodeGenerator sqlCodeGenerator(SqlDialect sqlDialect, FunctionRegistry functionRegistry) {
        String source = table == null || table.isBlank() ? sqlDialect.getDefaultTable() : table.trim();
        Span span;
        try {
            span = Span.parse(defaultSpan.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid lognog.dsl.timechart.default-span: " + defaultSpan, e);
        }
        SqlCodeGenerator generator = new SqlCodeGenerator(sqlDialect, source, defaultLimit, span, functionRegistry);
        logger.info("Query compiler initialized: dialect={}, table={}, defaultLimit={}, timechartSpan={}",
            sqlDialect.getName(), source, defaultLimit, span);
        return generator;
    }

    static SqlDialect dialectFor(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case ClickHouseDialect.NAME:
                return new ClickHouseDialect();
            case SqliteDialect.NAME:
                return new SqliteDialect();
            default:
                throw new IllegalStateException("Unknown lognog.dsl.dialect '" + name
                    + "'; use " + ClickHouseDialect.NAME + " or " + SqliteDialect.NAME);
        }
    }
}
