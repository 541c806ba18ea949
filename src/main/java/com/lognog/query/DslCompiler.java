package com.lognog.query;

import com.lognog.query.ast.Pipeline;
import com.lognog.query.codegen.SqlCodeGenerator;
import com.lognog.query.lexer.DslLexer;
import com.lognog.query.lexer.Token;
import com.lognog.query.parser.DslParser;
import com.lognog.query.resolve.FieldResolver;
import com.lognog.query.resolve.ResolvedPipeline;
import com.lognog.query.schema.FieldSchema;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point of the query compiler: query text in, SQL and result shape out.
 *
 * The phases run in order (lex, parse, resolve, generate) and the first
 * failure ends the call with a {@link CompileException} naming the phase and,
 * where there is one, the position of the offending token. Nothing is
 * returned for a query that fails.
 *
 * Stateless and safe for concurrent use; the alert scheduler and the search
 * API share one instance.
 */
@Component
public class DslCompiler {

    private static final Logger logger = LoggerFactory.getLogger(DslCompiler.class);

    private final DslLexer lexer;
    private final DslParser parser;
    private final FieldResolver resolver;
    private final SqlCodeGenerator generator;
    private final FieldSchema defaultSchema;
    private final CompilerMetrics metrics;

    public DslCompiler(DslLexer lexer, DslParser parser, FieldResolver resolver, SqlCodeGenerator generator,
                       FieldSchema defaultSchema, CompilerMetrics metrics) {
        this.lexer = lexer;
        this.parser = parser;
        this.resolver = resolver;
        this.generator = generator;
        this.defaultSchema = defaultSchema;
        this.metrics = metrics;
    }

    /**
     * Compile against the default log schema.
     */
    public CompiledQuery compile(String query) {
        return compile(query, defaultSchema, null);
    }

    public CompiledQuery compile(String query, FieldSchema schema) {
        return compile(query, schema, null);
    }

    /**
     * Compile a query.
     *
     * @param query     DSL text
     * @param schema    fields of the log store
     * @param timeRange optional bounds on the timestamp; null for none
     * @return the SQL, its output columns and any warnings
     * @throws CompileException on the first error of any phase
     */
    public CompiledQuery compile(String query, FieldSchema schema, TimeRange timeRange) {
        Timer.Sample sample = metrics.startCompileTimer();
        try {
            ResolvedPipeline resolved = analyze(query, schema);
            CompiledQuery compiled = generator.generate(resolved, timeRange);
            metrics.recordCompileSucceeded();
            logger.debug("Compiled query [{}] to SQL: {}", query, compiled.getSql());
            return compiled;
        } catch (CompileException e) {
            metrics.recordCompileFailed(e.getStage());
            logger.debug("Rejected query [{}]: {}", query, e.getMessage());
            throw e;
        } finally {
            metrics.recordCompileLatency(sample);
        }
    }

    /**
     * Dry run: lex, parse and resolve without emitting SQL.
     *
     * @return warnings of an otherwise valid query
     * @throws CompileException on the first error
     */
    public List<CompileWarning> validate(String query, FieldSchema schema) {
        metrics.recordValidateRequest();
        try {
            List<CompileWarning> warnings = analyze(query, schema).getWarnings();
            logger.debug("Validated query [{}] with {} warning(s)", query, warnings.size());
            return warnings;
        } catch (CompileException e) {
            logger.debug("Query [{}] failed validation: {}", query, e.getMessage());
            throw e;
        }
    }

    public List<CompileWarning> validate(String query) {
        return validate(query, defaultSchema);
    }

    public FieldSchema getDefaultSchema() {
        return defaultSchema;
    }

    private ResolvedPipeline analyze(String query, FieldSchema schema) {
        List<Token> tokens = lexer.tokenize(query);
        Pipeline pipeline = parser.parse(tokens);
        return resolver.resolve(pipeline, schema == null ? defaultSchema : schema);
    }
}
