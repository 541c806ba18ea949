package com.lognog.query;

import com.lognog.query.codegen.ClickHouseDialect;
import com.lognog.query.codegen.SqlCodeGenerator;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.DslLexer;
import com.lognog.query.lexer.LexException;
import com.lognog.query.parser.DslParser;
import com.lognog.query.parser.ParseException;
import com.lognog.query.resolve.FieldResolver;
import com.lognog.query.resolve.ResolveException;
import com.lognog.query.schema.FieldSchema;
import com.lognog.query.schema.FieldType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DslCompiler, running every phase
 */
@DisplayName("DslCompiler Tests")
class DslCompilerTest {

    private CompilerMetrics metrics;
    private DslCompiler compiler;

    @BeforeEach
    void setUp() {
        metrics = new CompilerMetrics();
        metrics.meterRegistry = new SimpleMeterRegistry();
        metrics.init();

        FunctionRegistry registry = FunctionRegistry.standard();
        compiler = new DslCompiler(new DslLexer(), new DslParser(registry), new FieldResolver(registry),
            new SqlCodeGenerator(new ClickHouseDialect(), registry), FieldSchema.defaultLogSchema(), metrics);
    }

    @Test
    @DisplayName("Should compile a search, aggregate, sort and limit pipeline")
    void shouldCompileEndToEnd() {
        // When
        CompiledQuery compiled =
            compiler.compile("search app_name=nginx severity<=3 | stats count by hostname | sort desc count | limit 10");

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT hostname, count() AS count FROM lognog.logs "
            + "WHERE app_name = 'nginx' AND severity <= 3 GROUP BY hostname ORDER BY count DESC LIMIT 10");
        assertThat(compiled.getOutputColumns()).containsExactly(
            new OutputColumn("hostname", FieldType.STRING),
            new OutputColumn("count", FieldType.INTEGER));
        assertThat(compiled.getWarnings()).isEmpty();
        assertThat(metrics.getCompileSucceeded().count()).isEqualTo(1.0);
        assertThat(metrics.getCompileLatency().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("A plain count has one integer column")
    void shouldCompileCount() {
        CompiledQuery compiled = compiler.compile("search * | stats count");

        assertThat(compiled.getSql()).isEqualTo("SELECT count() AS count FROM lognog.logs");
        assertThat(compiled.getOutputColumns()).containsExactly(new OutputColumn("count", FieldType.INTEGER));
    }

    @Test
    @DisplayName("The same query should always compile to the same SQL")
    void shouldBeDeterministic() {
        String query = "search host=web* | eval kb=dest_port / 1024 | stats avg(kb) as avg_kb, dc(user) by app";

        assertThat(compiler.compile(query).getSql()).isEqualTo(compiler.compile(query).getSql());
    }

    @Test
    @DisplayName("Severity names and aliases should compile like codes and columns")
    void shouldCompileSeverityNames() {
        assertThat(compiler.compile("search level<=warning").getSql())
            .isEqualTo(compiler.compile("search severity<=4").getSql());
        assertThat(compiler.compile("search severity<=04").getSql())
            .isEqualTo(compiler.compile("search severity<=warning").getSql());
    }

    @Test
    @DisplayName("Wildcards should pick the cheapest match")
    void shouldClassifyWildcards() {
        assertThat(compiler.compile("search host=web*").getSql()).isEqualTo(
            "SELECT * FROM lognog.logs WHERE startsWith(hostname, 'web') ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("rex fields should be usable downstream")
    void shouldCompileRex() {
        assertThat(compiler.compile("search * | rex field=message \"user=(?<username>\\w+)\" | table username").getSql())
            .isEqualTo("SELECT extractGroups(message, 'user=(\\\\w+)')[1] AS username FROM lognog.logs "
                + "ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("case() should compile to CASE WHEN")
    void shouldCompileCase() {
        assertThat(compiler.compile(
            "search * | eval level_name=case(severity<=3, \"high\", severity<=5, \"medium\", \"low\") | table level_name")
            .getSql())
            .isEqualTo("SELECT CASE WHEN (severity <= 3) THEN 'high' WHEN (severity <= 5) THEN 'medium' "
                + "ELSE 'low' END AS level_name FROM lognog.logs ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Time range should be applied to the query")
    void shouldApplyTimeRange() {
        TimeRange range = new TimeRange(Instant.parse("2024-01-15T10:00:00Z"), Instant.parse("2024-01-15T11:00:00Z"));

        assertThat(compiler.compile("search *", FieldSchema.defaultLogSchema(), range).getSql()).isEqualTo(
            "SELECT * FROM lognog.logs WHERE timestamp >= '2024-01-15 10:00:00' "
                + "AND timestamp <= '2024-01-15 11:00:00' ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Failures should name their phase and be counted")
    void shouldReportFailingPhase() {
        assertThatThrownBy(() -> compiler.compile("search hostnme=web01"))
            .isInstanceOf(ResolveException.class)
            .satisfies(e -> {
                CompileError error = ((CompileException) e).toError();
                assertThat(error.getStage()).isEqualTo(CompilePhase.RESOLVE);
                assertThat(error.getPosition()).isEqualTo(7);
            });
        assertThatThrownBy(() -> compiler.compile("search message=\"open"))
            .isInstanceOf(LexException.class);
        assertThatThrownBy(() -> compiler.compile("search * | frobnicate"))
            .isInstanceOf(ParseException.class);

        assertThat(metrics.getCompileFailed(CompilePhase.RESOLVE).count()).isEqualTo(1.0);
        assertThat(metrics.getCompileFailed(CompilePhase.LEX).count()).isEqualTo(1.0);
        assertThat(metrics.getCompileFailed(CompilePhase.PARSE).count()).isEqualTo(1.0);
        assertThat(metrics.getCompileSucceeded().count()).isZero();
        assertThat(metrics.getCompileLatency().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("An oversized span should fail in the parse phase")
    void shouldCountOversizedSpanAsParseFailure() {
        assertThatThrownBy(() -> compiler.compile("search * | timechart span=100000000000000000000s count"))
            .isInstanceOf(ParseException.class)
            .satisfies(e -> assertThat(((CompileException) e).toError().getPosition()).isEqualTo(26));

        assertThat(metrics.getCompileFailed(CompilePhase.PARSE).count()).isEqualTo(1.0);
        assertThat(metrics.getCompileSucceeded().count()).isZero();
    }

    @Test
    @DisplayName("validate should return warnings without compiling")
    void shouldValidate() {
        assertThat(compiler.validate("search * | sort host | stats count"))
            .extracting(CompileWarning::getMessage)
            .containsExactly("sort has no effect before stats, which discards row order");
        assertThat(metrics.getValidateRequests().count()).isEqualTo(1.0);
        assertThat(metrics.getCompileSucceeded().count()).isZero();

        assertThatThrownBy(() -> compiler.validate("search * |"))
            .isInstanceOf(ParseException.class);
    }
}
