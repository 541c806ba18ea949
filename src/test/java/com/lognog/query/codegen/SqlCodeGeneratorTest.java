package com.lognog.query.codegen;

import com.lognog.query.CompilePhase;
import com.lognog.query.CompiledQuery;
import com.lognog.query.OutputColumn;
import com.lognog.query.TimeRange;
import com.lognog.query.ast.Span;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.DslLexer;
import com.lognog.query.parser.DslParser;
import com.lognog.query.parser.ParseException;
import com.lognog.query.resolve.FieldResolver;
import com.lognog.query.resolve.ResolvedPipeline;
import com.lognog.query.schema.FieldSchema;
import com.lognog.query.schema.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SqlCodeGenerator against the ClickHouse dialect
 */
@DisplayName("SqlCodeGenerator Tests")
class SqlCodeGeneratorTest {

    private FunctionRegistry registry;
    private DslLexer lexer;
    private DslParser parser;
    private FieldResolver resolver;
    private SqlCodeGenerator generator;

    @BeforeEach
    void setUp() {
        registry = FunctionRegistry.standard();
        lexer = new DslLexer();
        parser = new DslParser(registry);
        resolver = new FieldResolver(registry);
        generator = new SqlCodeGenerator(new ClickHouseDialect(), registry);
    }

    private ResolvedPipeline resolve(String query) {
        return resolver.resolve(parser.parse(lexer.tokenize(query)), FieldSchema.defaultLogSchema());
    }

    private String sql(String query) {
        return generator.generate(resolve(query)).getSql();
    }

    @Test
    @DisplayName("A bare search returns newest rows first under the default limit")
    void shouldSelectAllWithDefaults() {
        assertThat(sql("search *")).isEqualTo("SELECT * FROM lognog.logs ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Wildcards should use prefix, suffix or LIKE matching")
    void shouldTranslateWildcards() {
        assertThat(sql("search host=web* app=nginx")).isEqualTo(
            "SELECT * FROM lognog.logs WHERE startsWith(hostname, 'web') AND app_name = 'nginx' "
                + "ORDER BY timestamp DESC LIMIT 1000");
        assertThat(sql("search host=*web")).contains("WHERE endsWith(hostname, 'web')");
        assertThat(sql("search host=*web*")).contains("WHERE hostname LIKE '%web%'");
        assertThat(sql("search host=web_*")).contains("WHERE startsWith(hostname, 'web_')");
        assertThat(sql("search host=w*b_1")).contains("WHERE hostname LIKE 'w%b\\\\_1'");
        assertThat(sql("search host!=web*")).contains("WHERE NOT (startsWith(hostname, 'web'))");
        assertThat(sql("search host=*")).contains("WHERE hostname IS NOT NULL");
        assertThat(sql("search host!=*")).contains("WHERE hostname IS NULL");
    }

    @Test
    @DisplayName("Boolean structure should survive translation")
    void shouldTranslateBooleanStructure() {
        assertThat(sql("search (app=nginx OR app=apache) NOT severity>4")).contains(
            "WHERE (app_name = 'nginx' OR app_name = 'apache') AND NOT (severity > 4)");
    }

    @Test
    @DisplayName("Contains terms should match case-insensitively")
    void shouldTranslateContains() {
        assertThat(sql("search timeout")).contains("WHERE positionCaseInsensitive(raw, 'timeout') > 0");
        assertThat(sql("search message~\"conn*refused\"")).contains("WHERE message ILIKE 'conn%refused'");
    }

    @Test
    @DisplayName("String literals should be escaped")
    void shouldEscapeStrings() {
        assertThat(sql("search message=\"it's\"")).contains("WHERE message = 'it''s'");
        assertThat(sql("search message=\"a\\\\b\"")).contains("WHERE message = 'a\\\\b'");
        assertThat(sql("search user=1001")).contains("WHERE user = '1001'");
    }

    @Test
    @DisplayName("Time range should bound the innermost query")
    void shouldApplyTimeRange() {
        // Given
        TimeRange range = new TimeRange(Instant.parse("2024-01-15T10:00:00Z"), Instant.parse("2024-01-15T11:00:00Z"));

        // When
        String sql = generator.generate(resolve("search app=nginx | head 10 | where severity<3"), range).getSql();

        // Then
        assertThat(sql).isEqualTo("SELECT * FROM (SELECT * FROM lognog.logs "
            + "WHERE timestamp >= '2024-01-15 10:00:00' AND timestamp <= '2024-01-15 11:00:00' "
            + "AND app_name = 'nginx' ORDER BY timestamp DESC LIMIT 10) WHERE severity < 3 ORDER BY timestamp DESC");
    }

    @Test
    @DisplayName("stats should group, alias and skip the default limit")
    void shouldTranslateStats() {
        // When
        CompiledQuery compiled = generator.generate(resolve(
            "search * | stats count, dc(host) as hosts, p95(dest_port), earliest(message) by app"));

        // Then
        assertThat(compiled.getSql()).isEqualTo("SELECT app_name, count() AS count, uniq(hostname) AS hosts, "
            + "quantile(0.95)(dest_port) AS p95_dest_port, argMin(message, timestamp) AS earliest_message "
            + "FROM lognog.logs GROUP BY app_name");
        assertThat(compiled.getOutputColumns()).containsExactly(
            new OutputColumn("app_name", FieldType.STRING),
            new OutputColumn("count", FieldType.INTEGER),
            new OutputColumn("hosts", FieldType.INTEGER),
            new OutputColumn("p95_dest_port", FieldType.FLOAT),
            new OutputColumn("earliest_message", FieldType.STRING));
    }

    @Test
    @DisplayName("Filters after an aggregation should become HAVING")
    void shouldUseHavingAfterAggregation() {
        assertThat(sql("search * | stats count by host | where count > 10")).isEqualTo(
            "SELECT hostname, count() AS count FROM lognog.logs GROUP BY hostname HAVING count() > 10");
    }

    @Test
    @DisplayName("Sort and limit after stats should order by the output name")
    void shouldOrderAggregatesByName() {
        assertThat(sql("search app_name=nginx severity<=3 | stats count by hostname | sort desc count | limit 10"))
            .isEqualTo("SELECT hostname, count() AS count FROM lognog.logs "
                + "WHERE app_name = 'nginx' AND severity <= 3 GROUP BY hostname ORDER BY count DESC LIMIT 10");
    }

    @Test
    @DisplayName("eval fields should be inlined where they are used")
    void shouldInlineEvalFields() {
        assertThat(sql("search * | eval kb=dest_port / 1024 | where kb > 4 | table host, kb")).isEqualTo(
            "SELECT hostname, (dest_port / 1024) AS kb FROM lognog.logs WHERE (dest_port / 1024) > 4 "
                + "ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Functions and conditionals should render through their strategies")
    void shouldRenderFunctions() {
        // When
        String sql = sql("search * | eval n=len(message), s=substr(host, 1, 3), r=round(dest_port / 3, 2), "
            + "sev=case(severity <= 3, \"high\", severity <= 5, \"medium\", \"low\"), "
            + "hi=if(severity <= 3, \"high\", \"low\") | table n, s, r, sev, hi");

        // Then
        assertThat(sql).startsWith("SELECT lengthUTF8(message) AS n, substringUTF8(hostname, 1, 3) AS s, "
            + "round((dest_port / 3), 2) AS r, "
            + "CASE WHEN (severity <= 3) THEN 'high' WHEN (severity <= 5) THEN 'medium' ELSE 'low' END AS sev, "
            + "if((severity <= 3), 'high', 'low') AS hi FROM lognog.logs");
    }

    @Test
    @DisplayName("An aggregation after a limit should read from a subquery")
    void shouldWrapLimitBeforeAggregation() {
        assertThat(sql("search * | head 100 | stats count by host")).isEqualTo(
            "SELECT hostname, count() AS count FROM "
                + "(SELECT * FROM lognog.logs ORDER BY timestamp DESC LIMIT 100) GROUP BY hostname");
    }

    @Test
    @DisplayName("A second aggregation should read from the first")
    void shouldNestAggregations() {
        assertThat(sql("search * | stats count by host, app | stats avg(count) as avg_per_app by app")).isEqualTo(
            "SELECT app_name, avg(count) AS avg_per_app FROM "
                + "(SELECT hostname, app_name, count() AS count FROM lognog.logs GROUP BY hostname, app_name) "
                + "GROUP BY app_name");
    }

    @Test
    @DisplayName("A sort after a limit should not reorder before limiting")
    void shouldWrapLimitBeforeSort() {
        assertThat(sql("search * | sort -dest_port | head 5"))
            .isEqualTo("SELECT * FROM lognog.logs ORDER BY dest_port DESC LIMIT 5");
        assertThat(sql("search * | head 100 | sort host")).isEqualTo(
            "SELECT * FROM (SELECT * FROM lognog.logs ORDER BY timestamp DESC LIMIT 100) ORDER BY hostname ASC");
    }

    @Test
    @DisplayName("tail should invert the row order")
    void shouldTranslateTail() {
        assertThat(sql("search * | tail 5")).isEqualTo("SELECT * FROM lognog.logs ORDER BY timestamp ASC LIMIT 5");
        assertThat(sql("search * | sort host | tail 5"))
            .isEqualTo("SELECT * FROM lognog.logs ORDER BY hostname DESC LIMIT 5");
    }

    @Test
    @DisplayName("tail without any order is a codegen error")
    void shouldRejectTailWithoutOrder() {
        assertThatThrownBy(() -> sql("search * | stats count by host | tail 3"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("tail needs a defined row order")
            .satisfies(e -> assertThat(((CodegenException) e).getStage()).isEqualTo(CompilePhase.CODEGEN));
    }

    @Test
    @DisplayName("dedup should use LIMIT 1 BY")
    void shouldTranslateDedup() {
        assertThat(sql("search * | dedup host")).isEqualTo(
            "SELECT * FROM lognog.logs ORDER BY timestamp DESC LIMIT 1 BY hostname LIMIT 1000");
    }

    @Test
    @DisplayName("top and rare should count, order and limit")
    void shouldTranslateTopAndRare() {
        assertThat(sql("search * | top 3 host")).isEqualTo(
            "SELECT hostname, count() AS count FROM lognog.logs GROUP BY hostname ORDER BY count DESC LIMIT 3");
        assertThat(sql("search * | rare app")).isEqualTo(
            "SELECT app_name, count() AS count FROM lognog.logs GROUP BY app_name ORDER BY count ASC LIMIT 10");
    }

    @Test
    @DisplayName("timechart should bucket the timestamp and order by bucket")
    void shouldTranslateTimechart() {
        assertThat(sql("search app=nginx | timechart span=5m count by host")).isEqualTo(
            "SELECT toStartOfFiveMinutes(timestamp) AS time_bucket, hostname, count() AS count FROM lognog.logs "
                + "WHERE app_name = 'nginx' GROUP BY toStartOfFiveMinutes(timestamp), hostname "
                + "ORDER BY time_bucket ASC");
        assertThat(sql("search * | timechart count")).startsWith("SELECT toStartOfHour(timestamp) AS time_bucket");
        assertThat(sql("search * | timechart span=2h count"))
            .startsWith("SELECT toStartOfInterval(timestamp, INTERVAL 2 HOUR) AS time_bucket");
    }

    @Test
    @DisplayName("bin should bucket time and numeric fields")
    void shouldTranslateBin() {
        assertThat(sql("search * | bin span=1h timestamp as hour | stats count by hour")).isEqualTo(
            "SELECT toStartOfHour(timestamp) AS hour, count() AS count FROM lognog.logs "
                + "GROUP BY toStartOfHour(timestamp)");
        assertThat(sql("search * | bin span=100 dest_port | stats count by dest_port"))
            .startsWith("SELECT (floor(dest_port / 100) * 100) AS dest_port, count() AS count");
    }

    @Test
    @DisplayName("rex should extract positional groups")
    void shouldTranslateRex() {
        assertThat(sql("search * | rex field=message \"user=(?<username>\\w+)\" | stats count by username"))
            .isEqualTo("SELECT extractGroups(message, 'user=(\\\\w+)')[1] AS username, count() AS count "
                + "FROM lognog.logs GROUP BY extractGroups(message, 'user=(\\\\w+)')[1]");
    }

    @Test
    @DisplayName("rename should alias the column and follow the order")
    void shouldTranslateRename() {
        assertThat(sql("search * | rename host as server | table server"))
            .isEqualTo("SELECT hostname AS server FROM lognog.logs ORDER BY timestamp DESC LIMIT 1000");
        assertThat(sql("search * | stats count by host | sort -count | rename count as hits")).isEqualTo(
            "SELECT hostname, count() AS hits FROM lognog.logs GROUP BY hostname ORDER BY hits DESC");
        assertThat(sql("search * | rename host as values | table values"))
            .startsWith("SELECT hostname AS \"values\" FROM lognog.logs");
    }

    @Test
    @DisplayName("fields - should list the remaining columns")
    void shouldTranslateFieldsExclude() {
        String sql = sql("search * | fields - raw, structured_data");

        assertThat(sql).startsWith("SELECT timestamp, hostname, app_name, severity, message");
        assertThat(sql).doesNotContain("raw");
    }

    @Test
    @DisplayName("Table, limit and span settings should be configurable")
    void shouldHonourSettings() {
        SqlCodeGenerator custom = new SqlCodeGenerator(new ClickHouseDialect(), "logs_v2", 50, Span.parse("5m"), registry);
        SqlCodeGenerator unlimited = new SqlCodeGenerator(new ClickHouseDialect(), "logs_v2", 0, Span.parse("5m"), registry);

        assertThat(custom.generate(resolve("search *")).getSql())
            .isEqualTo("SELECT * FROM logs_v2 ORDER BY timestamp DESC LIMIT 50");
        assertThat(unlimited.generate(resolve("search *")).getSql())
            .isEqualTo("SELECT * FROM logs_v2 ORDER BY timestamp DESC");
        assertThat(custom.generate(resolve("search * | timechart count")).getSql())
            .startsWith("SELECT toStartOfFiveMinutes(timestamp) AS time_bucket");

        assertThatThrownBy(() -> new SqlCodeGenerator(new ClickHouseDialect(), "logs", -1, Span.parse("5m"), registry))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SqlCodeGenerator(new ClickHouseDialect(), "logs", 10, Span.parse("100"), registry))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Spans beyond the supported width are parse errors at the span")
    void shouldRejectOversizedSpans() {
        assertThatThrownBy(() -> sql("search * | timechart span=100000000000000000000s count"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("is too large")
            .satisfies(e -> {
                ParseException error = (ParseException) e;
                assertThat(error.getStage()).isEqualTo(CompilePhase.PARSE);
                assertThat(error.getPosition()).isEqualTo(26);
            });

        assertThatThrownBy(() -> sql("search * | bin span=100000000000000000000m timestamp"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("is too large")
            .satisfies(e -> assertThat(((ParseException) e).getPosition()).isEqualTo(20));

        assertThat(sql("search * | timechart span=522w count"))
            .startsWith("SELECT toStartOfInterval(timestamp, INTERVAL 522 WEEK) AS time_bucket");
    }

    @Test
    @DisplayName("Constant eval fields should never be read as column positions")
    void shouldNotTreatConstantsAsColumnPositions() {
        // When
        String sorted = sql("search * | eval pri=2 | sort pri | head 3");
        String grouped = sql("search * | eval bucket=2 | stats count by bucket");
        String mixed = sql("search * | eval pri=2 | sort pri, -dest_port | head 3");

        // Then
        assertThat(sorted).endsWith("2 AS pri FROM lognog.logs ORDER BY timestamp DESC LIMIT 3");
        assertThat(grouped).isEqualTo("SELECT 2 AS bucket, count() AS count FROM lognog.logs GROUP BY '2'");
        assertThat(mixed).endsWith("ORDER BY dest_port DESC LIMIT 3");
        assertThat(sql("search * | eval one=1 | dedup one")).contains("LIMIT 1 BY '1'");
        assertThat(sql("search * | eval pri=2 | top pri")).isEqualTo(
            "SELECT 2 AS pri, count() AS count FROM lognog.logs GROUP BY '2' ORDER BY count DESC LIMIT 10");
    }

    @Test
    @DisplayName("Warnings from resolution should be carried to the result")
    void shouldCarryWarnings() {
        CompiledQuery compiled = generator.generate(resolve("search * | sort host | stats count"));

        assertThat(compiled.getSql()).isEqualTo("SELECT count() AS count FROM lognog.logs");
        assertThat(compiled.getWarnings()).hasSize(1);
    }
}
