package com.lognog.query.codegen;

import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.DslLexer;
import com.lognog.query.parser.DslParser;
import com.lognog.query.parser.ParseException;
import com.lognog.query.resolve.FieldResolver;
import com.lognog.query.schema.FieldSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SqliteDialect through SqlCodeGenerator
 */
@DisplayName("SqliteDialect Tests")
class SqliteDialectTest {

    private DslLexer lexer;
    private DslParser parser;
    private FieldResolver resolver;
    private SqlCodeGenerator generator;

    @BeforeEach
    void setUp() {
        FunctionRegistry registry = FunctionRegistry.standard();
        lexer = new DslLexer();
        parser = new DslParser(registry);
        resolver = new FieldResolver(registry);
        generator = new SqlCodeGenerator(new SqliteDialect(), registry);
    }

    private String sql(String query) {
        return generator.generate(
            resolver.resolve(parser.parse(lexer.tokenize(query)), FieldSchema.defaultLogSchema())).getSql();
    }

    @Test
    @DisplayName("Should read from the logs table")
    void shouldUseSqliteTable() {
        assertThat(sql("search *")).isEqualTo("SELECT * FROM logs ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Aggregations should use standard SQL")
    void shouldTranslateAggregations() {
        assertThat(sql("search * | stats count, dc(host) as hosts by app")).isEqualTo(
            "SELECT app_name, count(*) AS count, count(DISTINCT hostname) AS hosts FROM logs GROUP BY app_name");
    }

    @Test
    @DisplayName("Wildcards and contains should use LIKE and instr")
    void shouldTranslateMatching() {
        assertThat(sql("search host=web*")).contains("WHERE hostname LIKE 'web%' ESCAPE '\\'");
        assertThat(sql("search host=*")).contains("WHERE hostname IS NOT NULL");
        assertThat(sql("search timeout")).contains("WHERE instr(lower(raw), lower('timeout')) > 0");
    }

    @Test
    @DisplayName("Division should not truncate integers")
    void shouldDivideAsReal() {
        assertThat(sql("search * | eval kb=dest_port / 1024 | table kb"))
            .isEqualTo("SELECT (CAST(dest_port AS REAL) / 1024) AS kb FROM logs ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Booleans and conditionals should use integers and CASE")
    void shouldRenderBooleansAndConditionals() {
        assertThat(sql("search * | eval high=if(severity <= 3, true, false) | table high"))
            .startsWith("SELECT CASE WHEN (severity <= 3) THEN 1 ELSE 0 END AS high FROM logs");
        assertThat(sql("search * | eval tag=concat(host, \"-\", app) | table tag"))
            .startsWith("SELECT (hostname || '-' || app_name) AS tag FROM logs");
    }

    @Test
    @DisplayName("dedup should group by its keys")
    void shouldDedupWithGroupBy() {
        assertThat(sql("search * | dedup host"))
            .isEqualTo("SELECT * FROM logs GROUP BY hostname ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Time buckets should round epoch seconds")
    void shouldBucketTime() {
        assertThat(sql("search * | timechart count")).startsWith(
            "SELECT datetime((CAST(strftime('%s', timestamp) AS INTEGER) / 3600) * 3600, 'unixepoch') AS time_bucket, "
                + "count(*) AS count FROM logs GROUP BY");
    }

    @Test
    @DisplayName("The widest accepted span should keep a positive bucket width")
    void shouldBoundTimeSpans() {
        assertThat(sql("search * | timechart span=522w count"))
            .contains("/ 315705600) * 315705600, 'unixepoch') AS time_bucket");

        assertThatThrownBy(() -> sql("search * | timechart span=20000000000000w count"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("is too large; the maximum is 522w")
            .satisfies(e -> assertThat(((ParseException) e).getPosition()).isEqualTo(26));
    }

    @Test
    @DisplayName("Numeric bins should round down without floor()")
    void shouldBinNumbersWithoutFloor() {
        // When
        String sql = sql("search * | bin span=100 dest_port | stats count by dest_port");

        // Then
        assertThat(sql).startsWith("SELECT ((CAST((CAST(dest_port AS REAL) / 100) AS INTEGER) - "
            + "((CAST(dest_port AS REAL) / 100) < CAST((CAST(dest_port AS REAL) / 100) AS INTEGER))) * 100) "
            + "AS dest_port, count(*) AS count FROM logs");
        assertThat(sql).doesNotContain("floor(");
    }

    @Test
    @DisplayName("Constant eval fields should group as one value")
    void shouldGroupConstantsAsValues() {
        assertThat(sql("search * | eval bucket=2 | stats count by bucket"))
            .isEqualTo("SELECT 2 AS bucket, count(*) AS count FROM logs GROUP BY '2'");
        assertThat(sql("search * | eval one=1 | dedup one")).contains("GROUP BY '1'");
    }

    @Test
    @DisplayName("Should reject aggregations SQLite lacks")
    void shouldRejectUnsupportedAggregations() {
        assertThatThrownBy(() -> sql("search * | stats median(dest_port)"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("Aggregation 'median' is not supported by SQLite");

        assertThatThrownBy(() -> sql("search * | stats p95(dest_port)"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("Aggregation 'p95' is not supported by SQLite");
    }

    @Test
    @DisplayName("Should reject regular expressions and IP functions")
    void shouldRejectUnsupportedFunctions() {
        assertThatThrownBy(() -> sql("search * | rex field=message \"user=(?<username>\\w+)\" | table username"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("rex is not supported by SQLite");

        assertThatThrownBy(() -> sql("search * | eval internal=is_private_ip(source_ip) | table internal"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("is_private_ip(): IP functions are not available in SQLite");

        assertThatThrownBy(() -> sql("search * | eval get=match(message, \"^GET\") | table get"))
            .isInstanceOf(CodegenException.class)
            .hasMessageContaining("match(): regular expressions are not available in SQLite");
    }
}
