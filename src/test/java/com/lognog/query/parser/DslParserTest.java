package com.lognog.query.parser;

import com.lognog.query.CompilePhase;
import com.lognog.query.ast.Aggregation;
import com.lognog.query.ast.BinStage;
import com.lognog.query.ast.ComparisonPredicate;
import com.lognog.query.ast.ContainsPredicate;
import com.lognog.query.ast.FieldsStage;
import com.lognog.query.ast.FilterStage;
import com.lognog.query.ast.LimitStage;
import com.lognog.query.ast.NotPredicate;
import com.lognog.query.ast.OrPredicate;
import com.lognog.query.ast.Pipeline;
import com.lognog.query.ast.PredicateValue;
import com.lognog.query.ast.RexStage;
import com.lognog.query.ast.SortField;
import com.lognog.query.ast.SortStage;
import com.lognog.query.ast.Span;
import com.lognog.query.ast.SpanUnit;
import com.lognog.query.ast.StatsStage;
import com.lognog.query.ast.TimechartStage;
import com.lognog.query.ast.TopStage;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.expr.ExpressionException;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.DslLexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DslParser
 */
@DisplayName("DslParser Tests")
class DslParserTest {

    private DslLexer lexer;
    private DslParser parser;

    @BeforeEach
    void setUp() {
        lexer = new DslLexer();
        parser = new DslParser(FunctionRegistry.standard());
    }

    private Pipeline parse(String query) {
        return parser.parse(lexer.tokenize(query));
    }

    @Test
    @DisplayName("Should parse a search with implicit AND")
    void shouldParseImplicitAnd() {
        // When
        Pipeline pipeline = parse("search host=web01 severity<=3");

        // Then
        assertThat(pipeline.size()).isEqualTo(1);
        assertThat(pipeline.getSearch().getPredicate().toString())
            .isEqualTo("(host=\"web01\" AND severity<=3)");
    }

    @Test
    @DisplayName("Implicit AND should bind tighter than OR")
    void implicitAndShouldBindTighterThanOr() {
        // When
        Pipeline pipeline = parse("search a=1 b=2 OR c=3");

        // Then
        assertThat(pipeline.getSearch().getPredicate()).isInstanceOf(OrPredicate.class);
        assertThat(pipeline.getSearch().getPredicate().toString()).isEqualTo("((a=1 AND b=2) OR c=3)");
    }

    @Test
    @DisplayName("Parentheses and NOT should group terms")
    void shouldParseParenthesesAndNot() {
        // When
        Pipeline pipeline = parse("search NOT (app=nginx OR app=apache) severity>4");

        // Then
        assertThat(pipeline.getSearch().getPredicate().toString())
            .isEqualTo("(NOT (app=\"nginx\" OR app=\"apache\") AND severity>4)");
    }

    @Test
    @DisplayName("A query without a leading keyword is an implicit search")
    void shouldAcceptImplicitSearch() {
        Pipeline pipeline = parse("host=web01 | head 5");

        assertThat(pipeline.getSearch().getPredicate()).isInstanceOf(ComparisonPredicate.class);
        assertThat(pipeline.getStages().get(1)).isInstanceOf(LimitStage.class);
    }

    @Test
    @DisplayName("search * and an empty query match everything")
    void shouldMatchAll() {
        assertThat(parse("search *").getSearch().matchesAll()).isTrue();
        assertThat(parse("").getSearch().matchesAll()).isTrue();
        assertThat(parse("* error").getSearch().getPredicate()).isInstanceOf(ContainsPredicate.class);
    }

    @Test
    @DisplayName("Bare words and quoted strings search the raw message")
    void shouldTurnBareTermsIntoRawContains() {
        // When
        Pipeline pipeline = parse("search timeout \"connection refused\"");

        // Then
        assertThat(pipeline.getSearch().getPredicate().toString())
            .isEqualTo("(_raw~\"timeout\" AND _raw~\"connection refused\")");
    }

    @Test
    @DisplayName("Should classify wildcard values")
    void shouldClassifyWildcards() {
        assertThat(wildcardOf("search host=web*").getShape()).isEqualTo(WildcardPattern.Shape.PREFIX);
        assertThat(wildcardOf("search host=*web").getShape()).isEqualTo(WildcardPattern.Shape.SUFFIX);
        assertThat(wildcardOf("search host=*web*").getShape()).isEqualTo(WildcardPattern.Shape.GENERAL);
        assertThat(wildcardOf("search host=w*b").getShape()).isEqualTo(WildcardPattern.Shape.GENERAL);
        assertThat(wildcardOf("search host=*").getShape()).isEqualTo(WildcardPattern.Shape.MATCH_ALL);
        assertThat(wildcardOf("search host=web-01*").getPattern()).isEqualTo("web-01*");
    }

    private WildcardPattern wildcardOf(String query) {
        PredicateValue value = ((ComparisonPredicate) parse(query).getSearch().getPredicate()).getValue();
        assertThat(value.getKind()).isEqualTo(PredicateValue.Kind.WILDCARD);
        return value.getWildcard();
    }

    @Test
    @DisplayName("A spaced arithmetic operator makes the value an expression")
    void shouldParseExpressionValues() {
        ComparisonPredicate predicate = (ComparisonPredicate) parse("search bytes > 1024 * 4").getSearch().getPredicate();

        assertThat(predicate.getValue().getKind()).isEqualTo(PredicateValue.Kind.EXPRESSION);
        assertThat(predicate.getValue().getExpression().toString()).isEqualTo("(1024 * 4)");
    }

    @Test
    @DisplayName("Should parse stats with default and explicit aliases")
    void shouldParseStats() {
        // When
        StatsStage stats = (StatsStage) parse("search * | stats count, sum(bytes), avg(bytes) as mean_bytes, p95(latency) by host")
            .getStages().get(1);

        // Then
        assertThat(stats.getAggregations()).extracting(Aggregation::getAlias)
            .containsExactly("count", "sum_bytes", "mean_bytes", "p95_latency");
        assertThat(stats.getAggregations().get(3).getFunction()).isEqualTo(AggregationFunction.PERCENTILE);
        assertThat(stats.getAggregations().get(3).getPercentile()).isEqualTo(95);
        assertThat(stats.getGroupBy()).extracting(Object::toString).containsExactly("host");
    }

    @Test
    @DisplayName("An aggregation over an expression needs an alias")
    void shouldRequireAliasForExpressionArgument() {
        assertThatThrownBy(() -> parse("search * | stats sum(bytes * 2)"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("as <name>");

        StatsStage stats = (StatsStage) parse("search * | stats sum(bytes * 2) as doubled").getStages().get(1);
        assertThat(stats.getAggregations().get(0).getAlias()).isEqualTo("doubled");
    }

    @Test
    @DisplayName("Should reject unknown aggregations and missing arguments")
    void shouldRejectBadAggregations() {
        assertThatThrownBy(() -> parse("search * | stats total(bytes)"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Unknown aggregation function 'total'");

        assertThatThrownBy(() -> parse("search * | stats sum"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("needs a field");
    }

    @Test
    @DisplayName("Should parse sort directions")
    void shouldParseSortDirections() {
        SortStage prefix = (SortStage) parse("search * | sort -count, +host").getStages().get(1);
        assertThat(prefix.getKeys().get(0).isDescending()).isTrue();
        assertThat(prefix.getKeys().get(1).isDescending()).isFalse();

        SortStage leading = (SortStage) parse("search * | sort desc count").getStages().get(1);
        assertThat(leading.getKeys()).hasSize(1);
        assertThat(leading.getKeys().get(0).getField().getName()).isEqualTo("count");
        assertThat(leading.getKeys().get(0).isDescending()).isTrue();

        SortStage trailing = (SortStage) parse("search * | sort host asc, count desc").getStages().get(1);
        assertThat(trailing.getKeys()).extracting(SortField::isDescending).containsExactly(false, true);
    }

    @Test
    @DisplayName("limit, head and tail default to 10 rows")
    void shouldDefaultLimits() {
        Pipeline pipeline = parse("search * | head | limit 5 | tail");

        assertThat(((LimitStage) pipeline.getStages().get(1)).getCount()).isEqualTo(10);
        assertThat(((LimitStage) pipeline.getStages().get(2)).getCount()).isEqualTo(5);
        assertThat(((LimitStage) pipeline.getStages().get(3)).isTail()).isTrue();
        assertThat(((LimitStage) pipeline.getStages().get(3)).getCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject a zero or negative limit")
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> parse("search * | limit 0"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("positive whole number");
    }

    @Test
    @DisplayName("Should parse top, rare, bin and timechart options")
    void shouldParseOptions() {
        TopStage top = (TopStage) parse("search * | top limit=3 host").getStages().get(1);
        assertThat(top.getLimit()).isEqualTo(3);
        assertThat(top.isRare()).isFalse();

        TopStage rare = (TopStage) parse("search * | rare app").getStages().get(1);
        assertThat(rare.isRare()).isTrue();
        assertThat(rare.getLimit()).isEqualTo(10);

        BinStage bin = (BinStage) parse("search * | bin span=5m timestamp as bucket").getStages().get(1);
        assertThat(bin.getSpan()).isEqualTo(new Span(BigDecimal.valueOf(5), SpanUnit.MINUTE));
        assertThat(bin.getOutputName()).isEqualTo("bucket");

        TimechartStage chart = (TimechartStage) parse("search * | timechart span=1h count by host").getStages().get(1);
        assertThat(chart.getSpan().toSeconds()).isEqualTo(3600);
        assertThat(chart.getGroupBy()).extracting(Object::toString).containsExactly("host");
    }

    @Test
    @DisplayName("Should parse fields include and exclude")
    void shouldParseFields() {
        FieldsStage exclude = (FieldsStage) parse("search * | fields - raw, structured_data").getStages().get(1);
        assertThat(exclude.getMode()).isEqualTo(FieldsStage.Mode.EXCLUDE);
        assertThat(exclude.getFields()).hasSize(2);

        FieldsStage include = (FieldsStage) parse("search * | fields host message").getStages().get(1);
        assertThat(include.getMode()).isEqualTo(FieldsStage.Mode.INCLUDE);
    }

    @Test
    @DisplayName("rex should default to _raw and collect named groups")
    void shouldParseRex() {
        RexStage rex = (RexStage) parse("search * | rex \"user=(?<username>\\w+) from (?P<client>[0-9.]+)\"")
            .getStages().get(1);

        assertThat(rex.getField().getName()).isEqualTo(ContainsPredicate.RAW_FIELD);
        assertThat(rex.getPattern().getFieldNames()).containsExactly("username", "client");
        assertThat(rex.getPattern().getPositionalPattern()).isEqualTo("user=(\\w+) from ([0-9.]+)");
    }

    @Test
    @DisplayName("rex without named groups is a parse error")
    void shouldRejectRexWithoutNamedGroups() {
        assertThatThrownBy(() -> parse("search * | rex field=message \"user=(\\w+)\""))
            .isInstanceOf(ParseException.class)
            .satisfies(e -> {
                ParseException error = (ParseException) e;
                assertThat(error.getStage()).isEqualTo(CompilePhase.PARSE);
                assertThat(error.getReason()).isNotBlank().contains("named capture group");
                assertThat(error.getPosition()).isEqualTo(29);
            });
    }

    @Test
    @DisplayName("A query must start with a search")
    void shouldRejectNonSearchFirstStage() {
        assertThatThrownBy(() -> parse("stats count"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("must start with a search");
    }

    @Test
    @DisplayName("Unknown commands list the valid ones")
    void shouldRejectUnknownCommand() {
        assertThatThrownBy(() -> parse("search * | frobnicate x"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Unknown command 'frobnicate'")
            .hasMessageContaining("timechart")
            .satisfies(e -> assertThat(((ParseException) e).getPosition()).isEqualTo(11));
    }

    @Test
    @DisplayName("NOT * can match nothing and is rejected")
    void shouldRejectNotMatchAll() {
        assertThatThrownBy(() -> parse("search NOT *"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("NOT *");
    }

    @Test
    @DisplayName("Should reject a dangling pipe and trailing garbage")
    void shouldRejectMalformedPipes() {
        assertThatThrownBy(() -> parse("search * |"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Expected a command after '|'");

        assertThatThrownBy(() -> parse("search * | head 5 )"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Expected '|' or end of query");
    }

    @Test
    @DisplayName("A filter that matches everything is dropped")
    void shouldDropMatchAllFilter() {
        Pipeline pipeline = parse("search host=a | search * | where severity<3");

        assertThat(pipeline.size()).isEqualTo(2);
        assertThat(pipeline.getStages().get(1)).isInstanceOf(FilterStage.class);
    }

    @Test
    @DisplayName("Unknown functions in eval are expression errors")
    void shouldRejectUnknownFunction() {
        assertThatThrownBy(() -> parse("search * | eval x=frob(bytes)"))
            .isInstanceOf(ExpressionException.class)
            .satisfies(e -> assertThat(((ExpressionException) e).getStage()).isEqualTo(CompilePhase.EXPR));
    }

    @Test
    @DisplayName("NOT should wrap single terms")
    void shouldWrapSingleTermInNot() {
        assertThat(parse("search NOT app=nginx").getSearch().getPredicate()).isInstanceOf(NotPredicate.class);
    }
}
