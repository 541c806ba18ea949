package com.lognog.query.parser;

import com.lognog.query.ast.Aggregation;
import com.lognog.query.ast.Assignment;
import com.lognog.query.ast.BinStage;
import com.lognog.query.ast.ContainsPredicate;
import com.lognog.query.ast.DedupStage;
import com.lognog.query.ast.EvalStage;
import com.lognog.query.ast.FieldName;
import com.lognog.query.ast.FieldsStage;
import com.lognog.query.ast.FilterStage;
import com.lognog.query.ast.LimitStage;
import com.lognog.query.ast.Pipeline;
import com.lognog.query.ast.Predicate;
import com.lognog.query.ast.RenamePair;
import com.lognog.query.ast.RenameStage;
import com.lognog.query.ast.RexPattern;
import com.lognog.query.ast.RexStage;
import com.lognog.query.ast.SearchStage;
import com.lognog.query.ast.SortField;
import com.lognog.query.ast.SortStage;
import com.lognog.query.ast.Span;
import com.lognog.query.ast.Stage;
import com.lognog.query.ast.StatsStage;
import com.lognog.query.ast.TableStage;
import com.lognog.query.ast.TimechartStage;
import com.lognog.query.ast.TopStage;
import com.lognog.query.expr.Expression;
import com.lognog.query.expr.ExpressionParser;
import com.lognog.query.expr.FieldRefExpression;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.lexer.Token;
import com.lognog.query.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses one token stream. Each stage keyword dispatches to its own
 * sub-parser; a stage that filters nothing ({@code | search *}) is dropped.
 */
class PipelineParser {

    private final TokenCursor cursor;
    private final ExpressionParser expressions;
    private final PredicateParser predicates;

    PipelineParser(TokenCursor cursor, ExpressionParser expressions) {
        this.cursor = cursor;
        this.expressions = expressions;
        this.predicates = new PredicateParser(cursor, expressions);
    }

    Pipeline parse() {
        List<Stage> stages = new ArrayList<>();
        stages.add(parseLeadingSearch());
        while (cursor.match(TokenType.PIPE)) {
            if (cursor.isAtEnd() || cursor.check(TokenType.PIPE)) {
                throw cursor.error("Expected a command after '|'");
            }
            Stage stage = parseStage();
            if (stage != null) {
                stages.add(stage);
            }
        }
        if (!cursor.isAtEnd()) {
            throw cursor.error("Expected '|' or end of query");
        }
        return new Pipeline(stages);
    }

    private SearchStage parseLeadingSearch() {
        Token first = cursor.peek();
        if (first.is(TokenType.IDENTIFIER) && !startsFieldTerm()) {
            Command command = Command.fromKeyword(first.getText());
            if (command == Command.SEARCH) {
                cursor.advance();
            } else if (command != null) {
                throw new ParseException("A query must start with a search; put '" + command.getKeyword()
                    + "' after one, e.g. 'search * | " + command.getKeyword() + " ...'", first.getPosition());
            }
        }
        if (cursor.isAtEnd() || cursor.check(TokenType.PIPE)) {
            return new SearchStage(null, first.getPosition());
        }
        return new SearchStage(predicates.parse(), first.getPosition());
    }

    private boolean startsFieldTerm() {
        TokenType next = cursor.peek(1).getType();
        return next.isComparison() || next == TokenType.CONTAINS;
    }

    private Stage parseStage() {
        Token keyword = cursor.peek();
        if (!keyword.is(TokenType.IDENTIFIER)) {
            throw cursor.error("Expected a command");
        }
        Command command = Command.fromKeyword(keyword.getText());
        if (command == null) {
            throw new ParseException("Unknown command '" + keyword.getText() + "'; expected one of: "
                + Command.keywords(), keyword.getPosition());
        }
        cursor.advance();
        int position = keyword.getPosition();
        return switch (command) {
            case SEARCH, FILTER, WHERE -> parseFilter(command, position);
            case STATS -> parseStats(position);
            case EVAL -> parseEval(position);
            case TABLE -> new TableStage(parseFieldList("table"), position);
            case FIELDS -> parseFields(position);
            case RENAME -> parseRename(position);
            case DEDUP -> new DedupStage(parseFieldList("dedup"), position);
            case SORT -> parseSort(position);
            case LIMIT -> parseLimit(LimitStage.Kind.LIMIT, position);
            case HEAD -> parseLimit(LimitStage.Kind.HEAD, position);
            case TAIL -> parseLimit(LimitStage.Kind.TAIL, position);
            case TOP -> parseTop(false, position);
            case RARE -> parseTop(true, position);
            case BIN -> parseBin(position);
            case TIMECHART -> parseTimechart(position);
            case REX -> parseRex(position);
        };
    }

    private Stage parseFilter(Command command, int position) {
        if (!predicates.atTermStart()) {
            throw cursor.error("Expected a condition after '" + command.getKeyword() + "'");
        }
        Predicate predicate = predicates.parse();
        return predicate == null ? null : new FilterStage(command.getKeyword(), predicate, position);
    }

    private StatsStage parseStats(int position) {
        List<Aggregation> aggregations = parseAggregations("stats");
        return new StatsStage(aggregations, parseGroupBy(), position);
    }

    private TimechartStage parseTimechart(int position) {
        Span span = null;
        if (atOption("span")) {
            span = parseSpanOption();
        }
        List<Aggregation> aggregations = parseAggregations("timechart");
        List<FieldName> groupBy = parseGroupBy();
        return new TimechartStage(span, aggregations, groupBy, position);
    }

    private List<Aggregation> parseAggregations(String command) {
        if (!cursor.check(TokenType.IDENTIFIER) || cursor.checkWord("by")) {
            throw cursor.error("Expected an aggregation after '" + command + "'");
        }
        List<Aggregation> aggregations = new ArrayList<>();
        do {
            aggregations.add(parseAggregation());
            cursor.match(TokenType.COMMA);
        } while (cursor.check(TokenType.IDENTIFIER) && !cursor.checkWord("by"));
        return aggregations;
    }

    private Aggregation parseAggregation() {
        Token nameToken = cursor.expect(TokenType.IDENTIFIER, "an aggregation function");
        String name = nameToken.getText().toLowerCase(Locale.ROOT);
        AggregationFunction function = AggregationFunction.lookup(name);
        if (function == null) {
            throw new ParseException("Unknown aggregation function '" + nameToken.getText()
                + "'; expected count, dc, sum, avg, min, max, median, mode, stddev, variance, range, "
                + "values, list, first, last, earliest, latest or pN", nameToken.getPosition());
        }
        Expression argument = null;
        if (cursor.match(TokenType.LPAREN)) {
            if (!(function == AggregationFunction.COUNT && cursor.check(TokenType.RPAREN))) {
                argument = expressions.parse(cursor);
            }
            cursor.expect(TokenType.RPAREN, "')'");
        }
        if (argument == null && function.isArgumentRequired()) {
            throw new ParseException("Aggregation '" + name + "' needs a field, e.g. " + name + "(bytes)",
                nameToken.getPosition());
        }

        String alias;
        if (cursor.matchWord("as")) {
            alias = cursor.expect(TokenType.IDENTIFIER, "an alias after 'as'").getText();
        } else if (argument == null) {
            alias = name;
        } else if (argument instanceof FieldRefExpression) {
            alias = name + "_" + ((FieldRefExpression) argument).getName();
        } else {
            throw new ParseException("Aggregation '" + name + "' over an expression needs an alias: add 'as <name>'",
                nameToken.getPosition());
        }
        Integer percentile = function == AggregationFunction.PERCENTILE ? AggregationFunction.percentileOf(name) : null;
        return new Aggregation(name, function, percentile, argument, alias, nameToken.getPosition());
    }

    private List<FieldName> parseGroupBy() {
        if (cursor.matchWord("by")) {
            return parseFieldList("by");
        }
        return List.of();
    }

    private EvalStage parseEval(int position) {
        List<Assignment> assignments = new ArrayList<>();
        do {
            Token target = cursor.expect(TokenType.IDENTIFIER, "a field name to assign");
            cursor.expect(TokenType.EQUALS, "'=' after '" + target.getText() + "'");
            Expression expression = expressions.parse(cursor);
            assignments.add(new Assignment(new FieldName(target.getText(), target.getPosition()), expression));
        } while (cursor.match(TokenType.COMMA));
        return new EvalStage(assignments, position);
    }

    private FieldsStage parseFields(int position) {
        FieldsStage.Mode mode = FieldsStage.Mode.INCLUDE;
        if (cursor.match(TokenType.MINUS)) {
            mode = FieldsStage.Mode.EXCLUDE;
        } else {
            cursor.match(TokenType.PLUS);
        }
        return new FieldsStage(mode, parseFieldList("fields"), position);
    }

    private RenameStage parseRename(int position) {
        List<RenamePair> pairs = new ArrayList<>();
        do {
            FieldName from = parseFieldName("a field to rename");
            cursor.expectWord("as");
            Token to = cursor.expect(TokenType.IDENTIFIER, "the new field name");
            pairs.add(new RenamePair(from, new FieldName(to.getText(), to.getPosition())));
            cursor.match(TokenType.COMMA);
        } while (cursor.check(TokenType.IDENTIFIER));
        return new RenameStage(pairs, position);
    }

    private SortStage parseSort(int position) {
        boolean descendingByDefault = false;
        if ((cursor.checkWord("asc") || cursor.checkWord("desc")) && startsSortKey(cursor.peek(1))) {
            descendingByDefault = cursor.advance().isWord("desc");
        }
        List<SortField> keys = new ArrayList<>();
        do {
            boolean descending = descendingByDefault;
            if (cursor.match(TokenType.MINUS)) {
                descending = true;
            } else if (cursor.match(TokenType.PLUS)) {
                descending = false;
            }
            FieldName field = parseFieldName("a field to sort by");
            if (cursor.matchWord("desc")) {
                descending = true;
            } else if (cursor.matchWord("asc")) {
                descending = false;
            }
            keys.add(new SortField(field, descending));
            cursor.match(TokenType.COMMA);
        } while (startsSortKey(cursor.peek()));
        return new SortStage(keys, position);
    }

    private static boolean startsSortKey(Token token) {
        return token.is(TokenType.IDENTIFIER) || token.is(TokenType.MINUS) || token.is(TokenType.PLUS);
    }

    private LimitStage parseLimit(LimitStage.Kind kind, int position) {
        long count = LimitStage.DEFAULT_COUNT;
        if (cursor.check(TokenType.NUMBER)) {
            count = parseCount(cursor.advance());
        } else if (atOption("limit")) {
            count = parseLimitOption();
        }
        return new LimitStage(kind, count, position);
    }

    private TopStage parseTop(boolean rare, int position) {
        long limit = TopStage.DEFAULT_LIMIT;
        if (cursor.check(TokenType.NUMBER)) {
            limit = parseCount(cursor.advance());
        } else if (atOption("limit")) {
            limit = parseLimitOption();
        }
        FieldName field = parseFieldName("a field after '" + (rare ? "rare" : "top") + "'");
        if (atOption("limit")) {
            limit = parseLimitOption();
        }
        return new TopStage(rare, limit, field, position);
    }

    private long parseLimitOption() {
        cursor.advance();
        cursor.advance();
        return parseCount(cursor.expect(TokenType.NUMBER, "a number after 'limit='"));
    }

    private BinStage parseBin(int position) {
        Span span = null;
        FieldName field = null;
        while (span == null || field == null) {
            if (span == null && atOption("span")) {
                span = parseSpanOption();
            } else if (field == null && cursor.check(TokenType.IDENTIFIER)) {
                field = parseFieldName("a field to bin");
            } else if (span == null) {
                throw cursor.error("Expected span=<n>[s|m|h|d|w]");
            } else {
                throw cursor.error("Expected a field to bin");
            }
        }
        FieldName alias = null;
        if (cursor.matchWord("as")) {
            Token aliasToken = cursor.expect(TokenType.IDENTIFIER, "an alias after 'as'");
            alias = new FieldName(aliasToken.getText(), aliasToken.getPosition());
        }
        return new BinStage(span, field, alias, position);
    }

    private RexStage parseRex(int position) {
        FieldName field = new FieldName(ContainsPredicate.RAW_FIELD, position);
        if (atOption("field")) {
            cursor.advance();
            cursor.advance();
            field = parseFieldName("a field after 'field='");
        }
        Token pattern = cursor.expect(TokenType.STRING, "a quoted regular expression");
        try {
            return new RexStage(field, RexPattern.of(pattern.getText()), position);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), pattern.getPosition());
        }
    }

    /**
     * True at {@code name=}.
     */
    private boolean atOption(String name) {
        return cursor.checkWord(name) && cursor.peek(1).is(TokenType.EQUALS);
    }

    private Span parseSpanOption() {
        cursor.advance();
        cursor.advance();
        Token value = cursor.peek();
        if (!value.is(TokenType.NUMBER) && !value.is(TokenType.IDENTIFIER)) {
            throw cursor.error("Expected a span such as 5m, 1h or 100");
        }
        cursor.advance();
        try {
            return Span.parse(value.getText());
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), value.getPosition());
        }
    }

    private List<FieldName> parseFieldList(String context) {
        List<FieldName> fields = new ArrayList<>();
        do {
            fields.add(parseFieldName("a field name after '" + context + "'"));
            cursor.match(TokenType.COMMA);
        } while (cursor.check(TokenType.IDENTIFIER));
        return fields;
    }

    private FieldName parseFieldName(String expectation) {
        Token token = cursor.expect(TokenType.IDENTIFIER, expectation);
        return new FieldName(token.getText(), token.getPosition());
    }

    private static long parseCount(Token token) {
        String text = token.getText();
        if (text.matches("\\d{1,18}")) {
            long count = Long.parseLong(text);
            if (count > 0) {
                return count;
            }
        }
        throw new ParseException("Expected a positive whole number but found '" + text + "'", token.getPosition());
    }
}
