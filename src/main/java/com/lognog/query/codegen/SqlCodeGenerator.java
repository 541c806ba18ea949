package com.lognog.query.codegen;

import com.lognog.query.CompiledQuery;
import com.lognog.query.OutputColumn;
import com.lognog.query.TimeRange;
import com.lognog.query.ast.Aggregation;
import com.lognog.query.ast.AndPredicate;
import com.lognog.query.ast.Assignment;
import com.lognog.query.ast.BinStage;
import com.lognog.query.ast.ComparisonOperator;
import com.lognog.query.ast.ComparisonPredicate;
import com.lognog.query.ast.ContainsPredicate;
import com.lognog.query.ast.DedupStage;
import com.lognog.query.ast.EvalStage;
import com.lognog.query.ast.FieldName;
import com.lognog.query.ast.FieldsStage;
import com.lognog.query.ast.FilterStage;
import com.lognog.query.ast.LimitStage;
import com.lognog.query.ast.NotPredicate;
import com.lognog.query.ast.OrPredicate;
import com.lognog.query.ast.Predicate;
import com.lognog.query.ast.PredicateValue;
import com.lognog.query.ast.PredicateVisitor;
import com.lognog.query.ast.RenamePair;
import com.lognog.query.ast.RenameStage;
import com.lognog.query.ast.RexPattern;
import com.lognog.query.ast.RexStage;
import com.lognog.query.ast.SearchStage;
import com.lognog.query.ast.SortField;
import com.lognog.query.ast.SortStage;
import com.lognog.query.ast.Span;
import com.lognog.query.ast.Stage;
import com.lognog.query.ast.StageVisitor;
import com.lognog.query.ast.StatsStage;
import com.lognog.query.ast.TableStage;
import com.lognog.query.ast.TimechartStage;
import com.lognog.query.ast.TopStage;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.expr.BinaryExpression;
import com.lognog.query.expr.BinaryOperator;
import com.lognog.query.expr.ConditionalExpression;
import com.lognog.query.expr.Expression;
import com.lognog.query.expr.ExpressionVisitor;
import com.lognog.query.expr.FieldRefExpression;
import com.lognog.query.expr.FunctionCallExpression;
import com.lognog.query.expr.LiteralExpression;
import com.lognog.query.expr.UnaryExpression;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.function.CodegenStrategy;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.function.FunctionSpec;
import com.lognog.query.resolve.FieldScope;
import com.lognog.query.resolve.ResolvedPipeline;
import com.lognog.query.schema.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Emits SQL for a resolved pipeline.
 *
 * Stages fold into one SELECT for as long as SQL evaluation order allows:
 * filters merge into WHERE (or HAVING after an aggregation), eval, rex and
 * bin fields are inlined where referenced. A stage that would change the
 * meaning of the block, such as an aggregation after a limit, wraps it in a
 * subquery first.
 */
public class SqlCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SqlCodeGenerator.class);

    public static final long DEFAULT_LIMIT = 1000L;
    public static final Span DEFAULT_TIMECHART_SPAN = Span.parse("1h");

    private final SqlDialect dialect;
    private final String table;
    private final long defaultLimit;
    private final Span defaultSpan;
    private final FunctionRegistry functionRegistry;

    public SqlCodeGenerator(SqlDialect dialect, FunctionRegistry functionRegistry) {
        this(dialect, dialect.getDefaultTable(), DEFAULT_LIMIT, DEFAULT_TIMECHART_SPAN, functionRegistry);
    }

    /**
     * @param defaultLimit limit applied to raw searches without one; 0 disables it
     */
    public SqlCodeGenerator(SqlDialect dialect, String table, long defaultLimit, Span defaultSpan,
                            FunctionRegistry functionRegistry) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.table = Objects.requireNonNull(table, "table");
        this.defaultLimit = defaultLimit;
        this.defaultSpan = Objects.requireNonNull(defaultSpan, "defaultSpan");
        this.functionRegistry = Objects.requireNonNull(functionRegistry, "functionRegistry");
        if (defaultLimit < 0) {
            throw new IllegalArgumentException("Default limit must not be negative: " + defaultLimit);
        }
        if (!defaultSpan.isTimeSpan()) {
            throw new IllegalArgumentException("Default timechart span needs a time unit: " + defaultSpan);
        }
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public CompiledQuery generate(ResolvedPipeline pipeline) {
        return generate(pipeline, null);
    }

    /**
     * @param timeRange optional bounds on the timestamp, applied to the innermost query
     * @throws CodegenException when the dialect cannot express a stage or a
     *                          field has no SQL at the point it is used
     */
    public CompiledQuery generate(ResolvedPipeline pipeline, TimeRange timeRange) {
        String sql = new Generation(pipeline, timeRange).run();

        List<OutputColumn> columns = new ArrayList<>();
        for (Map.Entry<String, FieldType> field : pipeline.getOutputScope().asMap().entrySet()) {
            columns.add(new OutputColumn(field.getKey(), field.getValue()));
        }
        logger.trace("Generated {} SQL: {}", dialect.getName(), sql);
        return new CompiledQuery(sql, columns, pipeline.getWarnings());
    }

    /**
     * Per-call state: the block being built and the scope in front of the
     * current stage.
     */
    private final class Generation implements StageVisitor<Void> {

        private final ResolvedPipeline pipeline;
        private final TimeRange timeRange;
        private final String timestampField;
        private QueryBlock block;
        private FieldScope scope;
        private int position;

        Generation(ResolvedPipeline pipeline, TimeRange timeRange) {
            this.pipeline = pipeline;
            this.timeRange = timeRange;
            this.timestampField = pipeline.getSchema().getTimestampField();
        }

        String run() {
            scope = pipeline.getInitialScope();
            block = QueryBlock.overTable(table, scope.names(), dialect);
            if (timeRange != null) {
                String timestamp = dialect.quoteIdentifier(timestampField);
                block.where.add(timestamp + " >= " + dialect.datetimeLiteral(timeRange.getEarliest()));
                block.where.add(timestamp + " <= " + dialect.datetimeLiteral(timeRange.getLatest()));
            }

            List<Stage> stages = pipeline.getStages();
            for (int i = 0; i < stages.size(); i++) {
                scope = i == 0 ? pipeline.getInitialScope() : pipeline.getScopeAfter(i - 1);
                position = stages.get(i).getPosition();
                stages.get(i).accept(this);
            }

            FieldScope output = pipeline.getOutputScope();
            applyDefaultOrder(true);
            if (!block.aggregated && !block.isBounded() && block.limit == null && defaultLimit > 0) {
                block.limit = defaultLimit;
            }
            return block.toSql(output, dialect);
        }

        @Override
        public Void visitSearch(SearchStage stage) {
            if (!stage.matchesAll()) {
                block.addFilter(predicate(stage.getPredicate()));
            }
            return null;
        }

        @Override
        public Void visitFilter(FilterStage stage) {
            if (block.isLimitedOrDeduplicated()) {
                seal();
            }
            block.addFilter(predicate(stage.getPredicate()));
            return null;
        }

        @Override
        public Void visitStats(StatsStage stage) {
            sealBeforeAggregation();
            aggregate(null, stage.getGroupBy(), stage.getAggregations());
            return null;
        }

        @Override
        public Void visitEval(EvalStage stage) {
            for (Assignment assignment : stage.getAssignments()) {
                // later assignments see earlier ones
                block.bindings.put(assignment.getTarget().getName(), expression(assignment.getExpression()));
            }
            return null;
        }

        @Override
        public Void visitTable(TableStage stage) {
            // the output scope alone decides the selected columns
            return null;
        }

        @Override
        public Void visitFields(FieldsStage stage) {
            return null;
        }

        @Override
        public Void visitRename(RenameStage stage) {
            for (RenamePair pair : stage.getPairs()) {
                String from = pair.getFrom().getName();
                String to = pair.getTo().getName();
                block.bindings.put(to, binding(from));
                block.bindings.remove(from);
                block.renameOrder(from, to);
            }
            return null;
        }

        @Override
        public Void visitDedup(DedupStage stage) {
            if (block.aggregated || block.isLimitedOrDeduplicated()) {
                seal();
            }
            for (FieldName field : stage.getFields()) {
                block.dedupKeys.add(groupKey(binding(field.getName())));
            }
            return null;
        }

        @Override
        public Void visitSort(SortStage stage) {
            if (block.isLimitedOrDeduplicated()) {
                seal();
            }
            block.orderBy.clear();
            for (SortField key : stage.getKeys()) {
                String name = key.getField().getName();
                String sql = binding(name);
                if (QueryBlock.isNumericLiteral(sql)) {
                    // same value on every row
                    continue;
                }
                block.orderBy.add(new QueryBlock.OrderTerm(name, sql, key.isDescending()));
            }
            return null;
        }

        @Override
        public Void visitLimit(LimitStage stage) {
            if (!stage.isTail()) {
                block.limit = block.limit == null ? stage.getCount() : Math.min(block.limit, stage.getCount());
                return null;
            }
            if (block.isLimitedOrDeduplicated()) {
                seal();
            }
            List<QueryBlock.OrderTerm> order = effectiveOrder();
            if (order.isEmpty()) {
                throw new CodegenException("tail needs a defined row order here; add a sort before tail", position);
            }
            List<QueryBlock.OrderTerm> inverted = new ArrayList<>(order.size());
            for (QueryBlock.OrderTerm term : order) {
                inverted.add(term.inverted());
            }
            block.orderBy.clear();
            block.orderBy.addAll(inverted);
            block.limit = stage.getCount();
            return null;
        }

        @Override
        public Void visitTop(TopStage stage) {
            sealBeforeAggregation();
            String field = stage.getField().getName();
            String fieldSql = binding(field);
            String count = dialect.aggregate(AggregationFunction.COUNT, null, null, null, position);
            block.bindings.clear();
            block.bindings.put(field, fieldSql);
            block.bindings.put(TopStage.COUNT_FIELD, count);
            block.groupBy.add(groupKey(fieldSql));
            block.aggregated = true;
            block.orderBy.clear();
            block.orderBy.add(new QueryBlock.OrderTerm(TopStage.COUNT_FIELD, count, !stage.isRare()));
            block.limit = stage.getLimit();
            return null;
        }

        @Override
        public Void visitBin(BinStage stage) {
            String column = binding(stage.getField().getName());
            Span span = stage.getSpan();
            String bucket;
            if (span.isTimeSpan()) {
                bucket = dialect.timeBucket(column, span);
            } else {
                bucket = dialect.numericBucket(column, span.getAmount().toPlainString());
            }
            block.bindings.put(stage.getOutputName(), bucket);
            return null;
        }

        @Override
        public Void visitTimechart(TimechartStage stage) {
            sealBeforeAggregation();
            Span span = stage.getSpan() != null ? stage.getSpan() : defaultSpan;
            String bucket = dialect.timeBucket(binding(timestampField), span);
            aggregate(bucket, stage.getGroupBy(), stage.getAggregations());
            block.orderBy.add(new QueryBlock.OrderTerm(TimechartStage.BUCKET_FIELD, bucket, false));
            return null;
        }

        @Override
        public Void visitRex(RexStage stage) {
            String source = binding(stage.getField().getName());
            RexPattern pattern = stage.getPattern();
            for (RexPattern.Group group : pattern.getGroups()) {
                block.bindings.put(group.getName(),
                    dialect.extractGroup(source, pattern.getPositionalPattern(), group.getIndex(), position));
            }
            return null;
        }

        /**
         * Turn the block into a grouped one. {@code bucket}, when given, is
         * the first group key under the name {@code time_bucket}.
         */
        private void aggregate(String bucket, List<FieldName> groupBy, List<Aggregation> aggregations) {
            Map<String, String> output = new LinkedHashMap<>();
            List<String> keys = new ArrayList<>();
            if (bucket != null) {
                output.put(TimechartStage.BUCKET_FIELD, bucket);
                keys.add(bucket);
            }
            for (FieldName field : groupBy) {
                String sql = binding(field.getName());
                output.put(field.getName(), sql);
                keys.add(groupKey(sql));
            }
            String timestamp = block.bindings.get(timestampField);
            for (Aggregation aggregation : aggregations) {
                String argument = aggregation.getArgument() == null ? null : expression(aggregation.getArgument());
                output.put(aggregation.getAlias(), dialect.aggregate(aggregation.getFunction(),
                    aggregation.getPercentile(), argument, timestamp, aggregation.getPosition()));
            }
            block.bindings.clear();
            block.bindings.putAll(output);
            block.groupBy.addAll(keys);
            block.aggregated = true;
            block.orderBy.clear();
        }

        /**
         * A constant key groups every row together; as a string it cannot be
         * read as a column position.
         */
        private String groupKey(String sql) {
            return QueryBlock.isNumericLiteral(sql) ? dialect.quoteString(sql) : sql;
        }

        private void sealBeforeAggregation() {
            if (block.aggregated || block.isLimitedOrDeduplicated()) {
                seal();
            }
        }

        /**
         * Close the current block over the scope in front of the current
         * stage and continue in a block that reads from it. Its order carries
         * over for the fields still visible.
         */
        private void seal() {
            applyDefaultOrder(false);
            String inner = block.toSql(scope, dialect);
            boolean bounded = block.aggregated || block.limit != null || block.isBounded();
            List<QueryBlock.OrderTerm> carried = new ArrayList<>();
            for (QueryBlock.OrderTerm term : block.orderBy) {
                if (term.getName() != null && scope.contains(term.getName())) {
                    carried.add(new QueryBlock.OrderTerm(term.getName(),
                        dialect.quoteIdentifier(term.getName()), term.isDescending()));
                }
            }
            block = QueryBlock.overSubquery(inner, scope.names(), bounded, dialect);
            block.orderBy.addAll(carried);
            logger.trace("Sealed block into a subquery at position {}", position);
        }

        /**
         * Newest first, for raw rows with no explicit order that are limited,
         * deduplicated or returned.
         */
        private void applyDefaultOrder(boolean last) {
            if (block.aggregated || !block.orderBy.isEmpty()) {
                return;
            }
            if (!last && !block.isLimitedOrDeduplicated()) {
                return;
            }
            String timestamp = block.bindings.get(timestampField);
            if (timestamp != null) {
                block.orderBy.add(new QueryBlock.OrderTerm(timestampField, timestamp, true));
            }
        }

        private List<QueryBlock.OrderTerm> effectiveOrder() {
            if (!block.orderBy.isEmpty()) {
                return block.orderBy;
            }
            String timestamp = block.bindings.get(timestampField);
            if (block.aggregated || timestamp == null) {
                return List.of();
            }
            return List.of(new QueryBlock.OrderTerm(timestampField, timestamp, true));
        }

        private String binding(String name) {
            String sql = block.bindings.get(name);
            if (sql == null) {
                throw new CodegenException("Field '" + name + "' is not available at this point of the pipeline",
                    position);
            }
            return sql;
        }

        private String predicate(Predicate predicate) {
            return predicate.accept(new PredicateSql());
        }

        private String expression(Expression expression) {
            return expression.accept(new ExpressionSql());
        }

        private final class PredicateSql implements PredicateVisitor<String> {

            @Override
            public String visitAnd(AndPredicate predicate) {
                return predicate.getLeft().accept(this) + " AND " + predicate.getRight().accept(this);
            }

            @Override
            public String visitOr(OrPredicate predicate) {
                return "(" + predicate.getLeft().accept(this) + " OR " + predicate.getRight().accept(this) + ")";
            }

            @Override
            public String visitNot(NotPredicate predicate) {
                return "NOT (" + predicate.getOperand().accept(this) + ")";
            }

            @Override
            public String visitComparison(ComparisonPredicate predicate) {
                String name = predicate.getField().getName();
                String column = binding(name);
                PredicateValue value = predicate.getValue();
                boolean negated = predicate.getOperator() == ComparisonOperator.NE;

                switch (value.getKind()) {
                    case WILDCARD:
                        WildcardPattern pattern = value.getWildcard();
                        if (pattern.getShape() == WildcardPattern.Shape.MATCH_ALL) {
                            return column + (negated ? " IS NULL" : " IS NOT NULL");
                        }
                        String match = dialect.wildcardMatch(column, pattern);
                        return negated ? "NOT (" + match + ")" : match;
                    case NUMBER:
                        FieldType type = scope.typeOf(name);
                        String number = type == FieldType.STRING
                            ? dialect.quoteString(value.getText())
                            : value.getText();
                        return column + " " + predicate.getOperator().getSymbol() + " " + number;
                    case EXPRESSION:
                        return column + " " + predicate.getOperator().getSymbol() + " " + expression(value.getExpression());
                    default:
                        return column + " " + predicate.getOperator().getSymbol() + " "
                            + dialect.quoteString(value.getText());
                }
            }

            @Override
            public String visitContains(ContainsPredicate predicate) {
                String column = binding(predicate.getField().getName());
                String value = predicate.getValue();
                if (WildcardPattern.isWildcard(value)) {
                    return dialect.containsPattern(column, new WildcardPattern(value));
                }
                return dialect.contains(column, value);
            }
        }

        private final class ExpressionSql implements ExpressionVisitor<String> {

            @Override
            public String visitLiteral(LiteralExpression expression) {
                switch (expression.getKind()) {
                    case NUMBER:
                        return expression.getText();
                    case STRING:
                        return dialect.quoteString(expression.getText());
                    case BOOLEAN:
                        return dialect.booleanLiteral(Boolean.parseBoolean(expression.getText()));
                    default:
                        return "NULL";
                }
            }

            @Override
            public String visitFieldRef(FieldRefExpression expression) {
                String sql = block.bindings.get(expression.getName());
                if (sql == null) {
                    throw new CodegenException("Field '" + expression.getName()
                        + "' is not available at this point of the pipeline", expression.getPosition());
                }
                return sql;
            }

            @Override
            public String visitUnary(UnaryExpression expression) {
                String operand = expression.getOperand().accept(this);
                if (expression.getOperator() == UnaryExpression.Operator.NOT) {
                    return "NOT (" + operand + ")";
                }
                return "-(" + operand + ")";
            }

            @Override
            public String visitBinary(BinaryExpression expression) {
                String left = expression.getLeft().accept(this);
                String right = expression.getRight().accept(this);
                if (expression.getOperator() == BinaryOperator.DIVIDE) {
                    return dialect.divide(left, right);
                }
                return "(" + left + " " + expression.getOperator().getSymbol() + " " + right + ")";
            }

            @Override
            public String visitFunctionCall(FunctionCallExpression expression) {
                FunctionSpec function = functionRegistry.lookup(expression.getName());
                if (function == null) {
                    throw new CodegenException("Unknown function '" + expression.getName() + "'",
                        expression.getPosition());
                }
                int arity = expression.getArguments().size();
                CodegenStrategy strategy = dialect.strategyFor(function).forArity(arity);
                if (strategy.getKind() == CodegenStrategy.Kind.UNSUPPORTED) {
                    throw new CodegenException(expression.getName() + "(): " + strategy.getText(),
                        expression.getPosition());
                }
                if (strategy.getKind() == CodegenStrategy.Kind.CONDITIONAL) {
                    throw new CodegenException("Conditional function '" + expression.getName()
                        + "' was not parsed as a conditional", expression.getPosition());
                }
                List<String> arguments = new ArrayList<>(arity);
                for (Expression argument : expression.getArguments()) {
                    arguments.add(argument.accept(this));
                }
                return strategy.render(arguments);
            }

            @Override
            public String visitConditional(ConditionalExpression expression) {
                List<String> conditions = new ArrayList<>();
                List<String> values = new ArrayList<>();
                for (ConditionalExpression.Branch branch : expression.getBranches()) {
                    conditions.add(branch.getCondition().accept(this));
                    values.add(branch.getValue().accept(this));
                }
                String otherwise = expression.hasOtherwise() ? expression.getOtherwise().accept(this) : null;
                return dialect.conditional(conditions, values, otherwise);
            }
        }
    }
}
