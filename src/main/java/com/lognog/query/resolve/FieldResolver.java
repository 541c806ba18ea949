package com.lognog.query.resolve;

import com.google.common.base.Joiner;
import com.lognog.query.CompileWarning;
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
import com.lognog.query.ast.Pipeline;
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
import com.lognog.query.ast.Stage;
import com.lognog.query.ast.StageVisitor;
import com.lognog.query.ast.StatsStage;
import com.lognog.query.ast.TableStage;
import com.lognog.query.ast.TimechartStage;
import com.lognog.query.ast.TopStage;
import com.lognog.query.expr.BinaryExpression;
import com.lognog.query.expr.BinaryOperator;
import com.lognog.query.expr.Expression;
import com.lognog.query.expr.ExpressionException;
import com.lognog.query.expr.ExpressionTransformer;
import com.lognog.query.expr.ExpressionTyper;
import com.lognog.query.expr.FieldRefExpression;
import com.lognog.query.expr.LiteralExpression;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.schema.FieldSchema;
import com.lognog.query.schema.FieldType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps every field reference of a pipeline to a canonical column or to a
 * field an earlier stage introduced, replaces severity names with their
 * codes and type-checks expressions.
 *
 * Fields flow forward: each stage sees the scope the previous one produced.
 * An unknown field is always an error, never a silently empty match.
 */
@Component
public class FieldResolver {

    private final FunctionRegistry functionRegistry;

    public FieldResolver(FunctionRegistry functionRegistry) {
        this.functionRegistry = functionRegistry;
    }

    /**
     * @throws ResolveException    on an unknown field, bad severity or illegal coercion
     * @throws ExpressionException on an ill-typed expression
     */
    public ResolvedPipeline resolve(Pipeline pipeline, FieldSchema schema) {
        Resolution resolution = new Resolution(schema);
        List<Stage> stages = new ArrayList<>(pipeline.size());
        List<FieldScope> scopes = new ArrayList<>(pipeline.size());
        for (Stage stage : pipeline.getStages()) {
            stages.add(stage.accept(resolution));
            scopes.add(resolution.scope);
        }
        return new ResolvedPipeline(stages, scopes, schema, resolution.warnings);
    }

    /**
     * Per-call state: the current scope and the collected warnings.
     */
    private final class Resolution implements StageVisitor<Stage> {

        private final FieldSchema schema;
        private final List<CompileWarning> warnings = new ArrayList<>();
        private FieldScope scope;
        // position of a sort whose order no later stage has used yet
        private Integer pendingSort;
        private Long lastLimit;

        Resolution(FieldSchema schema) {
            this.schema = schema;
            this.scope = FieldScope.of(schema);
        }

        @Override
        public Stage visitSearch(SearchStage stage) {
            if (stage.matchesAll()) {
                return stage;
            }
            return new SearchStage(resolvePredicate(stage.getPredicate()), stage.getPosition());
        }

        @Override
        public Stage visitFilter(FilterStage stage) {
            return new FilterStage(stage.getCommand(), resolvePredicate(stage.getPredicate()), stage.getPosition());
        }

        @Override
        public Stage visitStats(StatsStage stage) {
            warnDiscardedSort("stats");
            List<FieldName> groupBy = resolveFieldList(stage.getGroupBy(), "stats");
            Map<String, FieldType> output = new LinkedHashMap<>();
            for (FieldName field : groupBy) {
                output.put(field.getName(), scope.typeOf(field.getName()));
            }
            List<Aggregation> aggregations = resolveAggregations(stage.getAggregations(), output, "stats");
            scope = FieldScope.of(output);
            lastLimit = null;
            return new StatsStage(aggregations, groupBy, stage.getPosition());
        }

        @Override
        public Stage visitEval(EvalStage stage) {
            List<Assignment> assignments = new ArrayList<>(stage.getAssignments().size());
            for (Assignment assignment : stage.getAssignments()) {
                Expression expression = resolveExpression(assignment.getExpression());
                FieldType type = typeOf(expression);
                String target = assignment.getTarget().getName();
                if (scope.contains(target)) {
                    warn(assignment.getTarget().getPosition(), "eval overwrites existing field '" + target + "'");
                }
                scope = scope.with(target, type);
                assignments.add(assignment.withExpression(expression));
            }
            return new EvalStage(assignments, stage.getPosition());
        }

        @Override
        public Stage visitTable(TableStage stage) {
            List<FieldName> fields = resolveFieldList(stage.getFields(), "table");
            scope = scope.select(fields);
            return new TableStage(fields, stage.getPosition());
        }

        @Override
        public Stage visitFields(FieldsStage stage) {
            List<FieldName> fields = resolveFieldList(stage.getFields(), "fields");
            if (stage.getMode() == FieldsStage.Mode.INCLUDE) {
                scope = scope.select(fields);
            } else {
                for (FieldName field : fields) {
                    scope = scope.without(field.getName());
                }
                if (scope.size() == 0) {
                    throw new ResolveException("fields - would remove every field", stage.getPosition());
                }
            }
            return new FieldsStage(stage.getMode(), fields, stage.getPosition());
        }

        @Override
        public Stage visitRename(RenameStage stage) {
            List<RenamePair> pairs = new ArrayList<>(stage.getPairs().size());
            for (RenamePair pair : stage.getPairs()) {
                FieldName from = resolveField(pair.getFrom());
                String to = pair.getTo().getName();
                if (to.equals(from.getName())) {
                    warn(pair.getTo().getPosition(), "rename of '" + to + "' to the same name has no effect");
                    continue;
                }
                if (scope.contains(to)) {
                    warn(pair.getTo().getPosition(), "rename replaces existing field '" + to + "'");
                }
                scope = scope.renamed(from.getName(), to);
                pairs.add(new RenamePair(from, pair.getTo()));
            }
            return new RenameStage(pairs, stage.getPosition());
        }

        @Override
        public Stage visitDedup(DedupStage stage) {
            List<FieldName> fields = resolveFieldList(stage.getFields(), "dedup");
            pendingSort = null;
            return new DedupStage(fields, stage.getPosition());
        }

        @Override
        public Stage visitSort(SortStage stage) {
            List<SortField> keys = new ArrayList<>(stage.getKeys().size());
            for (SortField key : stage.getKeys()) {
                keys.add(key.withField(resolveField(key.getField())));
            }
            pendingSort = stage.getPosition();
            return new SortStage(keys, stage.getPosition());
        }

        @Override
        public Stage visitLimit(LimitStage stage) {
            if (!stage.isTail() && lastLimit != null && stage.getCount() > lastLimit) {
                warn(stage.getPosition(), stage.getCommand() + " " + stage.getCount()
                    + " is larger than the preceding limit of " + lastLimit + " and has no effect");
            }
            lastLimit = lastLimit == null ? stage.getCount() : Math.min(lastLimit, stage.getCount());
            pendingSort = null;
            return stage;
        }

        @Override
        public Stage visitTop(TopStage stage) {
            warnDiscardedSort(stage.getCommand());
            FieldName field = resolveField(stage.getField());
            if (field.getName().equals(TopStage.COUNT_FIELD)) {
                throw new ResolveException(stage.getCommand() + " over a field named 'count' clashes with its count column",
                    field.getPosition());
            }
            Map<String, FieldType> output = new LinkedHashMap<>();
            output.put(field.getName(), scope.typeOf(field.getName()));
            output.put(TopStage.COUNT_FIELD, FieldType.INTEGER);
            scope = FieldScope.of(output);
            lastLimit = stage.getLimit();
            return stage.withField(field);
        }

        @Override
        public Stage visitBin(BinStage stage) {
            FieldName field = resolveField(stage.getField());
            FieldType type = scope.typeOf(field.getName());
            FieldType bucketType;
            if (type == FieldType.DATETIME) {
                if (!stage.getSpan().isTimeSpan()) {
                    throw new ResolveException("bin over time field '" + field.getName()
                        + "' needs a time span such as 5m or 1h", stage.getPosition());
                }
                bucketType = FieldType.DATETIME;
            } else if (type.isNumeric() || type == FieldType.UNKNOWN) {
                if (stage.getSpan().isTimeSpan()) {
                    throw new ResolveException("bin over numeric field '" + field.getName()
                        + "' needs a unitless span such as 100", stage.getPosition());
                }
                bucketType = FieldType.FLOAT;
            } else {
                throw new ResolveException("bin needs a time or numeric field but '" + field.getName()
                    + "' is " + type.getValue(), field.getPosition());
            }
            BinStage resolved = stage.withField(field);
            scope = scope.with(resolved.getOutputName(), bucketType);
            return resolved;
        }

        @Override
        public Stage visitTimechart(TimechartStage stage) {
            String timestamp = schema.getTimestampField();
            if (scope.typeOf(timestamp) != FieldType.DATETIME) {
                throw new ResolveException("timechart needs the '" + timestamp
                    + "' field, which an earlier stage removed", stage.getPosition());
            }
            warnDiscardedSort("timechart");
            List<FieldName> groupBy = resolveFieldList(stage.getGroupBy(), "timechart");
            Map<String, FieldType> output = new LinkedHashMap<>();
            output.put(TimechartStage.BUCKET_FIELD, FieldType.DATETIME);
            for (FieldName field : groupBy) {
                if (output.put(field.getName(), scope.typeOf(field.getName())) != null) {
                    throw new ResolveException("Duplicate output field '" + field.getName() + "' in timechart",
                        field.getPosition());
                }
            }
            List<Aggregation> aggregations = resolveAggregations(stage.getAggregations(), output, "timechart");
            scope = FieldScope.of(output);
            lastLimit = null;
            return new TimechartStage(stage.getSpan(), aggregations, groupBy, stage.getPosition());
        }

        @Override
        public Stage visitRex(RexStage stage) {
            FieldName field = resolveField(stage.getField());
            FieldType type = scope.typeOf(field.getName());
            if (type != FieldType.STRING && type != FieldType.UNKNOWN) {
                throw new ResolveException("rex needs a string field but '" + field.getName() + "' is "
                    + type.getValue(), field.getPosition());
            }
            for (RexPattern.Group group : stage.getPattern().getGroups()) {
                if (scope.contains(group.getName())) {
                    warn(stage.getPosition(), "rex overwrites existing field '" + group.getName() + "'");
                }
                scope = scope.with(group.getName(), FieldType.STRING);
            }
            return stage.withField(field);
        }

        private List<Aggregation> resolveAggregations(List<Aggregation> aggregations,
                                                      Map<String, FieldType> output, String command) {
            List<Aggregation> resolved = new ArrayList<>(aggregations.size());
            for (Aggregation aggregation : aggregations) {
                FieldType argumentType = null;
                Aggregation current = aggregation;
                if (aggregation.getArgument() != null) {
                    Expression argument = resolveExpression(aggregation.getArgument());
                    argumentType = typeOf(argument);
                    AggregationFunction function = aggregation.getFunction();
                    if (function.requiresNumericArgument() && !argumentType.isNumeric()
                        && argumentType != FieldType.UNKNOWN) {
                        throw new ExpressionException("Aggregation '" + aggregation.getName()
                            + "' needs a numeric argument but '" + aggregation.getArgument() + "' is "
                            + argumentType.getValue(), aggregation.getArgument().getPosition());
                    }
                    current = aggregation.withArgument(argument);
                }
                FieldType resultType = aggregation.getFunction().resultType(argumentType);
                if (output.put(aggregation.getAlias(), resultType) != null) {
                    throw new ResolveException("Duplicate output field '" + aggregation.getAlias() + "' in "
                        + command + "; use 'as' to name it differently", aggregation.getPosition());
                }
                resolved.add(current);
            }
            return resolved;
        }

        private void warnDiscardedSort(String command) {
            if (pendingSort != null) {
                warn(pendingSort, "sort has no effect before " + command + ", which discards row order");
                pendingSort = null;
            }
        }

        private List<FieldName> resolveFieldList(List<FieldName> fields, String command) {
            List<FieldName> resolved = new ArrayList<>(fields.size());
            Set<String> seen = new LinkedHashSet<>();
            for (FieldName field : fields) {
                FieldName canonical = resolveField(field);
                if (!seen.add(canonical.getName())) {
                    warn(field.getPosition(), "duplicate field '" + canonical.getName() + "' in " + command);
                    continue;
                }
                resolved.add(canonical);
            }
            return resolved;
        }

        private FieldName resolveField(FieldName field) {
            return field.withName(canonical(field.getName(), field.getPosition()));
        }

        private String canonical(String name, int position) {
            if (scope.contains(name)) {
                return name;
            }
            String aliased = FieldAliases.canonicalOf(name);
            if (aliased != null && scope.contains(aliased)) {
                return aliased;
            }
            StringBuilder message = new StringBuilder("Unknown field '").append(name).append("'");
            String suggestion = suggest(name);
            if (suggestion != null) {
                message.append("; did you mean '").append(suggestion).append("'?");
            } else if (scope.size() < schema.getFields().size()) {
                message.append("; available fields here: ").append(Joiner.on(", ").join(scope.names()));
            }
            throw new ResolveException(message.toString(), position);
        }

        private String suggest(String name) {
            String best = null;
            int bestDistance = Integer.MAX_VALUE;
            List<String> candidates = new ArrayList<>(scope.names());
            for (Map.Entry<String, String> alias : FieldAliases.asMap().entrySet()) {
                if (scope.contains(alias.getValue())) {
                    candidates.add(alias.getKey());
                }
            }
            for (String candidate : candidates) {
                int distance = editDistance(name.toLowerCase(Locale.ROOT), candidate.toLowerCase(Locale.ROOT));
                if (distance < bestDistance) {
                    best = candidate;
                    bestDistance = distance;
                }
            }
            return bestDistance <= 2 && bestDistance < name.length() ? best : null;
        }

        private Expression resolveExpression(Expression expression) {
            return new ExpressionResolver().transform(expression);
        }

        private FieldType typeOf(Expression expression) {
            return new ExpressionTyper(functionRegistry, scope::typeOf).typeOf(expression);
        }

        private boolean isSeverityField(String canonical) {
            FieldType type = scope.typeOf(canonical);
            return canonical.equals(schema.getSeverityField()) && type != null && type.isNumeric();
        }

        private Predicate resolvePredicate(Predicate predicate) {
            return predicate.accept(new PredicateResolver());
        }

        private void warn(Integer position, String message) {
            warnings.add(new CompileWarning(position, message));
        }

        private final class PredicateResolver implements PredicateVisitor<Predicate> {

            @Override
            public Predicate visitAnd(AndPredicate predicate) {
                return new AndPredicate(predicate.getLeft().accept(this), predicate.getRight().accept(this));
            }

            @Override
            public Predicate visitOr(OrPredicate predicate) {
                return new OrPredicate(predicate.getLeft().accept(this), predicate.getRight().accept(this));
            }

            @Override
            public Predicate visitNot(NotPredicate predicate) {
                return new NotPredicate(predicate.getOperand().accept(this), predicate.getPosition());
            }

            @Override
            public Predicate visitComparison(ComparisonPredicate predicate) {
                FieldName field = resolveField(predicate.getField());
                String name = field.getName();
                FieldType type = scope.typeOf(name);
                ComparisonOperator operator = predicate.getOperator();
                PredicateValue value = predicate.getValue();

                if (value.is(PredicateValue.Kind.WILDCARD)) {
                    if (!operator.isEquality()) {
                        throw new ResolveException("Wildcards only work with = and !=", value.getPosition());
                    }
                    if (type != FieldType.STRING && type != FieldType.UNKNOWN) {
                        throw new ResolveException("Wildcard '" + value.getText() + "' cannot match "
                            + type.getValue() + " field '" + name + "'", value.getPosition());
                    }
                    return predicate.with(field, value);
                }
                if (type == FieldType.ARRAY) {
                    throw new ResolveException("Cannot compare array field '" + name + "' with a value",
                        field.getPosition());
                }
                if (isSeverityField(name)) {
                    return predicate.with(field, severityValue(value));
                }
                switch (value.getKind()) {
                    case STRING:
                        if (type.isNumeric()) {
                            throw new ResolveException("Field '" + name + "' is numeric but '" + value.getText()
                                + "' is not a number", value.getPosition());
                        }
                        return predicate.with(field, value);
                    case EXPRESSION:
                        return predicate.with(field, expressionValue(name, type, value));
                    default:
                        return predicate.with(field, value);
                }
            }

            @Override
            public Predicate visitContains(ContainsPredicate predicate) {
                FieldName field = resolveField(predicate.getField());
                FieldType type = scope.typeOf(field.getName());
                if (type != FieldType.STRING && type != FieldType.UNKNOWN) {
                    throw new ResolveException("'~' needs a string field but '" + field.getName() + "' is "
                        + type.getValue(), field.getPosition());
                }
                return predicate.withField(field);
            }

            private PredicateValue severityValue(PredicateValue value) {
                switch (value.getKind()) {
                    case STRING:
                        return PredicateValue.number(Integer.toString(severityCode(value.getText(), value.getPosition())),
                            value.getPosition());
                    case NUMBER:
                        if (!value.getText().matches("0*[0-7]")) {
                            throw new ResolveException("Severity must be a whole number from "
                                + SeverityLevel.MIN_CODE + " to " + SeverityLevel.MAX_CODE + " but was "
                                + value.getText(), value.getPosition());
                        }
                        return PredicateValue.number(Integer.toString(Integer.parseInt(value.getText())),
                            value.getPosition());
                    default:
                        return expressionValue(schema.getSeverityField(), FieldType.INTEGER, value);
                }
            }

            private PredicateValue expressionValue(String field, FieldType fieldType, PredicateValue value) {
                Expression expression = resolveExpression(value.getExpression());
                FieldType valueType = typeOf(expression);
                boolean compatible = fieldType == FieldType.UNKNOWN || valueType == FieldType.UNKNOWN
                    || fieldType == valueType || (fieldType.isNumeric() && valueType.isNumeric())
                    || (fieldType == FieldType.DATETIME && valueType == FieldType.STRING);
                if (!compatible) {
                    throw new ResolveException("Cannot compare " + fieldType.getValue() + " field '" + field
                        + "' with a " + valueType.getValue() + " expression", value.getPosition());
                }
                return PredicateValue.expression(expression, value.getPosition());
            }
        }

        /**
         * Canonicalises field references and turns {@code severity = "warning"}
         * into {@code severity = 4} inside expressions.
         */
        private final class ExpressionResolver extends ExpressionTransformer {

            @Override
            public Expression visitFieldRef(FieldRefExpression expression) {
                return expression.withName(canonical(expression.getName(), expression.getPosition()));
            }

            @Override
            public Expression visitBinary(BinaryExpression expression) {
                Expression resolved = super.visitBinary(expression);
                if (!(resolved instanceof BinaryExpression)) {
                    return resolved;
                }
                BinaryExpression binary = (BinaryExpression) resolved;
                if (!binary.getOperator().is(BinaryOperator.Kind.COMPARISON)) {
                    return binary;
                }
                Expression left = severityLiteral(binary.getRight(), binary.getLeft());
                Expression right = severityLiteral(binary.getLeft(), binary.getRight());
                if (left == binary.getLeft() && right == binary.getRight()) {
                    return binary;
                }
                return new BinaryExpression(left, binary.getOperator(), right);
            }

            /**
             * {@code candidate} as a severity code when {@code other} is the
             * severity field and {@code candidate} a string literal.
             */
            private Expression severityLiteral(Expression other, Expression candidate) {
                if (!(other instanceof FieldRefExpression) || !(candidate instanceof LiteralExpression)) {
                    return candidate;
                }
                LiteralExpression literal = (LiteralExpression) candidate;
                if (literal.getKind() != LiteralExpression.Kind.STRING
                    || !isSeverityField(((FieldRefExpression) other).getName())) {
                    return candidate;
                }
                return LiteralExpression.number(Integer.toString(severityCode(literal.getText(), literal.getPosition())),
                    literal.getPosition());
            }
        }

        private int severityCode(String text, int position) {
            SeverityLevel level = SeverityLevel.fromName(text);
            if (level != null) {
                return level.getCode();
            }
            if (text.matches("0*[0-7]")) {
                return Integer.parseInt(text);
            }
            throw new ResolveException("Unknown severity '" + text + "'; use a code from 0 to 7 or one of "
                + "emergency, alert, critical, error, warning, notice, info, debug", position);
        }
    }

    /**
     * Levenshtein distance, used for "did you mean" hints.
     */
    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
