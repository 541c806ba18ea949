package com.lognog.query.codegen;

import com.google.common.collect.ImmutableList;
import com.lognog.query.resolve.FieldScope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One SELECT under construction. Stages fold into the current block until
 * one cannot, at which point the block becomes the FROM of a new one.
 *
 * {@code bindings} maps every field a later stage may reference to the SQL
 * that computes it inside this block.
 */
final class QueryBlock {

    private static final Pattern NUMERIC_LITERAL = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    static final class OrderTerm {
        private final String name;
        private final String sql;
        private final boolean descending;

        OrderTerm(String name, String sql, boolean descending) {
            this.name = name;
            this.sql = sql;
            this.descending = descending;
        }

        String getName() {
            return name;
        }

        String getSql() {
            return sql;
        }

        boolean isDescending() {
            return descending;
        }

        OrderTerm inverted() {
            return new OrderTerm(name, sql, !descending);
        }

        OrderTerm renamed(String from, String to) {
            return from.equals(name) ? new OrderTerm(to, sql, descending) : this;
        }
    }

    private final String from;
    private final ImmutableList<String> sourceColumns;
    // true when the source already is aggregated or limited
    private final boolean bounded;

    final Map<String, String> bindings = new LinkedHashMap<>();
    final List<String> where = new ArrayList<>();
    final List<String> groupBy = new ArrayList<>();
    final List<String> having = new ArrayList<>();
    final List<OrderTerm> orderBy = new ArrayList<>();
    final List<String> dedupKeys = new ArrayList<>();
    Long limit;
    boolean aggregated;

    private QueryBlock(String from, List<String> sourceColumns, boolean bounded, SqlDialect dialect) {
        this.from = from;
        this.sourceColumns = ImmutableList.copyOf(sourceColumns);
        this.bounded = bounded;
        for (String column : sourceColumns) {
            bindings.put(column, dialect.quoteIdentifier(column));
        }
    }

    static QueryBlock overTable(String table, List<String> columns, SqlDialect dialect) {
        return new QueryBlock(table, columns, false, dialect);
    }

    /**
     * A block reading the result of {@code inner}, whose columns are {@code columns}.
     */
    static QueryBlock overSubquery(String innerSql, List<String> columns, boolean bounded, SqlDialect dialect) {
        return new QueryBlock("(" + innerSql + ")", columns, bounded, dialect);
    }

    /**
     * True for SQL that is a bare number. In ORDER BY, GROUP BY and LIMIT BY
     * an integer there means a column position, not a value.
     */
    static boolean isNumericLiteral(String sql) {
        return NUMERIC_LITERAL.matcher(sql).matches();
    }

    boolean isBounded() {
        return bounded;
    }

    boolean isLimitedOrDeduplicated() {
        return limit != null || !dedupKeys.isEmpty();
    }

    void addFilter(String condition) {
        (aggregated ? having : where).add(condition);
    }

    void renameOrder(String from, String to) {
        orderBy.replaceAll(term -> term.renamed(from, to));
    }

    /**
     * Render the block, selecting the fields of {@code scope} in order.
     */
    String toSql(FieldScope scope, SqlDialect dialect) {
        StringBuilder sql = new StringBuilder();

        sql.append("SELECT ").append(selectList(scope, dialect));
        sql.append(" FROM ").append(from);

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }

        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        } else if (!dedupKeys.isEmpty() && !dialect.supportsLimitBy()) {
            sql.append(" GROUP BY ").append(String.join(", ", dedupKeys));
        }

        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(String.join(" AND ", having));
        }

        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ");
            for (int i = 0; i < orderBy.size(); i++) {
                if (i > 0) sql.append(", ");
                OrderTerm term = orderBy.get(i);
                // aggregate results are ordered by their output names
                boolean byName = aggregated && term.getName() != null && scope.contains(term.getName());
                sql.append(byName ? dialect.quoteIdentifier(term.getName()) : term.getSql());
                sql.append(term.isDescending() ? " DESC" : " ASC");
            }
        }

        if (!dedupKeys.isEmpty() && dialect.supportsLimitBy()) {
            sql.append(" LIMIT 1 BY ").append(String.join(", ", dedupKeys));
        }

        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }

        return sql.toString();
    }

    private String selectList(FieldScope scope, SqlDialect dialect) {
        if (selectsSourceUnchanged(scope, dialect)) {
            return "*";
        }
        List<String> columns = new ArrayList<>(scope.size());
        for (String name : scope.names()) {
            String quoted = dialect.quoteIdentifier(name);
            String expression = bindings.get(name);
            if (expression == null) {
                throw new CodegenException("Field '" + name + "' has no SQL binding");
            }
            columns.add(expression.equals(quoted) ? quoted : expression + " AS " + quoted);
        }
        return String.join(", ", columns);
    }

    private boolean selectsSourceUnchanged(FieldScope scope, SqlDialect dialect) {
        if (aggregated || !scope.names().equals(sourceColumns)) {
            return false;
        }
        for (String column : sourceColumns) {
            if (!dialect.quoteIdentifier(column).equals(bindings.get(column))) {
                return false;
            }
        }
        return true;
    }
}
