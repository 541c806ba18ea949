package com.lognog.query.codegen;

import com.google.common.collect.ImmutableSet;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.function.CodegenStrategy;
import com.lognog.query.function.FunctionSpec;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Constructs both stores write the same way: identifier quoting, datetime
 * literals, CASE and LIKE pattern escaping.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    protected static final DateTimeFormatter DATETIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final ImmutableSet<String> RESERVED = ImmutableSet.of(
        "all", "and", "as", "asc", "between", "by", "case", "desc", "distinct", "else", "end",
        "from", "group", "having", "in", "is", "join", "like", "limit", "not", "null", "on",
        "or", "order", "select", "table", "then", "union", "values", "when", "where"
    );

    @Override
    public String quoteIdentifier(String name) {
        if (PLAIN_IDENTIFIER.matcher(name).matches() && !RESERVED.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String datetimeLiteral(Instant instant) {
        return quoteString(DATETIME_FORMATTER.format(instant));
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "true" : "false";
    }

    @Override
    public CodegenStrategy strategyFor(FunctionSpec function) {
        return function.getStrategy();
    }

    @Override
    public String conditional(List<String> conditions, List<String> values, String otherwise) {
        StringBuilder sql = new StringBuilder("CASE");
        for (int i = 0; i < conditions.size(); i++) {
            sql.append(" WHEN ").append(conditions.get(i)).append(" THEN ").append(values.get(i));
        }
        if (otherwise != null) {
            sql.append(" ELSE ").append(otherwise);
        }
        return sql.append(" END").toString();
    }

    @Override
    public String divide(String left, String right) {
        return "(" + left + " / " + right + ")";
    }

    /**
     * LIKE pattern for a wildcard: literal {@code %}, {@code _} and
     * backslashes escaped with a backslash, each star turned into {@code %}.
     * The result still has to be quoted.
     */
    protected static String likePattern(WildcardPattern pattern) {
        StringBuilder like = new StringBuilder();
        List<String> segments = pattern.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                like.append('%');
            }
            like.append(escapeLike(segments.get(i)));
        }
        return like.toString();
    }

    protected static String escapeLike(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '%' || c == '_' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @Override
    public String toString() {
        return getName();
    }
}
