package com.lognog.query.function;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How a function call becomes SQL.
 *
 * <ul>
 *   <li>DIRECT: an SQL builtin, {@code name(a, b)}</li>
 *   <li>TEMPLATE: text with {@code {0}}, {@code {1}} ... and {@code {*}} (all arguments)</li>
 *   <li>INFIX: arguments joined by an operator, {@code (a || b)}</li>
 *   <li>CONDITIONAL: compiled as a CASE by the generator</li>
 *   <li>UNSUPPORTED: rejected at code generation for the dialect</li>
 * </ul>
 * A strategy may carry per-arity overrides, e.g. one-argument {@code log}.
 */
public final class CodegenStrategy {

    public enum Kind {
        DIRECT,
        TEMPLATE,
        INFIX,
        CONDITIONAL,
        UNSUPPORTED
    }

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+|\\*)}");
    private static final CodegenStrategy CONDITIONAL = new CodegenStrategy(Kind.CONDITIONAL, null, ImmutableMap.of());

    private final Kind kind;
    private final String text;
    private final ImmutableMap<Integer, CodegenStrategy> byArity;

    private CodegenStrategy(Kind kind, String text, ImmutableMap<Integer, CodegenStrategy> byArity) {
        this.kind = kind;
        this.text = text;
        this.byArity = byArity;
    }

    public static CodegenStrategy direct(String sqlName) {
        return new CodegenStrategy(Kind.DIRECT, Objects.requireNonNull(sqlName), ImmutableMap.of());
    }

    public static CodegenStrategy template(String template) {
        return new CodegenStrategy(Kind.TEMPLATE, Objects.requireNonNull(template), ImmutableMap.of());
    }

    public static CodegenStrategy infix(String operator) {
        return new CodegenStrategy(Kind.INFIX, Objects.requireNonNull(operator), ImmutableMap.of());
    }

    public static CodegenStrategy conditional() {
        return CONDITIONAL;
    }

    /**
     * @param reason shown to the user, e.g. "regular expressions are not available in SQLite"
     */
    public static CodegenStrategy unsupported(String reason) {
        return new CodegenStrategy(Kind.UNSUPPORTED, Objects.requireNonNull(reason), ImmutableMap.of());
    }

    /**
     * Copy of this strategy using {@code override} when called with {@code arity} arguments.
     */
    public CodegenStrategy withArity(int arity, CodegenStrategy override) {
        Map<Integer, CodegenStrategy> merged = new TreeMap<>(byArity);
        merged.put(arity, override);
        return new CodegenStrategy(kind, text, ImmutableMap.copyOf(merged));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * SQL name, template, operator or unsupported reason, depending on the kind.
     */
    public String getText() {
        return text;
    }

    public CodegenStrategy forArity(int arity) {
        return byArity.getOrDefault(arity, this);
    }

    public Map<Integer, CodegenStrategy> getArityOverrides() {
        return byArity;
    }

    /**
     * Render a call from already generated argument SQL.
     */
    public String render(List<String> args) {
        CodegenStrategy effective = forArity(args.size());
        if (effective != this) {
            return effective.render(args);
        }
        switch (kind) {
            case DIRECT:
                return text + "(" + Joiner.on(", ").join(args) + ")";
            case INFIX:
                return args.size() == 1 ? args.get(0) : "(" + Joiner.on(" " + text + " ").join(args) + ")";
            case TEMPLATE:
                return fill(args);
            default:
                throw new IllegalStateException("Strategy " + kind + " cannot render a call directly");
        }
    }

    private String fill(List<String> args) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = "*".equals(key)
                ? Joiner.on(", ").join(args)
                : args.get(Integer.parseInt(key));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Highest positional placeholder index in a template, or -1.
     */
    int maxPlaceholder() {
        if (kind != Kind.TEMPLATE) {
            return -1;
        }
        int max = -1;
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            if (!"*".equals(matcher.group(1))) {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            }
        }
        return max;
    }

    /**
     * Check that every template placeholder refers to an argument that
     * exists for each argument count the arity allows.
     *
     * @throws IllegalStateException on a malformed strategy
     */
    public void validateAgainst(String function, Arity arity) {
        if (kind == Kind.DIRECT || kind == Kind.INFIX) {
            if (text.isEmpty()) {
                throw new IllegalStateException("Function '" + function + "' has an empty SQL name");
            }
        }
        if (kind == Kind.TEMPLATE && maxPlaceholder() >= arity.getMin() && !byArityCovers(arity)) {
            throw new IllegalStateException("Template of '" + function + "' refers to argument {"
                + maxPlaceholder() + "} but the function may be called with " + arity.getMin() + " argument(s)");
        }
        for (Map.Entry<Integer, CodegenStrategy> entry : byArity.entrySet()) {
            int count = entry.getKey();
            if (!arity.accepts(count)) {
                throw new IllegalStateException("Function '" + function + "' overrides arity " + count
                    + " outside its accepted arity " + arity);
            }
            if (entry.getValue().maxPlaceholder() >= count) {
                throw new IllegalStateException("Template of '" + function + "' for " + count
                    + " argument(s) refers to argument {" + entry.getValue().maxPlaceholder() + "}");
            }
        }
    }

    private boolean byArityCovers(Arity arity) {
        if (arity.isVariadic()) {
            return false;
        }
        int needed = maxPlaceholder();
        for (int count = arity.getMin(); count <= arity.getMax(); count++) {
            if (count <= needed && !byArity.containsKey(count)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + (text == null ? "" : "(" + text + ")");
    }
}
