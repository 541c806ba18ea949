package com.lognog.query.function;

import com.google.common.collect.ImmutableMap;
import com.lognog.query.schema.FieldType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.lognog.query.function.ArgType.ANY;
import static com.lognog.query.function.ArgType.BOOLEAN;
import static com.lognog.query.function.ArgType.NUMERIC;
import static com.lognog.query.function.ArgType.STRING;
import static com.lognog.query.function.ArgType.TIME;
import static com.lognog.query.function.CodegenStrategy.direct;
import static com.lognog.query.function.CodegenStrategy.template;

/**
 * Immutable registry of the eval functions, keyed by lowercase name.
 *
 * The registry is built and validated once; a duplicate name or a template
 * placeholder outside a function's arity fails class initialisation. The SQL
 * strategies here target ClickHouse; other dialects override them
 * per function.
 */
public final class FunctionRegistry {

    private static final FunctionRegistry STANDARD = new FunctionRegistry(standardFunctions());

    private final ImmutableMap<String, FunctionSpec> functions;

    /**
     * @throws IllegalStateException on a duplicate name or a malformed strategy
     */
    public FunctionRegistry(List<FunctionSpec> specs) {
        Map<String, FunctionSpec> byName = new LinkedHashMap<>();
        for (FunctionSpec spec : specs) {
            String key = spec.getName().toLowerCase(Locale.ROOT);
            if (!key.equals(spec.getName())) {
                throw new IllegalStateException("Function names must be lowercase: '" + spec.getName() + "'");
            }
            if (byName.put(key, spec) != null) {
                throw new IllegalStateException("Duplicate function '" + key + "'");
            }
            spec.getStrategy().validateAgainst(key, spec.getArity());
        }
        this.functions = ImmutableMap.copyOf(byName);
    }

    public static FunctionRegistry standard() {
        return STANDARD;
    }

    /**
     * @return the function, or null when no function has this name
     */
    public FunctionSpec lookup(String name) {
        return name == null ? null : functions.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Collection<FunctionSpec> getAll() {
        return functions.values();
    }

    public int size() {
        return functions.size();
    }

    private static List<FunctionSpec> standardFunctions() {
        return List.of(
            // math
            FunctionSpec.builder("abs", FunctionCategory.MATH).args(NUMERIC)
                .description("Absolute value").build(),
            FunctionSpec.builder("round", FunctionCategory.MATH).arity(Arity.between(1, 2)).args(NUMERIC, NUMERIC)
                .returns(FieldType.FLOAT).description("Round to N decimal places (default 0)").build(),
            FunctionSpec.builder("floor", FunctionCategory.MATH).args(NUMERIC)
                .description("Largest whole number not greater than x").build(),
            FunctionSpec.builder("ceil", FunctionCategory.MATH).args(NUMERIC)
                .description("Smallest whole number not less than x").build(),
            FunctionSpec.builder("ceiling", FunctionCategory.MATH).args(NUMERIC).sql(direct("ceil"))
                .description("Alias of ceil").build(),
            FunctionSpec.builder("sqrt", FunctionCategory.MATH).args(NUMERIC).returns(FieldType.FLOAT)
                .description("Square root").build(),
            FunctionSpec.builder("pow", FunctionCategory.MATH).arity(Arity.exactly(2)).args(NUMERIC)
                .returns(FieldType.FLOAT).description("x raised to the power y").build(),
            FunctionSpec.builder("log", FunctionCategory.MATH).arity(Arity.between(1, 2)).args(NUMERIC)
                .returns(FieldType.FLOAT)
                .sql(template("(ln({0}) / ln({1}))").withArity(1, template("log10({0})")))
                .description("Logarithm of x in base y (default 10)").build(),
            FunctionSpec.builder("ln", FunctionCategory.MATH).args(NUMERIC).returns(FieldType.FLOAT)
                .description("Natural logarithm").build(),
            FunctionSpec.builder("log10", FunctionCategory.MATH).args(NUMERIC).returns(FieldType.FLOAT)
                .description("Base 10 logarithm").build(),
            FunctionSpec.builder("exp", FunctionCategory.MATH).args(NUMERIC).returns(FieldType.FLOAT)
                .description("e raised to the power x").build(),
            FunctionSpec.builder("pi", FunctionCategory.MATH).arity(Arity.exactly(0)).returns(FieldType.FLOAT)
                .description("The constant pi").build(),

            // string
            FunctionSpec.builder("len", FunctionCategory.STRING).args(STRING).returns(FieldType.INTEGER)
                .sql(direct("lengthUTF8")).description("Number of characters").build(),
            FunctionSpec.builder("length", FunctionCategory.STRING).args(STRING).returns(FieldType.INTEGER)
                .sql(direct("lengthUTF8")).description("Alias of len").build(),
            FunctionSpec.builder("lower", FunctionCategory.STRING).args(STRING).returns(FieldType.STRING)
                .description("Lowercase").build(),
            FunctionSpec.builder("upper", FunctionCategory.STRING).args(STRING).returns(FieldType.STRING)
                .description("Uppercase").build(),
            FunctionSpec.builder("trim", FunctionCategory.STRING).args(STRING).returns(FieldType.STRING)
                .sql(direct("trimBoth")).description("Strip leading and trailing whitespace").build(),
            FunctionSpec.builder("ltrim", FunctionCategory.STRING).args(STRING).returns(FieldType.STRING)
                .sql(direct("trimLeft")).description("Strip leading whitespace").build(),
            FunctionSpec.builder("rtrim", FunctionCategory.STRING).args(STRING).returns(FieldType.STRING)
                .sql(direct("trimRight")).description("Strip trailing whitespace").build(),
            FunctionSpec.builder("substr", FunctionCategory.STRING).arity(Arity.between(2, 3))
                .args(STRING, NUMERIC, NUMERIC).returns(FieldType.STRING).sql(direct("substringUTF8"))
                .description("Substring from a 1-based offset, optionally of a given length").build(),
            FunctionSpec.builder("substring", FunctionCategory.STRING).arity(Arity.between(2, 3))
                .args(STRING, NUMERIC, NUMERIC).returns(FieldType.STRING).sql(direct("substringUTF8"))
                .description("Alias of substr").build(),
            FunctionSpec.builder("replace", FunctionCategory.STRING).arity(Arity.exactly(3)).args(STRING)
                .returns(FieldType.STRING).sql(direct("replaceAll"))
                .description("Replace every occurrence of a substring").build(),
            FunctionSpec.builder("split", FunctionCategory.STRING).arity(Arity.between(2, 3))
                .args(STRING, STRING, NUMERIC).returns(FieldType.ARRAY).returns(3, FieldType.STRING)
                .sql(template("splitByString({1}, {0})")
                    .withArity(3, template("arrayElement(splitByString({1}, {0}), {2} + 1)")))
                .description("Split on a delimiter; with an index, the 0-based element").build(),
            FunctionSpec.builder("concat", FunctionCategory.STRING).arity(Arity.atLeast(1)).args(ANY)
                .returns(FieldType.STRING).description("Concatenate values as text").build(),
            FunctionSpec.builder("tostring", FunctionCategory.STRING).args(ANY).returns(FieldType.STRING)
                .sql(direct("toString")).description("Convert to text").build(),
            FunctionSpec.builder("tonumber", FunctionCategory.STRING).args(ANY).returns(FieldType.FLOAT)
                .sql(template("toFloat64OrNull(toString({0}))"))
                .description("Convert to a number, null when not numeric").build(),
            FunctionSpec.builder("like", FunctionCategory.STRING).arity(Arity.exactly(2)).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template("({0} LIKE {1})"))
                .description("SQL LIKE pattern match (% and _)").build(),
            FunctionSpec.builder("match", FunctionCategory.STRING).arity(Arity.exactly(2)).args(STRING)
                .returns(FieldType.BOOLEAN).description("Regular expression match").build(),

            // conditional
            FunctionSpec.builder("if", FunctionCategory.CONDITIONAL).arity(Arity.exactly(3))
                .args(BOOLEAN, ANY, ANY).sql(CodegenStrategy.conditional())
                .description("if(condition, then, else)").build(),
            FunctionSpec.builder("case", FunctionCategory.CONDITIONAL).arity(Arity.atLeast(2))
                .args(ANY).sql(CodegenStrategy.conditional())
                .description("case(cond1, value1, cond2, value2, ..., [default])").build(),
            FunctionSpec.builder("coalesce", FunctionCategory.CONDITIONAL).arity(Arity.atLeast(1)).args(ANY)
                .description("First non-null argument").build(),
            FunctionSpec.builder("nullif", FunctionCategory.CONDITIONAL).arity(Arity.exactly(2)).args(ANY)
                .sql(direct("nullIf")).description("Null when both arguments are equal, else the first").build(),
            FunctionSpec.builder("isnull", FunctionCategory.CONDITIONAL).args(ANY).returns(FieldType.BOOLEAN)
                .sql(template("({0} IS NULL)")).description("True when the value is null").build(),
            FunctionSpec.builder("isnotnull", FunctionCategory.CONDITIONAL).args(ANY).returns(FieldType.BOOLEAN)
                .sql(template("({0} IS NOT NULL)")).description("True when the value is not null").build(),
            FunctionSpec.builder("null", FunctionCategory.CONDITIONAL).arity(Arity.exactly(0))
                .returns(FieldType.UNKNOWN).sql(template("NULL")).description("The null value").build(),
            FunctionSpec.builder("true", FunctionCategory.CONDITIONAL).arity(Arity.exactly(0))
                .returns(FieldType.BOOLEAN).sql(template("true")).description("Boolean true").build(),
            FunctionSpec.builder("false", FunctionCategory.CONDITIONAL).arity(Arity.exactly(0))
                .returns(FieldType.BOOLEAN).sql(template("false")).description("Boolean false").build(),
            FunctionSpec.builder("min", FunctionCategory.CONDITIONAL).arity(Arity.atLeast(2)).args(ANY)
                .sql(direct("least")).description("Smallest of the arguments").build(),
            FunctionSpec.builder("max", FunctionCategory.CONDITIONAL).arity(Arity.atLeast(2)).args(ANY)
                .sql(direct("greatest")).description("Largest of the arguments").build(),

            // time
            FunctionSpec.builder("now", FunctionCategory.TIME).arity(Arity.exactly(0))
                .returns(FieldType.DATETIME).description("Current time").build(),
            FunctionSpec.builder("strftime", FunctionCategory.TIME).arity(Arity.exactly(2)).args(TIME, STRING)
                .returns(FieldType.STRING).sql(direct("formatDateTime"))
                .description("Format a time with a %-pattern").build(),

            // network
            FunctionSpec.builder("classify_ip", FunctionCategory.NETWORK).args(STRING).returns(FieldType.STRING)
                .sql(template(IpRangeTemplates.classify()))
                .description("One of loopback, link_local, multicast, reserved, private or public").build(),
            FunctionSpec.builder("is_private_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isPrivate()))
                .description("RFC 1918 or carrier-grade NAT address").build(),
            FunctionSpec.builder("is_public_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isPublic()))
                .description("Routable public address").build(),
            FunctionSpec.builder("is_internal_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isInternal()))
                .description("Any non-public address").build(),
            FunctionSpec.builder("is_loopback_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isLoopback()))
                .description("127.0.0.0/8").build(),
            FunctionSpec.builder("is_link_local_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isLinkLocal()))
                .description("169.254.0.0/16").build(),
            FunctionSpec.builder("is_multicast_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isMulticast()))
                .description("224.0.0.0/4").build(),
            FunctionSpec.builder("is_reserved_ip", FunctionCategory.NETWORK).args(STRING)
                .returns(FieldType.BOOLEAN).sql(template(IpRangeTemplates.isReserved()))
                .description("Reserved or documentation address").build()
        );
    }
}
