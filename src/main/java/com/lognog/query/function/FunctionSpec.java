package com.lognog.query.function;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.lognog.query.schema.FieldType;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration of one eval function: arity, argument constraints, result type
 * and default SQL strategy.
 */
public final class FunctionSpec {

    private final String name;
    private final FunctionCategory category;
    private final Arity arity;
    private final ImmutableList<ArgType> argTypes;
    private final FieldType returnType;
    private final ImmutableMap<Integer, FieldType> returnTypeByArity;
    private final CodegenStrategy strategy;
    private final String description;

    private FunctionSpec(Builder builder) {
        this.name = builder.name;
        this.category = builder.category;
        this.arity = builder.arity;
        this.argTypes = ImmutableList.copyOf(builder.argTypes);
        this.returnType = builder.returnType;
        this.returnTypeByArity = ImmutableMap.copyOf(builder.returnTypeByArity);
        this.strategy = builder.strategy;
        this.description = builder.description;
    }

    public static Builder builder(String name, FunctionCategory category) {
        return new Builder(name, category);
    }

    public String getName() {
        return name;
    }

    public FunctionCategory getCategory() {
        return category;
    }

    @JsonIgnore
    public Arity getArity() {
        return arity;
    }

    /**
     * Arity as shown in the function reference, e.g. {@code 1-2}.
     */
    public String getArityText() {
        return arity.toString();
    }

    @JsonIgnore
    public List<ArgType> getArgTypes() {
        return argTypes;
    }

    /**
     * Constraint on argument {@code index}; the last declared constraint
     * repeats for variadic tails.
     */
    public ArgType argType(int index) {
        if (argTypes.isEmpty()) {
            return ArgType.ANY;
        }
        return argTypes.get(Math.min(index, argTypes.size() - 1));
    }

    /**
     * Result type for a call with {@code argCount} arguments, or null when
     * the result takes the common type of the value arguments.
     */
    public FieldType returnTypeFor(int argCount) {
        return returnTypeByArity.getOrDefault(argCount, returnType);
    }

    @JsonIgnore
    public CodegenStrategy getStrategy() {
        return strategy;
    }

    public String getDescription() {
        return description;
    }

    public boolean isConditional() {
        return strategy.getKind() == CodegenStrategy.Kind.CONDITIONAL;
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }

    public static final class Builder {
        private final String name;
        private final FunctionCategory category;
        private Arity arity = Arity.exactly(1);
        private List<ArgType> argTypes = ImmutableList.of();
        private FieldType returnType;
        private final Map<Integer, FieldType> returnTypeByArity = new HashMap<>();
        private CodegenStrategy strategy;
        private String description = "";

        private Builder(String name, FunctionCategory category) {
            this.name = Objects.requireNonNull(name, "name");
            this.category = Objects.requireNonNull(category, "category");
        }

        public Builder arity(Arity arity) {
            this.arity = arity;
            return this;
        }

        public Builder args(ArgType... types) {
            this.argTypes = Arrays.asList(types);
            return this;
        }

        public Builder returns(FieldType type) {
            this.returnType = type;
            return this;
        }

        public Builder returns(int argCount, FieldType type) {
            this.returnTypeByArity.put(argCount, type);
            return this;
        }

        public Builder sql(CodegenStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public FunctionSpec build() {
            if (strategy == null) {
                strategy = CodegenStrategy.direct(name);
            }
            return new FunctionSpec(this);
        }
    }
}
