package com.lognog.query.function;

/**
 * Accepted argument count: fixed, a range, or open-ended.
 */
public final class Arity {

    private static final int VARIADIC = -1;

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        if (min < 0 || (max != VARIADIC && max < min)) {
            throw new IllegalArgumentException("Invalid arity " + min + ".." + max);
        }
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public static Arity atLeast(int min) {
        return new Arity(min, VARIADIC);
    }

    public int getMin() {
        return min;
    }

    /**
     * Upper bound, or -1 when variadic.
     */
    public int getMax() {
        return max;
    }

    public boolean isVariadic() {
        return max == VARIADIC;
    }

    public boolean accepts(int count) {
        return count >= min && (isVariadic() || count <= max);
    }

    /**
     * Human readable form: {@code 2}, {@code 1-2} or {@code 1+}.
     */
    @Override
    public String toString() {
        if (isVariadic()) {
            return min + "+";
        }
        return min == max ? Integer.toString(min) : min + "-" + max;
    }
}
