package com.lognog.query.ast;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bucket width of a bin or timechart: a time span such as {@code 5m}, or a
 * unitless numeric width such as {@code 100}.
 */
public final class Span {

    private static final Pattern SPAN_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)([A-Za-z]*)");

    // ten years
    public static final long MAX_TIME_SPAN_SECONDS = 10L * 366 * 86_400;
    public static final BigDecimal MAX_NUMERIC_SPAN = new BigDecimal("1000000000000000");

    private final BigDecimal amount;
    private final SpanUnit unit;

    public Span(BigDecimal amount, SpanUnit unit) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.unit = unit;
    }

    /**
     * Parse span text.
     *
     * @throws IllegalArgumentException when the text is not a positive amount
     *                                  with an optional s/m/h/d/w unit
     */
    public static Span parse(String text) {
        Matcher matcher = SPAN_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid span '" + text + "'");
        }
        BigDecimal amount = new BigDecimal(matcher.group(1));
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Span must be positive: '" + text + "'");
        }
        String suffix = matcher.group(2);
        if (suffix.isEmpty()) {
            if (amount.compareTo(MAX_NUMERIC_SPAN) > 0) {
                throw new IllegalArgumentException("Span '" + text + "' is too large; the maximum is "
                    + MAX_NUMERIC_SPAN.toPlainString());
            }
            return new Span(amount, null);
        }
        SpanUnit unit = SpanUnit.fromSuffix(suffix);
        if (unit == null) {
            throw new IllegalArgumentException("Unknown span unit '" + suffix + "' (use s, m, h, d or w)");
        }
        if (amount.stripTrailingZeros().scale() > 0) {
            throw new IllegalArgumentException("Time span must be a whole number: '" + text + "'");
        }
        BigDecimal maxAmount = BigDecimal.valueOf(MAX_TIME_SPAN_SECONDS / unit.getSeconds());
        if (amount.compareTo(maxAmount) > 0) {
            throw new IllegalArgumentException("Time span '" + text + "' is too large; the maximum is "
                + maxAmount.toPlainString() + unit.getSuffix());
        }
        return new Span(amount, unit);
    }

    public BigDecimal getAmount() {
        return amount;
    }

    /**
     * Null for a unitless numeric span.
     */
    public SpanUnit getUnit() {
        return unit;
    }

    public boolean isTimeSpan() {
        return unit != null;
    }

    public long getWholeAmount() {
        return amount.longValueExact();
    }

    /**
     * @throws ArithmeticException when the span does not fit in a long,
     *                             which {@link #parse} rules out
     */
    public long toSeconds() {
        return Math.multiplyExact(getWholeAmount(), unit.getSeconds());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return amount.compareTo(span.amount) == 0 && unit == span.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), unit);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + (unit == null ? "" : unit.getSuffix());
    }
}
