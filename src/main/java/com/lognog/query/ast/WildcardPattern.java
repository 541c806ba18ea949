package com.lognog.query.ast;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A literal containing {@code *}. Kept as its own value kind so code
 * generation can pick prefix, suffix or general matching instead of a regex.
 */
public final class WildcardPattern {

    public enum Shape {
        /** {@code *} alone */
        MATCH_ALL,
        /** {@code web*} */
        PREFIX,
        /** {@code *web} */
        SUFFIX,
        /** a star anywhere else, or at both ends */
        GENERAL
    }

    private static final Splitter STAR_SPLITTER = Splitter.on('*');

    private final String pattern;
    private final Shape shape;
    private final ImmutableList<String> segments;

    public WildcardPattern(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('*') < 0) {
            throw new IllegalArgumentException("Not a wildcard pattern: " + text);
        }
        this.pattern = text.replaceAll("\\*{2,}", "*");
        this.segments = ImmutableList.copyOf(STAR_SPLITTER.split(pattern));
        this.shape = classify(pattern);
    }

    private static Shape classify(String pattern) {
        if (pattern.equals("*")) {
            return Shape.MATCH_ALL;
        }
        int stars = pattern.length() - pattern.replace("*", "").length();
        if (stars == 1 && pattern.endsWith("*")) {
            return Shape.PREFIX;
        }
        if (stars == 1 && pattern.startsWith("*")) {
            return Shape.SUFFIX;
        }
        return Shape.GENERAL;
    }

    public static boolean isWildcard(String text) {
        return text.indexOf('*') >= 0;
    }

    public String getPattern() {
        return pattern;
    }

    public Shape getShape() {
        return shape;
    }

    /**
     * The literal text between stars, in order. A leading or trailing star
     * yields an empty first or last segment.
     */
    public List<String> getSegments() {
        return segments;
    }

    /**
     * For a {@link Shape#PREFIX} pattern, the text before the star.
     */
    public String getPrefix() {
        return segments.get(0);
    }

    /**
     * For a {@link Shape#SUFFIX} pattern, the text after the star.
     */
    public String getSuffix() {
        return segments.get(segments.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WildcardPattern)) return false;
        return pattern.equals(((WildcardPattern) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
