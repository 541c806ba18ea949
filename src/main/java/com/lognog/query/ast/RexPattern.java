package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A rex regular expression analysed at parse time.
 *
 * Named groups, {@code (?<name>...)} or {@code (?P<name>...)}, become the
 * extracted fields. The names are stripped so the stored pattern only has
 * positional groups, which every SQL regex engine understands; each field
 * keeps the 1-based index of its group.
 */
public final class RexPattern {

    private static final Pattern GROUP_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final class Group {
        private final String name;
        private final int index;

        Group(String name, int index) {
            this.name = name;
            this.index = index;
        }

        public String getName() {
            return name;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public String toString() {
            return name + "#" + index;
        }
    }

    private final String source;
    private final String positionalPattern;
    private final ImmutableList<Group> groups;

    private RexPattern(String source, String positionalPattern, ImmutableList<Group> groups) {
        this.source = source;
        this.positionalPattern = positionalPattern;
        this.groups = groups;
    }

    /**
     * Analyse a pattern.
     *
     * @throws IllegalArgumentException when the pattern has no named group,
     *                                  repeats a group name or is not a valid regex
     */
    public static RexPattern of(String source) {
        Objects.requireNonNull(source, "source");
        StringBuilder out = new StringBuilder(source.length());
        ImmutableList.Builder<Group> groups = ImmutableList.builder();
        Set<String> seen = new HashSet<>();
        int captureIndex = 0;
        boolean inClass = false;

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                out.append(c).append(source.charAt(i + 1));
                i += 2;
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                out.append(c);
                i++;
                continue;
            }
            if (c == '[') {
                inClass = true;
                out.append(c);
                // a ']' right after '[' or '[^' is a literal
                if (source.startsWith("^]", i + 1)) {
                    out.append("^]");
                    i += 3;
                } else if (source.startsWith("]", i + 1)) {
                    out.append(']');
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c != '(') {
                out.append(c);
                i++;
                continue;
            }
            if (!source.startsWith("?", i + 1)) {
                captureIndex++;
                out.append('(');
                i++;
                continue;
            }
            int nameStart = namedGroupStart(source, i);
            if (nameStart < 0) {
                // non-capturing group, lookaround or inline flags
                out.append('(');
                i++;
                continue;
            }
            int nameEnd = source.indexOf('>', nameStart);
            if (nameEnd < 0) {
                throw new IllegalArgumentException("Unterminated group name in rex pattern");
            }
            String name = source.substring(nameStart, nameEnd);
            if (!GROUP_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid capture group name '" + name + "'");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate capture group name '" + name + "'");
            }
            captureIndex++;
            groups.add(new Group(name, captureIndex));
            out.append('(');
            i = nameEnd + 1;
        }

        ImmutableList<Group> built = groups.build();
        if (built.isEmpty()) {
            throw new IllegalArgumentException(
                "rex pattern has no named capture groups; use (?<name>...) to name the extracted field");
        }
        String positional = out.toString();
        try {
            Pattern.compile(positional);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid rex pattern: " + e.getDescription(), e);
        }
        return new RexPattern(source, positional, built);
    }

    /**
     * Offset of a group name if a named group opens at {@code open}, else -1.
     */
    private static int namedGroupStart(String source, int open) {
        if (source.startsWith("?P<", open + 1)) {
            return open + 4;
        }
        if (source.startsWith("?<", open + 1) && open + 3 < source.length()) {
            char next = source.charAt(open + 3);
            // (?<= and (?<! are lookbehinds
            if (next != '=' && next != '!') {
                return open + 3;
            }
        }
        return -1;
    }

    public String getSource() {
        return source;
    }

    /**
     * The pattern with group names removed.
     */
    public String getPositionalPattern() {
        return positionalPattern;
    }

    public List<Group> getGroups() {
        return groups;
    }

    public List<String> getFieldNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (Group group : groups) {
            names.add(group.getName());
        }
        return names.build();
    }

    @Override
    public String toString() {
        return source;
    }
}
