package com.lognog.query.parser;

import com.google.common.base.Joiner;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Pipe-stage keywords.
 */
public enum Command {

    SEARCH("search"),
    FILTER("filter"),
    WHERE("where"),
    STATS("stats"),
    EVAL("eval"),
    TABLE("table"),
    FIELDS("fields"),
    RENAME("rename"),
    DEDUP("dedup"),
    SORT("sort"),
    LIMIT("limit"),
    HEAD("head"),
    TAIL("tail"),
    TOP("top"),
    RARE("rare"),
    BIN("bin"),
    TIMECHART("timechart"),
    REX("rex");

    private final String keyword;

    Command(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * @return the command for a keyword (any case), or null
     */
    public static Command fromKeyword(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        for (Command command : values()) {
            if (command.keyword.equals(lower)) {
                return command;
            }
        }
        return null;
    }

    public static String keywords() {
        return Joiner.on(", ").join(Arrays.stream(values()).map(Command::getKeyword).collect(Collectors.toList()));
    }
}
