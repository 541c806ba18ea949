package com.lognog.query.function;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * ClickHouse templates for the IPv4 classification functions. Addresses that
 * do not parse fall outside every range.
 */
final class IpRangeTemplates {

    private static final List<String[]> LOOPBACK = ImmutableList.<String[]>of(
        new String[]{"127.0.0.0", "127.255.255.255"});
    private static final List<String[]> LINK_LOCAL = ImmutableList.<String[]>of(
        new String[]{"169.254.0.0", "169.254.255.255"});
    private static final List<String[]> MULTICAST = ImmutableList.<String[]>of(
        new String[]{"224.0.0.0", "239.255.255.255"});
    private static final List<String[]> RESERVED = ImmutableList.of(
        new String[]{"240.0.0.0", "255.255.255.255"},
        new String[]{"0.0.0.0", "0.255.255.255"},
        new String[]{"192.0.0.0", "192.0.0.255"},
        new String[]{"192.0.2.0", "192.0.2.255"},
        new String[]{"198.51.100.0", "198.51.100.255"},
        new String[]{"203.0.113.0", "203.0.113.255"},
        new String[]{"198.18.0.0", "198.19.255.255"});
    // RFC 1918 plus carrier-grade NAT
    private static final List<String[]> PRIVATE = ImmutableList.of(
        new String[]{"10.0.0.0", "10.255.255.255"},
        new String[]{"172.16.0.0", "172.31.255.255"},
        new String[]{"192.168.0.0", "192.168.255.255"},
        new String[]{"100.64.0.0", "100.127.255.255"});

    private IpRangeTemplates() {
    }

    static String isPrivate() {
        return anyOf(PRIVATE);
    }

    static String isLoopback() {
        return anyOf(LOOPBACK);
    }

    static String isLinkLocal() {
        return anyOf(LINK_LOCAL);
    }

    static String isMulticast() {
        return anyOf(MULTICAST);
    }

    static String isReserved() {
        return anyOf(RESERVED);
    }

    static String isInternal() {
        List<String[]> all = new ArrayList<>(PRIVATE);
        all.addAll(LOOPBACK);
        all.addAll(LINK_LOCAL);
        all.addAll(MULTICAST);
        all.addAll(RESERVED);
        return anyOf(all);
    }

    static String isPublic() {
        return "(NOT " + isInternal() + ")";
    }

    static String classify() {
        List<String> parts = new ArrayList<>();
        addBranches(parts, LOOPBACK, "loopback");
        addBranches(parts, LINK_LOCAL, "link_local");
        addBranches(parts, MULTICAST, "multicast");
        addBranches(parts, RESERVED, "reserved");
        addBranches(parts, PRIVATE, "private");
        parts.add("'public'");
        return "multiIf(" + Joiner.on(", ").join(parts) + ")";
    }

    private static void addBranches(List<String> parts, List<String[]> ranges, String label) {
        for (String[] range : ranges) {
            parts.add(between(range));
            parts.add("'" + label + "'");
        }
    }

    private static String anyOf(List<String[]> ranges) {
        List<String> parts = new ArrayList<>(ranges.size());
        for (String[] range : ranges) {
            parts.add(between(range));
        }
        return parts.size() == 1 ? parts.get(0) : "(" + Joiner.on(" OR ").join(parts) + ")";
    }

    private static String between(String[] range) {
        return "(toIPv4OrNull({0}) BETWEEN toIPv4('" + range[0] + "') AND toIPv4('" + range[1] + "'))";
    }
}
