package com.linggate.core.rule;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * 有序规则列表，任意一条匹配即放行；空列表即拒绝
 */
public record RuleList(List<AccessRule> rules) implements ServiceEntry, Iterable<AccessRule> {

    private static final RuleList EMPTY = new RuleList(List.of());

    public RuleList {
        rules = List.copyOf(rules);
    }

    public static RuleList empty() {
        return EMPTY;
    }

    public static RuleList of(AccessRule... rules) {
        return new RuleList(Arrays.asList(rules));
    }

    public AccessRule get(int index) {
        return rules.get(index);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<AccessRule> iterator() {
        return rules.iterator();
    }

    @Override
    public String toString() {
        return rules.toString();
    }
}
