package com.github.dominikschlosser.federation.dynamicgroup;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/** The four kinds of {@link MatchingRule}. {@code toString()} renders the rule back to its syntax. */
public final class MatchingRules {

    private MatchingRules() {}

    public static MatchingRule equalTo(String attribute, String value) {
        return new Equals(attribute, value);
    }

    public static MatchingRule in(String attribute, Set<String> values) {
        return new In(attribute, values);
    }

    public static MatchingRule all(List<MatchingRule> rules) {
        return new Combination(true, rules);
    }

    public static MatchingRule any(List<MatchingRule> rules) {
        return new Combination(false, rules);
    }

    private static final class Equals implements MatchingRule {

        private final String attribute;
        private final String value;

        Equals(String attribute, String value) {
            this.attribute = attribute;
            this.value = value;
        }

        @Override
        public boolean matches(Map<String, String> attributes) {
            return value.equals(attributes.get(attribute));
        }

        @Override
        public String toString() {
            return attribute + " = '" + value + "'";
        }
    }

    private static final class In implements MatchingRule {

        private final String attribute;
        private final Set<String> values;

        In(String attribute, Set<String> values) {
            this.attribute = attribute;
            this.values = Set.copyOf(values);
        }

        @Override
        public boolean matches(Map<String, String> attributes) {
            String actual = attributes.get(attribute);
            return actual != null && values.contains(actual);
        }

        @Override
        public String toString() {
            return attribute + " in ("
                    + new TreeSet<>(values).stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "))
                    + ")";
        }
    }

    private static final class Combination implements MatchingRule {

        private final boolean all;
        private final List<MatchingRule> rules;

        Combination(boolean all, List<MatchingRule> rules) {
            this.all = all;
            this.rules = List.copyOf(rules);
        }

        @Override
        public boolean matches(Map<String, String> attributes) {
            if (all) {
                return rules.stream().allMatch(rule -> rule.matches(attributes));
            }
            return rules.stream().anyMatch(rule -> rule.matches(attributes));
        }

        @Override
        public String toString() {
            return (all ? "ALL {" : "ANY {")
                    + rules.stream().map(Object::toString).collect(Collectors.joining(", "))
                    + "}";
        }
    }
}
