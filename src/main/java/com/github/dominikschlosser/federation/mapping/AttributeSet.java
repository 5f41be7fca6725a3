package com.github.dominikschlosser.federation.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Provider attributes keyed by attribute URI, iterated in URI order so that the same input always
 * yields the same attribute statement.
 */
public final class AttributeSet {

    private static final AttributeSet EMPTY = new AttributeSet(new TreeMap<>(), Map.of());

    private final Map<String, List<String>> values;
    private final Map<String, String> friendlyNames;

    private AttributeSet(Map<String, List<String>> values, Map<String, String> friendlyNames) {
        Map<String, List<String>> copy = new TreeMap<>();
        values.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        this.values = Collections.unmodifiableMap(copy);
        this.friendlyNames = Collections.unmodifiableMap(new LinkedHashMap<>(friendlyNames));
    }

    public static AttributeSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        values.forEach((name, list) -> builder.values.put(name, new ArrayList<>(list)));
        builder.friendlyNames.putAll(friendlyNames);
        return builder;
    }

    public Set<String> getNames() {
        return values.keySet();
    }

    public List<String> getValues(String name) {
        return values.getOrDefault(name, List.of());
    }

    public String getFirstValue(String name) {
        List<String> list = values.get(name);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public String getFriendlyName(String name) {
        return friendlyNames.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeSet)) {
            return false;
        }
        AttributeSet that = (AttributeSet) o;
        return values.equals(that.values) && friendlyNames.equals(that.friendlyNames);
    }

    @Override
    public int hashCode() {
        return values.hashCode() * 31 + friendlyNames.hashCode();
    }

    @Override
    public String toString() {
        return "AttributeSet" + values.keySet();
    }

    public static final class Builder {

        private final Map<String, List<String>> values = new TreeMap<>();
        private final Map<String, String> friendlyNames = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String name, String value) {
            return add(name, value, null);
        }

        public Builder add(String name, String value, String friendlyName) {
            values.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            if (friendlyName != null) {
                friendlyNames.put(name, friendlyName);
            }
            return this;
        }

        public Builder addAll(String name, Collection<String> newValues) {
            values.computeIfAbsent(name, k -> new ArrayList<>()).addAll(newValues);
            return this;
        }

        public boolean contains(String name) {
            return values.containsKey(name);
        }

        public AttributeSet build() {
            return new AttributeSet(values, friendlyNames);
        }
    }
}
