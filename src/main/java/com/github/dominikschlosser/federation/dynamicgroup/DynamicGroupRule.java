package com.github.dominikschlosser.federation.dynamicgroup;

import java.util.Objects;

public final class DynamicGroupRule {

    private final String groupId;
    private final MatchingRule matchingRule;
    private final String description;

    public DynamicGroupRule(String groupId, MatchingRule matchingRule, String description) {
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.matchingRule = Objects.requireNonNull(matchingRule, "matchingRule");
        this.description = description;
    }

    public String getGroupId() {
        return groupId;
    }

    public MatchingRule getMatchingRule() {
        return matchingRule;
    }

    public String getDescription() {
        return description;
    }

    public boolean matches(ResourceIdentity resource) {
        return matchingRule.matches(resource.getAttributes());
    }

    @Override
    public String toString() {
        return groupId + ": " + matchingRule;
    }
}
