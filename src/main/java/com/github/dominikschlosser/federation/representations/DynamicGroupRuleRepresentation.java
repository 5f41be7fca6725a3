package com.github.dominikschlosser.federation.representations;

/** A dynamic group and the matching rule that grants membership to non-human resources. */
public class DynamicGroupRuleRepresentation {

    private String groupId;
    private String matchingRule;
    private String description;

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getMatchingRule() {
        return matchingRule;
    }

    public void setMatchingRule(String matchingRule) {
        this.matchingRule = matchingRule;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
