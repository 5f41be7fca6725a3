package com.github.dominikschlosser.federation.representations;

/** Maps a canonical group to the group name a provider knows it by. */
public class GroupMappingRepresentation {

    private String providerId;
    private String groupId;
    private String targetGroup;

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getTargetGroup() {
        return targetGroup;
    }

    public void setTargetGroup(String targetGroup) {
        this.targetGroup = targetGroup;
    }
}
