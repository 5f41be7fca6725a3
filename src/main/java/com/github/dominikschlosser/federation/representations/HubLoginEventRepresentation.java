package com.github.dominikschlosser.federation.representations;

import java.util.List;
import java.util.Map;

/** JSON claims bundle the identity hub signs for every completed login. */
public class HubLoginEventRepresentation {

    private String subject;
    private Map<String, String> attributes;
    private List<String> groups;
    private String issuedAt;
    private String traceId;

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public List<String> getGroups() {
        return groups;
    }

    public void setGroups(List<String> groups) {
        this.groups = groups;
    }

    public String getIssuedAt() {
        return issuedAt;
    }

    public void setIssuedAt(String issuedAt) {
        this.issuedAt = issuedAt;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }
}
