package com.github.dominikschlosser.federation.correlation;

import java.util.Objects;

/** A principal that already exists in a provider directory. */
public final class PrincipalHandle {

    private final String principalId;
    private final String name;
    private final boolean active;

    public PrincipalHandle(String principalId, String name, boolean active) {
        this.principalId = Objects.requireNonNull(principalId, "principalId");
        this.name = name;
        this.active = active;
    }

    public static PrincipalHandle active(String principalId, String name) {
        return new PrincipalHandle(principalId, name, true);
    }

    public String getPrincipalId() {
        return principalId;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrincipalHandle)) {
            return false;
        }
        PrincipalHandle that = (PrincipalHandle) o;
        return active == that.active && principalId.equals(that.principalId) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principalId, name, active);
    }

    @Override
    public String toString() {
        return "PrincipalHandle{" + principalId + (active ? "" : ", inactive") + "}";
    }
}
