package com.github.dominikschlosser.federation.authorization;

import java.util.Objects;

/**
 * Role and trust reference asserted to a role-federating provider.
 *
 * <p>On the wire the pair is a single attribute value, {@code "<roleHandle>,<trustHandle>"}, e.g.
 * {@code "Auth0-Physician-Role,saml-provider/Auth0"}. The format is fixed by the relying party.
 */
public final class AuthorizationHandle {

    public static final String SEPARATOR = ",";

    private final String roleHandle;
    private final String trustHandle;

    public AuthorizationHandle(String roleHandle, String trustHandle) {
        this.roleHandle = Objects.requireNonNull(roleHandle, "roleHandle");
        this.trustHandle = Objects.requireNonNull(trustHandle, "trustHandle");
    }

    public String getRoleHandle() {
        return roleHandle;
    }

    public String getTrustHandle() {
        return trustHandle;
    }

    public String encode() {
        return roleHandle + SEPARATOR + trustHandle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthorizationHandle)) {
            return false;
        }
        AuthorizationHandle that = (AuthorizationHandle) o;
        return roleHandle.equals(that.roleHandle) && trustHandle.equals(that.trustHandle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roleHandle, trustHandle);
    }

    @Override
    public String toString() {
        return encode();
    }
}
