package com.github.dominikschlosser.federation;

/**
 * Stable, enumerable reason codes for a rejected federation request or configuration reload.
 *
 * <p>The code is what clients and audit consumers see. It never changes for an existing constant.
 */
public enum RejectionReason {
    UNKNOWN_PROVIDER("UnknownProvider"),
    REQUIRED_ATTRIBUTE_MISSING("RequiredAttributeMissing"),
    NO_USER_FOUND("NoUserFound"),
    AMBIGUOUS("Ambiguous"),
    TIMEOUT("Timeout"),
    PRINCIPAL_INACTIVE("PrincipalInactive"),
    DIRECTORY_UNAVAILABLE("DirectoryUnavailable"),
    NO_BINDING("NoBinding"),
    AMBIGUOUS_BINDING("AmbiguousBinding"),
    SIGNING_FAILED("SigningFailed"),
    ASSERTION_BUILD_FAILED("AssertionBuildFailed"),
    INVALID_EVENT("InvalidEvent"),
    INVALID_CONFIGURATION("InvalidConfiguration"),
    CANCELLED("Cancelled");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
