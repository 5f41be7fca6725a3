package com.github.dominikschlosser.federation.trust;

import org.keycloak.saml.common.constants.JBossSAMLURIConstants;

public enum NameIdFormat {
    EMAIL(JBossSAMLURIConstants.NAMEID_FORMAT_EMAIL),
    PERSISTENT(JBossSAMLURIConstants.NAMEID_FORMAT_PERSISTENT),
    TRANSIENT(JBossSAMLURIConstants.NAMEID_FORMAT_TRANSIENT);

    private final JBossSAMLURIConstants uri;

    NameIdFormat(JBossSAMLURIConstants uri) {
        this.uri = uri;
    }

    public JBossSAMLURIConstants getUri() {
        return uri;
    }

    /**
     * Accepts the short names ({@code email}, {@code persistent}, {@code transient}) and the full
     * SAML format URIs. A missing value means {@code persistent}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static NameIdFormat fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return PERSISTENT;
        }
        String trimmed = value.trim();
        for (NameIdFormat format : values()) {
            if (format.name().equalsIgnoreCase(trimmed) || format.uri.get().equals(trimmed)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported NameID format: " + value);
    }
}
