package com.github.dominikschlosser.federation.trust;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;
import java.util.List;

/**
 * Raised when a configuration document fails validation or cannot be read. The active snapshot is
 * left untouched.
 */
public class ConfigurationException extends FederationException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(List.of(message));
    }

    public ConfigurationException(List<String> errors) {
        super(RejectionReason.INVALID_CONFIGURATION, "Invalid federation configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(RejectionReason.INVALID_CONFIGURATION, message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
