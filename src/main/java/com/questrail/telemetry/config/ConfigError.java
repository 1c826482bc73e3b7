package com.questrail.telemetry.config;

import java.util.List;

/**
 * Raised when a packet configuration document fails validation.
 *
 * <p>The validator collects every violation it finds before failing, so
 * {@link #violations()} lists all problems in document order. Loading a
 * configuration either succeeds completely or fails with this exception;
 * there is no partial result.</p>
 */
public final class ConfigError extends Exception
{
    private final List<String> violations;

    public ConfigError(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigError(String violation, Throwable cause) {
        super(buildMessage(List.of(violation)), cause);
        this.violations = List.of(violation);
    }

    public List<String> violations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        return "Invalid packet configuration (" + violations.size() + " violation"
                + (violations.size() == 1 ? "" : "s") + "): " + String.join("; ", violations);
    }
}
