package io.mersel.services.feedvalidator.application.enums;

import java.util.Locale;

/**
 * Severity of a validation finding.
 * <p>
 * Only {@link #ERROR} fails a validation run.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    /**
     * Display name used in reports ("Error", "Warning", "Info").
     */
    public String label() {
        String name = name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    /**
     * Lower case name used as JSON key and metric tag ("error", "warning", "info").
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
