package io.mersel.services.feedvalidator.application.enums;

/**
 * Output format of a validation report.
 */
public enum ReportFormat {
    TEXT,
    JSON
}
