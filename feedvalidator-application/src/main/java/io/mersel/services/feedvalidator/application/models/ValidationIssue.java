package io.mersel.services.feedvalidator.application.models;

import io.mersel.services.feedvalidator.application.enums.Severity;

import java.util.List;

/**
 * A finding emitted by a validation rule.
 * <p>
 * Plain issues carry a message and an optional line. Aggregate issues bundle the
 * individual causes in {@code details} so one logical check yields one issue.
 *
 * @param rule     Name of the rule that emitted the issue
 * @param severity Severity after configured overrides
 * @param message  Human readable description
 * @param line     Source line in the feed, {@code null} when unknown
 * @param details  Sub-findings of an aggregate issue, empty otherwise
 */
public record ValidationIssue(
        String rule,
        Severity severity,
        String message,
        Integer line,
        List<IssueDetail> details
) {

    public ValidationIssue {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ValidationIssue error(String rule, String message, Integer line) {
        return new ValidationIssue(rule, Severity.ERROR, message, line, List.of());
    }

    public static ValidationIssue warning(String rule, String message, Integer line) {
        return new ValidationIssue(rule, Severity.WARNING, message, line, List.of());
    }

    public static ValidationIssue info(String rule, String message, Integer line) {
        return new ValidationIssue(rule, Severity.INFO, message, line, List.of());
    }

    public static ValidationIssue aggregate(String rule, Severity severity, String message, List<IssueDetail> details) {
        return new ValidationIssue(rule, severity, message, null, details);
    }

    public boolean isAggregate() {
        return !details.isEmpty();
    }
}
