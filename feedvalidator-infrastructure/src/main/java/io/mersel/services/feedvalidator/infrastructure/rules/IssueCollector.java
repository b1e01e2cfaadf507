package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of one rule.
 * <p>
 * {@code report} methods use the rule's effective severity (its default or the configured
 * override). {@code error} and {@code aggregate} pin the severity regardless
 * of overrides.
 */
public final class IssueCollector {

    private final String rule;
    private final Severity severity;
    private final int maxDetails;
    private final List<ValidationIssue> issues = new ArrayList<>();

    public IssueCollector(String rule, Severity severity, int maxDetails) {
        this.rule = rule;
        this.severity = severity;
        this.maxDetails = maxDetails;
    }

    public IssueCollector(String rule, Severity severity) {
        this(rule, severity, Integer.MAX_VALUE);
    }

    public Severity severity() {
        return severity;
    }

    // ── Effective severity ──────────────────────────────────────────

    public void report(String message, ElectionElement element) {
        add(severity, message, lineOf(element));
    }

    public void report(String message, Integer line) {
        add(severity, message, line);
    }

    /**
     * Reports one aggregate issue bundling the given sub-findings.
     */
    public void report(String message, List<IssueDetail> details) {
        aggregate(severity, message, details);
    }

    // ── Pinned severity ─────────────────────────────────────────────

    public void error(String message, ElectionElement element) {
        add(Severity.ERROR, message, lineOf(element));
    }

    public void aggregate(Severity fixedSeverity, String message, List<IssueDetail> details) {
        List<IssueDetail> kept = details;
        if (details.size() > maxDetails) {
            kept = new ArrayList<>(details.subList(0, maxDetails));
            kept.add(IssueDetail.of("... and " + (details.size() - maxDetails) + " more"));
        }
        issues.add(ValidationIssue.aggregate(rule, fixedSeverity, message, kept));
    }

    private void add(Severity fixedSeverity, String message, Integer line) {
        issues.add(new ValidationIssue(rule, fixedSeverity, message, line, List.of()));
    }

    public List<ValidationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public static Integer lineOf(ElectionElement element) {
        return element == null || element.line() <= 0 ? null : element.line();
    }

    public static IssueDetail detail(String message, ElectionElement element) {
        return new IssueDetail(message, lineOf(element));
    }
}
