package io.mersel.services.feedvalidator.application.models;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.enums.Severity;

import java.util.List;
import java.util.Map;

/**
 * Result of one validation run.
 * <p>
 * The verdict depends only on the presence of {@link Severity#ERROR} issues.
 *
 * @param feed         Validated feed path
 * @param ruleSet      Rule set used for the run
 * @param issues       Issues in emission order
 * @param entityCounts Number of validated entities per type (Party, Person, ...)
 * @param durationMs   Run duration in milliseconds
 */
public record ValidationReport(
        String feed,
        RuleSet ruleSet,
        List<ValidationIssue> issues,
        Map<String, Integer> entityCounts,
        long durationMs
) {

    public ValidationReport {
        issues = List.copyOf(issues);
        entityCounts = entityCounts == null ? Map.of() : entityCounts;
    }

    public boolean passed() {
        return issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
    }

    public List<ValidationIssue> issuesOf(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }
}
