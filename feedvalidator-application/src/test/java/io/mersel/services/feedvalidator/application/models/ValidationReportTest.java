package io.mersel.services.feedvalidator.application.models;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.enums.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValidationReport")
class ValidationReportTest {

    @Test
    @DisplayName("warnings and infos alone do not fail the run")
    void warningsDoNotFail() {
        var report = new ValidationReport("feed.xml", RuleSet.ELECTION, List.of(
                ValidationIssue.warning("AllCaps", "all caps", 3),
                ValidationIssue.info("Something", "note", null)
        ), Map.of(), 5);

        assertThat(report.passed()).isTrue();
        assertThat(report.count(Severity.WARNING)).isEqualTo(1);
        assertThat(report.count(Severity.ERROR)).isZero();
    }

    @Test
    @DisplayName("a single error fails the run")
    void errorFails() {
        var report = new ValidationReport("feed.xml", RuleSet.ELECTION, List.of(
                ValidationIssue.warning("AllCaps", "all caps", 3),
                ValidationIssue.aggregate("DuplicateGpUnits", Severity.ERROR, "duplicates",
                        List.of(IssueDetail.of("a"), new IssueDetail("b", 7)))
        ), Map.of("Party", 2), 5);

        assertThat(report.passed()).isFalse();
        assertThat(report.issuesOf(Severity.ERROR)).singleElement()
                .satisfies(issue -> {
                    assertThat(issue.isAggregate()).isTrue();
                    assertThat(issue.details()).extracting(IssueDetail::line).containsExactly(null, 7);
                });
    }

    @Test
    @DisplayName("severity label is capitalised")
    void severityLabel() {
        assertThat(Severity.ERROR.label()).isEqualTo("Error");
        assertThat(Severity.WARNING.label()).isEqualTo("Warning");
        assertThat(RuleSet.fromName(" officeholder ")).isEqualTo(RuleSet.OFFICEHOLDER);
    }
}
