package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IssueCollector")
class IssueCollectorTest {

    @Test
    @DisplayName("report_uses_effective_severity - override applies to report, not to pinned methods")
    void report_uses_effective_severity() {
        var issues = new IssueCollector("AllCaps", Severity.INFO);

        issues.report("effective", (Integer) 4);
        issues.error("pinned", null);

        assertThat(issues.issues()).extracting(ValidationIssue::severity)
                .containsExactly(Severity.INFO, Severity.ERROR);
        assertThat(issues.issues().get(0).line()).isEqualTo(4);
        assertThat(issues.issues().get(1).line()).isNull();
        assertThat(issues.issues()).allMatch(i -> i.rule().equals("AllCaps"));
    }

    @Test
    @DisplayName("aggregate_truncated - details beyond the limit collapse into one line")
    void aggregate_truncated() {
        var issues = new IssueCollector("DuplicateID", Severity.ERROR, 2);
        List<IssueDetail> details = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            details.add(new IssueDetail("id" + i + " is a duplicate object ID", i + 1));
        }

        issues.report("The Election File contains duplicate object IDs", details);

        ValidationIssue issue = issues.issues().get(0);
        assertThat(issue.details()).hasSize(3);
        assertThat(issue.details().get(2).message()).isEqualTo("... and 3 more");
    }

    @Test
    @DisplayName("aggregate_within_limit - details are kept as given")
    void aggregate_within_limit() {
        var issues = new IssueCollector("DuplicateID", Severity.ERROR, 10);

        issues.report("dup", List.of(IssueDetail.of("a"), IssueDetail.of("b")));

        assertThat(issues.issues().get(0).details()).extracting(IssueDetail::message).containsExactly("a", "b");
        assertThat(issues.isEmpty()).isFalse();
    }
}
