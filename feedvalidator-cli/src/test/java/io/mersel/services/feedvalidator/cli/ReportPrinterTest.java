package io.mersel.services.feedvalidator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.feedvalidator.application.enums.ReportFormat;
import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReportPrinter")
class ReportPrinterTest {

    private final ReportPrinter printer =
            new ReportPrinter(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));

    private static ValidationReport failedReport() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("Party", 2);
        counts.put("Contest", 1);
        return new ValidationReport("feed.xml", RuleSet.ELECTION, List.of(
                ValidationIssue.warning("AllCaps", "Candidate BallotName is in all capitals: DOE", 12),
                new ValidationIssue("DuplicateID", Severity.ERROR, "The Election File contains duplicate object IDs",
                        null, List.of(new IssueDetail("par1 is a duplicate object ID", 7))),
                ValidationIssue.info("Note", "informational", null)
        ), counts, 42);
    }

    @Test
    @DisplayName("text_groups_by_severity - errors first, details indented with line numbers")
    void text_groups_by_severity() {
        String text = printer.render(failedReport(), ReportFormat.TEXT);

        assertThat(text).contains("Validation report for feed.xml (rule set ELECTION)");
        assertThat(text.indexOf("Errors (1)")).isLessThan(text.indexOf("Warnings (1)"));
        assertThat(text.indexOf("Warnings (1)")).isLessThan(text.indexOf("Info (1)"));
        assertThat(text).contains("  [DuplicateID] The Election File contains duplicate object IDs\n");
        assertThat(text).contains("      line 7: par1 is a duplicate object ID\n");
        assertThat(text).contains("  [AllCaps] line 12: Candidate BallotName is in all capitals: DOE\n");
        assertThat(text).contains("Entities: Party=2, Contest=1");
        assertThat(text).contains("Result: FAILED (1 errors, 1 warnings, 1 info) in 42ms");
    }

    @Test
    @DisplayName("text_passed - no issues prints only the verdict")
    void text_passed() {
        var report = new ValidationReport("ok.xml", RuleSet.OFFICEHOLDER, List.of(), Map.of(), 5);

        String text = printer.render(report, ReportFormat.TEXT);

        assertThat(text).doesNotContain("Errors").doesNotContain("Entities:");
        assertThat(text).contains("Result: PASSED (0 errors, 0 warnings, 0 info)");
    }

    @Test
    @DisplayName("json_structure - verdict, counts, timestamp and issues are serialized")
    void json_structure() throws Exception {
        String json = printer.render(failedReport(), ReportFormat.JSON);

        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("feed").asText()).isEqualTo("feed.xml");
        assertThat(node.get("ruleSet").asText()).isEqualTo("ELECTION");
        assertThat(node.get("passed").asBoolean()).isFalse();
        assertThat(node.get("validatedAt").asText()).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(node.get("counts").get("error").asInt()).isEqualTo(1);
        assertThat(node.get("entityCounts").get("Party").asInt()).isEqualTo(2);
        assertThat(node.get("issues")).hasSize(3);
        JsonNode duplicate = node.get("issues").get(1);
        assertThat(duplicate.get("rule").asText()).isEqualTo("DuplicateID");
        assertThat(duplicate.get("severity").asText()).isEqualTo("ERROR");
        assertThat(duplicate.get("details").get(0).get("line").asInt()).isEqualTo(7);
    }

    @Test
    @DisplayName("turkish_locale - section labels and JSON count keys stay ASCII")
    void turkish_locale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            String text = printer.render(failedReport(), ReportFormat.TEXT);
            JsonNode counts = new ObjectMapper().readTree(printer.render(failedReport(), ReportFormat.JSON))
                    .get("counts");

            assertThat(text).contains("Warnings (1)").contains("Info (1)");
            assertThat(counts.has("warning")).isTrue();
            assertThat(counts.has("info")).isTrue();
        } finally {
            Locale.setDefault(previous);
        }
    }
}
