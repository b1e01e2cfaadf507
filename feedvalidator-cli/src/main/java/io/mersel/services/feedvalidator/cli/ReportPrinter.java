package io.mersel.services.feedvalidator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mersel.services.feedvalidator.application.enums.ReportFormat;
import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link ValidationReport} as plain text or JSON.
 */
@Component
public class ReportPrinter {

    private static final List<Severity> SEVERITY_ORDER = List.of(Severity.ERROR, Severity.WARNING, Severity.INFO);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportPrinter(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(ValidationReport report, ReportFormat format) {
        return format == ReportFormat.JSON ? renderJson(report) : renderText(report);
    }

    // ── Text ──────────────────────────────────────────────────────────

    String renderText(ValidationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation report for ").append(report.feed())
                .append(" (rule set ").append(report.ruleSet()).append(")\n");

        for (Severity severity : SEVERITY_ORDER) {
            List<ValidationIssue> issues = report.issuesOf(severity);
            if (issues.isEmpty()) {
                continue;
            }
            sb.append('\n').append(plural(severity)).append(" (").append(issues.size()).append(")\n");
            for (ValidationIssue issue : issues) {
                sb.append("  [").append(issue.rule()).append("] ")
                        .append(location(issue.line())).append(issue.message()).append('\n');
                for (IssueDetail detail : issue.details()) {
                    sb.append("      ").append(location(detail.line())).append(detail.message()).append('\n');
                }
            }
        }

        if (!report.entityCounts().isEmpty()) {
            sb.append("\nEntities: ").append(report.entityCounts().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", "))).append('\n');
        }

        sb.append("\nResult: ").append(report.passed() ? "PASSED" : "FAILED")
                .append(" (").append(report.count(Severity.ERROR)).append(" errors, ")
                .append(report.count(Severity.WARNING)).append(" warnings, ")
                .append(report.count(Severity.INFO)).append(" info) in ")
                .append(report.durationMs()).append("ms\n");
        return sb.toString();
    }

    private static String plural(Severity severity) {
        return severity.label() + (severity == Severity.INFO ? "" : "s");
    }

    private static String location(Integer line) {
        return line == null ? "" : "line " + line + ": ";
    }

    // ── JSON ──────────────────────────────────────────────────────────

    String renderJson(ValidationReport report) {
        Map<String, Object> counts = new LinkedHashMap<>();
        for (Severity severity : SEVERITY_ORDER) {
            counts.put(severity.key(), report.count(severity));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("feed", report.feed());
        body.put("ruleSet", report.ruleSet());
        body.put("passed", report.passed());
        body.put("validatedAt", Instant.now(clock));
        body.put("durationMs", report.durationMs());
        body.put("counts", counts);
        body.put("entityCounts", report.entityCounts());
        body.put("issues", report.issues());

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report could not be serialized: " + e.getMessage(), e);
        }
    }
}
