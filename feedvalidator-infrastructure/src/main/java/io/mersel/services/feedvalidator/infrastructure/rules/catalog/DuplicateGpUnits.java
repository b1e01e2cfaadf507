package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.graph.CompositionGraph;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Reused GpUnit identifiers and GpUnits composed of exactly the same units.
 * A single finding is reported on its own, several are bundled into one issue.
 */
public class DuplicateGpUnits extends AbstractRule implements ElementRule {

    public DuplicateGpUnits(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return List.of("GpUnitCollection");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        CompositionGraph graph = CompositionGraph.fromCollection(element);
        List<IssueDetail> findings = new ArrayList<>();

        for (String id : graph.duplicateIds()) {
            findings.add(new IssueDetail("GpUnit with object_id " + id + " is duplicated", graph.lineOf(id)));
        }
        for (List<String> group : graph.duplicatePaths()) {
            findings.add(new IssueDetail("GpUnits (" + String.join(", ", group) + ") are duplicates",
                    graph.lineOf(group.get(0))));
        }

        if (findings.size() == 1) {
            issues.report(findings.get(0).message(), findings.get(0).line());
        } else if (!findings.isEmpty()) {
            issues.report("Duplicate GpUnits found", findings);
        }
    }
}
