package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.graph.CompositionGraph;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * The GpUnits of a collection form a single tree: exactly one unit is never listed as a
 * composing unit of another.
 */
public class GpUnitsHaveSingleRoot extends AbstractRule implements TreeRule {

    public GpUnitsHaveSingleRoot(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        for (ElectionElement collection : all("GpUnitCollection")) {
            CompositionGraph graph = CompositionGraph.fromCollection(collection);
            if (graph.isEmpty()) {
                continue;
            }
            List<String> roots = graph.rootCandidates();
            if (roots.isEmpty()) {
                issues.report("GpUnits have no geo district root.", collection);
            } else if (roots.size() > 1) {
                issues.report("GpUnits tree has more than one root: " + String.join(", ", roots), collection);
            }
        }
    }
}
