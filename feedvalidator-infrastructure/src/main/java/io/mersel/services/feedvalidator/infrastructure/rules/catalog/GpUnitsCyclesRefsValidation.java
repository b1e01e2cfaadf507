package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.graph.CompositionGraph;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Composing GpUnit references must not loop back to a unit on the same path.
 */
public class GpUnitsCyclesRefsValidation extends AbstractRule implements TreeRule {

    public GpUnitsCyclesRefsValidation(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        for (ElectionElement collection : all("GpUnitCollection")) {
            CompositionGraph graph = CompositionGraph.fromCollection(collection);
            List<String> closing = graph.cycleClosingNodes();
            if (closing.size() == 1) {
                String node = closing.get(0);
                issues.report("Cycle detected at node " + node, graph.lineOf(node));
            } else if (closing.size() > 1) {
                List<IssueDetail> details = new ArrayList<>();
                for (String node : closing) {
                    details.add(new IssueDetail("Cycle detected at node " + node, graph.lineOf(node)));
                }
                issues.report("GpUnits composition contains cycles", details);
            }
        }
    }
}
