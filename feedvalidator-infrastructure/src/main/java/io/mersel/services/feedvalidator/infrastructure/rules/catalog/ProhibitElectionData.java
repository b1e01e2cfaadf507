package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Officeholder feeds must not carry Election elements.
 */
public class ProhibitElectionData extends AbstractRule implements TreeRule {

    public ProhibitElectionData(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        List<ElectionElement> elections = all("Election");
        if (!elections.isEmpty()) {
            issues.report("Election data is prohibited in officeholder feeds.", elections.get(0));
        }
    }
}
