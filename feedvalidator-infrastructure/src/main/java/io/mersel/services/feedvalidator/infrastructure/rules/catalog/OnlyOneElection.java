package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

public class OnlyOneElection extends AbstractRule implements ElementRule {

    public OnlyOneElection(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return List.of("ElectionReport");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        int elections = element.children("Election").size();
        if (elections > 1) {
            issues.report("ElectionReport has " + elections + " Election elements, only one is allowed.", element);
        }
    }
}
