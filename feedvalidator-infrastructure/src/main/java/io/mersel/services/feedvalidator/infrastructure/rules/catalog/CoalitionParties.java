package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

public class CoalitionParties extends AbstractRule implements TreeRule {

    public CoalitionParties(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        for (ElectionElement coalition : all("Coalition")) {
            ElectionElement partyIds = coalition.child("PartyIds");
            if (partyIds == null || !partyIds.hasText()) {
                issues.report(describe(coalition) + " must define PartyIds", coalition);
            }
        }
    }
}
