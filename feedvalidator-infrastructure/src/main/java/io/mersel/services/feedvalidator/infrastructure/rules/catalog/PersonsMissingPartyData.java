package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * A {@code PartyId} sent without a value.
 */
public class PersonsMissingPartyData extends AbstractRule implements ElementRule {

    public PersonsMissingPartyData(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return List.of("Person");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        ElectionElement partyId = element.child("PartyId");
        if (partyId != null && !partyId.hasText()) {
            issues.report(describe(element) + " is missing party data", element);
        }
    }
}
