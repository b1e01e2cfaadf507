package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Two parties of a collection must not share a name in the same language.
 */
public class DuplicatedPartyName extends PartyCollectionRule {

    public DuplicatedPartyName(RuleContext context) {
        super(context);
    }

    @Override
    protected String message() {
        return "The feed contains duplicated party names";
    }

    @Override
    protected List<IssueDetail> findings(List<ElectionElement> parties) {
        return duplicated(parties, NAME, "name");
    }
}
