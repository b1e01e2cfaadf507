package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Two parties of a collection must not share an abbreviation in the same language.
 */
public class DuplicatedPartyAbbreviation extends PartyCollectionRule {

    public DuplicatedPartyAbbreviation(RuleContext context) {
        super(context);
    }

    @Override
    protected String message() {
        return "The feed contains duplicated party abbreviations";
    }

    @Override
    protected List<IssueDetail> findings(List<ElectionElement> parties) {
        return duplicated(parties, ABBREVIATION, "abbreviation");
    }
}
