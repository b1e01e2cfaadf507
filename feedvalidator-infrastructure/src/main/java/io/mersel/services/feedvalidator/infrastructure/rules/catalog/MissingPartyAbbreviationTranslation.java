package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Every party abbreviation covers each language used by the other parties of the collection.
 */
public class MissingPartyAbbreviationTranslation extends PartyCollectionRule {

    public MissingPartyAbbreviationTranslation(RuleContext context) {
        super(context);
    }

    @Override
    protected String message() {
        return "The feed is missing several parties abbreviation translation";
    }

    @Override
    protected List<IssueDetail> findings(List<ElectionElement> parties) {
        return missingTranslations(parties, ABBREVIATION, "abbreviation");
    }
}
