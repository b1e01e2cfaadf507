package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.ValidReferenceRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code PartyId} values of candidates and persons must name a Party of the feed.
 */
public class MissingPartyAffiliation extends AbstractRule implements ValidReferenceRule {

    public MissingPartyAffiliation(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public String referencedEntity() {
        return "Party";
    }

    @Override
    public Set<String> referenceValues() {
        Set<String> references = new LinkedHashSet<>();
        for (String owner : List.of("Candidate", "Person")) {
            for (ElectionElement element : all(owner)) {
                references.addAll(splitIds(element.childText("PartyId")));
            }
        }
        return references;
    }

    @Override
    public Set<String> definedValues() {
        return memberIds("PartyCollection", "Party");
    }
}
