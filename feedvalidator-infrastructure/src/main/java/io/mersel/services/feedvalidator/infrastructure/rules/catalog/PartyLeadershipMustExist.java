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
 * Party leaders and chairs must be Persons of the feed.
 */
public class PartyLeadershipMustExist extends AbstractRule implements ValidReferenceRule {

    private static final Set<String> LEADERSHIP_TYPES = Set.of("party-leader-id", "party-chair-id");

    public PartyLeadershipMustExist(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public String referencedEntity() {
        return "Person";
    }

    @Override
    public Set<String> referenceValues() {
        return leadershipIds(members("PartyCollection", "Party"));
    }

    @Override
    public Set<String> definedValues() {
        return memberIds("PersonCollection", "Person");
    }

    /**
     * Values of the party-leader-id and party-chair-id external identifiers of the parties.
     */
    static Set<String> leadershipIds(List<ElectionElement> parties) {
        Set<String> ids = new LinkedHashSet<>();
        for (ElectionElement party : parties) {
            for (ElectionElement identifier : party.findAll("ExternalIdentifiers/ExternalIdentifier")) {
                String otherType = identifier.childText("OtherType");
                String value = identifier.childText("Value");
                if (otherType != null && LEADERSHIP_TYPES.contains(otherType) && value != null && !value.isEmpty()) {
                    ids.add(value);
                }
            }
        }
        return ids;
    }
}
