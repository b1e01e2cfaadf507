package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.ValidReferenceRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Office holders must be Persons of the feed. An office listing no holder id is
 * reported on its own.
 */
public class OfficeMissingOfficeHolderPersonData extends AbstractRule implements ValidReferenceRule {

    public OfficeMissingOfficeHolderPersonData(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public String referencedEntity() {
        return "Person";
    }

    @Override
    public Set<String> referenceValues() {
        Set<String> references = new LinkedHashSet<>();
        for (ElectionElement office : members("OfficeCollection", "Office")) {
            references.addAll(splitIds(office.childText("OfficeHolderPersonIds")));
        }
        return references;
    }

    @Override
    public Set<String> definedValues() {
        return memberIds("PersonCollection", "Person");
    }

    @Override
    public void check(IssueCollector issues) {
        for (ElectionElement office : members("OfficeCollection", "Office")) {
            ElectionElement holders = office.child("OfficeHolderPersonIds");
            if (holders != null && !holders.hasText()) {
                issues.report("Office is missing IDs of Officeholders.", holders);
            }
        }
        ValidReferenceRule.super.check(issues);
    }
}
