package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.ValidReferenceRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every Person of an officeholder feed holds an office or leads a party, and every
 * Office has exactly one holder.
 */
public class PersonHasOffice extends AbstractRule implements ValidReferenceRule {

    public PersonHasOffice(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public Set<String> referenceValues() {
        return memberIds("PersonCollection", "Person");
    }

    @Override
    public Set<String> definedValues() {
        Set<String> defined = new LinkedHashSet<>();
        for (ElectionElement office : members("OfficeCollection", "Office")) {
            defined.addAll(splitIds(office.childText("OfficeHolderPersonIds")));
        }
        defined.addAll(PartyLeadershipMustExist.leadershipIds(members("PartyCollection", "Party")));
        return defined;
    }

    @Override
    public void check(IssueCollector issues) {
        if (root() == null || all("PersonCollection").isEmpty()) {
            return;
        }
        List<ElectionElement> officeCollections = all("OfficeCollection");
        if (officeCollections.isEmpty()) {
            issues.report("The feed has a PersonCollection but no OfficeCollection.", (Integer) null);
            return;
        }
        for (ElectionElement office : members("OfficeCollection", "Office")) {
            int holders = splitIds(office.childText("OfficeHolderPersonIds")).size();
            if (holders > 1) {
                issues.report("Office " + office.objectId() + " has " + holders
                        + " OfficeHolders. Must have exactly one.", office);
            }
        }
        ValidReferenceRule.super.check(issues);
    }
}
