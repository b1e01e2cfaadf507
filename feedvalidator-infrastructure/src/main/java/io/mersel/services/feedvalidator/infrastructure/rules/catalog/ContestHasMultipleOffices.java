package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

public class ContestHasMultipleOffices extends AbstractRule implements ElementRule {

    public ContestHasMultipleOffices(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return List.of("Contest");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        ElectionElement officeIds = element.child("OfficeIds");
        if (officeIds == null) {
            return;
        }
        int count = splitIds(officeIds.text()).size();
        if (count == 0) {
            issues.report(describe(element) + " has no associated offices.", element);
        } else if (count > 1) {
            issues.report(describe(element) + " has more than one associated office.", element);
        }
    }
}
