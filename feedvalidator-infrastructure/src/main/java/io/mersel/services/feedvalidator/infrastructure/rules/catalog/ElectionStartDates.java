package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.time.LocalDate;

public class ElectionStartDates extends ElectionDateRule {

    public ElectionStartDates(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        LocalDate start = dateOf(element, "StartDate");
        if (start != null && start.isBefore(context.today())) {
            issues.report("The election start date " + start + " is in the past.", element.child("StartDate"));
        }
    }
}
