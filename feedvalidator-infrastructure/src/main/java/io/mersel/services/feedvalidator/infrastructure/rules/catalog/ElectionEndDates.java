package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.time.LocalDate;

public class ElectionEndDates extends ElectionDateRule {

    public ElectionEndDates(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        LocalDate end = dateOf(element, "EndDate");
        if (end == null) {
            return;
        }
        if (end.isBefore(context.today())) {
            issues.report("The election end date " + end + " is in the past.", element.child("EndDate"));
        }
        LocalDate start = dateOf(element, "StartDate");
        if (start != null && end.isBefore(start)) {
            issues.report("The election end date " + end + " is before the start date " + start + ".",
                    element.child("EndDate"));
        }
    }
}
