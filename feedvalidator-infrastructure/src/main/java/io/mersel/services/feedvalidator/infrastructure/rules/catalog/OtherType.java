package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * An element typed {@code other} must say which type it is in {@code OtherType}.
 */
public class OtherType extends AbstractRule implements ElementRule {

    public OtherType(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return context.schemaFacts().otherTypeContainers();
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        if (!"other".equals(element.childText("Type"))) {
            return;
        }
        String otherType = element.childText("OtherType");
        if (otherType == null || otherType.isEmpty()) {
            issues.report("Type on " + describe(element) + " is set to 'other' but OtherType element is not defined",
                    element);
        }
    }
}
