package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code OtherType} must not carry a value the schema already enumerates.
 */
public class ValidEnumerations extends AbstractRule implements ElementRule {

    private final Set<String> enumerations;

    public ValidEnumerations(RuleContext context) {
        super(context, Severity.ERROR);
        this.enumerations = new HashSet<>(context.schemaFacts().enumerationValues());
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
        if (otherType != null && enumerations.contains(otherType)) {
            issues.report("Type of " + describe(element) + " is set to 'other' even though '" + otherType
                    + "' is a valid enumeration", element);
        }
    }
}
