package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Optional elements should be left out rather than sent empty.
 */
public class OptionalAndEmpty extends AbstractRule implements ElementRule {

    public OptionalAndEmpty(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return context.schemaFacts().optionalElements();
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        if (element.children().isEmpty() && !element.hasText()) {
            issues.report("This optional element included although it is empty: " + element.tag(), element);
        }
    }
}
