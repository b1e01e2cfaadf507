package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

public class EmptyText extends AbstractRule implements ElementRule {

    public EmptyText(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return List.of("Text");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        String text = element.text();
        if (text != null && !text.isEmpty() && text.trim().isEmpty()) {
            issues.report("Text element contains only whitespace", element);
        }
    }
}
