package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.Locale;

public class ValidateOcdidLowerCase extends AbstractRule implements ElementRule {

    public ValidateOcdidLowerCase(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return List.of("ExternalIdentifier");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        if (!"ocd-id".equals(element.childText("Type"))) {
            return;
        }
        String value = element.childText("Value");
        if (value == null || value.isEmpty()) {
            return;
        }
        if (!value.equals(value.toLowerCase(Locale.ROOT))) {
            issues.report("OCD-ID " + value + " is not in all lower case letters. Valid OCD-IDs should be all lowercase.",
                    element);
        }
    }
}
