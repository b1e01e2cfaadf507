package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Values of IDREF and IDREFS typed elements must name an {@code objectId} of the feed.
 * Empty values are accepted.
 */
public class ValidIDREF extends AbstractRule implements ElementRule {

    public ValidIDREF(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return context.schemaFacts().idrefElements();
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        List<String> undefined = new ArrayList<>();
        for (String id : splitIds(element.text())) {
            if (!context.index().contains(id)) {
                undefined.add(id);
            }
        }
        if (!undefined.isEmpty()) {
            issues.report(element.tag() + " refers to undefined objectId(s): "
                    + String.join(", ", undefined), element);
        }
    }
}
