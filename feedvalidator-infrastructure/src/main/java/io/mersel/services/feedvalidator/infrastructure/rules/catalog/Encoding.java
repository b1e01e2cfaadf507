package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;

public class Encoding extends AbstractRule implements TreeRule {

    public Encoding(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        if (context.tree() != null && !context.tree().isUtf8()) {
            issues.report("Encoding on file is not UTF-8", (Integer) null);
        }
    }
}
