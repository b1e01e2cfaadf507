package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.TreeRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code objectId} values are unique across the whole document. Empty values are ignored.
 */
public class DuplicateID extends AbstractRule implements TreeRule {

    public DuplicateID(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public void check(IssueCollector issues) {
        ElectionElement root = root();
        if (root == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        List<IssueDetail> duplicates = new ArrayList<>();
        for (ElectionElement element : root.subtree()) {
            String id = element.objectId();
            if (id == null || id.isBlank()) {
                continue;
            }
            if (!seen.add(id)) {
                duplicates.add(IssueCollector.detail(id + " is a duplicate object ID", element));
            }
        }
        if (!duplicates.isEmpty()) {
            issues.report("The Election File contains duplicate object IDs", duplicates);
        }
    }
}
