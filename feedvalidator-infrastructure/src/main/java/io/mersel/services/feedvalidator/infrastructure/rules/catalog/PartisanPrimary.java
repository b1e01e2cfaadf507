package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.Set;

/**
 * In a partisan primary every candidate contest names the parties it is held for in
 * {@code PrimaryPartyIds}. Inactive for other election types.
 */
public class PartisanPrimary extends AbstractRule implements ElementRule {

    static final Set<String> PRIMARY_TYPES = Set.of("primary", "partisan-primary-open", "partisan-primary-closed");

    public PartisanPrimary(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return isPrimary(context) ? List.of("CandidateContest") : List.of();
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        String primaryPartyIds = element.childText("PrimaryPartyIds");
        if (primaryPartyIds == null || primaryPartyIds.isEmpty()) {
            issues.report("Election is a partisan primary but " + describe(element)
                    + " has no PrimaryPartyIds.", element);
        }
    }

    /**
     * True when the {@code Type} of the feed's first Election is one of the primary types.
     */
    static boolean isPrimary(RuleContext context) {
        ElectionElement root = context.root();
        ElectionElement election = root == null ? null : root.child("Election");
        String type = election == null ? null : election.childText("Type");
        return type != null && PRIMARY_TYPES.contains(type);
    }
}
