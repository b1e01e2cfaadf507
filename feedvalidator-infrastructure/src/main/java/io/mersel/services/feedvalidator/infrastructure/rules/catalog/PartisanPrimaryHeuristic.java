package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags candidate contests whose name carries a party marker such as {@code (dem)} while the
 * election is not typed as a primary.
 */
public class PartisanPrimaryHeuristic extends AbstractRule implements ElementRule {

    private static final Pattern PARTY_MARKER = Pattern.compile("\\((dem|rep|lib)\\)", Pattern.CASE_INSENSITIVE);

    public PartisanPrimaryHeuristic(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return PartisanPrimary.isPrimary(context) ? List.of() : List.of("CandidateContest");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        String name = element.childText("Name");
        if (name != null && PARTY_MARKER.matcher(name).find()) {
            issues.report("Name of " + describe(element) + " suggests a partisan primary but the election"
                    + " is not typed as one: " + name, element);
        }
    }
}
