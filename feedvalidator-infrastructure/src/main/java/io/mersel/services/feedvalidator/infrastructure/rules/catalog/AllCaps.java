package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.Locale;

/**
 * Display names written entirely in capitals.
 */
public class AllCaps extends AbstractRule implements ElementRule {

    public AllCaps(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return List.of("Candidate", "CandidateContest", "PartyContest", "Person");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        checkText(element, element.find("BallotName/Text"), "BallotName", issues);
        checkText(element, element.child("Name"), "Name", issues);
        checkText(element, element.find("FullName/Text"), "FullName", issues);
    }

    private static void checkText(ElectionElement owner, ElectionElement text, String field, IssueCollector issues) {
        if (text == null || !isAllCaps(text.trimmedText())) {
            return;
        }
        issues.report(field + " of " + describe(owner) + " is in all capitals: " + text.trimmedText(), text);
    }

    static boolean isAllCaps(String value) {
        boolean hasLetter = value.chars().anyMatch(Character::isLetter);
        return hasLetter
                && value.equals(value.toUpperCase(Locale.ROOT))
                && !value.equals(value.toLowerCase(Locale.ROOT));
    }
}
