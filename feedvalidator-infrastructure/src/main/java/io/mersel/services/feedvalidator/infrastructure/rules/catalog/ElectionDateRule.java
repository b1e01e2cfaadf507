package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Base of the rules checking the {@code StartDate} and {@code EndDate} of an Election
 * against the run's clock. Dates that do not parse are left to schema conformance.
 */
public abstract class ElectionDateRule extends AbstractRule implements ElementRule {

    protected ElectionDateRule(RuleContext context, Severity defaultSeverity) {
        super(context, defaultSeverity);
    }

    @Override
    public List<String> elements() {
        return List.of("Election");
    }

    /**
     * Date of the given child, {@code null} when absent or unparsable. Only the
     * {@code yyyy-MM-dd} prefix is read so timezone suffixes are tolerated.
     */
    protected static LocalDate dateOf(ElectionElement election, String child) {
        String text = election.childText(child);
        if (text == null || text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
