package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.models.OcdIdDataset;
import io.mersel.services.feedvalidator.infrastructure.ocd.OcdIdNormalizer;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Base of the rules that compare OCD-IDs against the country catalogue.
 * <p>
 * The rules are inactive when no country code or local catalogue is configured. When the
 * catalogue cannot be loaded the rule reports one Error and is skipped; other rules of
 * the run are not affected.
 */
public abstract class OcdIdRule extends AbstractRule implements ElementRule {

    static final Pattern OCD_ID_PATTERN =
            Pattern.compile("^ocd-division/country:[a-z]{2}(/[\\p{L}_~.-]+:[\\p{L}\\p{N}_.~'-]+)*$");

    protected OcdIdRule(RuleContext context, Severity defaultSeverity) {
        super(context, defaultSeverity);
    }

    /**
     * Element names checked once the catalogue is available.
     */
    protected abstract List<String> targetElements();

    @Override
    public final List<String> elements() {
        return context.ocdIds().isConfigured() ? targetElements() : List.of();
    }

    @Override
    public boolean prepare(IssueCollector issues) {
        try {
            context.ocdIds().dataset();
            return true;
        } catch (OcdIdDatasetException e) {
            issues.error("Could not load the OCD-ID catalogue: " + e.getMessage(), (ElectionElement) null);
            return false;
        }
    }

    /**
     * True when the value is well formed and present in the catalogue.
     */
    protected boolean isValidOcdId(Object rawValue) {
        String value = OcdIdNormalizer.normalize(rawValue);
        OcdIdDataset dataset = context.ocdIds().loaded();
        return OCD_ID_PATTERN.matcher(value).matches() && dataset != null && dataset.contains(value);
    }

    /**
     * {@code ExternalIdentifier} elements of the unit, document order.
     */
    protected static List<ElectionElement> externalIdentifiers(ElectionElement unit) {
        return unit.findAll("ExternalIdentifiers/ExternalIdentifier");
    }
}
