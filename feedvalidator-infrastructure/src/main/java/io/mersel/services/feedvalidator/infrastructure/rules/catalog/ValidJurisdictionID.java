package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.rules.ValidReferenceRule;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Office jurisdiction identifiers must name a GpUnit of the feed.
 */
public class ValidJurisdictionID extends AbstractRule implements ValidReferenceRule {

    public ValidJurisdictionID(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public String referencedEntity() {
        return "GpUnit";
    }

    @Override
    public Set<String> referenceValues() {
        Set<String> references = new LinkedHashSet<>();
        for (ElectionElement office : all("Office")) {
            references.addAll(OfficesHaveJurisdictionID.jurisdictionIds(office));
        }
        return references;
    }

    @Override
    public Set<String> definedValues() {
        return objectIds("GpUnit");
    }
}
