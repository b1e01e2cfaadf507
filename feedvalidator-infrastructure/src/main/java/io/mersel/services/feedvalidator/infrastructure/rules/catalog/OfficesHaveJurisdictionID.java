package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Every Office names exactly one jurisdiction, through {@code AdditionalData} or an
 * {@code ExternalIdentifier} of other type {@code jurisdiction-id}.
 */
public class OfficesHaveJurisdictionID extends AbstractRule implements ElementRule {

    public OfficesHaveJurisdictionID(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return List.of("Office");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        int count = jurisdictionIds(element).size();
        if (count == 0) {
            issues.report("Office " + element.objectId() + " is missing a jurisdiction-id.", element);
        } else if (count > 1) {
            issues.report("Office " + element.objectId() + " has more than one jurisdiction-id.", element);
        }
    }

    /**
     * Non-blank jurisdiction identifiers declared on the office, document order.
     */
    static List<String> jurisdictionIds(ElectionElement office) {
        List<String> ids = new ArrayList<>();
        for (ElectionElement data : office.children("AdditionalData")) {
            if ("jurisdiction-id".equals(data.attribute("type")) && data.hasText()) {
                ids.add(data.trimmedText());
            }
        }
        for (ElectionElement identifier : office.iter("ExternalIdentifier")) {
            String type = identifier.childText("Type");
            String value = identifier.childText("Value");
            if (type != null && "other".equals(type.toLowerCase(Locale.ROOT))
                    && "jurisdiction-id".equals(identifier.childText("OtherType"))
                    && value != null && !value.isEmpty()) {
                ids.add(value);
            }
        }
        return ids;
    }
}
