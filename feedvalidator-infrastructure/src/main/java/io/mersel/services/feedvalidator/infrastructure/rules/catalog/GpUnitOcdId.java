package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.Set;

/**
 * Reporting units of a district type should carry a catalogued OCD-ID.
 */
public class GpUnitOcdId extends OcdIdRule {

    static final Set<String> DISTRICT_TYPES = Set.of(
            "borough", "city", "county", "municipality", "province", "state",
            "town", "township", "village", "ward", "region", "country");

    public GpUnitOcdId(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    protected List<String> targetElements() {
        return List.of("ReportingUnit");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        String id = element.objectId();
        if (id == null || id.isBlank()) {
            return;
        }
        String type = element.childText("Type");
        if (type == null || !DISTRICT_TYPES.contains(type)) {
            return;
        }
        for (ElectionElement identifier : externalIdentifiers(element)) {
            if (!"ocd-id".equals(identifier.childText("Type"))) {
                continue;
            }
            String value = identifier.childText("Value");
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (!isValidOcdId(value)) {
                issues.report("The OCD ID " + value + " of GpUnit " + id + " is not in the list of valid OCD IDs.",
                        identifier);
            }
        }
    }
}
