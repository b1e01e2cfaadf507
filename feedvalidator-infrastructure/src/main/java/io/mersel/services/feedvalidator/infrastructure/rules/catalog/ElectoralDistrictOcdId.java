package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;
import java.util.Locale;

/**
 * The {@code ElectoralDistrictId} of a contest must point at a GpUnit carrying a
 * catalogued OCD-ID.
 */
public class ElectoralDistrictOcdId extends OcdIdRule {

    public ElectoralDistrictOcdId(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    protected List<String> targetElements() {
        return List.of("ElectoralDistrictId");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        ElectionElement contest = element.parent();
        if (contest == null || !"Contest".equals(contest.tag())) {
            return;
        }
        String contestId = contest.objectId();
        if (contestId == null || contestId.isBlank()) {
            return;
        }

        String districtId = element.trimmedText();
        ElectionElement gpUnit = context.index().first("GpUnit", districtId);
        if (gpUnit == null) {
            issues.report("The contest " + contestId + " does not refer to a GpUnit (" + districtId + ").", element);
            return;
        }

        List<ElectionElement> identifiers = externalIdentifiers(gpUnit);
        if (identifiers.isEmpty()) {
            issues.report("The GpUnit " + districtId + " referenced by contest " + contestId
                    + " does not have any external identifiers.", element);
            return;
        }

        for (ElectionElement identifier : identifiers) {
            String type = identifier.childText("Type");
            if (type == null || !"ocd-id".equals(type.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (!"ocd-id".equals(type)) {
                issues.report("The ExternalIdentifier type of GpUnit " + districtId
                        + " is incorrect. Should be ocd-id and not " + type + ".", identifier);
                return;
            }
            String value = identifier.childText("Value");
            if (value != null && isValidOcdId(value)) {
                return;
            }
            issues.report("The contest " + contestId + " does not have a valid OCD ID: " + value, element);
            return;
        }
        issues.report("The contest " + contestId + " does not have a valid OCD ID.", element);
    }
}
