package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parties of a collection should be told apart by color. Colors compare case-insensitively.
 */
public class ValidateDuplicateColors extends AbstractRule implements ElementRule {

    public ValidateDuplicateColors(RuleContext context) {
        super(context, Severity.INFO);
    }

    @Override
    public List<String> elements() {
        return List.of("PartyCollection");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        Map<String, List<ElectionElement>> byColor = new LinkedHashMap<>();
        for (ElectionElement party : element.children("Party")) {
            String color = party.childText("Color");
            if (color != null && !color.isEmpty()) {
                byColor.computeIfAbsent(color.toLowerCase(Locale.ROOT), key -> new ArrayList<>()).add(party);
            }
        }
        List<IssueDetail> details = new ArrayList<>();
        byColor.forEach((color, parties) -> {
            if (parties.size() > 1) {
                details.add(IssueCollector.detail(parties.stream().map(AbstractRule::describe)
                        .collect(Collectors.joining(", ")) + " share the color " + color, parties.get(1)));
            }
        });
        if (!details.isEmpty()) {
            issues.report("There are parties with duplicate colors", details);
        }
    }
}
