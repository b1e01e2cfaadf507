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
 * A party has at most one {@code Color}, written as six hex digits without a leading {@code #}.
 */
public class PartiesHaveValidColors extends AbstractRule implements ElementRule {

    private static final Pattern HEX_COLOR = Pattern.compile("[0-9a-fA-F]{6}");

    public PartiesHaveValidColors(RuleContext context) {
        super(context, Severity.WARNING);
    }

    @Override
    public List<String> elements() {
        return List.of("Party");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        List<ElectionElement> colors = element.children("Color");
        if (colors.isEmpty()) {
            return;
        }
        if (colors.size() > 1) {
            issues.report(describe(element) + " has more than one color.", colors.get(1));
            return;
        }
        ElectionElement color = colors.get(0);
        if (!color.hasText()) {
            issues.report("The color of " + describe(element) + " is missing a value.", color);
        } else if (!HEX_COLOR.matcher(color.trimmedText()).matches()) {
            issues.report("The color " + color.trimmedText() + " of " + describe(element)
                    + " is not a valid hex color.", color);
        }
    }
}
