package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The {@code total-percent} vote counts of a contest add up to 0 or 100.
 * <p>
 * Sums are compared with a relative tolerance of 1e-6. Zero has no scale, so a sum counts
 * as zero when its magnitude is below the same value.
 */
public class PercentSum extends AbstractRule implements ElementRule {

    private static final Logger log = LoggerFactory.getLogger(PercentSum.class);

    static final double TOLERANCE = 1e-6;

    public PercentSum(RuleContext context) {
        super(context, Severity.ERROR);
    }

    @Override
    public List<String> elements() {
        return List.of("Contest");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        double sum = 0.0;
        for (ElectionElement voteCounts : element.iter("VoteCounts")) {
            if (!"total-percent".equals(voteCounts.childText("OtherType"))) {
                continue;
            }
            String count = voteCounts.childText("Count");
            if (count == null || count.isEmpty()) {
                continue;
            }
            try {
                sum += Double.parseDouble(count);
            } catch (NumberFormatException e) {
                log.debug("Unparsable total-percent count '{}' in {}", count, describe(element));
            }
        }
        if (Math.abs(sum) >= TOLERANCE && !isClose(sum, 100.0)) {
            issues.report("Contest percents do not add up to 0 or 100: " + sum + " (" + describe(element) + ")",
                    element);
        }
    }

    static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
    }
}
