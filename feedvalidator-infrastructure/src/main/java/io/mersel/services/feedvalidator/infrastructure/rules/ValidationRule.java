package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.Severity;

/**
 * Unit of validation logic.
 * <p>
 * Rules report violations through the {@link IssueCollector} they are handed and never
 * mutate the tree. Concrete rules implement {@link ElementRule} or {@link TreeRule}.
 */
public interface ValidationRule {

    /**
     * Registry name of the rule, also used in reports and severity overrides.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Severity of the issues the rule reports through {@link IssueCollector#report}.
     */
    Severity defaultSeverity();

    /**
     * Called once before the rule is evaluated. Returning {@code false} skips the rule;
     * the rule is expected to have reported why.
     */
    default boolean prepare(IssueCollector issues) {
        return true;
    }
}
