package io.mersel.services.feedvalidator.infrastructure.rules;

/**
 * Rule invoked exactly once for the whole document.
 */
public interface TreeRule extends ValidationRule {

    void check(IssueCollector issues);
}
