package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.List;

/**
 * Rule invoked once per matching element, in document order.
 * <p>
 * An element matches when its tag or {@code xsi:type} is one of {@link #elements()}.
 * A rule returning no element names is never invoked.
 */
public interface ElementRule extends ValidationRule {

    List<String> elements();

    void check(ElectionElement element, IssueCollector issues);
}
