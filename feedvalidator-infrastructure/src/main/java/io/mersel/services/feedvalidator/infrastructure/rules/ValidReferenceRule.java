package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.Set;
import java.util.TreeSet;

/**
 * Reference integrity check: every referenced identifier must be defined in the feed.
 * <p>
 * Implementations only gather the two sets; {@link #check(IssueCollector)} reports the
 * sorted difference {@code referenceValues - definedValues} as one issue. A document
 * without a root is not validated.
 */
public interface ValidReferenceRule extends TreeRule {

    /**
     * Document root, {@code null} when there is nothing to validate.
     */
    ElectionElement root();

    Set<String> referenceValues();

    Set<String> definedValues();

    /**
     * Name of the referenced entity used in the message ("Party", "Person", ...).
     */
    default String referencedEntity() {
        return "data";
    }

    @Override
    default void check(IssueCollector issues) {
        if (root() == null) {
            return;
        }
        Set<String> dangling = new TreeSet<>(referenceValues());
        dangling.removeAll(definedValues());
        if (!dangling.isEmpty()) {
            issues.report("No defined " + referencedEntity() + " for " + String.join(", ", dangling)
                    + " found in the feed.", (Integer) null);
        }
    }
}
