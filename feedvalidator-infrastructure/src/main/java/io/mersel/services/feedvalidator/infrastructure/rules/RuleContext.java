package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.infrastructure.ocd.OcdIdLookup;
import io.mersel.services.feedvalidator.infrastructure.schema.SchemaFacts;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionIndex;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionTree;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Everything a rule may read during one validation run.
 *
 * @param tree        Loaded feed, {@code null} when there is no document to validate
 * @param schemaFacts Facts of the feed's schema
 * @param ocdIds      OCD-ID catalogue of the run
 * @param clock       Clock used by date rules
 * @param index       {@code objectId} index of the tree
 */
public record RuleContext(ElectionTree tree, SchemaFacts schemaFacts, OcdIdLookup ocdIds, Clock clock,
                          ElectionIndex index) {

    public RuleContext {
        index = index == null ? ElectionIndex.of(tree) : index;
        schemaFacts = schemaFacts == null ? SchemaFacts.empty() : schemaFacts;
        ocdIds = ocdIds == null ? OcdIdLookup.disabled() : ocdIds;
        clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public RuleContext(ElectionTree tree, SchemaFacts schemaFacts, OcdIdLookup ocdIds, Clock clock) {
        this(tree, schemaFacts, ocdIds, clock, null);
    }

    public static RuleContext of(ElectionTree tree) {
        return new RuleContext(tree, SchemaFacts.empty(), OcdIdLookup.disabled(), Clock.systemDefaultZone());
    }

    public ElectionElement root() {
        return tree == null ? null : tree.root();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
