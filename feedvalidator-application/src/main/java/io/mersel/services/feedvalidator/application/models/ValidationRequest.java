package io.mersel.services.feedvalidator.application.models;

import io.mersel.services.feedvalidator.application.enums.RuleSet;

import java.nio.file.Path;
import java.util.Set;

/**
 * Input of a validation run.
 *
 * @param feed          Election feed to validate
 * @param schema        XSD the feed must conform to
 * @param ruleSet       Rule set to run
 * @param countryCode   Country of the OCD-ID catalogue, {@code null} to skip OCD-ID rules
 * @param localOcdFile  Local OCD-ID catalogue used instead of the remote one, may be {@code null}
 * @param excludedRules Rule names to skip
 */
public record ValidationRequest(
        Path feed,
        Path schema,
        RuleSet ruleSet,
        String countryCode,
        Path localOcdFile,
        Set<String> excludedRules
) {

    public ValidationRequest {
        ruleSet = ruleSet == null ? RuleSet.ELECTION : ruleSet;
        excludedRules = excludedRules == null ? Set.of() : Set.copyOf(excludedRules);
    }

    public static ValidationRequest of(Path feed, Path schema) {
        return new ValidationRequest(feed, schema, RuleSet.ELECTION, null, null, Set.of());
    }
}
