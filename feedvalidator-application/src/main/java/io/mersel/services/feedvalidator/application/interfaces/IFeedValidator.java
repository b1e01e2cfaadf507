package io.mersel.services.feedvalidator.application.interfaces;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.application.models.ValidationReport;
import io.mersel.services.feedvalidator.application.models.ValidationRequest;

import java.util.List;

/**
 * Validates an election feed against its schema and the business rule catalogue.
 */
public interface IFeedValidator {

    /**
     * Runs schema conformance and every rule of the requested rule set.
     *
     * @param request Feed, schema, rule set and OCD-ID options
     * @return Report with all issues, entity counts and the verdict
     * @throws FeedLoadException   the feed is unreadable or not well formed
     * @throws SchemaLoadException the schema is unreadable or does not compile
     */
    ValidationReport validate(ValidationRequest request) throws FeedLoadException, SchemaLoadException;

    /**
     * Rule names of a rule set in evaluation order.
     */
    List<String> ruleNames(RuleSet ruleSet);
}
