package io.mersel.services.feedvalidator.application.enums;

/**
 * Supported rule sets.
 * <p>
 * {@link #ELECTION} is for election result feeds, {@link #OFFICEHOLDER} for feeds
 * that only carry officeholder data.
 */
public enum RuleSet {
    ELECTION,
    OFFICEHOLDER;

    public static RuleSet fromName(String value) {
        for (RuleSet ruleSet : values()) {
            if (ruleSet.name().equalsIgnoreCase(value.trim())) {
                return ruleSet;
            }
        }
        throw new IllegalArgumentException("Unknown rule set: " + value);
    }
}
