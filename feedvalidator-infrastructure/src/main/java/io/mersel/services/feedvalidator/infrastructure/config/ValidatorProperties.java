package io.mersel.services.feedvalidator.infrastructure.config;

import io.mersel.services.feedvalidator.application.enums.Severity;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule engine settings under {@code feed-validator.rules}.
 * <ul>
 *   <li>{@code severity-overrides} Rule name to severity, replaces the rule's default severity</li>
 *   <li>{@code excluded} Rule names that are never run</li>
 *   <li>{@code max-details-per-issue} Upper bound of sub-findings kept in one aggregate issue</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "feed-validator.rules")
public class ValidatorProperties {

    private static final Logger log = LoggerFactory.getLogger(ValidatorProperties.class);

    private Map<String, Severity> severityOverrides = new LinkedHashMap<>();
    private List<String> excluded = new ArrayList<>();
    private int maxDetailsPerIssue = 500;

    @PostConstruct
    void validate() {
        if (maxDetailsPerIssue <= 0) {
            log.warn("max-details-per-issue must be positive (given: {}), using 500", maxDetailsPerIssue);
            maxDetailsPerIssue = 500;
        }
        if (!severityOverrides.isEmpty()) {
            log.info("Rule severity overrides: {}", severityOverrides);
        }
    }

    public Map<String, Severity> getSeverityOverrides() {
        return severityOverrides;
    }

    public void setSeverityOverrides(Map<String, Severity> severityOverrides) {
        this.severityOverrides = severityOverrides;
    }

    public List<String> getExcluded() {
        return excluded;
    }

    public void setExcluded(List<String> excluded) {
        this.excluded = excluded;
    }

    public int getMaxDetailsPerIssue() {
        return maxDetailsPerIssue;
    }

    public void setMaxDetailsPerIssue(int maxDetailsPerIssue) {
        this.maxDetailsPerIssue = maxDetailsPerIssue;
    }
}
