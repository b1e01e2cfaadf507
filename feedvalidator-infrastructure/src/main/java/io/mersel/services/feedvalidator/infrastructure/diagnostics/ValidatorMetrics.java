package io.mersel.services.feedvalidator.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.feedvalidator.application.enums.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Application metrics of the feed validator.
 */
@Component
public class ValidatorMetrics {

    private final MeterRegistry registry;

    public ValidatorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a finished validation run.
     *
     * @param ruleSet    Rule set name (ELECTION, OFFICEHOLDER)
     * @param result     "valid", "invalid" or "error"
     * @param durationMs Run duration (milliseconds)
     */
    public void recordValidation(String ruleSet, String result, long durationMs) {
        Counter.builder("feedvalidator_validations_total")
                .tag("rule_set", ruleSet)
                .tag("result", result)
                .description("Validation runs")
                .register(registry)
                .increment();

        Timer.builder("feedvalidator_validation_duration")
                .tag("rule_set", ruleSet)
                .description("Validation run duration")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Records emitted issues per severity.
     */
    public void recordIssues(Severity severity, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("feedvalidator_issues_total")
                .tag("severity", severity.key())
                .description("Issues emitted by rules")
                .register(registry)
                .increment(count);
    }

    /**
     * Records a rule that threw instead of reporting an issue.
     */
    public void recordRuleFailure(String rule) {
        Counter.builder("feedvalidator_rule_failures_total")
                .tag("rule", rule)
                .description("Rules aborted by an unexpected exception")
                .register(registry)
                .increment();
    }

    /**
     * Records an OCD-ID catalogue acquisition.
     *
     * @param source     "local", "cache", "download" or "none" on failure
     * @param success    Catalogue loaded
     * @param durationMs Duration (milliseconds)
     */
    public void recordDatasetSync(String source, boolean success, long durationMs) {
        Counter.builder("feedvalidator_ocd_sync_total")
                .tag("source", source)
                .tag("status", success ? "success" : "failure")
                .description("OCD-ID catalogue acquisitions")
                .register(registry)
                .increment();

        Timer.builder("feedvalidator_ocd_sync_duration")
                .description("OCD-ID catalogue acquisition duration")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Registers a gauge reporting the number of catalogues held in memory.
     */
    public void registerDatasetCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("feedvalidator_ocd_cache_size", cache, c -> (double) c.estimatedSize())
                .description("OCD-ID catalogues held in memory")
                .register(registry);
    }
}
