package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.ValidationIssue;
import io.mersel.services.feedvalidator.infrastructure.RuleTestSupport;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ValidReferenceRule")
class ValidReferenceRuleTest {

    private static final ElectionElement ROOT = RuleTestSupport.tree("<ElectionReport/>").root();

    private static ValidReferenceRule rule(ElectionElement root, Set<String> references, Set<String> defined,
                                           String entity) {
        return new ValidReferenceRule() {
            @Override
            public ElectionElement root() {
                return root;
            }

            @Override
            public Set<String> referenceValues() {
                return references;
            }

            @Override
            public Set<String> definedValues() {
                return defined;
            }

            @Override
            public String referencedEntity() {
                return entity;
            }

            @Override
            public Severity defaultSeverity() {
                return Severity.ERROR;
            }
        };
    }

    private static List<ValidationIssue> check(ValidReferenceRule rule) {
        var issues = new IssueCollector("Ref", rule.defaultSeverity());
        rule.check(issues);
        return issues.issues();
    }

    @Test
    @DisplayName("all_defined - no issue")
    void all_defined() {
        assertThat(check(rule(ROOT, Set.of("a", "b"), Set.of("a", "b", "c"), "Party"))).isEmpty();
    }

    @Test
    @DisplayName("dangling_sorted - missing ids reported once, sorted")
    void dangling_sorted() {
        List<ValidationIssue> issues = check(rule(ROOT, Set.of("z", "a", "m"), Set.of("m"), "Person"));

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).message()).isEqualTo("No defined Person for a, z found in the feed.");
        assertThat(issues.get(0).severity()).isEqualTo(Severity.ERROR);
    }

    @Test
    @DisplayName("no_references - nothing referenced, nothing reported")
    void no_references() {
        assertThat(check(rule(ROOT, Set.of(), Set.of("a"), "Party"))).isEmpty();
    }

    @Test
    @DisplayName("nothing_defined - every reference dangles")
    void nothing_defined() {
        List<ValidationIssue> issues = check(rule(ROOT, Set.of("a"), Set.of(), "Party"));

        assertThat(issues).extracting(ValidationIssue::message)
                .containsExactly("No defined Party for a found in the feed.");
    }

    @Test
    @DisplayName("default_entity - generic wording when the entity is not named")
    void default_entity() {
        var rule = new ValidReferenceRule() {
            @Override
            public ElectionElement root() {
                return ROOT;
            }

            @Override
            public Set<String> referenceValues() {
                return Set.of("x");
            }

            @Override
            public Set<String> definedValues() {
                return Set.of();
            }

            @Override
            public Severity defaultSeverity() {
                return Severity.WARNING;
            }
        };

        assertThat(check(rule)).extracting(ValidationIssue::message)
                .containsExactly("No defined data for x found in the feed.");
    }

    @Test
    @DisplayName("no_root - nothing to validate")
    void no_root() {
        assertThat(check(rule(null, Set.of("a"), Set.of(), "Party"))).isEmpty();
    }
}
