package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.infrastructure.RuleTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RulesRegistry")
class RulesRegistryTest {

    private static final RuleContext CONTEXT = RuleTestSupport.context("<ElectionReport/>");

    @Test
    @DisplayName("every_rule_registered - registry equals the concrete rule classes")
    void every_rule_registered() {
        var scanner = new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AssignableTypeFilter(ValidationRule.class));

        Set<String> implemented = scanner.findCandidateComponents(RulesRegistry.class.getPackageName()).stream()
                .map(BeanDefinition::getBeanClassName)
                .map(ClassUtils::getShortName)
                .collect(Collectors.toSet());

        assertThat(implemented).isNotEmpty();
        assertThat(RulesRegistry.allNames()).containsExactlyInAnyOrderElementsOf(implemented);
    }

    @Test
    @DisplayName("names_match_classes - registry key is the rule's reported name")
    void names_match_classes() {
        for (RuleSet ruleSet : RuleSet.values()) {
            assertThat(RulesRegistry.create(ruleSet, CONTEXT, Set.of()))
                    .extracting(ValidationRule::name)
                    .containsExactlyElementsOf(RulesRegistry.names(ruleSet));
        }
    }

    @Test
    @DisplayName("rule_set_order - fixed order, first and last rules")
    void rule_set_order() {
        assertThat(RulesRegistry.names(RuleSet.ELECTION)).hasSize(30)
                .startsWith("Encoding", "OptionalAndEmpty")
                .containsSubsequence("MissingPartyAffiliation", "PartiesHaveValidColors", "ValidateDuplicateColors")
                .endsWith("ElectionStartDates", "ElectionEndDates");
        assertThat(RulesRegistry.names(RuleSet.OFFICEHOLDER)).hasSize(27)
                .contains("PersonHasOffice", "ProhibitElectionData")
                .doesNotContain("OnlyOneElection", "CandidatesReferencedOnce");
    }

    @Test
    @DisplayName("excluded_rules - skipped by name")
    void excluded_rules() {
        assertThat(RulesRegistry.create(RuleSet.ELECTION, CONTEXT, Set.of("AllCaps", "DuplicateID")))
                .extracting(ValidationRule::name)
                .hasSize(28)
                .doesNotContain("AllCaps", "DuplicateID");
    }
}
