package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.RuleSet;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.AllCaps;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.CandidatesReferencedOnce;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.CoalitionParties;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ContestHasMultipleOffices;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.DuplicateGpUnits;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.DuplicateID;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.DuplicatedPartyAbbreviation;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.DuplicatedPartyName;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ElectionEndDates;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ElectionStartDates;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ElectoralDistrictOcdId;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.EmptyText;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.Encoding;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.GpUnitOcdId;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.GpUnitsCyclesRefsValidation;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.GpUnitsHaveSingleRoot;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.MissingPartyAbbreviationTranslation;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.MissingPartyAffiliation;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.MissingPartyNameTranslation;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.OfficeMissingOfficeHolderPersonData;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.OfficesHaveJurisdictionID;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.OnlyOneElection;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.OptionalAndEmpty;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.OtherType;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PartiesHaveValidColors;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PartisanPrimary;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PartisanPrimaryHeuristic;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PartyLeadershipMustExist;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PercentSum;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PersonHasOffice;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.PersonsMissingPartyData;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ProhibitElectionData;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ValidEnumerations;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ValidIDREF;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ValidJurisdictionID;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ValidateDuplicateColors;
import io.mersel.services.feedvalidator.infrastructure.rules.catalog.ValidateOcdidLowerCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Fixed, ordered rule sets. Each entry maps the rule name to its constructor; the order
 * is the evaluation and report order.
 */
public final class RulesRegistry {

    private static final Map<RuleSet, Map<String, Function<RuleContext, ValidationRule>>> RULE_SETS =
            new EnumMap<>(RuleSet.class);

    static {
        Map<String, Function<RuleContext, ValidationRule>> election = new LinkedHashMap<>();
        election.put("Encoding", Encoding::new);
        election.put("OptionalAndEmpty", OptionalAndEmpty::new);
        election.put("EmptyText", EmptyText::new);
        election.put("ValidIDREF", ValidIDREF::new);
        election.put("DuplicateID", DuplicateID::new);
        election.put("OnlyOneElection", OnlyOneElection::new);
        election.put("PercentSum", PercentSum::new);
        election.put("OtherType", OtherType::new);
        election.put("ValidEnumerations", ValidEnumerations::new);
        election.put("DuplicateGpUnits", DuplicateGpUnits::new);
        election.put("GpUnitsHaveSingleRoot", GpUnitsHaveSingleRoot::new);
        election.put("GpUnitsCyclesRefsValidation", GpUnitsCyclesRefsValidation::new);
        election.put("ElectoralDistrictOcdId", ElectoralDistrictOcdId::new);
        election.put("GpUnitOcdId", GpUnitOcdId::new);
        election.put("ValidateOcdidLowerCase", ValidateOcdidLowerCase::new);
        election.put("CoalitionParties", CoalitionParties::new);
        election.put("CandidatesReferencedOnce", CandidatesReferencedOnce::new);
        election.put("MissingPartyAffiliation", MissingPartyAffiliation::new);
        election.put("PartiesHaveValidColors", PartiesHaveValidColors::new);
        election.put("ValidateDuplicateColors", ValidateDuplicateColors::new);
        election.put("DuplicatedPartyName", DuplicatedPartyName::new);
        election.put("DuplicatedPartyAbbreviation", DuplicatedPartyAbbreviation::new);
        election.put("MissingPartyNameTranslation", MissingPartyNameTranslation::new);
        election.put("MissingPartyAbbreviationTranslation", MissingPartyAbbreviationTranslation::new);
        election.put("AllCaps", AllCaps::new);
        election.put("ContestHasMultipleOffices", ContestHasMultipleOffices::new);
        election.put("PartisanPrimary", PartisanPrimary::new);
        election.put("PartisanPrimaryHeuristic", PartisanPrimaryHeuristic::new);
        election.put("ElectionStartDates", ElectionStartDates::new);
        election.put("ElectionEndDates", ElectionEndDates::new);
        RULE_SETS.put(RuleSet.ELECTION, Collections.unmodifiableMap(election));

        Map<String, Function<RuleContext, ValidationRule>> officeholder = new LinkedHashMap<>();
        officeholder.put("Encoding", Encoding::new);
        officeholder.put("OptionalAndEmpty", OptionalAndEmpty::new);
        officeholder.put("EmptyText", EmptyText::new);
        officeholder.put("ValidIDREF", ValidIDREF::new);
        officeholder.put("DuplicateID", DuplicateID::new);
        officeholder.put("OtherType", OtherType::new);
        officeholder.put("ValidEnumerations", ValidEnumerations::new);
        officeholder.put("DuplicateGpUnits", DuplicateGpUnits::new);
        officeholder.put("GpUnitsHaveSingleRoot", GpUnitsHaveSingleRoot::new);
        officeholder.put("GpUnitsCyclesRefsValidation", GpUnitsCyclesRefsValidation::new);
        officeholder.put("GpUnitOcdId", GpUnitOcdId::new);
        officeholder.put("ValidateOcdidLowerCase", ValidateOcdidLowerCase::new);
        officeholder.put("MissingPartyAffiliation", MissingPartyAffiliation::new);
        officeholder.put("PartiesHaveValidColors", PartiesHaveValidColors::new);
        officeholder.put("ValidateDuplicateColors", ValidateDuplicateColors::new);
        officeholder.put("DuplicatedPartyName", DuplicatedPartyName::new);
        officeholder.put("DuplicatedPartyAbbreviation", DuplicatedPartyAbbreviation::new);
        officeholder.put("MissingPartyNameTranslation", MissingPartyNameTranslation::new);
        officeholder.put("MissingPartyAbbreviationTranslation", MissingPartyAbbreviationTranslation::new);
        officeholder.put("PersonsMissingPartyData", PersonsMissingPartyData::new);
        officeholder.put("AllCaps", AllCaps::new);
        officeholder.put("OfficeMissingOfficeHolderPersonData", OfficeMissingOfficeHolderPersonData::new);
        officeholder.put("PartyLeadershipMustExist", PartyLeadershipMustExist::new);
        officeholder.put("PersonHasOffice", PersonHasOffice::new);
        officeholder.put("OfficesHaveJurisdictionID", OfficesHaveJurisdictionID::new);
        officeholder.put("ValidJurisdictionID", ValidJurisdictionID::new);
        officeholder.put("ProhibitElectionData", ProhibitElectionData::new);
        RULE_SETS.put(RuleSet.OFFICEHOLDER, Collections.unmodifiableMap(officeholder));
    }

    private RulesRegistry() {
    }

    /**
     * Instantiates the rules of a set for one run, skipping excluded names.
     */
    public static List<ValidationRule> create(RuleSet ruleSet, RuleContext context, Set<String> excluded) {
        List<ValidationRule> rules = new ArrayList<>();
        for (Map.Entry<String, Function<RuleContext, ValidationRule>> entry : RULE_SETS.get(ruleSet).entrySet()) {
            if (!excluded.contains(entry.getKey())) {
                rules.add(entry.getValue().apply(context));
            }
        }
        return rules;
    }

    public static List<String> names(RuleSet ruleSet) {
        return List.copyOf(RULE_SETS.get(ruleSet).keySet());
    }

    /**
     * Names of every rule of every set.
     */
    public static Set<String> allNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Function<RuleContext, ValidationRule>> rules : RULE_SETS.values()) {
            names.addAll(rules.keySet());
        }
        return names;
    }
}
