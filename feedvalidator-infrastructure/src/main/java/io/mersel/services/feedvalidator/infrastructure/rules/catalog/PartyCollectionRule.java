package io.mersel.services.feedvalidator.infrastructure.rules.catalog;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.application.models.IssueDetail;
import io.mersel.services.feedvalidator.infrastructure.rules.AbstractRule;
import io.mersel.services.feedvalidator.infrastructure.rules.ElementRule;
import io.mersel.services.feedvalidator.infrastructure.rules.IssueCollector;
import io.mersel.services.feedvalidator.infrastructure.rules.RuleContext;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Base of the Info rules that compare the localized names and abbreviations of the
 * parties of a {@code PartyCollection}.
 * <p>
 * A collection without parties is reported by every subclass with its own message.
 * Findings of one collection are bundled into a single aggregate issue.
 */
public abstract class PartyCollectionRule extends AbstractRule implements ElementRule {

    static final String NAME = "Name";
    static final String ABBREVIATION = "InternationalizedAbbreviation";

    protected PartyCollectionRule(RuleContext context) {
        super(context, Severity.INFO);
    }

    /**
     * Headline of the aggregate issue.
     */
    protected abstract String message();

    protected abstract List<IssueDetail> findings(List<ElectionElement> parties);

    @Override
    public final List<String> elements() {
        return List.of("PartyCollection");
    }

    @Override
    public void check(ElectionElement element, IssueCollector issues) {
        List<ElectionElement> parties = element.children("Party");
        List<IssueDetail> details = parties.isEmpty()
                ? List.of(IssueCollector.detail("The party collection has no Party elements", element))
                : findings(parties);
        if (!details.isEmpty()) {
            issues.report(message(), details);
        }
    }

    /**
     * Language to text of a localized field. A field holding plain text instead of
     * {@code Text} children is keyed by the empty language.
     */
    static Map<String, String> texts(ElectionElement party, String field) {
        Map<String, String> texts = new LinkedHashMap<>();
        ElectionElement container = party.child(field);
        if (container == null) {
            return texts;
        }
        for (ElectionElement text : container.children("Text")) {
            if (text.hasText()) {
                String language = text.attribute("language");
                texts.putIfAbsent(language == null ? "" : language.trim(), text.trimmedText());
            }
        }
        if (texts.isEmpty() && container.hasText()) {
            texts.put("", container.trimmedText());
        }
        return texts;
    }

    /**
     * Parties without the field, and text values shared by more than one party in the
     * same language.
     */
    static List<IssueDetail> duplicated(List<ElectionElement> parties, String field, String label) {
        List<IssueDetail> details = new ArrayList<>();
        Map<List<String>, List<ElectionElement>> owners = new LinkedHashMap<>();
        for (ElectionElement party : parties) {
            Map<String, String> texts = texts(party, field);
            if (texts.isEmpty()) {
                details.add(IssueCollector.detail(describe(party) + " has no " + label, party));
                continue;
            }
            texts.forEach((language, value) ->
                    owners.computeIfAbsent(List.of(language, value), key -> new ArrayList<>()).add(party));
        }
        owners.forEach((key, sharing) -> {
            if (sharing.size() > 1) {
                String ids = sharing.stream().map(AbstractRule::describe).collect(Collectors.joining(", "));
                String language = key.get(0).isEmpty() ? "" : " (" + key.get(0) + ")";
                details.add(IssueCollector.detail(ids + " share the " + label + " '" + key.get(1) + "'" + language,
                        sharing.get(1)));
            }
        });
        return details;
    }

    /**
     * Parties without the field, and parties lacking a language that another party of
     * the collection provides.
     */
    static List<IssueDetail> missingTranslations(List<ElectionElement> parties, String field, String label) {
        Map<ElectionElement, Set<String>> languages = new LinkedHashMap<>();
        Set<String> all = new TreeSet<>();
        for (ElectionElement party : parties) {
            Set<String> own = new TreeSet<>(texts(party, field).keySet());
            own.remove("");
            languages.put(party, own);
            all.addAll(own);
        }
        List<IssueDetail> details = new ArrayList<>();
        for (ElectionElement party : parties) {
            if (party.child(field) == null) {
                details.add(IssueCollector.detail(describe(party) + " has no " + label, party));
                continue;
            }
            Set<String> missing = new TreeSet<>(all);
            missing.removeAll(languages.get(party));
            if (!missing.isEmpty()) {
                details.add(IssueCollector.detail(describe(party) + " has no " + label + " translation for: "
                        + String.join(", ", missing), party));
            }
        }
        return details;
    }
}
