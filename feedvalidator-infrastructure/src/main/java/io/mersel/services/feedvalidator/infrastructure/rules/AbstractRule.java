package io.mersel.services.feedvalidator.infrastructure.rules;

import io.mersel.services.feedvalidator.application.enums.Severity;
import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base class of the rule catalogue: keeps the run context and the default severity.
 */
public abstract class AbstractRule implements ValidationRule {

    protected final RuleContext context;
    private final Severity defaultSeverity;

    protected AbstractRule(RuleContext context, Severity defaultSeverity) {
        this.context = context;
        this.defaultSeverity = defaultSeverity;
    }

    @Override
    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    public ElectionElement root() {
        return context.root();
    }

    /**
     * Elements anywhere below the root whose tag or {@code xsi:type} matches.
     */
    protected List<ElectionElement> all(String name) {
        ElectionElement root = root();
        return root == null ? List.of() : root.iter(name);
    }

    /**
     * Non-blank {@code objectId} values of all matching elements.
     */
    protected Set<String> objectIds(String name) {
        Set<String> ids = new LinkedHashSet<>();
        for (ElectionElement element : all(name)) {
            String id = element.objectId();
            if (id != null && !id.isBlank()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    /**
     * Direct members of every matching collection, e.g.
     * {@code members("PersonCollection", "Person")}.
     */
    protected List<ElectionElement> members(String collection, String member) {
        List<ElectionElement> members = new ArrayList<>();
        for (ElectionElement container : all(collection)) {
            members.addAll(container.children(member));
        }
        return members;
    }

    /**
     * Non-blank {@code objectId} values of {@link #members(String, String)}.
     */
    protected Set<String> memberIds(String collection, String member) {
        Set<String> ids = new LinkedHashSet<>();
        for (ElectionElement element : members(collection, member)) {
            String id = element.objectId();
            if (id != null && !id.isBlank()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    /**
     * Whitespace separated identifiers of an IDREFS style text, empty list for blank text.
     */
    protected static List<String> splitIds(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        for (String id : text.trim().split("\\s+")) {
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    protected static String describe(ElectionElement element) {
        String id = element.objectId();
        return id == null || id.isBlank() ? element.tag() : element.tag() + " " + id;
    }
}
