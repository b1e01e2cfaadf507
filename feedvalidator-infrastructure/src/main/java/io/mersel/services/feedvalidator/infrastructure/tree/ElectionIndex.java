package io.mersel.services.feedvalidator.infrastructure.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Elements of a feed keyed by their trimmed {@code objectId}, document order.
 * Built once per run and shared read-only by the rules.
 */
public final class ElectionIndex {

    private static final ElectionIndex EMPTY = new ElectionIndex(Map.of());

    private final Map<String, List<ElectionElement>> byObjectId;

    private ElectionIndex(Map<String, List<ElectionElement>> byObjectId) {
        this.byObjectId = byObjectId;
    }

    public static ElectionIndex of(ElectionTree tree) {
        if (tree == null || tree.root() == null) {
            return EMPTY;
        }
        Map<String, List<ElectionElement>> index = new LinkedHashMap<>();
        for (ElectionElement element : tree.root().subtree()) {
            String id = element.objectId();
            if (id != null && !id.isBlank()) {
                index.computeIfAbsent(id.trim(), key -> new ArrayList<>()).add(element);
            }
        }
        index.replaceAll((id, elements) -> List.copyOf(elements));
        return new ElectionIndex(Collections.unmodifiableMap(index));
    }

    public Set<String> objectIds() {
        return byObjectId.keySet();
    }

    public boolean contains(String objectId) {
        return objectId != null && byObjectId.containsKey(objectId);
    }

    public List<ElectionElement> withObjectId(String objectId) {
        return objectId == null ? List.of() : byObjectId.getOrDefault(objectId, List.of());
    }

    /**
     * First element named {@code name} with the given {@code objectId}, or {@code null}.
     */
    public ElectionElement first(String name, String objectId) {
        for (ElectionElement element : withObjectId(objectId)) {
            if (element.matches(name)) {
                return element;
            }
        }
        return null;
    }
}
