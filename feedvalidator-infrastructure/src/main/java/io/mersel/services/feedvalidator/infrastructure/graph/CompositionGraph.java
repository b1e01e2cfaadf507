package io.mersel.services.feedvalidator.infrastructure.graph;

import io.mersel.services.feedvalidator.infrastructure.tree.ElectionElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Composition graph of the GpUnits of one collection.
 * <p>
 * Nodes are the units carrying an {@code objectId}; there is an edge from a unit to every
 * identifier listed in its {@code ComposingGpUnitIds}. The graph is built per check and
 * never mutated. Traversals use an explicit stack so malformed input cannot exhaust the
 * call stack.
 */
public final class CompositionGraph {

    /**
     * One unit of the collection.
     *
     * @param id           Unit identifier
     * @param composingIds Identifiers of the composing units, document order
     * @param line         Source line, 0 when unknown
     */
    public record Unit(String id, List<String> composingIds, int line) {

        public Unit {
            composingIds = List.copyOf(composingIds);
        }
    }

    private final List<Unit> units;
    private final Map<String, Unit> byId = new LinkedHashMap<>();

    private CompositionGraph(List<Unit> units) {
        this.units = List.copyOf(units);
        for (Unit unit : this.units) {
            byId.putIfAbsent(unit.id(), unit);
        }
    }

    public static CompositionGraph of(List<Unit> units) {
        return new CompositionGraph(units);
    }

    /**
     * Builds the graph from the {@code GpUnit} children of a {@code GpUnitCollection}.
     * Units without an {@code objectId} are not part of the graph.
     */
    public static CompositionGraph fromCollection(ElectionElement collection) {
        List<Unit> units = new ArrayList<>();
        if (collection == null) {
            return new CompositionGraph(units);
        }
        for (ElectionElement gpUnit : collection.children("GpUnit")) {
            String id = gpUnit.objectId();
            if (id == null || id.isBlank()) {
                continue;
            }
            List<String> composing = new ArrayList<>();
            ElectionElement composingIds = gpUnit.child("ComposingGpUnitIds");
            if (composingIds != null && composingIds.hasText()) {
                for (String child : composingIds.trimmedText().split("\\s+")) {
                    composing.add(child);
                }
            }
            units.add(new Unit(id.trim(), composing, gpUnit.line()));
        }
        return new CompositionGraph(units);
    }

    public List<Unit> units() {
        return units;
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    /**
     * Identifiers never listed as a composing unit of any unit, document order.
     * A valid graph has exactly one; none means every unit is part of a cycle path.
     */
    public List<String> rootCandidates() {
        Set<String> referenced = new HashSet<>();
        for (Unit unit : units) {
            referenced.addAll(unit.composingIds());
        }
        List<String> roots = new ArrayList<>();
        for (String id : byId.keySet()) {
            if (!referenced.contains(id)) {
                roots.add(id);
            }
        }
        return roots;
    }

    /**
     * Nodes at which a cycle closes, i.e. nodes reached again while still on the current
     * depth-first path. Each node is reported once, in discovery order. Composing ids that
     * name no unit are ignored.
     */
    public List<String> cycleClosingNodes() {
        Set<String> closing = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();

        for (String start : byId.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(byId.get(start)));
            onPath.add(start);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.unit.composingIds().size()) {
                    String child = frame.unit.composingIds().get(frame.next++);
                    if (onPath.contains(child)) {
                        closing.add(child);
                    } else if (!visited.contains(child) && byId.containsKey(child)) {
                        stack.push(new Frame(byId.get(child)));
                        onPath.add(child);
                    }
                } else {
                    stack.pop();
                    onPath.remove(frame.unit.id());
                    visited.add(frame.unit.id());
                }
            }
        }
        return new ArrayList<>(closing);
    }

    /**
     * Groups of units sharing the same non-empty set of composing identifiers.
     * Member identifiers are listed in document order; only groups with two or more
     * members are returned.
     */
    public List<List<String>> duplicatePaths() {
        Map<Set<String>, List<String>> groups = new LinkedHashMap<>();
        for (Unit unit : units) {
            if (unit.composingIds().isEmpty()) {
                continue;
            }
            Set<String> key = Set.copyOf(unit.composingIds());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(unit.id());
        }
        List<List<String>> duplicates = new ArrayList<>();
        for (List<String> members : groups.values()) {
            if (members.size() > 1) {
                duplicates.add(List.copyOf(members));
            }
        }
        return duplicates;
    }

    /**
     * Identifiers used by more than one unit, in order of first reuse.
     */
    public List<String> duplicateIds() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Unit unit : units) {
            if (!seen.add(unit.id())) {
                duplicates.add(unit.id());
            }
        }
        return new ArrayList<>(duplicates);
    }

    /**
     * Source line of the first unit with the given identifier, {@code null} when unknown.
     */
    public Integer lineOf(String id) {
        Unit unit = byId.get(id);
        return unit == null || unit.line() <= 0 ? null : unit.line();
    }

    private static final class Frame {
        private final Unit unit;
        private int next;

        private Frame(Unit unit) {
            this.unit = unit;
        }
    }
}
