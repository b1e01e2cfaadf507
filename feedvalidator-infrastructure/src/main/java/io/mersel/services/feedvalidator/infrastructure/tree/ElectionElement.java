package io.mersel.services.feedvalidator.infrastructure.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One element of a loaded election feed.
 * <p>
 * Holds the local name, attributes in document order, direct text, children and the
 * source line of the start tag. Attributes in a namespace are keyed {@code {uri}local}.
 * Elements are only mutated by {@link ElectionTreeLoader} while loading; rules see a
 * read-only view.
 */
public final class ElectionElement {

    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    private static final String XSI_TYPE = "{" + XSI_NAMESPACE + "}type";

    private final String tag;
    private final Map<String, String> attributes;
    private final List<ElectionElement> children = new ArrayList<>();
    private final ElectionElement parent;
    private final int line;
    private StringBuilder text;

    ElectionElement(String tag, Map<String, String> attributes, ElectionElement parent, int line) {
        this.tag = tag;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.parent = parent;
        this.line = line;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    void appendText(char[] ch, int start, int length) {
        if (text == null) {
            text = new StringBuilder();
        }
        text.append(ch, start, length);
    }

    // ── Identity ────────────────────────────────────────────────────

    public String tag() {
        return tag;
    }

    public int line() {
        return line;
    }

    public ElectionElement parent() {
        return parent;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public String objectId() {
        return attributes.get("objectId");
    }

    /**
     * {@code xsi:type} value without its prefix, or {@code null}.
     */
    public String xsiType() {
        String type = attributes.get(XSI_TYPE);
        if (type == null) {
            return null;
        }
        int colon = type.indexOf(':');
        return colon >= 0 ? type.substring(colon + 1) : type;
    }

    /**
     * True when the tag or the {@code xsi:type} equals the given name.
     */
    public boolean matches(String name) {
        return tag.equals(name) || name.equals(xsiType());
    }

    // ── Text ────────────────────────────────────────────────────────

    /**
     * Raw direct text, {@code null} when the element has no character content.
     */
    public String text() {
        return text == null ? null : text.toString();
    }

    /**
     * Trimmed direct text, empty string when there is none.
     */
    public String trimmedText() {
        return text == null ? "" : text.toString().trim();
    }

    public boolean hasText() {
        return !trimmedText().isEmpty();
    }

    // ── Navigation ──────────────────────────────────────────────────

    public List<ElectionElement> children() {
        return Collections.unmodifiableList(children);
    }

    public List<ElectionElement> children(String name) {
        List<ElectionElement> result = new ArrayList<>();
        for (ElectionElement child : children) {
            if (child.tag.equals(name)) {
                result.add(child);
            }
        }
        return result;
    }

    public ElectionElement child(String name) {
        for (ElectionElement child : children) {
            if (child.tag.equals(name)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Trimmed text of the first child with the given tag, {@code null} when absent.
     */
    public String childText(String name) {
        ElectionElement child = child(name);
        return child == null ? null : child.trimmedText();
    }

    /**
     * Elements reached by a slash separated path of tags relative to this element,
     * e.g. {@code "PartyCollection/Party"}.
     */
    public List<ElectionElement> findAll(String path) {
        List<ElectionElement> current = List.of(this);
        for (String step : path.split("/")) {
            List<ElectionElement> next = new ArrayList<>();
            for (ElectionElement element : current) {
                next.addAll(element.children(step));
            }
            current = next;
        }
        return current;
    }

    public ElectionElement find(String path) {
        List<ElectionElement> found = findAll(path);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Every element of the subtree in document order, this element first.
     */
    public List<ElectionElement> subtree() {
        List<ElectionElement> result = new ArrayList<>();
        Deque<ElectionElement> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ElectionElement element = stack.pop();
            result.add(element);
            for (int i = element.children.size() - 1; i >= 0; i--) {
                stack.push(element.children.get(i));
            }
        }
        return result;
    }

    /**
     * Elements of the subtree, this element included, whose tag or {@code xsi:type} matches.
     */
    public List<ElectionElement> iter(String name) {
        List<ElectionElement> result = new ArrayList<>();
        for (ElectionElement element : subtree()) {
            if (element.matches(name)) {
                result.add(element);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        String id = objectId();
        return "<" + tag + (id != null ? " objectId=\"" + id + "\"" : "") + "> (line " + line + ")";
    }
}
