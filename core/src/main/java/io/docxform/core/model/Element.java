package io.docxform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Container node: an ordered child list (insertion order is document order) and an
 * insertion-ordered attribute map.
 *
 * <p>Every mutating method first consults the {@link MutationGuard} installed on the tree root. A
 * guard that refuses turns the call into a no-op.
 */
public final class Element extends Node {

    /** Type tag of document roots. */
    public static final String DOCUMENT_TYPE = "#document";

    private final List<Node> children = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private MutationGuard guard;

    /** Creates a closed element with no source position, as converters do. */
    public Element(String type) {
        super(type, SourceSpan.NONE);
    }

    /** Creates an open element starting at {@code start}, as node parsers do. */
    public Element(String type, int start) {
        super(type, start);
    }

    /** Creates an element closed over {@code span}. */
    public Element(String type, SourceSpan span) {
        super(type, span);
    }

    @Override
    public boolean isElement() {
        return true;
    }

    /** Unmodifiable view of the children. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** The first child, or {@code null}. */
    public Node firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    /** The last child, or {@code null}. */
    public Node lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * Appends {@code child} and makes this element its parent.
     *
     * @return the appended child
     * @throws IllegalArgumentException if {@code child} is this element or one of its ancestors
     * @throws IllegalStateException if {@code child} already has a parent
     */
    public <T extends Node> T appendChild(T child) {
        return insertChild(children.size(), child);
    }

    /**
     * Inserts {@code child} at {@code index}.
     *
     * @return the inserted child
     */
    public <T extends Node> T insertChild(int index, T child) {
        Objects.requireNonNull(child, "child must not be null");
        if (child == this || (child.isElement() && hasAncestor(child))) {
            throw new IllegalArgumentException("appending '" + child.type() + "' to '" + type() + "' would create a cycle");
        }
        if (child.parent() != null) {
            throw new IllegalStateException("node '" + child.type() + "' at " + child.span()
                    + " already belongs to '" + child.parent().type() + "'");
        }
        if (index < 0 || index > children.size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of range 0.." + children.size());
        }
        if (!mutationPermitted()) {
            return child;
        }
        child.attachTo(this);
        children.add(index, child);
        return child;
    }

    /**
     * Replaces {@code existing} with {@code replacement}. The replaced subtree is discarded.
     *
     * @throws IllegalArgumentException if {@code existing} is not a child of this element
     */
    public void replaceChild(Node existing, Node replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        int index = indexOfChild(existing);
        if (index < 0) {
            throw new IllegalArgumentException("'" + existing + "' is not a child of '" + type() + "'");
        }
        if (replacement.parent() != null) {
            throw new IllegalStateException("replacement '" + replacement.type() + "' already has a parent");
        }
        if (replacement == this || hasAncestor(replacement)) {
            throw new IllegalArgumentException("replacement '" + replacement.type() + "' would create a cycle");
        }
        if (!mutationPermitted()) {
            return;
        }
        existing.detach();
        replacement.attachTo(this);
        children.set(index, replacement);
    }

    /** Discards every child subtree. */
    public void clearChildren() {
        if (children.isEmpty() || !mutationPermitted()) {
            return;
        }
        children.forEach(Node::detach);
        children.clear();
    }

    /**
     * Merges runs of adjacent {@code #text} children into one node and discards empty ones. Does not
     * recurse.
     */
    public void normalize() {
        if (children.isEmpty() || !needsNormalizing() || !mutationPermitted()) {
            return;
        }
        List<Node> merged = new ArrayList<>(children.size());
        CharacterData run = null;
        for (Node node : children) {
            if (isPlainText(node)) {
                CharacterData text = (CharacterData) node;
                if (text.data().isEmpty()) {
                    text.detach();
                    continue;
                }
                if (run != null) {
                    run = joinText(run, text);
                    merged.set(merged.size() - 1, run);
                    continue;
                }
                run = text;
            } else {
                run = null;
            }
            merged.add(node);
        }
        children.clear();
        children.addAll(merged);
    }

    private boolean needsNormalizing() {
        Node previous = null;
        for (Node node : children) {
            if (isPlainText(node)) {
                if (((CharacterData) node).data().isEmpty() || isPlainText(previous)) {
                    return true;
                }
            }
            previous = node;
        }
        return false;
    }

    private static boolean isPlainText(Node node) {
        return node instanceof CharacterData && CharacterData.TEXT_TYPE.equals(node.type());
    }

    private CharacterData joinText(CharacterData left, CharacterData right) {
        SourceSpan span = SourceSpan.of(
                Math.min(left.span().start(), right.span().start()),
                Math.max(left.span().end(), right.span().end()));
        CharacterData joined = new CharacterData(CharacterData.TEXT_TYPE, left.data() + right.data(), span);
        left.detach();
        right.detach();
        joined.attachTo(this);
        return joined;
    }

    private int indexOfChild(Node node) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    // --- Attributes ---

    /** Unmodifiable, insertion-ordered view of the attributes. */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /** The attribute value, or {@code null} when absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public Element setAttribute(String name, String value) {
        Objects.requireNonNull(name, "attribute name must not be null");
        Objects.requireNonNull(value, "attribute value must not be null");
        if (mutationPermitted()) {
            attributes.put(name, value);
        }
        return this;
    }

    public Element removeAttribute(String name) {
        if (attributes.containsKey(name) && mutationPermitted()) {
            attributes.remove(name);
        }
        return this;
    }

    @Override
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder sb) {
        if (node instanceof CharacterData) {
            sb.append(((CharacterData) node).data());
            return;
        }
        for (Node child : ((Element) node).children) {
            appendText(child, sb);
        }
    }

    // --- Guard (engine use) ---

    /**
     * Installs {@code newGuard} on this element. Only the guard of the tree root is consulted.
     *
     * @param newGuard the guard, or {@code null} to remove it
     * @return the previously installed guard, or {@code null}
     */
    public MutationGuard installGuard(MutationGuard newGuard) {
        MutationGuard previous = guard;
        guard = newGuard;
        return previous;
    }

    MutationGuard guard() {
        return guard;
    }
}
