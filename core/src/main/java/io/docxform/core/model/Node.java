package io.docxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A unit of the document tree: either an {@link Element} with children and attributes, or a
 * {@link CharacterData} leaf holding raw text.
 *
 * <p>The parent link is a non-owning back-reference assigned exactly once, when the node is
 * appended to an element. The source span start is fixed at construction; the end is fixed by
 * {@link #close(int)} and never changes afterwards.
 */
public abstract class Node {

    private final String type;
    private final int start;
    private int end;
    private boolean closed;
    private Element parent;

    /** Creates an open node whose end offset is fixed later by {@link #close(int)}. */
    protected Node(String type, int start) {
        this.type = requireType(type);
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative, got: " + start);
        }
        this.start = start;
        this.end = start;
    }

    /** Creates a node that is already closed over {@code span}. */
    protected Node(String type, SourceSpan span) {
        this.type = requireType(type);
        Objects.requireNonNull(span, "span must not be null");
        this.start = span.start();
        this.end = span.end();
        this.closed = true;
    }

    private static String requireType(String type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isEmpty()) {
            throw new IllegalArgumentException("type must not be empty");
        }
        return type;
    }

    /** The type tag selecting which parser, writer and converter apply. */
    public String type() {
        return type;
    }

    /** The owning element, or {@code null} for a root or detached node. */
    public Element parent() {
        return parent;
    }

    /** Source span; an open node reports an empty span at its start offset. */
    public SourceSpan span() {
        return new SourceSpan(start, end);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Fixes the end offset. A node is closed at most once and never reopened.
     *
     * @throws IllegalStateException if the node is already closed
     * @throws IllegalArgumentException if {@code end} precedes the start offset
     */
    public void close(int end) {
        if (closed) {
            throw new IllegalStateException("node '" + type + "' at " + span() + " is already closed");
        }
        if (end < start) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start + " of '" + type + "'");
        }
        this.end = end;
        this.closed = true;
    }

    public abstract boolean isElement();

    /** Concatenated character data of this node and its descendants, in document order. */
    public abstract String textContent();

    /** Topmost ancestor, or this node when it has no parent. */
    public Node root() {
        Node top = this;
        while (top.parent != null) {
            top = top.parent;
        }
        return top;
    }

    /** Number of ancestors. A root has depth 0. */
    public int depth() {
        int depth = 0;
        for (Element p = parent; p != null; p = p.parent()) {
            depth++;
        }
        return depth;
    }

    /** Position among the parent's children, or -1 for a parentless node. */
    public int index() {
        if (parent == null) {
            return -1;
        }
        List<Node> siblings = parent.children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        return -1;
    }

    /** The following sibling, or {@code null}. */
    public Node nextSibling() {
        int index = index();
        if (index < 0 || index + 1 >= parent.childCount()) {
            return null;
        }
        return parent.child(index + 1);
    }

    /** The preceding sibling, or {@code null}. */
    public Node previousSibling() {
        int index = index();
        return index > 0 ? parent.child(index - 1) : null;
    }

    /** Returns {@code true} if {@code candidate} is this node's parent, grandparent, and so on. */
    public boolean hasAncestor(Node candidate) {
        for (Element p = parent; p != null; p = p.parent()) {
            if (p == candidate) {
                return true;
            }
        }
        return false;
    }

    void attachTo(Element newParent) {
        if (parent != null) {
            throw new IllegalStateException(
                    "node '" + type + "' at " + span() + " already belongs to '" + parent.type() + "'");
        }
        parent = newParent;
    }

    void detach() {
        parent = null;
    }

    /** Consults the guard installed on this tree's root, if any. */
    final boolean mutationPermitted() {
        Node top = root();
        MutationGuard guard = top instanceof Element ? ((Element) top).guard() : null;
        return guard == null || guard.permits(this);
    }

    @Override
    public String toString() {
        return type + "@" + span();
    }
}
