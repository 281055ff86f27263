package io.docxform.core.model;

import java.util.Objects;

/** Structural helpers over node trees. */
public final class Nodes {

    private Nodes() {
        // utility class
    }

    /**
     * Compares two trees by type, attributes (order-insensitive), character data and child order,
     * ignoring source spans and parents.
     */
    public static boolean structurallyEqual(Node left, Node right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (!left.type().equals(right.type()) || left.isElement() != right.isElement()) {
            return false;
        }
        if (left instanceof CharacterData) {
            return ((CharacterData) left).data().equals(((CharacterData) right).data());
        }
        Element a = (Element) left;
        Element b = (Element) right;
        if (!a.attributes().equals(b.attributes()) || a.childCount() != b.childCount()) {
            return false;
        }
        for (int i = 0; i < a.childCount(); i++) {
            if (!structurallyEqual(a.child(i), b.child(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copies {@code node} and its descendants into a new detached tree. Spans are preserved; copies of
     * open nodes are closed at their current span.
     */
    public static Node deepCopy(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node instanceof CharacterData) {
            CharacterData text = (CharacterData) node;
            return new CharacterData(text.type(), text.data(), text.span());
        }
        Element source = (Element) node;
        Element copy = shallowCopy(source);
        for (Node child : source.children()) {
            copy.appendChild(deepCopy(child));
        }
        return copy;
    }

    /** Copies an element's type, span and attributes, without children. */
    public static Element shallowCopy(Element source) {
        Element copy = new Element(source.type(), source.span());
        source.attributes().forEach(copy::setAttribute);
        return copy;
    }

    /** Renders the tree as an indented outline, one node per line. Intended for logs and tests. */
    public static String outline(Node node) {
        StringBuilder sb = new StringBuilder();
        outline(node, 0, sb);
        return sb.toString();
    }

    private static void outline(Node node, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent)).append(node.type());
        if (node instanceof CharacterData) {
            sb.append(" \"").append(((CharacterData) node).data()).append('"');
        } else {
            Element element = (Element) node;
            element.attributes().forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(v).append('"'));
        }
        sb.append('\n');
        if (node instanceof Element) {
            for (Node child : ((Element) node).children()) {
                outline(child, indent + 1, sb);
            }
        }
    }
}
