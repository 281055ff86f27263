package io.docxform.core.model;

import java.util.Objects;

/** Leaf node holding a single string payload. */
public final class CharacterData extends Node {

    /** Type tag of plain text nodes. */
    public static final String TEXT_TYPE = "#text";

    private String data;

    /** Creates a plain {@code #text} node with no source position. */
    public CharacterData(String data) {
        this(TEXT_TYPE, data, SourceSpan.NONE);
    }

    public CharacterData(String type, String data, SourceSpan span) {
        super(type, span);
        this.data = Objects.requireNonNull(data, "data must not be null");
    }

    /** Creates an open node starting at {@code start}; the parser closes it. */
    public CharacterData(String type, String data, int start) {
        super(type, start);
        this.data = Objects.requireNonNull(data, "data must not be null");
    }

    @Override
    public boolean isElement() {
        return false;
    }

    public String data() {
        return data;
    }

    public void setData(String newData) {
        Objects.requireNonNull(newData, "data must not be null");
        if (mutationPermitted()) {
            data = newData;
        }
    }

    public void appendData(String more) {
        Objects.requireNonNull(more, "data must not be null");
        if (!more.isEmpty() && mutationPermitted()) {
            data = data + more;
        }
    }

    @Override
    public String textContent() {
        return data;
    }
}
