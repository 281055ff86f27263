package io.docxform.core.mapping;

import io.docxform.core.model.Element;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative renames for one language pair and style: node types, attributes per source type and
 * attributes to drop. Attribute entries under {@link #ANY_TYPE} apply to every type; entries for a
 * specific type take precedence.
 *
 * <p>Immutable and thread-safe.
 */
public final class MappingTable {

    /** Key matching every source type in attribute rules. */
    public static final String ANY_TYPE = "*";

    private static final MappingTable IDENTITY = new Builder().build();

    private final Map<String, String> types;
    private final Map<String, Map<String, String>> attributes;
    private final Map<String, Set<String>> droppedAttributes;

    private MappingTable(Builder builder) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(builder.types));
        Map<String, Map<String, String>> attrs = new LinkedHashMap<>();
        builder.attributes.forEach((type, renames) ->
                attrs.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(renames))));
        this.attributes = Collections.unmodifiableMap(attrs);
        Map<String, Set<String>> drops = new LinkedHashMap<>();
        builder.droppedAttributes.forEach((type, names) ->
                drops.put(type, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
        this.droppedAttributes = Collections.unmodifiableMap(drops);
    }

    /** A table that changes nothing. */
    public static MappingTable identity() {
        return IDENTITY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isIdentity() {
        return types.isEmpty() && attributes.isEmpty() && droppedAttributes.isEmpty();
    }

    /** Returns {@code true} if the table renames {@code sourceType} explicitly. */
    public boolean mapsType(String sourceType) {
        return types.containsKey(sourceType);
    }

    /** The target type for {@code sourceType}; unmapped types keep their name. */
    public String mapType(String sourceType) {
        return types.getOrDefault(sourceType, sourceType);
    }

    /**
     * The target name of attribute {@code name} on a node of {@code sourceType}, or {@code null} if
     * the attribute is dropped.
     */
    public String mapAttribute(String sourceType, String name) {
        if (isDropped(sourceType, name)) {
            return null;
        }
        Map<String, String> specific = attributes.get(sourceType);
        if (specific != null && specific.containsKey(name)) {
            return specific.get(name);
        }
        Map<String, String> any = attributes.get(ANY_TYPE);
        if (any != null && any.containsKey(name)) {
            return any.get(name);
        }
        return name;
    }

    private boolean isDropped(String sourceType, String name) {
        Set<String> specific = droppedAttributes.get(sourceType);
        if (specific != null && specific.contains(name)) {
            return true;
        }
        Set<String> any = droppedAttributes.get(ANY_TYPE);
        return any != null && any.contains(name);
    }

    /**
     * Creates a childless counterpart of {@code source} with the mapped type and attributes. The
     * counterpart keeps the source span and attribute order.
     *
     * <p>When a rename lands on a name that is already taken, the attribute that carried that name in
     * the source keeps it and the renamed one is discarded. If two renames land on the same name, the
     * first in source order wins.
     */
    public Element apply(Element source) {
        Objects.requireNonNull(source, "source must not be null");
        String type = source.type();
        Element target = new Element(mapType(type), source.span());
        source.attributes().forEach((name, value) -> {
            String mapped = mapAttribute(type, name);
            if (mapped == null) {
                return;
            }
            if (!mapped.equals(name)) {
                boolean heldInSource = source.hasAttribute(mapped) && mapped.equals(mapAttribute(type, mapped));
                if (heldInSource || target.hasAttribute(mapped)) {
                    return;
                }
            }
            target.setAttribute(mapped, value);
        });
        return target;
    }

    public Map<String, String> types() {
        return types;
    }

    public Map<String, Map<String, String>> attributes() {
        return attributes;
    }

    public Map<String, Set<String>> droppedAttributes() {
        return droppedAttributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappingTable)) {
            return false;
        }
        MappingTable that = (MappingTable) o;
        return types.equals(that.types)
                && attributes.equals(that.attributes)
                && droppedAttributes.equals(that.droppedAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, attributes, droppedAttributes);
    }

    @Override
    public String toString() {
        return "MappingTable[types=" + types + ", attributes=" + attributes + ", drop=" + droppedAttributes + "]";
    }

    /** Builder for {@link MappingTable}. */
    public static final class Builder {

        private final Map<String, String> types = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> attributes = new LinkedHashMap<>();
        private final Map<String, Set<String>> droppedAttributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder type(String from, String to) {
            types.put(requireName(from, "type"), requireName(to, "type"));
            return this;
        }

        /** Renames attribute {@code from} to {@code to} on nodes of {@code sourceType} (or {@code *}). */
        public Builder attribute(String sourceType, String from, String to) {
            attributes
                    .computeIfAbsent(requireName(sourceType, "type"), k -> new LinkedHashMap<>())
                    .put(requireName(from, "attribute"), requireName(to, "attribute"));
            return this;
        }

        public Builder dropAttribute(String sourceType, String name) {
            droppedAttributes
                    .computeIfAbsent(requireName(sourceType, "type"), k -> new LinkedHashSet<>())
                    .add(requireName(name, "attribute"));
            return this;
        }

        public MappingTable build() {
            return new MappingTable(this);
        }

        private static String requireName(String value, String what) {
            Objects.requireNonNull(value, what + " name must not be null");
            if (value.isEmpty()) {
                throw new IllegalArgumentException(what + " name must not be empty");
            }
            return value;
        }
    }
}
