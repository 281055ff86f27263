package io.docxform.core.error;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A message code owned by a plugin module, rendered as {@code urn:doc-xform:<module>:<id>}.
 *
 * <pre>
 * static final MessageCode EMPTY_LINK = new PluginMessageCode("html", "empty-link", "link without target");
 * </pre>
 *
 * @param module      owning module, e.g. the language or style name
 * @param id          kebab-case code name, unique within the module
 * @param explanation longer description for message listings, may be empty
 */
public record PluginMessageCode(String module, String id, String explanation) implements MessageCode {

    private static final Pattern NAME = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    public PluginMessageCode {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(explanation, "explanation must not be null");
        if (!NAME.matcher(module).matches()) {
            throw new IllegalArgumentException("module must be kebab-case, got: '" + module + "'");
        }
        if (!NAME.matcher(id).matches()) {
            throw new IllegalArgumentException("id must be kebab-case, got: '" + id + "'");
        }
        if ("diagnostic".equals(module)) {
            throw new IllegalArgumentException("module name 'diagnostic' is reserved for engine codes");
        }
    }

    public PluginMessageCode(String module, String id) {
        this(module, id, "");
    }

    @Override
    public String urn() {
        return "urn:doc-xform:" + module + ":" + id;
    }

    @Override
    public String toString() {
        return module + ":" + id;
    }
}
