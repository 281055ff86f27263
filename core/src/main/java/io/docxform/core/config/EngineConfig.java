package io.docxform.core.config;

import io.docxform.core.engine.ConversionMode;
import io.docxform.core.model.Document;
import java.util.Objects;

/**
 * Engine-wide settings.
 *
 * @param conversionMode  treatment of node types without a converter or mapping entry
 * @param debug           when {@code true}, ancestor mutations abort the convert pass instead of
 *                        being ignored with a warning
 * @param retainNamespace when {@code true}, user entries of the conversion context are copied into
 *                        the output document's namespace
 * @param defaultStyle    style used by the convenience entry points that take none
 */
public record EngineConfig(ConversionMode conversionMode, boolean debug, boolean retainNamespace, String defaultStyle) {

    /** Lenient conversion, release mode, no namespace retention, style {@code default}. */
    public static final EngineConfig DEFAULT =
            new EngineConfig(ConversionMode.LENIENT, false, false, Document.DEFAULT_STYLE);

    public EngineConfig {
        Objects.requireNonNull(conversionMode, "conversionMode must not be null");
        Objects.requireNonNull(defaultStyle, "defaultStyle must not be null");
        if (defaultStyle.isBlank()) {
            throw new IllegalArgumentException("defaultStyle must not be blank");
        }
    }

    public EngineConfig withConversionMode(ConversionMode mode) {
        return new EngineConfig(mode, debug, retainNamespace, defaultStyle);
    }

    public EngineConfig withDebug(boolean enabled) {
        return new EngineConfig(conversionMode, enabled, retainNamespace, defaultStyle);
    }

    public EngineConfig withRetainNamespace(boolean enabled) {
        return new EngineConfig(conversionMode, debug, enabled, defaultStyle);
    }

    public EngineConfig withDefaultStyle(String style) {
        return new EngineConfig(conversionMode, debug, retainNamespace, style);
    }
}
