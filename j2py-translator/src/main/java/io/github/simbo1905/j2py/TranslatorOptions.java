package io.github.simbo1905.j2py;

import java.util.logging.Logger;

/// Output settings for the generator.
///
/// @param indentWidth spaces per indentation level, between 1 and 8
/// @param entryPoint  append an `if __name__ == "__main__":` guard calling the first
///                    class that declares `static main(...)`
public record TranslatorOptions(int indentWidth, boolean entryPoint) {

    private static final Logger LOG = Logger.getLogger(TranslatorOptions.class.getName());

    public static final String INDENT_PROPERTY = "j2py.indent";
    public static final String ENTRY_POINT_PROPERTY = "j2py.entryPoint";

    public static final TranslatorOptions DEFAULT = new TranslatorOptions(4, true);

    public TranslatorOptions {
        if (indentWidth < 1 || indentWidth > 8) {
            throw new IllegalArgumentException("indentWidth must be between 1 and 8: " + indentWidth);
        }
    }

    /// Defaults overridden by the `j2py.indent` and `j2py.entryPoint` system properties.
    /// An unparsable indent is logged and ignored.
    public static TranslatorOptions fromSystemProperties() {
        int indent = DEFAULT.indentWidth;
        final String indentValue = System.getProperty(INDENT_PROPERTY);
        if (indentValue != null) {
            try {
                final int parsed = Integer.parseInt(indentValue.trim());
                if (parsed >= 1 && parsed <= 8) {
                    indent = parsed;
                    LOG.fine(() -> "Indent width set to " + parsed + " via system property");
                } else {
                    LOG.warning(() -> "Indent width out of range: " + indentValue + ". Using default: " + DEFAULT.indentWidth);
                }
            } catch (NumberFormatException e) {
                LOG.warning(() -> "Invalid indent width: " + indentValue + ". Using default: " + DEFAULT.indentWidth);
            }
        }

        boolean entryPoint = DEFAULT.entryPoint;
        final String entryValue = System.getProperty(ENTRY_POINT_PROPERTY);
        if (entryValue != null) {
            entryPoint = Boolean.parseBoolean(entryValue.trim());
            final boolean value = entryPoint;
            LOG.fine(() -> "Entry point guard " + (value ? "enabled" : "disabled") + " via system property");
        }
        return new TranslatorOptions(indent, entryPoint);
    }

    public TranslatorOptions withIndentWidth(int width) {
        return new TranslatorOptions(width, entryPoint);
    }

    public TranslatorOptions withEntryPoint(boolean enabled) {
        return new TranslatorOptions(indentWidth, enabled);
    }

    String indentUnit() {
        return " ".repeat(indentWidth);
    }
}
