package io.github.simbo1905.j2py;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static io.github.simbo1905.j2py.JavaAst.TypeRef;

/// Fixed tables mapping Java types, literals and names onto Python.
final class PythonTypes {
    private PythonTypes() {}

    private static final Map<String, String> TYPE_HINTS = Map.ofEntries(
            Map.entry("int", "int"),
            Map.entry("long", "int"),
            Map.entry("short", "int"),
            Map.entry("byte", "int"),
            Map.entry("float", "float"),
            Map.entry("double", "float"),
            Map.entry("boolean", "bool"),
            Map.entry("char", "str"),
            Map.entry("String", "str"),
            Map.entry("void", "None"));

    private static final Map<String, String> DEFAULT_VALUES = Map.of(
            "int", "0",
            "float", "0.0",
            "bool", "False",
            "str", "\"\"");

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    /// Python keywords and names reserved by the generated code that are legal Java identifiers.
    private static final Set<String> RESERVED = Set.of(
            "and", "as", "async", "await", "def", "del", "elif", "except", "from", "global", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "with", "yield", "None", "True", "False",
            "self");

    /// Maps a declared type to a Python type hint; each array dimension wraps in `list[...]`.
    /// Unrecognised names pass through as nominal types.
    static String hint(TypeRef type) {
        String hint = TYPE_HINTS.getOrDefault(type.name(), type.name());
        for (int i = 0; i < type.arrayDims(); i++) {
            hint = "list[" + hint + "]";
        }
        return hint;
    }

    /// `var` declarations carry no type to annotate with.
    static boolean hasHint(TypeRef type) {
        return !"var".equals(type.name());
    }

    /// Value used for a declaration without an initializer.
    static String defaultValue(TypeRef type) {
        if (type.arrayDims() > 0) {
            return "[]";
        }
        return DEFAULT_VALUES.getOrDefault(TYPE_HINTS.get(type.name()), "None");
    }

    static boolean isIntType(TypeRef type) {
        return type.arrayDims() == 0 && "int".equals(TYPE_HINTS.get(type.name()));
    }

    static boolean isFloatType(TypeRef type) {
        return type.arrayDims() == 0 && "float".equals(TYPE_HINTS.get(type.name()));
    }

    /// Formats literal source text.
    ///
    /// Numbers pass through, `true`/`false`/`null` become `True`/`False`/`None` and quoted
    /// strings or chars keep their quotes. Any other bare token is taken to be unquoted
    /// string content and is quoted here. That last rule is a heuristic: without type
    /// information a bare token cannot be told apart from a symbolic reference.
    static String literal(String text) {
        switch (text) {
            case "true":
                return "True";
            case "false":
                return "False";
            case "null":
                return "None";
            default:
                break;
        }
        if (NUMBER.matcher(text).matches()) {
            return text;
        }
        if (text.length() >= 2 && (text.startsWith("\"") || text.startsWith("'"))) {
            return text;
        }
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static boolean isStringLiteral(String text) {
        return text.startsWith("\"");
    }

    /// Renames identifiers that would collide with Python keywords.
    static String name(String javaName) {
        return RESERVED.contains(javaName) ? javaName + "_" : javaName;
    }
}
