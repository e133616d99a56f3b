package io.github.simbo1905.j2py;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.simbo1905.j2py.JavaAst.CompilationUnit;

/// Translates Java source into Python 3 source.
///
/// Usage:
/// ```java
/// String python = JavaToPython.translator().translate(javaSource);
/// ```
///
/// The pipeline is tokenizer, token buffer, parser and generator. Each stage is also
/// reachable on its own: [#tokenize(String)], [#parse(String)] and [#generate(CompilationUnit)].
/// Instances are immutable and may be shared between threads.
public final class JavaToPython {

    private static final Logger LOG = Logger.getLogger(JavaToPython.class.getName());

    private static final JavaToPython DEFAULT = new JavaToPython(TranslatorOptions.DEFAULT);

    private final TranslatorOptions options;

    private JavaToPython(TranslatorOptions options) {
        this.options = options;
    }

    /// Translator with [TranslatorOptions#DEFAULT].
    public static JavaToPython translator() {
        return DEFAULT;
    }

    public static JavaToPython translator(TranslatorOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return new JavaToPython(options);
    }

    public TranslatorOptions options() {
        return options;
    }

    /// Parses and renders one compilation unit.
    /// @throws JavaSyntaxException when a class, block or switch is left unclosed
    public String translate(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "Translating " + source.length() + " characters");
        return generate(parse(source));
    }

    public String generate(CompilationUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        return PythonGenerator.generate(unit, options);
    }

    public static CompilationUnit parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return JavaParser.parse(source);
    }

    /// All tokens of the input, hidden comments included, ending with `EOF`.
    public static List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new JavaTokenizer(source).tokenize();
    }
}
