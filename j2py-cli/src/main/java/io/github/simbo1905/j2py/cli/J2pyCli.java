package io.github.simbo1905.j2py.cli;

import io.github.simbo1905.j2py.JavaSyntaxException;
import io.github.simbo1905.j2py.JavaToPython;
import io.github.simbo1905.j2py.TranslatorOptions;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// CLI entry point translating Java source files to Python.
///
/// Usage:
/// `java -jar j2py-cli.jar [-o outDir] [--encoding NAME] [--lenient] <file-or-dir>...`
///
/// Without `-o` each translation is printed to stdout under a `# ==== path ====` banner.
/// With `-o` each `Name.java` is written to `outDir/Name.py` and the written path is printed.
/// Exit codes: 0 success, 1 when any file fails to read or parse, 2 for usage errors.
public final class J2pyCli {
    private J2pyCli() {}

    private static final Logger LOG = Logger.getLogger(J2pyCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: java -jar j2py-cli.jar [-o outDir] [--encoding NAME] [--lenient] <file-or-dir>...";

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        final int code = run(args, out, err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /// Parsed command line.
    /// @param outputDir null to print to stdout
    record Arguments(Path outputDir, Charset charset, SourceFiles.DecodePolicy policy, List<Path> inputs, boolean help) {
        Arguments {
            Objects.requireNonNull(charset, "charset must not be null");
            Objects.requireNonNull(policy, "policy must not be null");
            inputs = List.copyOf(inputs);
        }

        /// @throws IllegalArgumentException for unknown options, missing values, unknown charsets or no inputs
        static Arguments parse(String[] args) {
            if (args == null) {
                throw new IllegalArgumentException("No input files");
            }
            Path outputDir = null;
            Charset charset = StandardCharsets.UTF_8;
            SourceFiles.DecodePolicy policy = SourceFiles.DecodePolicy.STRICT;
            final var inputs = new ArrayList<Path>();
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> {
                        return new Arguments(null, charset, policy, List.of(), true);
                    }
                    case "-o", "--output" -> outputDir = Path.of(value(args, ++i, arg));
                    case "--encoding" -> charset = Charset.forName(value(args, ++i, arg));
                    case "--lenient" -> policy = SourceFiles.DecodePolicy.REPLACE;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        inputs.add(Path.of(arg));
                    }
                }
            }
            if (inputs.isEmpty()) {
                throw new IllegalArgumentException("No input files");
            }
            return new Arguments(outputDir, charset, policy, inputs, false);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }
    }

    static int run(String[] args, PrintWriter out, PrintWriter err) {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");

        final Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help()) {
            out.println(USAGE);
            return EXIT_OK;
        }

        final List<Path> files;
        try {
            files = SourceFiles.collect(arguments.inputs());
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (files.isEmpty()) {
            err.println("No .java files found");
            return EXIT_USAGE;
        }

        final var translator = JavaToPython.translator(TranslatorOptions.fromSystemProperties());
        LOG.fine(() -> "Translating " + files.size() + " file(s) with " + translator.options());
        int failures = 0;
        for (Path file : files) {
            try {
                translateFile(translator, arguments, file, out);
            } catch (JavaSyntaxException e) {
                err.println(file + ":" + e.line() + ":" + e.column() + ": " + e.getMessage());
                failures++;
            } catch (CharacterCodingException e) {
                err.println(file + ": not valid " + arguments.charset().name() + " (use --lenient to replace bad bytes)");
                failures++;
            } catch (IOException e) {
                err.println(file + ": " + e.getMessage());
                failures++;
            }
        }
        out.flush();
        final int failed = failures;
        LOG.fine(() -> "Translated " + (files.size() - failed) + " of " + files.size() + " file(s)");
        return failures == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private static void translateFile(JavaToPython translator, Arguments arguments, Path file, PrintWriter out)
            throws IOException {
        final String source = SourceFiles.read(file, arguments.charset(), arguments.policy());
        final String python = translator.translate(source);
        if (arguments.outputDir() == null) {
            out.println("# ==== " + file + " ====");
            out.print(python);
            out.flush();
            return;
        }
        Files.createDirectories(arguments.outputDir());
        final Path target = arguments.outputDir().resolve(SourceFiles.pythonFileName(file));
        Files.writeString(target, python, StandardCharsets.UTF_8);
        LOG.fine(() -> "Wrote " + target);
        out.println(target);
    }
}
