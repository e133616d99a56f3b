package io.github.simbo1905.j2py.cli;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Reads Java source files with an explicit charset and decoding policy.
public final class SourceFiles {
    private SourceFiles() {}

    private static final Logger LOG = Logger.getLogger(SourceFiles.class.getName());

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /// What to do with bytes that are not valid in the chosen charset.
    public enum DecodePolicy {
        /// Fail with [CharacterCodingException].
        STRICT,
        /// Substitute the charset's replacement character.
        REPLACE
    }

    /// Decodes a whole file. A leading byte order mark is dropped.
    /// @throws CharacterCodingException under [DecodePolicy#STRICT] when the bytes do not decode
    public static String read(Path path, Charset charset, DecodePolicy policy) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(charset, "charset must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        final byte[] bytes = Files.readAllBytes(path);
        final CodingErrorAction action = policy == DecodePolicy.STRICT ? CodingErrorAction.REPORT : CodingErrorAction.REPLACE;
        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(action)
                .onUnmappableCharacter(action);
        final String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        LOG.fine(() -> "Read " + bytes.length + " bytes from " + path + " as " + charset.name());
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    /// Expands the inputs into source files. Files are taken as given; directories are
    /// walked for `*.java` files in sorted order.
    /// @throws NoSuchFileException when an input does not exist
    public static List<Path> collect(List<Path> inputs) throws IOException {
        Objects.requireNonNull(inputs, "inputs must not be null");
        final var files = new ArrayList<Path>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    final List<Path> found = walk
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(".java"))
                            .sorted()
                            .collect(Collectors.toList());
                    LOG.fine(() -> "Found " + found.size() + " source file(s) under " + input);
                    files.addAll(found);
                }
            } else if (Files.exists(input)) {
                files.add(input);
            } else {
                throw new NoSuchFileException(input.toString());
            }
        }
        return files;
    }

    /// `Foo.java` becomes `Foo.py`.
    static String pythonFileName(Path source) {
        final String name = source.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + ".py";
    }
}
