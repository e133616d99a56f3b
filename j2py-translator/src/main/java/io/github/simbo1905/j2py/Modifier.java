package io.github.simbo1905.j2py;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/// Declaration modifiers recognised in front of classes, members and parameters.
public enum Modifier {
    PUBLIC(TokenKind.PUBLIC),
    PRIVATE(TokenKind.PRIVATE),
    PROTECTED(TokenKind.PROTECTED),
    STATIC(TokenKind.STATIC),
    FINAL(TokenKind.FINAL),
    ABSTRACT(TokenKind.ABSTRACT),
    SYNCHRONIZED(TokenKind.SYNCHRONIZED),
    NATIVE(TokenKind.NATIVE),
    TRANSIENT(TokenKind.TRANSIENT),
    VOLATILE(TokenKind.VOLATILE),
    STRICTFP(TokenKind.STRICTFP);

    private static final Map<TokenKind, Modifier> BY_TOKEN = new EnumMap<>(TokenKind.class);

    static {
        for (Modifier m : values()) {
            BY_TOKEN.put(m.token, m);
        }
    }

    private final TokenKind token;

    Modifier(TokenKind token) {
        this.token = token;
    }

    /// @return the modifier spelled by this token kind, or null
    public static Modifier fromToken(TokenKind kind) {
        return BY_TOKEN.get(kind);
    }

    public static boolean isModifier(TokenKind kind) {
        return BY_TOKEN.containsKey(kind);
    }

    /// Immutable copy that keeps enum ordering.
    static Set<Modifier> immutableSet(Collection<Modifier> modifiers) {
        final EnumSet<Modifier> copy = EnumSet.noneOf(Modifier.class);
        copy.addAll(modifiers);
        return Collections.unmodifiableSet(copy);
    }
}
