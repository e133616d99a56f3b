package io.github.simbo1905.j2py;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Classification of a lexical token.
///
/// Keyword kinds carry their source spelling; symbol kinds carry the operator text.
/// Kinds without spelling (EOF, COMMENT, literals, IDENTIFIER, UNKNOWN) are classified
/// by the tokenizer's scanning rules rather than by table lookup.
public enum TokenKind {
    EOF,
    COMMENT,
    STRING,
    CHAR,
    NUMBER,
    IDENTIFIER,
    UNKNOWN,

    // keywords
    ABSTRACT(Category.KEYWORD, "abstract"),
    ASSERT(Category.KEYWORD, "assert"),
    BOOLEAN(Category.KEYWORD, "boolean"),
    BREAK(Category.KEYWORD, "break"),
    BYTE(Category.KEYWORD, "byte"),
    CASE(Category.KEYWORD, "case"),
    CATCH(Category.KEYWORD, "catch"),
    CHAR_TYPE(Category.KEYWORD, "char"),
    CLASS(Category.KEYWORD, "class"),
    CONTINUE(Category.KEYWORD, "continue"),
    DEFAULT(Category.KEYWORD, "default"),
    DO(Category.KEYWORD, "do"),
    DOUBLE(Category.KEYWORD, "double"),
    ELSE(Category.KEYWORD, "else"),
    ENUM(Category.KEYWORD, "enum"),
    EXTENDS(Category.KEYWORD, "extends"),
    FINAL(Category.KEYWORD, "final"),
    FINALLY(Category.KEYWORD, "finally"),
    FLOAT(Category.KEYWORD, "float"),
    FOR(Category.KEYWORD, "for"),
    IF(Category.KEYWORD, "if"),
    IMPLEMENTS(Category.KEYWORD, "implements"),
    IMPORT(Category.KEYWORD, "import"),
    INSTANCEOF(Category.KEYWORD, "instanceof"),
    INT(Category.KEYWORD, "int"),
    INTERFACE(Category.KEYWORD, "interface"),
    LONG(Category.KEYWORD, "long"),
    NATIVE(Category.KEYWORD, "native"),
    NEW(Category.KEYWORD, "new"),
    PACKAGE(Category.KEYWORD, "package"),
    PRIVATE(Category.KEYWORD, "private"),
    PROTECTED(Category.KEYWORD, "protected"),
    PUBLIC(Category.KEYWORD, "public"),
    RETURN(Category.KEYWORD, "return"),
    SHORT(Category.KEYWORD, "short"),
    STATIC(Category.KEYWORD, "static"),
    STRICTFP(Category.KEYWORD, "strictfp"),
    SUPER(Category.KEYWORD, "super"),
    SWITCH(Category.KEYWORD, "switch"),
    SYNCHRONIZED(Category.KEYWORD, "synchronized"),
    THIS(Category.KEYWORD, "this"),
    THROW(Category.KEYWORD, "throw"),
    THROWS(Category.KEYWORD, "throws"),
    TRANSIENT(Category.KEYWORD, "transient"),
    TRY(Category.KEYWORD, "try"),
    VOID(Category.KEYWORD, "void"),
    VOLATILE(Category.KEYWORD, "volatile"),
    WHILE(Category.KEYWORD, "while"),
    TRUE(Category.KEYWORD, "true"),
    FALSE(Category.KEYWORD, "false"),
    NULL(Category.KEYWORD, "null"),

    // multi-character symbols
    URSHIFT_ASSIGN(Category.SYMBOL, ">>>="),
    RSHIFT_ASSIGN(Category.SYMBOL, ">>="),
    LSHIFT_ASSIGN(Category.SYMBOL, "<<="),
    EQUAL(Category.SYMBOL, "=="),
    LE(Category.SYMBOL, "<="),
    GE(Category.SYMBOL, ">="),
    NOTEQUAL(Category.SYMBOL, "!="),
    AND(Category.SYMBOL, "&&"),
    OR(Category.SYMBOL, "||"),
    INC(Category.SYMBOL, "++"),
    DEC(Category.SYMBOL, "--"),
    ADD_ASSIGN(Category.SYMBOL, "+="),
    SUB_ASSIGN(Category.SYMBOL, "-="),
    MUL_ASSIGN(Category.SYMBOL, "*="),
    DIV_ASSIGN(Category.SYMBOL, "/="),
    AND_ASSIGN(Category.SYMBOL, "&="),
    OR_ASSIGN(Category.SYMBOL, "|="),
    XOR_ASSIGN(Category.SYMBOL, "^="),
    MOD_ASSIGN(Category.SYMBOL, "%="),
    ARROW(Category.SYMBOL, "->"),
    COLONCOLON(Category.SYMBOL, "::"),
    ELLIPSIS(Category.SYMBOL, "..."),

    // single-character symbols
    LBRACE(Category.SYMBOL, "{"),
    RBRACE(Category.SYMBOL, "}"),
    LPAREN(Category.SYMBOL, "("),
    RPAREN(Category.SYMBOL, ")"),
    LBRACK(Category.SYMBOL, "["),
    RBRACK(Category.SYMBOL, "]"),
    SEMI(Category.SYMBOL, ";"),
    COMMA(Category.SYMBOL, ","),
    DOT(Category.SYMBOL, "."),
    ASSIGN(Category.SYMBOL, "="),
    GT(Category.SYMBOL, ">"),
    LT(Category.SYMBOL, "<"),
    BANG(Category.SYMBOL, "!"),
    TILDE(Category.SYMBOL, "~"),
    QUESTION(Category.SYMBOL, "?"),
    COLON(Category.SYMBOL, ":"),
    ADD(Category.SYMBOL, "+"),
    SUB(Category.SYMBOL, "-"),
    MUL(Category.SYMBOL, "*"),
    DIV(Category.SYMBOL, "/"),
    BITAND(Category.SYMBOL, "&"),
    BITOR(Category.SYMBOL, "|"),
    CARET(Category.SYMBOL, "^"),
    MOD(Category.SYMBOL, "%"),
    AT(Category.SYMBOL, "@");

    enum Category { SPECIAL, KEYWORD, SYMBOL }

    private final Category category;
    private final String spelling;

    TokenKind() {
        this(Category.SPECIAL, null);
    }

    TokenKind(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    /// Source spelling for keywords and symbols, null for scanned kinds.
    public String spelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isSymbol() {
        return category == Category.SYMBOL;
    }

    private static final Map<String, TokenKind> KEYWORDS;
    private static final List<TokenKind> SYMBOLS_LONGEST_FIRST;

    static {
        final var keywords = new LinkedHashMap<String, TokenKind>();
        final var symbols = new java.util.ArrayList<TokenKind>();
        for (TokenKind kind : values()) {
            if (kind.isKeyword()) {
                keywords.put(kind.spelling, kind);
            } else if (kind.isSymbol()) {
                symbols.add(kind);
            }
        }
        // stable sort keeps table order among equal lengths
        symbols.sort(Comparator.comparingInt((TokenKind k) -> k.spelling.length()).reversed());
        KEYWORDS = Collections.unmodifiableMap(keywords);
        SYMBOLS_LONGEST_FIRST = List.copyOf(symbols);
    }

    /// Looks up a keyword by its spelling.
    /// @return the keyword kind, or IDENTIFIER when the word is not reserved
    public static TokenKind keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    /// Symbol kinds ordered so that longer operators are tried before their prefixes.
    static List<TokenKind> symbolsLongestFirst() {
        return SYMBOLS_LONGEST_FIRST;
    }
}
