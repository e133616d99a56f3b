package io.github.simbo1905.j2py;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import static io.github.simbo1905.j2py.JavaAst.*;

/// Recursive-descent parser for the supported Java subset, with precedence climbing
/// for binary expressions.
///
/// Disambiguation rules:
/// - a class member is a method iff, after its modifiers, a type token (with any `[]`
///   pairs) is followed by IDENTIFIER and `(`; otherwise it is a field. An identifier
///   equal to the class name followed by `(` is a constructor.
/// - a statement starting with a primitive type keyword, or with IDENTIFIER followed by
///   IDENTIFIER or `[` `]`, is a local variable declaration; anything else is an
///   expression, turned into an assignment when an assignment operator follows.
/// - a `for` header containing `:` before the first `;` or `)` is a foreach loop.
///
/// Any token mismatch raises `JavaSyntaxException`; there is no multi-error recovery.
/// Tokens outside class declarations at the top level, and unrecognised tokens in a class
/// body, are skipped.
public final class JavaParser {

    private static final Logger LOG = Logger.getLogger(JavaParser.class.getName());

    static final Set<TokenKind> TYPE_KEYWORDS = EnumSet.of(
            TokenKind.INT, TokenKind.LONG, TokenKind.SHORT, TokenKind.BYTE,
            TokenKind.FLOAT, TokenKind.DOUBLE, TokenKind.BOOLEAN, TokenKind.CHAR_TYPE);

    private static final Set<TokenKind> LITERALS = EnumSet.of(
            TokenKind.NUMBER, TokenKind.STRING, TokenKind.CHAR,
            TokenKind.TRUE, TokenKind.FALSE, TokenKind.NULL);

    private final TokenBuffer tokens;
    private Token current;

    public JavaParser(TokenBuffer tokens) {
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.current = tokens.lookahead(1);
        skipIgnored();
    }

    /// Convenience: tokenizes and parses `source` in one step.
    public static CompilationUnit parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new JavaParser(new ChannelTokenBuffer(new JavaTokenizer(source))).parse();
    }

    /// Parses the whole token stream.
    /// @throws JavaSyntaxException on the first structural error
    public CompilationUnit parse() {
        final var classes = new ArrayList<ClassDecl>();
        while (!at(TokenKind.EOF)) {
            if (Modifier.isModifier(current.kind()) || at(TokenKind.CLASS)) {
                final var decl = parseTypeDeclaration();
                if (decl != null) {
                    classes.add(decl);
                    LOG.fine(() -> "Parsed class " + decl.name() + " with " + decl.members().size() + " members");
                } else if (!at(TokenKind.EOF)) {
                    advance();
                }
            } else {
                final Token skipped = current;
                LOG.finer(() -> "Skipping top-level token " + skipped);
                advance();
            }
        }
        return new CompilationUnit(classes);
    }

    // ------------------------------------------------------------ token plumbing

    private void advance() {
        tokens.consume();
        current = tokens.lookahead(1);
        skipIgnored();
    }

    private void skipIgnored() {
        while (current.isHidden() || current.kind() == TokenKind.COMMENT) {
            tokens.consume();
            current = tokens.lookahead(1);
        }
    }

    private boolean at(TokenKind kind) {
        return current.kind() == kind;
    }

    /// Consumes the current token if it has the given kind, otherwise fails.
    private Token match(TokenKind kind) {
        if (current.kind() != kind) {
            throw new JavaSyntaxException(kind, current);
        }
        final Token matched = current;
        advance();
        return matched;
    }

    private boolean accept(TokenKind kind) {
        if (current.kind() == kind) {
            advance();
            return true;
        }
        return false;
    }

    /// Kind of the k-th visible token ahead; `peek(1)` is the current token.
    private TokenKind peek(int k) {
        return tokens.lookahead(k).kind();
    }

    private Set<Modifier> parseModifiers() {
        final Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        while (Modifier.isModifier(current.kind())) {
            modifiers.add(Modifier.fromToken(current.kind()));
            advance();
        }
        return modifiers;
    }

    private static boolean isTypeStart(TokenKind kind) {
        return TYPE_KEYWORDS.contains(kind) || kind == TokenKind.IDENTIFIER || kind == TokenKind.VOID;
    }

    // ------------------------------------------------------------ declarations

    private ClassDecl parseTypeDeclaration() {
        final var modifiers = parseModifiers();
        if (!at(TokenKind.CLASS)) {
            return null;
        }
        return parseClassDeclaration(modifiers);
    }

    private ClassDecl parseClassDeclaration(Set<Modifier> modifiers) {
        match(TokenKind.CLASS);
        final String name = match(TokenKind.IDENTIFIER).text();
        String superclass = null;
        if (accept(TokenKind.EXTENDS)) {
            superclass = parseQualifiedName();
        }
        if (accept(TokenKind.IMPLEMENTS)) {
            while (!at(TokenKind.LBRACE) && !at(TokenKind.EOF)) {
                advance();
            }
        }
        match(TokenKind.LBRACE);

        final var members = new ArrayList<ClassMember>();
        while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
            parseClassMember(name, members);
        }
        if (at(TokenKind.EOF)) {
            throw new JavaSyntaxException(TokenKind.RBRACE, current, "class '" + name + "'");
        }
        match(TokenKind.RBRACE);
        return new ClassDecl(name, modifiers, superclass, members);
    }

    private String parseQualifiedName() {
        final var sb = new StringBuilder(match(TokenKind.IDENTIFIER).text());
        while (at(TokenKind.DOT) && peek(2) == TokenKind.IDENTIFIER) {
            advance();
            sb.append('.').append(match(TokenKind.IDENTIFIER).text());
        }
        return sb.toString();
    }

    private void parseClassMember(String className, List<ClassMember> members) {
        final TokenKind kind = current.kind();
        if (kind == TokenKind.SEMI) {
            advance();
            return;
        }
        if (kind == TokenKind.LBRACE) {
            members.add(new Initializer(false, parseBlock()));
            return;
        }
        if (kind == TokenKind.STATIC && peek(2) == TokenKind.LBRACE) {
            advance();
            members.add(new Initializer(true, parseBlock()));
            return;
        }
        if (!Modifier.isModifier(kind) && !isTypeStart(kind)) {
            final Token skipped = current;
            LOG.finer(() -> "Skipping class body token " + skipped);
            advance();
            return;
        }
        if (looksLikeConstructor(className)) {
            members.add(parseConstructor(className));
        } else if (looksLikeMethod()) {
            members.add(parseMethod());
        } else {
            members.add(parseField());
        }
    }

    private int skipModifiersAhead(int i) {
        while (Modifier.isModifier(peek(i))) {
            i++;
        }
        return i;
    }

    private boolean looksLikeConstructor(String className) {
        final int i = skipModifiersAhead(1);
        return peek(i) == TokenKind.IDENTIFIER
                && tokens.lookahead(i).text().equals(className)
                && peek(i + 1) == TokenKind.LPAREN;
    }

    private boolean looksLikeMethod() {
        int i = skipModifiersAhead(1);
        if (!isTypeStart(peek(i))) {
            return false;
        }
        i++;
        while (peek(i) == TokenKind.LBRACK && peek(i + 1) == TokenKind.RBRACK) {
            i += 2;
        }
        return peek(i) == TokenKind.IDENTIFIER && peek(i + 1) == TokenKind.LPAREN;
    }

    /// Parses a type name with any `[]` suffixes.
    private TypeRef parseType() {
        final String name;
        if (TYPE_KEYWORDS.contains(current.kind()) || at(TokenKind.VOID)) {
            name = current.text();
            advance();
        } else {
            name = match(TokenKind.IDENTIFIER).text();
        }
        int dims = 0;
        while (at(TokenKind.LBRACK) && peek(2) == TokenKind.RBRACK) {
            advance();
            advance();
            dims++;
        }
        return new TypeRef(name, dims);
    }

    private FieldDecl parseField() {
        final var modifiers = parseModifiers();
        final var type = parseType();
        final String name = match(TokenKind.IDENTIFIER).text();
        Expr init = null;
        if (accept(TokenKind.ASSIGN)) {
            init = parseExpression();
        }
        match(TokenKind.SEMI);
        return new FieldDecl(modifiers, type, name, init);
    }

    private MethodDecl parseMethod() {
        final var modifiers = parseModifiers();
        final var returnType = parseType();
        final String name = match(TokenKind.IDENTIFIER).text();
        final var params = parseParameters();
        skipThrowsClause();
        final Block body = accept(TokenKind.SEMI) ? null : parseBlock();
        return new MethodDecl(modifiers, returnType, name, params, body);
    }

    private ConstructorDecl parseConstructor(String className) {
        final var modifiers = parseModifiers();
        match(TokenKind.IDENTIFIER);
        final var params = parseParameters();
        skipThrowsClause();
        return new ConstructorDecl(modifiers, className, params, parseBlock());
    }

    private void skipThrowsClause() {
        if (accept(TokenKind.THROWS)) {
            parseQualifiedName();
            while (accept(TokenKind.COMMA)) {
                parseQualifiedName();
            }
        }
    }

    private List<Param> parseParameters() {
        match(TokenKind.LPAREN);
        final var params = new ArrayList<Param>();
        while (!at(TokenKind.RPAREN) && !at(TokenKind.EOF)) {
            parseModifiers();
            TypeRef type = parseType();
            if (accept(TokenKind.ELLIPSIS)) {
                type = new TypeRef(type.name(), type.arrayDims() + 1);
            }
            params.add(new Param(type, match(TokenKind.IDENTIFIER).text()));
            if (!accept(TokenKind.COMMA)) {
                break;
            }
        }
        match(TokenKind.RPAREN);
        return params;
    }

    // ------------------------------------------------------------ statements

    private Block parseBlock() {
        final int openLine = current.line();
        match(TokenKind.LBRACE);
        final var statements = new ArrayList<Stmt>();
        while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
            statements.add(parseStatement());
        }
        if (at(TokenKind.EOF)) {
            throw new JavaSyntaxException(TokenKind.RBRACE, current, "block opened at line " + openLine);
        }
        match(TokenKind.RBRACE);
        return new Block(statements);
    }

    /// A braced block, or a single statement wrapped as a block.
    private Block parseBody() {
        if (at(TokenKind.LBRACE)) {
            return parseBlock();
        }
        return new Block(List.of(parseStatement()));
    }

    private Stmt parseStatement() {
        return switch (current.kind()) {
            case IF -> parseIf();
            case WHILE -> parseWhile();
            case DO -> parseDoWhile();
            case FOR -> parseFor();
            case SWITCH -> parseSwitch();
            case LBRACE -> parseBlock();
            case SEMI -> {
                advance();
                yield new Block(List.of());
            }
            case RETURN -> {
                advance();
                final Expr value = at(TokenKind.SEMI) ? null : parseExpression();
                match(TokenKind.SEMI);
                yield new Return(value);
            }
            case BREAK -> {
                advance();
                match(TokenKind.SEMI);
                yield new Break();
            }
            case CONTINUE -> {
                advance();
                match(TokenKind.SEMI);
                yield new Continue();
            }
            default -> {
                final Stmt stmt = parseSimpleStatement();
                match(TokenKind.SEMI);
                yield stmt;
            }
        };
    }

    /// Declaration, assignment or expression statement without its terminating `;`.
    /// Shared by statement lists and the `for` header clauses.
    private Stmt parseSimpleStatement() {
        if (looksLikeLocalDeclaration()) {
            return parseLocalDeclaration();
        }
        final Expr expr = parseExpression();
        final AssignOp op = AssignOp.fromToken(current.kind());
        if (op != null) {
            advance();
            return new Assign(expr, op, parseExpression());
        }
        return new ExprStmt(expr);
    }

    private boolean looksLikeLocalDeclaration() {
        final TokenKind kind = current.kind();
        if (kind == TokenKind.FINAL || TYPE_KEYWORDS.contains(kind)) {
            return true;
        }
        if (kind == TokenKind.IDENTIFIER) {
            final TokenKind next = peek(2);
            return next == TokenKind.IDENTIFIER || (next == TokenKind.LBRACK && peek(3) == TokenKind.RBRACK);
        }
        return false;
    }

    private LocalVarDecl parseLocalDeclaration() {
        parseModifiers();
        final var type = parseType();
        final String name = match(TokenKind.IDENTIFIER).text();
        Expr init = null;
        if (accept(TokenKind.ASSIGN)) {
            init = parseExpression();
        }
        return new LocalVarDecl(type, name, init);
    }

    private IfStatement parseIf() {
        match(TokenKind.IF);
        match(TokenKind.LPAREN);
        final Expr condition = parseExpression();
        match(TokenKind.RPAREN);
        final Block thenBlock = parseBody();
        Stmt elseBranch = null;
        if (accept(TokenKind.ELSE)) {
            elseBranch = at(TokenKind.IF) ? parseIf() : parseBody();
        }
        return new IfStatement(condition, thenBlock, elseBranch);
    }

    private WhileStatement parseWhile() {
        match(TokenKind.WHILE);
        match(TokenKind.LPAREN);
        final Expr condition = parseExpression();
        match(TokenKind.RPAREN);
        return new WhileStatement(condition, parseBody());
    }

    private DoWhileStatement parseDoWhile() {
        match(TokenKind.DO);
        final Block body = parseBody();
        match(TokenKind.WHILE);
        match(TokenKind.LPAREN);
        final Expr condition = parseExpression();
        match(TokenKind.RPAREN);
        match(TokenKind.SEMI);
        return new DoWhileStatement(body, condition);
    }

    private Stmt parseFor() {
        match(TokenKind.FOR);
        match(TokenKind.LPAREN);
        if (isForEachHeader()) {
            parseModifiers();
            final var type = parseType();
            final String name = match(TokenKind.IDENTIFIER).text();
            match(TokenKind.COLON);
            final Expr collection = parseExpression();
            match(TokenKind.RPAREN);
            return new ForEachStatement(new Param(type, name), collection, parseBody());
        }

        final Stmt init = at(TokenKind.SEMI) ? null : parseSimpleStatement();
        match(TokenKind.SEMI);
        final Expr condition = at(TokenKind.SEMI) ? null : parseExpression();
        match(TokenKind.SEMI);
        final Stmt update = at(TokenKind.RPAREN) ? null : parseSimpleStatement();
        match(TokenKind.RPAREN);
        return new ForStatement(init, condition, update, parseBody());
    }

    /// Scans the header up to the first `;` or `)`, looking for a `:`.
    private boolean isForEachHeader() {
        for (int i = 1; ; i++) {
            final TokenKind kind = peek(i);
            if (kind == TokenKind.COLON) {
                return true;
            }
            if (kind == TokenKind.SEMI || kind == TokenKind.RPAREN || kind == TokenKind.EOF) {
                return false;
            }
        }
    }

    private SwitchStatement parseSwitch() {
        match(TokenKind.SWITCH);
        match(TokenKind.LPAREN);
        final Expr subject = parseExpression();
        match(TokenKind.RPAREN);
        match(TokenKind.LBRACE);

        final var arms = new ArrayList<SwitchArm>();
        while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
            if (accept(TokenKind.DEFAULT)) {
                match(TokenKind.COLON);
                arms.add(new DefaultLabel(parseArmStatements()));
            } else {
                match(TokenKind.CASE);
                final Expr value = parseExpression();
                match(TokenKind.COLON);
                arms.add(new CaseLabel(value, parseArmStatements()));
            }
        }
        if (at(TokenKind.EOF)) {
            throw new JavaSyntaxException(TokenKind.RBRACE, current, "switch");
        }
        match(TokenKind.RBRACE);
        return new SwitchStatement(subject, arms);
    }

    private List<Stmt> parseArmStatements() {
        final var statements = new ArrayList<Stmt>();
        while (!at(TokenKind.CASE) && !at(TokenKind.DEFAULT) && !at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
            statements.add(parseStatement());
        }
        return statements;
    }

    // ------------------------------------------------------------ expressions

    private Expr parseExpression() {
        final Expr condition = parseBinary(0);
        if (accept(TokenKind.QUESTION)) {
            final Expr whenTrue = parseExpression();
            match(TokenKind.COLON);
            final Expr whenFalse = parseExpression();
            return new Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    /// Precedence climbing: folds operators binding at least `minPrecedence`,
    /// parsing each right operand one level tighter so operators associate left.
    private Expr parseBinary(int minPrecedence) {
        Expr left = parsePrimary();
        while (true) {
            final BinaryOperator op = BinaryOperator.fromToken(current.kind());
            if (op == null || op.precedence() < minPrecedence) {
                return left;
            }
            advance();
            final Expr right = parseBinary(op.precedence() + 1);
            left = new BinaryOp(op, left, right);
        }
    }

    private Expr parsePrimary() {
        final TokenKind kind = current.kind();

        if (kind == TokenKind.LPAREN) {
            if (TYPE_KEYWORDS.contains(peek(2)) && peek(3) == TokenKind.RPAREN) {
                advance();
                final TypeRef type = TypeRef.of(current.text());
                advance();
                match(TokenKind.RPAREN);
                return new Cast(type, parsePrimary());
            }
            advance();
            final Expr inner = parseExpression();
            match(TokenKind.RPAREN);
            return parsePostfixChain(inner);
        }
        if (LITERALS.contains(kind)) {
            final var literal = new Literal(current.text());
            advance();
            return parsePostfixChain(literal);
        }
        if (kind == TokenKind.INC || kind == TokenKind.DEC) {
            advance();
            return new PrefixOp(kind == TokenKind.INC ? IncDec.INC : IncDec.DEC, parsePrimary());
        }
        if (kind == TokenKind.BANG) {
            advance();
            return new UnaryOp(UnaryOperator.NOT, parsePrimary());
        }
        if (kind == TokenKind.SUB) {
            advance();
            return new UnaryOp(UnaryOperator.NEG, parsePrimary());
        }
        if (kind == TokenKind.ADD) {
            advance();
            return parsePrimary();
        }
        if (kind == TokenKind.NEW) {
            return parsePostfixChain(parseNew());
        }
        if (kind == TokenKind.LBRACE) {
            return new ArrayInit(parseArrayElements());
        }
        if (kind == TokenKind.IDENTIFIER || kind == TokenKind.THIS || kind == TokenKind.SUPER) {
            final var identifier = new Identifier(current.text());
            advance();
            return parsePostfixChain(identifier);
        }

        final Token unknown = current;
        LOG.finer(() -> "No expression rule for " + unknown);
        if (kind != TokenKind.EOF) {
            advance();
        }
        return new Unknown(unknown.kind() + ":" + unknown.text());
    }

    /// Applies any sequence of `.name`, `(args)`, `[index]`, `++` and `--` to `base`.
    private Expr parsePostfixChain(Expr base) {
        while (true) {
            if (at(TokenKind.DOT) && peek(2) == TokenKind.IDENTIFIER) {
                advance();
                base = new Member(base, current.text());
                advance();
            } else if (at(TokenKind.LPAREN)) {
                base = new Call(base, parseArguments());
            } else if (at(TokenKind.LBRACK)) {
                advance();
                final Expr index = parseExpression();
                match(TokenKind.RBRACK);
                base = new Index(base, index);
            } else if (at(TokenKind.INC) || at(TokenKind.DEC)) {
                base = new PostfixOp(at(TokenKind.INC) ? IncDec.INC : IncDec.DEC, base);
                advance();
            } else {
                return base;
            }
        }
    }

    private List<Expr> parseArguments() {
        match(TokenKind.LPAREN);
        final var args = new ArrayList<Expr>();
        if (!at(TokenKind.RPAREN)) {
            args.add(parseExpression());
            while (accept(TokenKind.COMMA)) {
                args.add(parseExpression());
            }
        }
        match(TokenKind.RPAREN);
        return args;
    }

    private Expr parseNew() {
        match(TokenKind.NEW);
        final String typeName;
        if (TYPE_KEYWORDS.contains(current.kind())) {
            typeName = current.text();
            advance();
        } else {
            typeName = parseQualifiedName();
        }
        if (!at(TokenKind.LBRACK)) {
            return new NewObject(typeName, parseArguments());
        }

        // new T[n][m]..., new T[n][] or new T[]...{...}
        final var sizes = new ArrayList<Expr>();
        int dims = 0;
        while (at(TokenKind.LBRACK)) {
            advance();
            if (!at(TokenKind.RBRACK) && sizes.size() == dims) {
                sizes.add(parseExpression());
            }
            match(TokenKind.RBRACK);
            dims++;
        }
        final var elementType = new TypeRef(typeName, dims - 1);
        if (!sizes.isEmpty()) {
            return new NewArray(elementType, sizes, null);
        }
        return new NewArray(elementType, null, parseArrayElements());
    }

    private List<Expr> parseArrayElements() {
        match(TokenKind.LBRACE);
        final var elements = new ArrayList<Expr>();
        while (!at(TokenKind.RBRACE) && !at(TokenKind.EOF)) {
            elements.add(parseExpression());
            if (!accept(TokenKind.COMMA)) {
                break;
            }
        }
        match(TokenKind.RBRACE);
        return elements;
    }
}
