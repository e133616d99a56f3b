package io.github.simbo1905.j2py;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/// AST for the supported Java subset.
///
/// Three closed families: class members (`ClassMember`), statements (`Stmt`) and
/// expressions (`Expr`). Every node is an immutable record that owns its children;
/// lists are copied on construction so no node can be shared between two parents.
/// Optional parts are represented by null and documented on each record.
public final class JavaAst {
    private JavaAst() {}

    /// Root of a parsed source file: the class declarations in source order.
    public record CompilationUnit(List<ClassDecl> classes) {
        public CompilationUnit {
            classes = List.copyOf(classes);
        }
    }

    /// `[modifiers] class name [extends superclass] { members }`.
    /// `superclass` is null when there is no `extends` clause.
    public record ClassDecl(String name, Set<Modifier> modifiers, String superclass, List<ClassMember> members) {
        public ClassDecl {
            Objects.requireNonNull(name, "name must not be null");
            modifiers = Modifier.immutableSet(modifiers);
            members = List.copyOf(members);
        }
    }

    /// A declared type: base name plus the number of `[]` suffixes.
    public record TypeRef(String name, int arrayDims) {
        public TypeRef {
            Objects.requireNonNull(name, "name must not be null");
            if (arrayDims < 0) {
                throw new IllegalArgumentException("arrayDims must not be negative");
            }
        }

        public static TypeRef of(String name) {
            return new TypeRef(name, 0);
        }

        @Override
        public String toString() {
            return name + "[]".repeat(arrayDims);
        }
    }

    /// A method, constructor or loop variable parameter.
    public record Param(TypeRef type, String name) {
        public Param {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    public sealed interface ClassMember permits FieldDecl, MethodDecl, ConstructorDecl, Initializer {}

    /// Field with an optional initializer (`init` may be null).
    public record FieldDecl(Set<Modifier> modifiers, TypeRef type, String name, Expr init) implements ClassMember {
        public FieldDecl {
            modifiers = Modifier.immutableSet(modifiers);
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        public boolean isStatic() {
            return modifiers.contains(Modifier.STATIC);
        }
    }

    /// Method; `body` is null for declarations ending in `;` (abstract or native).
    public record MethodDecl(Set<Modifier> modifiers, TypeRef returnType, String name, List<Param> params, Block body)
            implements ClassMember {
        public MethodDecl {
            modifiers = Modifier.immutableSet(modifiers);
            Objects.requireNonNull(returnType, "returnType must not be null");
            Objects.requireNonNull(name, "name must not be null");
            params = List.copyOf(params);
        }

        public boolean isStatic() {
            return modifiers.contains(Modifier.STATIC);
        }
    }

    public record ConstructorDecl(Set<Modifier> modifiers, String className, List<Param> params, Block body)
            implements ClassMember {
        public ConstructorDecl {
            modifiers = Modifier.immutableSet(modifiers);
            Objects.requireNonNull(className, "className must not be null");
            params = List.copyOf(params);
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /// `{ ... }` or `static { ... }` directly inside a class body.
    public record Initializer(boolean isStatic, Block body) implements ClassMember {
        public Initializer {
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    // ---------------------------------------------------------------- statements

    public sealed interface Stmt permits Block, LocalVarDecl, IfStatement, WhileStatement, DoWhileStatement,
            ForStatement, ForEachStatement, SwitchStatement, Return, Break, Continue, Assign, ExprStmt {}

    public record Block(List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }
    }

    /// Local variable declaration; `init` may be null.
    public record LocalVarDecl(TypeRef type, String name, Expr init) implements Stmt {
        public LocalVarDecl {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// `elseBranch` is null, another `IfStatement` (an else-if chain) or a `Block`.
    public record IfStatement(Expr condition, Block thenBlock, Stmt elseBranch) implements Stmt {
        public IfStatement {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenBlock, "thenBlock must not be null");
            if (elseBranch != null && !(elseBranch instanceof IfStatement) && !(elseBranch instanceof Block)) {
                throw new IllegalArgumentException("else branch must be an if statement or a block");
            }
        }
    }

    public record WhileStatement(Expr condition, Stmt body) implements Stmt {
        public WhileStatement {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    public record DoWhileStatement(Stmt body, Expr condition) implements Stmt {
        public DoWhileStatement {
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }

    /// Classic three-clause `for`; `init`, `condition` and `update` may each be null.
    public record ForStatement(Stmt init, Expr condition, Stmt update, Stmt body) implements Stmt {
        public ForStatement {
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /// Range-style `for (Type name : collection)`.
    public record ForEachStatement(Param variable, Expr collection, Stmt body) implements Stmt {
        public ForEachStatement {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(collection, "collection must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    public record SwitchStatement(Expr subject, List<SwitchArm> arms) implements Stmt {
        public SwitchStatement {
            Objects.requireNonNull(subject, "subject must not be null");
            arms = List.copyOf(arms);
        }
    }

    public sealed interface SwitchArm permits CaseLabel, DefaultLabel {
        List<Stmt> statements();
    }

    public record CaseLabel(Expr value, List<Stmt> statements) implements SwitchArm {
        public CaseLabel {
            Objects.requireNonNull(value, "value must not be null");
            statements = List.copyOf(statements);
        }
    }

    public record DefaultLabel(List<Stmt> statements) implements SwitchArm {
        public DefaultLabel {
            statements = List.copyOf(statements);
        }
    }

    /// `value` is null for a bare `return;`.
    public record Return(Expr value) implements Stmt {}

    public record Break() implements Stmt {}

    public record Continue() implements Stmt {}

    public record Assign(Expr target, AssignOp op, Expr value) implements Stmt {
        public Assign {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    public record ExprStmt(Expr expression) implements Stmt {
        public ExprStmt {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    // ---------------------------------------------------------------- expressions

    public sealed interface Expr permits BinaryOp, UnaryOp, PrefixOp, PostfixOp, Conditional, Cast, Call, Member,
            Index, NewObject, NewArray, ArrayInit, Identifier, Literal, Unknown {}

    public record BinaryOp(BinaryOperator op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    public record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    public record PrefixOp(IncDec op, Expr operand) implements Expr {
        public PrefixOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    public record PostfixOp(IncDec op, Expr operand) implements Expr {
        public PostfixOp {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// `condition ? whenTrue : whenFalse`.
    public record Conditional(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(whenTrue, "whenTrue must not be null");
            Objects.requireNonNull(whenFalse, "whenFalse must not be null");
        }
    }

    /// Cast to a primitive type, e.g. `(int) x`.
    public record Cast(TypeRef type, Expr operand) implements Expr {
        public Cast {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    public record Call(Expr callee, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(callee, "callee must not be null");
            args = List.copyOf(args);
        }
    }

    /// `base.name`.
    public record Member(Expr base, String name) implements Expr {
        public Member {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// `base[index]`.
    public record Index(Expr base, Expr index) implements Expr {
        public Index {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(index, "index must not be null");
        }
    }

    /// `new Type(args)`.
    public record NewObject(String type, List<Expr> args) implements Expr {
        public NewObject {
            Objects.requireNonNull(type, "type must not be null");
            args = List.copyOf(args);
        }
    }

    /// `new T[n][m]...` (elements null) or `new T[]{...}` (sizes null).
    /// `elementType` is the type of one element of the outermost array; `sizes` holds the
    /// dimension expressions from the outermost inwards and may be shorter than the
    /// number of dimensions, as in `new int[3][]`.
    public record NewArray(TypeRef elementType, List<Expr> sizes, List<Expr> elements) implements Expr {
        public NewArray {
            Objects.requireNonNull(elementType, "elementType must not be null");
            if ((sizes == null) == (elements == null)) {
                throw new IllegalArgumentException("exactly one of sizes and elements must be present");
            }
            if (sizes != null && sizes.isEmpty()) {
                throw new IllegalArgumentException("sizes must not be empty");
            }
            if (sizes != null && sizes.size() > elementType.arrayDims() + 1) {
                throw new IllegalArgumentException("more sizes than dimensions: " + sizes.size());
            }
            sizes = sizes == null ? null : List.copyOf(sizes);
            elements = elements == null ? null : List.copyOf(elements);
        }
    }

    /// Bare `{a, b, c}` array initializer.
    public record ArrayInit(List<Expr> elements) implements Expr {
        public ArrayInit {
            elements = List.copyOf(elements);
        }
    }

    public record Identifier(String name) implements Expr {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Raw literal text as written in the source: numbers, quoted strings and chars,
    /// `true`, `false` and `null`.
    public record Literal(String text) implements Expr {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// Placeholder for a token the expression grammar does not cover.
    public record Unknown(String diagnostic) implements Expr {
        public Unknown {
            Objects.requireNonNull(diagnostic, "diagnostic must not be null");
        }
    }

    // ---------------------------------------------------------------- operators

    /// Binary operators with their binding strength; higher binds tighter.
    public enum BinaryOperator {
        MUL(TokenKind.MUL, 60, "*"),
        DIV(TokenKind.DIV, 60, "/"),
        MOD(TokenKind.MOD, 60, "%"),
        ADD(TokenKind.ADD, 50, "+"),
        SUB(TokenKind.SUB, 50, "-"),
        GT(TokenKind.GT, 40, ">"),
        LT(TokenKind.LT, 40, "<"),
        GE(TokenKind.GE, 40, ">="),
        LE(TokenKind.LE, 40, "<="),
        EQUAL(TokenKind.EQUAL, 30, "=="),
        NOTEQUAL(TokenKind.NOTEQUAL, 30, "!="),
        AND(TokenKind.AND, 20, "and"),
        OR(TokenKind.OR, 10, "or");

        private final TokenKind token;
        private final int precedence;
        private final String python;

        BinaryOperator(TokenKind token, int precedence, String python) {
            this.token = token;
            this.precedence = precedence;
            this.python = python;
        }

        public int precedence() {
            return precedence;
        }

        /// Operator spelling in the generated Python.
        public String python() {
            return python;
        }

        public boolean isComparison() {
            return precedence == 30 || precedence == 40;
        }

        /// @return the operator for this token kind, or null when it is not a binary operator
        public static BinaryOperator fromToken(TokenKind kind) {
            for (BinaryOperator op : values()) {
                if (op.token == kind) {
                    return op;
                }
            }
            return null;
        }
    }

    public enum UnaryOperator { NOT, NEG }

    public enum IncDec { INC, DEC }

    public enum AssignOp {
        ASSIGN(TokenKind.ASSIGN, "="),
        ADD_ASSIGN(TokenKind.ADD_ASSIGN, "+="),
        SUB_ASSIGN(TokenKind.SUB_ASSIGN, "-="),
        MUL_ASSIGN(TokenKind.MUL_ASSIGN, "*="),
        DIV_ASSIGN(TokenKind.DIV_ASSIGN, "/="),
        MOD_ASSIGN(TokenKind.MOD_ASSIGN, "%=");

        private final TokenKind token;
        private final String python;

        AssignOp(TokenKind token, String python) {
            this.token = token;
            this.python = python;
        }

        public String python() {
            return python;
        }

        /// @return the assignment operator for this token kind, or null
        public static AssignOp fromToken(TokenKind kind) {
            for (AssignOp op : values()) {
                if (op.token == kind) {
                    return op;
                }
            }
            return null;
        }
    }
}
