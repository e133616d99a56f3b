package io.github.simbo1905.j2py;

import java.util.*;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static io.github.simbo1905.j2py.JavaAst.*;

/// Renders a Java syntax tree as Python 3 source.
///
/// Rendering is a single depth-first walk writing into one buffer. Depth is passed
/// explicitly and every nested suite is one level deeper than its header. All state
/// lives in a [RenderContext] created per call, so the generator is reentrant.
///
/// Increments of fields and array elements inside an expression run as statements placed
/// just before the line that uses them, with the old value kept in a `_tmpN` temporary for
/// postfix forms. Where no such line exists (loop headers, `elif`, conditionally evaluated
/// operands) they are reported instead.
///
/// Nodes the tree cannot express faithfully still produce output: an unknown expression
/// renders as `None` with a `# Unknown node: ...` comment placed above the enclosing
/// statement, and no input makes generation fail.
final class PythonGenerator {
    private PythonGenerator() {}

    private static final Logger LOG = Logger.getLogger(PythonGenerator.class.getName());

    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_]\\w*(\\.[A-Za-z_]\\w*)+");

    /// Static library calls with a direct Python builtin.
    private static final Map<String, String> BUILTINS = Map.of(
            "Math.max", "max",
            "Math.min", "min",
            "Math.abs", "abs",
            "Integer.parseInt", "int",
            "Long.parseLong", "int",
            "Double.parseDouble", "float",
            "String.valueOf", "str");

    // Python binding strengths used to decide where parentheses are needed.
    private static final int CONDITIONAL = 1;
    private static final int NOT = 25;
    private static final int COMPARISON = 30;
    private static final int ADDITIVE = 50;
    private static final int MULTIPLICATIVE = 60;
    private static final int NEGATION = 70;
    private static final int PRIMARY = 100;

    static String generate(CompilationUnit unit, TranslatorOptions options) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(options, "options must not be null");

        final var ctx = new RenderContext(options.indentUnit());
        for (int i = 0; i < unit.classes().size(); i++) {
            if (i > 0) {
                ctx.out.append("\n\n");
            }
            emitClass(ctx, unit.classes().get(i));
        }

        final ClassDecl entry = options.entryPoint() ? findEntryClass(unit) : null;
        if (entry != null) {
            ctx.out.append("\n\n");
            ctx.out.append("if __name__ == \"__main__\":\n");
            ctx.out.append(ctx.indentUnit).append(PythonTypes.name(entry.name())).append(".main(sys.argv[1:])\n");
        }

        final var sb = new StringBuilder(ctx.out.length() + 64);
        sb.append("from __future__ import annotations\n");
        if (entry != null) {
            sb.append("import sys\n");
        }
        if (ctx.out.length() > 0) {
            sb.append("\n\n").append(ctx.out);
        }
        LOG.fine(() -> "Generated " + unit.classes().size() + " class(es), " + ctx.codeLines + " code line(s)");
        return sb.toString();
    }

    private static ClassDecl findEntryClass(CompilationUnit unit) {
        for (ClassDecl cls : unit.classes()) {
            for (ClassMember member : cls.members()) {
                if (member instanceof MethodDecl m && m.isStatic() && m.name().equals("main") && m.params().size() == 1) {
                    return cls;
                }
            }
        }
        return null;
    }

    // ---------------------------------------------------------------- classes and members

    private static void emitClass(RenderContext ctx, ClassDecl cls) {
        ctx.className = PythonTypes.name(cls.name());
        ctx.fields.clear();
        ctx.fieldTypes.clear();
        ctx.methods.clear();

        final List<FieldDecl> instanceFields = new ArrayList<>();
        final List<Initializer> instanceInitializers = new ArrayList<>();
        boolean hasConstructor = false;
        for (ClassMember member : cls.members()) {
            if (member instanceof FieldDecl f) {
                ctx.fields.put(f.name(), f.isStatic());
                ctx.fieldTypes.put(f.name(), f.type());
                if (!f.isStatic()) {
                    instanceFields.add(f);
                }
            } else if (member instanceof MethodDecl m) {
                ctx.methods.put(m.name(), m.isStatic());
            } else if (member instanceof ConstructorDecl) {
                hasConstructor = true;
            } else if (member instanceof Initializer init && !init.isStatic()) {
                instanceInitializers.add(init);
            }
        }

        final String base = cls.superclass() == null ? "" : "(" + cls.superclass() + ")";
        line(ctx, 0, "class " + ctx.className + base + ":");
        final int start = ctx.codeLines;

        final boolean hasSuperclass = cls.superclass() != null;
        final boolean needsInit = !hasConstructor && (!instanceFields.isEmpty() || !instanceInitializers.isEmpty());
        boolean initEmitted = false;
        for (ClassMember member : cls.members()) {
            if (member instanceof FieldDecl f) {
                emitFieldDeclaration(ctx, f);
            } else if (member instanceof Initializer init) {
                if (init.isStatic()) {
                    enterClassBody(ctx);
                    emitStatements(ctx, init.body().statements(), 1);
                }
            } else if (member instanceof MethodDecl m) {
                if (needsInit && !initEmitted) {
                    separateMember(ctx, start);
                    emitDefaultConstructor(ctx, hasSuperclass, instanceFields, instanceInitializers);
                    initEmitted = true;
                }
                separateMember(ctx, start);
                emitMethod(ctx, m);
            } else if (member instanceof ConstructorDecl c) {
                separateMember(ctx, start);
                emitConstructor(ctx, c, hasSuperclass, instanceFields, instanceInitializers);
            }
        }
        if (needsInit && !initEmitted) {
            separateMember(ctx, start);
            emitDefaultConstructor(ctx, hasSuperclass, instanceFields, instanceInitializers);
        }
        if (ctx.codeLines == start) {
            line(ctx, 1, "pass");
        }
    }

    /// Static fields become class attributes; instance fields are annotated here and
    /// assigned in `__init__`.
    private static void emitFieldDeclaration(RenderContext ctx, FieldDecl f) {
        final String name = PythonTypes.name(f.name());
        final String hint = PythonTypes.hint(f.type());
        if (f.isStatic()) {
            enterClassBody(ctx);
            final String value = f.init() == null ? PythonTypes.defaultValue(f.type()) : expr(ctx, f.init());
            line(ctx, 1, name + ": " + hint + " = " + value);
        } else {
            line(ctx, 1, name + ": " + hint);
        }
    }

    private static void separateMember(RenderContext ctx, int classStart) {
        if (ctx.codeLines > classStart) {
            ctx.out.append('\n');
        }
    }

    private static void emitMethod(RenderContext ctx, MethodDecl m) {
        enterScope(ctx, m.params());
        if (m.isStatic()) {
            line(ctx, 1, "@staticmethod");
        }
        line(ctx, 1, "def " + PythonTypes.name(m.name()) + "(" + parameters(m.params(), !m.isStatic()) + ") -> "
                + PythonTypes.hint(m.returnType()) + ":");
        emitSuite(ctx, m.body() == null ? List.of() : m.body().statements(), 2);
    }

    /// An explicit `super(...)` or `this(...)` call stays first. Without one a subclass calls
    /// `super().__init__()`. Field initializers run after the superclass constructor and are
    /// skipped when the body delegates to another constructor with `this(...)`.
    private static void emitConstructor(RenderContext ctx, ConstructorDecl c, boolean hasSuperclass,
                                        List<FieldDecl> instanceFields, List<Initializer> instanceInitializers) {
        enterScope(ctx, c.params());
        line(ctx, 1, "def __init__(" + parameters(c.params(), true) + ") -> None:");
        final int start = ctx.codeLines;

        final List<Stmt> body = c.body().statements();
        final String explicitCall = body.isEmpty() ? null : explicitConstructorCall(body.get(0));
        int from = 0;
        if (explicitCall != null) {
            emitStmt(ctx, body.get(0), 2);
            from = 1;
        } else if (hasSuperclass) {
            line(ctx, 2, "super().__init__()");
        }
        if (!"this".equals(explicitCall)) {
            final Map<String, TypeRef> params = new HashMap<>(ctx.locals);
            ctx.locals.clear();
            emitInstanceInitialisation(ctx, instanceFields, instanceInitializers);
            ctx.locals.putAll(params);
        }

        emitStatements(ctx, body.subList(from, body.size()), 2);
        if (ctx.codeLines == start) {
            line(ctx, 2, "pass");
        }
    }

    private static void emitDefaultConstructor(RenderContext ctx, boolean hasSuperclass,
                                               List<FieldDecl> instanceFields, List<Initializer> instanceInitializers) {
        enterScope(ctx, List.of());
        line(ctx, 1, "def __init__(self) -> None:");
        final int start = ctx.codeLines;
        if (hasSuperclass) {
            line(ctx, 2, "super().__init__()");
        }
        emitInstanceInitialisation(ctx, instanceFields, instanceInitializers);
        if (ctx.codeLines == start) {
            line(ctx, 2, "pass");
        }
    }

    private static void emitInstanceInitialisation(RenderContext ctx,
                                                   List<FieldDecl> instanceFields, List<Initializer> instanceInitializers) {
        for (FieldDecl f : instanceFields) {
            final String value = f.init() == null ? PythonTypes.defaultValue(f.type()) : hoisting(ctx, f.init());
            line(ctx, 2, "self." + PythonTypes.name(f.name()) + " = " + value);
        }
        for (Initializer init : instanceInitializers) {
            emitStatements(ctx, init.body().statements(), 2);
        }
    }

    /// @return `super` or `this` for an explicit constructor call, otherwise null
    private static String explicitConstructorCall(Stmt stmt) {
        if (stmt instanceof ExprStmt es
                && es.expression() instanceof Call call
                && call.callee() instanceof Identifier id
                && (id.name().equals("super") || id.name().equals("this"))) {
            return id.name();
        }
        return null;
    }

    private static String parameters(List<Param> params, boolean withSelf) {
        final var parts = new ArrayList<String>();
        if (withSelf) {
            parts.add("self");
        }
        for (Param p : params) {
            parts.add(PythonTypes.name(p.name()) + ": " + PythonTypes.hint(p.type()));
        }
        return String.join(", ", parts);
    }

    private static void enterScope(RenderContext ctx, List<Param> params) {
        ctx.classBody = false;
        ctx.locals.clear();
        for (Param p : params) {
            ctx.locals.put(p.name(), p.type());
        }
    }

    private static void enterClassBody(RenderContext ctx) {
        ctx.classBody = true;
        ctx.locals.clear();
    }

    // ---------------------------------------------------------------- statements

    /// Emits statements as a suite, writing `pass` when nothing executable was produced.
    private static void emitSuite(RenderContext ctx, List<Stmt> statements, int depth) {
        final int start = ctx.codeLines;
        emitStatements(ctx, statements, depth);
        if (ctx.codeLines == start) {
            line(ctx, depth, "pass");
        }
    }

    private static void emitStatements(RenderContext ctx, List<Stmt> statements, int depth) {
        for (Stmt stmt : statements) {
            emitStmt(ctx, stmt, depth);
        }
    }

    private static void emitStmt(RenderContext ctx, Stmt stmt, int depth) {
        if (stmt instanceof Block b) {
            emitStatements(ctx, b.statements(), depth);
        } else if (stmt instanceof LocalVarDecl d) {
            final String value = d.init() == null ? PythonTypes.defaultValue(d.type()) : hoisting(ctx, d.init());
            ctx.locals.put(d.name(), localType(ctx, d));
            final String name = PythonTypes.name(d.name());
            line(ctx, depth, PythonTypes.hasHint(d.type())
                    ? name + ": " + PythonTypes.hint(d.type()) + " = " + value
                    : name + " = " + value);
        } else if (stmt instanceof IfStatement s) {
            emitIf(ctx, s, depth, "if");
        } else if (stmt instanceof WhileStatement w) {
            line(ctx, depth, "while " + expr(ctx, w.condition()) + ":");
            emitSuite(ctx, statementsOf(w.body()), depth + 1);
        } else if (stmt instanceof DoWhileStatement d) {
            line(ctx, depth, "while True:");
            emitStatements(ctx, statementsOf(d.body()), depth + 1);
            line(ctx, depth + 1, "if " + hoisting(ctx, new UnaryOp(UnaryOperator.NOT, d.condition())) + ":");
            line(ctx, depth + 2, "break");
        } else if (stmt instanceof ForStatement f) {
            emitFor(ctx, f, depth);
        } else if (stmt instanceof ForEachStatement f) {
            final String collection = hoisting(ctx, f.collection());
            ctx.locals.put(f.variable().name(), f.variable().type());
            line(ctx, depth, "for " + PythonTypes.name(f.variable().name()) + " in " + collection + ":");
            emitSuite(ctx, statementsOf(f.body()), depth + 1);
        } else if (stmt instanceof SwitchStatement s) {
            emitSwitch(ctx, s, depth);
        } else if (stmt instanceof Return r) {
            line(ctx, depth, r.value() == null ? "return" : "return " + hoisting(ctx, r.value()));
        } else if (stmt instanceof Break) {
            line(ctx, depth, "break");
        } else if (stmt instanceof Continue) {
            line(ctx, depth, "continue");
        } else if (stmt instanceof Assign a) {
            final String target = hoisting(ctx, a.target());
            final String value = hoisting(ctx, a.value());
            line(ctx, depth, target + " " + assignOperator(ctx, a) + " " + value);
        } else if (stmt instanceof ExprStmt e) {
            emitExpressionStatement(ctx, e.expression(), depth);
        } else {
            comment(ctx, depth, "Unsupported node: " + stmt.getClass().getSimpleName());
        }
    }

    /// `var` locals take the type of an integral or floating initializer.
    private static TypeRef localType(RenderContext ctx, LocalVarDecl d) {
        if (PythonTypes.hasHint(d.type()) || d.init() == null) {
            return d.type();
        }
        if (ctx.types.isIntegral(d.init())) {
            return TypeRef.of("int");
        }
        return ctx.types.isFloating(d.init()) ? TypeRef.of("double") : d.type();
    }

    /// `/=` on integral operands is floor division.
    private static String assignOperator(RenderContext ctx, Assign a) {
        if (a.op() == AssignOp.DIV_ASSIGN && ctx.types.isIntegral(a.target()) && ctx.types.isIntegral(a.value())) {
            return "//=";
        }
        return a.op().python();
    }

    private static void emitIf(RenderContext ctx, IfStatement s, int depth, String keyword) {
        final String condition = keyword.equals("if") ? hoisting(ctx, s.condition()) : expr(ctx, s.condition());
        line(ctx, depth, keyword + " " + condition + ":");
        emitSuite(ctx, s.thenBlock().statements(), depth + 1);
        if (s.elseBranch() instanceof IfStatement elif) {
            emitIf(ctx, elif, depth, "elif");
        } else if (s.elseBranch() != null) {
            line(ctx, depth, "else:");
            emitSuite(ctx, statementsOf(s.elseBranch()), depth + 1);
        }
    }

    /// Counting loops become `range`; any other loop becomes its init statement followed by
    /// a `while` whose body ends with the update.
    private static void emitFor(RenderContext ctx, ForStatement f, int depth) {
        final Optional<RangeLoops.CountingLoop> counting = RangeLoops.match(f, ctx.types);
        if (counting.isPresent()) {
            final RangeLoops.CountingLoop loop = counting.get();
            final String range = range(ctx, loop);
            ctx.locals.putIfAbsent(loop.variable(), TypeRef.of("int"));
            line(ctx, depth, "for " + PythonTypes.name(loop.variable()) + " in " + range + ":");
            emitSuite(ctx, statementsOf(f.body()), depth + 1);
            return;
        }

        LOG.finer(() -> "Rendering for loop as while loop");
        if (f.init() != null) {
            emitStmt(ctx, f.init(), depth);
        }
        line(ctx, depth, "while " + (f.condition() == null ? "True" : expr(ctx, f.condition())) + ":");
        final List<Stmt> body = new ArrayList<>(statementsOf(f.body()));
        if (f.update() != null) {
            body.add(f.update());
        }
        emitSuite(ctx, body, depth + 1);
    }

    private static String range(RenderContext ctx, RangeLoops.CountingLoop loop) {
        final String start = expr(ctx, loop.start());
        final String end;
        if (loop.inclusive()) {
            final Long exclusive = RangeLoops.exclusiveEnd(loop);
            end = exclusive != null
                    ? exclusive.toString()
                    : operand(ctx, loop.end(), ADDITIVE, false, false) + " + 1";
        } else {
            end = expr(ctx, loop.end());
        }
        final String step = loop.step() == 1 ? "" : ", " + loop.step();
        return "range(" + start + ", " + end + step + ")";
    }

    /// Cases keep source order, the default arm is moved last as `case _:` and a trailing
    /// `break` in an arm is dropped.
    private static void emitSwitch(RenderContext ctx, SwitchStatement s, int depth) {
        final String subject = hoisting(ctx, s.subject());
        line(ctx, depth, "match " + subject + ":");
        DefaultLabel fallback = null;
        boolean anyCase = false;
        for (SwitchArm arm : s.arms()) {
            if (arm instanceof DefaultLabel d) {
                fallback = d;
            } else if (arm instanceof CaseLabel c) {
                line(ctx, depth + 1, "case " + pattern(ctx, c.value(), subject) + ":");
                emitArm(ctx, c.statements(), depth + 2);
                anyCase = true;
            }
        }
        if (fallback != null) {
            line(ctx, depth + 1, "case _:");
            emitArm(ctx, fallback.statements(), depth + 2);
        } else if (!anyCase) {
            line(ctx, depth + 1, "case _:");
            line(ctx, depth + 2, "pass");
        }
    }

    /// An arm that leaves the switch early with `break` runs inside a one-pass
    /// `while True:` loop, so that `break` leaves the arm and not an enclosing loop.
    private static void emitArm(RenderContext ctx, List<Stmt> statements, int depth) {
        final List<Stmt> body = armBody(statements);
        if (!jumpsOut(body, Break.class)) {
            emitSuite(ctx, body, depth);
            return;
        }
        if (jumpsOut(body, Continue.class)) {
            LOG.fine(() -> "Switch arm uses both break and continue");
            ctx.pendingDiagnostics.add("Unsupported node: break inside a switch arm that also continues a loop");
            emitSuite(ctx, body, depth);
            return;
        }
        line(ctx, depth, "while True:");
        emitStatements(ctx, body, depth + 1);
        line(ctx, depth + 1, "break");
    }

    /// Whether a `break` or `continue` among these statements leaves them, looking through
    /// blocks and `if` but not loops. A `continue` also passes through nested switches.
    private static boolean jumpsOut(List<Stmt> statements, Class<? extends Stmt> jump) {
        for (Stmt stmt : statements) {
            if (jump.isInstance(stmt)) {
                return true;
            }
            if (stmt instanceof Block b && jumpsOut(b.statements(), jump)) {
                return true;
            }
            if (stmt instanceof IfStatement i
                    && (jumpsOut(i.thenBlock().statements(), jump)
                    || (i.elseBranch() != null && jumpsOut(List.of(i.elseBranch()), jump)))) {
                return true;
            }
            if (jump == Continue.class && stmt instanceof SwitchStatement sw) {
                for (SwitchArm arm : sw.arms()) {
                    if (jumpsOut(arm.statements(), jump)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static List<Stmt> armBody(List<Stmt> statements) {
        if (statements.size() == 1 && statements.get(0) instanceof Block b) {
            return armBody(b.statements());
        }
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof Break) {
            return statements.subList(0, statements.size() - 1);
        }
        return statements;
    }

    /// Literals and dotted names are valid `case` patterns; anything else compares in a guard.
    private static String pattern(RenderContext ctx, Expr value, String subject) {
        if (value instanceof Literal lit) {
            return PythonTypes.literal(lit.text());
        }
        if (value instanceof UnaryOp neg && neg.op() == UnaryOperator.NEG && neg.operand() instanceof Literal lit) {
            return "-" + PythonTypes.literal(lit.text());
        }
        final String rendered = expr(ctx, value);
        if (DOTTED_NAME.matcher(rendered).matches()) {
            return rendered;
        }
        return "_ if " + subject + " == " + rendered;
    }

    private static void emitExpressionStatement(RenderContext ctx, Expr e, int depth) {
        if (e instanceof Unknown u) {
            ctx.pendingDiagnostics.add("Unknown node: " + u.diagnostic());
            flushDiagnostics(ctx, depth);
        } else if (e instanceof PostfixOp p) {
            line(ctx, depth, hoisting(ctx, p.operand()) + (p.op() == IncDec.INC ? " += 1" : " -= 1"));
        } else if (e instanceof PrefixOp p) {
            line(ctx, depth, hoisting(ctx, p.operand()) + (p.op() == IncDec.INC ? " += 1" : " -= 1"));
        } else {
            line(ctx, depth, hoisting(ctx, e));
        }
    }

    private static List<Stmt> statementsOf(Stmt stmt) {
        return stmt instanceof Block b ? b.statements() : List.of(stmt);
    }

    // ---------------------------------------------------------------- expressions

    private static String expr(RenderContext ctx, Expr e) {
        if (e instanceof Literal lit) {
            return PythonTypes.literal(lit.text());
        }
        if (e instanceof Identifier id) {
            return resolveName(ctx, id.name());
        }
        if (e instanceof BinaryOp b) {
            return binary(ctx, b);
        }
        if (e instanceof UnaryOp u) {
            return u.op() == UnaryOperator.NOT
                    ? "not " + wrapIf(level(u.operand()) < PRIMARY, expr(ctx, u.operand()))
                    : "-" + wrapIf(level(u.operand()) < NEGATION, expr(ctx, u.operand()));
        }
        if (e instanceof PrefixOp p) {
            return increment(ctx, p.operand(), p.op(), true);
        }
        if (e instanceof PostfixOp p) {
            return increment(ctx, p.operand(), p.op(), false);
        }
        if (e instanceof Conditional c) {
            final String condition = wrapIf(level(c.condition()) <= CONDITIONAL, expr(ctx, c.condition()));
            return conditionally(ctx, () -> wrapIf(level(c.whenTrue()) <= CONDITIONAL, expr(ctx, c.whenTrue())))
                    + " if " + condition
                    + " else " + conditionally(ctx, () -> expr(ctx, c.whenFalse()));
        }
        if (e instanceof Cast c) {
            final String conversion = conversion(c.type());
            return conversion == null ? expr(ctx, c.operand()) : conversion + "(" + expr(ctx, c.operand()) + ")";
        }
        if (e instanceof Call c) {
            return call(ctx, c);
        }
        if (e instanceof Member m) {
            return member(ctx, m);
        }
        if (e instanceof Index i) {
            return primary(ctx, i.base()) + "[" + expr(ctx, i.index()) + "]";
        }
        if (e instanceof NewObject n) {
            return n.type() + "(" + arguments(ctx, n.args()) + ")";
        }
        if (e instanceof NewArray n) {
            return newArray(ctx, n);
        }
        if (e instanceof ArrayInit a) {
            return "[" + arguments(ctx, a.elements()) + "]";
        }
        if (e instanceof Unknown u) {
            ctx.pendingDiagnostics.add("Unknown node: " + u.diagnostic());
            return "None";
        }
        ctx.pendingDiagnostics.add("Unsupported node: " + e.getClass().getSimpleName());
        return "None";
    }

    private static String resolveName(RenderContext ctx, String name) {
        switch (name) {
            case "this":
                return "self";
            case "super":
                return "super()";
            default:
                break;
        }
        if (ctx.locals.containsKey(name) || ctx.classBody) {
            return PythonTypes.name(name);
        }
        final Boolean isStatic = ctx.fields.get(name);
        if (isStatic == null) {
            return PythonTypes.name(name);
        }
        return (isStatic ? ctx.className : "self") + "." + PythonTypes.name(name);
    }

    private static String binary(RenderContext ctx, BinaryOp b) {
        final int parent = level(b);
        final boolean comparison = b.op().isComparison();
        final boolean concat = b.op() == BinaryOperator.ADD && (isStringy(b.left()) || isStringy(b.right()));

        final String left = concat && !isStringy(b.left())
                ? "str(" + expr(ctx, b.left()) + ")"
                : operand(ctx, b.left(), parent, comparison, false);
        final boolean shortCircuit = b.op() == BinaryOperator.AND || b.op() == BinaryOperator.OR;
        final String right = conditionally(ctx, shortCircuit, () -> concat && !isStringy(b.right())
                ? "str(" + expr(ctx, b.right()) + ")"
                : operand(ctx, b.right(), parent, comparison, true));
        return left + " " + binaryOperator(ctx, b) + " " + right;
    }

    /// `/` on integral operands is floor division.
    private static String binaryOperator(RenderContext ctx, BinaryOp b) {
        if (b.op() == BinaryOperator.DIV && ctx.types.isIntegral(b.left()) && ctx.types.isIntegral(b.right())) {
            return "//";
        }
        return b.op().python();
    }

    /// Operands bind at least as tightly as their parent; the right operand of an
    /// operator of equal strength is parenthesized because all binary operators here
    /// associate to the left. Comparisons never chain.
    private static String operand(RenderContext ctx, Expr child, int parent, boolean parentIsComparison, boolean right) {
        final int childLevel = level(child);
        final boolean parens = childLevel < parent
                || (right && childLevel == parent)
                || (parentIsComparison && childLevel == COMPARISON);
        return wrapIf(parens, expr(ctx, child));
    }

    /// On a local, `++x` becomes `(x := x + 1)` and `x++` becomes `((x := x + 1) - 1)`.
    /// On a field or array element the update is hoisted: `++a` leaves `a += 1` before the
    /// line and renders `a`; `a++` also saves the old value in a temporary and renders that.
    private static String increment(RenderContext ctx, Expr operand, IncDec op, boolean prefix) {
        final String target = expr(ctx, operand);
        if (operand instanceof Identifier && !target.contains(".")) {
            final String walrus = "(" + target + " := " + target + (op == IncDec.INC ? " + 1" : " - 1") + ")";
            return prefix ? walrus : "(" + walrus + (op == IncDec.INC ? " - 1" : " + 1") + ")";
        }
        if (!ctx.canHoist) {
            ctx.pendingDiagnostics.add("Unknown node: increment of " + target + " inside an expression");
            return "(" + target + ")";
        }
        final String update = target + (op == IncDec.INC ? " += 1" : " -= 1");
        if (prefix) {
            ctx.hoisted.add(update);
            return target;
        }
        final String temporary = "_tmp" + ctx.temporaries++;
        ctx.hoisted.add(temporary + " = " + target);
        ctx.hoisted.add(update);
        return temporary;
    }

    /// Renders an expression evaluated exactly once just before the line being built, so
    /// increments inside it may be hoisted into statements.
    private static String hoisting(RenderContext ctx, Expr e) {
        final boolean saved = ctx.canHoist;
        ctx.canHoist = true;
        try {
            return expr(ctx, e);
        } finally {
            ctx.canHoist = saved;
        }
    }

    /// Renders an operand that may not be evaluated; nothing inside it is hoisted.
    private static String conditionally(RenderContext ctx, Supplier<String> render) {
        return conditionally(ctx, true, render);
    }

    private static String conditionally(RenderContext ctx, boolean conditional, Supplier<String> render) {
        final boolean saved = ctx.canHoist;
        ctx.canHoist = saved && !conditional;
        try {
            return render.get();
        } finally {
            ctx.canHoist = saved;
        }
    }

    private static String call(RenderContext ctx, Call c) {
        if (c.callee() instanceof Member m) {
            final String name = m.name();
            if (name.equals("println") || name.equals("print")) {
                return print(ctx, c.args(), name.equals("println"));
            }
            if ((name.equals("length") || name.equals("size")) && c.args().isEmpty()) {
                return "len(" + expr(ctx, m.base()) + ")";
            }
            if (name.equals("equals") && c.args().size() == 1) {
                return binary(ctx, new BinaryOp(BinaryOperator.EQUAL, m.base(), c.args().get(0)));
            }
            if (m.base() instanceof Identifier owner && !isDeclared(ctx, owner.name())) {
                final String builtin = BUILTINS.get(owner.name() + "." + name);
                if (builtin != null) {
                    return builtin + "(" + arguments(ctx, c.args()) + ")";
                }
            }
            return primary(ctx, m.base()) + "." + PythonTypes.name(name) + "(" + arguments(ctx, c.args()) + ")";
        }
        if (c.callee() instanceof Identifier id) {
            final String name = id.name();
            if (name.equals("super")) {
                return "super().__init__(" + arguments(ctx, c.args()) + ")";
            }
            if (name.equals("this")) {
                return "self.__init__(" + arguments(ctx, c.args()) + ")";
            }
            final Boolean isStatic = ctx.methods.get(name);
            if (isStatic != null && !ctx.locals.containsKey(name) && !ctx.classBody) {
                return (isStatic ? ctx.className : "self") + "." + PythonTypes.name(name)
                        + "(" + arguments(ctx, c.args()) + ")";
            }
            return PythonTypes.name(name) + "(" + arguments(ctx, c.args()) + ")";
        }
        return primary(ctx, c.callee()) + "(" + arguments(ctx, c.args()) + ")";
    }

    /// Only the first argument is printed; `print` suppresses the newline.
    private static String print(RenderContext ctx, List<Expr> args, boolean newline) {
        if (args.isEmpty()) {
            return newline ? "print()" : "print(end=\"\")";
        }
        final String value = expr(ctx, args.get(0));
        return newline ? "print(" + value + ")" : "print(" + value + ", end=\"\")";
    }

    private static String member(RenderContext ctx, Member m) {
        if (m.name().equals("length") && !(m.base() instanceof Identifier id && id.name().equals("this"))) {
            return "len(" + expr(ctx, m.base()) + ")";
        }
        return primary(ctx, m.base()) + "." + PythonTypes.name(m.name());
    }

    private static String newArray(RenderContext ctx, NewArray n) {
        if (n.elements() != null) {
            return "[" + arguments(ctx, n.elements()) + "]";
        }
        return sizedArray(ctx, n.sizes(), 0, n.elementType());
    }

    /// Nested lists from the outermost size inwards; elements of a dimension without a
    /// size start as empty lists.
    private static String sizedArray(RenderContext ctx, List<Expr> sizes, int index, TypeRef elementType) {
        final Expr size = sizes.get(index);
        if (index + 1 < sizes.size()) {
            final var inner = new TypeRef(elementType.name(), elementType.arrayDims() - 1);
            return "[" + sizedArray(ctx, sizes, index + 1, inner) + " for _ in range(" + expr(ctx, size) + ")]";
        }
        if (elementType.arrayDims() > 0) {
            return "[[] for _ in range(" + expr(ctx, size) + ")]";
        }
        return "[" + PythonTypes.defaultValue(elementType) + "] * " + operand(ctx, size, MULTIPLICATIVE, false, true);
    }

    /// @return the converting builtin for a cast, or null when the cast is dropped
    private static String conversion(TypeRef type) {
        if (type.arrayDims() > 0) {
            return null;
        }
        if (PythonTypes.isIntType(type)) {
            return "int";
        }
        if (PythonTypes.isFloatType(type)) {
            return "float";
        }
        if (type.name().equals("char")) {
            return "chr";
        }
        if (type.name().equals("String")) {
            return "str";
        }
        return null;
    }

    private static String arguments(RenderContext ctx, List<Expr> args) {
        final var parts = new ArrayList<String>(args.size());
        for (Expr arg : args) {
            parts.add(expr(ctx, arg));
        }
        return String.join(", ", parts);
    }

    private static String primary(RenderContext ctx, Expr e) {
        return wrapIf(level(e) < PRIMARY, expr(ctx, e));
    }

    private static boolean isDeclared(RenderContext ctx, String name) {
        return ctx.locals.containsKey(name) || ctx.fields.containsKey(name);
    }

    private static boolean isStringy(Expr e) {
        if (e instanceof Literal lit) {
            return PythonTypes.isStringLiteral(lit.text());
        }
        return e instanceof BinaryOp b
                && b.op() == BinaryOperator.ADD
                && (isStringy(b.left()) || isStringy(b.right()));
    }

    /// Binding strength of the Python text an expression renders to.
    private static int level(Expr e) {
        if (e instanceof BinaryOp b) {
            return b.op().isComparison() ? COMPARISON : b.op().precedence();
        }
        if (e instanceof UnaryOp u) {
            return u.op() == UnaryOperator.NOT ? NOT : NEGATION;
        }
        if (e instanceof Conditional) {
            return CONDITIONAL;
        }
        if (e instanceof Cast c) {
            return conversion(c.type()) == null ? level(c.operand()) : PRIMARY;
        }
        if (e instanceof Call c && c.callee() instanceof Member m && m.name().equals("equals") && c.args().size() == 1) {
            return COMPARISON;
        }
        if (e instanceof NewArray n && n.sizes() != null && n.sizes().size() == 1 && n.elementType().arrayDims() == 0) {
            return MULTIPLICATIVE;
        }
        return PRIMARY;
    }

    private static String wrapIf(boolean parens, String text) {
        return parens ? "(" + text + ")" : text;
    }

    // ---------------------------------------------------------------- output

    /// Writes one line of code, preceded by pending diagnostics and hoisted statements.
    private static void line(RenderContext ctx, int depth, String text) {
        flushDiagnostics(ctx, depth);
        for (String hoisted : ctx.hoisted) {
            write(ctx, depth, hoisted);
        }
        ctx.hoisted.clear();
        write(ctx, depth, text);
    }

    private static void write(RenderContext ctx, int depth, String text) {
        ctx.out.append(ctx.indentUnit.repeat(depth)).append(text).append('\n');
        ctx.codeLines++;
    }

    private static void comment(RenderContext ctx, int depth, String text) {
        ctx.out.append(ctx.indentUnit.repeat(depth)).append("# ").append(text).append('\n');
    }

    private static void flushDiagnostics(RenderContext ctx, int depth) {
        for (String diagnostic : ctx.pendingDiagnostics) {
            comment(ctx, depth, diagnostic);
        }
        ctx.pendingDiagnostics.clear();
    }

    private static final class RenderContext {
        final StringBuilder out = new StringBuilder(4 * 1024);
        final String indentUnit;
        final List<String> pendingDiagnostics = new ArrayList<>();
        /// Statements that must run before the next line, in order.
        final List<String> hoisted = new ArrayList<>();
        /// Names of the current class's fields and methods, mapped to whether they are static.
        final Map<String, Boolean> fields = new HashMap<>();
        final Map<String, TypeRef> fieldTypes = new HashMap<>();
        final Map<String, Boolean> methods = new HashMap<>();
        /// Parameters and locals of the member being rendered, with their declared types.
        final Map<String, TypeRef> locals = new HashMap<>();
        final ExpressionTypes types = ExpressionTypes.of(this::declaredType);
        String className = "";
        boolean classBody;
        boolean canHoist;
        int temporaries;
        int codeLines;

        RenderContext(String indentUnit) {
            this.indentUnit = indentUnit;
        }

        TypeRef declaredType(String name) {
            return locals.containsKey(name) ? locals.get(name) : fieldTypes.get(name);
        }
    }
}
