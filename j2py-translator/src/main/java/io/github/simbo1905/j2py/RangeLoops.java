package io.github.simbo1905.j2py;

import java.util.Optional;
import java.util.logging.Logger;

import static io.github.simbo1905.j2py.JavaAst.*;

/// Recognises classic `for` loops that count an integer variable upwards by a constant
/// step, so they can be rendered as `for v in range(...)`.
///
/// The loop must have the shape `for (v = start; v < end | v <= end; step-update)` where
/// the update is `v++`, `++v`, `v += k`, `v = v + k` or `v = k + v` (or the decrementing
/// forms) with an integer literal `k`, and the resulting step is positive. The counter must
/// be declared integral (or, for an undeclared counter, start at an integer literal) and
/// neither bound may be floating, since `range` accepts integers only. Anything else yields
/// an empty result and the caller falls back to a `while` loop.
final class RangeLoops {
    private RangeLoops() {}

    private static final Logger LOG = Logger.getLogger(RangeLoops.class.getName());

    /// A loop counting `variable` from `start` while `variable <cmp> end`, advancing by `step`.
    record CountingLoop(String variable, Expr start, Expr end, boolean inclusive, long step) {}

    static Optional<CountingLoop> match(ForStatement loop) {
        return match(loop, ExpressionTypes.none());
    }

    static Optional<CountingLoop> match(ForStatement loop, ExpressionTypes types) {
        if (loop.init() == null || loop.condition() == null || loop.update() == null) {
            return Optional.empty();
        }

        final String variable;
        final Expr start;
        final TypeRef counterType;
        if (loop.init() instanceof LocalVarDecl decl && decl.init() != null) {
            variable = decl.name();
            start = decl.init();
            counterType = decl.type();
        } else if (loop.init() instanceof Assign assign
                && assign.op() == AssignOp.ASSIGN
                && assign.target() instanceof Identifier id) {
            variable = id.name();
            start = assign.value();
            counterType = types.declaredType(variable);
        } else {
            LOG.finer(() -> "Loop init is not a counter initialisation: " + loop.init());
            return Optional.empty();
        }

        final boolean integralCounter = counterType != null && PythonTypes.isIntType(counterType);
        final boolean untypedCounter = counterType == null || !PythonTypes.hasHint(counterType);
        if (!integralCounter && !(untypedCounter && intLiteral(start) != null)) {
            LOG.finer(() -> "Loop counter " + variable + " is not integral: " + counterType);
            return Optional.empty();
        }
        if (types.isFloating(start)) {
            LOG.finer(() -> "Loop start is not integral: " + start);
            return Optional.empty();
        }

        if (!(loop.condition() instanceof BinaryOp cond)
                || (cond.op() != BinaryOperator.LT && cond.op() != BinaryOperator.LE)
                || !isVariable(cond.left(), variable)) {
            LOG.finer(() -> "Loop condition is not an upper bound on " + variable);
            return Optional.empty();
        }

        if (types.isFloating(cond.right())) {
            LOG.finer(() -> "Loop bound is not integral: " + cond.right());
            return Optional.empty();
        }

        final Long step = step(loop.update(), variable);
        if (step == null || step <= 0) {
            LOG.finer(() -> "Loop update is not a positive constant step of " + variable);
            return Optional.empty();
        }
        return Optional.of(new CountingLoop(variable, start, cond.right(), cond.op() == BinaryOperator.LE, step));
    }

    /// For an inclusive bound over integer literals: the first value past the last one visited.
    /// @return the exclusive bound, or null when start or end is not an integer literal
    static Long exclusiveEnd(CountingLoop loop) {
        final Long start = intLiteral(loop.start());
        final Long end = intLiteral(loop.end());
        if (start == null || end == null) {
            return null;
        }
        if (end < start) {
            return end + 1;
        }
        final long last = start + ((end - start) / loop.step()) * loop.step();
        return last + loop.step();
    }

    private static Long step(Stmt update, String variable) {
        if (update instanceof ExprStmt stmt) {
            final Expr e = stmt.expression();
            if (e instanceof PostfixOp post && isVariable(post.operand(), variable)) {
                return post.op() == IncDec.INC ? 1L : -1L;
            }
            if (e instanceof PrefixOp pre && isVariable(pre.operand(), variable)) {
                return pre.op() == IncDec.INC ? 1L : -1L;
            }
            return null;
        }
        if (!(update instanceof Assign assign) || !isVariable(assign.target(), variable)) {
            return null;
        }
        switch (assign.op()) {
            case ADD_ASSIGN: {
                final Long k = intLiteral(assign.value());
                return k;
            }
            case SUB_ASSIGN: {
                final Long k = intLiteral(assign.value());
                return k == null ? null : -k;
            }
            case ASSIGN:
                return selfIncrement(assign.value(), variable);
            default:
                return null;
        }
    }

    /// `v + k`, `k + v` or `v - k`.
    private static Long selfIncrement(Expr value, String variable) {
        if (!(value instanceof BinaryOp op)) {
            return null;
        }
        if (op.op() == BinaryOperator.ADD) {
            if (isVariable(op.left(), variable)) {
                return intLiteral(op.right());
            }
            if (isVariable(op.right(), variable)) {
                return intLiteral(op.left());
            }
        }
        if (op.op() == BinaryOperator.SUB && isVariable(op.left(), variable)) {
            final Long k = intLiteral(op.right());
            return k == null ? null : -k;
        }
        return null;
    }

    private static boolean isVariable(Expr e, String variable) {
        return e instanceof Identifier id && id.name().equals(variable);
    }

    /// Value of an integer literal, optionally negated; null for anything else.
    static Long intLiteral(Expr e) {
        if (e instanceof UnaryOp neg && neg.op() == UnaryOperator.NEG) {
            final Long inner = intLiteral(neg.operand());
            return inner == null ? null : -inner;
        }
        if (e instanceof Literal lit && !lit.text().isEmpty() && lit.text().chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(lit.text());
            } catch (NumberFormatException ex) {
                LOG.finer(() -> "Integer literal out of range: " + lit.text());
                return null;
            }
        }
        return null;
    }
}
