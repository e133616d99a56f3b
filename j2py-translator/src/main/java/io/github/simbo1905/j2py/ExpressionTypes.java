package io.github.simbo1905.j2py;

import java.util.Objects;
import java.util.function.Function;

import static io.github.simbo1905.j2py.JavaAst.*;

/// Static typing of expressions from declarations in scope.
///
/// Answers are conservative: an expression is integral only when every part of it is known
/// to be, and floating only when some part is known to be. Anything else is unknown and
/// both checks return false.
final class ExpressionTypes {
    private final Function<String, TypeRef> declared;

    /// @param declared declared type of a local, parameter or field by name; null when unknown
    private ExpressionTypes(Function<String, TypeRef> declared) {
        this.declared = declared;
    }

    static ExpressionTypes of(Function<String, TypeRef> declared) {
        Objects.requireNonNull(declared, "declared must not be null");
        return new ExpressionTypes(declared);
    }

    /// Nothing declared; only literals have a type.
    static ExpressionTypes none() {
        return new ExpressionTypes(name -> null);
    }

    TypeRef declaredType(String name) {
        return declared.apply(name);
    }

    /// Whether the expression has a Java integral type (`int`, `long`, `short`, `byte`).
    boolean isIntegral(Expr e) {
        if (e instanceof Literal) {
            return RangeLoops.intLiteral(e) != null;
        }
        if (e instanceof UnaryOp u) {
            return u.op() == UnaryOperator.NEG && isIntegral(u.operand());
        }
        if (e instanceof BinaryOp b) {
            return isArithmetic(b.op()) && isIntegral(b.left()) && isIntegral(b.right());
        }
        if (e instanceof PrefixOp p) {
            return isIntegral(p.operand());
        }
        if (e instanceof PostfixOp p) {
            return isIntegral(p.operand());
        }
        if (e instanceof Cast c) {
            return PythonTypes.isIntType(c.type());
        }
        if (e instanceof Conditional c) {
            return isIntegral(c.whenTrue()) && isIntegral(c.whenFalse());
        }
        if (e instanceof Member m && m.name().equals("length")) {
            return true;
        }
        if (e instanceof Call c) {
            return isIntegralCall(c);
        }
        final TypeRef type = typeOf(e);
        return type != null && PythonTypes.isIntType(type);
    }

    /// Whether the expression has a Java floating type, or is a division Python would
    /// render as true division.
    boolean isFloating(Expr e) {
        if (e instanceof Literal lit) {
            final String text = lit.text();
            return !text.isEmpty() && Character.isDigit(text.charAt(0))
                    && (text.contains(".") || text.contains("e") || text.contains("E"));
        }
        if (e instanceof UnaryOp u) {
            return u.op() == UnaryOperator.NEG && isFloating(u.operand());
        }
        if (e instanceof BinaryOp b) {
            if (!isArithmetic(b.op())) {
                return false;
            }
            if (b.op() == BinaryOperator.DIV && !(isIntegral(b.left()) && isIntegral(b.right()))) {
                return true;
            }
            return isFloating(b.left()) || isFloating(b.right());
        }
        if (e instanceof Cast c) {
            return PythonTypes.isFloatType(c.type());
        }
        if (e instanceof Conditional c) {
            return isFloating(c.whenTrue()) || isFloating(c.whenFalse());
        }
        final TypeRef type = typeOf(e);
        return type != null && PythonTypes.isFloatType(type);
    }

    /// Declared type of a name, `this.name` or an element of an array, or null.
    TypeRef typeOf(Expr e) {
        if (e instanceof Identifier id) {
            return declared.apply(id.name());
        }
        if (e instanceof Member m && m.base() instanceof Identifier self && self.name().equals("this")) {
            return declared.apply(m.name());
        }
        if (e instanceof Index i) {
            final TypeRef array = typeOf(i.base());
            return array == null || array.arrayDims() == 0 ? null : new TypeRef(array.name(), array.arrayDims() - 1);
        }
        return null;
    }

    private boolean isIntegralCall(Call c) {
        if (!(c.callee() instanceof Member m)) {
            return false;
        }
        if ((m.name().equals("length") || m.name().equals("size")) && c.args().isEmpty()) {
            return true;
        }
        if (m.base() instanceof Identifier owner && declared.apply(owner.name()) == null) {
            final String qualified = owner.name() + "." + m.name();
            if (qualified.equals("Integer.parseInt") || qualified.equals("Long.parseLong")) {
                return true;
            }
            if (qualified.equals("Math.abs") || qualified.equals("Math.max") || qualified.equals("Math.min")) {
                return !c.args().isEmpty() && c.args().stream().allMatch(this::isIntegral);
            }
        }
        return false;
    }

    private static boolean isArithmetic(BinaryOperator op) {
        return op == BinaryOperator.ADD || op == BinaryOperator.SUB || op == BinaryOperator.MUL
                || op == BinaryOperator.DIV || op == BinaryOperator.MOD;
    }
}
