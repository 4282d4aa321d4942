package org.termcalc.core.context;

import org.apache.commons.math3.complex.Complex;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.result.NumberType;

import java.util.List;

/**
 * The numeric semantics of every operation and built-in function.
 * <p>
 * Real arguments are computed with {@link Math}. A function whose real argument leaves its real
 * domain promotes the computation to {@link Complex}. Complex arguments always stay complex.
 * Undefined outcomes are {@link MathResult#nan()}.
 */
public final class MathOperations {

    private static final Complex ONE = Complex.ONE;
    private static final Complex HALF_PI = new Complex(Math.PI / 2.0, 0.0);

    private MathOperations() {}

    /**
     * Applies a binary operation.
     * @param op The operation. {@link OperationType#ASSIGN} has no numeric meaning and yields NaN.
     * @param left The left operand.
     * @param right The right operand.
     * @return The result, complex if either operand is complex.
     */
    public static MathResult binary(OperationType op, MathResult left, MathResult right) {
        NumberType type = NumberType.combine(left.getType(), right.getType());
        Complex l = left.getValue();
        Complex r = right.getValue();
        return switch (op) {
            case ADD -> type == NumberType.REAL
                    ? MathResult.real(left.getReal() + right.getReal())
                    : new MathResult(type, l.add(r));
            case SUB -> type == NumberType.REAL
                    ? MathResult.real(left.getReal() - right.getReal())
                    : new MathResult(type, l.subtract(r));
            case MUL -> type == NumberType.REAL
                    ? MathResult.real(left.getReal() * right.getReal())
                    : new MathResult(type, l.multiply(r));
            case DIV -> type == NumberType.REAL
                    ? MathResult.real(left.getReal() / right.getReal())
                    : new MathResult(type, l.divide(r));
            case POW -> pow(left, right);
            case MOD -> mod(left, right);
            case ASSIGN -> MathResult.nan();
        };
    }

    /**
     * Applies a prefix operation. Only {@link OperationType#ADD} (identity) and
     * {@link OperationType#SUB} (negation) are defined.
     * @param op The operation.
     * @param operand The operand.
     * @return The result, or NaN for a non-unary operation.
     */
    public static MathResult unary(OperationType op, MathResult operand) {
        return switch (op) {
            case ADD -> operand;
            case SUB -> operand.isReal()
                    ? MathResult.real(-operand.getReal())
                    : MathResult.of(operand.getValue().negate());
            default -> MathResult.nan();
        };
    }

    /**
     * Applies a built-in function.
     * @param fn The function.
     * @param args The evaluated arguments.
     * @return The result, or NaN if the argument count does not match the arity.
     */
    public static MathResult function(FunctionType fn, List<MathResult> args) {
        if (args.size() != fn.getArity()) {
            return MathResult.nan();
        }
        if (fn.getArity() == 2) {
            MathResult a = args.get(0);
            MathResult b = args.get(1);
            return switch (fn) {
                case POW -> pow(a, b);
                case ROOT -> pow(a, reciprocal(b));
                default -> MathResult.nan();
            };
        }

        MathResult arg = args.get(0);
        if (arg.isComplex()) {
            return complexFunction(fn, arg.getValue());
        }
        double x = arg.getReal();
        return switch (fn) {
            case COS -> MathResult.real(Math.cos(x));
            case SIN -> MathResult.real(Math.sin(x));
            case TAN -> MathResult.real(Math.tan(x));
            case COT -> MathResult.real(1.0 / Math.tan(x));
            case COSH -> MathResult.real(Math.cosh(x));
            case SINH -> MathResult.real(Math.sinh(x));
            case TANH -> MathResult.real(Math.tanh(x));
            case COTH -> MathResult.real(1.0 / Math.tanh(x));
            case ARCCOS -> Math.abs(x) > 1.0 ? complexFunction(fn, real(x)) : MathResult.real(Math.acos(x));
            case ARCSIN -> Math.abs(x) > 1.0 ? complexFunction(fn, real(x)) : MathResult.real(Math.asin(x));
            case ARCTAN -> MathResult.real(Math.atan(x));
            case ARCCOT -> MathResult.real(Math.PI / 2.0 - Math.atan(x));
            case ARCCOSH -> x < 1.0
                    ? complexFunction(fn, real(x))
                    : MathResult.real(Math.log(x + Math.sqrt(x * x - 1.0)));
            case ARCSINH -> MathResult.real(Math.signum(x) * Math.log(Math.abs(x) + Math.sqrt(x * x + 1.0)));
            case ARCTANH -> Math.abs(x) > 1.0
                    ? complexFunction(fn, real(x))
                    : MathResult.real(0.5 * Math.log((1.0 + x) / (1.0 - x)));
            case ARCCOTH -> Math.abs(x) < 1.0
                    ? complexFunction(fn, real(x))
                    : MathResult.real(0.5 * Math.log((x + 1.0) / (x - 1.0)));
            case EXP -> MathResult.real(Math.exp(x));
            case LN -> x < 0.0 ? complexFunction(fn, real(x)) : MathResult.real(Math.log(x));
            case SQRT -> x < 0.0 ? complexFunction(fn, real(x)) : MathResult.real(Math.sqrt(x));
            case RE -> MathResult.real(x);
            case IM -> MathResult.real(0.0);
            default -> MathResult.nan();
        };
    }

    private static MathResult complexFunction(FunctionType fn, Complex z) {
        return switch (fn) {
            case COS -> MathResult.of(z.cos());
            case SIN -> MathResult.of(z.sin());
            case TAN -> MathResult.of(z.tan());
            case COT -> MathResult.of(z.cos().divide(z.sin()));
            case COSH -> MathResult.of(z.cosh());
            case SINH -> MathResult.of(z.sinh());
            case TANH -> MathResult.of(z.tanh());
            case COTH -> MathResult.of(z.cosh().divide(z.sinh()));
            case ARCCOS -> MathResult.of(z.acos());
            case ARCSIN -> MathResult.of(z.asin());
            case ARCTAN -> MathResult.of(z.atan());
            case ARCCOT -> MathResult.of(HALF_PI.subtract(z.atan()));
            case ARCCOSH -> MathResult.of(acosh(z));
            case ARCSINH -> MathResult.of(asinh(z));
            case ARCTANH -> MathResult.of(atanh(z));
            case ARCCOTH -> MathResult.of(atanh(z.reciprocal()));
            case EXP -> MathResult.of(z.exp());
            case LN -> MathResult.of(z.log());
            case SQRT -> MathResult.of(z.sqrt());
            case RE -> MathResult.real(z.getReal());
            case IM -> MathResult.real(z.getImaginary());
            default -> MathResult.nan();
        };
    }

    private static MathResult pow(MathResult base, MathResult exponent) {
        if (base.isReal() && exponent.isReal()) {
            return MathResult.real(Math.pow(base.getReal(), exponent.getReal()));
        }
        return MathResult.of(base.getValue().log().multiply(exponent.getValue()).exp());
    }

    /**
     * Integer remainder with the sign of the dividend. Both operands must be real integers and
     * the divisor must not be zero.
     */
    private static MathResult mod(MathResult left, MathResult right) {
        if (!left.isReal() || !right.isReal()) {
            return MathResult.nan();
        }
        double a = left.getReal();
        double b = right.getReal();
        if (!isInteger(a) || !isInteger(b) || b == 0.0) {
            return MathResult.nan();
        }
        return MathResult.real(a % b);
    }

    private static MathResult reciprocal(MathResult value) {
        return value.isReal()
                ? MathResult.real(1.0 / value.getReal())
                : MathResult.of(value.getValue().reciprocal());
    }

    private static boolean isInteger(double value) {
        return !Double.isInfinite(value) && !Double.isNaN(value) && value == Math.rint(value);
    }

    private static Complex real(double x) {
        return new Complex(x, 0.0);
    }

    private static Complex asinh(Complex z) {
        return z.add(z.multiply(z).add(ONE).sqrt()).log();
    }

    private static Complex acosh(Complex z) {
        return z.add(z.add(ONE).sqrt().multiply(z.subtract(ONE).sqrt())).log();
    }

    private static Complex atanh(Complex z) {
        return ONE.add(z).log().subtract(ONE.subtract(z).log()).multiply(0.5);
    }
}
