package org.termcalc.core.context;

import org.termcalc.core.result.MathResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the numeric semantics in {@link MathOperations}, in particular the promotion
 * of real arguments outside a function's real domain.
 */
public class MathOperationsTest {

    private static final double EPS = 1e-9;

    private static MathResult call(FunctionType fn, MathResult... args) {
        return MathOperations.function(fn, List.of(args));
    }

    @Test
    @Tag("unit")
    void realArithmeticStaysReal() {
        MathResult sum = MathOperations.binary(OperationType.ADD, MathResult.real(1.0), MathResult.real(1.2));
        MathResult quotient = MathOperations.binary(OperationType.DIV, MathResult.real(1.0), MathResult.real(8.0));

        assertThat(sum.isReal()).isTrue();
        assertThat(sum.getReal()).isCloseTo(2.2, within(EPS));
        assertThat(quotient.getReal()).isEqualTo(0.125);
    }

    @Test
    @Tag("unit")
    void divisionByZeroFollowsFloatingPoint() {
        assertThat(MathOperations.binary(OperationType.DIV, MathResult.real(1.0), MathResult.real(0.0)).getReal())
                .isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(MathOperations.binary(OperationType.DIV, MathResult.real(0.0), MathResult.real(0.0)).isNaN())
                .isTrue();
    }

    @Test
    @Tag("unit")
    void mixedArithmeticIsComplex() {
        MathResult result = MathOperations.binary(OperationType.SUB, MathResult.real(0.5), MathResult.complex(0.0, 1.8));

        assertThat(result.isComplex()).isTrue();
        assertThat(result.getReal()).isCloseTo(0.5, within(EPS));
        assertThat(result.getImaginary()).isCloseTo(-1.8, within(EPS));
    }

    @Test
    @Tag("unit")
    void unaryOperations() {
        assertThat(MathOperations.unary(OperationType.SUB, MathResult.real(2.44))).isEqualTo(MathResult.real(-2.44));
        assertThat(MathOperations.unary(OperationType.ADD, MathResult.complex(1.0, 2.0))).isEqualTo(MathResult.complex(1.0, 2.0));
        assertThat(MathOperations.unary(OperationType.SUB, MathResult.complex(1.0, 2.0))).isEqualTo(MathResult.complex(-1.0, -2.0));
        assertThat(MathOperations.unary(OperationType.MUL, MathResult.real(1.0)).isNaN()).isTrue();
    }

    /**
     * The remainder takes the sign of the dividend and is only defined for integer operands and a
     * non-zero divisor.
     */
    @Test
    @Tag("unit")
    void moduloOnIntegersOnly() {
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(7.0), MathResult.real(3.0))).isEqualTo(MathResult.real(1.0));
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(-7.0), MathResult.real(3.0))).isEqualTo(MathResult.real(-1.0));
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(7.5), MathResult.real(3.0)).isNaN()).isTrue();
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(7.0), MathResult.real(0.0)).isNaN()).isTrue();
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.complex(7.0, 1.0), MathResult.real(2.0)).isNaN()).isTrue();
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(1e20), MathResult.real(7.0)).getReal()).isCloseTo(2.0, within(EPS));
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(-1e19), MathResult.real(10.0)).getReal()).isCloseTo(0.0, within(EPS));
        assertThat(MathOperations.binary(OperationType.MOD, MathResult.real(-0x1p70), MathResult.real(3.0)).getReal()).isCloseTo(-1.0, within(EPS));
    }

    @Test
    @Tag("unit")
    void assignmentHasNoValue() {
        assertThat(MathOperations.binary(OperationType.ASSIGN, MathResult.real(1.0), MathResult.real(2.0)).isNaN()).isTrue();
    }

    @Test
    @Tag("unit")
    void promotesOutOfDomainArgumentsToComplex() {
        // Act
        MathResult sqrt = call(FunctionType.SQRT, MathResult.real(-1.0));
        MathResult ln = call(FunctionType.LN, MathResult.real(-1.0));
        MathResult acos = call(FunctionType.ARCCOS, MathResult.real(45.0));
        MathResult asin = call(FunctionType.ARCSIN, MathResult.real(45.0));

        // Assert
        assertThat(sqrt.isComplex()).isTrue();
        assertThat(sqrt.getReal()).isCloseTo(0.0, within(EPS));
        assertThat(sqrt.getImaginary()).isCloseTo(1.0, within(EPS));
        assertThat(ln.getReal()).isCloseTo(0.0, within(EPS));
        assertThat(ln.getImaginary()).isCloseTo(Math.PI, within(EPS));
        assertThat(acos.getReal()).isCloseTo(0.0, within(EPS));
        assertThat(acos.getImaginary()).isCloseTo(4.499686190, within(EPS));
        assertThat(asin.getReal()).isCloseTo(Math.PI / 2.0, within(EPS));
        assertThat(asin.getImaginary()).isCloseTo(-4.499686190, within(EPS));
    }

    @Test
    @Tag("unit")
    void inverseHyperbolicFunctionsOnRealDomain() {
        assertThat(call(FunctionType.ARCCOSH, MathResult.real(1.7897)).getReal()).isCloseTo(1.186000090, within(EPS));
        assertThat(call(FunctionType.ARCSINH, MathResult.real(0.5)).getReal()).isCloseTo(0.481211825, within(EPS));
        assertThat(call(FunctionType.ARCSINH, MathResult.real(-0.5)).getReal()).isCloseTo(-0.481211825, within(EPS));
        assertThat(call(FunctionType.ARCTANH, MathResult.real(-0.233)).getReal()).isCloseTo(-0.237359350, within(EPS));
        assertThat(call(FunctionType.ARCCOTH, MathResult.real(-1.7)).getReal()).isCloseTo(-0.674963358, within(EPS));
    }

    @Test
    @Tag("unit")
    void inverseHyperbolicFunctionsPromoteOutsideDomain() {
        MathResult acosh = call(FunctionType.ARCCOSH, MathResult.real(0.5));
        MathResult atanh = call(FunctionType.ARCTANH, MathResult.real(2.0));

        assertThat(acosh.isComplex()).isTrue();
        assertThat(acosh.getReal()).isCloseTo(0.0, within(EPS));
        assertThat(acosh.getImaginary()).isCloseTo(Math.acos(0.5), within(EPS));
        assertThat(atanh.isComplex()).isTrue();
        assertThat(atanh.getReal()).isCloseTo(0.5 * Math.log(3.0), within(EPS));
    }

    @Test
    @Tag("unit")
    void powerAndRoot() {
        assertThat(call(FunctionType.POW, MathResult.real(5.0), MathResult.real(2.0)).getReal()).isCloseTo(25.0, within(EPS));
        assertThat(call(FunctionType.ROOT, MathResult.real(25.0), MathResult.real(2.0)).getReal()).isCloseTo(5.0, within(EPS));

        MathResult complexPower = MathOperations.binary(OperationType.POW, MathResult.complex(0.0, 1.0), MathResult.real(2.0));
        assertThat(complexPower.isComplex()).isTrue();
        assertThat(complexPower.getReal()).isCloseTo(-1.0, within(EPS));
        assertThat(complexPower.getImaginary()).isCloseTo(0.0, within(EPS));
    }

    @Test
    @Tag("unit")
    void realAndImaginaryParts() {
        assertThat(call(FunctionType.RE, MathResult.complex(3.0, 4.0))).isEqualTo(MathResult.real(3.0));
        assertThat(call(FunctionType.IM, MathResult.complex(3.0, 4.0))).isEqualTo(MathResult.real(4.0));
        assertThat(call(FunctionType.IM, MathResult.real(3.0))).isEqualTo(MathResult.real(0.0));
    }

    @Test
    @Tag("unit")
    void wrongArgumentCountIsNaN() {
        assertThat(call(FunctionType.POW, MathResult.real(5.0)).isNaN()).isTrue();
        assertThat(call(FunctionType.SIN).isNaN()).isTrue();
    }
}
