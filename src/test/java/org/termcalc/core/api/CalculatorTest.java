package org.termcalc.core.api;

import org.termcalc.core.context.MathContext;
import org.termcalc.core.result.MathResult;
import org.termcalc.core.result.NumberType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests of a single input line through parsing, analysis and evaluation.
 */
public class CalculatorTest {

    private static final double EPS = 1e-9;

    private ICalculator calculator;
    private MathContext context;

    @BeforeEach
    void setUp() {
        calculator = new Calculator();
        context = new MathContext();
    }

    private MathResult evaluate(String input) throws CalculationException {
        Optional<MathResult> result = calculator.evaluateInput(input, context);
        assertThat(result).as("result of '%s'", input).isPresent();
        return result.get();
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "55.78                                  | 55.78",
            ".09878                                 | 0.09878",
            "pi                                     | 3.141592653589793",
            "e                                      | 2.718281828459045",
            "-1                                     | -1",
            "+11.1                                  | 11.1",
            "+.111                                  | 0.111",
            "--+-e                                  | -2.718281828459045",
            "---+-2.44                              | 2.44",
            "(-(-(-(-999))))                        | 999",
            "1+1.2                                  | 2.2",
            "0-23.23                                | -23.23",
            "1.2*0.5                                | 0.6",
            "1.0/8.0                                | 0.125",
            "25^0.5                                 | 5",
            "24*74+9^1.55-88/3                      | 1776.801992365",
            "12*(1.0+2.7)                           | 44.4",
            "(25+3)/-7                              | -4",
            "cos(0.4)                               | 0.921060994",
            "sin(pi/2)                              | 1",
            "tan(0.45)                              | 0.483055065",
            "cot(7)                                 | 1.147515422",
            "acos(cos(pi))                          | 3.141592653589793",
            "asin(sin(pi/3))                        | 1.0471975511965976",
            "atan(tan(pi/7))                        | 0.4487989505128276",
            "acot(cot(pi/4))                        | 0.7853981633974483",
            "cosh(0.7897)                           | 1.328358237",
            "arccosh(1.7897)                        | 1.186000090",
            "sinh(pi+9/3)                           | 232.395542404",
            "arcsinh(0.5)                           | 0.481211825",
            "tanh(e)                                | 0.991328915",
            "arctanh(-0.233)                        | -0.237359350",
            "coth(0.887)                            | 1.408631623",
            "arccoth(-1.7)                          | -0.674963358",
            "exp(1)                                 | 2.718281828459045",
            "ln(e^87)                               | 87",
            "pow(5, 2)                              | 25",
            "root(25, 2)                            | 5",
            "cos(exp(0.5)+pi/2*ln(2))-root(1, 2)    | -1.919465158",
            "1+cos(pi)*8                            | -7",
            "exp(-1/8)+tan(1545.56464-pi*3)^sqrt(4) | 0.892351383",
            "(-1*-1+1*e^(5/7))/(cos(pi/7)*8+2)      | 0.3304527988",
            "5^-2                                   | 0.04",
            "6*--2                                  | 12",
            "+15.7^+--+-0.5                         | 0.2523772326",
            "tanh(.2)                               | 0.197375320",
            "tan(pi/3)                              | 1.732050807",
            "sin(0.7)                               | 0.644217687",
            "exp(ln(3))                             | 3",
            "pi - 9 / 2 ^- 0.7                      | -11.478950480",
            "17 % 5                                 | 2",
            "1E20 % 7                               | 2"
    })
    void evaluatesRealExpressions(String input, double expected) throws CalculationException {
        MathResult result = evaluate(input);

        assertThat(result.getType()).isEqualTo(NumberType.REAL);
        assertThat(result.getReal()).isCloseTo(expected, within(1e-8));
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "0.5 - 1.8i                               | 0.5         | -1.8",
            ".458+.97i                                | 0.458       | 0.97",
            "(-1*-1+1*e^(5/7))/(cos(pi/(7+2i))*8+2)   | 0.324096360 | -0.013251332",
            "sinh(3) - cos(pi/e) + .5i                | 9.614621876 | 0.5",
            "acos(45)                                 | 0           | 4.499686190",
            "asin(45)                                 | 1.5707963268 | -4.499686190",
            "sqrt(-1)                                 | 0           | 1",
            "ln(-1)                                   | 0           | 3.141592653589793",
            "i^2                                      | -1          | 0"
    })
    void evaluatesComplexExpressions(String input, double re, double im) throws CalculationException {
        MathResult result = evaluate(input);

        assertThat(result.getType()).isEqualTo(NumberType.COMPLEX);
        assertThat(result.getReal()).isCloseTo(re, within(1e-8));
        assertThat(result.getImaginary()).isCloseTo(im, within(1e-8));
    }

    @Test
    @Tag("unit")
    void definesConstant() throws CalculationException {
        // Act
        Optional<MathResult> result = calculator.evaluateInput("c = e + pi", context);

        // Assert
        assertThat(result).isEmpty();
        assertThat(context.getConstantValue("c")).hasValueSatisfying(
                c -> assertThat(c.getReal()).isCloseTo(Math.PI + Math.E, within(EPS)));
        assertThat(evaluate("c * 2").getReal()).isCloseTo(2 * (Math.PI + Math.E), within(EPS));
    }

    @Test
    @Tag("unit")
    void definesAndCallsFunction() throws CalculationException {
        // Act
        Optional<MathResult> result = calculator.evaluateInput("f(x, y) = x + y", context);

        // Assert
        assertThat(result).isEmpty();
        assertThat(context.isUserFunction("f")).isTrue();
        assertThat(context.getUserFunctions().get("f").definition()).isEqualTo("f(x, y) = x + y");
        assertThat(evaluate("f(3, 15.2)").getReal()).isCloseTo(18.2, within(EPS));
        assertThat(evaluate("f(3+5, arccos(0.7))").getReal()).isCloseTo(8.795398830, within(1e-8));
    }

    /**
     * A redefinition replaces the previous function, including its argument count.
     */
    @Test
    @Tag("unit")
    void redefinesFunction() throws CalculationException {
        // Arrange
        calculator.evaluateInput("f(x, y) = x + y", context);

        // Act
        calculator.evaluateInput("f(x) = x + 1", context);

        // Assert
        assertThat(context.isUserFunction("f")).isTrue();
        assertThat(evaluate("f(3)").getReal()).isCloseTo(4.0, within(EPS));
        assertThatThrownBy(() -> calculator.evaluateInput("f(3, 4)", context))
                .isInstanceOf(CalculationException.class)
                .hasMessageStartingWith("Error: Expected 1 argument(s).");
    }

    @Test
    @Tag("unit")
    void functionSeesCurrentConstantValues() throws CalculationException {
        calculator.evaluateInput("k = 2", context);
        calculator.evaluateInput("scale(x) = k * x", context);
        calculator.evaluateInput("k = 10", context);

        assertThat(evaluate("scale(3)").getReal()).isEqualTo(30.0);
    }

    @Test
    @Tag("unit")
    void storesLastResultAsAnswer() throws CalculationException {
        // Act
        MathResult result = evaluate("15-8.78");

        // Assert
        assertThat(result.getReal()).isCloseTo(6.22, within(EPS));
        assertThat(context.getConstantValue(Calculator.ANSWER_CONSTANT)).hasValueSatisfying(
                ans -> assertThat(ans.getReal()).isCloseTo(6.22, within(EPS)));
        assertThat(evaluate("ans * 2").getReal()).isCloseTo(12.44, within(EPS));
    }

    @Test
    @Tag("unit")
    void definitionsDoNotChangeAnswer() throws CalculationException {
        evaluate("3");
        calculator.evaluateInput("c = 7", context);

        assertThat(context.getConstantValue("ans")).contains(MathResult.real(3.0));
    }

    @Test
    @Tag("unit")
    void answerTrackingCanBeDisabled() throws CalculationException {
        ICalculator plain = new Calculator(false, 64);

        plain.evaluateInput("1 + 1", context);

        assertThat(context.isUserConstant(Calculator.ANSWER_CONSTANT)).isFalse();
    }

    @Test
    @Tag("unit")
    void repeatedEvaluationGivesSameResultAndKeepsDefinitions() throws CalculationException {
        // Arrange
        ICalculator plain = new Calculator(false, 64);
        plain.evaluateInput("f(x) = x^2", context);
        String bodyBefore = context.getUserFunctions().get("f").body().toString();
        Map<String, MathResult> constantsBefore = Map.copyOf(context.getUserConstants());

        // Act
        Optional<MathResult> first = plain.evaluateInput("f(3)", context);
        Optional<MathResult> second = plain.evaluateInput("f(3)", context);

        // Assert
        assertThat(first).contains(MathResult.real(9.0));
        assertThat(second).isEqualTo(first);
        assertThat(context.getUserFunctions()).containsOnlyKeys("f");
        assertThat(context.getUserFunctions().get("f").body().toString()).isEqualTo(bodyBefore);
        assertThat(context.getUserFunctions().get("f").parameters()).containsExactly("x");
        assertThat(context.getUserConstants()).isEqualTo(constantsBefore);
    }

    @Test
    @Tag("unit")
    void trimsInput() throws CalculationException {
        assertThat(evaluate("   1 + 2   ").getReal()).isEqualTo(3.0);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "2*(5-3              | Error: Expected symbol \")\".\\n2*(5-3\\n      ^~~~",
            "3-cis(pi/2)+sin(0)  | Error: Expected built-in or user defined function.\\n3-cis(pi/2)+sin(0)\\n    ^~~~ Found: unknown function \"cis(...)\"",
            "5*3+cos(py)-7^1     | Error: Expected built-in or user defined constant.\\n5*3+cos(py)-7^1\\n         ^~~~ Found: unknown constant \"py\"",
            "5+--*2.7            | Error: Expected unary operation.\\n5+--*2.7\\n    ^~~~ Found: non-unary operation \"*\"",
            "3-)                 | Error: Expected operand (number, constant, function call) or an unary operation.\\n3-)\\n  ^~~~ Found: unexpected symbol \")\"",
            "5+|                 | Error: Unknown token found: \"|\".\\n5+|\\n  ^~~~",
            "pow(5,              | Error: Expected symbol \")\".\\npow(5,\\n      ^~~~",
            "pow(5)              | Error: Expected 2 argument(s).\\npow(5)\\n  ^~~~ Found: 1 argument(s)",
            "pow(5,)             | Error: Expected an argument.\\npow(5,)\\n      ^~~~ Found: symbol \")\"",
            "pi = 5              | Error: Expected new constant name or function name.\\npi = 5\\n ^~~~ Found: built-in expression \"pi\"",
            "z(x) = z(x) + 2     | Error: Expected non-symbolic expression.\\nz(x) = z(x) + 2\\n       ^~~~ Found: symbolic expression \"z\"",
            "y(x) = z            | Error: Expected non-symbolic expression.\\ny(x) = z\\n       ^~~~ Found: symbolic expression \"z\"",
            "h(x, y, x) = x^2+y  | Error: Expected distinct arguments.\\nh(x, y, x) = x^2+y\\n^~~~ Found: function definition with partly equal arguments"
    })
    void reportsErrorsWithLocation(String input, String message) {
        assertThatThrownBy(() -> calculator.evaluateInput(input, context))
                .isInstanceOf(CalculationException.class)
                .hasMessage(message.replace("\\n", "\n"));
    }

    /**
     * A failed line leaves the context untouched.
     */
    @Test
    @Tag("unit")
    void failedDefinitionDoesNotChangeContext() {
        assertThatThrownBy(() -> calculator.evaluateInput("y(x) = z", context)).isInstanceOf(CalculationException.class);

        assertThat(context.getUserFunctions()).isEmpty();
        assertThat(context.getUserConstants()).isEmpty();
    }
}
