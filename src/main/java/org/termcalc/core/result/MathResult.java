package org.termcalc.core.result;

import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * The result of a mathematical expression: a real or a complex number.
 * <p>
 * The value is always stored as a {@link Complex}. A result tagged {@link NumberType#REAL}
 * carries a zero imaginary part; the constructor enforces this.
 */
public final class MathResult {

    private static final MathResult NAN = new MathResult(NumberType.REAL, new Complex(Double.NaN, 0.0));

    private final NumberType type;
    private final Complex value;

    /**
     * Creates a new result.
     * @param type The number type of the result.
     * @param value The value. For {@link NumberType#REAL} the imaginary part is discarded.
     */
    public MathResult(NumberType type, Complex value) {
        this.type = Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        this.value = type == NumberType.REAL && value.getImaginary() != 0.0
                ? new Complex(value.getReal(), 0.0)
                : value;
    }

    /**
     * @param re The real value.
     * @return A real result.
     */
    public static MathResult real(double re) {
        return new MathResult(NumberType.REAL, new Complex(re, 0.0));
    }

    /**
     * @param re The real part.
     * @param im The imaginary part.
     * @return A complex result (tagged complex even if {@code im} is zero).
     */
    public static MathResult complex(double re, double im) {
        return new MathResult(NumberType.COMPLEX, new Complex(re, im));
    }

    /**
     * @param value The complex value.
     * @return A complex result.
     */
    public static MathResult of(Complex value) {
        return new MathResult(NumberType.COMPLEX, value);
    }

    /**
     * The undefined outcome of an evaluation.
     * @return A real result whose value is NaN.
     */
    public static MathResult nan() {
        return NAN;
    }

    public NumberType getType() {
        return type;
    }

    public Complex getValue() {
        return value;
    }

    public double getReal() {
        return value.getReal();
    }

    public double getImaginary() {
        return value.getImaginary();
    }

    public boolean isReal() {
        return type == NumberType.REAL;
    }

    public boolean isComplex() {
        return type == NumberType.COMPLEX;
    }

    /**
     * @return {@code true} if either part of the value is NaN.
     */
    public boolean isNaN() {
        return Double.isNaN(value.getReal()) || Double.isNaN(value.getImaginary());
    }

    /**
     * @return {@code true} if the value is not NaN and either part is infinite.
     */
    public boolean isInfinite() {
        return !isNaN() && (Double.isInfinite(value.getReal()) || Double.isInfinite(value.getImaginary()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MathResult other)) return false;
        return type == other.type
                && Double.compare(value.getReal(), other.value.getReal()) == 0
                && Double.compare(value.getImaginary(), other.value.getImaginary()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value.getReal(), value.getImaginary());
    }

    @Override
    public String toString() {
        if (type == NumberType.REAL) {
            return String.valueOf(value.getReal());
        }
        double im = value.getImaginary();
        return value.getReal() + (im < 0 || Double.compare(im, -0.0) == 0 ? "-" : "+") + Math.abs(im) + "i";
    }
}
