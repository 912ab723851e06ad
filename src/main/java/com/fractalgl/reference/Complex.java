package com.fractalgl.reference;

/**
 * A complex number with double components. Arithmetic follows the {@code vec2} routines of
 * the GLSL runtime term by term, so results agree with the GPU up to float precision.
 */
public record Complex(double re, double im) {
    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public static Complex real(double value) {
        return new Complex(value, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex subtract(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex multiply(Complex other) {
        return new Complex(re * other.re - im * other.im, im * other.re + re * other.im);
    }

    public Complex divide(Complex other) {
        double denominator = other.re * other.re + other.im * other.im;
        return new Complex((re * other.re + im * other.im) / denominator,
                (-re * other.im + im * other.re) / denominator);
    }

    public Complex scale(double factor) {
        return new Complex(re * factor, im * factor);
    }

    public Complex negate() {
        return new Complex(-re, -im);
    }

    public Complex square() {
        return new Complex(re * re - im * im, 2.0 * re * im);
    }

    public double squaredMagnitude() {
        return re * re + im * im;
    }

    public double abs() {
        return Math.sqrt(squaredMagnitude());
    }

    public double arg() {
        return Math.atan2(im, re);
    }

    public boolean isZero() {
        return re == 0.0 && im == 0.0;
    }

    public boolean isNaN() {
        return Double.isNaN(re) || Double.isNaN(im);
    }

    @Override
    public String toString() {
        return im < 0 || (im == 0 && 1 / im < 0)
                ? re + " - " + (-im) + "i"
                : re + " + " + im + "i";
    }
}
