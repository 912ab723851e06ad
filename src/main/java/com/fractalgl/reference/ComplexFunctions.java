package com.fractalgl.reference;

import com.fractalgl.ast.ComplexFunction;
import com.fractalgl.glsl.ComplexRuntime;

/**
 * Double-precision counterparts of the GLSL runtime routines, formula for formula,
 * including the zero-base cases of {@link #pow} and the snapping in {@link #gamma}.
 */
public final class ComplexFunctions {
    private static final double GAMMA_EPSILON = 1e-7;
    private static final double[] LANCZOS = ComplexRuntime.lanczosCoefficients()
            .collectDouble(Double::parseDouble)
            .toArray();

    private ComplexFunctions() {
    }

    public static Complex apply(ComplexFunction function, Complex z) {
        return switch (function) {
            case NEG -> z.negate();
            case ABS -> abs(z);
            case ARG -> arg(z);
            case LN -> ln(z);
            case EXP -> exp(z);
            case SQRT -> sqrt(z);
            case FLOOR -> new Complex(Math.floor(z.re()), Math.floor(z.im()));
            case ROUND -> new Complex(Math.floor(z.re() + 0.5), Math.floor(z.im() + 0.5));
            case CEIL -> new Complex(Math.ceil(z.re()), Math.ceil(z.im()));
            case RE -> Complex.real(z.re());
            case IM -> Complex.real(z.im());
            case SIN -> sin(z);
            case COS -> cos(z);
            case TAN -> sin(z).divide(cos(z));
            case COT -> cos(z).divide(sin(z));
            case SEC -> Complex.ONE.divide(cos(z));
            case CSC -> Complex.ONE.divide(sin(z));
            case SINH -> sinh(z);
            case COSH -> cosh(z);
            case TANH -> sinh(z).divide(cosh(z));
            case COTH -> cosh(z).divide(sinh(z));
            case SECH -> Complex.ONE.divide(cosh(z));
            case CSCH -> Complex.ONE.divide(sinh(z));
            case ARCSIN -> arcsin(z);
            case ARCCOS -> arccos(z);
            case ARCTAN -> arctan(z);
            case ARCCOT -> arccot(z);
            case ARCSEC -> arccos(Complex.ONE.divide(z));
            case ARCCSC -> arcsin(Complex.ONE.divide(z));
            case GAMMA -> gamma(z);
        };
    }

    /** Principal branch; 0^0 is NaN, 0^w with Re w &lt; 0 is infinite, otherwise 0^w is 0. */
    public static Complex pow(Complex base, Complex exponent) {
        if (base.isZero()) {
            if (exponent.re() == 0.0) {
                return new Complex(Double.NaN, Double.NaN);
            }
            if (exponent.re() < 0.0) {
                return new Complex(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
            }
            return Complex.ZERO;
        }
        return exp(exponent.multiply(ln(base)));
    }

    public static Complex powReal(Complex z, double n) {
        double angle = n * z.arg();
        return new Complex(Math.cos(angle), Math.sin(angle)).scale(Math.pow(z.abs(), n));
    }

    public static Complex ln(Complex z) {
        return new Complex(Math.log(z.abs()), z.arg());
    }

    public static Complex exp(Complex z) {
        return new Complex(Math.cos(z.im()), Math.sin(z.im())).scale(Math.exp(z.re()));
    }

    public static Complex sqrt(Complex z) {
        double angle = 0.5 * z.arg();
        return new Complex(Math.cos(angle), Math.sin(angle)).scale(Math.pow(z.squaredMagnitude(), 0.25));
    }

    public static Complex abs(Complex z) {
        return Complex.real(z.abs());
    }

    public static Complex arg(Complex z) {
        return Complex.real(z.arg());
    }

    public static Complex sin(Complex z) {
        return new Complex(Math.sin(z.re()) * Math.cosh(z.im()), Math.cos(z.re()) * Math.sinh(z.im()));
    }

    public static Complex cos(Complex z) {
        return new Complex(Math.cos(z.re()) * Math.cosh(z.im()), -Math.sin(z.re()) * Math.sinh(z.im()));
    }

    public static Complex sinh(Complex z) {
        return new Complex(Math.sinh(z.re()) * Math.cos(z.im()), Math.cosh(z.re()) * Math.sin(z.im()));
    }

    public static Complex cosh(Complex z) {
        return new Complex(Math.cosh(z.re()) * Math.cos(z.im()), Math.sinh(z.re()) * Math.sin(z.im()));
    }

    public static Complex arcsin(Complex z) {
        return Complex.ONE.divide(Complex.I).multiply(ln(z.multiply(Complex.I).add(sqrtOneMinusSquare(z))));
    }

    public static Complex arccos(Complex z) {
        return Complex.ONE.divide(Complex.I).multiply(ln(z.add(Complex.I.multiply(sqrtOneMinusSquare(z)))));
    }

    public static Complex arctan(Complex z) {
        Complex twoI = new Complex(0.0, 2.0);
        return Complex.ONE.divide(twoI).multiply(ln(Complex.I.subtract(z).divide(Complex.I.add(z))));
    }

    public static Complex arccot(Complex z) {
        Complex twoI = new Complex(0.0, 2.0);
        return Complex.ONE.divide(twoI).multiply(ln(z.add(Complex.I).divide(z.subtract(Complex.I))));
    }

    // sqrt(1 - z^2) from its modulus and half its argument, as carcsin builds it
    private static Complex sqrtOneMinusSquare(Complex z) {
        Complex w = Complex.ONE.subtract(z.square());
        return powReal(abs(w), 0.5).multiply(exp(new Complex(0.0, 0.5).multiply(arg(w))));
    }

    public static Complex gamma(Complex z) {
        if (z.re() < 0.5) {
            return Complex.real(Math.PI).divide(sin(z.scale(Math.PI)).multiply(lanczos(Complex.ONE.subtract(z))));
        }
        return lanczos(z);
    }

    private static Complex lanczos(Complex z) {
        Complex shifted = z.subtract(Complex.ONE);
        Complex x = Complex.real(LANCZOS[0]);
        for (int i = 1; i < LANCZOS.length; i++) {
            x = x.add(Complex.real(LANCZOS[i]).divide(shifted.add(Complex.real(i))));
        }
        Complex t = shifted.add(Complex.real(7.5));
        Complex y = pow(t, shifted.add(Complex.real(0.5)))
                .multiply(exp(t.negate()))
                .multiply(x)
                .scale(Math.sqrt(2.0 * Math.PI));
        if (Math.abs(y.im()) <= GAMMA_EPSILON) {
            y = Complex.real(y.re());
        }
        return y;
    }
}
