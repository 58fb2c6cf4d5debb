package com.libragraph.provenance.types;

/**
 * A complex number with double-precision components.
 *
 * <p>Java has no built-in complex type; callers that carry complex values
 * (e.g. k-point weights, phase factors) wrap them in this record so the
 * hasher can recognise them.
 */
public record ComplexNumber(double real, double imaginary) {

    public static ComplexNumber of(double real, double imaginary) {
        return new ComplexNumber(real, imaginary);
    }

    @Override
    public String toString() {
        return "(" + real + (imaginary < 0 ? "" : "+") + imaginary + "j)";
    }
}
