package org.qcircuit.dd;

/**
 * An immutable complex number.
 *
 * @param re The real part.
 * @param im The imaginary part.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    /**
     * @param phase The angle in radians.
     * @return {@code e^(i*phase)}.
     */
    public static Complex expI(double phase) {
        return new Complex(Math.cos(phase), Math.sin(phase));
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex multiply(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex scale(double factor) {
        return new Complex(re * factor, im * factor);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    public boolean approximatelyEquals(Complex other, double tolerance) {
        return Math.abs(re - other.re) <= tolerance && Math.abs(im - other.im) <= tolerance;
    }
}
