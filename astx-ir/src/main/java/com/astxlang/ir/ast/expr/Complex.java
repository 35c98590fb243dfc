package com.astxlang.ir.ast.expr;

/**
 * 复数字面量的值
 */
public final class Complex {
    private final double real;
    private final double imaginary;

    public Complex(double real, double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    public double getReal() {
        return real;
    }

    public double getImaginary() {
        return imaginary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Complex)) return false;
        Complex other = (Complex) o;
        return Double.compare(real, other.real) == 0 && Double.compare(imaginary, other.imaginary) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imaginary);
    }

    @Override
    public String toString() {
        return "(" + real + (imaginary < 0 ? "" : "+") + imaginary + "j)";
    }
}
