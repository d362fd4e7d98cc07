package com.github.trinity.sourcefit;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * A scalar together with its gradient over the constrained parameters of one
 * or more sources.
 * <p>
 * Every term of the ELBO is built by composing these accumulations, so value
 * and gradient always travel together. The gradient is stored as
 * {@code [source][param]} using the {@link ParamLayout} order.
 * </p>
 *
 * @author Sean Phillips
 */
public class SensitiveFloat {

    private double value;
    private final int numParams;
    private final double[][] gradient;

    private SensitiveFloat(int numSources, int numParams) {
        this.numParams = numParams;
        this.gradient = new double[numSources][numParams];
    }

    /**
     * Zero value with a zero gradient for {@code numSources} sources.
     */
    public static SensitiveFloat zero(int numSources) {
        return new SensitiveFloat(numSources, ParamLayout.SIZE);
    }

    /**
     * Zero value scoped to a single source.
     */
    public static SensitiveFloat zero() {
        return zero(1);
    }

    public double value() {
        return value;
    }

    public int numSources() {
        return gradient.length;
    }

    public int numParams() {
        return numParams;
    }

    public double derivative(int source, int param) {
        return gradient[source][param];
    }

    /**
     * @return a copy of one source's gradient
     */
    public double[] gradient(int source) {
        return Arrays.copyOf(gradient[source], gradient[source].length);
    }

    // ----- Primitive accumulation -----

    public void addValue(double delta) {
        value += delta;
    }

    public void addDerivative(int source, int param, double delta) {
        gradient[source][param] += delta;
    }

    public void clear() {
        value = 0.0;
        for (double[] row : gradient) {
            Arrays.fill(row, 0.0);
        }
    }

    // ----- Composition -----

    public void add(SensitiveFloat other) {
        addScaled(other, 1.0);
    }

    public void addScaled(SensitiveFloat other, double factor) {
        checkShape(other);
        value += factor * other.value;
        for (int s = 0; s < gradient.length; s++) {
            add(gradient[s], other.gradient[s], factor);
        }
    }

    /**
     * Adds a single-source scalar, scaled, into the slot of {@code source}.
     */
    public void addToSource(SensitiveFloat local, int source, double factor) {
        value += factor * local.value;
        addGradient(local, source, factor);
    }

    /**
     * Chain-rule step: adds {@code factor} times the gradient of a single-source
     * scalar into the slot of {@code source}, leaving the value untouched. Used
     * when this scalar is a nonlinear function of {@code local} whose value is
     * accumulated separately and whose derivative with respect to
     * {@code local} is {@code factor}.
     */
    public void addGradient(SensitiveFloat local, int source, double factor) {
        if (local.gradient.length != 1) {
            throw new IllegalArgumentException("Expected a single-source scalar, got " + local.gradient.length);
        }
        if (local.numParams != numParams) {
            throw new DimensionMismatchException(local.numParams, numParams);
        }
        add(gradient[source], local.gradient[0], factor);
    }

    /**
     * Multiplies value and gradient by a constant.
     */
    public void scale(double factor) {
        value *= factor;
        for (double[] row : gradient) {
            for (int i = 0; i < row.length; i++) {
                row[i] *= factor;
            }
        }
    }

    public SensitiveFloat copy() {
        SensitiveFloat copy = new SensitiveFloat(gradient.length, numParams);
        copy.value = value;
        for (int s = 0; s < gradient.length; s++) {
            System.arraycopy(gradient[s], 0, copy.gradient[s], 0, gradient[s].length);
        }
        return copy;
    }

    private void checkShape(SensitiveFloat other) {
        if (other.gradient.length != gradient.length) {
            throw new DimensionMismatchException(other.gradient.length, gradient.length);
        }
    }

    private static void add(double[] a, double[] b, double factor) {
        for (int i = 0; i < a.length; i++) {
            a[i] += factor * b[i];
        }
    }

    @Override
    public String toString() {
        return "SensitiveFloat{value=" + value + ", sources=" + gradient.length + "}";
    }
}
