/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * An objective function bundled with the derivatives a solver will use.
 * <p>
 * Missing derivatives are resolved once, at construction: a missing gradient is
 * replaced by a {@link NumericalGradient} scheme and a missing Hessian by
 * {@link FiniteDifferences#hessian}. Solvers therefore never branch on
 * whether the caller supplied derivatives.
 * </p>
 *
 * <pre>{@code
 * Objective analytic = Objective.of(f, grad);
 * Objective numeric  = Objective.of(f, null, null, NumericalGradient.CENTRAL);
 * }</pre>
 */
public final class Objective {

    private final ToDoubleFunction<double[]> function;
    private final GradientFunction gradient;
    private final HessianFunction hessian;
    private final boolean analyticGradient;

    private Objective(ToDoubleFunction<double[]> function, GradientFunction gradient,
                      HessianFunction hessian, boolean analyticGradient) {
        this.function = function;
        this.gradient = gradient;
        this.hessian = hessian;
        this.analyticGradient = analyticGradient;
    }

    /**
     * Creates an objective, substituting finite differences for missing derivatives.
     * @param function Objective function
     * @param gradient Analytic gradient, or {@code null}
     * @param hessian Analytic Hessian, or {@code null}
     * @param numericalGradient Scheme used when {@code gradient} is null
     * @return Objective
     */
    public static Objective of(ToDoubleFunction<double[]> function, GradientFunction gradient,
                               HessianFunction hessian, NumericalGradient numericalGradient) {
        if (function == null) {
            throw new IllegalArgumentException("Objective function cannot be null");
        }
        NumericalGradient scheme = numericalGradient != null ? numericalGradient : NumericalGradient.FORWARD;
        GradientFunction g = gradient != null ? gradient : scheme.gradientOf(function);
        HessianFunction h = hessian != null ? hessian : FiniteDifferences.hessianOf(function);
        return new Objective(function, g, h, gradient != null);
    }

    /**
     * Creates an objective with forward-difference fallback for the gradient.
     * @param function Objective function
     * @param gradient Analytic gradient, or {@code null}
     * @return Objective
     */
    public static Objective of(ToDoubleFunction<double[]> function, GradientFunction gradient) {
        return of(function, gradient, null, NumericalGradient.FORWARD);
    }

    public double value(double[] x) {
        return function.applyAsDouble(x);
    }

    public double[] gradient(double[] x) {
        return gradient.gradient(x);
    }

    public double[][] hessian(double[] x) {
        return hessian.hessian(x);
    }

    /**
     * Approximates H(x)·v from one gradient evaluation.
     * @param x Point
     * @param v Direction
     * @param gx Gradient at {@code x}
     * @return Hessian-vector product
     */
    public double[] hessianVector(double[] x, double[] v, double[] gx) {
        return FiniteDifferences.hessianVectorProduct(gradient, x, v, gx);
    }

    /**
     * Checks that a gradient evaluated at {@code x} has one entry per coordinate.
     * @param x Point
     * @param gx Gradient returned at {@code x}
     * @return Description of the mismatch, or {@code null} when the lengths agree
     */
    public static String checkGradient(double[] x, double[] gx) {
        if (gx == null) {
            return "gradient function returned null";
        }
        if (gx.length != x.length) {
            return String.format(Locale.ROOT, "gradient length %d does not match dimension %d", gx.length, x.length);
        }
        return null;
    }

    public ToDoubleFunction<double[]> getFunction() {
        return function;
    }

    public GradientFunction getGradientFunction() {
        return gradient;
    }

    /**
     * Checks whether the gradient was supplied by the caller.
     * @return false when finite differences are in use
     */
    public boolean hasAnalyticGradient() {
        return analyticGradient;
    }
}
