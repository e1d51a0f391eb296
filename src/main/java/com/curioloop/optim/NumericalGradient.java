/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import java.util.function.ToDoubleFunction;

/**
 * Numerical gradient computation methods.
 * <p>
 * Provides forward and central difference approximations used whenever a
 * solver is not given an analytic gradient. The step for coordinate i is
 * scaled by {@code max(|x_i|, 1)} so that it stays meaningful for large
 * coordinates.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Forward difference: n + 1 evaluations, O(h) accuracy
 * GradientFunction fast = NumericalGradient.FORWARD.gradientOf(x -> x[0]*x[0] + x[1]*x[1]);
 *
 * // Central difference: 2n evaluations, O(h²) accuracy
 * GradientFunction accurate = NumericalGradient.CENTRAL.gradientOf(x -> x[0]*x[0] + x[1]*x[1]);
 * }</pre>
 *
 * @see GradientFunction
 */
public enum NumericalGradient {

    /**
     * Forward difference method.
     * <p>
     * g[i] ≈ (f(x + h*e_i) - f(x)) / h with h = √ε·max(|x_i|, 1)
     * </p>
     * One shared evaluation of f(x) plus one per coordinate.
     */
    FORWARD {
        @Override
        public double[] gradient(ToDoubleFunction<double[]> func, double[] x) {
            int n = x.length;
            double[] work = x.clone();
            double f0 = func.applyAsDouble(work);
            double[] g = new double[n];

            for (int i = 0; i < n; i++) {
                double xi = x[i];
                double h = SQRT_EPSILON * Math.max(1.0, Math.abs(xi));

                // Ensure h is representable
                double temp = xi + h;
                h = temp - xi;

                work[i] = temp;
                double f1 = func.applyAsDouble(work);
                work[i] = xi;

                g[i] = (f1 - f0) / h;
            }
            return g;
        }
    },

    /**
     * Central difference method.
     * <p>
     * g[i] ≈ (f(x + h*e_i) - f(x - h*e_i)) / (2*h) with h = ε^(1/3)·max(|x_i|, 1)
     * </p>
     * More accurate but slower than forward difference; f(x) itself is never evaluated.
     */
    CENTRAL {
        @Override
        public double[] gradient(ToDoubleFunction<double[]> func, double[] x) {
            int n = x.length;
            double[] work = x.clone();
            double[] g = new double[n];

            for (int i = 0; i < n; i++) {
                double xi = x[i];
                double h = CBRT_EPSILON * Math.max(1.0, Math.abs(xi));

                work[i] = xi + h;
                double f1 = func.applyAsDouble(work);

                work[i] = xi - h;
                double f2 = func.applyAsDouble(work);

                work[i] = xi;

                g[i] = (f1 - f2) / (2.0 * h);
            }
            return g;
        }
    };

    /** Machine epsilon */
    static final double EPSILON = Math.ulp(1.0);

    /** Default step size for forward difference */
    static final double SQRT_EPSILON = Math.sqrt(EPSILON);

    /** Default step size for central difference */
    static final double CBRT_EPSILON = Math.cbrt(EPSILON);

    /** Default step size for second differences */
    static final double FOURTH_ROOT_EPSILON = Math.pow(EPSILON, 0.25);

    /**
     * Approximates the gradient of {@code func} at {@code x}.
     * @param func Objective function
     * @param x Point of evaluation (not modified)
     * @return Approximate gradient
     */
    public abstract double[] gradient(ToDoubleFunction<double[]> func, double[] x);

    /**
     * Wraps a function-only objective into a gradient function.
     * @param func Function that computes only the objective value
     * @return Gradient function backed by this difference scheme
     */
    public GradientFunction gradientOf(ToDoubleFunction<double[]> func) {
        return x -> gradient(func, x);
    }
}
