/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Functional interface for analytic gradients.
 * <p>
 * Solvers that accept a gradient fall back to {@link NumericalGradient} when none is given:
 * </p>
 * <pre>{@code
 * GradientFunction grad = x -> new double[]{2 * x[0], 2 * x[1]};
 * GradientFunction approx = NumericalGradient.CENTRAL.gradientOf(x -> x[0]*x[0] + x[1]*x[1]);
 * }</pre>
 */
@FunctionalInterface
public interface GradientFunction {

    /**
     * Computes the gradient.
     * @param x Current point (read-only)
     * @return Freshly allocated gradient of length {@code x.length}
     */
    double[] gradient(double[] x);
}
