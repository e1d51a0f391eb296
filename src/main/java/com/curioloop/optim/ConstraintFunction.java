/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Functional interface for vector-valued constraint functions.
 * <p>
 * Used by {@link IpNewtonOptimizer} together with the row bounds of
 * {@link NonlinearConstraints}: each row i is constrained to
 * {@code lower[i] <= c(x)[i] <= upper[i]}.
 * </p>
 */
@FunctionalInterface
public interface ConstraintFunction {

    /**
     * Evaluates all constraint rows.
     * @param x Current point (read-only)
     * @return Constraint values, one per row
     */
    double[] values(double[] x);
}
