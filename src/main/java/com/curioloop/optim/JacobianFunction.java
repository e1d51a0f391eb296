/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Functional interface for the Jacobian of a {@link ConstraintFunction}.
 */
@FunctionalInterface
public interface JacobianFunction {

    /**
     * Evaluates the Jacobian.
     * @param x Current point (read-only)
     * @return m×n matrix whose row i is the gradient of constraint row i
     */
    double[][] jacobian(double[] x);
}
