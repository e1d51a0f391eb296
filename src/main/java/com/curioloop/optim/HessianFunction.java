/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Functional interface for analytic Hessians.
 *
 * @see FiniteDifferences#hessian(java.util.function.ToDoubleFunction, double[])
 */
@FunctionalInterface
public interface HessianFunction {

    /**
     * Computes the Hessian matrix.
     * @param x Current point (read-only)
     * @return Symmetric n×n matrix, row-major
     */
    double[][] hessian(double[] x);
}
