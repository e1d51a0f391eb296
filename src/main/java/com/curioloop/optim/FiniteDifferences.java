/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;

import java.util.function.ToDoubleFunction;

/**
 * Second-order finite differences.
 * <p>
 * Steps are {@code ε^(1/4)·max(|x_i|, 1)}, which balances truncation and
 * round-off error for second differences. First-order schemes live in
 * {@link NumericalGradient}.
 * </p>
 */
public final class FiniteDifferences {

    private FiniteDifferences() {}

    /**
     * Approximates the Hessian by central differences.
     * <p>
     * Diagonal entries use the three-point second difference, off-diagonal entries
     * the four-corner mixed difference. Only the upper triangle is computed and then
     * mirrored, so the result is exactly symmetric. Costs {@code 1 + 2n + 2n(n-1)}
     * evaluations.
     * </p>
     * @param func Objective function
     * @param x Point of evaluation (not modified)
     * @return Symmetric n×n matrix
     */
    public static double[][] hessian(ToDoubleFunction<double[]> func, double[] x) {
        int n = x.length;
        double[] work = x.clone();
        double fx = func.applyAsDouble(work);
        double[][] hess = new double[n][n];

        double[] h = new double[n];
        for (int i = 0; i < n; i++) {
            h[i] = NumericalGradient.FOURTH_ROOT_EPSILON * Math.max(Math.abs(x[i]), 1.0);
        }

        for (int i = 0; i < n; i++) {
            work[i] = x[i] + h[i];
            double fPlus = func.applyAsDouble(work);
            work[i] = x[i] - h[i];
            double fMinus = func.applyAsDouble(work);
            work[i] = x[i];
            hess[i][i] = (fPlus - 2.0 * fx + fMinus) / (h[i] * h[i]);
        }

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double fpp = corner(func, work, i, x[i] + h[i], j, x[j] + h[j]);
                double fpm = corner(func, work, i, x[i] + h[i], j, x[j] - h[j]);
                double fmp = corner(func, work, i, x[i] - h[i], j, x[j] + h[j]);
                double fmm = corner(func, work, i, x[i] - h[i], j, x[j] - h[j]);
                work[i] = x[i];
                work[j] = x[j];
                double value = (fpp - fpm - fmp + fmm) / (4.0 * h[i] * h[j]);
                hess[i][j] = value;
                hess[j][i] = value;
            }
        }
        return hess;
    }

    /**
     * Wraps a function-only objective into a Hessian function.
     * @param func Objective function
     * @return Hessian function backed by {@link #hessian}
     */
    public static HessianFunction hessianOf(ToDoubleFunction<double[]> func) {
        return x -> hessian(func, x);
    }

    /**
     * Approximates the Hessian-vector product from one extra gradient evaluation.
     * <p>
     * Hv ≈ (∇f(x + h·v) − ∇f(x)) / h with h = ε^(1/4)·max(‖v‖, 1).
     * </p>
     * @param gradient Gradient function
     * @param x Point of evaluation
     * @param v Direction
     * @param gx Gradient already known at {@code x}
     * @return Approximation of H(x)·v
     */
    public static double[] hessianVectorProduct(GradientFunction gradient, double[] x, double[] v, double[] gx) {
        double h = NumericalGradient.FOURTH_ROOT_EPSILON * Math.max(Vectors.norm(v), 1.0);
        double[] perturbed = gradient.gradient(Vectors.addScaled(x, v, h));
        double[] result = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            result[i] = (perturbed[i] - gx[i]) / h;
        }
        return result;
    }

    /**
     * Approximates the Jacobian of a vector function by forward differences.
     * @param constraints Vector function
     * @param x Point of evaluation (not modified)
     * @param cx Function value already known at {@code x}
     * @return m×n matrix, row i holding the gradient of component i
     */
    public static double[][] jacobian(ConstraintFunction constraints, double[] x, double[] cx) {
        int n = x.length;
        int m = cx.length;
        double[] work = x.clone();
        double[][] jac = new double[m][n];
        for (int j = 0; j < n; j++) {
            double h = NumericalGradient.SQRT_EPSILON * Math.max(Math.abs(x[j]), 1.0);
            work[j] = x[j] + h;
            double[] shifted = constraints.values(work);
            work[j] = x[j];
            for (int i = 0; i < m; i++) {
                jac[i][j] = (shifted[i] - cx[i]) / h;
            }
        }
        return jac;
    }

    private static double corner(ToDoubleFunction<double[]> func, double[] work,
                                 int i, double xi, int j, double xj) {
        work[i] = xi;
        work[j] = xj;
        return func.applyAsDouble(work);
    }
}
