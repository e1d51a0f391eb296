/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linalg;

/**
 * Cholesky factorization {@code A = L·Lᵀ} of a symmetric positive definite matrix.
 * <p>
 * Factorization failure is reported by a {@code null} return rather than an
 * exception, because the Newton-type solvers treat an indefinite matrix as an
 * ordinary event and react by regularizing.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Cholesky chol = Cholesky.decompose(hessian);
 * if (chol != null) {
 *     double[] d = chol.solve(Vectors.negate(gradient));
 * }
 * }</pre>
 */
public final class Cholesky {

    private final double[][] lower;

    private Cholesky(double[][] lower) {
        this.lower = lower;
    }

    /**
     * Factorizes a symmetric matrix. Only the lower triangle is read.
     * @param a Square matrix
     * @return Factorization, or {@code null} if {@code a} is not numerically positive definite
     */
    public static Cholesky decompose(double[][] a) {
        int n = a.length;
        double[][] l = new double[n][n];
        for (int j = 0; j < n; j++) {
            double diag = a[j][j];
            for (int k = 0; k < j; k++) {
                diag -= l[j][k] * l[j][k];
            }
            if (!(diag > 0.0) || !Double.isFinite(diag)) {
                return null;
            }
            double ljj = Math.sqrt(diag);
            l[j][j] = ljj;
            for (int i = j + 1; i < n; i++) {
                double sum = a[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= l[i][k] * l[j][k];
                }
                l[i][j] = sum / ljj;
            }
        }
        return new Cholesky(l);
    }

    /**
     * Solves {@code A·x = b} using the stored factor.
     * @param b Right-hand side
     * @return Solution vector
     */
    public double[] solve(double[] b) {
        int n = b.length;
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = b[i];
            for (int k = 0; k < i; k++) {
                sum -= lower[i][k] * y[k];
            }
            y[i] = sum / lower[i][i];
        }
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = y[i];
            for (int k = i + 1; k < n; k++) {
                sum -= lower[k][i] * x[k];
            }
            x[i] = sum / lower[i][i];
        }
        return x;
    }

    /**
     * Solves {@code A·x = b}, falling back to {@code (A + τI)·x = b} when
     * {@code A} is not positive definite.
     * <p>
     * The unshifted system is tried first; then τ starts at {@code initialTau} and is
     * multiplied by {@code tauFactor} after every failed attempt.
     * </p>
     * @param a Symmetric matrix
     * @param b Right-hand side
     * @param initialTau First diagonal shift
     * @param tauFactor Growth factor of the shift
     * @param maxAttempts Number of shifted attempts
     * @return Solution, or {@code null} when every attempt failed
     */
    public static double[] solveRegularized(double[][] a, double[] b,
                                            double initialTau, double tauFactor, int maxAttempts) {
        Cholesky chol = decompose(a);
        if (chol != null) {
            return chol.solve(b);
        }
        double tau = initialTau;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            chol = decompose(Matrices.shiftDiagonal(a, tau));
            if (chol != null) {
                return chol.solve(b);
            }
            tau *= tauFactor;
        }
        return null;
    }
}
