/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linalg;

/**
 * Dense row-major matrix helpers used by the Newton-type solvers.
 */
public final class Matrices {

    private Matrices() {}

    /**
     * Creates an identity matrix.
     * @param n Dimension
     * @return n×n identity
     */
    public static double[][] identity(int n) {
        double[][] m = new double[n][n];
        for (int i = 0; i < n; i++) {
            m[i][i] = 1.0;
        }
        return m;
    }

    /**
     * Computes the matrix-vector product.
     * @param m Matrix with {@code v.length} columns
     * @param v Vector
     * @return m·v
     */
    public static double[] multiply(double[][] m, double[] v) {
        double[] r = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            double sum = 0.0;
            double[] row = m[i];
            for (int j = 0; j < v.length; j++) {
                sum += row[j] * v[j];
            }
            r[i] = sum;
        }
        return r;
    }

    /**
     * Computes the transposed matrix-vector product.
     * @param m Matrix with {@code v.length} rows
     * @param v Vector
     * @return mᵀ·v
     */
    public static double[] multiplyTransposed(double[][] m, double[] v) {
        int cols = m.length == 0 ? 0 : m[0].length;
        double[] r = new double[cols];
        for (int i = 0; i < m.length; i++) {
            double vi = v[i];
            if (vi == 0.0) {
                continue;
            }
            double[] row = m[i];
            for (int j = 0; j < cols; j++) {
                r[j] += row[j] * vi;
            }
        }
        return r;
    }

    /**
     * Evaluates the quadratic form.
     * @param m Square matrix
     * @param v Vector
     * @return vᵀ·m·v
     */
    public static double quadraticForm(double[][] m, double[] v) {
        return Vectors.dot(v, multiply(m, v));
    }

    /**
     * Deep-copies a matrix.
     * @param m Matrix
     * @return Independent copy
     */
    public static double[][] copy(double[][] m) {
        double[][] r = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            r[i] = m[i].clone();
        }
        return r;
    }

    /**
     * Returns {@code m + shift·I} as a new matrix.
     * @param m Square matrix
     * @param shift Diagonal shift
     * @return Shifted copy
     */
    public static double[][] shiftDiagonal(double[][] m, double shift) {
        double[][] r = copy(m);
        for (int i = 0; i < r.length; i++) {
            r[i][i] += shift;
        }
        return r;
    }

    /**
     * Checks that every entry is finite.
     * @param m Matrix
     * @return true if no entry is NaN or infinite
     */
    public static boolean isFinite(double[][] m) {
        for (double[] row : m) {
            if (!Vectors.isFinite(row)) {
                return false;
            }
        }
        return true;
    }
}
