/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linalg;

/**
 * Pure arithmetic on dense real vectors.
 * <p>
 * Every operation allocates its result and leaves its arguments untouched,
 * so callers may freely alias inputs.
 * </p>
 */
public final class Vectors {

    private Vectors() {}

    /**
     * Computes the inner product of two vectors.
     * @param a First vector
     * @param b Second vector (same length as {@code a})
     * @return a·b
     */
    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    /**
     * Computes the Euclidean norm.
     * @param a Vector
     * @return ‖a‖₂
     */
    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /**
     * Computes the infinity norm.
     * @param a Vector
     * @return max |a_i|, 0 for an empty vector, NaN if any entry is NaN
     */
    public static double normInf(double[] a) {
        double max = 0.0;
        for (double v : a) {
            if (Double.isNaN(v)) {
                return Double.NaN;
            }
            double abs = Math.abs(v);
            if (abs > max) {
                max = abs;
            }
        }
        return max;
    }

    /**
     * Computes the L1 norm.
     * @param a Vector
     * @return Σ |a_i|
     */
    public static double norm1(double[] a) {
        double sum = 0.0;
        for (double v : a) {
            sum += Math.abs(v);
        }
        return sum;
    }

    /**
     * Multiplies a vector by a scalar.
     * @param a Vector
     * @param s Scalar
     * @return s·a
     */
    public static double[] scale(double[] a, double s) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = a[i] * s;
        }
        return r;
    }

    public static double[] add(double[] a, double[] b) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = a[i] + b[i];
        }
        return r;
    }

    public static double[] subtract(double[] a, double[] b) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = a[i] - b[i];
        }
        return r;
    }

    public static double[] negate(double[] a) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = -a[i];
        }
        return r;
    }

    /**
     * Computes {@code a + s·b} without an intermediate vector.
     * @param a Base vector
     * @param b Direction
     * @param s Scale applied to {@code b}
     * @return a + s·b
     */
    public static double[] addScaled(double[] a, double[] b, double s) {
        double[] r = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            r[i] = a[i] + s * b[i];
        }
        return r;
    }

    public static double[] copy(double[] a) {
        return a.clone();
    }

    public static double[] zeros(int n) {
        return new double[n];
    }

    /**
     * Checks that every component is finite.
     * @param a Vector
     * @return true if no component is NaN or infinite
     */
    public static boolean isFinite(double[] a) {
        for (double v : a) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
