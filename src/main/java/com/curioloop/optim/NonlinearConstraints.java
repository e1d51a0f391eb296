/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import java.util.Locale;

/**
 * General constraints {@code lower[i] <= c(x)[i] <= upper[i]}.
 * <p>
 * A row with {@code lower[i] == upper[i]} is an equality; an infinite side is
 * absent. Without an analytic Jacobian, forward differences of {@code c} are used.
 * </p>
 *
 * <pre>{@code
 * // x + y >= 3
 * NonlinearConstraints sum = NonlinearConstraints.of(
 *     x -> new double[]{x[0] + x[1]},
 *     x -> new double[][]{{1, 1}},
 *     new double[]{3}, new double[]{Double.POSITIVE_INFINITY});
 * }</pre>
 */
public final class NonlinearConstraints {

    private final ConstraintFunction function;
    private final JacobianFunction jacobian;
    private final double[] lower;
    private final double[] upper;

    private NonlinearConstraints(ConstraintFunction function, JacobianFunction jacobian,
                                 double[] lower, double[] upper) {
        this.function = function;
        this.jacobian = jacobian;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates a constraint block.
     * @param function Constraint rows
     * @param jacobian Analytic Jacobian, or {@code null} for forward differences
     * @param lower Row lower bounds
     * @param upper Row upper bounds
     * @return Constraint block
     * @throws IllegalArgumentException if the function or bounds are missing, differ
     *         in length or contain NaN
     */
    public static NonlinearConstraints of(ConstraintFunction function, JacobianFunction jacobian,
                                          double[] lower, double[] upper) {
        if (function == null) {
            throw new IllegalArgumentException("Constraint function cannot be null");
        }
        if (lower == null || upper == null || lower.length != upper.length) {
            throw new IllegalArgumentException("Constraint bounds must be non-null and of equal length");
        }
        for (int i = 0; i < lower.length; i++) {
            if (Double.isNaN(lower[i]) || Double.isNaN(upper[i])) {
                throw new IllegalArgumentException("Constraint bounds cannot be NaN");
            }
        }
        return new NonlinearConstraints(function, jacobian, lower.clone(), upper.clone());
    }

    /**
     * Creates equality constraints {@code c(x) = target}.
     * @param function Constraint rows
     * @param jacobian Analytic Jacobian, or {@code null}
     * @param target Right-hand side
     * @return Constraint block
     */
    public static NonlinearConstraints equalTo(ConstraintFunction function, JacobianFunction jacobian,
                                               double[] target) {
        return of(function, jacobian, target, target);
    }

    public double[] values(double[] x) {
        return function.values(x);
    }

    /**
     * Evaluates the Jacobian.
     * @param x Point
     * @param cx Constraint values at {@code x}, used by the finite-difference fallback
     * @return m×n Jacobian
     */
    public double[][] jacobian(double[] x, double[] cx) {
        return jacobian != null ? jacobian.jacobian(x) : FiniteDifferences.jacobian(function, x, cx);
    }

    /**
     * Checks constraint values and Jacobian evaluated at {@code x} against the declared bounds.
     * @param x Point
     * @param cx Constraint values at {@code x}
     * @param jc Jacobian at {@code x}
     * @return Description of the mismatch, or {@code null} when the shapes agree
     */
    public String checkShape(double[] x, double[] cx, double[][] jc) {
        int m = size();
        if (cx == null || cx.length != m) {
            return String.format(Locale.ROOT, "constraint function returned %d values, expected %d",
                    cx == null ? 0 : cx.length, m);
        }
        if (jc == null || jc.length != m) {
            return String.format(Locale.ROOT, "constraint Jacobian has %d rows, expected %d",
                    jc == null ? 0 : jc.length, m);
        }
        for (double[] row : jc) {
            if (row == null || row.length != x.length) {
                return String.format(Locale.ROOT, "constraint Jacobian row length does not match dimension %d",
                        x.length);
            }
        }
        return null;
    }

    public int size() {
        return lower.length;
    }

    public double getLower(int row) {
        return lower[row];
    }

    public double getUpper(int row) {
        return upper[row];
    }
}
