/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.DoubleUnaryOperator;

/**
 * Brent's method for bounded minimization of a function of one variable.
 * <p>
 * Keeps three points: x (best so far), w (second best) and v (previous w).
 * A parabola through them proposes the next point; the proposal is used only
 * when it falls strictly inside the bracket and is less than half the step
 * before last, otherwise a golden-section step is taken. The run stops when
 * x is within {@code 2·tol1} of the bracket midpoint, where
 * {@code tol1 = tolerance·|x| + 1e-10}.
 * </p>
 *
 * <pre>{@code
 * UnivariateResult r = BrentOptimizer.minimize(x -> (x - 2) * (x - 2), 0, 5);
 * }</pre>
 */
public final class BrentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BrentOptimizer.class);

    /** (3 − √5) / 2 */
    static final double GOLDEN = 0.5 * (3.0 - Math.sqrt(5.0));

    private static final double ABSOLUTE_TOLERANCE = 1e-10;

    private final DoubleUnaryOperator objective;
    private final double tolerance;
    private final int maxIterations;

    private BrentOptimizer(Builder builder) {
        this.objective = builder.objective;
        this.tolerance = builder.tolerance;
        this.maxIterations = builder.maxIterations;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes {@code f} on {@code [a, b]} with default settings.
     * @param f Function of one variable
     * @param a One end of the interval
     * @param b Other end of the interval
     * @return Result
     */
    public static UnivariateResult minimize(DoubleUnaryOperator f, double a, double b) {
        return builder().objective(f).build().optimize(a, b);
    }

    /**
     * Minimizes on the interval spanned by {@code a} and {@code b} (in either order).
     * @param a One end of the interval
     * @param b Other end of the interval
     * @return Result
     * @throws IllegalArgumentException if an end point is not finite
     */
    public UnivariateResult optimize(double a, double b) {
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            throw new IllegalArgumentException("Interval end points must be finite");
        }
        double lo = Math.min(a, b);
        double hi = Math.max(a, b);

        double x = lo + GOLDEN * (hi - lo);
        double fx = objective.applyAsDouble(x);
        int functionCalls = 1;
        double w = x;
        double fw = fx;
        double v = x;
        double fv = fx;
        double d = 0.0;
        double e = 0.0;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double mid = 0.5 * (lo + hi);
            double tol1 = tolerance * Math.abs(x) + ABSOLUTE_TOLERANCE;
            double tol2 = 2.0 * tol1;

            if (Math.abs(x - mid) <= tol2 - 0.5 * (hi - lo)) {
                double width = hi - lo;
                LOGGER.debug("Brent converged after {} iterations: x={}, f={}", iteration, x, fx);
                return new UnivariateResult(x, fx, iteration, functionCalls, ConvergenceReason.of(
                        OptimizationStatus.STEP_TOLERANCE_REACHED, width,
                        String.format(Locale.ROOT, "Converged: bracket width %.2e within tolerance", width)));
            }

            boolean golden = true;
            if (Math.abs(e) > tol1) {
                double r = (x - w) * (fx - fv);
                double q = (x - v) * (fx - fw);
                double p = (x - v) * q - (x - w) * r;
                q = 2.0 * (q - r);
                if (q > 0) {
                    p = -p;
                } else {
                    q = -q;
                }
                double previous = e;
                if (Math.abs(p) < Math.abs(0.5 * q * previous) && p > q * (lo - x) && p < q * (hi - x)) {
                    e = d;
                    d = p / q;
                    double u = x + d;
                    // Keep away from the bracket ends
                    if (u - lo < tol2 || hi - u < tol2) {
                        d = x < mid ? tol1 : -tol1;
                    }
                    golden = false;
                }
            }
            if (golden) {
                e = (x < mid ? hi : lo) - x;
                d = GOLDEN * e;
            }

            double u = Math.abs(d) >= tol1 ? x + d : x + (d > 0 ? tol1 : -tol1);
            double fu = objective.applyAsDouble(u);
            functionCalls++;

            if (fu <= fx) {
                if (u < x) {
                    hi = x;
                } else {
                    lo = x;
                }
                v = w;
                fv = fw;
                w = x;
                fw = fx;
                x = u;
                fx = fu;
            } else {
                if (u < x) {
                    lo = u;
                } else {
                    hi = u;
                }
                if (fu <= fw || w == x) {
                    v = w;
                    fv = fw;
                    w = u;
                    fw = fu;
                } else if (fu <= fv || v == x || v == w) {
                    v = u;
                    fv = fu;
                }
            }
        }

        LOGGER.debug("Brent stopped after {} iterations: x={}, f={}", maxIterations, x, fx);
        return new UnivariateResult(x, fx, maxIterations, functionCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    /**
     * Builder for Brent optimizer.
     */
    public static final class Builder {
        private DoubleUnaryOperator objective;
        private double tolerance = Math.sqrt(NumericalGradient.EPSILON);
        private int maxIterations = 500;

        private Builder() {}

        public Builder objective(DoubleUnaryOperator objective) {
            this.objective = objective;
            return this;
        }

        /**
         * Sets the relative tolerance on x.
         * @param value Tolerance (must be positive, default √ε)
         * @return This builder
         */
        public Builder tolerance(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Tolerance must be positive");
            }
            this.tolerance = value;
            return this;
        }

        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }

        public BrentOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new BrentOptimizer(this);
        }
    }
}
