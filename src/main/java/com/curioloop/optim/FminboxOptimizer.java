/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Box-constrained minimization by a logarithmic barrier (fminbox).
 * <p>
 * Solves {@code min f(x)} subject to {@code l < x < u} by a sequence of
 * unconstrained solves of
 * </p>
 * <pre>
 *   B_μ(x) = f(x) + μ·Φ(x),   Φ(x) = −Σ log(x_i − l_i) − Σ log(u_i − x_i)
 * </pre>
 * <p>
 * where only finite bounds contribute to Φ. μ starts at
 * {@code muFactor·‖∇f‖₁ / ‖∇Φ‖₁} (unless given) and is multiplied by
 * {@code muFactor} after every outer iteration. The run stops when the
 * projected gradient of the original objective,
 * {@code max_i |x_i − clip(x_i − g_i, l_i, u_i)|}, reaches the outer tolerance.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = FminboxOptimizer.builder()
 *     .objective(x -> x[0] * x[0] + x[1] * x[1])
 *     .gradient(x -> new double[]{2 * x[0], 2 * x[1]})
 *     .bounds(Bound.atLeast(2), Bound.unbounded())
 *     .build()
 *     .optimize(new double[]{5, 5});
 * }</pre>
 */
public final class FminboxOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FminboxOptimizer.class);

    private static final double INTERIOR_MARGIN = 1e-15;
    private static final double FALLBACK_MU = 1e-4;

    /**
     * Unconstrained method used for the barrier subproblems.
     */
    public enum InnerMethod {
        BFGS,
        LBFGS,
        CONJUGATE_GRADIENT,
        GRADIENT_DESCENT
    }

    private final Objective objective;
    private final double[] lower;
    private final double[] upper;
    private final InnerMethod method;
    private final Termination termination;
    private final Double mu0;
    private final double muFactor;
    private final int outerIterations;
    private final double outerGradientTolerance;

    private FminboxOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.lower = builder.lower;
        this.upper = builder.upper;
        this.method = builder.method;
        this.termination = builder.termination;
        this.mu0 = builder.mu0;
        this.muFactor = builder.muFactor;
        this.outerIterations = builder.outerIterations;
        this.outerGradientTolerance = builder.outerGradientTolerance;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function within a box using L-BFGS subproblems.
     * @param objective Objective function
     * @param gradient Gradient function, or {@code null} for forward differences
     * @param lower Lower bounds ({@code -∞} for none)
     * @param upper Upper bounds ({@code +∞} for none)
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              double[] lower, double[] upper, double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).bounds(lower, upper).build().optimize(initialPoint);
    }

    /**
     * Runs the barrier method from the given initial point.
     * <p>
     * Points on or outside the box are moved strictly inside first. Bounds with
     * {@code lower >= upper} or of the wrong length give an
     * {@link OptimizationStatus#INVALID_ARGUMENT} result.
     * </p>
     * @param initialPoint Initial guess (not modified)
     * @return Optimization result
     */
    public OptimizationResult optimize(double[] initialPoint) {
        if (initialPoint == null || initialPoint.length == 0) {
            throw new IllegalArgumentException("Initial point cannot be null or empty");
        }
        if (!Vectors.isFinite(initialPoint)) {
            return finish(initialPoint.clone(), Double.NaN, null, 0, 0, 0,
                    ConvergenceReason.invalidArgument("initial point must be finite"));
        }
        int n = initialPoint.length;
        double[] l = lower != null ? lower : filled(n, Double.NEGATIVE_INFINITY);
        double[] u = upper != null ? upper : filled(n, Double.POSITIVE_INFINITY);

        String invalid = validate(l, u, n);
        if (invalid != null) {
            double[] x0 = initialPoint.clone();
            return new OptimizationResult(x0, objective.value(x0), objective.gradient(x0), 0, 1, 1,
                    ConvergenceReason.invalidArgument(invalid));
        }

        double[] x = nudgeInside(initialPoint, l, u);
        double fx = objective.value(x);
        double[] gx = objective.gradient(x);
        int functionCalls = 1;
        int gradientCalls = 1;

        String mismatch = Objective.checkGradient(x, gx);
        if (mismatch != null) {
            return finish(x, fx, null, 0, functionCalls, gradientCalls, ConvergenceReason.invalidArgument(mismatch));
        }
        if (!Double.isFinite(fx) || !Vectors.isFinite(gx)) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, ConvergenceReason.numericalInstability());
        }

        double mu;
        if (mu0 != null) {
            mu = mu0;
        } else {
            double ratio = muFactor * Vectors.norm1(gx) / Vectors.norm1(barrierGradient(x, l, u));
            mu = ratio > 0 && Double.isFinite(ratio) ? ratio : FALLBACK_MU;
        }

        double projected = projectedGradientNorm(x, gx, l, u);
        if (projected <= outerGradientTolerance) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, projectedGradientReason(projected));
        }

        for (int outer = 1; outer <= outerIterations; outer++) {
            OptimizationResult inner = solveBarrier(x, l, u, mu);
            x = inner.getSolution();
            for (int i = 0; i < n; i++) {
                if (!Double.isInfinite(l[i])) x[i] = Math.max(l[i] + INTERIOR_MARGIN, x[i]);
                if (!Double.isInfinite(u[i])) x[i] = Math.min(u[i] - INTERIOR_MARGIN, x[i]);
            }

            fx = objective.value(x);
            gx = objective.gradient(x);
            functionCalls += inner.getFunctionCalls() + 1;
            gradientCalls += inner.getGradientCalls() + 1;
            if (!Double.isFinite(fx) || !Vectors.isFinite(gx)) {
                return finish(x, fx, gx, outer, functionCalls, gradientCalls, ConvergenceReason.numericalInstability());
            }

            projected = projectedGradientNorm(x, gx, l, u);
            LOGGER.debug("Fminbox outer iteration {}: mu={}, f={}, projected gradient={}, inner: {}",
                    outer, mu, fx, projected, inner.getMessage());
            if (projected <= outerGradientTolerance) {
                return finish(x, fx, gx, outer, functionCalls, gradientCalls, projectedGradientReason(projected));
            }
            mu *= muFactor;
        }

        return finish(x, fx, gx, outerIterations, functionCalls, gradientCalls,
                ConvergenceReason.of(OptimizationStatus.MAX_ITERATIONS_REACHED, outerIterations,
                        "Stopped: reached maximum outer iterations (" + outerIterations + ")"));
    }

    private OptimizationResult solveBarrier(double[] x, double[] l, double[] u, double mu) {
        ToDoubleFunction<double[]> f = xp -> {
            double phi = barrierValue(xp, l, u);
            return Double.isFinite(phi) ? objective.value(xp) + mu * phi : Double.POSITIVE_INFINITY;
        };
        GradientFunction g = xp -> Vectors.addScaled(objective.gradient(xp), barrierGradient(xp, l, u), mu);

        switch (method) {
            case BFGS:
                return BfgsOptimizer.builder().objective(f).gradient(g).termination(termination).build().optimize(x);
            case CONJUGATE_GRADIENT:
                return ConjugateGradientOptimizer.builder().objective(f).gradient(g).termination(termination)
                        .build().optimize(x);
            case GRADIENT_DESCENT:
                return GradientDescentOptimizer.builder().objective(f).gradient(g).termination(termination)
                        .build().optimize(x);
            case LBFGS:
            default:
                return LbfgsOptimizer.builder().objective(f).gradient(g).termination(termination).build().optimize(x);
        }
    }

    private static String validate(double[] l, double[] u, int n) {
        if (l.length != n || u.length != n) {
            return "bounds dimension does not match initial point";
        }
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(l[i]) || Double.isNaN(u[i]) || l[i] >= u[i]) {
                return "lower >= upper";
            }
        }
        return null;
    }

    /**
     * Moves every coordinate on or outside the box strictly inside it.
     */
    static double[] nudgeInside(double[] x0, double[] l, double[] u) {
        double[] x = x0.clone();
        for (int i = 0; i < x.length; i++) {
            boolean finiteL = !Double.isInfinite(l[i]);
            boolean finiteU = !Double.isInfinite(u[i]);
            if (x[i] <= l[i]) {
                x[i] = finiteL && finiteU ? 0.99 * l[i] + 0.01 * u[i] : l[i] + 1.0;
            } else if (x[i] >= u[i]) {
                x[i] = finiteL && finiteU ? 0.01 * l[i] + 0.99 * u[i] : u[i] - 1.0;
            }
        }
        return x;
    }

    static double barrierValue(double[] x, double[] l, double[] u) {
        double value = 0.0;
        for (int i = 0; i < x.length; i++) {
            if (!Double.isInfinite(l[i])) {
                double gap = x[i] - l[i];
                if (gap <= 0) return Double.POSITIVE_INFINITY;
                value -= Math.log(gap);
            }
            if (!Double.isInfinite(u[i])) {
                double gap = u[i] - x[i];
                if (gap <= 0) return Double.POSITIVE_INFINITY;
                value -= Math.log(gap);
            }
        }
        return value;
    }

    static double[] barrierGradient(double[] x, double[] l, double[] u) {
        double[] g = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            if (!Double.isInfinite(l[i])) {
                g[i] -= 1.0 / (x[i] - l[i]);
            }
            if (!Double.isInfinite(u[i])) {
                g[i] += 1.0 / (u[i] - x[i]);
            }
        }
        return g;
    }

    /**
     * Computes {@code max_i |x_i − clip(x_i − g_i, l_i, u_i)|}.
     */
    static double projectedGradientNorm(double[] x, double[] g, double[] l, double[] u) {
        double max = 0.0;
        for (int i = 0; i < x.length; i++) {
            double clipped = Math.max(l[i], Math.min(u[i], x[i] - g[i]));
            max = Math.max(max, Math.abs(x[i] - clipped));
        }
        return max;
    }

    private static ConvergenceReason projectedGradientReason(double norm) {
        return ConvergenceReason.of(OptimizationStatus.GRADIENT_TOLERANCE_REACHED, norm,
                String.format(Locale.ROOT, "Converged: projected gradient norm %.2e below tolerance", norm));
    }

    private static double[] filled(int n, double value) {
        double[] a = new double[n];
        Arrays.fill(a, value);
        return a;
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("Fminbox stopped after {} outer iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for fminbox optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private double[] lower;
        private double[] upper;
        private InnerMethod method = InnerMethod.LBFGS;
        private Termination termination = Termination.defaults();
        private Double mu0;
        private double muFactor = 0.001;
        private int outerIterations = 20;
        private double outerGradientTolerance = 1e-8;

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
            return this;
        }

        public Builder numericalGradient(NumericalGradient method) {
            if (method == null) {
                throw new IllegalArgumentException("Numerical gradient method cannot be null");
            }
            this.numericalGradient = method;
            return this;
        }

        /**
         * Sets the box. Either array may be null to leave that side unbounded.
         * @param lower Lower bounds
         * @param upper Upper bounds
         * @return This builder
         */
        public Builder bounds(double[] lower, double[] upper) {
            this.lower = lower != null ? lower.clone() : null;
            this.upper = upper != null ? upper.clone() : null;
            return this;
        }

        public Builder bounds(Bound... bounds) {
            if (bounds == null) {
                throw new IllegalArgumentException("Bounds cannot be null");
            }
            double[][] split = Bound.split(bounds);
            this.lower = split[0];
            this.upper = split[1];
            return this;
        }

        /**
         * Sets the unconstrained method for the barrier subproblems (default L-BFGS).
         * @param method Inner method
         * @return This builder
         */
        public Builder method(InnerMethod method) {
            if (method == null) {
                throw new IllegalArgumentException("Inner method cannot be null");
            }
            this.method = method;
            return this;
        }

        /**
         * Sets the termination of every inner solve.
         * @param termination Termination criteria
         * @return This builder
         */
        public Builder termination(Termination termination) {
            if (termination == null) {
                throw new IllegalArgumentException("Termination cannot be null");
            }
            this.termination = termination;
            return this;
        }

        /**
         * Fixes the initial barrier weight instead of deriving it from the gradients.
         * @param value Initial μ (must be positive)
         * @return This builder
         */
        public Builder mu0(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Initial mu must be positive");
            }
            this.mu0 = value;
            return this;
        }

        /**
         * Sets the factor that both scales the initial μ and shrinks μ between outer iterations.
         * @param value Factor in (0, 1), default 0.001
         * @return This builder
         */
        public Builder muFactor(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("mu factor must be in (0, 1)");
            }
            this.muFactor = value;
            return this;
        }

        public Builder outerIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Outer iterations must be positive");
            }
            this.outerIterations = value;
            return this;
        }

        public Builder outerGradientTolerance(double value) {
            if (!(value >= 0)) {
                throw new IllegalArgumentException("Outer gradient tolerance must be non-negative");
            }
            this.outerGradientTolerance = value;
            return this;
        }

        public FminboxOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new FminboxOptimizer(this);
        }
    }
}
