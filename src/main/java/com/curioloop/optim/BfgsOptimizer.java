/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Matrices;
import com.curioloop.optim.linalg.Vectors;
import com.curioloop.optim.linesearch.LineSearch;
import com.curioloop.optim.linesearch.LineSearchResult;
import com.curioloop.optim.linesearch.StrongWolfeLineSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * BFGS quasi-Newton optimizer for unconstrained problems.
 * <p>
 * Maintains a dense n×n approximation H of the inverse Hessian, starting from
 * the identity. Each iteration searches along {@code d = −H·∇f} and then applies
 * the rank-two update
 * </p>
 * <pre>
 *   H ← (I − ρ·s·yᵀ)·H·(I − ρ·y·sᵀ) + ρ·s·sᵀ,   ρ = 1 / (yᵀs)
 * </pre>
 * <p>
 * with {@code s = x_{k+1} − x_k} and {@code y = ∇f_{k+1} − ∇f_k}. The update is
 * skipped unless {@code yᵀs > 1e-10}, which keeps H positive definite.
 * Memory grows as n², use {@link LbfgsOptimizer} for large problems.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = BfgsOptimizer.builder()
 *     .objective(x -> Math.pow(x[0] + 2*x[1] - 7, 2) + Math.pow(2*x[0] + x[1] - 5, 2))
 *     .gradient(x -> new double[]{
 *         2*(x[0] + 2*x[1] - 7) + 4*(2*x[0] + x[1] - 5),
 *         4*(x[0] + 2*x[1] - 7) + 2*(2*x[0] + x[1] - 5)})
 *     .build()
 *     .optimize(new double[]{0, 0});
 * }</pre>
 */
public final class BfgsOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BfgsOptimizer.class);

    private static final double CURVATURE_THRESHOLD = 1e-10;

    private final Objective objective;
    private final Termination termination;
    private final LineSearch lineSearch;

    private BfgsOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.termination = builder.termination;
        this.lineSearch = builder.lineSearch;
    }

    /**
     * Creates a new builder for the BFGS optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with an analytic gradient and default settings.
     * @param objective Objective function
     * @param gradient Gradient function, or {@code null} for forward differences
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).build().optimize(initialPoint);
    }

    /**
     * Runs the optimization starting from the given initial point.
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
        double[] x = initialPoint.clone();
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

        double gradNorm = Vectors.normInf(gx);
        ConvergenceReason initial = ConvergenceReason.check(
                gradNorm, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0, termination);
        if (initial != null && initial.isConverged()) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, initial);
        }

        double[][] h = Matrices.identity(n);

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            double[] d = Vectors.negate(Matrices.multiply(h, gx));

            LineSearchResult ls = lineSearch.search(objective, x, d, fx, gx);
            functionCalls += ls.getFunctionCalls();
            gradientCalls += ls.getGradientCalls();
            if (!ls.isSuccess()) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.lineSearchFailed("no step satisfies the acceptance conditions"));
            }

            double[] xNew = Vectors.addScaled(x, d, ls.getAlpha());
            double fNew = ls.getFunctionValue();
            double[] gNew = ls.getGradient();
            if (gNew == null) {
                gNew = objective.gradient(xNew);
                gradientCalls++;
            }
            if (!Double.isFinite(fNew) || !Vectors.isFinite(gNew)) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.numericalInstability());
            }

            double[] s = Vectors.subtract(xNew, x);
            double[] y = Vectors.subtract(gNew, gx);
            double stepNorm = Vectors.normInf(s);
            double funcChange = Math.abs(fNew - fx);
            gradNorm = Vectors.normInf(gNew);

            x = xNew;
            fx = fNew;
            gx = gNew;

            LOGGER.debug("BFGS iteration {}: f={}, |g|={}, alpha={}", iteration, fx, gradNorm, ls.getAlpha());

            ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, iteration, termination);
            if (reason != null) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
            }

            double ys = Vectors.dot(y, s);
            if (ys > CURVATURE_THRESHOLD) {
                h = update(h, s, y, 1.0 / ys);
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    /**
     * Applies the inverse BFGS update in expanded form:
     * H_ij − ρ(s_i·(Hy)_j + (Hy)_i·s_j) + ρ(1 + ρ·yᵀHy)·s_i·s_j.
     */
    static double[][] update(double[][] h, double[] s, double[] y, double rho) {
        int n = s.length;
        double[] hy = Matrices.multiply(h, y);
        double yhy = Vectors.dot(y, hy);
        double coeff = rho * (1.0 + rho * yhy);
        double[][] next = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                next[i][j] = h[i][j] - rho * (s[i] * hy[j] + hy[i] * s[j]) + coeff * s[i] * s[j];
            }
        }
        return next;
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("BFGS stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for BFGS optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private LineSearch lineSearch = StrongWolfeLineSearch.defaults();

        private Builder() {}

        /**
         * Sets the objective function.
         * @param objective Objective function
         * @return This builder
         */
        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        /**
         * Sets the analytic gradient. When absent, {@link #numericalGradient} is used.
         * @param gradient Gradient function, may be null
         * @return This builder
         */
        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
            return this;
        }

        /**
         * Sets the finite-difference scheme used without an analytic gradient.
         * @param method Difference scheme (default FORWARD)
         * @return This builder
         */
        public Builder numericalGradient(NumericalGradient method) {
            if (method == null) {
                throw new IllegalArgumentException("Numerical gradient method cannot be null");
            }
            this.numericalGradient = method;
            return this;
        }

        /**
         * Sets the termination criteria.
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
         * Sets the line search (default strong Wolfe).
         * @param lineSearch Line search
         * @return This builder
         */
        public Builder lineSearch(LineSearch lineSearch) {
            if (lineSearch == null) {
                throw new IllegalArgumentException("Line search cannot be null");
            }
            this.lineSearch = lineSearch;
            return this;
        }

        /**
         * Builds the optimizer.
         * @return BFGS optimizer
         * @throws IllegalArgumentException if the objective is missing
         */
        public BfgsOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new BfgsOptimizer(this);
        }
    }
}
