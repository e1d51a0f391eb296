/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Cholesky;
import com.curioloop.optim.linalg.Matrices;
import com.curioloop.optim.linalg.Vectors;
import com.curioloop.optim.linesearch.LineSearch;
import com.curioloop.optim.linesearch.LineSearchResult;
import com.curioloop.optim.linesearch.StrongWolfeLineSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Newton's method with a modified Hessian and line search.
 * <p>
 * Each iteration solves {@code H·d = −∇f} by Cholesky factorization. When H is
 * not positive definite, {@code H + τI} is factorized instead, τ starting at
 * {@code initialTau} and growing by {@code tauFactor} for up to
 * {@code maxRegularization} attempts. A direction that still fails to descend is
 * replaced by {@code −∇f}. Without an analytic Hessian a central-difference
 * Hessian of the objective is used.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = NewtonOptimizer.builder()
 *     .objective(f)
 *     .gradient(grad)
 *     .hessian(hess)
 *     .build()
 *     .optimize(x0);
 * }</pre>
 */
public final class NewtonOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NewtonOptimizer.class);

    private final Objective objective;
    private final Termination termination;
    private final LineSearch lineSearch;
    private final double initialTau;
    private final double tauFactor;
    private final int maxRegularization;

    private NewtonOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, builder.hessian, builder.numericalGradient);
        this.termination = builder.termination;
        this.lineSearch = builder.lineSearch;
        this.initialTau = builder.initialTau;
        this.tauFactor = builder.tauFactor;
        this.maxRegularization = builder.maxRegularization;
    }

    /**
     * Creates a new builder for the Newton optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default settings.
     * @param objective Objective function
     * @param gradient Gradient function, or {@code null} for forward differences
     * @param hessian Hessian function, or {@code null} for central differences
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              HessianFunction hessian, double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).hessian(hessian).build().optimize(initialPoint);
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

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            double[][] h = objective.hessian(x);
            if (!Matrices.isFinite(h)) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.numericalInstability());
            }

            double[] d = Cholesky.solveRegularized(h, Vectors.negate(gx), initialTau, tauFactor, maxRegularization);
            if (d == null) {
                LOGGER.debug("Newton iteration {}: Hessian stayed indefinite after {} shifts", iteration, maxRegularization);
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.regularizationFailed());
            }
            if (Vectors.dot(d, gx) >= 0) {
                d = Vectors.negate(gx);
            }

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

            double stepNorm = Vectors.normInf(Vectors.subtract(xNew, x));
            double funcChange = Math.abs(fNew - fx);
            gradNorm = Vectors.normInf(gNew);

            x = xNew;
            fx = fNew;
            gx = gNew;

            LOGGER.debug("Newton iteration {}: f={}, |g|={}, alpha={}", iteration, fx, gradNorm, ls.getAlpha());

            ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, iteration, termination);
            if (reason != null) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("Newton stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for Newton optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private HessianFunction hessian;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private LineSearch lineSearch = StrongWolfeLineSearch.defaults();
        private double initialTau = 1e-8;
        private double tauFactor = 10.0;
        private int maxRegularization = 20;

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
            return this;
        }

        /**
         * Sets the analytic Hessian. When absent, a central-difference Hessian is used.
         * @param hessian Hessian function, may be null
         * @return This builder
         */
        public Builder hessian(HessianFunction hessian) {
            this.hessian = hessian;
            return this;
        }

        public Builder numericalGradient(NumericalGradient method) {
            if (method == null) {
                throw new IllegalArgumentException("Numerical gradient method cannot be null");
            }
            this.numericalGradient = method;
            return this;
        }

        public Builder termination(Termination termination) {
            if (termination == null) {
                throw new IllegalArgumentException("Termination cannot be null");
            }
            this.termination = termination;
            return this;
        }

        public Builder lineSearch(LineSearch lineSearch) {
            if (lineSearch == null) {
                throw new IllegalArgumentException("Line search cannot be null");
            }
            this.lineSearch = lineSearch;
            return this;
        }

        /**
         * Sets the Hessian regularization schedule.
         * @param initialTau First diagonal shift (must be positive)
         * @param tauFactor Growth factor (must exceed 1)
         * @param maxAttempts Number of shifted factorizations, 0 to give up on the first indefinite Hessian
         * @return This builder
         */
        public Builder regularization(double initialTau, double tauFactor, int maxAttempts) {
            if (!(initialTau > 0) || !(tauFactor > 1) || maxAttempts < 0) {
                throw new IllegalArgumentException("Invalid regularization schedule");
            }
            this.initialTau = initialTau;
            this.tauFactor = tauFactor;
            this.maxRegularization = maxAttempts;
            return this;
        }

        public NewtonOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new NewtonOptimizer(this);
        }
    }
}
