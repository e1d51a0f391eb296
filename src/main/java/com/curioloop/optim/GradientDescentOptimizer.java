/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import com.curioloop.optim.linesearch.BacktrackingLineSearch;
import com.curioloop.optim.linesearch.LineSearch;
import com.curioloop.optim.linesearch.LineSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Steepest descent optimizer.
 * <p>
 * Searches along {@code −∇f} with Armijo backtracking by default. Converges
 * linearly at best; mostly useful as a baseline and as an inner solver of
 * {@link FminboxOptimizer}.
 * </p>
 */
public final class GradientDescentOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GradientDescentOptimizer.class);

    private final Objective objective;
    private final Termination termination;
    private final LineSearch lineSearch;

    private GradientDescentOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.termination = builder.termination;
        this.lineSearch = builder.lineSearch;
    }

    /**
     * Creates a new builder for the gradient descent optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default settings.
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
            double[] d = Vectors.negate(gx);

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

            LOGGER.debug("Gradient descent iteration {}: f={}, |g|={}", iteration, fx, gradNorm);

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
        LOGGER.debug("Gradient descent stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for gradient descent optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private LineSearch lineSearch = BacktrackingLineSearch.defaults();

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

        public Builder termination(Termination termination) {
            if (termination == null) {
                throw new IllegalArgumentException("Termination cannot be null");
            }
            this.termination = termination;
            return this;
        }

        /**
         * Sets the line search (default Armijo backtracking).
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

        public GradientDescentOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new GradientDescentOptimizer(this);
        }
    }
}
