/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import com.curioloop.optim.linesearch.HagerZhangLineSearch;
import com.curioloop.optim.linesearch.LineSearch;
import com.curioloop.optim.linesearch.LineSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Nonlinear conjugate gradient optimizer with the Hager-Zhang β.
 * <p>
 * Needs only O(n) memory. After each line search, with {@code y = ∇f_{k+1} − ∇f_k},
 * </p>
 * <pre>
 *   β = (y·∇f_{k+1} − 2·(y·y)·(d·∇f_{k+1}) / (d·y)) / (d·y)
 *   β ← max(β, −1 / (‖d‖·min(η, ‖∇f_k‖)))
 *   d ← −∇f_{k+1} + β·d
 * </pre>
 * <p>
 * The direction is reset to steepest descent when it is not a descent
 * direction, when {@code d·y} vanishes, and every {@code restartInterval}
 * iterations (the dimension by default).
 * </p>
 *
 * @see <a href="https://doi.org/10.1137/030601880">Hager &amp; Zhang (2005)</a>
 */
public final class ConjugateGradientOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConjugateGradientOptimizer.class);

    private static final double MIN_CURVATURE = 1e-30;

    private final Objective objective;
    private final Termination termination;
    private final LineSearch lineSearch;
    private final double eta;
    private final int restartInterval;

    private ConjugateGradientOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.termination = builder.termination;
        this.lineSearch = builder.lineSearch;
        this.eta = builder.eta;
        this.restartInterval = builder.restartInterval;
    }

    /**
     * Creates a new builder for the conjugate gradient optimizer.
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
        int restart = restartInterval > 0 ? restartInterval : initialPoint.length;
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

        double[] d = Vectors.negate(gx);

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
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
            double[] gOld = gx;
            x = xNew;
            fx = fNew;
            gx = gNew;
            gradNorm = Vectors.normInf(gx);

            LOGGER.debug("CG iteration {}: f={}, |g|={}, alpha={}", iteration, fx, gradNorm, ls.getAlpha());

            ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, iteration, termination);
            if (reason != null) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
            }

            d = nextDirection(d, gOld, gx, iteration % restart == 0);
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    private double[] nextDirection(double[] d, double[] gOld, double[] gNew, boolean restart) {
        double[] y = Vectors.subtract(gNew, gOld);
        double dy = Vectors.dot(d, y);
        if (restart || Math.abs(dy) < MIN_CURVATURE) {
            return Vectors.negate(gNew);
        }

        double beta = (Vectors.dot(y, gNew) - 2.0 * Vectors.dot(y, y) * Vectors.dot(d, gNew) / dy) / dy;
        double etaBound = -1.0 / (Vectors.norm(d) * Math.min(eta, Vectors.norm(gOld)));
        beta = Math.max(beta, etaBound);

        double[] next = Vectors.addScaled(Vectors.negate(gNew), d, beta);
        if (Vectors.dot(next, gNew) >= 0) {
            return Vectors.negate(gNew);
        }
        return next;
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("CG stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for conjugate gradient optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private LineSearch lineSearch = HagerZhangLineSearch.defaults();
        private double eta = 0.4;
        private int restartInterval = 0;

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
         * Sets the line search (default Hager-Zhang).
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
         * Sets η of the β lower bound.
         * @param value η (must be positive)
         * @return This builder
         */
        public Builder eta(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("eta must be positive");
            }
            this.eta = value;
            return this;
        }

        /**
         * Sets the restart interval.
         * @param value Iterations between restarts, 0 for the problem dimension
         * @return This builder
         */
        public Builder restartInterval(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Restart interval must be non-negative");
            }
            this.restartInterval = value;
            return this;
        }

        public ConjugateGradientOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new ConjugateGradientOptimizer(this);
        }
    }
}
