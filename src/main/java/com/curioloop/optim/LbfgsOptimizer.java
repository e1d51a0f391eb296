/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import com.curioloop.optim.linesearch.LineSearch;
import com.curioloop.optim.linesearch.LineSearchResult;
import com.curioloop.optim.linesearch.StrongWolfeLineSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.ToDoubleFunction;

/**
 * Limited-memory BFGS optimizer for unconstrained problems.
 * <p>
 * Instead of a dense inverse Hessian, only the last m correction pairs
 * {@code (s_k, y_k)} are kept and the search direction is produced by the
 * two-loop recursion. The initial inverse Hessian is {@code γ·I} with
 * {@code γ = yᵀs / yᵀy} from the most recent accepted pair. With an empty
 * history the direction is steepest descent, so {@code memory(0)} gives a
 * steepest-descent method with the configured line search.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = LbfgsOptimizer.builder()
 *     .objective(rosenbrock)
 *     .gradient(rosenbrockGradient)
 *     .memory(5)
 *     .build()
 *     .optimize(new double[]{-1.2, 1.0});
 * }</pre>
 *
 * @see BfgsOptimizer
 */
public final class LbfgsOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LbfgsOptimizer.class);

    private static final double CURVATURE_THRESHOLD = 1e-10;

    private final Objective objective;
    private final Termination termination;
    private final LineSearch lineSearch;
    private final int memory;
    private final boolean scaleInitialHessian;

    private LbfgsOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.termination = builder.termination;
        this.lineSearch = builder.lineSearch;
        this.memory = builder.memory;
        this.scaleInitialHessian = builder.scaleInitialHessian;
    }

    /**
     * Creates a new builder for the L-BFGS optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default settings (memory 10, strong Wolfe line search).
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
     * Gets the number of stored correction pairs.
     * @return Memory size
     */
    public int getMemory() {
        return memory;
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

        Deque<Correction> history = new ArrayDeque<>(Math.max(memory, 1));
        double gamma = 1.0;

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            double[] d = history.isEmpty()
                    ? Vectors.negate(gx)
                    : Vectors.negate(twoLoopRecursion(gx, history, gamma));

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

            LOGGER.debug("L-BFGS iteration {}: f={}, |g|={}, alpha={}", iteration, fx, gradNorm, ls.getAlpha());

            ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, iteration, termination);
            if (reason != null) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
            }

            double ys = Vectors.dot(y, s);
            if (ys > CURVATURE_THRESHOLD && memory > 0) {
                if (history.size() >= memory) {
                    history.removeFirst();
                }
                history.addLast(new Correction(s, y, 1.0 / ys));
                if (scaleInitialHessian) {
                    gamma = ys / Vectors.dot(y, y);
                }
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    /**
     * Computes H·g for the implicit inverse Hessian held in {@code history}.
     * @param g Gradient
     * @param history Correction pairs, oldest first
     * @param gamma Initial inverse Hessian scale
     * @return H·g
     */
    static double[] twoLoopRecursion(double[] g, Deque<Correction> history, double gamma) {
        double[] q = g.clone();
        double[] alpha = new double[history.size()];

        int i = history.size() - 1;
        for (Iterator<Correction> it = history.descendingIterator(); it.hasNext(); i--) {
            Correction c = it.next();
            alpha[i] = c.rho * Vectors.dot(c.s, q);
            q = Vectors.addScaled(q, c.y, -alpha[i]);
        }

        double[] r = Vectors.scale(q, gamma);

        i = 0;
        for (Correction c : history) {
            double beta = c.rho * Vectors.dot(c.y, r);
            r = Vectors.addScaled(r, c.s, alpha[i] - beta);
            i++;
        }
        return r;
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("L-BFGS stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /** One stored correction pair. */
    static final class Correction {
        final double[] s;
        final double[] y;
        final double rho;

        Correction(double[] s, double[] y, double rho) {
            this.s = s;
            this.y = y;
            this.rho = rho;
        }
    }

    /**
     * Builder for L-BFGS optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private LineSearch lineSearch = StrongWolfeLineSearch.defaults();
        private int memory = 10;
        private boolean scaleInitialHessian = true;

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

        public Builder lineSearch(LineSearch lineSearch) {
            if (lineSearch == null) {
                throw new IllegalArgumentException("Line search cannot be null");
            }
            this.lineSearch = lineSearch;
            return this;
        }

        /**
         * Sets the number of correction pairs kept.
         * <p>
         * Typical values are 3 to 20. Zero disables the quasi-Newton model entirely.
         * </p>
         * @param value Memory size (must be non-negative)
         * @return This builder
         */
        public Builder memory(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Memory must be non-negative");
            }
            this.memory = value;
            return this;
        }

        /**
         * Enables the γ = yᵀs / yᵀy scaling of the initial inverse Hessian (default on).
         * <p>
         * With scaling off the initial matrix stays the identity, which reproduces
         * {@link BfgsOptimizer} exactly while the history holds every pair.
         * </p>
         * @param value Whether to scale
         * @return This builder
         */
        public Builder scaleInitialHessian(boolean value) {
            this.scaleInitialHessian = value;
            return this;
        }

        /**
         * Builds the optimizer.
         * @return L-BFGS optimizer
         * @throws IllegalArgumentException if the objective is missing
         */
        public LbfgsOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new LbfgsOptimizer(this);
        }
    }
}
