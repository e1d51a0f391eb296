/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Nelder-Mead downhill simplex optimizer.
 * <p>
 * Derivative-free: only the objective is evaluated, the result never carries a
 * gradient and {@code gradientCalls} is always zero. Suited for small,
 * non-smooth or noisy problems.
 * </p>
 *
 * <h2>Algorithm</h2>
 * <p>
 * The initial simplex is x₀ plus n vertices, vertex i offsetting coordinate i by
 * {@code s·max(|x_i|, 1)}. Each iteration sorts the vertices, reflects the
 * worst through the centroid of the others, and then expands, contracts
 * (outside or inside) or shrinks towards the best vertex.
 * </p>
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>standard deviation of the vertex values below the function tolerance</li>
 *   <li>simplex diameter (largest infinity-norm distance from the best vertex) below the step tolerance</li>
 *   <li>iteration cap</li>
 * </ul>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = NelderMeadOptimizer.minimize(
 *     x -> 100 * Math.pow(x[1] - x[0]*x[0], 2) + Math.pow(1 - x[0], 2),
 *     new double[]{-1.2, 1.0}
 * );
 * }</pre>
 */
public final class NelderMeadOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NelderMeadOptimizer.class);

    private final ToDoubleFunction<double[]> objective;
    private final Termination termination;
    private final double reflection;
    private final double expansion;
    private final double contraction;
    private final double shrink;
    private final double initialSimplexScale;

    private NelderMeadOptimizer(Builder builder) {
        this.objective = builder.objective;
        this.termination = builder.termination;
        this.reflection = builder.reflection;
        this.expansion = builder.expansion;
        this.contraction = builder.contraction;
        this.shrink = builder.shrink;
        this.initialSimplexScale = builder.initialSimplexScale;
    }

    /**
     * Creates a new builder for the Nelder-Mead optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default coefficients and termination criteria.
     * @param objective Objective function
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, double[] initialPoint) {
        return builder().objective(objective).build().optimize(initialPoint);
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
            return finish(new Vertex(initialPoint.clone(), Double.NaN), 0, 0,
                    ConvergenceReason.invalidArgument("initial point must be finite"));
        }
        int n = initialPoint.length;
        Vertex[] simplex = new Vertex[n + 1];
        simplex[0] = new Vertex(initialPoint.clone(), objective.applyAsDouble(initialPoint.clone()));
        for (int i = 0; i < n; i++) {
            double[] v = initialPoint.clone();
            v[i] += initialSimplexScale * Math.max(Math.abs(initialPoint[i]), 1.0);
            simplex[i + 1] = new Vertex(v, objective.applyAsDouble(v));
        }
        int functionCalls = n + 1;
        int iteration = 0;

        for (Vertex v : simplex) {
            if (!Double.isFinite(v.value)) {
                return finish(simplex[0], 0, functionCalls, ConvergenceReason.numericalInstability());
            }
        }

        while (iteration < termination.getMaxIterations()) {
            Arrays.sort(simplex, Vertex.BY_VALUE);

            double spread = spread(simplex);
            if (spread < termination.getFunctionTolerance()) {
                return finish(simplex[0], iteration, functionCalls, ConvergenceReason.of(
                        OptimizationStatus.FUNCTION_TOLERANCE_REACHED, spread,
                        String.format(Locale.ROOT, "Converged: simplex function spread %.2e below tolerance", spread)));
            }
            double diameter = diameter(simplex);
            if (diameter < termination.getStepTolerance()) {
                return finish(simplex[0], iteration, functionCalls, ConvergenceReason.of(
                        OptimizationStatus.STEP_TOLERANCE_REACHED, diameter,
                        String.format(Locale.ROOT, "Converged: simplex diameter %.2e below tolerance", diameter)));
            }

            iteration++;

            Vertex best = simplex[0];
            Vertex secondWorst = simplex[n - 1];
            Vertex worst = simplex[n];
            double[] centroid = centroid(simplex);

            double[] reflected = Vectors.addScaled(centroid, Vectors.subtract(centroid, worst.x), reflection);
            double fReflected = objective.applyAsDouble(reflected);
            functionCalls++;

            if (fReflected < secondWorst.value && fReflected >= best.value) {
                simplex[n] = new Vertex(reflected, fReflected);
                continue;
            }

            if (fReflected < best.value) {
                double[] expanded = Vectors.addScaled(centroid, Vectors.subtract(reflected, centroid), expansion);
                double fExpanded = objective.applyAsDouble(expanded);
                functionCalls++;
                simplex[n] = fExpanded < fReflected
                        ? new Vertex(expanded, fExpanded)
                        : new Vertex(reflected, fReflected);
                continue;
            }

            if (fReflected < worst.value) {
                double[] outside = Vectors.addScaled(centroid, Vectors.subtract(reflected, centroid), contraction);
                double fOutside = objective.applyAsDouble(outside);
                functionCalls++;
                if (fOutside <= fReflected) {
                    simplex[n] = new Vertex(outside, fOutside);
                    continue;
                }
            } else {
                double[] inside = Vectors.addScaled(centroid, Vectors.subtract(worst.x, centroid), contraction);
                double fInside = objective.applyAsDouble(inside);
                functionCalls++;
                if (fInside < worst.value) {
                    simplex[n] = new Vertex(inside, fInside);
                    continue;
                }
            }

            for (int i = 1; i <= n; i++) {
                double[] shrunk = Vectors.addScaled(best.x, Vectors.subtract(simplex[i].x, best.x), shrink);
                simplex[i] = new Vertex(shrunk, objective.applyAsDouble(shrunk));
                functionCalls++;
            }
        }

        Arrays.sort(simplex, Vertex.BY_VALUE);
        return finish(simplex[0], iteration, functionCalls, ConvergenceReason.maxIterations(iteration));
    }

    private OptimizationResult finish(Vertex best, int iterations, int functionCalls, ConvergenceReason reason) {
        LOGGER.debug("Nelder-Mead stopped after {} iterations, {} evaluations: {}",
                iterations, functionCalls, reason.getMessage());
        return new OptimizationResult(best.x, best.value, null, iterations, functionCalls, 0, reason);
    }

    private static double spread(Vertex[] simplex) {
        double mean = 0.0;
        for (Vertex v : simplex) {
            mean += v.value;
        }
        mean /= simplex.length;
        double variance = 0.0;
        for (Vertex v : simplex) {
            double dev = v.value - mean;
            variance += dev * dev;
        }
        return Math.sqrt(variance / simplex.length);
    }

    private static double diameter(Vertex[] simplex) {
        double diameter = 0.0;
        for (int i = 1; i < simplex.length; i++) {
            diameter = Math.max(diameter, Vectors.normInf(Vectors.subtract(simplex[i].x, simplex[0].x)));
        }
        return diameter;
    }

    private static double[] centroid(Vertex[] simplex) {
        int n = simplex.length - 1;
        double[] c = new double[n];
        for (int i = 0; i < n; i++) {
            double[] x = simplex[i].x;
            for (int j = 0; j < n; j++) {
                c[j] += x[j];
            }
        }
        for (int j = 0; j < n; j++) {
            c[j] /= n;
        }
        return c;
    }

    /** Simplex vertex with its cached objective value. */
    private static final class Vertex {
        static final Comparator<Vertex> BY_VALUE = Comparator.comparingDouble(v -> v.value);

        final double[] x;
        final double value;

        Vertex(double[] x, double value) {
            this.x = x;
            this.value = value;
        }
    }

    /**
     * Builder for Nelder-Mead optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private Termination termination = Termination.defaults();
        private double reflection = 1.0;
        private double expansion = 2.0;
        private double contraction = 0.5;
        private double shrink = 0.5;
        private double initialSimplexScale = 0.05;

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
         * Sets the simplex coefficients.
         * @param reflection α &gt; 0
         * @param expansion γ &gt; 1
         * @param contraction ρ in (0, 1)
         * @param shrink σ in (0, 1)
         * @return This builder
         */
        public Builder coefficients(double reflection, double expansion, double contraction, double shrink) {
            if (!(reflection > 0) || !(expansion > 1)
                    || !(contraction > 0 && contraction < 1) || !(shrink > 0 && shrink < 1)) {
                throw new IllegalArgumentException("Invalid simplex coefficients");
            }
            this.reflection = reflection;
            this.expansion = expansion;
            this.contraction = contraction;
            this.shrink = shrink;
            return this;
        }

        /**
         * Sets the relative edge length of the initial simplex.
         * @param value Scale s (must be positive)
         * @return This builder
         */
        public Builder initialSimplexScale(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Initial simplex scale must be positive");
            }
            this.initialSimplexScale = value;
            return this;
        }

        /**
         * Builds the optimizer.
         * @return Nelder-Mead optimizer
         * @throws IllegalArgumentException if the objective is missing
         */
        public NelderMeadOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new NelderMeadOptimizer(this);
        }
    }
}
