/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.function.IntToDoubleFunction;
import java.util.function.ToDoubleFunction;

/**
 * Simulated annealing with a Metropolis acceptance rule.
 * <p>
 * Runs exactly {@code maxIterations} proposals. At step k a neighbour of the
 * current point is drawn; an improvement is always accepted and a worse point
 * is accepted with probability {@code exp(−Δf / T_k)}. The default schedule
 * is {@code T_k = 1 / ln(k)} and the default neighbour adds an independent
 * standard normal to every coordinate.
 * </p>
 * <p>
 * The best point ever visited is returned. Running the full budget is the
 * expected outcome, so the result reports {@link OptimizationStatus#BUDGET_COMPLETED}
 * and counts as converged. With a fixed {@code seed} the run is reproducible.
 * </p>
 */
public final class SimulatedAnnealingOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedAnnealingOptimizer.class);

    /**
     * Proposes a candidate near the current point.
     */
    @FunctionalInterface
    public interface Neighbor {
        /**
         * @param x Current point (must not be modified)
         * @param random Random source of the run
         * @return New candidate point
         */
        double[] propose(double[] x, Random random);
    }

    /** Logarithmic cooling {@code 1 / ln(k)}; infinite at k = 1. */
    public static final IntToDoubleFunction LOG_TEMPERATURE = k -> 1.0 / Math.log(k);

    /** Adds a standard normal draw to each coordinate. */
    public static final Neighbor GAUSSIAN_NEIGHBOR = (x, random) -> {
        double[] proposal = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            proposal[i] = x[i] + boxMuller(random);
        }
        return proposal;
    };

    private final ToDoubleFunction<double[]> objective;
    private final int maxIterations;
    private final IntToDoubleFunction temperature;
    private final Neighbor neighbor;
    private final Long seed;

    private SimulatedAnnealingOptimizer(Builder builder) {
        this.objective = builder.objective;
        this.maxIterations = builder.termination.getMaxIterations();
        this.temperature = builder.temperature;
        this.neighbor = builder.neighbor;
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a reproducible chain with default schedule and neighbour.
     * @param objective Objective function
     * @param initialPoint Initial guess
     * @param seed Random seed
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, double[] initialPoint, long seed) {
        return builder().objective(objective).seed(seed).build().optimize(initialPoint);
    }

    /**
     * Runs the chain from the given initial point.
     * @param initialPoint Initial guess (not modified)
     * @return Optimization result holding the best point visited
     */
    public OptimizationResult optimize(double[] initialPoint) {
        if (initialPoint == null || initialPoint.length == 0) {
            throw new IllegalArgumentException("Initial point cannot be null or empty");
        }
        if (!Vectors.isFinite(initialPoint)) {
            return new OptimizationResult(initialPoint, Double.NaN, null, 0, 0, 0,
                    ConvergenceReason.invalidArgument("initial point must be finite"));
        }
        Random random = seed != null ? new Random(seed) : new Random();

        double[] current = initialPoint.clone();
        double fCurrent = objective.applyAsDouble(current);
        double[] best = current.clone();
        double fBest = fCurrent;
        int functionCalls = 1;
        int accepted = 0;

        for (int k = 1; k <= maxIterations; k++) {
            double t = temperature.applyAsDouble(k);
            double[] proposal = neighbor.propose(current, random);
            double fProposal = objective.applyAsDouble(proposal);
            functionCalls++;

            if (fProposal <= fCurrent) {
                current = proposal;
                fCurrent = fProposal;
                accepted++;
                if (fProposal < fBest) {
                    best = proposal.clone();
                    fBest = fProposal;
                }
            } else if (random.nextDouble() <= Math.exp(-(fProposal - fCurrent) / t)) {
                current = proposal;
                fCurrent = fProposal;
                accepted++;
            }
        }

        LOGGER.debug("Simulated annealing finished {} iterations: best f={}, accepted {} moves",
                maxIterations, fBest, accepted);
        ConvergenceReason reason = ConvergenceReason.of(OptimizationStatus.BUDGET_COMPLETED, maxIterations,
                "Completed " + maxIterations + " iterations");
        return new OptimizationResult(best, fBest, null, maxIterations, functionCalls, 0, reason);
    }

    static double boxMuller(Random random) {
        double u1 = random.nextDouble();
        while (u1 == 0) {
            u1 = random.nextDouble();
        }
        double u2 = random.nextDouble();
        return Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
    }

    /**
     * Builder for simulated annealing optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private Termination termination = Termination.defaults();
        private IntToDoubleFunction temperature = LOG_TEMPERATURE;
        private Neighbor neighbor = GAUSSIAN_NEIGHBOR;
        private Long seed;

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        /**
         * Sets the termination. Only the iteration budget is used; tolerances are ignored.
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
         * Sets the cooling schedule, called with k = 1, 2, ..., maxIterations.
         * @param temperature Temperature as a function of the step number
         * @return This builder
         */
        public Builder temperature(IntToDoubleFunction temperature) {
            if (temperature == null) {
                throw new IllegalArgumentException("Temperature schedule cannot be null");
            }
            this.temperature = temperature;
            return this;
        }

        public Builder neighbor(Neighbor neighbor) {
            if (neighbor == null) {
                throw new IllegalArgumentException("Neighbor generator cannot be null");
            }
            this.neighbor = neighbor;
            return this;
        }

        /**
         * Fixes the random seed. Without one every run draws a fresh seed.
         * @param seed Seed
         * @return This builder
         */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public SimulatedAnnealingOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new SimulatedAnnealingOptimizer(this);
        }
    }
}
