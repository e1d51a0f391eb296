/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;

/**
 * Backtracking line search on the Armijo condition.
 * <p>
 * Starting from {@code α₀}, the step is contracted by {@code ρ} until
 * {@code f(x + α·d) ≤ f(x) + c₁·α·∇f(x)·d}. No gradient is evaluated, so the
 * result never carries one.
 * </p>
 */
public final class BacktrackingLineSearch implements LineSearch {

    private final double initialAlpha;
    private final double c1;
    private final double rho;
    private final int maxIterations;

    private BacktrackingLineSearch(Builder builder) {
        this.initialAlpha = builder.initialAlpha;
        this.c1 = builder.c1;
        this.rho = builder.rho;
        this.maxIterations = builder.maxIterations;
    }

    /**
     * Creates a backtracking search with α₀ = 1, c₁ = 1e-4, ρ = 0.5 and at most 20 contractions.
     * @return Line search
     */
    public static BacktrackingLineSearch defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LineSearchResult search(Objective objective, double[] x, double[] d, double fx, double[] gx) {
        double slope = Vectors.dot(gx, d);
        double alpha = initialAlpha;
        int functionCalls = 0;

        for (int i = 0; i < maxIterations; i++) {
            double fNew = objective.value(Vectors.addScaled(x, d, alpha));
            functionCalls++;
            if (fNew <= fx + c1 * alpha * slope) {
                return new LineSearchResult(alpha, fNew, null, functionCalls, 0, true);
            }
            alpha *= rho;
        }

        double fLast = objective.value(Vectors.addScaled(x, d, alpha));
        return new LineSearchResult(alpha, fLast, null, functionCalls + 1, 0, false);
    }

    /**
     * Builder for {@link BacktrackingLineSearch}.
     */
    public static final class Builder {
        private double initialAlpha = 1.0;
        private double c1 = 1e-4;
        private double rho = 0.5;
        private int maxIterations = 20;

        private Builder() {}

        public Builder initialAlpha(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Initial step must be positive and finite");
            }
            this.initialAlpha = value;
            return this;
        }

        /**
         * Sets the sufficient decrease constant.
         * @param value c₁ in (0, 1)
         * @return This builder
         */
        public Builder c1(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("c1 must be in (0, 1)");
            }
            this.c1 = value;
            return this;
        }

        /**
         * Sets the contraction factor.
         * @param value ρ in (0, 1)
         * @return This builder
         */
        public Builder rho(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("rho must be in (0, 1)");
            }
            this.rho = value;
            return this;
        }

        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }

        public BacktrackingLineSearch build() {
            return new BacktrackingLineSearch(this);
        }
    }
}
