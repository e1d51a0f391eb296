/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Termination criteria shared by every optimizer.
 * <p>
 * How each criterion is measured depends on the method:
 * <ul>
 *   <li>Gradient-based solvers: infinity norm of the gradient, infinity norm of the
 *       last step, absolute change of the objective</li>
 *   <li>Nelder-Mead: simplex diameter against the step tolerance, standard deviation
 *       of the vertex values against the function tolerance</li>
 *   <li>fminbox / interior-point Newton: projected gradient and KKT residual take the
 *       place of the gradient norm</li>
 * </ul>
 *
 * @see ConvergenceReason#check(double, double, double, int, Termination)
 */
public final class Termination {

    private final int maxIterations;
    private final double gradientTolerance;
    private final double stepTolerance;
    private final double functionTolerance;

    private Termination(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.gradientTolerance = builder.gradientTolerance;
        this.stepTolerance = builder.stepTolerance;
        this.functionTolerance = builder.functionTolerance;
    }

    /**
     * Creates a new builder for termination criteria.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates default termination criteria.
     * @return Default termination
     */
    public static Termination defaults() {
        return builder().build();
    }

    /**
     * Gets the hard iteration ceiling.
     * @return Maximum iterations
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Gets the acceptance threshold for the gradient norm.
     * @return Gradient tolerance
     */
    public double getGradientTolerance() {
        return gradientTolerance;
    }

    /**
     * Gets the acceptance threshold for the last step.
     * @return Step tolerance
     */
    public double getStepTolerance() {
        return stepTolerance;
    }

    /**
     * Gets the acceptance threshold for the objective change.
     * @return Function tolerance
     */
    public double getFunctionTolerance() {
        return functionTolerance;
    }

    /**
     * Creates a builder pre-filled with these criteria.
     * @return Builder copy
     */
    public Builder toBuilder() {
        return builder()
                .maxIterations(maxIterations)
                .gradientTolerance(gradientTolerance)
                .stepTolerance(stepTolerance)
                .functionTolerance(functionTolerance);
    }

    /**
     * Builder for Termination criteria.
     */
    public static final class Builder {
        private int maxIterations = 1000;
        private double gradientTolerance = 1e-8;
        private double stepTolerance = 1e-8;
        private double functionTolerance = 1e-12;

        private Builder() {}

        /**
         * Sets the maximum number of iterations.
         * @param value Maximum iterations (must be positive)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }

        /**
         * Sets the gradient tolerance.
         * @param value Gradient tolerance (must be non-negative)
         * @return This builder
         */
        public Builder gradientTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Gradient tolerance must be non-negative");
            }
            this.gradientTolerance = value;
            return this;
        }

        /**
         * Sets the step tolerance.
         * @param value Step tolerance (must be non-negative)
         * @return This builder
         */
        public Builder stepTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Step tolerance must be non-negative");
            }
            this.stepTolerance = value;
            return this;
        }

        /**
         * Sets the function change tolerance.
         * @param value Function tolerance (must be non-negative)
         * @return This builder
         */
        public Builder functionTolerance(double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Function tolerance must be non-negative");
            }
            this.functionTolerance = value;
            return this;
        }

        /**
         * Builds the termination criteria.
         * @return Termination criteria
         */
        public Termination build() {
            return new Termination(this);
        }
    }

    @Override
    public String toString() {
        return "Termination{" +
                "maxIterations=" + maxIterations +
                ", gradientTolerance=" + gradientTolerance +
                ", stepTolerance=" + stepTolerance +
                ", functionTolerance=" + functionTolerance +
                '}';
    }
}
