/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import java.util.Arrays;

/**
 * Result of an optimization run.
 * <p>
 * Callers should inspect {@link #isConverged()} before trusting the solution.
 * </p>
 */
public final class OptimizationResult {

    private final double[] solution;
    private final double functionValue;
    private final double[] gradient;
    private final int iterations;
    private final int functionCalls;
    private final int gradientCalls;
    private final ConvergenceReason reason;

    /**
     * Creates an optimization result.
     * @param solution Final iterate
     * @param functionValue Objective value at the final iterate
     * @param gradient Gradient at the final iterate, or {@code null} for derivative-free methods
     * @param iterations Number of outer iterations
     * @param functionCalls Number of objective evaluations
     * @param gradientCalls Number of gradient evaluations
     * @param reason Why the run stopped
     */
    public OptimizationResult(double[] solution, double functionValue, double[] gradient,
                              int iterations, int functionCalls, int gradientCalls,
                              ConvergenceReason reason) {
        this.solution = solution != null ? solution.clone() : new double[0];
        this.functionValue = functionValue;
        this.gradient = gradient != null ? gradient.clone() : null;
        this.iterations = iterations;
        this.functionCalls = functionCalls;
        this.gradientCalls = gradientCalls;
        this.reason = reason;
    }

    /**
     * Gets the solution vector.
     * @return Copy of solution vector
     */
    public double[] getSolution() {
        return solution.clone();
    }

    /**
     * Gets the function value at the solution.
     * @return Function value
     */
    public double getFunctionValue() {
        return functionValue;
    }

    /**
     * Gets the gradient at the solution.
     * @return Copy of the gradient, or {@code null} if the method does not use gradients
     */
    public double[] getGradient() {
        return gradient != null ? gradient.clone() : null;
    }

    /**
     * Checks whether a gradient is reported.
     * @return true if {@link #getGradient()} is non-null
     */
    public boolean hasGradient() {
        return gradient != null;
    }

    /**
     * Gets the number of iterations performed.
     * @return Iteration count
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Gets the number of objective evaluations.
     * @return Function call count
     */
    public int getFunctionCalls() {
        return functionCalls;
    }

    /**
     * Gets the number of gradient evaluations.
     * @return Gradient call count
     */
    public int getGradientCalls() {
        return gradientCalls;
    }

    /**
     * Gets the termination reason.
     * @return Reason
     */
    public ConvergenceReason getReason() {
        return reason;
    }

    /**
     * Gets the optimization status.
     * @return Status
     */
    public OptimizationStatus getStatus() {
        return reason.getStatus();
    }

    /**
     * Checks if the optimization converged successfully.
     * @return true if a tolerance caused termination
     */
    public boolean isConverged() {
        return reason.isConverged();
    }

    /**
     * Gets the human-readable termination message.
     * @return Message
     */
    public String getMessage() {
        return reason.getMessage();
    }

    /**
     * Gets the dimension of the solution.
     * @return Solution dimension
     */
    public int getDimension() {
        return solution.length;
    }

    @Override
    public String toString() {
        return "OptimizationResult{" +
                "status=" + reason.getStatus() +
                ", message='" + reason.getMessage() + '\'' +
                ", functionValue=" + functionValue +
                ", iterations=" + iterations +
                ", functionCalls=" + functionCalls +
                ", gradientCalls=" + gradientCalls +
                ", solution=" + Arrays.toString(solution) +
                '}';
    }
}
