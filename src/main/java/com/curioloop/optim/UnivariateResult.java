/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Result of a one-dimensional minimization.
 *
 * @see BrentOptimizer
 */
public final class UnivariateResult {

    private final double point;
    private final double functionValue;
    private final int iterations;
    private final int functionCalls;
    private final ConvergenceReason reason;

    public UnivariateResult(double point, double functionValue, int iterations, int functionCalls,
                            ConvergenceReason reason) {
        this.point = point;
        this.functionValue = functionValue;
        this.iterations = iterations;
        this.functionCalls = functionCalls;
        this.reason = reason;
    }

    /**
     * Gets the best abscissa found.
     * @return Minimizer estimate
     */
    public double getPoint() {
        return point;
    }

    public double getFunctionValue() {
        return functionValue;
    }

    public int getIterations() {
        return iterations;
    }

    public int getFunctionCalls() {
        return functionCalls;
    }

    public ConvergenceReason getReason() {
        return reason;
    }

    public OptimizationStatus getStatus() {
        return reason.getStatus();
    }

    public boolean isConverged() {
        return reason.isConverged();
    }

    public String getMessage() {
        return reason.getMessage();
    }

    @Override
    public String toString() {
        return "UnivariateResult{" +
                "status=" + reason.getStatus() +
                ", message='" + reason.getMessage() + '\'' +
                ", point=" + point +
                ", functionValue=" + functionValue +
                ", iterations=" + iterations +
                ", functionCalls=" + functionCalls +
                '}';
    }
}
