/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

/**
 * Outcome of a {@link LineSearch}.
 */
public final class LineSearchResult {

    private final double alpha;
    private final double functionValue;
    private final double[] gradient;
    private final int functionCalls;
    private final int gradientCalls;
    private final boolean success;

    /**
     * Creates a line search result.
     * @param alpha Step length
     * @param functionValue f(x + α·d)
     * @param gradient ∇f(x + α·d), or {@code null} if the search did not evaluate it
     * @param functionCalls Objective evaluations spent
     * @param gradientCalls Gradient evaluations spent
     * @param success Whether the acceptance conditions hold at {@code alpha}
     */
    public LineSearchResult(double alpha, double functionValue, double[] gradient,
                            int functionCalls, int gradientCalls, boolean success) {
        this.alpha = alpha;
        this.functionValue = functionValue;
        this.gradient = gradient;
        this.functionCalls = functionCalls;
        this.gradientCalls = gradientCalls;
        this.success = success;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getFunctionValue() {
        return functionValue;
    }

    /**
     * Gets the gradient at the accepted point so callers can skip re-evaluating it.
     * @return Gradient, or {@code null} when not computed
     */
    public double[] getGradient() {
        return gradient;
    }

    public int getFunctionCalls() {
        return functionCalls;
    }

    public int getGradientCalls() {
        return gradientCalls;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return "LineSearchResult{" +
                "alpha=" + alpha +
                ", functionValue=" + functionValue +
                ", functionCalls=" + functionCalls +
                ", gradientCalls=" + gradientCalls +
                ", success=" + success +
                '}';
    }
}
