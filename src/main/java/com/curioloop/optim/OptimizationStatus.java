/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Enumeration of optimization status codes.
 * <p>
 * Non-negative codes mean the run stopped because a tolerance was met (or, for
 * simulated annealing, because its fixed budget completed); negative codes are
 * failures.
 * </p>
 */
public enum OptimizationStatus {

    /** Gradient norm fell below the gradient tolerance */
    GRADIENT_TOLERANCE_REACHED(0, "Gradient tolerance satisfied"),

    /** Last step fell below the step tolerance */
    STEP_TOLERANCE_REACHED(1, "Step tolerance satisfied"),

    /** Objective change fell below the function tolerance */
    FUNCTION_TOLERANCE_REACHED(2, "Function tolerance satisfied"),

    /** Fixed-budget method ran all of its iterations */
    BUDGET_COMPLETED(3, "Iteration budget completed"),

    /** Maximum iterations reached */
    MAX_ITERATIONS_REACHED(-1, "Maximum iterations reached"),

    /** Line search failed */
    LINE_SEARCH_FAILED(-2, "Line search failed"),

    /** Hessian stayed indefinite after every regularization attempt */
    REGULARIZATION_FAILED(-3, "Hessian regularization failed"),

    /** Trust radius shrank below its floor */
    TRUST_REGION_COLLAPSED(-4, "Trust region radius below minimum"),

    /** NaN or infinity appeared in the iterate, objective or gradient */
    NUMERICAL_INSTABILITY(-5, "Numerical instability"),

    /** Invalid argument provided */
    INVALID_ARGUMENT(-6, "Invalid argument");

    private final int code;
    private final String message;

    OptimizationStatus(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Gets the numeric status code.
     * @return Status code
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the status message.
     * @return Status message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Checks if this status indicates successful convergence.
     * @return true if converged
     */
    public boolean isConverged() {
        return code >= 0;
    }

    /**
     * Gets the status from a numeric code.
     * @param code Numeric status code
     * @return Corresponding status enum
     * @throws IllegalArgumentException if no status carries the code
     */
    public static OptimizationStatus fromCode(int code) {
        for (OptimizationStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + code);
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
