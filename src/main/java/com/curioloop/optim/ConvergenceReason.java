/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import java.util.Locale;

/**
 * Why a solver stopped, together with the measurement that triggered it.
 * <p>
 * The tolerance reasons are only ever produced by {@link #check}, which
 * tests the criteria in a fixed priority order:
 * gradient, step, function change, iteration cap. Failures such as a line
 * search that cannot make progress are produced by the solvers themselves.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, k, termination);
 * if (reason != null) {
 *     return new OptimizationResult(x, fx, gx, k, functionCalls, gradientCalls, reason);
 * }
 * }</pre>
 */
public final class ConvergenceReason {

    private final OptimizationStatus status;
    private final double value;
    private final String message;

    private ConvergenceReason(OptimizationStatus status, double value, String message) {
        this.status = status;
        this.value = value;
        this.message = message;
    }

    /**
     * Tests the termination criteria in priority order.
     * <p>
     * Pass {@link Double#POSITIVE_INFINITY} for a measurement that is not
     * available yet, e.g. the step and function change before the first iteration.
     * </p>
     * @param gradientNorm Gradient norm at the current iterate
     * @param stepNorm Norm of the last step
     * @param functionChange Absolute change of the objective over the last step
     * @param iteration Number of completed iterations
     * @param termination Criteria to test against
     * @return First matching reason, or {@code null} when the run should continue
     */
    public static ConvergenceReason check(double gradientNorm, double stepNorm, double functionChange,
                                          int iteration, Termination termination) {
        if (gradientNorm < termination.getGradientTolerance()) {
            return gradient(gradientNorm);
        }
        if (stepNorm < termination.getStepTolerance()) {
            return step(stepNorm);
        }
        if (functionChange < termination.getFunctionTolerance()) {
            return function(functionChange);
        }
        if (iteration >= termination.getMaxIterations()) {
            return maxIterations(iteration);
        }
        return null;
    }

    public static ConvergenceReason gradient(double gradientNorm) {
        return new ConvergenceReason(OptimizationStatus.GRADIENT_TOLERANCE_REACHED, gradientNorm,
                format("Converged: gradient norm %.2e below tolerance", gradientNorm));
    }

    public static ConvergenceReason step(double stepNorm) {
        return new ConvergenceReason(OptimizationStatus.STEP_TOLERANCE_REACHED, stepNorm,
                format("Converged: step size %.2e below tolerance", stepNorm));
    }

    public static ConvergenceReason function(double functionChange) {
        return new ConvergenceReason(OptimizationStatus.FUNCTION_TOLERANCE_REACHED, functionChange,
                format("Converged: function change %.2e below tolerance", functionChange));
    }

    public static ConvergenceReason maxIterations(int iterations) {
        return new ConvergenceReason(OptimizationStatus.MAX_ITERATIONS_REACHED, iterations,
                "Stopped: reached maximum iterations (" + iterations + ")");
    }

    /**
     * Creates a line-search failure.
     * @param detail What could not be satisfied
     * @return Failure reason
     */
    public static ConvergenceReason lineSearchFailed(String detail) {
        return new ConvergenceReason(OptimizationStatus.LINE_SEARCH_FAILED, Double.NaN,
                "Stopped: line search failed (" + detail + ")");
    }

    public static ConvergenceReason regularizationFailed() {
        return new ConvergenceReason(OptimizationStatus.REGULARIZATION_FAILED, Double.NaN,
                "Stopped: Hessian regularization failed, cannot find descent direction");
    }

    public static ConvergenceReason trustRegionCollapsed(double radius) {
        return new ConvergenceReason(OptimizationStatus.TRUST_REGION_COLLAPSED, radius,
                format("Stopped: trust region radius %.2e below minimum", radius));
    }

    public static ConvergenceReason numericalInstability() {
        return new ConvergenceReason(OptimizationStatus.NUMERICAL_INSTABILITY, Double.NaN,
                "Stopped: numerical instability (NaN or infinity detected)");
    }

    /**
     * Creates the reason for a rejected input.
     * @param detail Explanation shown to the caller
     * @return Failure reason
     */
    public static ConvergenceReason invalidArgument(String detail) {
        return new ConvergenceReason(OptimizationStatus.INVALID_ARGUMENT, Double.NaN,
                "Invalid argument: " + detail);
    }

    /**
     * Creates a converged reason with a method-specific message, used where the
     * solver measures a gradient-like quantity of its own (projected gradient,
     * KKT residual, bracket width).
     * @param status Converged status
     * @param value Measured quantity
     * @param message Canonical message
     * @return Reason
     */
    static ConvergenceReason of(OptimizationStatus status, double value, String message) {
        return new ConvergenceReason(status, value, message);
    }

    /**
     * Gets the status kind.
     * @return Status
     */
    public OptimizationStatus getStatus() {
        return status;
    }

    /**
     * Gets the measurement that triggered this reason.
     * @return Norm, change or iteration count; NaN for failures without a measurement
     */
    public double getValue() {
        return value;
    }

    /**
     * Gets the canonical message.
     * @return Short human-readable reason
     */
    public String getMessage() {
        return message;
    }

    public boolean isConverged() {
        return status.isConverged();
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }

    @Override
    public String toString() {
        return status.name() + ": " + message;
    }
}
