/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Single entry point for unconstrained minimization.
 * <p>
 * Without an explicit {@link Method}, Nelder-Mead is used when no gradient is
 * given and BFGS otherwise. An explicit method always wins; gradient-based
 * methods then fall back to finite differences when no gradient is given.
 * Only the termination, gradient and Hessian are forwarded; every other
 * setting is the method's default.
 * </p>
 *
 * <pre>{@code
 * OptimizationResult r1 = Minimizer.minimize(f, x0);                  // Nelder-Mead
 * OptimizationResult r2 = Minimizer.minimize(f, grad, x0);            // BFGS
 * OptimizationResult r3 = Minimizer.builder()
 *     .objective(f).gradient(grad)
 *     .method(Minimizer.Method.LBFGS)
 *     .termination(Termination.builder().maxIterations(200).build())
 *     .build()
 *     .optimize(x0);
 * }</pre>
 */
public final class Minimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Minimizer.class);

    /**
     * Unconstrained methods available through the dispatcher.
     */
    public enum Method {
        NELDER_MEAD,
        GRADIENT_DESCENT,
        BFGS,
        LBFGS,
        CONJUGATE_GRADIENT,
        NEWTON,
        NEWTON_TRUST_REGION,
        KRYLOV_TRUST_REGION
    }

    private final ToDoubleFunction<double[]> objective;
    private final GradientFunction gradient;
    private final HessianFunction hessian;
    private final Method method;
    private final Termination termination;

    private Minimizer(Builder builder) {
        this.objective = builder.objective;
        this.gradient = builder.gradient;
        this.hessian = builder.hessian;
        this.method = builder.method != null ? builder.method
                : builder.gradient != null ? Method.BFGS : Method.NELDER_MEAD;
        this.termination = builder.termination;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes without derivatives (Nelder-Mead).
     * @param objective Objective function
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, double[] initialPoint) {
        return builder().objective(objective).build().optimize(initialPoint);
    }

    /**
     * Minimizes with a gradient (BFGS), or without one (Nelder-Mead) when {@code gradient} is null.
     * @param objective Objective function
     * @param gradient Gradient function, may be null
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).build().optimize(initialPoint);
    }

    /**
     * Minimizes with an explicitly chosen method.
     * @param method Method
     * @param objective Objective function
     * @param gradient Gradient function, may be null
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(Method method, ToDoubleFunction<double[]> objective,
                                              GradientFunction gradient, double[] initialPoint) {
        return builder().method(method).objective(objective).gradient(gradient).build().optimize(initialPoint);
    }

    /**
     * Gets the method this minimizer dispatches to.
     * @return Resolved method
     */
    public Method getMethod() {
        return method;
    }

    public OptimizationResult optimize(double[] initialPoint) {
        LOGGER.debug("Dispatching to {}", method);
        switch (method) {
            case NELDER_MEAD:
                return NelderMeadOptimizer.builder().objective(objective).termination(termination)
                        .build().optimize(initialPoint);
            case GRADIENT_DESCENT:
                return GradientDescentOptimizer.builder().objective(objective).gradient(gradient)
                        .termination(termination).build().optimize(initialPoint);
            case LBFGS:
                return LbfgsOptimizer.builder().objective(objective).gradient(gradient)
                        .termination(termination).build().optimize(initialPoint);
            case CONJUGATE_GRADIENT:
                return ConjugateGradientOptimizer.builder().objective(objective).gradient(gradient)
                        .termination(termination).build().optimize(initialPoint);
            case NEWTON:
                return NewtonOptimizer.builder().objective(objective).gradient(gradient).hessian(hessian)
                        .termination(termination).build().optimize(initialPoint);
            case NEWTON_TRUST_REGION:
                return NewtonTrustRegionOptimizer.builder().objective(objective).gradient(gradient).hessian(hessian)
                        .termination(termination).build().optimize(initialPoint);
            case KRYLOV_TRUST_REGION:
                return KrylovTrustRegionOptimizer.builder().objective(objective).gradient(gradient)
                        .termination(termination).build().optimize(initialPoint);
            case BFGS:
            default:
                return BfgsOptimizer.builder().objective(objective).gradient(gradient)
                        .termination(termination).build().optimize(initialPoint);
        }
    }

    /**
     * Builder for the dispatcher.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private HessianFunction hessian;
        private Method method;
        private Termination termination = Termination.defaults();

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
            return this;
        }

        /**
         * Sets the Hessian, used by the Newton methods only.
         * @param hessian Hessian function, may be null
         * @return This builder
         */
        public Builder hessian(HessianFunction hessian) {
            this.hessian = hessian;
            return this;
        }

        /**
         * Forces a method. Null restores automatic selection.
         * @param method Method, may be null
         * @return This builder
         */
        public Builder method(Method method) {
            this.method = method;
            return this;
        }

        public Builder termination(Termination termination) {
            if (termination == null) {
                throw new IllegalArgumentException("Termination cannot be null");
            }
            this.termination = termination;
            return this;
        }

        public Minimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new Minimizer(this);
        }
    }
}
