/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Cholesky;
import com.curioloop.optim.linalg.Matrices;
import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Newton trust-region optimizer with the dogleg subproblem solver.
 * <p>
 * The quadratic model {@code m(p) = f + gᵀp + ½pᵀHp} is minimized approximately
 * inside {@code ‖p‖ ≤ Δ} along the dogleg path from the Cauchy point to the
 * Newton point. The step is accepted when the ratio of actual to predicted
 * reduction exceeds {@code eta}. The radius is shrunk to a quarter of the step
 * length when the ratio is below ¼ and doubled (up to {@code maxDelta}) when it
 * is above ¾ and the step reached the boundary.
 * </p>
 *
 * @see KrylovTrustRegionOptimizer
 */
public final class NewtonTrustRegionOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NewtonTrustRegionOptimizer.class);

    static final double MIN_RADIUS = 1e-15;

    private final Objective objective;
    private final Termination termination;
    private final double initialDelta;
    private final double maxDelta;
    private final double eta;

    private NewtonTrustRegionOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, builder.hessian, builder.numericalGradient);
        this.termination = builder.termination;
        this.initialDelta = builder.initialDelta;
        this.maxDelta = builder.maxDelta;
        this.eta = builder.eta;
    }

    /**
     * Creates a new builder for the Newton trust-region optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default settings.
     * @param objective Objective function
     * @param gradient Gradient function, or {@code null} for forward differences
     * @param hessian Hessian function, or {@code null} for central differences
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              HessianFunction hessian, double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).hessian(hessian).build().optimize(initialPoint);
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
            return finish(initialPoint.clone(), Double.NaN, null, 0, 0, 0,
                    ConvergenceReason.invalidArgument("initial point must be finite"));
        }
        double[] x = initialPoint.clone();
        double fx = objective.value(x);
        double[] gx = objective.gradient(x);
        int functionCalls = 1;
        int gradientCalls = 1;

        String mismatch = Objective.checkGradient(x, gx);
        if (mismatch != null) {
            return finish(x, fx, null, 0, functionCalls, gradientCalls, ConvergenceReason.invalidArgument(mismatch));
        }
        if (!Double.isFinite(fx) || !Vectors.isFinite(gx)) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, ConvergenceReason.numericalInstability());
        }

        double gradNorm = Vectors.normInf(gx);
        ConvergenceReason initial = ConvergenceReason.check(
                gradNorm, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0, termination);
        if (initial != null && initial.isConverged()) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, initial);
        }

        double delta = initialDelta;

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            double[][] h = objective.hessian(x);
            if (!Matrices.isFinite(h)) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.numericalInstability());
            }

            double[] p = doglegStep(gx, h, delta);
            double[] xTrial = Vectors.add(x, p);
            double fTrial = objective.value(xTrial);
            functionCalls++;

            double predicted = -(Vectors.dot(gx, p) + 0.5 * Matrices.quadraticForm(h, p));
            double actual = fx - fTrial;
            double rho = predicted > 0 && Double.isFinite(fTrial) ? actual / predicted : 0.0;

            double pNorm = Vectors.norm(p);
            if (rho < 0.25) {
                delta = 0.25 * pNorm;
            } else if (rho > 0.75 && pNorm >= 0.99 * delta) {
                delta = Math.min(2.0 * delta, maxDelta);
            }

            LOGGER.debug("Trust region iteration {}: f={}, rho={}, delta={}", iteration, fx, rho, delta);

            if (rho > eta) {
                double[] gNew = objective.gradient(xTrial);
                gradientCalls++;
                if (!Vectors.isFinite(gNew)) {
                    return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                            ConvergenceReason.numericalInstability());
                }

                double stepNorm = Vectors.normInf(p);
                double funcChange = Math.abs(actual);
                gradNorm = Vectors.normInf(gNew);

                x = xTrial;
                fx = fTrial;
                gx = gNew;

                ConvergenceReason reason = ConvergenceReason.check(gradNorm, stepNorm, funcChange, iteration, termination);
                if (reason != null) {
                    return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
                }
            } else if (delta < MIN_RADIUS) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.trustRegionCollapsed(delta));
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    /**
     * Approximately minimizes the quadratic model inside the trust region.
     * @param g Gradient
     * @param h Hessian
     * @param delta Trust region radius
     * @return Step with {@code ‖p‖ ≤ delta}
     */
    static double[] doglegStep(double[] g, double[][] h, double delta) {
        int n = g.length;
        double gNormSq = Vectors.dot(g, g);
        if (gNormSq == 0) {
            return new double[n];
        }

        double gHg = Matrices.quadraticForm(h, g);
        if (gHg <= 0) {
            // Non-positive curvature along -g: go straight to the boundary
            return Vectors.scale(g, -delta / Math.sqrt(gNormSq));
        }

        double[] pC = Vectors.scale(g, -gNormSq / gHg);
        double pCNorm = Vectors.norm(pC);
        if (pCNorm >= delta) {
            return Vectors.scale(pC, delta / pCNorm);
        }

        Cholesky chol = Cholesky.decompose(h);
        if (chol == null) {
            return pC;
        }
        double[] pN = chol.solve(Vectors.negate(g));
        if (Vectors.norm(pN) <= delta) {
            return pN;
        }

        // ‖pC + τ(pN − pC)‖ = Δ
        double[] diff = Vectors.subtract(pN, pC);
        double a = Vectors.dot(diff, diff);
        double b = 2.0 * Vectors.dot(pC, diff);
        double c = Vectors.dot(pC, pC) - delta * delta;
        double disc = b * b - 4.0 * a * c;
        if (disc < 0 || a <= 0) {
            return pC;
        }
        double tau = (-b + Math.sqrt(disc)) / (2.0 * a);
        tau = Math.max(0.0, Math.min(1.0, tau));
        return Vectors.addScaled(pC, diff, tau);
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("Newton trust region stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /**
     * Builder for Newton trust-region optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private HessianFunction hessian;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private double initialDelta = 1.0;
        private double maxDelta = 100.0;
        private double eta = 0.1;

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
            return this;
        }

        public Builder hessian(HessianFunction hessian) {
            this.hessian = hessian;
            return this;
        }

        public Builder numericalGradient(NumericalGradient method) {
            if (method == null) {
                throw new IllegalArgumentException("Numerical gradient method cannot be null");
            }
            this.numericalGradient = method;
            return this;
        }

        public Builder termination(Termination termination) {
            if (termination == null) {
                throw new IllegalArgumentException("Termination cannot be null");
            }
            this.termination = termination;
            return this;
        }

        /**
         * Sets the initial trust region radius.
         * @param value Radius (must be positive, default 1)
         * @return This builder
         */
        public Builder initialDelta(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Initial radius must be positive");
            }
            this.initialDelta = value;
            return this;
        }

        /**
         * Sets the radius cap.
         * @param value Maximum radius (must be positive, default 100)
         * @return This builder
         */
        public Builder maxDelta(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Maximum radius must be positive");
            }
            this.maxDelta = value;
            return this;
        }

        /**
         * Sets the acceptance threshold on the reduction ratio.
         * @param value Threshold in [0, 0.25)
         * @return This builder
         */
        public Builder eta(double value) {
            if (!(value >= 0 && value < 0.25)) {
                throw new IllegalArgumentException("eta must be in [0, 0.25)");
            }
            this.eta = value;
            return this;
        }

        public NewtonTrustRegionOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            if (initialDelta > maxDelta) {
                throw new IllegalArgumentException("Initial radius cannot exceed maximum radius");
            }
            return new NewtonTrustRegionOptimizer(this);
        }
    }
}
