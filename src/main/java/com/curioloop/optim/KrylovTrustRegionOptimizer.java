/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToDoubleFunction;

/**
 * Hessian-free trust-region optimizer using Steihaug-Toint truncated CG.
 * <p>
 * The subproblem is solved by conjugate gradients on the quadratic model, where
 * every Hessian-vector product is approximated from one extra gradient
 * evaluation. CG stops at the boundary on negative curvature or when the step
 * would leave the region, and otherwise once the residual falls below
 * {@code cgTolerance·‖g‖}. No n×n matrix is ever formed.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * OptimizationResult result = KrylovTrustRegionOptimizer.builder()
 *     .objective(f)
 *     .gradient(grad)
 *     .build()
 *     .optimize(x0);
 * }</pre>
 *
 * @see NewtonTrustRegionOptimizer
 */
public final class KrylovTrustRegionOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(KrylovTrustRegionOptimizer.class);

    private static final double MIN_CURVATURE = 1e-15;

    private final Objective objective;
    private final Termination termination;
    private final double initialRadius;
    private final double maxRadius;
    private final double eta;
    private final double rhoLower;
    private final double rhoUpper;
    private final double cgTolerance;

    private KrylovTrustRegionOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, null, builder.numericalGradient);
        this.termination = builder.termination;
        this.initialRadius = builder.initialRadius;
        this.maxRadius = builder.maxRadius;
        this.eta = builder.eta;
        this.rhoLower = builder.rhoLower;
        this.rhoUpper = builder.rhoUpper;
        this.cgTolerance = builder.cgTolerance;
    }

    /**
     * Creates a new builder for the Krylov trust-region optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimizes a function with default settings.
     * @param objective Objective function
     * @param gradient Gradient function, or {@code null} for forward differences
     * @param initialPoint Initial guess
     * @return Optimization result
     */
    public static OptimizationResult minimize(ToDoubleFunction<double[]> objective, GradientFunction gradient,
                                              double[] initialPoint) {
        return builder().objective(objective).gradient(gradient).build().optimize(initialPoint);
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

        double radius = initialRadius;

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            SubproblemSolution cg = steihaug(objective, x, gx, radius, cgTolerance);
            gradientCalls += cg.gradientCalls;
            double[] s = cg.step;

            double[] xNew = Vectors.add(x, s);
            double fNew = objective.value(xNew);
            functionCalls++;

            double actual = fx - fNew;
            double predicted = -cg.modelChange;
            double rho = predicted > 0 && Double.isFinite(fNew) ? actual / predicted : 0.0;

            double sNorm = Vectors.norm(s);
            boolean interior = sNorm < 0.9 * radius;
            if (rho < rhoLower) {
                radius *= 0.25;
            } else if (rho > rhoUpper && !interior) {
                radius = Math.min(2.0 * radius, maxRadius);
            }

            LOGGER.debug("Krylov iteration {}: f={}, rho={}, radius={}, cg={}",
                    iteration, fx, rho, radius, cg.iterations);

            if (rho > eta) {
                double[] gNew = objective.gradient(xNew);
                gradientCalls++;
                if (!Vectors.isFinite(gNew)) {
                    return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                            ConvergenceReason.numericalInstability());
                }
                double funcChange = Math.abs(actual);
                x = xNew;
                fx = fNew;
                gx = gNew;
                gradNorm = Vectors.normInf(gx);

                ConvergenceReason reason = ConvergenceReason.check(gradNorm, sNorm, funcChange, iteration, termination);
                if (reason != null) {
                    return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
                }
            } else if (radius < NewtonTrustRegionOptimizer.MIN_RADIUS) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.trustRegionCollapsed(radius));
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    /**
     * Steihaug-Toint conjugate gradient on {@code m(s) = gᵀs + ½sᵀHs}, {@code ‖s‖ ≤ radius}.
     */
    static SubproblemSolution steihaug(Objective objective, double[] x, double[] gx,
                                       double radius, double tolerance) {
        int n = x.length;
        double[] z = new double[n];
        double[] r = gx.clone();
        double[] d = Vectors.negate(r);
        double rr0 = Vectors.dot(r, r);
        double rrPrev = rr0;
        int gradientCalls = 0;
        int iterations = 0;
        boolean onBoundary = false;

        for (int i = 0; i < n && rr0 > 0; i++) {
            double[] hd = objective.hessianVector(x, d, gx);
            gradientCalls++;
            iterations++;
            double dHd = Vectors.dot(d, hd);
            if (Math.abs(dHd) < MIN_CURVATURE) {
                break;
            }

            double alpha = rrPrev / dHd;
            double[] next = Vectors.addScaled(z, d, alpha);
            if (dHd < 0 || Vectors.dot(next, next) >= radius * radius) {
                z = Vectors.addScaled(z, d, boundaryTau(z, d, radius));
                onBoundary = true;
                break;
            }
            z = next;
            r = Vectors.addScaled(r, hd, alpha);

            double rrNext = Vectors.dot(r, r);
            if (rrNext / rr0 < tolerance * tolerance) {
                break;
            }
            double beta = rrNext / rrPrev;
            d = Vectors.addScaled(Vectors.negate(r), d, beta);
            rrPrev = rrNext;
        }

        double[] hz = objective.hessianVector(x, z, gx);
        gradientCalls++;
        double modelChange = Vectors.dot(gx, z) + 0.5 * Vectors.dot(z, hz);
        return new SubproblemSolution(z, modelChange, iterations, gradientCalls, onBoundary);
    }

    /** Positive root τ of {@code ‖z + τd‖ = radius}. */
    private static double boundaryTau(double[] z, double[] d, double radius) {
        double a = Vectors.dot(d, d);
        double b = 2.0 * Vectors.dot(z, d);
        double c = Vectors.dot(z, z) - radius * radius;
        double disc = b * b - 4.0 * a * c;
        return (-b + Math.sqrt(Math.max(0.0, disc))) / (2.0 * a);
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("Krylov trust region stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    static final class SubproblemSolution {
        final double[] step;
        final double modelChange;
        final int iterations;
        final int gradientCalls;
        final boolean onBoundary;

        SubproblemSolution(double[] step, double modelChange, int iterations, int gradientCalls, boolean onBoundary) {
            this.step = step;
            this.modelChange = modelChange;
            this.iterations = iterations;
            this.gradientCalls = gradientCalls;
            this.onBoundary = onBoundary;
        }
    }

    /**
     * Builder for Krylov trust-region optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private Termination termination = Termination.defaults();
        private double initialRadius = 1.0;
        private double maxRadius = 100.0;
        private double eta = 0.1;
        private double rhoLower = 0.25;
        private double rhoUpper = 0.75;
        private double cgTolerance = 0.01;

        private Builder() {}

        public Builder objective(ToDoubleFunction<double[]> objective) {
            this.objective = objective;
            return this;
        }

        public Builder gradient(GradientFunction gradient) {
            this.gradient = gradient;
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

        public Builder initialRadius(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Initial radius must be positive");
            }
            this.initialRadius = value;
            return this;
        }

        public Builder maxRadius(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Maximum radius must be positive");
            }
            this.maxRadius = value;
            return this;
        }

        public Builder eta(double value) {
            if (!(value >= 0 && value < 1)) {
                throw new IllegalArgumentException("eta must be in [0, 1)");
            }
            this.eta = value;
            return this;
        }

        /**
         * Sets the reduction-ratio thresholds for shrinking and expanding the radius.
         * @param lower Shrink below this ratio (default 0.25)
         * @param upper Expand above this ratio (default 0.75)
         * @return This builder
         */
        public Builder ratioThresholds(double lower, double upper) {
            if (!(lower > 0 && lower < upper && upper < 1)) {
                throw new IllegalArgumentException("Ratio thresholds must satisfy 0 < lower < upper < 1");
            }
            this.rhoLower = lower;
            this.rhoUpper = upper;
            return this;
        }

        /**
         * Sets the relative residual tolerance of the inner CG.
         * @param value Tolerance (must be positive, default 0.01)
         * @return This builder
         */
        public Builder cgTolerance(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("CG tolerance must be positive");
            }
            this.cgTolerance = value;
            return this;
        }

        public KrylovTrustRegionOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            if (initialRadius > maxRadius) {
                throw new IllegalArgumentException("Initial radius cannot exceed maximum radius");
            }
            return new KrylovTrustRegionOptimizer(this);
        }
    }
}
