/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Cholesky;
import com.curioloop.optim.linalg.Matrices;
import com.curioloop.optim.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Primal-dual interior-point Newton method.
 * <p>
 * Handles box bounds {@code l ≤ x ≤ u} and general constraints
 * {@code l_c ≤ c(x) ≤ u_c}. Rows with equal bounds are equalities with their own
 * multipliers; each finite side of the remaining rows is an inequality
 * {@code s = σ·(value − bound) ≥ 0} with σ = +1 for a lower and −1 for an
 * upper side, carrying a dual λ ≥ 0.
 * </p>
 *
 * <h2>Iteration</h2>
 * <ol>
 *   <li>Solve the condensed system {@code (H + J_Iᵀ·diag(λ/s)·J_I)·Δx = −g̃}, eliminating
 *       equality multipliers through their Schur complement.</li>
 *   <li>Limit primal and dual steps by the fraction-to-boundary rule (τ = 0.995).</li>
 *   <li>Halve the primal step until the merit {@code f − μ·Σ log s + penalty·Σ|c_eq|} decreases.</li>
 *   <li>Update μ by Mehrotra's rule {@code σ = (μ_aff/μ)³}, never letting it grow.</li>
 * </ol>
 * <p>
 * The Hessian is that of the objective only, so curvature of nonlinear
 * constraints is not modelled.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * // min x² + y²  s.t.  x + y = 1
 * OptimizationResult result = IpNewtonOptimizer.builder()
 *     .objective(x -> x[0] * x[0] + x[1] * x[1])
 *     .gradient(x -> new double[]{2 * x[0], 2 * x[1]})
 *     .hessian(x -> new double[][]{{2, 0}, {0, 2}})
 *     .constraints(NonlinearConstraints.equalTo(
 *         x -> new double[]{x[0] + x[1]}, x -> new double[][]{{1, 1}}, new double[]{1}))
 *     .build()
 *     .optimize(new double[]{0, 0});
 * }</pre>
 */
public final class IpNewtonOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(IpNewtonOptimizer.class);

    private static final double SLACK_FLOOR = 1e-10;
    private static final double DIVISION_FLOOR = 1e-20;
    private static final double INITIAL_MARGIN = 0.01;
    private static final double BOX_MARGIN = 1e-14;
    private static final double FRACTION_TO_BOUNDARY = 0.995;
    private static final int MAX_BACKTRACKS = 40;
    private static final double MERIT_SLACK = 1e-8;
    private static final double MU_CONVERGED = 1e-4;
    private static final double MU_FLOOR = 1e-20;
    private static final double LAMBDA_MIN = 1e-20;
    private static final double LAMBDA_MAX = 1e12;

    private final Objective objective;
    private final double[] lower;
    private final double[] upper;
    private final NonlinearConstraints constraints;
    private final Termination termination;
    private final Double mu0;
    private final Double kktTolerance;

    private IpNewtonOptimizer(Builder builder) {
        this.objective = Objective.of(builder.objective, builder.gradient, builder.hessian, builder.numericalGradient);
        this.lower = builder.lower;
        this.upper = builder.upper;
        this.constraints = builder.constraints;
        this.termination = builder.termination;
        this.mu0 = builder.mu0;
        this.kktTolerance = builder.kktTolerance;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the interior-point method from the given initial point.
     * <p>
     * Coordinates with finite bounds are first moved at least 1% of the box width
     * (or of {@code max(1, |bound|)} for one-sided bounds) inside. Crossed bounds
     * give an {@link OptimizationStatus#INVALID_ARGUMENT} result.
     * </p>
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
        int n = initialPoint.length;
        double[] l = lower != null ? lower : filled(n, Double.NEGATIVE_INFINITY);
        double[] u = upper != null ? upper : filled(n, Double.POSITIVE_INFINITY);

        String invalid = validate(l, u, n);
        if (invalid == null) {
            invalid = validateConstraints();
        }
        if (invalid != null) {
            double[] x0 = initialPoint.clone();
            return new OptimizationResult(x0, objective.value(x0), objective.gradient(x0), 0, 1, 1,
                    ConvergenceReason.invalidArgument(invalid));
        }

        Classification cc = Classification.of(l, u, constraints);
        int nIneq = cc.inequalityCount();
        boolean constrained = nIneq + cc.equalityCount() > 0;
        double kktTol = kktTolerance != null ? kktTolerance : termination.getGradientTolerance();

        double[] x = interiorStart(initialPoint, l, u);
        double fx = objective.value(x);
        double[] gx = objective.gradient(x);
        double[] cx = constraints != null ? constraints.values(x) : new double[0];
        double[][] jc = constraints != null ? constraints.jacobian(x, cx) : null;
        int functionCalls = 1;
        int gradientCalls = 1;

        String mismatch = Objective.checkGradient(x, gx);
        if (mismatch != null) {
            return finish(x, fx, null, 0, functionCalls, gradientCalls, ConvergenceReason.invalidArgument(mismatch));
        }
        if (constraints != null) {
            String shape = constraints.checkShape(x, cx, jc);
            if (shape != null) {
                return finish(x, fx, gx, 0, functionCalls, gradientCalls, ConvergenceReason.invalidArgument(shape));
            }
        }
        if (!Double.isFinite(fx) || !Vectors.isFinite(gx)) {
            return finish(x, fx, gx, 0, functionCalls, gradientCalls, ConvergenceReason.numericalInstability());
        }

        if (!constrained) {
            ConvergenceReason initial = ConvergenceReason.check(
                    Vectors.normInf(gx), Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0, termination);
            if (initial != null && initial.isConverged()) {
                return finish(x, fx, gx, 0, functionCalls, gradientCalls, initial);
            }
        }

        double[] slack = cc.slacks(x, cx);
        double mu = initialMu(gx, slack);
        double[] lambda = new double[nIneq];
        for (int i = 0; i < nIneq; i++) {
            lambda[i] = mu / Math.max(slack[i], 1e-14);
        }
        double[] lambdaEq = new double[cc.equalityCount()];
        double penalty = 10.0 * Math.max(Vectors.normInf(gx), 1.0);

        double[] bestX = x;
        double bestF = fx;
        double[] bestG = gx;

        for (int iteration = 1; iteration <= termination.getMaxIterations(); iteration++) {
            double[][] h = objective.hessian(x);
            Step step = solveKkt(cc, h, gx, x, cx, jc, slack, lambda, lambdaEq, mu);

            double alphaPrimal = nIneq > 0 ? maxFractionToBoundary(slack, step.dSlack) : 1.0;
            double alphaDual = nIneq > 0 ? maxFractionToBoundary(lambda, step.dLambda) : 1.0;

            double merit0 = merit(fx, slack, cc.equalityResidual(x, cx), mu, penalty);
            double alpha = alphaPrimal;
            double[] xNew = x;
            double fNew = fx;
            double[] cxNew = cx;
            for (int bt = 0; bt < MAX_BACKTRACKS; bt++) {
                xNew = Vectors.addScaled(x, step.dx, alpha);
                enforceBox(xNew, l, u);
                fNew = objective.value(xNew);
                cxNew = constraints != null ? constraints.values(xNew) : new double[0];
                functionCalls++;

                double meritNew = merit(fNew, cc.slacks(xNew, cxNew), cc.equalityResidual(xNew, cxNew), mu, penalty);
                if (Double.isFinite(meritNew) && meritNew < merit0 + MERIT_SLACK) {
                    break;
                }
                alpha *= 0.5;
            }

            if (!Double.isFinite(fNew) || !Vectors.isFinite(xNew)) {
                return finish(bestX, bestF, bestG, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.numericalInstability());
            }

            double[] xPrev = x;
            double fPrev = fx;
            x = xNew;
            fx = fNew;
            cx = cxNew;
            slack = cc.slacks(x, cx);

            for (int i = 0; i < nIneq; i++) {
                double next = lambda[i] + alphaDual * step.dLambda[i];
                lambda[i] = Math.min(Math.max(next, LAMBDA_MIN), LAMBDA_MAX);
            }
            for (int i = 0; i < lambdaEq.length; i++) {
                lambdaEq[i] += alphaDual * step.dLambdaEq[i];
            }

            gx = objective.gradient(x);
            gradientCalls++;
            if (!Vectors.isFinite(gx)) {
                return finish(bestX, bestF, bestG, iteration, functionCalls, gradientCalls,
                        ConvergenceReason.numericalInstability());
            }
            jc = constraints != null ? constraints.jacobian(x, cx) : null;
            if (fx < bestF) {
                bestX = x;
                bestF = fx;
                bestG = gx;
            }

            if (nIneq > 0) {
                double muNext = nextMu(slack, lambda, step.dSlack, step.dLambda);
                mu = Math.max(Math.min(muNext, mu), MU_FLOOR);
            }

            double stepNorm = Vectors.normInf(Vectors.subtract(x, xPrev));
            double funcChange = Math.abs(fx - fPrev);

            LOGGER.debug("IP-Newton iteration {}: f={}, mu={}, alpha={}", iteration, fx, mu, alpha);

            if (constrained) {
                double kkt = Math.max(
                        Vectors.normInf(lagrangianGradient(cc, gx, jc, lambda, lambdaEq)),
                        Vectors.normInf(cc.equalityResidual(x, cx)));
                if (kkt < kktTol && mu < MU_CONVERGED) {
                    return finish(x, fx, gx, iteration, functionCalls, gradientCalls,
                            ConvergenceReason.of(OptimizationStatus.GRADIENT_TOLERANCE_REACHED, kkt,
                                    String.format(Locale.ROOT, "Converged: KKT residual %.2e below tolerance", kkt)));
                }
            }

            double gradientMeasure = constrained ? Double.POSITIVE_INFINITY : Vectors.normInf(gx);
            ConvergenceReason reason = ConvergenceReason.check(gradientMeasure, stepNorm,
                    iteration > 1 ? funcChange : Double.POSITIVE_INFINITY, iteration, termination);
            if (reason != null) {
                return finish(x, fx, gx, iteration, functionCalls, gradientCalls, reason);
            }
        }

        int maxIterations = termination.getMaxIterations();
        return finish(x, fx, gx, maxIterations, functionCalls, gradientCalls,
                ConvergenceReason.maxIterations(maxIterations));
    }

    private double initialMu(double[] gx, double[] slack) {
        if (mu0 != null) {
            return mu0;
        }
        if (slack.length == 0) {
            return 0.0;
        }
        double barrierNorm = 0.0;
        for (double s : slack) {
            barrierNorm += 1.0 / Math.max(s, 1e-14);
        }
        double mu = barrierNorm > 0 ? 0.001 * Vectors.norm1(gx) / barrierNorm : 1e-4;
        return Math.min(Math.max(mu, 1e-10), 1.0);
    }

    /**
     * Solves the condensed primal-dual system for one Newton step.
     */
    static Step solveKkt(Classification cc, double[][] h, double[] gx, double[] x, double[] cx, double[][] jc,
                         double[] slack, double[] lambda, double[] lambdaEq, double mu) {
        int n = x.length;
        int nIneq = cc.inequalityCount();
        int nEq = cc.equalityCount();
        double[][] ji = cc.inequalityJacobian(n, jc);

        double[][] ht = Matrices.copy(h);
        double[] gt = gx.clone();
        if (nIneq > 0) {
            double[] correction = new double[nIneq];
            for (int k = 0; k < nIneq; k++) {
                double s = Math.max(slack[k], DIVISION_FLOOR);
                double weight = lambda[k] / s;
                correction[k] = -mu / s;
                double[] row = ji[k];
                for (int p = 0; p < n; p++) {
                    if (row[p] == 0.0) {
                        continue;
                    }
                    for (int q = 0; q < n; q++) {
                        ht[p][q] += row[p] * weight * row[q];
                    }
                }
            }
            gt = Vectors.add(gt, Matrices.multiplyTransposed(ji, correction));
        }

        double[] dx;
        double[] dLambdaEq;
        if (nEq > 0) {
            double[][] je = cc.equalityJacobian(n, jc);
            double[] gEq = cc.equalityResidual(x, cx);
            gt = Vectors.subtract(gt, Matrices.multiplyTransposed(je, lambdaEq));

            double[] v = robustSolve(ht, Vectors.negate(gt));
            double[][] y = new double[nEq][];
            for (int j = 0; j < nEq; j++) {
                y[j] = robustSolve(ht, je[j]);
            }
            double[][] schur = new double[nEq][nEq];
            double[] rhs = new double[nEq];
            for (int i = 0; i < nEq; i++) {
                for (int j = 0; j < nEq; j++) {
                    schur[i][j] = Vectors.dot(je[i], y[j]);
                }
                rhs[i] = -(gEq[i] + Vectors.dot(je[i], v));
            }
            dLambdaEq = robustSolve(schur, rhs);
            dx = v;
            for (int j = 0; j < nEq; j++) {
                dx = Vectors.addScaled(dx, y[j], dLambdaEq[j]);
            }
        } else {
            dx = robustSolve(ht, Vectors.negate(gt));
            dLambdaEq = new double[0];
        }

        double[] dSlack = new double[nIneq];
        double[] dLambda = new double[nIneq];
        for (int k = 0; k < nIneq; k++) {
            double s = Math.max(slack[k], DIVISION_FLOOR);
            dSlack[k] = Vectors.dot(ji[k], dx);
            dLambda[k] = (mu / s - lambda[k]) - (lambda[k] / s) * dSlack[k];
        }
        return new Step(dx, dLambdaEq, dSlack, dLambda);
    }

    /**
     * Cholesky solve with diagonal regularization; falls back to the scaled
     * right-hand side when every shift fails.
     */
    static double[] robustSolve(double[][] a, double[] b) {
        double[] solution = Cholesky.solveRegularized(a, b, 1e-8, 10.0, 25);
        if (solution != null) {
            return solution;
        }
        double norm = Vectors.normInf(b);
        return norm > 0 ? Vectors.scale(b, 1.0 / norm) : new double[b.length];
    }

    /**
     * Largest α ≤ 1 keeping {@code v + α·dv ≥ (1 − τ)·v}.
     */
    static double maxFractionToBoundary(double[] values, double[] steps) {
        double alpha = 1.0;
        for (int i = 0; i < values.length; i++) {
            if (steps[i] < -DIVISION_FLOOR) {
                alpha = Math.min(alpha, -FRACTION_TO_BOUNDARY * values[i] / steps[i]);
            }
        }
        return Math.max(alpha, 0.0);
    }

    /**
     * Mehrotra centering: {@code max(σ·μ, μ/10)} with {@code σ = (μ_aff/μ)³}.
     */
    static double nextMu(double[] slack, double[] lambda, double[] dSlack, double[] dLambda) {
        int m = slack.length;
        double current = 0.0;
        for (int i = 0; i < m; i++) {
            current += slack[i] * lambda[i];
        }
        current /= m;

        double alphaS = maxFractionToBoundary(slack, dSlack);
        double alphaL = maxFractionToBoundary(lambda, dLambda);
        double affine = 0.0;
        for (int i = 0; i < m; i++) {
            affine += (slack[i] + alphaS * dSlack[i]) * (lambda[i] + alphaL * dLambda[i]);
        }
        affine /= m;

        double ratio = affine / Math.max(current, 1e-25);
        double sigma = ratio * ratio * ratio;
        return Math.max(sigma * current, current / 10.0);
    }

    static double merit(double f, double[] slack, double[] eqResidual, double mu, double penalty) {
        double value = f;
        for (double s : slack) {
            if (s <= 0) {
                return Double.POSITIVE_INFINITY;
            }
            value -= mu * Math.log(s);
        }
        for (double r : eqResidual) {
            value += penalty * Math.abs(r);
        }
        return value;
    }

    /**
     * Gradient of the Lagrangian {@code ∇f − J_Iᵀλ − J_Eᵀλ_eq}.
     */
    static double[] lagrangianGradient(Classification cc, double[] gx, double[][] jc,
                                       double[] lambda, double[] lambdaEq) {
        int n = gx.length;
        double[] result = gx.clone();
        if (lambda.length > 0) {
            result = Vectors.subtract(result, Matrices.multiplyTransposed(cc.inequalityJacobian(n, jc), lambda));
        }
        if (lambdaEq.length > 0) {
            result = Vectors.subtract(result, Matrices.multiplyTransposed(cc.equalityJacobian(n, jc), lambdaEq));
        }
        return result;
    }

    private static String validate(double[] l, double[] u, int n) {
        if (l.length != n || u.length != n) {
            return "bounds dimension does not match initial point";
        }
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(l[i]) || Double.isNaN(u[i]) || l[i] > u[i]) {
                return "lower > upper";
            }
        }
        return null;
    }

    private String validateConstraints() {
        if (constraints == null) {
            return null;
        }
        for (int i = 0; i < constraints.size(); i++) {
            if (constraints.getLower(i) > constraints.getUpper(i)) {
                return "constraint lower > upper";
            }
        }
        return null;
    }

    static double[] interiorStart(double[] x0, double[] l, double[] u) {
        double[] x = x0.clone();
        for (int i = 0; i < x.length; i++) {
            boolean finiteL = !Double.isInfinite(l[i]);
            boolean finiteU = !Double.isInfinite(u[i]);
            if (l[i] == u[i]) {
                x[i] = l[i];
            } else if (finiteL && finiteU) {
                double margin = INITIAL_MARGIN * (u[i] - l[i]);
                x[i] = Math.max(l[i] + margin, Math.min(u[i] - margin, x[i]));
            } else if (finiteL) {
                x[i] = Math.max(l[i] + INITIAL_MARGIN * Math.max(1.0, Math.abs(l[i])), x[i]);
            } else if (finiteU) {
                x[i] = Math.min(u[i] - INITIAL_MARGIN * Math.max(1.0, Math.abs(u[i])), x[i]);
            }
        }
        return x;
    }

    private static void enforceBox(double[] x, double[] l, double[] u) {
        for (int i = 0; i < x.length; i++) {
            if (l[i] == u[i]) {
                x[i] = l[i];
                continue;
            }
            if (!Double.isInfinite(l[i])) x[i] = Math.max(l[i] + BOX_MARGIN, x[i]);
            if (!Double.isInfinite(u[i])) x[i] = Math.min(u[i] - BOX_MARGIN, x[i]);
        }
    }

    private static double[] filled(int n, double value) {
        double[] a = new double[n];
        Arrays.fill(a, value);
        return a;
    }

    private OptimizationResult finish(double[] x, double fx, double[] gx, int iterations,
                                      int functionCalls, int gradientCalls, ConvergenceReason reason) {
        LOGGER.debug("IP-Newton stopped after {} iterations: {}", iterations, reason.getMessage());
        return new OptimizationResult(x, fx, gx, iterations, functionCalls, gradientCalls, reason);
    }

    /** Newton step in primal and dual variables. */
    static final class Step {
        final double[] dx;
        final double[] dLambdaEq;
        final double[] dSlack;
        final double[] dLambda;

        Step(double[] dx, double[] dLambdaEq, double[] dSlack, double[] dLambda) {
            this.dx = dx;
            this.dLambdaEq = dLambdaEq;
            this.dSlack = dSlack;
            this.dLambda = dLambda;
        }
    }

    /** One classified bound: variable or constraint index, bound value and side. */
    static final class Row {
        final int index;
        final double bound;
        final double sigma;

        Row(int index, double bound, double sigma) {
            this.index = index;
            this.bound = bound;
            this.sigma = sigma;
        }
    }

    /**
     * Index tables built once per run. Inequalities list box rows before
     * constraint rows, and so do equalities.
     */
    static final class Classification {
        final Row[] boxInequalities;
        final Row[] boxEqualities;
        final Row[] constraintInequalities;
        final Row[] constraintEqualities;

        private Classification(List<Row> boxIneq, List<Row> boxEq, List<Row> conIneq, List<Row> conEq) {
            this.boxInequalities = boxIneq.toArray(new Row[0]);
            this.boxEqualities = boxEq.toArray(new Row[0]);
            this.constraintInequalities = conIneq.toArray(new Row[0]);
            this.constraintEqualities = conEq.toArray(new Row[0]);
        }

        static Classification of(double[] l, double[] u, NonlinearConstraints constraints) {
            List<Row> boxIneq = new ArrayList<>();
            List<Row> boxEq = new ArrayList<>();
            for (int i = 0; i < l.length; i++) {
                classify(i, l[i], u[i], boxIneq, boxEq);
            }
            List<Row> conIneq = new ArrayList<>();
            List<Row> conEq = new ArrayList<>();
            if (constraints != null) {
                for (int i = 0; i < constraints.size(); i++) {
                    classify(i, constraints.getLower(i), constraints.getUpper(i), conIneq, conEq);
                }
            }
            return new Classification(boxIneq, boxEq, conIneq, conEq);
        }

        private static void classify(int index, double lo, double hi, List<Row> ineq, List<Row> eq) {
            if (lo == hi) {
                eq.add(new Row(index, lo, 1.0));
                return;
            }
            if (!Double.isInfinite(lo)) {
                ineq.add(new Row(index, lo, 1.0));
            }
            if (!Double.isInfinite(hi)) {
                ineq.add(new Row(index, hi, -1.0));
            }
        }

        int inequalityCount() {
            return boxInequalities.length + constraintInequalities.length;
        }

        int equalityCount() {
            return boxEqualities.length + constraintEqualities.length;
        }

        double[][] inequalityJacobian(int n, double[][] jc) {
            double[][] rows = new double[inequalityCount()][];
            int k = 0;
            for (Row r : boxInequalities) {
                rows[k] = new double[n];
                rows[k++][r.index] = r.sigma;
            }
            for (Row r : constraintInequalities) {
                rows[k++] = Vectors.scale(jc[r.index], r.sigma);
            }
            return rows;
        }

        double[][] equalityJacobian(int n, double[][] jc) {
            double[][] rows = new double[equalityCount()][];
            int k = 0;
            for (Row r : boxEqualities) {
                rows[k] = new double[n];
                rows[k++][r.index] = 1.0;
            }
            for (Row r : constraintEqualities) {
                rows[k++] = jc[r.index].clone();
            }
            return rows;
        }

        double[] slacks(double[] x, double[] cx) {
            double[] s = new double[inequalityCount()];
            int k = 0;
            for (Row r : boxInequalities) {
                s[k++] = Math.max(r.sigma * (x[r.index] - r.bound), SLACK_FLOOR);
            }
            for (Row r : constraintInequalities) {
                s[k++] = Math.max(r.sigma * (cx[r.index] - r.bound), SLACK_FLOOR);
            }
            return s;
        }

        double[] equalityResidual(double[] x, double[] cx) {
            double[] res = new double[equalityCount()];
            int k = 0;
            for (Row r : boxEqualities) {
                res[k++] = x[r.index] - r.bound;
            }
            for (Row r : constraintEqualities) {
                res[k++] = cx[r.index] - r.bound;
            }
            return res;
        }
    }

    /**
     * Builder for interior-point Newton optimizer.
     */
    public static final class Builder {
        private ToDoubleFunction<double[]> objective;
        private GradientFunction gradient;
        private HessianFunction hessian;
        private NumericalGradient numericalGradient = NumericalGradient.FORWARD;
        private double[] lower;
        private double[] upper;
        private NonlinearConstraints constraints;
        private Termination termination = Termination.defaults();
        private Double mu0;
        private Double kktTolerance;

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

        /**
         * Sets box bounds. Equal entries fix the variable.
         * @param lower Lower bounds, or null for none
         * @param upper Upper bounds, or null for none
         * @return This builder
         */
        public Builder bounds(double[] lower, double[] upper) {
            this.lower = lower != null ? lower.clone() : null;
            this.upper = upper != null ? upper.clone() : null;
            return this;
        }

        public Builder bounds(Bound... bounds) {
            if (bounds == null) {
                throw new IllegalArgumentException("Bounds cannot be null");
            }
            double[][] split = Bound.split(bounds);
            this.lower = split[0];
            this.upper = split[1];
            return this;
        }

        public Builder constraints(NonlinearConstraints constraints) {
            this.constraints = constraints;
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
         * Fixes the initial barrier parameter.
         * @param value Initial μ (must be positive)
         * @return This builder
         */
        public Builder mu0(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Initial mu must be positive");
            }
            this.mu0 = value;
            return this;
        }

        /**
         * Sets the KKT residual tolerance (default: the gradient tolerance).
         * @param value Tolerance (must be positive)
         * @return This builder
         */
        public Builder kktTolerance(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("KKT tolerance must be positive");
            }
            this.kktTolerance = value;
            return this;
        }

        public IpNewtonOptimizer build() {
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }
            return new IpNewtonOptimizer(this);
        }
    }
}
