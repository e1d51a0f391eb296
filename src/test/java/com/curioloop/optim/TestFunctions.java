/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.junit.jupiter.params.provider.Arguments;

import java.util.function.ToDoubleFunction;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Standard two-dimensional benchmark problems with analytic derivatives,
 * known minima and canonical starting points.
 */
public final class TestFunctions {

    /**
     * A benchmark problem.
     */
    public static final class Problem {
        private final String name;
        private final ToDoubleFunction<double[]> function;
        private final GradientFunction gradient;
        private final HessianFunction hessian;
        private final double[] minimum;
        private final double minimumValue;
        private final double[] start;

        Problem(String name, ToDoubleFunction<double[]> function, GradientFunction gradient,
                HessianFunction hessian, double[] minimum, double minimumValue, double[] start) {
            this.name = name;
            this.function = function;
            this.gradient = gradient;
            this.hessian = hessian;
            this.minimum = minimum;
            this.minimumValue = minimumValue;
            this.start = start;
        }

        public String name() {
            return name;
        }

        public ToDoubleFunction<double[]> f() {
            return function;
        }

        public GradientFunction gradient() {
            return gradient;
        }

        public HessianFunction hessian() {
            return hessian;
        }

        public double[] minimum() {
            return minimum.clone();
        }

        public double minimumValue() {
            return minimumValue;
        }

        public double[] start() {
            return start.clone();
        }

        /**
         * Tolerance on the optimal value expected from a converged solver.
         */
        public double valueTolerance() {
            return this == SPHERE ? 1e-10 : 1e-6;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final Problem SPHERE = new Problem("Sphere",
            x -> x[0] * x[0] + x[1] * x[1],
            x -> new double[]{2 * x[0], 2 * x[1]},
            x -> new double[][]{{2, 0}, {0, 2}},
            new double[]{0, 0}, 0.0, new double[]{5, 5});

    public static final Problem BOOTH = new Problem("Booth",
            x -> {
                double a = x[0] + 2 * x[1] - 7;
                double b = 2 * x[0] + x[1] - 5;
                return a * a + b * b;
            },
            x -> {
                double a = x[0] + 2 * x[1] - 7;
                double b = 2 * x[0] + x[1] - 5;
                return new double[]{2 * a + 4 * b, 4 * a + 2 * b};
            },
            x -> new double[][]{{10, 8}, {8, 10}},
            new double[]{1, 3}, 0.0, new double[]{0, 0});

    public static final Problem ROSENBROCK = new Problem("Rosenbrock",
            x -> {
                double a = 1 - x[0];
                double b = x[1] - x[0] * x[0];
                return a * a + 100 * b * b;
            },
            x -> {
                double b = x[1] - x[0] * x[0];
                return new double[]{-2 * (1 - x[0]) - 400 * x[0] * b, 200 * b};
            },
            x -> new double[][]{
                    {1200 * x[0] * x[0] - 400 * x[1] + 2, -400 * x[0]},
                    {-400 * x[0], 200}},
            new double[]{1, 1}, 0.0, new double[]{-1.2, 1.0});

    public static final Problem BEALE = new Problem("Beale",
            x -> {
                double t1 = 1.5 - x[0] + x[0] * x[1];
                double t2 = 2.25 - x[0] + x[0] * x[1] * x[1];
                double t3 = 2.625 - x[0] + x[0] * x[1] * x[1] * x[1];
                return t1 * t1 + t2 * t2 + t3 * t3;
            },
            x -> {
                double y = x[1];
                double t1 = 1.5 - x[0] + x[0] * y;
                double t2 = 2.25 - x[0] + x[0] * y * y;
                double t3 = 2.625 - x[0] + x[0] * y * y * y;
                return new double[]{
                        2 * t1 * (y - 1) + 2 * t2 * (y * y - 1) + 2 * t3 * (y * y * y - 1),
                        2 * t1 * x[0] + 2 * t2 * (2 * x[0] * y) + 2 * t3 * (3 * x[0] * y * y)};
            },
            TestFunctions::bealeHessian,
            new double[]{3, 0.5}, 0.0, new double[]{0, 0});

    public static final Problem HIMMELBLAU = new Problem("Himmelblau",
            x -> {
                double a = x[0] * x[0] + x[1] - 11;
                double b = x[0] + x[1] * x[1] - 7;
                return a * a + b * b;
            },
            x -> {
                double a = x[0] * x[0] + x[1] - 11;
                double b = x[0] + x[1] * x[1] - 7;
                return new double[]{4 * x[0] * a + 2 * b, 2 * a + 4 * x[1] * b};
            },
            x -> new double[][]{
                    {12 * x[0] * x[0] + 4 * x[1] - 42, 4 * x[0] + 4 * x[1]},
                    {4 * x[0] + 4 * x[1], 12 * x[1] * x[1] + 4 * x[0] - 26}},
            new double[]{3, 2}, 0.0, new double[]{0, 0});

    public static final Problem GOLDSTEIN_PRICE = new Problem("Goldstein-Price",
            TestFunctions::goldsteinPrice,
            TestFunctions::goldsteinPriceGradient,
            TestFunctions::goldsteinPriceHessian,
            new double[]{0, -1}, 3.0, new double[]{0, -0.5});

    /** The four minima of Himmelblau's function, all with value zero. */
    public static final double[][] HIMMELBLAU_MINIMA = {
            {3.0, 2.0},
            {-2.805118, 3.131312},
            {-3.779310, -3.283186},
            {3.584428, -1.848126}
    };

    private TestFunctions() {}

    public static Problem[] all() {
        return new Problem[]{SPHERE, BOOTH, ROSENBROCK, BEALE, HIMMELBLAU, GOLDSTEIN_PRICE};
    }

    public static Stream<Arguments> allProblems() {
        return Stream.of(all()).map(Arguments::of);
    }

    /**
     * Catalogue without Goldstein-Price. From its standard start the Krylov trust region stops
     * on the step tolerance near f = 243.6 with a gradient norm around 1e3.
     */
    public static Stream<Arguments> smoothProblems() {
        return Stream.of(SPHERE, BOOTH, ROSENBROCK, BEALE, HIMMELBLAU).map(Arguments::of);
    }

    /**
     * Quadratic problems every gradient-based solver handles from finite differences.
     */
    public static Stream<Arguments> quadraticProblems() {
        return Stream.of(SPHERE, BOOTH).map(Arguments::of);
    }

    /**
     * Asserts convergence to the known optimal value of the problem.
     */
    public static void assertSolved(OptimizationResult result, Problem problem) {
        assertThat(result.isConverged())
                .as("%s converged: %s", problem.name(), result.getMessage())
                .isTrue();
        assertThat(Math.abs(result.getFunctionValue() - problem.minimumValue()))
                .as("%s optimal value, got %s", problem.name(), result.getFunctionValue())
                .isLessThan(problem.valueTolerance());
    }

    /**
     * Euclidean distance to the closest of the given points.
     */
    public static double distanceToNearest(double[] x, double[][] points) {
        double best = Double.POSITIVE_INFINITY;
        for (double[] p : points) {
            double sum = 0;
            for (int i = 0; i < x.length; i++) {
                double d = x[i] - p[i];
                sum += d * d;
            }
            best = Math.min(best, Math.sqrt(sum));
        }
        return best;
    }

    /**
     * Euclidean distance between two points.
     */
    public static double distance(double[] a, double[] b) {
        return distanceToNearest(a, new double[][]{b});
    }

    private static double[][] bealeHessian(double[] x) {
        double[] c = {1.5, 2.25, 2.625};
        double hxx = 0;
        double hxy = 0;
        double hyy = 0;
        for (int i = 1; i <= 3; i++) {
            double yi = Math.pow(x[1], i);
            double yi1 = Math.pow(x[1], i - 1);
            double t = c[i - 1] - x[0] + x[0] * yi;
            double tx = yi - 1;
            double ty = i * x[0] * yi1;
            double tyy = i >= 2 ? i * (i - 1) * x[0] * Math.pow(x[1], i - 2) : 0.0;
            hxx += 2 * tx * tx;
            hxy += 2 * (tx * ty + t * i * yi1);
            hyy += 2 * (ty * ty + t * tyy);
        }
        return new double[][]{{hxx, hxy}, {hxy, hyy}};
    }

    private static double goldsteinPrice(double[] x) {
        double x1 = x[0];
        double x2 = x[1];
        double s = x1 + x2 + 1;
        double q1 = 19 - 14 * x1 + 3 * x1 * x1 - 14 * x2 + 6 * x1 * x2 + 3 * x2 * x2;
        double t = 2 * x1 - 3 * x2;
        double q2 = 18 - 32 * x1 + 12 * x1 * x1 + 48 * x2 - 36 * x1 * x2 + 27 * x2 * x2;
        return (1 + s * s * q1) * (30 + t * t * q2);
    }

    private static double[] goldsteinPriceGradient(double[] x) {
        double x1 = x[0];
        double x2 = x[1];
        double s = x1 + x2 + 1;
        double q1 = 19 - 14 * x1 + 3 * x1 * x1 - 14 * x2 + 6 * x1 * x2 + 3 * x2 * x2;
        double a = 1 + s * s * q1;
        double t = 2 * x1 - 3 * x2;
        double q2 = 18 - 32 * x1 + 12 * x1 * x1 + 48 * x2 - 36 * x1 * x2 + 27 * x2 * x2;
        double b = 30 + t * t * q2;

        double dq1 = -14 + 6 * x1 + 6 * x2;
        double da1 = 2 * s * q1 + s * s * dq1;
        double da2 = 2 * s * q1 + s * s * dq1;
        double db1 = 4 * t * q2 + t * t * (-32 + 24 * x1 - 36 * x2);
        double db2 = -6 * t * q2 + t * t * (48 - 36 * x1 + 54 * x2);
        return new double[]{da1 * b + a * db1, da2 * b + a * db2};
    }

    // Central differences of the analytic gradient, symmetrized.
    private static double[][] goldsteinPriceHessian(double[] x) {
        double[][] h = new double[2][2];
        for (int j = 0; j < 2; j++) {
            double step = 1e-6 * Math.max(Math.abs(x[j]), 1.0);
            double[] plus = x.clone();
            double[] minus = x.clone();
            plus[j] += step;
            minus[j] -= step;
            double[] gp = goldsteinPriceGradient(plus);
            double[] gm = goldsteinPriceGradient(minus);
            for (int i = 0; i < 2; i++) {
                h[i][j] = (gp[i] - gm[i]) / (2 * step);
            }
        }
        double off = 0.5 * (h[0][1] + h[1][0]);
        h[0][1] = off;
        h[1][0] = off;
        return h;
    }
}
