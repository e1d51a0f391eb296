/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the solvers on random quadratics and Rosenbrock starts.
 */
public class OptimizerPropertiesTest {

    @Provide
    Arbitrary<Minimizer.Method> gradientMethods() {
        return Arbitraries.of(
                Minimizer.Method.BFGS,
                Minimizer.Method.LBFGS,
                Minimizer.Method.CONJUGATE_GRADIENT,
                Minimizer.Method.NEWTON,
                Minimizer.Method.NEWTON_TRUST_REGION);
    }

    @Property(tries = 100)
    @Label("Convex quadratics are solved to their centre")
    void convexQuadraticIsSolved(
            @ForAll("gradientMethods") Minimizer.Method method,
            @ForAll @DoubleRange(min = 0.5, max = 20.0) double a,
            @ForAll @DoubleRange(min = 0.5, max = 20.0) double b,
            @ForAll @DoubleRange(min = -5.0, max = 5.0) double c0,
            @ForAll @DoubleRange(min = -5.0, max = 5.0) double c1,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double x0,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double x1
    ) {
        ToDoubleFunction<double[]> f = x -> a * sq(x[0] - c0) + b * sq(x[1] - c1);
        GradientFunction g = x -> new double[]{2 * a * (x[0] - c0), 2 * b * (x[1] - c1)};
        HessianFunction h = x -> new double[][]{{2 * a, 0}, {0, 2 * b}};
        double[] start = {x0, x1};

        OptimizationResult result = Minimizer.builder()
                .method(method).objective(f).gradient(g).hessian(h)
                .build()
                .optimize(start);

        assertThat(result.isConverged()).as(result.getMessage()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(1e-8);
        assertThat(result.getSolution()).containsExactly(new double[]{c0, c1}, within(1e-4));
        assertThat(start).containsExactly(x0, x1);
    }

    @Property(tries = 100)
    @Label("The reported value belongs to the reported point and does not exceed the start")
    void resultIsConsistent(
            @ForAll Minimizer.Method method,
            @ForAll @DoubleRange(min = -3.0, max = 3.0) double x0,
            @ForAll @DoubleRange(min = -3.0, max = 3.0) double x1
    ) {
        TestFunctions.Problem problem = TestFunctions.ROSENBROCK;
        double[] start = {x0, x1};

        OptimizationResult result = Minimizer.builder()
                .method(method)
                .objective(problem.f())
                .gradient(problem.gradient())
                .hessian(problem.hessian())
                .termination(Termination.builder().maxIterations(20).build())
                .build()
                .optimize(start);

        assertThat(result.getFunctionValue()).isEqualTo(problem.f().applyAsDouble(result.getSolution()));
        // approximate Wolfe steps may rise by a relative 1e-6
        double f0 = problem.f().applyAsDouble(start);
        assertThat(result.getFunctionValue()).isLessThanOrEqualTo(f0 + 1e-6 * Math.abs(f0) + 1e-12);
        assertThat(result.getIterations()).isBetween(0, 20);
        assertThat(result.getFunctionCalls()).isPositive();
    }

    /**
     * Exception raised by a failing objective, tagged with the evaluation that threw.
     */
    public static class CallbackException extends RuntimeException {
        private final int evaluation;

        public CallbackException(int evaluation) {
            super("Objective failed at evaluation " + evaluation);
            this.evaluation = evaluation;
        }

        public int getEvaluation() {
            return evaluation;
        }
    }

    @Property(tries = 50)
    @Label("An exception thrown by the objective reaches the caller unchanged")
    void callbackExceptionPropagates(
            @ForAll Minimizer.Method method,
            @ForAll @IntRange(min = 1, max = 5) int throwAfter
    ) {
        TestFunctions.Problem problem = TestFunctions.ROSENBROCK;
        AtomicInteger evaluations = new AtomicInteger();
        ToDoubleFunction<double[]> failing = x -> {
            int n = evaluations.incrementAndGet();
            if (n > throwAfter) {
                throw new CallbackException(n);
            }
            return problem.f().applyAsDouble(x);
        };

        Minimizer minimizer = Minimizer.builder()
                .method(method)
                .objective(failing)
                .gradient(problem.gradient())
                .hessian(problem.hessian())
                .build();

        assertThatThrownBy(() -> minimizer.optimize(problem.start()))
                .isExactlyInstanceOf(CallbackException.class)
                .isInstanceOfSatisfying(CallbackException.class,
                        e -> assertThat(e.getEvaluation()).isEqualTo(throwAfter + 1));
    }

    private static double sq(double v) {
        return v * v;
    }
}
