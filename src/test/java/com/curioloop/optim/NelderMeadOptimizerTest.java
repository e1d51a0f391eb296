/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.concurrent.atomic.AtomicInteger;

import static com.curioloop.optim.TestFunctions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the Nelder-Mead simplex method.
 */
public class NelderMeadOptimizerTest {

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#allProblems")
    @DisplayName("Converges on every catalogue function from values alone")
    void testCatalogue(Problem problem) {
        OptimizationResult result = NelderMeadOptimizer.minimize(problem.f(), problem.start());

        assertSolved(result, problem);
        assertThat(result.hasGradient()).isFalse();
        assertThat(result.getGradientCalls()).isZero();
    }

    @Test
    @DisplayName("Rosenbrock from the standard start")
    void testRosenbrock() {
        OptimizationResult result = NelderMeadOptimizer.minimize(ROSENBROCK.f(), new double[]{-1.2, 1.0});

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(1e-6);
        assertThat(result.getSolution()).containsExactly(new double[]{1.0, 1.0}, within(1e-2));
        assertThat(result.getGradientCalls()).isZero();
        assertThat(result.getGradient()).isNull();
    }

    @Test
    @DisplayName("Simplex diameter below the step tolerance")
    void testStepTolerance() {
        OptimizationResult result = NelderMeadOptimizer.builder()
                .objective(SPHERE.f())
                .termination(Termination.builder().functionTolerance(0).stepTolerance(1e-4).build())
                .build()
                .optimize(SPHERE.start());

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.STEP_TOLERANCE_REACHED);
        assertThat(result.getMessage()).startsWith("Converged: simplex diameter");
        assertThat(result.getFunctionValue()).isLessThan(1e-6);
    }

    @Test
    @DisplayName("A flat enough initial simplex stops before the first iteration")
    void testInitialSpread() {
        OptimizationResult result = NelderMeadOptimizer.builder()
                .objective(SPHERE.f())
                .termination(Termination.builder().functionTolerance(10).build())
                .build()
                .optimize(SPHERE.start());

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.FUNCTION_TOLERANCE_REACHED);
        assertThat(result.getIterations()).isZero();
        assertThat(result.getFunctionCalls()).isEqualTo(3);
        assertThat(result.getSolution()).containsExactly(5, 5);
    }

    @Test
    @DisplayName("Starting at the minimum keeps it")
    void testStartAtMinimum() {
        OptimizationResult result = NelderMeadOptimizer.minimize(SPHERE.f(), SPHERE.minimum());

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(1e-10);
    }

    @Test
    @DisplayName("Iteration cap")
    void testMaxIterations() {
        OptimizationResult result = NelderMeadOptimizer.builder()
                .objective(ROSENBROCK.f())
                .termination(Termination.builder().maxIterations(5).build())
                .build()
                .optimize(ROSENBROCK.start());

        assertThat(result.getIterations()).isEqualTo(5);
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.MAX_ITERATIONS_REACHED);
        assertThat(result.getMessage()).isEqualTo("Stopped: reached maximum iterations (5)");
    }

    @Test
    @DisplayName("Function call counter matches the objective")
    void testCounters() {
        AtomicInteger calls = new AtomicInteger();
        double[] x0 = {0, 0};
        OptimizationResult result = NelderMeadOptimizer.minimize(x -> {
            calls.incrementAndGet();
            return HIMMELBLAU.f().applyAsDouble(x);
        }, x0);

        assertThat(result.getFunctionCalls()).isEqualTo(calls.get());
        assertThat(x0).containsExactly(0, 0);
    }

    @Test
    @DisplayName("Custom coefficients still converge")
    void testCustomCoefficients() {
        OptimizationResult result = NelderMeadOptimizer.builder()
                .objective(BOOTH.f())
                .coefficients(1.0, 2.5, 0.4, 0.6)
                .initialSimplexScale(0.2)
                .termination(Termination.builder().maxIterations(5000).build())
                .build()
                .optimize(BOOTH.start());

        assertSolved(result, BOOTH);
    }

    @Test
    @DisplayName("Non-finite start is rejected without evaluating the objective")
    void testNonFiniteStart() {
        AtomicInteger calls = new AtomicInteger();
        OptimizationResult result = NelderMeadOptimizer.minimize(x -> {
            calls.incrementAndGet();
            return SPHERE.f().applyAsDouble(x);
        }, new double[]{Double.NaN, 1});

        assertThat(result.isConverged()).isFalse();
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.INVALID_ARGUMENT);
        assertThat(result.getMessage()).isEqualTo("Invalid argument: initial point must be finite");
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("NaN in the initial simplex stops the run")
    void testNaNInInitialSimplex() {
        OptimizationResult result = NelderMeadOptimizer.minimize(
                x -> x[0] > 1 ? Double.NaN : x[0] * x[0] + x[1] * x[1], new double[]{1, 0});

        assertThat(result.isConverged()).isFalse();
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.NUMERICAL_INSTABILITY);
        assertThat(result.getIterations()).isZero();
        assertThat(result.getFunctionCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("Builder validation")
    void testValidation() {
        assertThatThrownBy(() -> NelderMeadOptimizer.builder().coefficients(1, 0.5, 0.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid simplex coefficients");
        assertThatThrownBy(() -> NelderMeadOptimizer.builder().coefficients(1, 2, 1, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NelderMeadOptimizer.builder().initialSimplexScale(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NelderMeadOptimizer.minimize(SPHERE.f(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
