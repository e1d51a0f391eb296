/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import com.curioloop.optim.linalg.Vectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static com.curioloop.optim.TestFunctions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the dogleg trust-region Newton method.
 */
public class NewtonTrustRegionOptimizerTest {

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#allProblems")
    @DisplayName("Converges on every catalogue function")
    void testCatalogue(Problem problem) {
        OptimizationResult result = NewtonTrustRegionOptimizer.minimize(
                problem.f(), problem.gradient(), problem.hessian(), problem.start());

        assertSolved(result, problem);
    }

    @Test
    @DisplayName("Goldstein-Price from (0, -0.5)")
    void testGoldsteinPrice() {
        OptimizationResult result = NewtonTrustRegionOptimizer.minimize(
                GOLDSTEIN_PRICE.f(), GOLDSTEIN_PRICE.gradient(), GOLDSTEIN_PRICE.hessian(),
                new double[]{0, -0.5});

        assertThat(Math.abs(result.getFunctionValue() - 3.0)).isLessThan(1e-4);
    }

    @Test
    @DisplayName("Finite-difference derivatives")
    void testFiniteDifferences() {
        OptimizationResult hessianOnly = NewtonTrustRegionOptimizer.minimize(
                SPHERE.f(), SPHERE.gradient(), null, SPHERE.start());
        assertThat(hessianOnly.getFunctionValue()).isLessThan(1e-12);

        OptimizationResult valuesOnly = NewtonTrustRegionOptimizer.minimize(
                SPHERE.f(), null, null, SPHERE.start());
        assertThat(valuesOnly.getFunctionValue()).isLessThan(1e-10);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#allProblems")
    @DisplayName("Starting at the minimum returns immediately")
    void testStartAtMinimum(Problem problem) {
        OptimizationResult result = NewtonTrustRegionOptimizer.minimize(
                problem.f(), problem.gradient(), problem.hessian(), problem.minimum());

        assertThat(result.getIterations()).isZero();
        assertThat(result.isConverged()).isTrue();
    }

    @Test
    @DisplayName("Dogleg returns the Newton step when it fits")
    void testDoglegNewtonStep() {
        double[] p = NewtonTrustRegionOptimizer.doglegStep(
                new double[]{10, 10}, new double[][]{{2, 0}, {0, 2}}, 100);
        assertThat(p).containsExactly(new double[]{-5, -5}, within(1e-12));
    }

    @Test
    @DisplayName("Dogleg scales the Cauchy step to the boundary")
    void testDoglegCauchyBoundary() {
        double[] p = NewtonTrustRegionOptimizer.doglegStep(
                new double[]{10, 10}, new double[][]{{2, 0}, {0, 2}}, 1);
        assertThat(Vectors.norm(p)).isCloseTo(1.0, within(1e-12));
        assertThat(p[0]).isNegative().isCloseTo(p[1], within(1e-15));
    }

    @Test
    @DisplayName("Dogleg follows -g to the boundary under negative curvature")
    void testDoglegNegativeCurvature() {
        double[] p = NewtonTrustRegionOptimizer.doglegStep(
                new double[]{1, 0}, new double[][]{{-1, 0}, {0, -1}}, 2);
        assertThat(p).containsExactly(new double[]{-2, 0}, within(1e-12));
    }

    @Test
    @DisplayName("Dogleg interpolates between the Cauchy and Newton points")
    void testDoglegInterpolation() {
        double[] g = {1, 1};
        double[][] h = {{1, 0}, {0, 10}};
        double[] p = NewtonTrustRegionOptimizer.doglegStep(g, h, 0.5);

        assertThat(Vectors.norm(p)).isCloseTo(0.5, within(1e-12));
        assertThat(Vectors.dot(p, g)).isNegative();

        assertThat(NewtonTrustRegionOptimizer.doglegStep(new double[]{0, 0}, h, 1.0)).containsExactly(0, 0);
    }

    @Test
    @DisplayName("A model that never predicts the objective collapses the region")
    void testTrustRegionCollapse() {
        OptimizationResult result = NewtonTrustRegionOptimizer.builder()
                .objective(SPHERE.f())
                .gradient(x -> new double[]{-2 * x[0], -2 * x[1]})
                .hessian(SPHERE.hessian())
                .build()
                .optimize(new double[]{1, 1});

        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.TRUST_REGION_COLLAPSED);
        assertThat(result.getSolution()).containsExactly(1, 1);
        assertThat(result.getGradientCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Small radius limits still reach the minimum")
    void testRadiusLimits() {
        OptimizationResult result = NewtonTrustRegionOptimizer.builder()
                .objective(SPHERE.f())
                .gradient(SPHERE.gradient())
                .hessian(SPHERE.hessian())
                .initialDelta(0.1)
                .maxDelta(0.5)
                .build()
                .optimize(new double[]{10, 10});

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(1e-10);
        assertThat(result.getIterations()).isGreaterThanOrEqualTo(28);
    }

    @Test
    @DisplayName("Iteration cap with strict tolerances")
    void testMaxIterations() {
        OptimizationResult result = NewtonTrustRegionOptimizer.builder()
                .objective(ROSENBROCK.f())
                .gradient(ROSENBROCK.gradient())
                .hessian(ROSENBROCK.hessian())
                .termination(Termination.builder()
                        .maxIterations(1).gradientTolerance(1e-15).stepTolerance(1e-15).functionTolerance(1e-15)
                        .build())
                .build()
                .optimize(ROSENBROCK.start());

        assertThat(result.getIterations()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(OptimizationStatus.MAX_ITERATIONS_REACHED);
    }

    @Test
    @DisplayName("Builder validation")
    void testValidation() {
        assertThatThrownBy(() -> NewtonTrustRegionOptimizer.builder().eta(0.3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NewtonTrustRegionOptimizer.builder()
                .objective(SPHERE.f()).initialDelta(10).maxDelta(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Initial radius");
    }
}
