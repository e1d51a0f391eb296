/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for finite-difference Hessians, Hessian-vector products and Jacobians.
 */
public class FiniteDifferencesTest {

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#smoothProblems")
    @DisplayName("Finite-difference Hessian matches the analytic one and is exactly symmetric")
    void testHessian(TestFunctions.Problem problem) {
        double[] x = {0.7, -0.3};
        double[][] exact = problem.hessian().hessian(x);
        double[][] approx = FiniteDifferences.hessian(problem.f(), x);

        assertThat(approx[0][1]).as("symmetric by construction").isEqualTo(approx[1][0]);
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertThat(approx[i][j]).as(problem.name() + " H[" + i + "][" + j + "]")
                        .isCloseTo(exact[i][j], within(1e-3 * Math.max(1.0, Math.abs(exact[i][j]))));
            }
        }
        assertThat(x).containsExactly(0.7, -0.3);
    }

    @Test
    @DisplayName("Hessian-vector product from one gradient difference")
    void testHessianVectorProduct() {
        TestFunctions.Problem rosenbrock = TestFunctions.ROSENBROCK;
        double[] x = {-1.2, 1.0};
        double[] v = {0.3, -0.8};
        double[][] h = rosenbrock.hessian().hessian(x);
        double[] expected = {h[0][0] * v[0] + h[0][1] * v[1], h[1][0] * v[0] + h[1][1] * v[1]};

        double[] hv = FiniteDifferences.hessianVectorProduct(
                rosenbrock.gradient(), x, v, rosenbrock.gradient().gradient(x));

        assertThat(hv[0]).isCloseTo(expected[0], within(1e-2 * Math.abs(expected[0])));
        assertThat(hv[1]).isCloseTo(expected[1], within(1e-2 * Math.abs(expected[1])));
    }

    @Test
    @DisplayName("Forward-difference Jacobian of a vector function")
    void testJacobian() {
        ConstraintFunction c = x -> new double[]{x[0] + x[1], x[0] * x[1], x[0] * x[0]};
        double[] x = {2, 3};
        double[][] jac = FiniteDifferences.jacobian(c, x, c.values(x));

        assertThat(jac).hasDimensions(3, 2);
        assertThat(jac[0]).containsExactly(new double[]{1, 1}, within(1e-6));
        assertThat(jac[1]).containsExactly(new double[]{3, 2}, within(1e-6));
        assertThat(jac[2]).containsExactly(new double[]{4, 0}, within(1e-6));
    }

    @Test
    @DisplayName("Objective substitutes finite differences for missing derivatives")
    void testObjectiveFallback() {
        Objective numeric = Objective.of(TestFunctions.BOOTH.f(), null, null, NumericalGradient.CENTRAL);
        assertThat(numeric.hasAnalyticGradient()).isFalse();
        assertThat(numeric.gradient(new double[]{0, 0}))
                .containsExactly(new double[]{-34, -38}, within(1e-6));
        assertThat(numeric.hessian(new double[]{0, 0})[0])
                .containsExactly(new double[]{10, 8}, within(1e-4));

        Objective analytic = Objective.of(TestFunctions.BOOTH.f(), TestFunctions.BOOTH.gradient());
        assertThat(analytic.hasAnalyticGradient()).isTrue();
        assertThatThrownBy(() -> Objective.of(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
