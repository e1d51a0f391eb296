/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the finite-difference gradient schemes.
 */
public class NumericalGradientTest {

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#allProblems")
    @DisplayName("Forward differences agree with the analytic gradient")
    void testForwardAgainstAnalytic(TestFunctions.Problem problem) {
        double[] x = {0.7, -0.3};
        double[] exact = problem.gradient().gradient(x);
        double[] approx = NumericalGradient.FORWARD.gradient(problem.f(), x);
        for (int i = 0; i < x.length; i++) {
            assertThat(approx[i]).as(problem.name() + " component " + i)
                    .isCloseTo(exact[i], within(1e-5 * Math.max(1.0, Math.abs(exact[i]))));
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("com.curioloop.optim.TestFunctions#allProblems")
    @DisplayName("Central differences are accurate to second order")
    void testCentralAgainstAnalytic(TestFunctions.Problem problem) {
        double[] x = {0.7, -0.3};
        double[] exact = problem.gradient().gradient(x);
        double[] approx = NumericalGradient.CENTRAL.gradient(problem.f(), x);
        for (int i = 0; i < x.length; i++) {
            assertThat(approx[i]).as(problem.name() + " component " + i)
                    .isCloseTo(exact[i], within(1e-7 * Math.max(1.0, Math.abs(exact[i]))));
        }
    }

    @Test
    @DisplayName("Forward differences cost n + 1 evaluations, central differences 2n")
    void testEvaluationCounts() {
        AtomicInteger calls = new AtomicInteger();
        ToDoubleFunction<double[]> counted = x -> {
            calls.incrementAndGet();
            return x[0] * x[0] + x[1] * x[1] + x[2] * x[2];
        };
        double[] x = {1, 2, 3};

        NumericalGradient.FORWARD.gradient(counted, x);
        assertThat(calls.get()).isEqualTo(4);

        calls.set(0);
        NumericalGradient.CENTRAL.gradient(counted, x);
        assertThat(calls.get()).isEqualTo(6);
    }

    @ParameterizedTest
    @EnumSource(NumericalGradient.class)
    @DisplayName("The evaluation point is left untouched")
    void testDoesNotMutatePoint(NumericalGradient scheme) {
        double[] x = {1e6, -2.5};
        double[] g = scheme.gradientOf(TestFunctions.SPHERE.f()).gradient(x);

        assertThat(x).containsExactly(1e6, -2.5);
        assertThat(g[0]).isCloseTo(2e6, within(2e6 * 1e-6));
        assertThat(g[1]).isCloseTo(-5.0, within(1e-6));
    }
}
