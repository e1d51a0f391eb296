/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.GradientFunction;
import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the More-Thuente search and its {@code cstep} interpolation kernel.
 */
public class MoreThuenteLineSearchTest {

    private static LineSearchResult search(MoreThuenteLineSearch search, ToDoubleFunction<double[]> f,
                                           GradientFunction g, double x0, double d) {
        Objective objective = Objective.of(f, g);
        double[] x = {x0};
        return search.search(objective, x, new double[]{d}, f.applyAsDouble(x), g.gradient(x));
    }

    private static MoreThuenteLineSearch.Interval interval(double stx, double fx, double dx,
                                                           double sty, double fy, double dy, boolean bracketed) {
        MoreThuenteLineSearch.Interval iv = new MoreThuenteLineSearch.Interval(fx, dx);
        iv.stx = stx;
        iv.sty = sty;
        iv.fy = fy;
        iv.dy = dy;
        iv.bracketed = bracketed;
        return iv;
    }

    @Nested
    @DisplayName("cstep")
    class Cstep {

        @Test
        @DisplayName("Case 1: a higher value brackets the minimum")
        void testHigherValue() {
            MoreThuenteLineSearch.Interval iv = interval(0, 0, -1, 0, 0, -1, false);

            double next = MoreThuenteLineSearch.cstep(iv, 1, 1, 3, 0, 5);

            assertThat(next).isCloseTo(0.25, within(1e-12));
            assertThat(iv.bracketed).isTrue();
            assertThat(iv.stx).isZero();
            assertThat(iv.sty).isEqualTo(1.0);
            assertThat(iv.fy).isEqualTo(1.0);
            assertThat(iv.dy).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Case 2: derivatives of opposite sign bracket the minimum")
        void testOppositeSlopes() {
            MoreThuenteLineSearch.Interval iv = interval(0, 0, -1, 0, 0, -1, false);

            double next = MoreThuenteLineSearch.cstep(iv, 1, -0.5, 1, 0, 5);

            assertThat(next).isCloseTo(0.5, within(1e-12));
            assertThat(iv.bracketed).isTrue();
            assertThat(iv.stx).as("best step moves to the trial").isEqualTo(1.0);
            assertThat(iv.sty).as("old best becomes the other end").isZero();
            assertThat(iv.dy).isEqualTo(-1.0);
        }

        @Test
        @DisplayName("Case 3: a shrinking derivative left of the best step falls back to stmin")
        void testDecreasingSlopeLeftOfBest() {
            MoreThuenteLineSearch.Interval iv = interval(5, 10, -10, 0, 20, -8, false);

            double next = MoreThuenteLineSearch.cstep(iv, 2, 8, -5, 0, 100);

            assertThat(next).isZero();
            assertThat(iv.bracketed).isFalse();
            assertThat(iv.stx).isEqualTo(2.0);
            assertThat(iv.fx).isEqualTo(8.0);
        }

        @Test
        @DisplayName("Case 3: a shrinking derivative right of the best step extrapolates")
        void testDecreasingSlopeRightOfBest() {
            MoreThuenteLineSearch.Interval iv = interval(0, 0, -2, 0, 0, -2, false);

            double next = MoreThuenteLineSearch.cstep(iv, 1, -1.5, -1, 0, 5);

            assertThat(next).isCloseTo(2.0, within(1e-12));
            assertThat(iv.stx).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Case 4: bracketed steps interpolate with the far end")
        void testBracketedSteepening() {
            MoreThuenteLineSearch.Interval iv = interval(1, 2, -1, 5, 10, -3, true);

            double next = MoreThuenteLineSearch.cstep(iv, 3, 1, -2, 0, 100);

            assertThat(next).isCloseTo(3.1029942466241787, within(1e-12));
            assertThat(iv.bracketed).isTrue();
            assertThat(iv.stx).isEqualTo(3.0);
            assertThat(iv.sty).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Case 4: unbracketed steps jump to the interval end")
        void testUnbracketedSteepening() {
            MoreThuenteLineSearch.Interval left = interval(5, 10, -1, 0, 20, -2, false);
            assertThat(MoreThuenteLineSearch.cstep(left, 2, 5, -3, 0, 100)).isZero();
            assertThat(left.stx).isEqualTo(2.0);

            MoreThuenteLineSearch.Interval right = interval(0, 0, -1, 0, 0, -1, false);
            assertThat(MoreThuenteLineSearch.cstep(right, 1, -2, -1, 0, 5)).isEqualTo(5.0);
            assertThat(right.bracketed).isFalse();
        }
    }

    @Test
    @DisplayName("Extrapolates until the curvature condition holds")
    void testExtrapolation() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().gtol(0.1).build(),
                x -> x[0] * x[0], x -> new double[]{2 * x[0]}, 100, -1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlpha()).isCloseTo(100.0, within(1e-9));
        assertThat(result.getFunctionValue()).isCloseTo(0.0, within(1e-12));
        assertThat(result.getFunctionCalls()).isEqualTo(5);
    }

    @Test
    @DisplayName("Leaves the auxiliary function once sufficient decrease is reached")
    void testStageSwitch() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().gtol(0.01).build(),
                x -> x[0] * x[0] + 5 * Math.sin(x[0]), x -> new double[]{2 * x[0] + 5 * Math.cos(x[0])}, 4, -1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlpha()).isCloseTo(5.10981321522994, within(1e-6));
        assertThat(result.getFunctionValue()).isLessThan(-3.2);
    }

    @Test
    @DisplayName("Bisects when the bracket stops shrinking by two thirds")
    void testBisectionFallback() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().gtol(0.001).build(),
                x -> x[0] * x[0] + 100 * Math.sin(5 * x[0]),
                x -> new double[]{2 * x[0] + 500 * Math.cos(5 * x[0])}, 20, -1);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlpha()).isCloseTo(0.22380330080089234, within(1e-6));
        assertThat(result.getFunctionValue()).isLessThan(349.0);
    }

    @Test
    @DisplayName("Halves a first trial with a non-finite value")
    void testNonFiniteFirstTrial() {
        LineSearchResult result = search(MoreThuenteLineSearch.defaults(),
                x -> x[0] > -50 ? x[0] * x[0] : Double.POSITIVE_INFINITY,
                x -> new double[]{2 * x[0]}, 200, -300);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAlpha()).isEqualTo(0.5);
        assertThat(result.getFunctionValue()).isEqualTo(2500.0);
        assertThat(result.getFunctionCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Stops when the interval is narrower than xtol")
    void testIntervalWidth() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().gtol(1e-15).xtol(0.5).build(),
                x -> Math.pow(Math.abs(x[0] - 1), 1.5),
                x -> new double[]{1.5 * Math.signum(x[0] - 1) * Math.sqrt(Math.abs(x[0] - 1))}, 5, -1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAlpha()).isCloseTo(3.5358983848622456, within(1e-9));
        assertThat(result.getFunctionCalls()).isEqualTo(4);
    }

    @Test
    @DisplayName("Stops when the evaluation budget is spent")
    void testEvaluationBudget() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().maxEvaluations(3).build(),
                x -> -x[0], x -> new double[]{-1}, 0, 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAlpha()).isEqualTo(5.0);
        assertThat(result.getFunctionCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("Stops at the lower step bound without sufficient decrease")
    void testLowerStepBound() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().stepBounds(2, 10).build(),
                x -> x[0] * x[0], x -> new double[]{2 * x[0]}, -0.1, 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAlpha()).isEqualTo(2.0);
        assertThat(result.getFunctionCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stops at the upper step bound while still descending")
    void testUpperStepBound() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().gtol(0.1).stepBounds(1e-16, 2).build(),
                x -> -Math.log(1 + x[0]), x -> new double[]{-1 / (1 + x[0])}, 0, 1);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAlpha()).isEqualTo(2.0);
        assertThat(result.getFunctionValue()).isCloseTo(-Math.log(3), within(1e-15));
        assertThat(result.getFunctionCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("A gradient that contradicts the function never yields a Wolfe point")
    void testInconsistentGradient() {
        LineSearchResult result = search(MoreThuenteLineSearch.builder().maxEvaluations(200).build(),
                x -> (x[0] - 5) * (x[0] - 5), x -> new double[]{-1}, 5, 1);

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Loose sufficient decrease still satisfies strong Wolfe on Rosenbrock")
    void testLooseFtol() {
        Objective rosenbrock = Objective.of(
                x -> Math.pow(1 - x[0], 2) + 100 * Math.pow(x[1] - x[0] * x[0], 2),
                x -> new double[]{
                        -2 * (1 - x[0]) - 400 * x[0] * (x[1] - x[0] * x[0]),
                        200 * (x[1] - x[0] * x[0])});
        double[] x = {-1.2, 1.0};
        double[] gx = rosenbrock.gradient(x);
        double[] d = Vectors.negate(gx);

        LineSearchResult result = MoreThuenteLineSearch.builder().ftol(0.4).build()
                .search(rosenbrock, x, d, rosenbrock.value(x), gx);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(rosenbrock.value(x));
        assertThat(Math.abs(Vectors.dot(result.getGradient(), d)))
                .isLessThanOrEqualTo(0.9 * Math.abs(Vectors.dot(gx, d)));
    }
}
