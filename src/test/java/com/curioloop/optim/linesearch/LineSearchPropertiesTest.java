/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the line search contract on random scaled quadratics.
 */
public class LineSearchPropertiesTest {

    @Provide
    Arbitrary<LineSearch> lineSearches() {
        return Arbitraries.of(
                BacktrackingLineSearch.defaults(),
                StrongWolfeLineSearch.defaults(),
                HagerZhangLineSearch.defaults(),
                MoreThuenteLineSearch.defaults());
    }

    /**
     * A successful search reports a positive step and the objective value at that step.
     */
    @Property(tries = 200)
    @Label("Accepted steps are positive and report f(x + alpha*d)")
    void acceptedStepMatchesObjective(
            @ForAll("lineSearches") LineSearch search,
            @ForAll @DoubleRange(min = 0.5, max = 20.0) double a,
            @ForAll @DoubleRange(min = 0.5, max = 20.0) double b,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double x0,
            @ForAll @DoubleRange(min = -10.0, max = 10.0) double x1
    ) {
        Assume.that(Math.abs(x0) + Math.abs(x1) > 1e-3);

        Objective quadratic = Objective.of(
                x -> a * x[0] * x[0] + b * x[1] * x[1] + 1.0,
                x -> new double[]{2 * a * x[0], 2 * b * x[1]});
        double[] x = {x0, x1};
        double fx = quadratic.value(x);
        double[] gx = quadratic.gradient(x);
        double[] d = Vectors.negate(gx);

        LineSearchResult result = search.search(quadratic, x, d, fx, gx);

        if (result.isSuccess()) {
            assertThat(result.getAlpha()).isPositive();
            double expected = quadratic.value(Vectors.addScaled(x, d, result.getAlpha()));
            assertThat(result.getFunctionValue()).isCloseTo(expected, within(1e-12 * Math.max(1.0, Math.abs(expected))));
            assertThat(result.getFunctionValue()).isLessThanOrEqualTo(fx * (1 + 1e-6));
        }
        assertThat(result.getFunctionCalls()).isPositive();
        assertThat(result.getGradientCalls()).isNotNegative();
        assertThat(x).as("start point untouched").containsExactly(x0, x1);
    }

    /**
     * Every search finds an acceptable step along steepest descent of a convex quadratic.
     */
    @Property(tries = 100)
    @Label("Steepest descent on a convex quadratic always succeeds")
    void steepestDescentSucceeds(
            @ForAll("lineSearches") LineSearch search,
            @ForAll @DoubleRange(min = 0.5, max = 5.0) double a,
            @ForAll @DoubleRange(min = 1.0, max = 10.0) double x0
    ) {
        Objective quadratic = Objective.of(
                x -> a * x[0] * x[0] + x[1] * x[1] + 1.0,
                x -> new double[]{2 * a * x[0], 2 * x[1]});
        double[] x = {x0, x0};
        double[] gx = quadratic.gradient(x);

        LineSearchResult result = search.search(quadratic, x, Vectors.negate(gx), quadratic.value(x), gx);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFunctionValue()).isLessThan(quadratic.value(x));
    }
}
