/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;

/**
 * Line search for the strong Wolfe conditions (Nocedal &amp; Wright, Algorithms 3.5 and 3.6).
 * <p>
 * An expansion phase doubles α until the Armijo bound is violated, the
 * objective stops decreasing, or the directional derivative turns non-negative.
 * A zoom phase then bisects the resulting bracket until both
 * </p>
 * <pre>
 *   f(x + α·d) ≤ f(x) + c₁·α·∇f(x)·d
 *   |∇f(x + α·d)·d| ≤ c₂·|∇f(x)·d|
 * </pre>
 * <p>
 * hold. The accepted gradient is returned so the caller can reuse it.
 * </p>
 */
public final class StrongWolfeLineSearch implements LineSearch {

    private static final int MAX_ZOOM_ITERATIONS = 20;
    private static final double MIN_BRACKET_WIDTH = 1e-14;

    private final double c1;
    private final double c2;
    private final double alphaMax;
    private final int maxIterations;

    private StrongWolfeLineSearch(Builder builder) {
        this.c1 = builder.c1;
        this.c2 = builder.c2;
        this.alphaMax = builder.alphaMax;
        this.maxIterations = builder.maxIterations;
    }

    /**
     * Creates a search with c₁ = 1e-4, c₂ = 0.9, α_max = 1e6 and 25 expansion steps.
     * @return Line search
     */
    public static StrongWolfeLineSearch defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LineSearchResult search(Objective objective, double[] x, double[] d, double fx, double[] gx) {
        Counter counter = new Counter();
        double slope0 = Vectors.dot(gx, d);

        double alphaPrev = 0.0;
        double fPrev = fx;
        double alpha = 1.0;

        for (int i = 0; i < maxIterations; i++) {
            double[] xNew = Vectors.addScaled(x, d, alpha);
            double fNew = objective.value(xNew);
            counter.functionCalls++;

            if (fNew > fx + c1 * alpha * slope0 || (i > 0 && fNew >= fPrev)) {
                return zoom(objective, x, d, fx, slope0, alphaPrev, alpha, fPrev, counter);
            }

            double[] gNew = objective.gradient(xNew);
            counter.gradientCalls++;
            double slope = Vectors.dot(gNew, d);

            if (Math.abs(slope) <= c2 * Math.abs(slope0)) {
                return counter.result(alpha, fNew, gNew, true);
            }
            if (slope >= 0) {
                return zoom(objective, x, d, fx, slope0, alpha, alphaPrev, fNew, counter);
            }

            alphaPrev = alpha;
            fPrev = fNew;
            alpha = Math.min(2.0 * alpha, alphaMax);
        }

        return counter.evaluate(objective, x, d, alpha, false);
    }

    private LineSearchResult zoom(Objective objective, double[] x, double[] d, double fx, double slope0,
                                  double alphaLo, double alphaHi, double fLo, Counter counter) {
        for (int j = 0; j < MAX_ZOOM_ITERATIONS; j++) {
            double alpha = 0.5 * (alphaLo + alphaHi);
            double[] xNew = Vectors.addScaled(x, d, alpha);
            double fNew = objective.value(xNew);
            counter.functionCalls++;

            if (fNew > fx + c1 * alpha * slope0 || fNew >= fLo) {
                alphaHi = alpha;
            } else {
                double[] gNew = objective.gradient(xNew);
                counter.gradientCalls++;
                double slope = Vectors.dot(gNew, d);

                if (Math.abs(slope) <= c2 * Math.abs(slope0)) {
                    return counter.result(alpha, fNew, gNew, true);
                }
                if (slope * (alphaHi - alphaLo) >= 0) {
                    alphaHi = alphaLo;
                }
                alphaLo = alpha;
                fLo = fNew;
            }

            if (Math.abs(alphaHi - alphaLo) < MIN_BRACKET_WIDTH) {
                break;
            }
        }
        return counter.evaluate(objective, x, d, alphaLo, false);
    }

    /** Evaluation counters of one search. */
    private static final class Counter {
        int functionCalls;
        int gradientCalls;

        LineSearchResult result(double alpha, double f, double[] g, boolean success) {
            return new LineSearchResult(alpha, f, g, functionCalls, gradientCalls, success);
        }

        LineSearchResult evaluate(Objective objective, double[] x, double[] d, double alpha, boolean success) {
            double[] xFinal = Vectors.addScaled(x, d, alpha);
            double f = objective.value(xFinal);
            double[] g = objective.gradient(xFinal);
            functionCalls++;
            gradientCalls++;
            return result(alpha, f, g, success);
        }
    }

    /**
     * Builder for {@link StrongWolfeLineSearch}.
     */
    public static final class Builder {
        private double c1 = 1e-4;
        private double c2 = 0.9;
        private double alphaMax = 1e6;
        private int maxIterations = 25;

        private Builder() {}

        /**
         * Sets the sufficient decrease constant.
         * @param value c₁ in (0, 1)
         * @return This builder
         */
        public Builder c1(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("c1 must be in (0, 1)");
            }
            this.c1 = value;
            return this;
        }

        /**
         * Sets the curvature constant.
         * @param value c₂ in (c₁, 1)
         * @return This builder
         */
        public Builder c2(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("c2 must be in (0, 1)");
            }
            this.c2 = value;
            return this;
        }

        public Builder alphaMax(double value) {
            if (!(value >= 1)) {
                throw new IllegalArgumentException("Maximum step must be at least 1");
            }
            this.alphaMax = value;
            return this;
        }

        public Builder maxIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max iterations must be positive");
            }
            this.maxIterations = value;
            return this;
        }

        public StrongWolfeLineSearch build() {
            if (c2 <= c1) {
                throw new IllegalArgumentException("c2 must exceed c1");
            }
            return new StrongWolfeLineSearch(this);
        }
    }
}
