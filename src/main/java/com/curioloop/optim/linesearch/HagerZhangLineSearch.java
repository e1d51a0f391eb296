/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;

/**
 * Hager-Zhang line search with approximate Wolfe conditions.
 * <p>
 * A step α is accepted when φ'(α) ≥ σ·φ'(0) and either the Armijo bound
 * φ(α) ≤ φ(0) + δ·α·φ'(0) holds or the approximate pair
 * </p>
 * <pre>
 *   φ(α) ≤ φ(0) + εₖ        (2δ − 1)·φ'(0) ≥ φ'(α)
 * </pre>
 * <p>
 * holds with εₖ = ε·|φ(0)|. The approximate test keeps the search useful close
 * to a minimizer, where differences of φ are dominated by round-off.
 * </p>
 * <p>
 * A bracket is grown from α = 1 by factor ρ and then narrowed by secant steps on
 * φ', kept strictly inside the bracket. When a secant step fails to shrink the
 * bracket by γ, a bisection at ratio θ follows.
 * </p>
 *
 * @see <a href="https://doi.org/10.1137/030601880">Hager &amp; Zhang (2005)</a>
 */
public final class HagerZhangLineSearch implements LineSearch {

    private static final double MIN_BRACKET_WIDTH = 1e-14;

    private final double delta;
    private final double sigma;
    private final double epsilon;
    private final double theta;
    private final double gamma;
    private final double rho;
    private final int maxBracketIterations;
    private final int maxSecantIterations;

    private HagerZhangLineSearch(Builder builder) {
        this.delta = builder.delta;
        this.sigma = builder.sigma;
        this.epsilon = builder.epsilon;
        this.theta = builder.theta;
        this.gamma = builder.gamma;
        this.rho = builder.rho;
        this.maxBracketIterations = builder.maxBracketIterations;
        this.maxSecantIterations = builder.maxSecantIterations;
    }

    /**
     * Creates a search with δ = 0.1, σ = 0.9, ε = 1e-6, θ = 0.5, γ = 0.66, ρ = 5.
     * @return Line search
     */
    public static HagerZhangLineSearch defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LineSearchResult search(Objective objective, double[] x, double[] d, double fx, double[] gx) {
        Phi phi = new Phi(objective, x, d, fx, Vectors.dot(gx, d));
        double epsK = epsilon * Math.abs(fx);

        // Bracket phase
        double c = 1.0;
        Point pc = phi.at(c);
        if (accepts(phi, pc, epsK)) {
            return phi.result(pc, true);
        }

        Point a = phi.origin();
        Point b = pc;
        if (!(pc.value > fx + epsK || pc.slope >= 0)) {
            boolean bracketed = false;
            for (int i = 0; i < maxBracketIterations; i++) {
                Point previous = pc;
                c *= rho;
                pc = phi.at(c);
                if (accepts(phi, pc, epsK)) {
                    return phi.result(pc, true);
                }
                if (pc.value > fx + epsK || pc.slope >= 0) {
                    a = previous;
                    b = pc;
                    bracketed = true;
                    break;
                }
            }
            if (!bracketed) {
                return phi.result(pc, false);
            }
        }

        // Secant and bisection phase
        double lastWidth = b.alpha - a.alpha;
        for (int i = 0; i < maxSecantIterations; i++) {
            double width = b.alpha - a.alpha;
            if (width < MIN_BRACKET_WIDTH) {
                Point mid = phi.at(0.5 * (a.alpha + b.alpha));
                return phi.result(mid, mid.value <= fx + epsK);
            }

            double cj;
            double denom = b.slope - a.slope;
            if (Math.abs(denom) > 1e-30) {
                cj = a.alpha - a.slope * width / denom;
                double margin = MIN_BRACKET_WIDTH * width;
                cj = Math.max(a.alpha + margin, Math.min(cj, b.alpha - margin));
            } else {
                cj = a.alpha + theta * width;
            }

            Point pj = phi.at(cj);
            if (accepts(phi, pj, epsK)) {
                return phi.result(pj, true);
            }
            if (pj.value > fx + epsK || pj.slope >= 0) {
                b = pj;
            } else {
                a = pj;
            }

            if (b.alpha - a.alpha > gamma * lastWidth) {
                Point mid = phi.at(a.alpha + theta * (b.alpha - a.alpha));
                if (accepts(phi, mid, epsK)) {
                    return phi.result(mid, true);
                }
                if (mid.value > fx + epsK || mid.slope >= 0) {
                    b = mid;
                } else {
                    a = mid;
                }
            }
            lastWidth = b.alpha - a.alpha;
        }

        Point best = phi.at(a.alpha);
        return phi.result(best, false);
    }

    private boolean accepts(Phi phi, Point p, double epsK) {
        if (p.slope < sigma * phi.slope0) {
            return false;
        }
        if (p.value <= phi.value0 + delta * p.alpha * phi.slope0) {
            return true;
        }
        return p.value <= phi.value0 + epsK && p.slope <= (2 * delta - 1) * phi.slope0;
    }

    /** A sample of φ and φ'. */
    private static final class Point {
        final double alpha;
        final double value;
        final double slope;
        final double[] gradient;

        Point(double alpha, double value, double slope, double[] gradient) {
            this.alpha = alpha;
            this.value = value;
            this.slope = slope;
            this.gradient = gradient;
        }
    }

    /** φ(α) = f(x + α·d) restricted to one search, with evaluation counters. */
    private static final class Phi {
        final Objective objective;
        final double[] x;
        final double[] d;
        final double value0;
        final double slope0;
        int functionCalls;
        int gradientCalls;

        Phi(Objective objective, double[] x, double[] d, double value0, double slope0) {
            this.objective = objective;
            this.x = x;
            this.d = d;
            this.value0 = value0;
            this.slope0 = slope0;
        }

        Point origin() {
            return new Point(0.0, value0, slope0, null);
        }

        Point at(double alpha) {
            double[] xa = Vectors.addScaled(x, d, alpha);
            double value = objective.value(xa);
            functionCalls++;
            double[] g = objective.gradient(xa);
            gradientCalls++;
            return new Point(alpha, value, Vectors.dot(g, d), g);
        }

        LineSearchResult result(Point p, boolean success) {
            return new LineSearchResult(p.alpha, p.value, p.gradient, functionCalls, gradientCalls, success);
        }
    }

    /**
     * Builder for {@link HagerZhangLineSearch}.
     */
    public static final class Builder {
        private double delta = 0.1;
        private double sigma = 0.9;
        private double epsilon = 1e-6;
        private double theta = 0.5;
        private double gamma = 0.66;
        private double rho = 5.0;
        private int maxBracketIterations = 50;
        private int maxSecantIterations = 50;

        private Builder() {}

        /**
         * Sets the sufficient decrease constant.
         * @param value δ in (0, 0.5)
         * @return This builder
         */
        public Builder delta(double value) {
            if (!(value > 0 && value < 0.5)) {
                throw new IllegalArgumentException("delta must be in (0, 0.5)");
            }
            this.delta = value;
            return this;
        }

        /**
         * Sets the curvature constant.
         * @param value σ in [δ, 1)
         * @return This builder
         */
        public Builder sigma(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("sigma must be in (0, 1)");
            }
            this.sigma = value;
            return this;
        }

        /**
         * Sets the relative tolerance of the approximate Wolfe test.
         * @param value ε ≥ 0
         * @return This builder
         */
        public Builder epsilon(double value) {
            if (!(value >= 0)) {
                throw new IllegalArgumentException("epsilon must be non-negative");
            }
            this.epsilon = value;
            return this;
        }

        public Builder theta(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("theta must be in (0, 1)");
            }
            this.theta = value;
            return this;
        }

        public Builder gamma(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("gamma must be in (0, 1)");
            }
            this.gamma = value;
            return this;
        }

        /**
         * Sets the bracket growth factor.
         * @param value ρ &gt; 1
         * @return This builder
         */
        public Builder rho(double value) {
            if (!(value > 1)) {
                throw new IllegalArgumentException("rho must exceed 1");
            }
            this.rho = value;
            return this;
        }

        public Builder maxBracketIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max bracket iterations must be positive");
            }
            this.maxBracketIterations = value;
            return this;
        }

        public Builder maxSecantIterations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max secant iterations must be positive");
            }
            this.maxSecantIterations = value;
            return this;
        }

        public HagerZhangLineSearch build() {
            if (sigma < delta) {
                throw new IllegalArgumentException("sigma must not be below delta");
            }
            return new HagerZhangLineSearch(this);
        }
    }
}
