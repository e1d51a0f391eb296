/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;
import com.curioloop.optim.linalg.Vectors;

/**
 * More-Thuente line search (MINPACK {@code cvsrch} / {@code cstep}).
 * <p>
 * Keeps an interval of uncertainty [stx, sty] and picks each trial step by
 * safeguarded cubic or quadratic interpolation. While no step with sufficient
 * decrease and non-negative modified slope has been seen (stage 1), the search
 * runs on the auxiliary function ψ(α) = φ(α) − φ(0) − ftol·α·φ'(0). Whenever the
 * interval fails to shrink by 2/3 the next trial is its midpoint.
 * </p>
 * <p>
 * Success means the strong Wolfe conditions hold; every other exit (interval
 * below {@code xtol}, evaluation budget, step stuck at a bound, rounding) is
 * reported with {@code success = false} and the last evaluated point.
 * </p>
 *
 * @see <a href="https://doi.org/10.1145/192115.192132">More &amp; Thuente (1994)</a>
 */
public final class MoreThuenteLineSearch implements LineSearch {

    private static final int MAX_FINITE_RETRIES = 50;

    private final double ftol;
    private final double gtol;
    private final double xtol;
    private final double alphaMin;
    private final double alphaMax;
    private final int maxEvaluations;

    private MoreThuenteLineSearch(Builder builder) {
        this.ftol = builder.ftol;
        this.gtol = builder.gtol;
        this.xtol = builder.xtol;
        this.alphaMin = builder.alphaMin;
        this.alphaMax = builder.alphaMax;
        this.maxEvaluations = builder.maxEvaluations;
    }

    /**
     * Creates a search with ftol = 1e-4, gtol = 0.9, xtol = 1e-8, α ∈ [1e-16, 65536] and 100 evaluations.
     * @return Line search
     */
    public static MoreThuenteLineSearch defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LineSearchResult search(Objective objective, double[] x, double[] d, double fx, double[] gx) {
        double slope0 = Vectors.dot(gx, d);
        double dgtest = ftol * slope0;

        Interval iv = new Interval(fx, slope0);
        boolean stage1 = true;
        double width = alphaMax - alphaMin;
        double width1 = 2.0 * width;
        boolean stepOk = true;

        int evaluations = 0;
        double stp = Math.max(alphaMin, Math.min(1.0, alphaMax));
        double fp;
        double dp;
        double[] gp;

        while (true) {
            double stmin;
            double stmax;
            if (iv.bracketed) {
                stmin = Math.min(iv.stx, iv.sty);
                stmax = Math.max(iv.stx, iv.sty);
            } else {
                stmin = iv.stx;
                stmax = stp + 4.0 * (stp - iv.stx);
            }
            stmin = Math.max(alphaMin, stmin);
            stmax = Math.min(alphaMax, stmax);

            stp = Math.max(stp, alphaMin);
            stp = Math.min(stp, alphaMax);

            // Unusual termination: fall back to the best step so far
            if ((iv.bracketed && (stp <= stmin || stp >= stmax))
                    || evaluations >= maxEvaluations - 1 || !stepOk
                    || (iv.bracketed && stmax - stmin <= xtol * stmax)) {
                stp = iv.stx;
            }

            double[] xp = Vectors.addScaled(x, d, stp);
            fp = objective.value(xp);
            gp = objective.gradient(xp);
            evaluations++;
            dp = Vectors.dot(gp, d);

            if (evaluations == 1) {
                int retries = 0;
                while ((!Double.isFinite(fp) || !Double.isFinite(dp)) && retries < MAX_FINITE_RETRIES) {
                    retries++;
                    stp *= 0.5;
                    xp = Vectors.addScaled(x, d, stp);
                    fp = objective.value(xp);
                    gp = objective.gradient(xp);
                    evaluations++;
                    dp = Vectors.dot(gp, d);
                    iv.stx = 0.875 * stp;
                }
            }

            double ftest = fx + stp * dgtest;
            int info = 0;
            if ((iv.bracketed && (stp <= stmin || stp >= stmax)) || !stepOk) {
                info = 6;
            }
            if (stp == alphaMax && fp <= ftest && dp <= dgtest) {
                info = 5;
            }
            if (stp == alphaMin && (fp > ftest || dp >= dgtest)) {
                info = 4;
            }
            if (evaluations >= maxEvaluations) {
                info = 3;
            }
            if (iv.bracketed && stmax - stmin <= xtol * stmax) {
                info = 2;
            }
            if (fp <= ftest && Math.abs(dp) <= -gtol * slope0) {
                info = 1;
            }
            if (info != 0) {
                return new LineSearchResult(stp, fp, gp, evaluations, evaluations, info == 1);
            }

            if (stage1 && fp <= ftest && dp >= Math.min(ftol, gtol) * slope0) {
                stage1 = false;
            }

            if (stage1 && fp <= iv.fx && fp > ftest) {
                // Step on the modified function ψ
                Interval modified = iv.shifted(dgtest);
                stp = cstep(modified, stp, fp - stp * dgtest, dp - dgtest, stmin, stmax);
                iv.restore(modified, dgtest);
                stepOk = modified.stepOk;
            } else {
                stp = cstep(iv, stp, fp, dp, stmin, stmax);
                stepOk = iv.stepOk;
            }

            if (iv.bracketed) {
                if (Math.abs(iv.sty - iv.stx) >= (2.0 / 3.0) * width1) {
                    stp = iv.stx + 0.5 * (iv.sty - iv.stx);
                }
                width1 = width;
                width = Math.abs(iv.sty - iv.stx);
            }
        }
    }

    /**
     * Computes a safeguarded trial step and updates the interval of uncertainty.
     * <p>
     * The four cases follow MINPACK {@code dcstep}:
     * </p>
     * <ol>
     *   <li>higher function value: the minimum is bracketed</li>
     *   <li>lower value, derivatives of opposite sign: the minimum is bracketed</li>
     *   <li>lower value, same sign, derivative magnitude decreases</li>
     *   <li>lower value, same sign, derivative magnitude does not decrease</li>
     * </ol>
     * @param iv Interval, updated in place
     * @param stp Current step
     * @param fp Function value at {@code stp}
     * @param dp Derivative at {@code stp}
     * @param stmin Lower bound for the new step
     * @param stmax Upper bound for the new step
     * @return New trial step
     */
    static double cstep(Interval iv, double stp, double fp, double dp, double stmin, double stmax) {
        double stx = iv.stx;
        double fx = iv.fx;
        double dx = iv.dx;
        double sty = iv.sty;
        double fy = iv.fy;
        double dy = iv.dy;
        boolean bracketed = iv.bracketed;

        double sgnd = dp * (dx / Math.abs(dx));
        boolean bound;
        double stpf;

        if (fp > fx) {
            bound = true;
            double theta = 3.0 * (fx - fp) / (stp - stx) + dx + dp;
            double s = max3(Math.abs(theta), Math.abs(dx), Math.abs(dp));
            double gamma = s * Math.sqrt(square(theta / s) - (dx / s) * (dp / s));
            if (stp < stx) {
                gamma = -gamma;
            }
            double p = (gamma - dx) + theta;
            double q = ((gamma - dx) + gamma) + dp;
            double r = p / q;
            double stpc = stx + r * (stp - stx);
            double stpq = stx + ((dx / ((fx - fp) / (stp - stx) + dx)) / 2.0) * (stp - stx);
            if (Math.abs(stpc - stx) < Math.abs(stpq - stx)) {
                stpf = stpc;
            } else {
                stpf = stpc + (stpq - stpc) / 2.0;
            }
            bracketed = true;
        } else if (sgnd < 0.0) {
            bound = false;
            double theta = 3.0 * (fx - fp) / (stp - stx) + dx + dp;
            double s = max3(Math.abs(theta), Math.abs(dx), Math.abs(dp));
            double gamma = s * Math.sqrt(square(theta / s) - (dx / s) * (dp / s));
            if (stp > stx) {
                gamma = -gamma;
            }
            double p = (gamma - dp) + theta;
            double q = ((gamma - dp) + gamma) + dx;
            double r = p / q;
            double stpc = stp + r * (stx - stp);
            double stpq = stp + (dp / (dp - dx)) * (stx - stp);
            stpf = Math.abs(stpc - stp) > Math.abs(stpq - stp) ? stpc : stpq;
            bracketed = true;
        } else if (Math.abs(dp) < Math.abs(dx)) {
            bound = true;
            double theta = 3.0 * (fx - fp) / (stp - stx) + dx + dp;
            double s = max3(Math.abs(theta), Math.abs(dx), Math.abs(dp));
            double gamma = s * Math.sqrt(Math.max(0.0, square(theta / s) - (dx / s) * (dp / s)));
            if (stp > stx) {
                gamma = -gamma;
            }
            double p = (gamma - dp) + theta;
            double q = (gamma + (dx - dp)) + gamma;
            double r = p / q;
            double stpc;
            if (r < 0.0 && gamma != 0.0) {
                stpc = stp + r * (stx - stp);
            } else if (stp > stx) {
                stpc = stmax;
            } else {
                stpc = stmin;
            }
            double stpq = stp + (dp / (dp - dx)) * (stx - stp);
            if (bracketed) {
                stpf = Math.abs(stp - stpc) < Math.abs(stp - stpq) ? stpc : stpq;
            } else {
                stpf = Math.abs(stp - stpc) > Math.abs(stp - stpq) ? stpc : stpq;
            }
        } else {
            bound = false;
            if (bracketed) {
                double theta = 3.0 * (fp - fy) / (sty - stp) + dy + dp;
                double s = max3(Math.abs(theta), Math.abs(dy), Math.abs(dp));
                double gamma = s * Math.sqrt(square(theta / s) - (dy / s) * (dp / s));
                if (stp > sty) {
                    gamma = -gamma;
                }
                double p = (gamma - dp) + theta;
                double q = ((gamma - dp) + gamma) + dy;
                double r = p / q;
                stpf = stp + r * (sty - stp);
            } else if (stp > stx) {
                stpf = stmax;
            } else {
                stpf = stmin;
            }
        }

        if (fp > fx) {
            iv.sty = stp;
            iv.fy = fp;
            iv.dy = dp;
        } else {
            if (sgnd < 0.0) {
                iv.sty = stx;
                iv.fy = fx;
                iv.dy = dx;
            }
            iv.stx = stp;
            iv.fx = fp;
            iv.dx = dp;
        }

        stpf = Math.min(stmax, stpf);
        stpf = Math.max(stmin, stpf);
        if (bracketed && bound) {
            double limit = iv.stx + (2.0 / 3.0) * (iv.sty - iv.stx);
            stpf = iv.sty > iv.stx ? Math.min(limit, stpf) : Math.max(limit, stpf);
        }

        iv.bracketed = bracketed;
        iv.stepOk = !Double.isNaN(stpf);
        return stpf;
    }

    private static double max3(double a, double b, double c) {
        return Math.max(a, Math.max(b, c));
    }

    private static double square(double v) {
        return v * v;
    }

    /** Interval of uncertainty with function values and derivatives at both ends. */
    static final class Interval {
        double stx;
        double fx;
        double dx;
        double sty;
        double fy;
        double dy;
        boolean bracketed;
        boolean stepOk = true;

        Interval(double f0, double slope0) {
            this.fx = f0;
            this.dx = slope0;
            this.fy = f0;
            this.dy = slope0;
        }

        Interval shifted(double dgtest) {
            Interval m = new Interval(fx - stx * dgtest, dx - dgtest);
            m.stx = stx;
            m.sty = sty;
            m.fy = fy - sty * dgtest;
            m.dy = dy - dgtest;
            m.bracketed = bracketed;
            return m;
        }

        void restore(Interval m, double dgtest) {
            stx = m.stx;
            sty = m.sty;
            fx = m.fx + m.stx * dgtest;
            fy = m.fy + m.sty * dgtest;
            dx = m.dx + dgtest;
            dy = m.dy + dgtest;
            bracketed = m.bracketed;
        }
    }

    /**
     * Builder for {@link MoreThuenteLineSearch}.
     */
    public static final class Builder {
        private double ftol = 1e-4;
        private double gtol = 0.9;
        private double xtol = 1e-8;
        private double alphaMin = 1e-16;
        private double alphaMax = 65536.0;
        private int maxEvaluations = 100;

        private Builder() {}

        /**
         * Sets the sufficient decrease constant.
         * @param value ftol in (0, 1)
         * @return This builder
         */
        public Builder ftol(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("ftol must be in (0, 1)");
            }
            this.ftol = value;
            return this;
        }

        /**
         * Sets the curvature constant.
         * @param value gtol in (0, 1)
         * @return This builder
         */
        public Builder gtol(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("gtol must be in (0, 1)");
            }
            this.gtol = value;
            return this;
        }

        /**
         * Sets the relative width below which the interval counts as collapsed.
         * @param value xtol ≥ 0
         * @return This builder
         */
        public Builder xtol(double value) {
            if (!(value >= 0)) {
                throw new IllegalArgumentException("xtol must be non-negative");
            }
            this.xtol = value;
            return this;
        }

        public Builder stepBounds(double min, double max) {
            if (!(min >= 0 && max > min)) {
                throw new IllegalArgumentException("Step bounds must satisfy 0 <= min < max");
            }
            this.alphaMin = min;
            this.alphaMax = max;
            return this;
        }

        public Builder maxEvaluations(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("Max evaluations must be positive");
            }
            this.maxEvaluations = value;
            return this;
        }

        public MoreThuenteLineSearch build() {
            return new MoreThuenteLineSearch(this);
        }
    }
}
