/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

/**
 * Represents bounds for an optimization variable.
 * <p>
 * An infinite side means the variable is unbounded on that side. Crossed
 * bounds are representable; the solvers that consume bounds reject them.
 * </p>
 */
public final class Bound {

    private static final Bound UNBOUNDED = new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final double lower;
    private final double upper;

    /**
     * Creates a bound with specified lower and upper limits.
     * @param lower Lower bound ({@link Double#NEGATIVE_INFINITY} for none)
     * @param upper Upper bound ({@link Double#POSITIVE_INFINITY} for none)
     * @throws IllegalArgumentException if either limit is NaN
     */
    public Bound(double lower, double upper) {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("Bound limits cannot be NaN");
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Creates an unbounded variable (no constraints).
     * @return Unbounded bound
     */
    public static Bound unbounded() {
        return UNBOUNDED;
    }

    public static Bound between(double lower, double upper) {
        return new Bound(lower, upper);
    }

    /**
     * Creates a bound with only a lower limit (x >= value).
     * @param value Minimum value
     * @return Bound with lower limit only
     */
    public static Bound atLeast(double value) {
        return new Bound(value, Double.POSITIVE_INFINITY);
    }

    /**
     * Creates a bound with only an upper limit (x <= value).
     * @param value Maximum value
     * @return Bound with upper limit only
     */
    public static Bound atMost(double value) {
        return new Bound(Double.NEGATIVE_INFINITY, value);
    }

    /**
     * Creates a fixed bound where the variable must equal the given value.
     * @param value Exact value
     * @return Fixed bound
     */
    public static Bound exactly(double value) {
        return new Bound(value, value);
    }

    /**
     * Splits bounds into lower and upper arrays.
     * @param bounds Per-variable bounds
     * @return {@code {lower, upper}}
     */
    static double[][] split(Bound[] bounds) {
        double[] lower = new double[bounds.length];
        double[] upper = new double[bounds.length];
        for (int i = 0; i < bounds.length; i++) {
            Bound b = bounds[i] != null ? bounds[i] : UNBOUNDED;
            lower[i] = b.lower;
            upper[i] = b.upper;
        }
        return new double[][]{lower, upper};
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /**
     * Checks if this bound has a lower limit.
     * @return true if the lower limit is finite
     */
    public boolean hasLower() {
        return !Double.isInfinite(lower);
    }

    /**
     * Checks if this bound has an upper limit.
     * @return true if the upper limit is finite
     */
    public boolean hasUpper() {
        return !Double.isInfinite(upper);
    }

    /**
     * Checks if this is a fixed bound (lower == upper).
     * @return true if fixed
     */
    public boolean isFixed() {
        return hasLower() && hasUpper() && lower == upper;
    }

    public boolean isUnbounded() {
        return !hasLower() && !hasUpper();
    }

    @Override
    public String toString() {
        if (isUnbounded()) return "(-∞, +∞)";
        if (isFixed()) return "[" + lower + "]";
        String l = hasLower() ? "[" + lower : "(-∞";
        String u = hasUpper() ? upper + "]" : "+∞)";
        return l + ", " + u;
    }
}
