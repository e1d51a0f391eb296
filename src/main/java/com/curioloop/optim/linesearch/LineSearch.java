/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linesearch;

import com.curioloop.optim.Objective;

/**
 * One-dimensional search along a descent direction.
 * <p>
 * Implementations look for a step length α so that {@code x + α·d} is an
 * acceptable next iterate. They are stateless and may be shared between solvers.
 * </p>
 *
 * <h2>Available strategies</h2>
 * <ul>
 *   <li>{@link BacktrackingLineSearch}: Armijo sufficient decrease only</li>
 *   <li>{@link StrongWolfeLineSearch}: bracket and zoom on the strong Wolfe conditions</li>
 *   <li>{@link HagerZhangLineSearch}: approximate Wolfe conditions</li>
 *   <li>{@link MoreThuenteLineSearch}: safeguarded cubic interpolation</li>
 * </ul>
 */
@FunctionalInterface
public interface LineSearch {

    /**
     * Searches along {@code d} starting from {@code x}.
     * @param objective Objective and its gradient
     * @param x Current iterate (not modified)
     * @param d Search direction, expected to satisfy ∇f(x)·d &lt; 0
     * @param fx f(x)
     * @param gx ∇f(x)
     * @return Accepted step, or the best attempt with {@code success = false}
     */
    LineSearchResult search(Objective objective, double[] x, double[] d, double fx, double[] gx);
}
