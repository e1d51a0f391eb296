/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class NonlinearConstraintsTest {

    private static final ConstraintFunction CIRCLE_AND_LINE =
            x -> new double[]{x[0] * x[0] + x[1] * x[1], x[0] - x[1]};

    @Test
    void testAnalyticJacobian() {
        NonlinearConstraints constraints = NonlinearConstraints.of(CIRCLE_AND_LINE,
                x -> new double[][]{{2 * x[0], 2 * x[1]}, {1, -1}},
                new double[]{Double.NEGATIVE_INFINITY, 0}, new double[]{1, 0});
        double[] x = {0.5, 2};

        assertThat(constraints.size()).isEqualTo(2);
        assertThat(constraints.values(x)).containsExactly(4.25, -1.5);
        assertThat(constraints.jacobian(x, constraints.values(x))[0]).containsExactly(1.0, 4.0);
        assertThat(constraints.getLower(1)).isEqualTo(constraints.getUpper(1));
    }

    @Test
    void testFiniteDifferenceJacobian() {
        NonlinearConstraints constraints = NonlinearConstraints.equalTo(CIRCLE_AND_LINE, null, new double[]{1, 0});
        double[] x = {0.5, 2};

        double[][] jac = constraints.jacobian(x, constraints.values(x));

        assertThat(jac[0]).containsExactly(new double[]{1.0, 4.0}, within(1e-6));
        assertThat(jac[1]).containsExactly(new double[]{1.0, -1.0}, within(1e-6));
        assertThat(x).containsExactly(0.5, 2);
    }

    @Test
    void testBoundsAreCopied() {
        double[] lower = {0};
        double[] upper = {1};
        NonlinearConstraints constraints = NonlinearConstraints.of(x -> new double[]{x[0]}, null, lower, upper);
        lower[0] = 5;

        assertThat(constraints.getLower(0)).isEqualTo(0.0);
    }

    @Test
    void testValidation() {
        assertThatThrownBy(() -> NonlinearConstraints.of(null, null, new double[]{0}, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Constraint function cannot be null");
        assertThatThrownBy(() -> NonlinearConstraints.of(CIRCLE_AND_LINE, null, null, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NonlinearConstraints.of(CIRCLE_AND_LINE, null,
                new double[]{Double.NaN}, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Constraint bounds cannot be NaN");
    }
}
