/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.optim.linalg;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for dense vector primitives.
 */
public class VectorsTest {

    @Test
    @DisplayName("Norms and dot product")
    void testNorms() {
        double[] a = {3, -4};
        assertThat(Vectors.dot(a, new double[]{1, 2})).isEqualTo(-5.0);
        assertThat(Vectors.norm(a)).isEqualTo(5.0);
        assertThat(Vectors.normInf(a)).isEqualTo(4.0);
        assertThat(Vectors.norm1(a)).isEqualTo(7.0);
        assertThat(Vectors.norm(new double[]{0, 0, 0})).isZero();
        assertThat(Vectors.normInf(new double[]{1, Double.NaN, 2})).isNaN();
        assertThat(Vectors.normInf(new double[]{Double.NaN, 5})).isNaN();
    }

    @Test
    @DisplayName("Element-wise operations return new arrays")
    void testPurity() {
        double[] a = {1, 2};
        double[] b = {10, 20};

        assertThat(Vectors.add(a, b)).containsExactly(11, 22);
        assertThat(Vectors.subtract(b, a)).containsExactly(9, 18);
        assertThat(Vectors.scale(a, -2)).containsExactly(-2, -4);
        assertThat(Vectors.negate(a)).containsExactly(-1, -2);
        assertThat(Vectors.addScaled(a, b, 0.5)).containsExactly(6, 12);

        assertThat(a).as("inputs untouched").containsExactly(1, 2);
        assertThat(b).containsExactly(10, 20);

        double[] copy = Vectors.copy(a);
        copy[0] = 99;
        assertThat(a[0]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Zeros and finiteness")
    void testZerosAndFinite() {
        assertThat(Vectors.zeros(3)).containsExactly(0, 0, 0);
        assertThat(Vectors.isFinite(new double[]{1, -2})).isTrue();
        assertThat(Vectors.isFinite(new double[]{1, Double.NaN})).isFalse();
        assertThat(Vectors.isFinite(new double[]{Double.NEGATIVE_INFINITY})).isFalse();
    }
}
