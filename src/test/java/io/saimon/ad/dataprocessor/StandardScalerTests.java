/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.dataprocessor;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class StandardScalerTests {

    @Test
    public void fit_usesPopulationStd() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 1, 10 }, { 3, 10 } });

        assertArrayEquals(new double[] { 2, 10 }, scaler.getMean(), 1e-12);
        assertArrayEquals(new double[] { 1, 1 }, scaler.getScale(), 1e-12);
        assertEquals(2, scaler.getDimensions());
    }

    @Test
    public void transform_centersAndScales() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 0, 5 }, { 4, 5 }, { 8, 5 } });

        double[][] scaled = scaler.transform(new double[][] { { 4, 5 }, { 8, 7 } });

        double std = Math.sqrt(32.0 / 3);
        assertArrayEquals(new double[] { 0, 0 }, scaled[0], 1e-12);
        assertArrayEquals(new double[] { 4 / std, 2 }, scaled[1], 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void transform_rejectsWrongDimension() {
        StandardScaler.fit(new double[][] { { 1, 2 } }).transform(new double[] { 1 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void fit_rejectsEmptyMatrix() {
        StandardScaler.fit(new double[0][]);
    }
}
