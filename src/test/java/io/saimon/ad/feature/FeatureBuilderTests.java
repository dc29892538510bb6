/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

import org.junit.Test;
import org.junit.runner.RunWith;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.model.MetricSeries;

@RunWith(JUnitParamsRunner.class)
public class FeatureBuilderTests {

    private FeatureBuilder builder = new FeatureBuilder(Arrays.asList(5, 10, 30));

    @Test
    public void build_returnsEmpty_forEmptySeries() {
        assertFalse(builder.build(MetricSeries.empty(TestHelpers.METRIC)).isPresent());
        assertFalse(builder.build(null).isPresent());
    }

    @Test
    public void build_namesColumnsInWindowOrder() {
        FeatureMatrix matrix = builder.build(TestHelpers.seriesOf(TestHelpers.METRIC, 1, 2, 3)).get();

        assertThat(
            matrix.getColumnNames(),
            contains("value", "rolling_mean_5", "rolling_std_5", "rolling_mean_10", "rolling_std_10", "rolling_mean_30", "rolling_std_30")
        );
        assertEquals(builder.getFeatureCount(), matrix.getColumnCount());
    }

    private Object[] lengthData() {
        return new Object[] { new Object[] { 1 }, new Object[] { 4 }, new Object[] { 30 }, new Object[] { 31 }, new Object[] { 500 } };
    }

    @Test
    @Parameters(method = "lengthData")
    public void build_keepsLengthAndHasNoMissingValues(int length) {
        FeatureMatrix matrix = builder.build(TestHelpers.seriesOf(TestHelpers.METRIC, TestHelpers.normal(length, 60, 5, 7))).get();

        assertEquals(length, matrix.getRowCount());
        assertEquals(7, matrix.getColumnCount());
        for (int i = 0; i < matrix.getRowCount(); i++) {
            for (int j = 0; j < matrix.getColumnCount(); j++) {
                assertTrue(Double.isFinite(matrix.get(i, j)));
            }
        }
    }

    @Test
    public void rollingMean_usesPartialWindowsAtTheStart() {
        double[] mean = FeatureBuilder.rollingMean(new double[] { 2, 4, 6, 8 }, 3);

        assertArrayEquals(new double[] { 2, 3, 4, 6 }, mean, 1e-12);
    }

    @Test
    public void rollingStd_isSampleStdAndZeroForSinglePoint() {
        double[] std = FeatureBuilder.rollingStd(new double[] { 2, 4, 6, 8 }, 3);

        assertEquals(0, std[0], 1e-12);
        assertEquals(Math.sqrt(2), std[1], 1e-12);
        assertEquals(2, std[2], 1e-12);
        assertEquals(2, std[3], 1e-12);
    }

    @Test
    public void build_copiesRawValuesIntoFirstColumn() {
        FeatureMatrix matrix = builder.build(TestHelpers.seriesOf(TestHelpers.METRIC, 3, 1, 4, 1, 5)).get();

        assertArrayEquals(new double[] { 3, 1, 4, 1, 5 }, matrix.getColumn(FeatureMatrix.VALUE_COLUMN), 0);
    }

    @Test
    public void build_sameSeriesYieldsEqualMatrices() {
        MetricSeries series = TestHelpers.seriesOf(TestHelpers.METRIC, TestHelpers.normal(100, 10, 2, 3));

        assertEquals(builder.build(series).get(), builder.build(series).get());
    }

    @Test(expected = IllegalArgumentException.class)
    public void constructor_rejectsNonPositiveWindow() {
        new FeatureBuilder(Arrays.asList(5, 0));
    }
}
