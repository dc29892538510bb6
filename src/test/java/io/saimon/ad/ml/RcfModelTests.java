/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;

public class RcfModelTests {

    @Test
    public void outlierScoresHigherThanInlier() {
        RcfModel model = RcfModel.fit(TestHelpers.gaussianRows(1000, 3, 17), 50, 256, 42);
        FeatureMatrix features = new FeatureMatrix(
            new double[][] { { 0, 0, 0 }, { 10, -10, 10 } },
            Arrays.asList("value", "a", "b")
        );

        double[] raw = model.score(features);
        double[] normalized = model.normalize(raw);

        assertTrue(raw[1] > raw[0]);
        assertEquals(1, normalized[1], 0);
        assertEquals(0, normalized[0], 0);
        assertEquals(3, model.getFeatureCount());
        assertEquals(Algorithm.RANDOM_CUT_FOREST, model.getAlgorithm());
        assertEquals(1000L, model.getConfig().get("total_updates"));
    }
}
