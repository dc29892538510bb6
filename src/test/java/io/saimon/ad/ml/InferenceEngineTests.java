/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.client.ModelRegistry;
import io.saimon.ad.feature.FeatureBuilder;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.model.ModelKey;
import io.saimon.ad.model.Severity;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableMap;

public class InferenceEngineTests {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private FeatureBuilder featureBuilder;
    private SeverityClassifier severityClassifier;
    private Stats stats;

    @Before
    public void setup() {
        featureBuilder = new FeatureBuilder(Arrays.asList(5, 10, 30));
        severityClassifier = new SeverityClassifier(0.7, 0.85, 0.95, 0.99);
        stats = Stats.withCounters();
    }

    private ModelStore realStore() {
        List<AlgorithmTrainer> trainers = Arrays.asList(new ZScoreTrainer(3.0), new IsolationForestTrainer(50, "256", "0.1", 42));
        CheckpointDao checkpointDao = new CheckpointDao(folder.getRoot().toPath(), ModelTrainer.getModelClasses(trainers));
        return new ModelStore(checkpointDao, mock(ModelRegistry.class), TestHelpers.fixedClock(), stats);
    }

    private InferenceEngine engine(ModelStore store, int minConsecutive) {
        return new InferenceEngine(store, featureBuilder, severityClassifier, 0.7, minConsecutive, TestHelpers.fixedClock(), stats);
    }

    private MetricSeries spikedSeries() {
        double[] values = TestHelpers.truncatedNormal(2000, 60, 5, 12.5, 1234);
        for (int i = 1000; i <= 1005; i++) {
            values[i] = 150;
        }
        return TestHelpers.seriesOf(TestHelpers.METRIC, ImmutableMap.of("instance", "node-1"), values);
    }

    @Test
    public void detect_flagsOnlyTheSpike() {
        ModelStore store = realStore();
        MetricSeries series = spikedSeries();
        new ModelTrainer(Arrays.asList(new ZScoreTrainer(3.0)), featureBuilder, store, 1000, stats).trainMetric(TestHelpers.METRIC, series);

        List<AnomalyRecord> anomalies = engine(store, 1).detect(series);

        assertEquals(6, anomalies.size());
        for (int i = 0; i < anomalies.size(); i++) {
            AnomalyRecord anomaly = anomalies.get(i);
            assertEquals(TestHelpers.START.plus(Duration.ofMinutes(1000 + i)), anomaly.getTimestamp());
            assertEquals(150, anomaly.getValue(), 0);
            assertTrue(anomaly.getSeverity().isAtLeast(Severity.HIGH));
            assertEquals(Algorithm.ZSCORE, anomaly.getAlgorithm());
            assertTrue(anomaly.getExpectedValue().isPresent());
            assertEquals(60, anomaly.getExpectedValue().get(), 1);
            assertEquals("node-1", anomaly.getLabels().get("instance"));
            assertEquals(TestHelpers.NOW, anomaly.getDetectedAt());
        }
        assertEquals(6L, stats.getStat(StatNames.ANOMALIES_DETECTED_COUNT.getName()).getValue());
    }

    @Test
    public void detect_isIdempotent() {
        ModelStore store = realStore();
        MetricSeries series = spikedSeries();
        new ModelTrainer(
            Arrays.asList(new ZScoreTrainer(3.0), new IsolationForestTrainer(50, "256", "0.1", 42)),
            featureBuilder,
            store,
            1000,
            stats
        ).trainMetric(TestHelpers.METRIC, series);
        FeatureMatrix features = featureBuilder.build(series).get();
        InferenceEngine engine = engine(store, 1);

        List<AnomalyRecord> first = engine.detect(series, features);
        List<AnomalyRecord> second = engine.detect(series, features);

        assertFalse(first.isEmpty());
        assertEquals(new HashSet<>(first), new HashSet<>(second));
        assertTrue(first.stream().anyMatch(anomaly -> anomaly.getAlgorithm() == Algorithm.ISOLATION_FOREST));
        assertTrue(
            first
                .stream()
                .filter(anomaly -> anomaly.getAlgorithm() == Algorithm.ISOLATION_FOREST)
                .noneMatch(anomaly -> anomaly.getExpectedValue().isPresent())
        );
    }

    @Test
    public void detect_emptySeriesYieldsNothing() {
        ModelStore store = mock(ModelStore.class);

        assertTrue(engine(store, 1).detect(MetricSeries.empty(TestHelpers.METRIC)).isEmpty());
    }

    @Test
    public void detect_withoutModelsYieldsNothing() {
        assertTrue(engine(realStore(), 1).detect(spikedSeries()).isEmpty());
    }

    @Test
    public void detect_skipsModelWithDifferentFeatureCount() {
        ModelStore store = mock(ModelStore.class);
        ModelState state = new ModelState(
            new ModelKey(TestHelpers.METRIC, Algorithm.ZSCORE),
            new ZScoreModel(0, 1, 3, 3),
            Instant.EPOCH,
            null
        );
        when(store.getModels(TestHelpers.METRIC)).thenReturn(Collections.singletonList(state));

        List<AnomalyRecord> anomalies = engine(store, 1).detect(TestHelpers.seriesOf(TestHelpers.METRIC, 0, 100, 0));

        assertTrue(anomalies.isEmpty());
        assertEquals(1L, stats.getStat(StatNames.INFERENCE_FAILURE_COUNT.getName()).getValue());
    }

    @Test
    public void detect_failingModelDoesNotStopOthers() {
        AnomalyModel broken = mock(AnomalyModel.class);
        when(broken.getAlgorithm()).thenReturn(Algorithm.ISOLATION_FOREST);
        when(broken.getFeatureCount()).thenReturn(7);
        when(broken.score(any())).thenThrow(new IllegalStateException("corrupted forest"));
        ModelKey zscoreKey = new ModelKey(TestHelpers.METRIC, Algorithm.ZSCORE);
        ModelKey forestKey = new ModelKey(TestHelpers.METRIC, Algorithm.ISOLATION_FOREST);
        ModelStore store = mock(ModelStore.class);
        when(store.getModels(TestHelpers.METRIC))
            .thenReturn(
                Arrays
                    .asList(
                        new ModelState(zscoreKey, new ZScoreModel(0, 1, 3, 7), Instant.EPOCH, null),
                        new ModelState(forestKey, broken, Instant.EPOCH, null)
                    )
            );

        List<AnomalyRecord> anomalies = engine(store, 1).detect(TestHelpers.seriesOf(TestHelpers.METRIC, 0, 100, 0));

        assertEquals(1, anomalies.size());
        assertEquals(Algorithm.ZSCORE, anomalies.get(0).getAlgorithm());
        assertEquals(Severity.CRITICAL, anomalies.get(0).getSeverity());
        assertEquals(1L, stats.getStat(StatNames.INFERENCE_FAILURE_COUNT.getName()).getValue());
    }

    @Test
    public void flag_strictlyAboveThreshold() {
        boolean[] flagged = engine(mock(ModelStore.class), 1).flag(new double[] { 0.7, 0.71, 0.2, 1.0 });

        assertArrayEquals(new boolean[] { false, true, false, true }, flagged);
    }

    @Test
    public void flag_requiresConsecutiveRun() {
        boolean[] flagged = engine(mock(ModelStore.class), 2).flag(new double[] { 0.8, 0.1, 0.9, 0.95, 0.2, 0.99, 0.98 });

        assertArrayEquals(new boolean[] { false, false, true, true, false, true, true }, flagged);
    }

    @Test
    public void score_returnsEmptyOnMismatch() {
        Optional<ScoringResult> result = engine(mock(ModelStore.class), 1)
            .score(TestHelpers.METRIC, new ZScoreModel(0, 1, 3, 2), featureBuilder.build(TestHelpers.seriesOf("m", 1, 2)).get());

        assertFalse(result.isPresent());
    }
}
