/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;
import org.opensearch.common.settings.Settings;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.common.exception.DataUnavailableException;
import io.saimon.ad.common.exception.InsufficientDataException;
import io.saimon.ad.feature.FeatureBuilder;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.model.ModelKey;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

public class ModelTrainerTests {

    private ModelStore store;
    private Stats stats;
    private FeatureBuilder featureBuilder;

    @Before
    public void setup() {
        store = mock(ModelStore.class);
        when(store.publish(any(), any()))
            .thenAnswer(invocation -> new ModelState(invocation.getArgument(0), invocation.getArgument(1), TestHelpers.NOW, null));
        stats = Stats.withCounters();
        featureBuilder = new FeatureBuilder(Arrays.asList(5, 10, 30));
    }

    @Test
    public void trainMetric_belowMinimumTrainsNothing() {
        ModelTrainer trainer = new ModelTrainer(Arrays.asList(new ZScoreTrainer(3.0)), featureBuilder, store, 1000, stats);
        MetricSeries series = TestHelpers.seriesOf(TestHelpers.METRIC, TestHelpers.normal(500, 60, 5, 1));

        try {
            trainer.trainMetric(TestHelpers.METRIC, series);
            fail("expected InsufficientDataException");
        } catch (InsufficientDataException e) {
            assertEquals(500, e.getActualPoints());
            assertEquals(1000, e.getRequiredPoints());
            assertEquals(TestHelpers.METRIC, e.getMetricName());
        }
        verifyNoInteractions(store);
    }

    @Test(expected = DataUnavailableException.class)
    public void trainMetric_rejectsEmptySeries() {
        new ModelTrainer(Arrays.asList(new ZScoreTrainer(3.0)), featureBuilder, store, 10, stats)
            .trainMetric(TestHelpers.METRIC, MetricSeries.empty(TestHelpers.METRIC));
    }

    @Test
    public void train_failingAlgorithmDoesNotStopOthers() {
        AlgorithmTrainer broken = mock(AlgorithmTrainer.class);
        when(broken.getAlgorithm()).thenReturn(Algorithm.ONE_CLASS_SVM);
        when(broken.train(any())).thenThrow(new IllegalStateException("solver diverged"));
        ModelTrainer trainer = new ModelTrainer(
            Arrays.asList(new ZScoreTrainer(3.0), broken, new IsolationForestTrainer(10, "auto", "0.1", 42)),
            featureBuilder,
            store,
            100,
            stats
        );

        List<ModelState> published = trainer
            .trainMetric(TestHelpers.METRIC, TestHelpers.seriesOf(TestHelpers.METRIC, TestHelpers.normal(200, 60, 5, 1)));

        assertThat(
            published.stream().map(state -> state.getKey().getAlgorithm()).collect(Collectors.toList()),
            contains(Algorithm.ZSCORE, Algorithm.ISOLATION_FOREST)
        );
        verify(store, never()).publish(eq(new ModelKey(TestHelpers.METRIC, Algorithm.ONE_CLASS_SVM)), any());
        assertEquals(1L, stats.getStat(StatNames.MODEL_FIT_FAILURE_COUNT.getName()).getValue());
        assertEquals(2L, stats.getStat(StatNames.MODELS_TRAINED_COUNT.getName()).getValue());
    }

    @Test
    public void createTrainers_followsEnabledFlags() {
        Settings settings = Settings
            .builder()
            .put("models.unsupervised.isolation_forest.enabled", false)
            .put("models.unsupervised.one_class_svm.enabled", true)
            .put("models.unsupervised.random_cut_forest.enabled", true)
            .build();

        List<AlgorithmTrainer> trainers = ModelTrainer.createTrainers(settings);

        assertThat(
            trainers.stream().map(AlgorithmTrainer::getAlgorithm).collect(Collectors.toList()),
            contains(Algorithm.ZSCORE, Algorithm.ONE_CLASS_SVM, Algorithm.RANDOM_CUT_FOREST)
        );
        assertEquals(OneClassSvmModel.class, ModelTrainer.getModelClasses(trainers).get(Algorithm.ONE_CLASS_SVM));
    }

    @Test
    public void createTrainers_defaultsToZScoreAndIsolationForest() {
        List<AlgorithmTrainer> trainers = ModelTrainer.createTrainers(Settings.EMPTY);

        assertThat(
            trainers.stream().map(AlgorithmTrainer::getAlgorithm).collect(Collectors.toList()),
            contains(Algorithm.ZSCORE, Algorithm.ISOLATION_FOREST)
        );
    }

    @Test
    public void trainMetric_publishesUnderMetricKey() {
        ModelTrainer trainer = new ModelTrainer(Arrays.asList(new ZScoreTrainer(3.0)), featureBuilder, store, 3, stats);

        trainer.trainMetric("disk", TestHelpers.seriesOf("disk", 1, 2, 3, 4));

        verify(store).publish(eq(new ModelKey("disk", Algorithm.ZSCORE)), any(ZScoreModel.class));
    }
}
