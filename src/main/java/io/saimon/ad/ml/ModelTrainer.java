/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.common.settings.Settings;

import io.saimon.ad.common.exception.DataUnavailableException;
import io.saimon.ad.common.exception.InsufficientDataException;
import io.saimon.ad.common.exception.ModelFitException;
import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.feature.FeatureBuilder;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.model.ModelKey;
import io.saimon.ad.settings.AnomalyDetectorSettings;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableList;

/**
 * Trains one model per enabled algorithm for a metric and publishes each to the model store.
 *
 * Algorithms are trained independently: a failure of one is logged and counted, the others
 * still train and publish.
 */
public class ModelTrainer {
    private static final Logger logger = LogManager.getLogger(ModelTrainer.class);

    private final List<AlgorithmTrainer> trainers;
    private final FeatureBuilder featureBuilder;
    private final ModelStore modelStore;
    private final int minDataPoints;
    private final Stats stats;

    public ModelTrainer(
        List<AlgorithmTrainer> trainers,
        FeatureBuilder featureBuilder,
        ModelStore modelStore,
        int minDataPoints,
        Stats stats
    ) {
        this.trainers = ImmutableList.copyOf(trainers);
        this.featureBuilder = featureBuilder;
        this.modelStore = modelStore;
        this.minDataPoints = minDataPoints;
        this.stats = stats;
    }

    /**
     * Creates the trainers of every algorithm enabled in the settings.
     *
     * @param settings engine settings
     * @return trainers in algorithm order
     */
    public static List<AlgorithmTrainer> createTrainers(Settings settings) {
        List<AlgorithmTrainer> trainers = new ArrayList<>();
        if (AnomalyDetectorSettings.ZSCORE_ENABLED.get(settings)) {
            trainers.add(new ZScoreTrainer(AnomalyDetectorSettings.ZSCORE_THRESHOLD.get(settings)));
        }
        if (AnomalyDetectorSettings.ISOLATION_FOREST_ENABLED.get(settings)) {
            trainers
                .add(
                    new IsolationForestTrainer(
                        AnomalyDetectorSettings.ISOLATION_FOREST_N_ESTIMATORS.get(settings),
                        AnomalyDetectorSettings.ISOLATION_FOREST_MAX_SAMPLES.get(settings),
                        AnomalyDetectorSettings.ISOLATION_FOREST_CONTAMINATION.get(settings),
                        AnomalyDetectorSettings.ISOLATION_FOREST_RANDOM_STATE.get(settings)
                    )
                );
        }
        if (AnomalyDetectorSettings.ONE_CLASS_SVM_ENABLED.get(settings)) {
            trainers
                .add(
                    new OneClassSvmTrainer(
                        AnomalyDetectorSettings.ONE_CLASS_SVM_KERNEL.get(settings),
                        AnomalyDetectorSettings.ONE_CLASS_SVM_GAMMA.get(settings),
                        AnomalyDetectorSettings.ONE_CLASS_SVM_NU.get(settings),
                        AnomalyDetectorSettings.ONE_CLASS_SVM_DEGREE.get(settings),
                        AnomalyDetectorSettings.ONE_CLASS_SVM_COEF0.get(settings)
                    )
                );
        }
        if (AnomalyDetectorSettings.RCF_ENABLED.get(settings)) {
            trainers
                .add(
                    new RcfTrainer(
                        AnomalyDetectorSettings.RCF_N_ESTIMATORS.get(settings),
                        AnomalyDetectorSettings.RCF_SAMPLE_SIZE.get(settings),
                        AnomalyDetectorSettings.RCF_RANDOM_STATE.get(settings)
                    )
                );
        }
        return trainers;
    }

    /**
     * @param trainers algorithm trainers
     * @return model class of every algorithm, used to read checkpoints
     */
    public static Map<Algorithm, Class<? extends AnomalyModel>> getModelClasses(List<AlgorithmTrainer> trainers) {
        Map<Algorithm, Class<? extends AnomalyModel>> classes = new EnumMap<>(Algorithm.class);
        for (AlgorithmTrainer trainer : trainers) {
            classes.put(trainer.getAlgorithm(), trainer.getModelClass());
        }
        return classes;
    }

    /**
     * Trains every algorithm on the series of a metric.
     *
     * @param metricName metric name
     * @param series training series
     * @return states of the models that trained successfully
     * @throws DataUnavailableException when the series is empty
     * @throws InsufficientDataException when the series has fewer points than the configured minimum; no model is trained
     */
    public List<ModelState> trainMetric(String metricName, MetricSeries series) {
        if (series == null || series.isEmpty()) {
            throw new DataUnavailableException(metricName, CommonMessages.NO_DATA_RETURNED);
        }
        if (series.size() < minDataPoints) {
            throw new InsufficientDataException(
                metricName,
                CommonMessages.getInsufficientDataMsg(metricName, series.size(), minDataPoints),
                series.size(),
                minDataPoints
            );
        }
        Optional<FeatureMatrix> features = featureBuilder.build(series);
        if (!features.isPresent()) {
            throw new DataUnavailableException(metricName, CommonMessages.NO_FEATURES_MSG);
        }
        logger.info("Training models for {} on {} points", metricName, series.size());
        return train(metricName, features.get());
    }

    /**
     * Trains every algorithm on a feature matrix and publishes the results.
     *
     * @param metricName metric name
     * @param features training matrix
     * @return states of the models that trained successfully
     */
    public List<ModelState> train(String metricName, FeatureMatrix features) {
        List<ModelState> published = new ArrayList<>();
        for (AlgorithmTrainer trainer : trainers) {
            Algorithm algorithm = trainer.getAlgorithm();
            AnomalyModel model;
            try {
                model = trainer.train(features);
            } catch (Exception e) {
                ModelFitException failure = new ModelFitException(metricName, algorithm, CommonMessages.FAIL_TO_FIT_MODEL, e);
                stats.increment(StatNames.MODEL_FIT_FAILURE_COUNT);
                logger.error(new ParameterizedMessage("Fail to train {} model for {}", algorithm, metricName), failure);
                continue;
            }
            published.add(modelStore.publish(new ModelKey(metricName, algorithm), model));
            stats.increment(StatNames.MODELS_TRAINED_COUNT);
            logger.info("Trained {} model for {}", algorithm, metricName);
        }
        return published;
    }

    public List<AlgorithmTrainer> getTrainers() {
        return trainers;
    }
}
