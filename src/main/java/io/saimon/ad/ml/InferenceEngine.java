/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.feature.FeatureBuilder;
import io.saimon.ad.feature.FeatureMatrix;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.model.DataPoint;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.base.Preconditions;

/**
 * Scores fresh data of a metric with every trained model of that metric.
 *
 * Each algorithm flags points on its own: a point above the threshold for two algorithms
 * yields two records. Given the same models and matrix, the result is the same except for the
 * detection time.
 */
public class InferenceEngine {
    private static final Logger logger = LogManager.getLogger(InferenceEngine.class);

    private final ModelStore modelStore;
    private final FeatureBuilder featureBuilder;
    private final SeverityClassifier severityClassifier;
    private final double threshold;
    private final int minConsecutive;
    private final Clock clock;
    private final Stats stats;

    public InferenceEngine(
        ModelStore modelStore,
        FeatureBuilder featureBuilder,
        SeverityClassifier severityClassifier,
        double threshold,
        int minConsecutive,
        Clock clock,
        Stats stats
    ) {
        Preconditions.checkArgument(minConsecutive >= 1, "min_consecutive must be at least 1");
        this.modelStore = modelStore;
        this.featureBuilder = featureBuilder;
        this.severityClassifier = severityClassifier;
        this.threshold = threshold;
        this.minConsecutive = minConsecutive;
        this.clock = clock;
        this.stats = stats;
    }

    /**
     * Builds the features of a series and detects anomalies in it.
     *
     * @param series recent data of a metric
     * @return flagged points, grouped by algorithm; empty if the series is empty
     */
    public List<AnomalyRecord> detect(MetricSeries series) {
        Optional<FeatureMatrix> features = featureBuilder.build(series);
        if (!features.isPresent()) {
            logger.debug("No data to score for {}", series == null ? null : series.getMetricName());
            return new ArrayList<>();
        }
        return detect(series, features.get());
    }

    /**
     * Detects anomalies in a series whose feature matrix is already built.
     *
     * @param series recent data of a metric
     * @param features feature matrix of the series, one row per point
     * @return flagged points, grouped by algorithm
     */
    public List<AnomalyRecord> detect(MetricSeries series, FeatureMatrix features) {
        Preconditions
            .checkArgument(
                series.size() == features.getRowCount(),
                "Series has %s points but matrix has %s rows",
                series.size(),
                features.getRowCount()
            );
        Instant detectedAt = clock.instant();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (ModelState state : modelStore.getModels(series.getMetricName())) {
            AnomalyModel model = state.getModel();
            Optional<ScoringResult> scored = score(series.getMetricName(), model, features);
            if (!scored.isPresent()) {
                continue;
            }
            ScoringResult result = scored.get();
            boolean[] flagged = flag(result.getNormalizedScores());
            Double expectedValue = model.getExpectedValue().orElse(null);
            for (int i = 0; i < flagged.length; i++) {
                if (!flagged[i]) {
                    continue;
                }
                DataPoint point = series.get(i);
                double normalized = result.getNormalizedScore(i);
                anomalies
                    .add(
                        new AnomalyRecord(
                            series.getMetricName(),
                            point.getTimestamp(),
                            point.getValue(),
                            expectedValue,
                            result.getRawScore(i),
                            normalized,
                            severityClassifier.classify(normalized),
                            model.getAlgorithm(),
                            detectedAt,
                            series.getLabels()
                        )
                    );
            }
        }
        stats.add(StatNames.ANOMALIES_DETECTED_COUNT, anomalies.size());
        logger.info("Detected {} anomalies in {} points of {}", anomalies.size(), series.size(), series.getMetricName());
        return anomalies;
    }

    /**
     * Scores a matrix with one model. Failures are logged and reported as an empty result.
     */
    Optional<ScoringResult> score(String metricName, AnomalyModel model, FeatureMatrix features) {
        if (model.getFeatureCount() != features.getColumnCount()) {
            stats.increment(StatNames.INFERENCE_FAILURE_COUNT);
            logger
                .warn(
                    "Skipping {} model of {}: {}",
                    model.getAlgorithm(),
                    metricName,
                    CommonMessages.getDimensionMismatchMsg(model.getFeatureCount(), features.getColumnCount())
                );
            return Optional.empty();
        }
        try {
            double[] raw = model.score(features);
            return Optional.of(new ScoringResult(model.getAlgorithm(), raw, model.normalize(raw)));
        } catch (Exception e) {
            stats.increment(StatNames.INFERENCE_FAILURE_COUNT);
            logger.error(new ParameterizedMessage("Fail to score {} with the {} model", metricName, model.getAlgorithm()), e);
            return Optional.empty();
        }
    }

    /**
     * Points above the threshold that belong to a run of at least minConsecutive such points.
     */
    boolean[] flag(double[] normalizedScores) {
        boolean[] flagged = new boolean[normalizedScores.length];
        int runStart = -1;
        for (int i = 0; i <= normalizedScores.length; i++) {
            boolean above = i < normalizedScores.length && normalizedScores[i] > threshold;
            if (above && runStart < 0) {
                runStart = i;
            } else if (!above && runStart >= 0) {
                if (i - runStart >= minConsecutive) {
                    for (int j = runStart; j < i; j++) {
                        flagged[j] = true;
                    }
                }
                runStart = -1;
            }
        }
        return flagged;
    }
}
