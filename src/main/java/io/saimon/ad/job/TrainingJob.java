/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.job;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import io.saimon.ad.common.exception.DataUnavailableException;
import io.saimon.ad.common.exception.InsufficientDataException;
import io.saimon.ad.feature.MetricDataFetcher;
import io.saimon.ad.ml.ModelState;
import io.saimon.ad.ml.ModelTrainer;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableList;

/**
 * Retrains the models of every configured metric. Metrics are independent: a metric that
 * cannot be trained is logged and skipped.
 */
public class TrainingJob implements Runnable {
    private static final Logger logger = LogManager.getLogger(TrainingJob.class);

    public static final String NAME = "training";

    private final List<String> metricNames;
    private final MetricDataFetcher dataFetcher;
    private final ModelTrainer modelTrainer;
    private final Stats stats;

    public TrainingJob(List<String> metricNames, MetricDataFetcher dataFetcher, ModelTrainer modelTrainer, Stats stats) {
        this.metricNames = ImmutableList.copyOf(metricNames);
        this.dataFetcher = dataFetcher;
        this.modelTrainer = modelTrainer;
        this.stats = stats;
    }

    @Override
    public void run() {
        logger.info("Starting model training for {} metrics", metricNames.size());
        int trained = 0;
        for (String metricName : metricNames) {
            try {
                MetricSeries series = dataFetcher.fetchTrainingData(metricName);
                List<ModelState> models = modelTrainer.trainMetric(metricName, series);
                trained += models.size();
            } catch (InsufficientDataException e) {
                stats.increment(StatNames.INSUFFICIENT_DATA_COUNT);
                logger.warn("Skipping training of {}: {}", metricName, e.getMessage());
            } catch (DataUnavailableException e) {
                stats.increment(StatNames.DATA_FETCH_FAILURE_COUNT);
                logger.warn(new ParameterizedMessage("No training data for {}", metricName), e);
            } catch (Exception e) {
                logger.error(new ParameterizedMessage("Fail to train models for {}", metricName), e);
            }
        }
        logger.info("Model training completed: {} models trained, stats {}", trained, stats.snapshot());
    }
}
