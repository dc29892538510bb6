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
import io.saimon.ad.feature.MetricDataFetcher;
import io.saimon.ad.ml.AnomalyEmitter;
import io.saimon.ad.ml.InferenceEngine;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableList;

/**
 * Scores the recent data of every configured metric and emits what gets flagged.
 */
public class InferenceJob implements Runnable {
    private static final Logger logger = LogManager.getLogger(InferenceJob.class);

    public static final String NAME = "inference";

    private final List<String> metricNames;
    private final MetricDataFetcher dataFetcher;
    private final InferenceEngine inferenceEngine;
    private final AnomalyEmitter anomalyEmitter;
    private final Stats stats;

    public InferenceJob(
        List<String> metricNames,
        MetricDataFetcher dataFetcher,
        InferenceEngine inferenceEngine,
        AnomalyEmitter anomalyEmitter,
        Stats stats
    ) {
        this.metricNames = ImmutableList.copyOf(metricNames);
        this.dataFetcher = dataFetcher;
        this.inferenceEngine = inferenceEngine;
        this.anomalyEmitter = anomalyEmitter;
        this.stats = stats;
    }

    @Override
    public void run() {
        logger.debug("Running inference cycle");
        int detected = 0;
        for (String metricName : metricNames) {
            try {
                MetricSeries series = dataFetcher.fetchRecentData(metricName);
                List<AnomalyRecord> anomalies = inferenceEngine.detect(series);
                detected += anomalies.size();
                anomalyEmitter.emit(anomalies);
            } catch (DataUnavailableException e) {
                stats.increment(StatNames.DATA_FETCH_FAILURE_COUNT);
                logger.warn(new ParameterizedMessage("No recent data for {}", metricName), e);
            } catch (Exception e) {
                stats.increment(StatNames.INFERENCE_FAILURE_COUNT);
                logger.error(new ParameterizedMessage("Fail to detect anomalies for {}", metricName), e);
            }
        }
        if (detected > 0) {
            logger.info("Detected {} anomalies, stats {}", detected, stats.snapshot());
        } else {
            logger.debug("No anomalies detected");
        }
    }
}
