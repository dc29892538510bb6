/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.opensearch.common.settings.Settings;

import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.settings.AnomalyDetectorSettings;

/**
 * Fetches the two time ranges the engine works on: the long training range and the recent
 * range scored by inference. Both ranges end now.
 */
public class MetricDataFetcher {
    private final DataCollector dataCollector;
    private final Clock clock;
    private final Duration trainingLookback;
    private final Duration recentLookback;
    private final Duration step;

    public MetricDataFetcher(DataCollector dataCollector, Clock clock, Duration trainingLookback, Duration recentLookback, Duration step) {
        this.dataCollector = dataCollector;
        this.clock = clock;
        this.trainingLookback = trainingLookback;
        this.recentLookback = recentLookback;
        this.step = step;
    }

    public static MetricDataFetcher fromSettings(DataCollector dataCollector, Clock clock, Settings settings) {
        return new MetricDataFetcher(
            dataCollector,
            clock,
            Duration.ofHours(AnomalyDetectorSettings.LOOKBACK_HOURS.get(settings)),
            Duration.ofMinutes(AnomalyDetectorSettings.WINDOW_SIZE.get(settings)),
            Duration.ofMillis(AnomalyDetectorSettings.QUERY_STEP.get(settings).millis())
        );
    }

    /**
     * @param metricName metric name
     * @return series covering the training lookback
     */
    public MetricSeries fetchTrainingData(String metricName) {
        return fetch(metricName, trainingLookback);
    }

    /**
     * @param metricName metric name
     * @return series covering the inference window
     */
    public MetricSeries fetchRecentData(String metricName) {
        return fetch(metricName, recentLookback);
    }

    private MetricSeries fetch(String metricName, Duration lookback) {
        Instant end = clock.instant();
        return dataCollector.fetch(metricName, end.minus(lookback), end, step);
    }
}
