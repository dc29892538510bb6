/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import java.time.Duration;
import java.time.Instant;

import io.saimon.ad.model.MetricSeries;

/**
 * Source of raw metric series.
 */
public interface DataCollector {

    /**
     * Fetches the series of a metric within a time range.
     *
     * The result is either complete or not returned at all: implementations never hand back a
     * partially filled series.
     *
     * @param metricName name of the metric
     * @param start range start, inclusive
     * @param end range end, inclusive
     * @param step resolution of the series
     * @return the series, possibly empty
     * @throws io.saimon.ad.common.exception.DataUnavailableException when the source cannot be read
     */
    MetricSeries fetch(String metricName, Instant start, Instant end, Duration step);
}
