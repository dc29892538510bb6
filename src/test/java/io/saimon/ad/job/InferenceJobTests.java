/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.job;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.common.exception.DataUnavailableException;
import io.saimon.ad.feature.MetricDataFetcher;
import io.saimon.ad.ml.AnomalyEmitter;
import io.saimon.ad.ml.InferenceEngine;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.model.Severity;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

public class InferenceJobTests {
    private static final String CPU = "node_cpu_usage";
    private static final String MEMORY = "node_memory_usage";

    private MetricDataFetcher dataFetcher;
    private InferenceEngine inferenceEngine;
    private AnomalyEmitter anomalyEmitter;
    private Stats stats;
    private InferenceJob job;

    @Before
    public void setup() {
        dataFetcher = mock(MetricDataFetcher.class);
        inferenceEngine = mock(InferenceEngine.class);
        anomalyEmitter = mock(AnomalyEmitter.class);
        stats = Stats.withCounters();
        job = new InferenceJob(Arrays.asList(CPU, MEMORY), dataFetcher, inferenceEngine, anomalyEmitter, stats);
    }

    @Test
    public void run_emitsDetectedAnomalies() {
        MetricSeries cpu = TestHelpers.seriesOf(CPU, 60, 61, 150);
        MetricSeries memory = TestHelpers.seriesOf(MEMORY, 40, 41, 40);
        List<AnomalyRecord> anomalies = Collections
            .singletonList(
                new AnomalyRecord(
                    CPU,
                    TestHelpers.START.plus(Duration.ofMinutes(2)),
                    150,
                    60.5,
                    30,
                    1.0,
                    Severity.CRITICAL,
                    Algorithm.ZSCORE,
                    TestHelpers.NOW,
                    Collections.emptyMap()
                )
            );
        when(dataFetcher.fetchRecentData(CPU)).thenReturn(cpu);
        when(dataFetcher.fetchRecentData(MEMORY)).thenReturn(memory);
        when(inferenceEngine.detect(cpu)).thenReturn(anomalies);
        when(inferenceEngine.detect(memory)).thenReturn(Collections.emptyList());

        job.run();

        verify(anomalyEmitter).emit(anomalies);
        verify(anomalyEmitter).emit(Collections.emptyList());
    }

    @Test
    public void run_fetchFailureSkipsMetric() {
        MetricSeries memory = TestHelpers.seriesOf(MEMORY, 40, 41, 40);
        when(dataFetcher.fetchRecentData(CPU)).thenThrow(new DataUnavailableException(CPU, "Prometheus unreachable"));
        when(dataFetcher.fetchRecentData(MEMORY)).thenReturn(memory);
        when(inferenceEngine.detect(memory)).thenReturn(Collections.emptyList());

        job.run();

        verify(inferenceEngine).detect(memory);
        assertEquals(1L, stats.getStat(StatNames.DATA_FETCH_FAILURE_COUNT.getName()).getValue());
    }

    @Test
    public void run_detectionFailureIsCounted() {
        when(dataFetcher.fetchRecentData(any())).thenReturn(TestHelpers.seriesOf(CPU, 1));
        when(inferenceEngine.detect(any(MetricSeries.class))).thenThrow(new IllegalArgumentException("bad matrix"));

        job.run();

        verify(anomalyEmitter, never()).emit(any());
        assertEquals(2L, stats.getStat(StatNames.INFERENCE_FAILURE_COUNT.getName()).getValue());
    }
}
