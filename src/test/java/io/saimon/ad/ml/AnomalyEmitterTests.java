/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.opensearch.core.action.ActionListener;

import io.saimon.ad.TestHelpers;
import io.saimon.ad.client.AnomalySink;
import io.saimon.ad.common.exception.SinkUnavailableException;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.model.Severity;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

public class AnomalyEmitterTests {

    private AnomalySink sink;
    private Stats stats;
    private AnomalyEmitter emitter;

    @Before
    public void setup() {
        sink = mock(AnomalySink.class);
        stats = Stats.withCounters();
        emitter = new AnomalyEmitter(sink, stats);
    }

    private AnomalyRecord anomaly(int minute, double value) {
        return new AnomalyRecord(
            TestHelpers.METRIC,
            TestHelpers.START.plus(Duration.ofMinutes(minute)),
            value,
            null,
            0.9,
            0.9,
            Severity.MEDIUM,
            Algorithm.ISOLATION_FOREST,
            TestHelpers.NOW,
            Collections.emptyMap()
        );
    }

    @SuppressWarnings("unchecked")
    @Test
    public void emit_dropsRejectedRecords() {
        List<AnomalyRecord> saved = new ArrayList<>();
        doAnswer(invocation -> {
            AnomalyRecord anomaly = invocation.getArgument(0);
            ActionListener<String> listener = invocation.getArgument(1);
            if (anomaly.getValue() > 100) {
                listener.onFailure(new SinkUnavailableException(anomaly.getMetricName(), "HTTP 500"));
            } else {
                saved.add(anomaly);
                listener.onResponse("1");
            }
            return null;
        }).when(sink).save(any(AnomalyRecord.class), any(ActionListener.class));

        int accepted = emitter.emit(Arrays.asList(anomaly(1, 90), anomaly(2, 500), anomaly(3, 95)));

        assertEquals(2, accepted);
        assertEquals(Arrays.asList(anomaly(1, 90), anomaly(3, 95)), saved);
        verify(sink, times(3)).save(any(AnomalyRecord.class), any(ActionListener.class));
        verify(sink).save(argThat(anomaly -> anomaly.getValue() == 500), any(ActionListener.class));
        assertEquals(2L, stats.getStat(StatNames.ANOMALIES_EMITTED_COUNT.getName()).getValue());
        assertEquals(1L, stats.getStat(StatNames.SINK_FAILURE_COUNT.getName()).getValue());
    }

    @SuppressWarnings("unchecked")
    @Test
    public void emit_continuesAfterSinkThrows() {
        List<AnomalyRecord> saved = new ArrayList<>();
        doAnswer(invocation -> {
            AnomalyRecord anomaly = invocation.getArgument(0);
            ActionListener<String> listener = invocation.getArgument(1);
            if (anomaly.getValue() > 100) {
                throw new IllegalStateException("sink closed");
            }
            saved.add(anomaly);
            listener.onResponse("1");
            return null;
        }).when(sink).save(any(AnomalyRecord.class), any(ActionListener.class));

        int accepted = emitter.emit(Arrays.asList(anomaly(1, 90), anomaly(2, 500), anomaly(3, 95)));

        assertEquals(2, accepted);
        assertEquals(Arrays.asList(anomaly(1, 90), anomaly(3, 95)), saved);
        assertEquals(2L, stats.getStat(StatNames.ANOMALIES_EMITTED_COUNT.getName()).getValue());
        assertEquals(1L, stats.getStat(StatNames.SINK_FAILURE_COUNT.getName()).getValue());
    }

    @Test
    public void emit_nothingToSave() {
        assertEquals(0, emitter.emit(Collections.emptyList()));
        verifyNoInteractions(sink);
    }
}
