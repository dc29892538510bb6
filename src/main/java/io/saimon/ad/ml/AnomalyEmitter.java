/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.core.action.ActionListener;

import io.saimon.ad.client.AnomalySink;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

/**
 * Forwards anomaly records to the sink. A record the sink rejects is logged and dropped.
 */
public class AnomalyEmitter {
    private static final Logger logger = LogManager.getLogger(AnomalyEmitter.class);

    private final AnomalySink sink;
    private final Stats stats;

    public AnomalyEmitter(AnomalySink sink, Stats stats) {
        this.sink = sink;
        this.stats = stats;
    }

    /**
     * Emits records one by one.
     *
     * @param anomalies records to emit
     * @return number of records the sink accepted
     */
    public int emit(List<AnomalyRecord> anomalies) {
        if (anomalies.isEmpty()) {
            return 0;
        }
        logger.info("Saving {} anomalies", anomalies.size());
        AtomicInteger accepted = new AtomicInteger();
        for (AnomalyRecord anomaly : anomalies) {
            logger
                .info(
                    "Anomaly detected: {} at {} (score: {}, severity: {}, algorithm: {})",
                    anomaly.getMetricName(),
                    anomaly.getTimestamp(),
                    String.format(Locale.ROOT, "%.3f", anomaly.getNormalizedScore()),
                    anomaly.getSeverity(),
                    anomaly.getAlgorithm()
                );
            ActionListener<String> listener = ActionListener.wrap(id -> {
                accepted.incrementAndGet();
                stats.increment(StatNames.ANOMALIES_EMITTED_COUNT);
            }, exception -> {
                stats.increment(StatNames.SINK_FAILURE_COUNT);
                logger
                    .warn(
                        new ParameterizedMessage("Dropping anomaly of {} at {}", anomaly.getMetricName(), anomaly.getTimestamp()),
                        exception
                    );
            });
            try {
                sink.save(anomaly, listener);
            } catch (Exception e) {
                listener.onFailure(e);
            }
        }
        return accepted.get();
    }
}
