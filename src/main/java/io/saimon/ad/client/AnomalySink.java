/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.client;

import org.opensearch.core.action.ActionListener;

import io.saimon.ad.model.AnomalyRecord;

/**
 * Downstream consumer of detected anomalies.
 */
public interface AnomalySink {

    /**
     * Stores one anomaly record. No retry is attempted.
     *
     * @param record anomaly record
     * @param listener onResponse is called with the id of the stored record (null if the sink
     *                 did not return one); onFailure with a SinkUnavailableException
     */
    void save(AnomalyRecord record, ActionListener<String> listener);
}
