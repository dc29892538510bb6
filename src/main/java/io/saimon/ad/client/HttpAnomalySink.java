/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.client;

import java.io.IOException;
import java.net.URI;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.core.action.ActionListener;

import io.saimon.ad.common.exception.SinkUnavailableException;
import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.model.AnomalyRecord;
import io.saimon.ad.util.HttpClientUtil;
import io.saimon.ad.util.HttpClientUtil.HttpResult;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Posts anomaly records to the REST API of the platform.
 */
public class HttpAnomalySink implements AnomalySink {
    private static final Logger logger = LogManager.getLogger(HttpAnomalySink.class);

    private final HttpClientUtil httpClient;
    private final URI anomaliesUri;
    private final Gson gson;

    public HttpAnomalySink(HttpClientUtil httpClient, String apiUrl) {
        this.httpClient = httpClient;
        String base = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.anomaliesUri = URI.create(base + CommonName.ANOMALIES_PATH);
        this.gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
    }

    @Override
    public void save(AnomalyRecord record, ActionListener<String> listener) {
        try {
            HttpResult result = httpClient.postJson(anomaliesUri, gson.toJson(toPayload(record)));
            if (!result.isSuccess()) {
                listener
                    .onFailure(
                        new SinkUnavailableException(
                            record.getMetricName(),
                            CommonMessages.FAIL_TO_SAVE_ANOMALY + ": " + CommonMessages.UNEXPECTED_HTTP_STATUS + result.getStatus()
                        )
                    );
                return;
            }
            String id = HttpModelRegistry.readId(result.getBody(), CommonName.ID_FIELD);
            logger.debug("Saved anomaly of {} at {} with id {}", record.getMetricName(), record.getTimestamp(), id);
            listener.onResponse(id);
        } catch (IOException e) {
            listener.onFailure(new SinkUnavailableException(record.getMetricName(), CommonMessages.FAIL_TO_SAVE_ANOMALY, e));
        }
    }

    static JsonObject toPayload(AnomalyRecord record) {
        JsonObject payload = new JsonObject();
        payload.addProperty(CommonName.METRIC_NAME_FIELD, record.getMetricName());
        payload.addProperty(CommonName.TIMESTAMP_FIELD, record.getTimestamp().toString());
        payload.addProperty(CommonName.VALUE_FIELD, record.getValue());
        payload.addProperty(CommonName.EXPECTED_VALUE_FIELD, record.getExpectedValue().orElse(null));
        payload.addProperty(CommonName.ANOMALY_SCORE_FIELD, record.getNormalizedScore());
        payload.addProperty(CommonName.SEVERITY_FIELD, record.getSeverity().getName());
        payload.addProperty(CommonName.ALGORITHM_FIELD, record.getAlgorithm().getName());
        JsonObject labels = new JsonObject();
        record.getLabels().forEach(labels::addProperty);
        payload.add(CommonName.LABELS_FIELD, labels);
        return payload;
    }
}
