/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.client;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

import org.apache.hc.core5.net.URIBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.core.action.ActionListener;

import io.saimon.ad.common.exception.RegistryUnavailableException;
import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.model.ModelRegistration;
import io.saimon.ad.util.HttpClientUtil;
import io.saimon.ad.util.HttpClientUtil.HttpResult;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Registers models with the REST API of the platform.
 */
public class HttpModelRegistry implements ModelRegistry {
    private static final Logger logger = LogManager.getLogger(HttpModelRegistry.class);

    private final HttpClientUtil httpClient;
    private final String apiUrl;
    private final Gson gson;

    public HttpModelRegistry(HttpClientUtil httpClient, String apiUrl) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();
    }

    @Override
    public void register(ModelRegistration registration, ActionListener<String> listener) {
        String metricName = registration.getName();
        try {
            JsonObject payload = toPayload(registration, lookupMetricId(metricName));
            HttpResult result = httpClient.postJson(URI.create(apiUrl + CommonName.MODELS_PATH), gson.toJson(payload));
            if (!result.isSuccess()) {
                listener
                    .onFailure(
                        new RegistryUnavailableException(
                            metricName,
                            CommonMessages.FAIL_TO_REGISTER_MODEL + ": " + CommonMessages.UNEXPECTED_HTTP_STATUS + result.getStatus()
                        )
                    );
                return;
            }
            String id = readId(result.getBody(), CommonName.MODEL_ID_FIELD);
            logger.info("Registered model {} with id {}", registration.getKey().getModelId(), id);
            listener.onResponse(id);
        } catch (IOException e) {
            listener.onFailure(new RegistryUnavailableException(metricName, CommonMessages.FAIL_TO_REGISTER_MODEL, e));
        }
    }

    /**
     * Looks up the id of a metric in the platform's metric catalogue.
     *
     * @param metricName metric name
     * @return metric id, null if the metric is unknown or the lookup failed
     */
    Long lookupMetricId(String metricName) {
        try {
            URI uri = new URIBuilder(apiUrl + CommonName.METRICS_PATH).appendPathSegments(metricName).build();
            HttpResult result = httpClient.get(uri);
            if (!result.isSuccess()) {
                logger.warn("Metric {} not found in the catalogue, registering model without metric id", metricName);
                return null;
            }
            JsonElement id = JsonParser.parseString(result.getBody()).getAsJsonObject().get(CommonName.ID_FIELD);
            return id == null || id.isJsonNull() ? null : id.getAsLong();
        } catch (IOException | URISyntaxException | JsonParseException | IllegalStateException | NumberFormatException e) {
            logger.warn(new ParameterizedMessage("Fail to look up metric id of {}", metricName), e);
            return null;
        }
    }

    JsonObject toPayload(ModelRegistration registration, Long metricId) {
        JsonObject payload = new JsonObject();
        payload.addProperty(CommonName.NAME_FIELD, registration.getName());
        payload.addProperty(CommonName.VERSION_FIELD, registration.getVersion());
        payload.addProperty(CommonName.MODEL_TYPE_FIELD, registration.getModelType());
        payload.addProperty(CommonName.METRIC_ID_FIELD, metricId);
        JsonObject config = new JsonObject();
        for (Map.Entry<String, Object> entry : registration.getConfig().entrySet()) {
            config.add(entry.getKey(), gson.toJsonTree(entry.getValue()));
        }
        config.addProperty(CommonName.TRAINED_AT_FIELD, registration.getTrainedAt().toString());
        payload.add(CommonName.CONFIG_FIELD, config);
        payload.add(CommonName.PERFORMANCE_METRICS_FIELD, new JsonObject());
        payload.addProperty(CommonName.FILE_PATH_FIELD, registration.getFilePath());
        payload.addProperty(CommonName.IS_ACTIVE_FIELD, true);
        payload.addProperty(CommonName.TRAINED_AT_FIELD, registration.getTrainedAt().toString());
        return payload;
    }

    static String readId(String body, String preferredField) {
        try {
            JsonElement json = JsonParser.parseString(body);
            if (!json.isJsonObject()) {
                return null;
            }
            JsonObject object = json.getAsJsonObject();
            JsonElement id = object.has(preferredField) ? object.get(preferredField) : object.get(CommonName.ID_FIELD);
            return id == null || id.isJsonNull() ? null : id.getAsString();
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logger.debug("Response carries no id: {}", body);
            return null;
        }
    }
}
