/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.feature;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.apache.hc.core5.net.URIBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.saimon.ad.common.exception.DataUnavailableException;
import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.model.DataPoint;
import io.saimon.ad.model.MetricSeries;
import io.saimon.ad.util.HttpClientUtil;
import io.saimon.ad.util.HttpClientUtil.HttpResult;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads metric series from a Prometheus compatible {@code query_range} endpoint.
 */
public class PrometheusDataCollector implements DataCollector {
    private static final Logger logger = LogManager.getLogger(PrometheusDataCollector.class);

    private final HttpClientUtil httpClient;
    private final String prometheusUrl;

    public PrometheusDataCollector(HttpClientUtil httpClient, String prometheusUrl) {
        this.httpClient = httpClient;
        this.prometheusUrl = prometheusUrl.endsWith("/") ? prometheusUrl.substring(0, prometheusUrl.length() - 1) : prometheusUrl;
        logger.info("Reading metrics from {}", this.prometheusUrl);
    }

    @Override
    public MetricSeries fetch(String metricName, Instant start, Instant end, Duration step) {
        logger.info("Fetching data for metric: {}", metricName);
        HttpResult result;
        try {
            URI uri = new URIBuilder(prometheusUrl + CommonName.QUERY_RANGE_PATH)
                .addParameter("query", metricName)
                .addParameter("start", toEpochSeconds(start))
                .addParameter("end", toEpochSeconds(end))
                .addParameter("step", formatStep(step))
                .build();
            result = httpClient.get(uri);
        } catch (IOException | URISyntaxException e) {
            throw new DataUnavailableException(metricName, CommonMessages.FAIL_TO_FETCH_METRIC, e);
        }
        if (!result.isSuccess()) {
            throw new DataUnavailableException(metricName, CommonMessages.UNEXPECTED_QUERY_STATUS + result.getStatus());
        }
        MetricSeries series = parse(metricName, result.getBody());
        if (series.isEmpty()) {
            logger.warn("{}: {}", CommonMessages.NO_DATA_RETURNED, metricName);
        } else {
            logger.info("Fetched {} data points for {}", series.size(), metricName);
        }
        return series;
    }

    static String formatStep(Duration step) {
        long millis = step.toMillis();
        return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
    }

    /**
     * Parses a query_range response. Several result series are merged on timestamp; the first
     * series wins on duplicates and provides the labels. Non-finite samples are dropped.
     *
     * @param metricName metric name
     * @param body response body
     * @return parsed series
     */
    static MetricSeries parse(String metricName, String body) {
        try {
            JsonObject json = JsonParser.parseString(body).getAsJsonObject();
            JsonElement status = json.get(CommonName.STATUS_FIELD);
            if (status == null || !CommonName.STATUS_SUCCESS.equals(status.getAsString())) {
                throw new DataUnavailableException(metricName, CommonMessages.UNEXPECTED_QUERY_STATUS + status);
            }
            JsonObject data = json.getAsJsonObject(CommonName.DATA_FIELD);
            if (data == null || !data.has(CommonName.RESULT_FIELD)) {
                throw new DataUnavailableException(metricName, CommonMessages.MALFORMED_QUERY_RESPONSE);
            }
            JsonArray results = data.getAsJsonArray(CommonName.RESULT_FIELD);
            TreeMap<Instant, Double> samples = new TreeMap<>();
            Map<String, String> labels = null;
            for (JsonElement element : results) {
                JsonObject seriesJson = element.getAsJsonObject();
                if (labels == null) {
                    labels = parseLabels(seriesJson.getAsJsonObject(CommonName.METRIC_FIELD));
                }
                JsonArray values = seriesJson.getAsJsonArray(CommonName.VALUES_FIELD);
                if (values == null) {
                    continue;
                }
                for (JsonElement pair : values) {
                    JsonArray sample = pair.getAsJsonArray();
                    Instant timestamp = Instant.ofEpochMilli(Math.round(sample.get(0).getAsDouble() * 1000));
                    double value = parseSampleValue(sample.get(1).getAsString());
                    if (Double.isFinite(value)) {
                        samples.putIfAbsent(timestamp, value);
                    }
                }
            }
            List<DataPoint> points = new ArrayList<>(samples.size());
            samples.forEach((timestamp, value) -> points.add(new DataPoint(timestamp, value)));
            return new MetricSeries(metricName, points, labels);
        } catch (JsonParseException | IllegalStateException | ClassCastException | IndexOutOfBoundsException
            | UnsupportedOperationException | NumberFormatException e) {
            throw new DataUnavailableException(metricName, CommonMessages.MALFORMED_QUERY_RESPONSE, e);
        }
    }

    private static Map<String, String> parseLabels(JsonObject metric) {
        Map<String, String> labels = new HashMap<>();
        if (metric == null) {
            return labels;
        }
        for (Map.Entry<String, JsonElement> entry : metric.entrySet()) {
            if (entry.getValue().isJsonPrimitive()) {
                labels.put(entry.getKey(), entry.getValue().getAsString());
            }
        }
        return labels;
    }

    private static double parseSampleValue(String value) {
        switch (value) {
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.parseDouble(value);
        }
    }

    private static String toEpochSeconds(Instant instant) {
        return String.format(Locale.ROOT, "%.3f", instant.toEpochMilli() / 1000.0);
    }
}
