/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.constant;

/**
 * Field names shared by checkpoints and the external API payloads.
 */
public class CommonName {
    // ======================================
    // Checkpoint fields
    // ======================================
    public static final String METRIC_NAME_FIELD = "metric_name";
    public static final String ALGORITHM_FIELD = "algorithm";
    public static final String TRAINED_AT_FIELD = "trained_at";
    public static final String MODEL_FIELD = "model";
    public static final String CHECKPOINT_FILE_SUFFIX = ".json";

    // ======================================
    // Registry payload
    // ======================================
    public static final String NAME_FIELD = "name";
    public static final String VERSION_FIELD = "version";
    public static final String MODEL_TYPE_FIELD = "model_type";
    public static final String METRIC_ID_FIELD = "metric_id";
    public static final String CONFIG_FIELD = "config";
    public static final String PERFORMANCE_METRICS_FIELD = "performance_metrics";
    public static final String FILE_PATH_FIELD = "file_path";
    public static final String IS_ACTIVE_FIELD = "is_active";
    public static final String MODEL_ID_FIELD = "model_id";
    public static final String ID_FIELD = "id";
    public static final String MEAN_FIELD = "mean";
    public static final String STD_FIELD = "std";
    public static final String THRESHOLD_FIELD = "threshold";

    // ======================================
    // Anomaly payload
    // ======================================
    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String VALUE_FIELD = "value";
    public static final String EXPECTED_VALUE_FIELD = "expected_value";
    public static final String ANOMALY_SCORE_FIELD = "anomaly_score";
    public static final String SEVERITY_FIELD = "severity";
    public static final String LABELS_FIELD = "labels";

    // ======================================
    // Prometheus query_range response
    // ======================================
    public static final String STATUS_FIELD = "status";
    public static final String STATUS_SUCCESS = "success";
    public static final String DATA_FIELD = "data";
    public static final String RESULT_FIELD = "result";
    public static final String METRIC_FIELD = "metric";
    public static final String VALUES_FIELD = "values";

    // ======================================
    // REST paths of the external API
    // ======================================
    public static final String MODELS_PATH = "/api/v1/models";
    public static final String METRICS_PATH = "/api/v1/metrics";
    public static final String ANOMALIES_PATH = "/api/v1/anomalies";
    public static final String QUERY_RANGE_PATH = "/api/v1/query_range";
}
