/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.constant;

import java.util.Locale;

public class CommonMessages {
    // ======================================
    // Data collection
    // ======================================
    public static final String NO_DATA_RETURNED = "No data returned for metric";
    public static final String FAIL_TO_FETCH_METRIC = "Fail to fetch metric";
    public static final String UNEXPECTED_QUERY_STATUS = "Ingestion source answered with status ";
    public static final String MALFORMED_QUERY_RESPONSE = "Malformed query_range response";
    public static final String NON_INCREASING_TIMESTAMPS = "Timestamps must be strictly increasing";

    // ======================================
    // Training
    // ======================================
    public static final String INSUFFICIENT_DATA_MSG_FORMAT = "Insufficient data for %s: got %d points, need at least %d";
    public static final String NO_FEATURES_MSG = "No features available for metric";
    public static final String FAIL_TO_FIT_MODEL = "Fail to fit model";
    public static final String EMPTY_TRAINING_MATRIX = "Training matrix must have at least one row";

    // ======================================
    // Registry and sink
    // ======================================
    public static final String FAIL_TO_REGISTER_MODEL = "Fail to register model";
    public static final String FAIL_TO_SAVE_ANOMALY = "Fail to save anomaly";
    public static final String UNEXPECTED_HTTP_STATUS = "Unexpected HTTP status ";

    // ======================================
    // Model store
    // ======================================
    public static final String FAIL_TO_WRITE_CHECKPOINT = "Fail to write checkpoint";
    public static final String FAIL_TO_READ_CHECKPOINT = "Fail to read checkpoint";
    public static final String UNKNOWN_ALGORITHM = "Unknown algorithm: ";
    public static final String FEATURE_DIMENSION_MISMATCH = "Feature dimension mismatch: model expects %d columns, got %d";

    public static String getInsufficientDataMsg(String metricName, int actual, int required) {
        return String.format(Locale.ROOT, INSUFFICIENT_DATA_MSG_FORMAT, metricName, actual, required);
    }

    public static String getDimensionMismatchMsg(int expected, int actual) {
        return String.format(Locale.ROOT, FEATURE_DIMENSION_MISMATCH, expected, actual);
    }
}
