/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.settings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

import com.google.common.collect.ImmutableList;

/**
 * Engine settings. Keys mirror the layout of the YAML configuration file.
 */
public final class AnomalyDetectorSettings {

    private AnomalyDetectorSettings() {}

    public static final String AUTO = "auto";
    public static final String SCALE = "scale";

    // ======================================
    // Detection
    // ======================================
    public static final Setting<Double> DETECTION_THRESHOLD = Setting
        .doubleSetting("anomaly_detection.threshold", 0.7, 0.0, 1.0, Setting.Property.NodeScope);

    // minutes of recent data scored by each inference run
    public static final Setting<Integer> WINDOW_SIZE = Setting
        .intSetting("anomaly_detection.window_size", 60, 1, Setting.Property.NodeScope);

    public static final Setting<Integer> MIN_CONSECUTIVE = Setting
        .intSetting("anomaly_detection.min_consecutive", 1, 1, Setting.Property.NodeScope);

    public static final Setting<Double> SEVERITY_LOW = Setting
        .doubleSetting("anomaly_detection.severity_levels.low", 0.7, 0.0, 1.0, Setting.Property.NodeScope);

    public static final Setting<Double> SEVERITY_MEDIUM = Setting
        .doubleSetting("anomaly_detection.severity_levels.medium", 0.85, 0.0, 1.0, Setting.Property.NodeScope);

    public static final Setting<Double> SEVERITY_HIGH = Setting
        .doubleSetting("anomaly_detection.severity_levels.high", 0.95, 0.0, 1.0, Setting.Property.NodeScope);

    public static final Setting<Double> SEVERITY_CRITICAL = Setting
        .doubleSetting("anomaly_detection.severity_levels.critical", 0.99, 0.0, 1.0, Setting.Property.NodeScope);

    // ======================================
    // Data collection
    // ======================================
    public static final String METRICS_KEY = "data_collection.metrics";
    public static final String METRIC_NAME_KEY = "name";

    public static final Setting<Integer> MIN_DATA_POINTS = Setting
        .intSetting("data_collection.min_data_points", 1000, 1, Setting.Property.NodeScope);

    public static final Setting<Integer> LOOKBACK_HOURS = Setting
        .intSetting("data_collection.lookback_hours", 168, 1, Setting.Property.NodeScope);

    public static final Setting<TimeValue> QUERY_STEP = Setting
        .timeSetting("data_collection.step", TimeValue.timeValueMinutes(1), TimeValue.timeValueSeconds(1), Setting.Property.NodeScope);

    // ======================================
    // Feature engineering
    // ======================================
    public static final Setting<List<Integer>> ROLLING_WINDOWS = Setting
        .listSetting(
            "feature_engineering.rolling_windows",
            Arrays.asList("5", "10", "30"),
            AnomalyDetectorSettings::parseWindow,
            Setting.Property.NodeScope
        );

    // ======================================
    // Z-score
    // ======================================
    public static final Setting<Boolean> ZSCORE_ENABLED = Setting
        .boolSetting("models.statistical.zscore.enabled", true, Setting.Property.NodeScope);

    public static final Setting<Double> ZSCORE_THRESHOLD = Setting
        .doubleSetting("models.statistical.zscore.threshold", 3.0, 1e-6, Setting.Property.NodeScope);

    // ======================================
    // Isolation forest
    // ======================================
    public static final Setting<Boolean> ISOLATION_FOREST_ENABLED = Setting
        .boolSetting("models.unsupervised.isolation_forest.enabled", true, Setting.Property.NodeScope);

    // a fraction in (0, 0.5] or "auto"
    public static final Setting<String> ISOLATION_FOREST_CONTAMINATION = Setting
        .simpleString(
            "models.unsupervised.isolation_forest.contamination",
            "0.1",
            AnomalyDetectorSettings::validateContamination,
            Setting.Property.NodeScope
        );

    public static final Setting<Integer> ISOLATION_FOREST_N_ESTIMATORS = Setting
        .intSetting("models.unsupervised.isolation_forest.n_estimators", 100, 1, 1000, Setting.Property.NodeScope);

    // a positive sample count or "auto"
    public static final Setting<String> ISOLATION_FOREST_MAX_SAMPLES = Setting
        .simpleString(
            "models.unsupervised.isolation_forest.max_samples",
            "256",
            AnomalyDetectorSettings::validateMaxSamples,
            Setting.Property.NodeScope
        );

    public static final Setting<Long> ISOLATION_FOREST_RANDOM_STATE = Setting
        .longSetting("models.unsupervised.isolation_forest.random_state", 42L, 0L, Setting.Property.NodeScope);

    // ======================================
    // One-class SVM
    // ======================================
    public static final Setting<Boolean> ONE_CLASS_SVM_ENABLED = Setting
        .boolSetting("models.unsupervised.one_class_svm.enabled", false, Setting.Property.NodeScope);

    public static final Setting<String> ONE_CLASS_SVM_KERNEL = Setting
        .simpleString(
            "models.unsupervised.one_class_svm.kernel",
            "rbf",
            AnomalyDetectorSettings::validateKernel,
            Setting.Property.NodeScope
        );

    // a positive number, "scale" or "auto"
    public static final Setting<String> ONE_CLASS_SVM_GAMMA = Setting
        .simpleString(
            "models.unsupervised.one_class_svm.gamma",
            AUTO,
            AnomalyDetectorSettings::validateGamma,
            Setting.Property.NodeScope
        );

    public static final Setting<Double> ONE_CLASS_SVM_NU = Setting
        .doubleSetting("models.unsupervised.one_class_svm.nu", 0.1, 1e-6, 1.0, Setting.Property.NodeScope);

    public static final Setting<Integer> ONE_CLASS_SVM_DEGREE = Setting
        .intSetting("models.unsupervised.one_class_svm.degree", 3, 1, Setting.Property.NodeScope);

    public static final Setting<Double> ONE_CLASS_SVM_COEF0 = Setting
        .doubleSetting("models.unsupervised.one_class_svm.coef0", 0.0, -Double.MAX_VALUE, Setting.Property.NodeScope);

    // ======================================
    // Random cut forest
    // ======================================
    public static final Setting<Boolean> RCF_ENABLED = Setting
        .boolSetting("models.unsupervised.random_cut_forest.enabled", false, Setting.Property.NodeScope);

    public static final Setting<Integer> RCF_N_ESTIMATORS = Setting
        .intSetting("models.unsupervised.random_cut_forest.n_estimators", 50, 1, 1000, Setting.Property.NodeScope);

    public static final Setting<Integer> RCF_SAMPLE_SIZE = Setting
        .intSetting("models.unsupervised.random_cut_forest.sample_size", 256, 2, 4096, Setting.Property.NodeScope);

    public static final Setting<Long> RCF_RANDOM_STATE = Setting
        .longSetting("models.unsupervised.random_cut_forest.random_state", 42L, 0L, Setting.Property.NodeScope);

    // ======================================
    // External endpoints and storage
    // ======================================
    public static final Setting<String> PROMETHEUS_URL = Setting
        .simpleString("prometheus_url", "http://prometheus:9090", Setting.Property.NodeScope);

    public static final Setting<String> API_URL = Setting.simpleString("api.url", "http://saimon-api:8000", Setting.Property.NodeScope);

    public static final Setting<String> MODEL_PATH = Setting.simpleString("model_path", "/app/models", Setting.Property.NodeScope);

    public static final Setting<TimeValue> HTTP_TIMEOUT = Setting
        .positiveTimeSetting("http.timeout", TimeValue.timeValueSeconds(30), Setting.Property.NodeScope);

    // ======================================
    // Scheduling
    // ======================================
    public static final Setting<TimeValue> TRAINING_INTERVAL = Setting
        .positiveTimeSetting("engine.training_interval", TimeValue.timeValueHours(24), Setting.Property.NodeScope);

    public static final Setting<TimeValue> INFERENCE_INTERVAL = Setting
        .positiveTimeSetting("engine.inference_interval", TimeValue.timeValueMinutes(5), Setting.Property.NodeScope);

    public static final Setting<TimeValue> TICK_INTERVAL = Setting
        .positiveTimeSetting("engine.tick_interval", TimeValue.timeValueSeconds(1), Setting.Property.NodeScope);

    /**
     * @return every typed setting of the engine
     */
    public static List<Setting<?>> getAllSettings() {
        return ImmutableList
            .of(
                DETECTION_THRESHOLD,
                WINDOW_SIZE,
                MIN_CONSECUTIVE,
                SEVERITY_LOW,
                SEVERITY_MEDIUM,
                SEVERITY_HIGH,
                SEVERITY_CRITICAL,
                MIN_DATA_POINTS,
                LOOKBACK_HOURS,
                QUERY_STEP,
                ROLLING_WINDOWS,
                ZSCORE_ENABLED,
                ZSCORE_THRESHOLD,
                ISOLATION_FOREST_ENABLED,
                ISOLATION_FOREST_CONTAMINATION,
                ISOLATION_FOREST_N_ESTIMATORS,
                ISOLATION_FOREST_MAX_SAMPLES,
                ISOLATION_FOREST_RANDOM_STATE,
                ONE_CLASS_SVM_ENABLED,
                ONE_CLASS_SVM_KERNEL,
                ONE_CLASS_SVM_GAMMA,
                ONE_CLASS_SVM_NU,
                ONE_CLASS_SVM_DEGREE,
                ONE_CLASS_SVM_COEF0,
                RCF_ENABLED,
                RCF_N_ESTIMATORS,
                RCF_SAMPLE_SIZE,
                RCF_RANDOM_STATE,
                PROMETHEUS_URL,
                API_URL,
                MODEL_PATH,
                HTTP_TIMEOUT,
                TRAINING_INTERVAL,
                INFERENCE_INTERVAL,
                TICK_INTERVAL
            );
    }

    /**
     * Reads every setting once so that an invalid value fails at startup rather than on first use.
     *
     * @param settings engine settings
     * @throws IllegalArgumentException on the first invalid value
     */
    public static void validate(Settings settings) {
        for (Setting<?> setting : getAllSettings()) {
            setting.get(settings);
        }
    }

    /**
     * Names of the metrics to watch. Accepts both a list of objects with a {@code name} key,
     * as the YAML configuration writes it, and a plain list of names.
     *
     * @param settings engine settings
     * @return metric names in configuration order
     */
    public static List<String> getMetricNames(Settings settings) {
        List<String> plain = settings.getAsList(METRICS_KEY);
        if (!plain.isEmpty()) {
            return ImmutableList.copyOf(plain);
        }
        Map<String, Settings> groups = settings.getGroups(METRICS_KEY);
        List<Map.Entry<String, Settings>> entries = new ArrayList<>(groups.entrySet());
        entries.sort(Comparator.comparingInt(entry -> Integer.parseInt(entry.getKey())));
        return entries
            .stream()
            .map(entry -> entry.getValue().get(METRIC_NAME_KEY))
            .filter(name -> name != null && !name.isEmpty())
            .collect(Collectors.collectingAndThen(Collectors.toList(), ImmutableList::copyOf));
    }

    static Integer parseWindow(String value) {
        int window = Integer.parseInt(value.trim());
        if (window < 1) {
            throw new IllegalArgumentException("Rolling window must be positive, got " + window);
        }
        return window;
    }

    static void validateContamination(String value) {
        if (AUTO.equals(value)) {
            return;
        }
        double contamination = parseDouble("contamination", value);
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5] or auto, got " + value);
        }
    }

    static void validateMaxSamples(String value) {
        if (AUTO.equals(value)) {
            return;
        }
        try {
            if (Integer.parseInt(value) < 1) {
                throw new IllegalArgumentException("max_samples must be positive or auto, got " + value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("max_samples must be positive or auto, got " + value, e);
        }
    }

    static void validateKernel(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "rbf":
            case "linear":
            case "poly":
            case "sigmoid":
                return;
            default:
                throw new IllegalArgumentException("Unsupported kernel " + value);
        }
    }

    static void validateGamma(String value) {
        if (AUTO.equals(value) || SCALE.equals(value)) {
            return;
        }
        if (parseDouble("gamma", value) <= 0) {
            throw new IllegalArgumentException("gamma must be positive, scale or auto, got " + value);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }
}
