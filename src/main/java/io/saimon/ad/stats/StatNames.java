/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.stats;

import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing names of all stats the engine keeps.
 */
public enum StatNames {
    MODELS_TRAINED_COUNT("models_trained_count"),
    MODEL_FIT_FAILURE_COUNT("model_fit_failure_count"),
    INSUFFICIENT_DATA_COUNT("insufficient_data_count"),
    DATA_FETCH_FAILURE_COUNT("data_fetch_failure_count"),
    REGISTRY_FAILURE_COUNT("registry_failure_count"),
    INFERENCE_FAILURE_COUNT("inference_failure_count"),
    ANOMALIES_DETECTED_COUNT("anomalies_detected_count"),
    ANOMALIES_EMITTED_COUNT("anomalies_emitted_count"),
    SINK_FAILURE_COUNT("sink_failure_count"),
    JOB_FAILURE_COUNT("job_failure_count");

    private final String name;

    StatNames(String name) {
        this.name = name;
    }

    /**
     * Get stat name
     *
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * Get set of stat names
     *
     * @return set of stat names
     */
    public static Set<String> getNames() {
        Set<String> names = new HashSet<>();

        for (StatNames statName : StatNames.values()) {
            names.add(statName.getName());
        }
        return names;
    }
}
