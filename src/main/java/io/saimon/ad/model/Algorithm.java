/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.model;

import java.util.Locale;

import io.saimon.ad.constant.CommonMessages;

/**
 * Algorithm families the engine can train. The name is the wire and config identifier.
 */
public enum Algorithm {
    ZSCORE("zscore"),
    ISOLATION_FOREST("isolation_forest"),
    ONE_CLASS_SVM("one_class_svm"),
    RANDOM_CUT_FOREST("random_cut_forest");

    private final String name;

    Algorithm(String name) {
        this.name = name;
    }

    /**
     * Get algorithm name
     *
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * Version tag the external registry records for a model of this algorithm.
     *
     * @return version tag such as "1.0-zscore"
     */
    public String getVersionTag() {
        return "1.0-" + name;
    }

    public static Algorithm fromName(String name) {
        for (Algorithm algorithm : values()) {
            if (algorithm.name.equals(name.toLowerCase(Locale.ROOT))) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException(CommonMessages.UNKNOWN_ALGORITHM + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
