/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import org.opensearch.common.settings.Settings;

import io.saimon.ad.model.Severity;
import io.saimon.ad.settings.AnomalyDetectorSettings;

import com.google.common.base.Preconditions;

/**
 * Maps a normalized score to a severity using ascending cut points.
 */
public class SeverityClassifier {
    private final double low;
    private final double medium;
    private final double high;
    private final double critical;

    /**
     * Constructor.
     *
     * @param low lowest cut point; scores below medium are LOW regardless of it
     * @param medium scores at or above are at least MEDIUM
     * @param high scores at or above are at least HIGH
     * @param critical scores at or above are CRITICAL
     * @throws IllegalArgumentException when the cut points are not monotonic
     */
    public SeverityClassifier(double low, double medium, double high, double critical) {
        Preconditions
            .checkArgument(
                low <= medium && medium <= high && high <= critical,
                "Severity levels must satisfy low <= medium <= high <= critical, got %s, %s, %s, %s",
                low,
                medium,
                high,
                critical
            );
        this.low = low;
        this.medium = medium;
        this.high = high;
        this.critical = critical;
    }

    public static SeverityClassifier fromSettings(Settings settings) {
        return new SeverityClassifier(
            AnomalyDetectorSettings.SEVERITY_LOW.get(settings),
            AnomalyDetectorSettings.SEVERITY_MEDIUM.get(settings),
            AnomalyDetectorSettings.SEVERITY_HIGH.get(settings),
            AnomalyDetectorSettings.SEVERITY_CRITICAL.get(settings)
        );
    }

    public Severity classify(double normalizedScore) {
        if (normalizedScore >= critical) {
            return Severity.CRITICAL;
        } else if (normalizedScore >= high) {
            return Severity.HIGH;
        } else if (normalizedScore >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public double getLow() {
        return low;
    }
}
