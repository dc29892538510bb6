/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import static org.junit.Assert.assertEquals;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.opensearch.common.settings.Settings;

import io.saimon.ad.model.Severity;

@RunWith(JUnitParamsRunner.class)
public class SeverityClassifierTests {

    private SeverityClassifier classifier = SeverityClassifier.fromSettings(Settings.EMPTY);

    private Object[] defaultData() {
        return new Object[] {
            new Object[] { 0.995, Severity.CRITICAL },
            new Object[] { 0.99, Severity.CRITICAL },
            new Object[] { 0.96, Severity.HIGH },
            new Object[] { 0.95, Severity.HIGH },
            new Object[] { 0.90, Severity.MEDIUM },
            new Object[] { 0.85, Severity.MEDIUM },
            new Object[] { 0.5, Severity.LOW },
            new Object[] { 0.0, Severity.LOW } };
    }

    @Test
    @Parameters(method = "defaultData")
    public void classify_withDefaultLevels(double score, Severity expected) {
        assertEquals(expected, classifier.classify(score));
    }

    @Test
    public void fromSettings_readsLevels() {
        Settings settings = Settings
            .builder()
            .put("anomaly_detection.severity_levels.medium", 0.8)
            .put("anomaly_detection.severity_levels.high", 0.85)
            .put("anomaly_detection.severity_levels.critical", 0.9)
            .build();

        SeverityClassifier custom = SeverityClassifier.fromSettings(settings);

        assertEquals(Severity.CRITICAL, custom.classify(0.91));
        assertEquals(Severity.HIGH, custom.classify(0.86));
        assertEquals(Severity.MEDIUM, custom.classify(0.81));
        assertEquals(Severity.LOW, custom.classify(0.75));
        assertEquals(0.7, custom.getLow(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromSettings_rejectsCriticalBelowDefaultHigh() {
        SeverityClassifier.fromSettings(Settings.builder().put("anomaly_detection.severity_levels.critical", 0.9).build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void constructor_rejectsNonMonotonicLevels() {
        new SeverityClassifier(0.7, 0.96, 0.95, 0.99);
    }
}
