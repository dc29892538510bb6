/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.model;

import java.time.Instant;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.collect.ImmutableMap;

/**
 * Entry the external model registry keeps for a trained model.
 */
public class ModelRegistration {
    private final ModelKey key;
    private final Map<String, Object> config;
    private final String filePath;
    private final Instant trainedAt;

    public ModelRegistration(ModelKey key, Map<String, Object> config, String filePath, Instant trainedAt) {
        this.key = key;
        this.config = config == null ? ImmutableMap.of() : ImmutableMap.copyOf(config);
        this.filePath = filePath;
        this.trainedAt = trainedAt;
    }

    public ModelKey getKey() {
        return key;
    }

    /**
     * @return metric name, the registry's model name
     */
    public String getName() {
        return key.getMetricName();
    }

    public String getVersion() {
        return key.getAlgorithm().getVersionTag();
    }

    public String getModelType() {
        return key.getAlgorithm().getName();
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public String getFilePath() {
        return filePath;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("key", key)
            .append("version", getVersion())
            .append("filePath", filePath)
            .append("trainedAt", trainedAt)
            .toString();
    }
}
