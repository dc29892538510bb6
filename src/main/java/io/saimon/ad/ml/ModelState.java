/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import org.apache.commons.lang3.builder.ToStringBuilder;

import io.saimon.ad.model.ModelKey;

/**
 * A trained model together with the information the store keeps about it.
 */
public class ModelState {
    private final ModelKey key;
    private final AnomalyModel model;
    private final Instant trainedAt;
    private final Path checkpointPath;

    /**
     * Constructor.
     *
     * @param key metric and algorithm of the model
     * @param model trained model
     * @param trainedAt time the training finished
     * @param checkpointPath checkpoint file, null if the model was never written to disk
     */
    public ModelState(ModelKey key, AnomalyModel model, Instant trainedAt, Path checkpointPath) {
        this.key = key;
        this.model = model;
        this.trainedAt = trainedAt;
        this.checkpointPath = checkpointPath;
    }

    public ModelKey getKey() {
        return key;
    }

    public AnomalyModel getModel() {
        return model;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public Optional<Path> getCheckpointPath() {
        return Optional.ofNullable(checkpointPath);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("key", key)
            .append("algorithm", model.getAlgorithm())
            .append("trainedAt", trainedAt)
            .append("checkpointPath", checkpointPath)
            .toString();
    }
}
