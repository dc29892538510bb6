/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.core.action.ActionListener;

import io.saimon.ad.client.ModelRegistry;
import io.saimon.ad.common.exception.AnomalyEngineException;
import io.saimon.ad.model.ModelKey;
import io.saimon.ad.model.ModelRegistration;
import io.saimon.ad.stats.StatNames;
import io.saimon.ad.stats.Stats;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Owns the trained models, keyed by metric and algorithm.
 *
 * Readers see an immutable snapshot published through a volatile reference. A model becomes
 * visible only once it is complete, and replacing the model of one key never touches another.
 */
public class ModelStore {
    private static final Logger logger = LogManager.getLogger(ModelStore.class);

    private final CheckpointDao checkpointDao;
    private final ModelRegistry modelRegistry;
    private final Clock clock;
    private final Stats stats;

    private volatile ImmutableSortedMap<ModelKey, ModelState> models;

    public ModelStore(CheckpointDao checkpointDao, ModelRegistry modelRegistry, Clock clock, Stats stats) {
        this.checkpointDao = checkpointDao;
        this.modelRegistry = modelRegistry;
        this.clock = clock;
        this.stats = stats;
        this.models = ImmutableSortedMap.of();
    }

    /**
     * Publishes a trained model: writes its checkpoint, makes it visible to readers and
     * registers it with the external registry. A failed checkpoint write still publishes the
     * model in memory but skips registration. Registry failures are logged only.
     *
     * @param key metric and algorithm
     * @param model trained model
     * @return the published state
     */
    public ModelState publish(ModelKey key, AnomalyModel model) {
        Instant trainedAt = clock.instant();
        Path checkpoint = null;
        try {
            checkpoint = checkpointDao.write(key, model, trainedAt);
        } catch (AnomalyEngineException e) {
            logger.error(new ParameterizedMessage("Model {} kept in memory only", key.getModelId()), e);
        }
        ModelState state = new ModelState(key, model, trainedAt, checkpoint);
        put(state);
        if (checkpoint != null) {
            register(state, checkpoint);
        }
        return state;
    }

    /**
     * Loads the checkpoints of the model directory. A checkpoint never replaces a model that
     * was trained after it.
     *
     * @return number of models loaded
     */
    public int loadCheckpoints() {
        int loaded = 0;
        for (ModelState state : checkpointDao.readAll()) {
            Optional<ModelState> current = getState(state.getKey());
            if (current.isPresent() && !current.get().getTrainedAt().isBefore(state.getTrainedAt())) {
                continue;
            }
            put(state);
            loaded++;
        }
        logger.info("Loaded {} models from {}", loaded, checkpointDao.getModelPath());
        return loaded;
    }

    public Optional<AnomalyModel> get(ModelKey key) {
        return getState(key).map(ModelState::getModel);
    }

    public Optional<ModelState> getState(ModelKey key) {
        return Optional.ofNullable(models.get(key));
    }

    /**
     * Models of one metric, in algorithm order.
     *
     * @param metricName metric name
     * @return model states, possibly empty
     */
    public List<ModelState> getModels(String metricName) {
        return models
            .values()
            .stream()
            .filter(state -> state.getKey().getMetricName().equals(metricName))
            .collect(Collectors.collectingAndThen(Collectors.toList(), ImmutableList::copyOf));
    }

    public int size() {
        return models.size();
    }

    private synchronized void put(ModelState state) {
        TreeMap<ModelKey, ModelState> next = new TreeMap<>(models);
        next.put(state.getKey(), state);
        models = ImmutableSortedMap.copyOfSorted(next);
    }

    private void register(ModelState state, Path checkpoint) {
        ModelRegistration registration = new ModelRegistration(
            state.getKey(),
            state.getModel().getConfig(),
            checkpoint.toString(),
            state.getTrainedAt()
        );
        modelRegistry.register(registration, ActionListener.wrap(id -> {}, exception -> {
            stats.increment(StatNames.REGISTRY_FAILURE_COUNT);
            logger.warn(new ParameterizedMessage("Fail to register model {}", state.getKey().getModelId()), exception);
        }));
    }
}
