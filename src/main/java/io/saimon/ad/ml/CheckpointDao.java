/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import io.saimon.ad.common.exception.AnomalyEngineException;
import io.saimon.ad.constant.CommonMessages;
import io.saimon.ad.constant.CommonName;
import io.saimon.ad.model.Algorithm;
import io.saimon.ad.model.ModelKey;

import com.amazon.randomcutforest.RandomCutForest;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * DAO for model checkpoints on the local file system.
 *
 * Each model is one JSON file named after its model id. The file carries the metric name and
 * the algorithm as fields, so nothing is recovered from the file name when reading.
 */
public class CheckpointDao {
    private static final Logger logger = LogManager.getLogger(CheckpointDao.class);

    private final Path modelPath;
    private final Map<Algorithm, Class<? extends AnomalyModel>> modelClasses;
    private final Gson gson;

    /**
     * Constructor.
     *
     * @param modelPath directory holding the checkpoints
     * @param modelClasses model class of every algorithm whose checkpoints can be read
     */
    public CheckpointDao(Path modelPath, Map<Algorithm, Class<? extends AnomalyModel>> modelClasses) {
        this.modelPath = modelPath;
        this.modelClasses = ImmutableMap.copyOf(modelClasses);
        this.gson = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(RandomCutForest.class, new RcfSerDe())
            .create();
    }

    /**
     * Writes a checkpoint. The file is replaced atomically, so readers see either the previous
     * checkpoint or the new one.
     *
     * @param key metric and algorithm of the model
     * @param model trained model
     * @param trainedAt training time
     * @return path of the checkpoint
     * @throws AnomalyEngineException when the checkpoint cannot be written
     */
    public Path write(ModelKey key, AnomalyModel model, Instant trainedAt) {
        JsonObject checkpoint = new JsonObject();
        checkpoint.addProperty(CommonName.METRIC_NAME_FIELD, key.getMetricName());
        checkpoint.addProperty(CommonName.ALGORITHM_FIELD, key.getAlgorithm().getName());
        checkpoint.addProperty(CommonName.TRAINED_AT_FIELD, trainedAt.toString());
        Path target = getCheckpointPath(key);
        try {
            checkpoint.add(CommonName.MODEL_FIELD, gson.toJsonTree(model));
            Files.createDirectories(modelPath);
            Path temp = Files.createTempFile(modelPath, target.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, gson.toJson(checkpoint).getBytes(StandardCharsets.UTF_8));
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException | RuntimeException e) {
            throw new AnomalyEngineException(key.getMetricName(), CommonMessages.FAIL_TO_WRITE_CHECKPOINT, e);
        }
        logger.info("Saved model {} to {}", key.getModelId(), target);
        return target;
    }

    /**
     * Reads one checkpoint.
     *
     * @param file checkpoint file
     * @return the model state, empty if the file is unreadable, corrupted or belongs to an unknown algorithm
     */
    public Optional<ModelState> read(Path file) {
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            JsonObject checkpoint = JsonParser.parseString(content).getAsJsonObject();
            String metricName = checkpoint.get(CommonName.METRIC_NAME_FIELD).getAsString();
            Algorithm algorithm = Algorithm.fromName(checkpoint.get(CommonName.ALGORITHM_FIELD).getAsString());
            Class<? extends AnomalyModel> modelClass = modelClasses.get(algorithm);
            if (modelClass == null) {
                logger.info("Skipping checkpoint {} of disabled algorithm {}", file, algorithm);
                return Optional.empty();
            }
            JsonElement trainedAtJson = checkpoint.get(CommonName.TRAINED_AT_FIELD);
            Instant trainedAt = trainedAtJson == null
                ? Files.getLastModifiedTime(file).toInstant()
                : Instant.parse(trainedAtJson.getAsString());
            AnomalyModel model = gson.fromJson(checkpoint.get(CommonName.MODEL_FIELD), modelClass);
            if (model == null) {
                logger.warn("Checkpoint {} has no model", file);
                return Optional.empty();
            }
            return Optional.of(new ModelState(new ModelKey(metricName, algorithm), model, trainedAt, file));
        } catch (IOException | RuntimeException e) {
            // a corrupted checkpoint is ignored: the next training run replaces it
            logger.warn(new ParameterizedMessage("{} {}", CommonMessages.FAIL_TO_READ_CHECKPOINT, file), e);
            return Optional.empty();
        }
    }

    /**
     * Reads every checkpoint of the model directory.
     *
     * @return readable checkpoints, in file name order
     */
    public List<ModelState> readAll() {
        List<ModelState> states = new ArrayList<>();
        if (!Files.isDirectory(modelPath)) {
            logger.info("Model directory {} does not exist yet", modelPath);
            return states;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(modelPath, "*" + CommonName.CHECKPOINT_FILE_SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            logger.error(new ParameterizedMessage("Fail to list model directory {}", modelPath), e);
            return states;
        }
        files.sort(null);
        for (Path file : files) {
            read(file).ifPresent(states::add);
        }
        return states;
    }

    /**
     * Checkpoint file of a model: the model id with characters outside [A-Za-z0-9._-] replaced.
     * A replaced id gets a hash suffix so that distinct metric names never share a file.
     *
     * @param key metric and algorithm of the model
     * @return checkpoint path
     */
    public Path getCheckpointPath(ModelKey key) {
        String modelId = key.getModelId();
        String sanitized = modelId.replaceAll("[^A-Za-z0-9._-]", "_");
        if (!sanitized.equals(modelId)) {
            sanitized = sanitized + "-" + Hashing.sha256().hashString(modelId, StandardCharsets.UTF_8).toString().substring(0, 8);
        }
        return modelPath.resolve(sanitized + CommonName.CHECKPOINT_FILE_SUFFIX);
    }

    public Path getModelPath() {
        return modelPath;
    }
}
