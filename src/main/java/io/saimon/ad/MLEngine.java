/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsException;

import io.saimon.ad.client.AnomalySink;
import io.saimon.ad.client.HttpAnomalySink;
import io.saimon.ad.client.HttpModelRegistry;
import io.saimon.ad.client.ModelRegistry;
import io.saimon.ad.feature.DataCollector;
import io.saimon.ad.feature.FeatureBuilder;
import io.saimon.ad.feature.MetricDataFetcher;
import io.saimon.ad.feature.PrometheusDataCollector;
import io.saimon.ad.job.InferenceJob;
import io.saimon.ad.job.JobRunner;
import io.saimon.ad.job.ScheduledJob;
import io.saimon.ad.job.TrainingJob;
import io.saimon.ad.ml.AlgorithmTrainer;
import io.saimon.ad.ml.AnomalyEmitter;
import io.saimon.ad.ml.CheckpointDao;
import io.saimon.ad.ml.InferenceEngine;
import io.saimon.ad.ml.ModelStore;
import io.saimon.ad.ml.ModelTrainer;
import io.saimon.ad.ml.SeverityClassifier;
import io.saimon.ad.settings.AnomalyDetectorSettings;
import io.saimon.ad.settings.YamlSettingsLoader;
import io.saimon.ad.stats.Stats;
import io.saimon.ad.util.HttpClientUtil;

import com.google.common.collect.ImmutableList;

/**
 * Entry point of the detection engine: loads the configuration, wires the components and runs
 * the training and inference jobs until the process is stopped.
 */
public class MLEngine implements Closeable {
    private static final Logger logger = LogManager.getLogger(MLEngine.class);

    public static final String CONFIG_PATH_ENV = "ML_CONFIG_PATH";
    public static final String PROMETHEUS_URL_ENV = "PROMETHEUS_URL";
    public static final String API_URL_ENV = "API_URL";
    public static final String MODEL_PATH_ENV = "ML_MODEL_PATH";
    public static final String DEFAULT_CONFIG_RESOURCE = "ml_config.yml";

    private final Stats stats;
    private final ModelStore modelStore;
    private final ModelTrainer modelTrainer;
    private final InferenceEngine inferenceEngine;
    private final JobRunner jobRunner;
    private final Closeable resources;

    /**
     * Wires the engine around its external collaborators.
     *
     * @param settings validated engine settings
     * @param clock clock used for query ranges, training times and detection times
     * @param dataCollector source of metric series
     * @param modelRegistry external model registry
     * @param anomalySink consumer of anomaly records
     * @param resources closed together with the engine
     */
    MLEngine(
        Settings settings,
        Clock clock,
        DataCollector dataCollector,
        ModelRegistry modelRegistry,
        AnomalySink anomalySink,
        Closeable resources
    ) {
        this.resources = resources;
        this.stats = Stats.withCounters();

        List<String> metricNames = AnomalyDetectorSettings.getMetricNames(settings);
        FeatureBuilder featureBuilder = new FeatureBuilder(AnomalyDetectorSettings.ROLLING_WINDOWS.get(settings));
        List<AlgorithmTrainer> trainers = ModelTrainer.createTrainers(settings);
        CheckpointDao checkpointDao = new CheckpointDao(
            Paths.get(AnomalyDetectorSettings.MODEL_PATH.get(settings)),
            ModelTrainer.getModelClasses(trainers)
        );
        this.modelStore = new ModelStore(checkpointDao, modelRegistry, clock, stats);
        this.modelTrainer = new ModelTrainer(
            trainers,
            featureBuilder,
            modelStore,
            AnomalyDetectorSettings.MIN_DATA_POINTS.get(settings),
            stats
        );
        this.inferenceEngine = new InferenceEngine(
            modelStore,
            featureBuilder,
            SeverityClassifier.fromSettings(settings),
            AnomalyDetectorSettings.DETECTION_THRESHOLD.get(settings),
            AnomalyDetectorSettings.MIN_CONSECUTIVE.get(settings),
            clock,
            stats
        );
        MetricDataFetcher dataFetcher = MetricDataFetcher.fromSettings(dataCollector, clock, settings);
        AnomalyEmitter anomalyEmitter = new AnomalyEmitter(anomalySink, stats);

        // training runs before inference, at startup and whenever both are due on the same tick
        List<ScheduledJob> jobs = ImmutableList
            .of(
                new ScheduledJob(
                    TrainingJob.NAME,
                    new TrainingJob(metricNames, dataFetcher, modelTrainer, stats),
                    toDuration(AnomalyDetectorSettings.TRAINING_INTERVAL.get(settings).millis())
                ),
                new ScheduledJob(
                    InferenceJob.NAME,
                    new InferenceJob(metricNames, dataFetcher, inferenceEngine, anomalyEmitter, stats),
                    toDuration(AnomalyDetectorSettings.INFERENCE_INTERVAL.get(settings).millis())
                )
            );
        this.jobRunner = new JobRunner(jobs, clock, toDuration(AnomalyDetectorSettings.TICK_INTERVAL.get(settings).millis()), stats);
        logger
            .info(
                "Engine configured for metrics {} with algorithms {}",
                metricNames,
                ModelTrainer.getModelClasses(trainers).keySet()
            );
    }

    /**
     * Creates an engine talking to Prometheus and the platform API over HTTP.
     *
     * @param settings engine settings
     * @return the engine
     */
    public static MLEngine create(Settings settings) {
        AnomalyDetectorSettings.validate(settings);
        HttpClientUtil httpClient = new HttpClientUtil(AnomalyDetectorSettings.HTTP_TIMEOUT.get(settings));
        String apiUrl = AnomalyDetectorSettings.API_URL.get(settings);
        return new MLEngine(
            settings,
            Clock.systemUTC(),
            new PrometheusDataCollector(httpClient, AnomalyDetectorSettings.PROMETHEUS_URL.get(settings)),
            new HttpModelRegistry(httpClient, apiUrl),
            new HttpAnomalySink(httpClient, apiUrl),
            httpClient
        );
    }

    /**
     * Loads settings from the file named by {@code ML_CONFIG_PATH}, or from the bundled default
     * configuration, then applies the environment overrides.
     *
     * @param env environment variables
     * @return settings
     * @throws IOException when the configuration file cannot be read
     */
    static Settings loadSettings(Map<String, String> env) throws IOException {
        Settings.Builder builder = Settings.builder();
        String configPath = env.get(CONFIG_PATH_ENV);
        if (configPath != null && !configPath.isEmpty()) {
            Path path = Paths.get(configPath);
            logger.info("Loading configuration from {}", path);
            try (InputStream in = Files.newInputStream(path)) {
                YamlSettingsLoader.load(builder, path.getFileName().toString(), in);
            }
        } else {
            logger.info("Loading bundled configuration {}", DEFAULT_CONFIG_RESOURCE);
            try (InputStream in = MLEngine.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
                if (in == null) {
                    throw new IOException("Missing bundled configuration " + DEFAULT_CONFIG_RESOURCE);
                }
                YamlSettingsLoader.load(builder, DEFAULT_CONFIG_RESOURCE, in);
            }
        }
        override(builder, env, PROMETHEUS_URL_ENV, AnomalyDetectorSettings.PROMETHEUS_URL.getKey());
        override(builder, env, API_URL_ENV, AnomalyDetectorSettings.API_URL.getKey());
        override(builder, env, MODEL_PATH_ENV, AnomalyDetectorSettings.MODEL_PATH.getKey());
        return builder.build();
    }

    private static void override(Settings.Builder builder, Map<String, String> env, String variable, String key) {
        String value = env.get(variable);
        if (value != null && !value.isEmpty()) {
            builder.put(key, value);
        }
    }

    private static Duration toDuration(long millis) {
        return Duration.ofMillis(millis);
    }

    /**
     * Loads existing checkpoints, then runs the job loop on the calling thread.
     */
    public void start() {
        modelStore.loadCheckpoints();
        jobRunner.start();
    }

    public void stop() {
        jobRunner.stop();
    }

    @Override
    public void close() throws IOException {
        stop();
        logger.info("Final stats {}", stats.snapshot());
        resources.close();
    }

    public Stats getStats() {
        return stats;
    }

    public ModelStore getModelStore() {
        return modelStore;
    }

    public ModelTrainer getModelTrainer() {
        return modelTrainer;
    }

    public InferenceEngine getInferenceEngine() {
        return inferenceEngine;
    }

    public JobRunner getJobRunner() {
        return jobRunner;
    }

    public static void main(String[] args) {
        logger.info("Starting ML engine");
        MLEngine engine;
        try {
            engine = create(loadSettings(System.getenv()));
        } catch (IOException | IllegalArgumentException | SettingsException e) {
            logger.fatal("Invalid configuration", e);
            System.exit(1);
            return;
        }
        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down ML engine");
            engine.stop();
            mainThread.interrupt();
        }, "ml-engine-shutdown"));
        try {
            engine.start();
        } finally {
            try {
                engine.close();
            } catch (IOException e) {
                logger.warn("Fail to close engine resources", e);
            }
        }
    }
}
