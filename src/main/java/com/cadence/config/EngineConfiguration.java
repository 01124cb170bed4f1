package com.cadence.config;

import com.cadence.calibration.CalibrationManager;
import com.cadence.domain.ModelKind;
import com.cadence.engine.BehavioralAuthEngine;
import com.cadence.engine.DecisionListener;
import com.cadence.engine.EngineMetrics;
import com.cadence.engine.SessionRegistry;
import com.cadence.features.FeatureExtractor;
import com.cadence.models.ModelRegistry;
import com.cadence.profile.ProfileArena;
import com.cadence.scoring.EnsembleScorer;
import com.cadence.storage.ProfileStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine from {@code cadence.engine.*} properties. Components that need
 * no engine settings (metrics, the session registry, the logging listener) are
 * picked up by component scanning.
 */
@Configuration
public class EngineConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfiguration.class);

    @Value("${cadence.engine.confidence-threshold:0.7}")
    private double confidenceThreshold;

    @Value("${cadence.engine.anomaly-score-threshold:0.8}")
    private double anomalyScoreThreshold;

    @Value("${cadence.engine.consecutive-anomalies-limit:3}")
    private int consecutiveAnomaliesLimit;

    @Value("${cadence.engine.window.size:30s}")
    private Duration windowSize;

    @Value("${cadence.engine.window.min-keystroke-events:20}")
    private int minKeystrokeEvents;

    @Value("${cadence.engine.window.min-mouse-events:15}")
    private int minMouseEvents;

    @Value("${cadence.engine.window.history-length:8}")
    private int historyLength;

    @Value("${cadence.engine.calibration.min-time:300s}")
    private Duration minCalibrationTime;

    @Value("${cadence.engine.calibration.min-windows:8}")
    private int minCalibrationWindows;

    @Value("${cadence.engine.calibration.min-modality-windows:5}")
    private int minModalityWindows;

    @Value("${cadence.engine.calibration.low-percentile:0.05}")
    private double calibrationLowPercentile;

    @Value("${cadence.engine.calibration.low-target:0.75}")
    private double calibrationLowTarget;

    @Value("${cadence.engine.calibration.high-percentile:0.5}")
    private double calibrationHighPercentile;

    @Value("${cadence.engine.calibration.high-target:0.95}")
    private double calibrationHighTarget;

    @Value("${cadence.engine.drift.detection-window:100}")
    private int driftDetectionWindow;

    @Value("${cadence.engine.drift.min-windows:5}")
    private int driftMinWindows;

    @Value("${cadence.engine.drift.alert-threshold:1.0}")
    private double driftAlertThreshold;

    @Value("${cadence.engine.drift.intrusion-threshold:2.5}")
    private double driftIntrusionThreshold;

    @Value("${cadence.engine.drift.sustained-windows:10}")
    private int driftSustainedWindows;

    @Value("${cadence.engine.session.recovery-windows:3}")
    private int recoveryWindows;

    @Value("${cadence.engine.session.lock-after-anomalies:5}")
    private int lockAfterAnomalies;

    @Value("${cadence.engine.session.max-suspicious-windows:20}")
    private int maxSuspiciousWindows;

    @Value("${cadence.engine.session.threads:4}")
    private int sessionThreads;

    @Value("${cadence.engine.profile.lock-timeout:250ms}")
    private Duration profileLockTimeout;

    @Value("${cadence.engine.training.threads:2}")
    private int trainingThreads;

    @Value("${cadence.engine.models.weights.sequence:1.0}")
    private double sequenceWeight;

    @Value("${cadence.engine.models.weights.reconstruction:1.0}")
    private double reconstructionWeight;

    @Value("${cadence.engine.models.weights.boundary:1.0}")
    private double boundaryWeight;

    @Value("${cadence.engine.models.weights.nearest-neighbor:1.0}")
    private double nearestNeighborWeight;

    @Value("${cadence.engine.models.weights.online-linear:1.0}")
    private double onlineLinearWeight;

    @Value("${cadence.engine.models.weights.isolation:1.0}")
    private double isolationWeight;

    @Value("${cadence.engine.models.sequence-length:5}")
    private int sequenceLength;

    @Value("${cadence.engine.models.reconstruction-components:0}")
    private int reconstructionComponents;

    @Value("${cadence.engine.models.boundary-percentile:0.95}")
    private double boundaryPercentile;

    @Value("${cadence.engine.models.boundary-steepness:4.0}")
    private double boundarySteepness;

    @Value("${cadence.engine.models.neighbor-capacity:200}")
    private int neighborCapacity;

    @Value("${cadence.engine.models.neighbor-k:5}")
    private int neighborK;

    @Value("${cadence.engine.models.linear-aggressiveness:0.5}")
    private double linearAggressiveness;

    @Value("${cadence.engine.models.linear-epochs:5}")
    private int linearEpochs;

    @Value("${cadence.engine.models.isolation-trees:100}")
    private int isolationTrees;

    @Value("${cadence.engine.models.isolation-sample-size:256}")
    private int isolationSampleSize;

    @Bean
    public EngineConfig engineConfig() {
        Map<ModelKind, Double> weights = new EnumMap<>(ModelKind.class);
        weights.put(ModelKind.SEQUENCE, sequenceWeight);
        weights.put(ModelKind.RECONSTRUCTION, reconstructionWeight);
        weights.put(ModelKind.BOUNDARY, boundaryWeight);
        weights.put(ModelKind.NEAREST_NEIGHBOR, nearestNeighborWeight);
        weights.put(ModelKind.ONLINE_LINEAR, onlineLinearWeight);
        weights.put(ModelKind.ISOLATION, isolationWeight);

        EngineConfig config = EngineConfig.builder()
            .confidenceThreshold(confidenceThreshold)
            .anomalyScoreThreshold(anomalyScoreThreshold)
            .consecutiveAnomaliesLimit(consecutiveAnomaliesLimit)
            .windowSize(windowSize)
            .minKeystrokeEvents(minKeystrokeEvents)
            .minMouseEvents(minMouseEvents)
            .historyLength(historyLength)
            .minCalibrationTime(minCalibrationTime)
            .minCalibrationWindows(minCalibrationWindows)
            .minModalityWindows(minModalityWindows)
            .calibrationLowPercentile(calibrationLowPercentile)
            .calibrationLowTarget(calibrationLowTarget)
            .calibrationHighPercentile(calibrationHighPercentile)
            .calibrationHighTarget(calibrationHighTarget)
            .driftDetectionWindow(driftDetectionWindow)
            .driftMinWindows(driftMinWindows)
            .driftAlertThreshold(driftAlertThreshold)
            .driftIntrusionThreshold(driftIntrusionThreshold)
            .driftSustainedWindows(driftSustainedWindows)
            .recoveryWindows(recoveryWindows)
            .lockAfterAnomalies(lockAfterAnomalies)
            .maxSuspiciousWindows(maxSuspiciousWindows)
            .profileLockTimeout(profileLockTimeout)
            .modelWeights(weights)
            .sequenceLength(sequenceLength)
            .reconstructionComponents(reconstructionComponents)
            .boundaryPercentile(boundaryPercentile)
            .boundarySteepness(boundarySteepness)
            .neighborCapacity(neighborCapacity)
            .neighborK(neighborK)
            .linearAggressiveness(linearAggressiveness)
            .linearEpochs(linearEpochs)
            .isolationTrees(isolationTrees)
            .isolationSampleSize(isolationSampleSize)
            .build();
        logger.info("Engine configured: window {}s, confidence {}, calibration {}s",
            windowSize.getSeconds(), confidenceThreshold, minCalibrationTime.getSeconds());
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ModelRegistry modelRegistry(EngineConfig engineConfig) {
        return ModelRegistry.standard(engineConfig);
    }

    @Bean
    public FeatureExtractor featureExtractor(EngineConfig engineConfig) {
        return new FeatureExtractor(engineConfig);
    }

    @Bean
    public ProfileArena profileArena(ProfileStore profileStore, EngineConfig engineConfig) {
        return new ProfileArena(profileStore, engineConfig);
    }

    @Bean
    public EnsembleScorer ensembleScorer(ModelRegistry modelRegistry, ProfileArena profileArena,
                                         EngineConfig engineConfig, EngineMetrics engineMetrics) {
        return new EnsembleScorer(modelRegistry, profileArena, engineConfig, engineMetrics);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService trainingExecutor() {
        return Executors.newFixedThreadPool(trainingThreads, named("cadence-training-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sessionExecutor() {
        return Executors.newFixedThreadPool(sessionThreads, named("cadence-session-"));
    }

    @Bean
    public CalibrationManager calibrationManager(ModelRegistry modelRegistry, ProfileArena profileArena,
                                                 EngineConfig engineConfig, EngineMetrics engineMetrics,
                                                 @Qualifier("trainingExecutor") ExecutorService trainingExecutor,
                                                 Clock clock) {
        return new CalibrationManager(modelRegistry, profileArena, engineConfig, engineMetrics, trainingExecutor,
            clock);
    }

    @Bean
    public BehavioralAuthEngine behavioralAuthEngine(EngineConfig engineConfig, FeatureExtractor featureExtractor,
                                                     ModelRegistry modelRegistry, ProfileArena profileArena,
                                                     EnsembleScorer ensembleScorer,
                                                     CalibrationManager calibrationManager,
                                                     SessionRegistry sessionRegistry,
                                                     List<DecisionListener> decisionListeners,
                                                     EngineMetrics engineMetrics,
                                                     @Qualifier("sessionExecutor") ExecutorService sessionExecutor) {
        return new BehavioralAuthEngine(engineConfig, featureExtractor, modelRegistry, profileArena, ensembleScorer,
            calibrationManager, sessionRegistry, decisionListeners, engineMetrics, sessionExecutor);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
