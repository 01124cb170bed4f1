package com.cadence.calibration;

import com.cadence.config.EngineConfig;
import com.cadence.domain.DriftState;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.Modality;
import com.cadence.drift.DriftMonitor;
import com.cadence.engine.EngineMetrics;
import com.cadence.models.ModelRegistry;
import com.cadence.models.ScoringModel;
import com.cadence.models.TrainingSet;
import com.cadence.profile.ProfileArena;
import com.cadence.profile.UserProfileSet;
import com.cadence.scoring.Aggregator;
import com.cadence.storage.ProfileStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Trains a user's full profile set from genuine windows.
 *
 * <p>Training runs under the user's exclusive profile lock so scorers either see
 * the complete previous version or the complete new one. Recalibration is
 * asynchronous on the training executor with at most one run per user.
 */
public class CalibrationManager {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationManager.class);

    private final ModelRegistry registry;
    private final ProfileArena arena;
    private final EngineConfig config;
    private final EngineMetrics metrics;
    private final Executor trainingExecutor;
    private final Clock clock;

    public CalibrationManager(ModelRegistry registry, ProfileArena arena, EngineConfig config,
                              EngineMetrics metrics, Executor trainingExecutor, Clock clock) {
        this.registry = registry;
        this.arena = arena;
        this.config = config;
        this.metrics = metrics;
        this.trainingExecutor = trainingExecutor;
        this.clock = clock;
    }

    /**
     * Trains, persists and publishes all models for the user.
     *
     * @param windows genuine windows in time order
     * @throws CalibrationIncompleteException if the windows cover too little time or are too few
     * @throws InsufficientModalityDataException if no modality has enough windows
     */
    public CalibrationResult calibrate(String userId, List<FeatureWindow> windows) {
        Duration covered = coverage(windows);
        if (covered.compareTo(config.getMinCalibrationTime()) < 0
            || windows.size() < config.getMinCalibrationWindows()) {
            throw new CalibrationIncompleteException(userId, covered, config.getMinCalibrationTime(),
                windows.size(), config.getMinCalibrationWindows());
        }

        Map<Modality, Integer> counts = new EnumMap<>(Modality.class);
        for (Modality modality : Modality.values()) {
            int count = 0;
            for (FeatureWindow window : windows) {
                if (window.hasModality(modality)) {
                    count++;
                }
            }
            counts.put(modality, count);
        }
        Set<Modality> trainable = EnumSet.noneOf(Modality.class);
        Set<Modality> missing = EnumSet.noneOf(Modality.class);
        for (Map.Entry<Modality, Integer> entry : counts.entrySet()) {
            if (entry.getValue() >= config.getMinModalityWindows()) {
                trainable.add(entry.getKey());
            } else {
                missing.add(entry.getKey());
            }
        }
        InsufficientModalityDataException gap = missing.isEmpty()
            ? null
            : new InsufficientModalityDataException(userId, missing, counts, config.getMinModalityWindows());
        if (trainable.isEmpty()) {
            throw gap;
        }
        if (gap != null) {
            logger.warn("Degraded calibration for user {}: {}", userId, gap.getMessage());
        }

        List<FeatureWindow> usable = new ArrayList<>();
        for (FeatureWindow window : windows) {
            for (Modality modality : trainable) {
                if (window.hasModality(modality)) {
                    usable.add(window);
                    break;
                }
            }
        }
        TrainingSet trainingSet = TrainingSet.of(userId, usable, trainable);

        UserProfileSet set = arena.get(userId);
        Timer.Sample sample = metrics.startTrainingTimer();
        try {
            return set.withWriteLock(config.getProfileLockTimeout(),
                () -> trainAndPublish(set, trainingSet, windows, trainable, gap, covered));
        } finally {
            metrics.recordTrainingLatency(sample);
        }
    }

    private CalibrationResult trainAndPublish(UserProfileSet set, TrainingSet trainingSet, List<FeatureWindow> windows,
                                              Set<Modality> trainable, InsufficientModalityDataException gap,
                                              Duration covered) {
        String userId = set.getUserId();
        long version = 1;
        for (ModelProfile existing : set.snapshot().values()) {
            version = Math.max(version, existing.getVersion() + 1);
        }
        Instant now = clock.instant();

        Map<ModelKind, ModelProfile> trained = new EnumMap<>(ModelKind.class);
        for (ScoringModel model : registry.all()) {
            ModelProfile profile = model.train(trainingSet);
            double[] scores = model.trainingScores(profile, trainingSet);
            profile.setCalibration(Aggregator.fitTransform(scores, config));
            profile.setVersion(version);
            profile.setTrainedAt(now);
            trained.put(model.kind(), profile);
            logger.debug("Trained {} for user {}: {}", model.kind(), userId, profile.getCalibration());
        }
        DriftState baseline = DriftMonitor.baselineOf(userId, windows, now);

        boolean persisted = persist(userId, trained, baseline);
        set.publish(trained, baseline);
        logger.info("Calibrated user {} v{} from {} windows over {}s with modalities {}",
            userId, version, trainingSet.size(), covered.getSeconds(), trainable);
        return new CalibrationResult(userId, trained, baseline, trainable, gap, trainingSet.size(), covered,
            version, persisted);
    }

    private boolean persist(String userId, Map<ModelKind, ModelProfile> trained, DriftState baseline) {
        ProfileStore store = arena.getStore();
        try {
            for (ModelProfile profile : trained.values()) {
                store.saveProfile(profile);
            }
            store.saveDriftState(baseline);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to persist profiles of user {}, keeping them in memory only", userId, e);
            return false;
        }
    }

    /**
     * Retrains the user's profiles in the background. Returns empty when a
     * recalibration for the user is already running.
     */
    public Optional<CompletableFuture<CalibrationResult>> recalibrateAsync(String userId, List<FeatureWindow> windows) {
        UserProfileSet set = arena.get(userId);
        if (!set.tryBeginRecalibration()) {
            logger.debug("Recalibration of user {} already in flight", userId);
            return Optional.empty();
        }
        List<FeatureWindow> snapshot = List.copyOf(windows);
        metrics.recordRecalibration();
        CompletableFuture<CalibrationResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> calibrate(userId, snapshot), trainingExecutor);
        } catch (RuntimeException e) {
            set.endRecalibration();
            throw e;
        }
        return Optional.of(future.whenComplete((result, ex) -> {
            set.endRecalibration();
            if (ex != null) {
                logger.warn("Recalibration of user {} failed: {}", userId, ex.getMessage());
            }
        }));
    }

    static Duration coverage(List<FeatureWindow> windows) {
        if (windows.isEmpty()) {
            return Duration.ZERO;
        }
        long span = windows.get(windows.size() - 1).getEndTime() - windows.get(0).getStartTime();
        return Duration.ofMillis(Math.max(0L, span));
    }
}
