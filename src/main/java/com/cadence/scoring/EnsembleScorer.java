package com.cadence.scoring;

import com.cadence.config.EngineConfig;
import com.cadence.domain.CalibrationTransform;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.ScoreRecord;
import com.cadence.engine.EngineMetrics;
import com.cadence.models.ModelRegistry;
import com.cadence.models.ModelScoreException;
import com.cadence.models.ModelUntrainedException;
import com.cadence.models.ScoringModel;
import com.cadence.profile.ProfileArena;
import com.cadence.profile.ProfileLockTimeoutException;
import com.cadence.profile.UserProfileSet;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered model against the user's current profiles.
 *
 * A model without a trained profile, or one that fails on the window, is left
 * out of the record and its failure noted; the remaining models still score.
 */
public class EnsembleScorer {
    private static final Logger logger = LoggerFactory.getLogger(EnsembleScorer.class);

    private final ModelRegistry registry;
    private final ProfileArena arena;
    private final EngineConfig config;
    private final EngineMetrics metrics;

    public EnsembleScorer(ModelRegistry registry, ProfileArena arena, EngineConfig config, EngineMetrics metrics) {
        this.registry = registry;
        this.arena = arena;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Scores the last window of {@code recent}; earlier windows give sequence context.
     */
    public ScoredWindow score(String userId, List<FeatureWindow> recent) {
        if (recent.isEmpty()) {
            throw new IllegalArgumentException("Nothing to score");
        }
        UserProfileSet set = arena.get(userId);
        Timer.Sample sample = metrics.startScoringTimer();
        try {
            return set.withReadLock(config.getProfileLockTimeout(), profiles -> scoreAll(userId, profiles, recent));
        } catch (ProfileLockTimeoutException e) {
            metrics.recordLockTimeout();
            logger.warn("Scoring window {} of user {} against prior profile version: {}",
                recent.get(recent.size() - 1).getWindowId(), userId, e.getMessage());
            return scoreAll(userId, set.snapshot(), recent);
        } finally {
            metrics.recordScoringLatency(sample);
        }
    }

    ScoredWindow scoreAll(String userId, Map<ModelKind, ModelProfile> profiles, List<FeatureWindow> recent) {
        FeatureWindow window = recent.get(recent.size() - 1);
        Map<ModelKind, Double> scores = new EnumMap<>(ModelKind.class);
        Map<ModelKind, String> failures = new EnumMap<>(ModelKind.class);
        Map<ModelKind, CalibrationTransform> transforms = new EnumMap<>(ModelKind.class);

        for (ScoringModel model : registry.all()) {
            ModelKind kind = model.kind();
            ModelProfile profile = profiles.get(kind);
            try {
                if (profile == null) {
                    throw new ModelUntrainedException(userId, kind);
                }
                double score = model.score(profile, recent);
                if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                    throw new ModelScoreException(kind, "Score out of range: " + score);
                }
                scores.put(kind, score);
                if (profile.getCalibration() != null) {
                    transforms.put(kind, profile.getCalibration());
                }
            } catch (ModelUntrainedException e) {
                failures.put(kind, e.getMessage());
                logger.debug("Model {} skipped for window {}: {}", kind, window.getWindowId(), e.getMessage());
            } catch (ModelScoreException e) {
                failures.put(kind, e.getMessage());
                metrics.recordModelFailure(kind);
                logger.warn("Model {} failed on window {} of user {}: {}",
                    kind, window.getWindowId(), userId, e.getMessage());
            } catch (RuntimeException e) {
                failures.put(kind, e.getClass().getSimpleName() + ": " + e.getMessage());
                metrics.recordModelFailure(kind);
                logger.error("Model {} crashed on window {} of user {}", kind, window.getWindowId(), userId, e);
            }
        }

        if (scores.isEmpty()) {
            metrics.recordWindowUnscored();
        } else {
            metrics.recordWindowScored();
        }
        ScoreRecord record = new ScoreRecord(window.getWindowId(), window.getEndTime(), scores, failures);
        return new ScoredWindow(record, transforms);
    }
}
