package com.cadence.scoring;

import com.cadence.config.EngineConfig;
import com.cadence.domain.CalibrationTransform;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ScoreRecord;
import com.cadence.models.ModelSupport;
import com.cadence.models.ModelUntrainedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Combines per-model scores of a session into one calibrated genuineness score.
 *
 * <p>Each raw score passes through the affine calibration transform of its
 * profile, then the weighted mean is taken over the models that actually
 * scored, so a missing model's weight is redistributed rather than counted as
 * zero. The aggregator also tracks how many windows in a row fell below the
 * confidence threshold; unscored windows count as low.
 *
 * <p>Not thread-safe; one instance belongs to one session worker.
 */
public class Aggregator {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Percentile spreads narrower than this fall back to a unit-slope shift
     */
    static final double MIN_CALIBRATION_SPREAD = 0.02;

    private final EngineConfig config;
    private int consecutiveLow;

    public Aggregator(EngineConfig config) {
        this.config = config;
    }

    /**
     * Calibrates and combines the scores of one window. The window is a severe
     * anomaly when its aggregate falls strictly below
     * {@link EngineConfig#severeAnomalyFloor()}; an aggregate equal to the floor is not severe.
     *
     * @throws ModelUntrainedException if no model produced a score
     */
    public AggregateResult aggregate(ScoredWindow scored) {
        ScoreRecord raw = scored.getRecord();
        Map<ModelKind, Double> calibrated = new EnumMap<>(ModelKind.class);
        for (Map.Entry<ModelKind, Double> entry : raw.getRawScores().entrySet()) {
            calibrated.put(entry.getKey(), scored.transformOf(entry.getKey()).apply(entry.getValue()));
        }
        double aggregate = combine(calibrated, config);

        boolean low = aggregate < config.getConfidenceThreshold();
        boolean severe = aggregate < config.severeAnomalyFloor();
        consecutiveLow = low ? consecutiveLow + 1 : 0;
        boolean triggered = consecutiveLow >= config.getConsecutiveAnomaliesLimit();

        ScoreRecord record = raw.withAggregate(calibrated, aggregate);
        logger.debug("Window {} aggregate {} from {} models (consecutive low {})",
            raw.getWindowId(), aggregate, calibrated.size(), consecutiveLow);
        return new AggregateResult(record, true, low, severe, consecutiveLow, triggered);
    }

    /**
     * Records a window that no model could score.
     */
    public AggregateResult recordUnscored(ScoreRecord record) {
        consecutiveLow++;
        boolean triggered = consecutiveLow >= config.getConsecutiveAnomaliesLimit();
        return new AggregateResult(record, false, true, false, consecutiveLow, triggered);
    }

    public int getConsecutiveLow() {
        return consecutiveLow;
    }

    public void reset() {
        consecutiveLow = 0;
    }

    /**
     * Weighted mean of the calibrated scores renormalized over the present models, in [0, 1].
     *
     * @throws ModelUntrainedException if no model with a positive weight is present
     */
    public static double combine(Map<ModelKind, Double> calibrated, EngineConfig config) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<ModelKind, Double> entry : calibrated.entrySet()) {
            double weight = config.weightOf(entry.getKey());
            weighted += weight * entry.getValue();
            totalWeight += weight;
        }
        if (calibrated.isEmpty() || totalWeight <= 0.0) {
            throw new ModelUntrainedException("No trained model produced a score");
        }
        return Math.max(0.0, Math.min(1.0, weighted / totalWeight));
    }

    /**
     * Fits the affine map sending the low calibration percentile of a model's
     * training scores to the low target and the high percentile to the high target.
     */
    public static CalibrationTransform fitTransform(double[] trainingScores, EngineConfig config) {
        if (trainingScores == null || trainingScores.length == 0) {
            return CalibrationTransform.identity();
        }
        double low = ModelSupport.percentile(trainingScores, config.getCalibrationLowPercentile());
        double high = ModelSupport.percentile(trainingScores, config.getCalibrationHighPercentile());
        double spread = high - low;
        if (spread < MIN_CALIBRATION_SPREAD) {
            return new CalibrationTransform(1.0, config.getCalibrationHighTarget() - high);
        }
        double slope = (config.getCalibrationHighTarget() - config.getCalibrationLowTarget()) / spread;
        double intercept = config.getCalibrationLowTarget() - slope * low;
        return new CalibrationTransform(slope, intercept);
    }
}
