package com.cadence.drift;

import com.cadence.config.EngineConfig;
import com.cadence.domain.DriftState;
import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.features.RunningStats;
import com.cadence.models.ModelSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Tracks how far a session's recent behavior has moved from the calibrated baseline.
 *
 * <p>The drift score is the root mean square, over features with a baseline,
 * of the standardized shift of the rolling mean: {@code (mean_recent - mean_base) / std_base}.
 * The rolling window holds the last {@code driftDetectionWindow} windows, oldest evicted first.
 * Shifts are clipped like the models' standardized inputs.
 *
 * <p>Drift is always judged together with the aggregate score. Sustained drift
 * while the user still scores as genuine suggests recalibration; strong drift
 * while the score is low suggests an intrusion. Neither signal alone decides.
 *
 * <p>Not thread-safe; one instance belongs to one session worker.
 */
public class DriftMonitor {
    private static final Logger logger = LoggerFactory.getLogger(DriftMonitor.class);

    private final EngineConfig config;
    private final Deque<FeatureWindow> recent = new ArrayDeque<>();
    private final RunningStats[] current = new RunningStats[FeatureSchema.DIMENSION];

    private DriftState baseline;
    private double driftScore;
    private int sustained;

    public DriftMonitor(EngineConfig config, DriftState baseline) {
        this.config = config;
        for (int i = 0; i < current.length; i++) {
            current[i] = new RunningStats();
        }
        this.baseline = baseline;
    }

    /**
     * Folds a window into the rolling statistics and evaluates both signals.
     *
     * @param aggregate the window's aggregate score, or null if it was not scored
     */
    public DriftAssessment update(FeatureWindow window, Double aggregate) {
        recent.addLast(window);
        forEachValue(window, true);
        while (recent.size() > config.getDriftDetectionWindow()) {
            forEachValue(recent.removeFirst(), false);
        }

        boolean ready = hasBaseline() && recent.size() >= config.getDriftMinWindows();
        driftScore = ready ? computeDrift() : 0.0;

        boolean genuine = aggregate != null && aggregate >= config.getConfidenceThreshold();
        boolean aboveAlert = driftScore > config.getDriftAlertThreshold();
        sustained = aboveAlert && genuine ? sustained + 1 : 0;

        boolean suggest = sustained >= config.getDriftSustainedWindows();
        int sustainedReported = sustained;
        if (suggest) {
            logger.info("Sustained drift {} over {} genuine windows, suggesting recalibration",
                driftScore, sustained);
            sustained = 0;
        }
        boolean intrusion = driftScore > config.getDriftIntrusionThreshold() && !genuine;
        return new DriftAssessment(driftScore, ready, aboveAlert, sustainedReported, suggest, intrusion);
    }

    private void forEachValue(FeatureWindow window, boolean add) {
        for (int i = 0; i < current.length; i++) {
            double value = window.get(i);
            if (Double.isNaN(value)) {
                continue;
            }
            if (add) {
                current[i].add(value);
            } else {
                current[i].remove(value);
            }
        }
    }

    private boolean hasBaseline() {
        return baseline != null && baseline.getBaselineMeans() != null && baseline.getBaselineStdDevs() != null
            && baseline.getBaselineCounts() != null;
    }

    private double computeDrift() {
        double[] means = baseline.getBaselineMeans();
        double[] stdDevs = baseline.getBaselineStdDevs();
        long[] counts = baseline.getBaselineCounts();
        double sum = 0.0;
        int features = 0;
        for (int i = 0; i < current.length && i < means.length; i++) {
            if (counts[i] == 0 || current[i].count() == 0) {
                continue;
            }
            double shift = (current[i].mean() - means[i]) / ModelSupport.floorStdDev(stdDevs[i], means[i]);
            shift = Math.max(-ModelSupport.Z_CLIP, Math.min(ModelSupport.Z_CLIP, shift));
            sum += shift * shift;
            features++;
        }
        return features == 0 ? 0.0 : Math.sqrt(sum / features);
    }

    /**
     * Replaces the baseline after a recalibration and restarts the rolling window.
     */
    public void rebaseline(DriftState newBaseline) {
        this.baseline = newBaseline;
        recent.clear();
        for (RunningStats stats : current) {
            stats.reset();
        }
        driftScore = 0.0;
        sustained = 0;
    }

    public double getDriftScore() {
        return driftScore;
    }

    public int getWindowCount() {
        return recent.size();
    }

    /**
     * Baseline plus the current rolling statistics, for persistence
     */
    public DriftState snapshot(String userId) {
        DriftState state = new DriftState(userId);
        if (baseline != null) {
            state.setBaselineMeans(baseline.getBaselineMeans());
            state.setBaselineStdDevs(baseline.getBaselineStdDevs());
            state.setBaselineCounts(baseline.getBaselineCounts());
            state.setLastRecalibration(baseline.getLastRecalibration());
        }
        double[] means = new double[current.length];
        double[] variances = new double[current.length];
        long[] counts = new long[current.length];
        for (int i = 0; i < current.length; i++) {
            counts[i] = current[i].count();
            means[i] = counts[i] == 0 ? 0.0 : current[i].mean();
            variances[i] = counts[i] < 2 ? 0.0 : current[i].variance();
        }
        state.setCurrentMeans(means);
        state.setCurrentVariances(variances);
        state.setCurrentCounts(counts);
        state.setDriftScore(driftScore);
        return state;
    }

    /**
     * Builds a drift baseline from calibration windows. Missing values are skipped.
     */
    public static DriftState baselineOf(String userId, List<FeatureWindow> windows, Instant calibratedAt) {
        RunningStats[] stats = new RunningStats[FeatureSchema.DIMENSION];
        for (int i = 0; i < stats.length; i++) {
            stats[i] = new RunningStats();
        }
        for (FeatureWindow window : windows) {
            for (int i = 0; i < stats.length; i++) {
                double value = window.get(i);
                if (!Double.isNaN(value)) {
                    stats[i].add(value);
                }
            }
        }
        double[] means = new double[stats.length];
        double[] stdDevs = new double[stats.length];
        long[] counts = new long[stats.length];
        for (int i = 0; i < stats.length; i++) {
            counts[i] = stats[i].count();
            means[i] = counts[i] == 0 ? 0.0 : stats[i].mean();
            stdDevs[i] = counts[i] < 2 ? 0.0 : stats[i].stdDev();
        }
        DriftState state = new DriftState(userId);
        state.setBaselineMeans(means);
        state.setBaselineStdDevs(stdDevs);
        state.setBaselineCounts(counts);
        state.setLastRecalibration(calibratedAt);
        return state;
    }
}
