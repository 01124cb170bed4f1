package com.cadence.config;

import com.cadence.domain.ModelKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable engine configuration, fixed when the engine is constructed.
 *
 * Defaults match the documented thresholds: CONFIDENCE_THRESHOLD 0.7,
 * ANOMALY_SCORE_THRESHOLD 0.8, CONSECUTIVE_ANOMALIES_LIMIT 3, WINDOW_SIZE 30s,
 * MIN_CALIBRATION_TIME 300s and DRIFT_DETECTION_WINDOW 100.
 */
public final class EngineConfig {

    // Decision thresholds
    private double confidenceThreshold = 0.7;
    private double anomalyScoreThreshold = 0.8;
    private int consecutiveAnomaliesLimit = 3;

    // Windowing
    private Duration windowSize = Duration.ofSeconds(30);
    private int minKeystrokeEvents = 20;
    private int minMouseEvents = 15;

    // Calibration
    private Duration minCalibrationTime = Duration.ofSeconds(300);
    private int minCalibrationWindows = 8;
    private int minModalityWindows = 5;
    private double calibrationLowPercentile = 0.05;
    private double calibrationLowTarget = 0.75;
    private double calibrationHighPercentile = 0.50;
    private double calibrationHighTarget = 0.95;

    // Drift
    private int driftDetectionWindow = 100;
    private int driftMinWindows = 5;
    private double driftAlertThreshold = 1.0;
    private double driftIntrusionThreshold = 2.5;
    private int driftSustainedWindows = 10;

    // Session
    private int recoveryWindows = 3;
    private int lockAfterAnomalies = 5;
    private int maxSuspiciousWindows = 20;
    private int historyLength = 8;

    // Profiles
    private Duration profileLockTimeout = Duration.ofMillis(250);

    // Models
    private Map<ModelKind, Double> modelWeights = defaultWeights();
    private int sequenceLength = 5;
    private int reconstructionComponents = 0;
    private double boundaryPercentile = 0.95;
    private double boundarySteepness = 4.0;
    private int neighborCapacity = 200;
    private int neighborK = 5;
    private double linearAggressiveness = 0.5;
    private int linearEpochs = 5;
    private int isolationTrees = 100;
    private int isolationSampleSize = 256;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.config.copyFrom(this);
        return builder;
    }

    private static Map<ModelKind, Double> defaultWeights() {
        Map<ModelKind, Double> weights = new EnumMap<>(ModelKind.class);
        for (ModelKind kind : ModelKind.values()) {
            weights.put(kind, 1.0);
        }
        return Collections.unmodifiableMap(weights);
    }

    private void copyFrom(EngineConfig other) {
        confidenceThreshold = other.confidenceThreshold;
        anomalyScoreThreshold = other.anomalyScoreThreshold;
        consecutiveAnomaliesLimit = other.consecutiveAnomaliesLimit;
        windowSize = other.windowSize;
        minKeystrokeEvents = other.minKeystrokeEvents;
        minMouseEvents = other.minMouseEvents;
        minCalibrationTime = other.minCalibrationTime;
        minCalibrationWindows = other.minCalibrationWindows;
        minModalityWindows = other.minModalityWindows;
        calibrationLowPercentile = other.calibrationLowPercentile;
        calibrationLowTarget = other.calibrationLowTarget;
        calibrationHighPercentile = other.calibrationHighPercentile;
        calibrationHighTarget = other.calibrationHighTarget;
        driftDetectionWindow = other.driftDetectionWindow;
        driftMinWindows = other.driftMinWindows;
        driftAlertThreshold = other.driftAlertThreshold;
        driftIntrusionThreshold = other.driftIntrusionThreshold;
        driftSustainedWindows = other.driftSustainedWindows;
        recoveryWindows = other.recoveryWindows;
        lockAfterAnomalies = other.lockAfterAnomalies;
        maxSuspiciousWindows = other.maxSuspiciousWindows;
        historyLength = other.historyLength;
        profileLockTimeout = other.profileLockTimeout;
        modelWeights = other.modelWeights;
        sequenceLength = other.sequenceLength;
        reconstructionComponents = other.reconstructionComponents;
        boundaryPercentile = other.boundaryPercentile;
        boundarySteepness = other.boundarySteepness;
        neighborCapacity = other.neighborCapacity;
        neighborK = other.neighborK;
        linearAggressiveness = other.linearAggressiveness;
        linearEpochs = other.linearEpochs;
        isolationTrees = other.isolationTrees;
        isolationSampleSize = other.isolationSampleSize;
    }

    private void validate() {
        requireUnit("confidenceThreshold", confidenceThreshold);
        requireUnit("anomalyScoreThreshold", anomalyScoreThreshold);
        requireUnit("calibrationLowPercentile", calibrationLowPercentile);
        requireUnit("calibrationHighPercentile", calibrationHighPercentile);
        requireUnit("calibrationLowTarget", calibrationLowTarget);
        requireUnit("calibrationHighTarget", calibrationHighTarget);
        requireUnit("boundaryPercentile", boundaryPercentile);
        if (calibrationLowPercentile >= calibrationHighPercentile) {
            throw new IllegalArgumentException("calibrationLowPercentile must be below calibrationHighPercentile");
        }
        if (calibrationLowTarget >= calibrationHighTarget) {
            throw new IllegalArgumentException("calibrationLowTarget must be below calibrationHighTarget");
        }
        requirePositive("consecutiveAnomaliesLimit", consecutiveAnomaliesLimit);
        requirePositive("minKeystrokeEvents", minKeystrokeEvents);
        requirePositive("minMouseEvents", minMouseEvents);
        requirePositive("minCalibrationWindows", minCalibrationWindows);
        requirePositive("minModalityWindows", minModalityWindows);
        requirePositive("driftDetectionWindow", driftDetectionWindow);
        requirePositive("driftMinWindows", driftMinWindows);
        requirePositive("driftSustainedWindows", driftSustainedWindows);
        requirePositive("recoveryWindows", recoveryWindows);
        requirePositive("lockAfterAnomalies", lockAfterAnomalies);
        requirePositive("maxSuspiciousWindows", maxSuspiciousWindows);
        requirePositive("historyLength", historyLength);
        requirePositive("sequenceLength", sequenceLength);
        requirePositive("neighborCapacity", neighborCapacity);
        requirePositive("neighborK", neighborK);
        requirePositive("linearEpochs", linearEpochs);
        requirePositive("isolationTrees", isolationTrees);
        requirePositive("isolationSampleSize", isolationSampleSize);
        if (reconstructionComponents < 0) {
            throw new IllegalArgumentException("reconstructionComponents must not be negative");
        }
        if (driftIntrusionThreshold < driftAlertThreshold) {
            throw new IllegalArgumentException("driftIntrusionThreshold must not be below driftAlertThreshold");
        }
        if (windowSize.isNegative() || windowSize.isZero()) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        if (minCalibrationTime.isNegative()) {
            throw new IllegalArgumentException("minCalibrationTime must not be negative");
        }
        if (profileLockTimeout.isNegative()) {
            throw new IllegalArgumentException("profileLockTimeout must not be negative");
        }
        if (sequenceLength > historyLength) {
            throw new IllegalArgumentException("historyLength must cover sequenceLength");
        }
        for (Map.Entry<ModelKind, Double> weight : modelWeights.entrySet()) {
            if (weight.getValue() == null || weight.getValue() < 0 || weight.getValue().isNaN()) {
                throw new IllegalArgumentException("Invalid weight for model " + weight.getKey());
            }
        }
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
    }

    /**
     * Aggregate strictly below this value counts as a severe anomaly
     */
    public double severeAnomalyFloor() {
        return 1.0 - anomalyScoreThreshold;
    }

    public double weightOf(ModelKind kind) {
        return modelWeights.getOrDefault(kind, 0.0);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getAnomalyScoreThreshold() {
        return anomalyScoreThreshold;
    }

    public int getConsecutiveAnomaliesLimit() {
        return consecutiveAnomaliesLimit;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public int getMinKeystrokeEvents() {
        return minKeystrokeEvents;
    }

    public int getMinMouseEvents() {
        return minMouseEvents;
    }

    public Duration getMinCalibrationTime() {
        return minCalibrationTime;
    }

    public int getMinCalibrationWindows() {
        return minCalibrationWindows;
    }

    public int getMinModalityWindows() {
        return minModalityWindows;
    }

    public double getCalibrationLowPercentile() {
        return calibrationLowPercentile;
    }

    public double getCalibrationLowTarget() {
        return calibrationLowTarget;
    }

    public double getCalibrationHighPercentile() {
        return calibrationHighPercentile;
    }

    public double getCalibrationHighTarget() {
        return calibrationHighTarget;
    }

    public int getDriftDetectionWindow() {
        return driftDetectionWindow;
    }

    public int getDriftMinWindows() {
        return driftMinWindows;
    }

    public double getDriftAlertThreshold() {
        return driftAlertThreshold;
    }

    public double getDriftIntrusionThreshold() {
        return driftIntrusionThreshold;
    }

    public int getDriftSustainedWindows() {
        return driftSustainedWindows;
    }

    public int getRecoveryWindows() {
        return recoveryWindows;
    }

    public int getLockAfterAnomalies() {
        return lockAfterAnomalies;
    }

    public int getMaxSuspiciousWindows() {
        return maxSuspiciousWindows;
    }

    public int getHistoryLength() {
        return historyLength;
    }

    public Duration getProfileLockTimeout() {
        return profileLockTimeout;
    }

    public Map<ModelKind, Double> getModelWeights() {
        return modelWeights;
    }

    public int getSequenceLength() {
        return sequenceLength;
    }

    public int getReconstructionComponents() {
        return reconstructionComponents;
    }

    public double getBoundaryPercentile() {
        return boundaryPercentile;
    }

    public double getBoundarySteepness() {
        return boundarySteepness;
    }

    public int getNeighborCapacity() {
        return neighborCapacity;
    }

    public int getNeighborK() {
        return neighborK;
    }

    public double getLinearAggressiveness() {
        return linearAggressiveness;
    }

    public int getLinearEpochs() {
        return linearEpochs;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    public int getIsolationSampleSize() {
        return isolationSampleSize;
    }

    public static class Builder {
        private final EngineConfig config;

        public Builder() {
            this.config = new EngineConfig();
        }

        public Builder confidenceThreshold(double value) {
            config.confidenceThreshold = value;
            return this;
        }

        public Builder anomalyScoreThreshold(double value) {
            config.anomalyScoreThreshold = value;
            return this;
        }

        public Builder consecutiveAnomaliesLimit(int value) {
            config.consecutiveAnomaliesLimit = value;
            return this;
        }

        public Builder windowSize(Duration value) {
            config.windowSize = value;
            return this;
        }

        public Builder minKeystrokeEvents(int value) {
            config.minKeystrokeEvents = value;
            return this;
        }

        public Builder minMouseEvents(int value) {
            config.minMouseEvents = value;
            return this;
        }

        public Builder minCalibrationTime(Duration value) {
            config.minCalibrationTime = value;
            return this;
        }

        public Builder minCalibrationWindows(int value) {
            config.minCalibrationWindows = value;
            return this;
        }

        public Builder minModalityWindows(int value) {
            config.minModalityWindows = value;
            return this;
        }

        public Builder calibrationLowPercentile(double value) {
            config.calibrationLowPercentile = value;
            return this;
        }

        public Builder calibrationLowTarget(double value) {
            config.calibrationLowTarget = value;
            return this;
        }

        public Builder calibrationHighPercentile(double value) {
            config.calibrationHighPercentile = value;
            return this;
        }

        public Builder calibrationHighTarget(double value) {
            config.calibrationHighTarget = value;
            return this;
        }

        public Builder driftDetectionWindow(int value) {
            config.driftDetectionWindow = value;
            return this;
        }

        public Builder driftMinWindows(int value) {
            config.driftMinWindows = value;
            return this;
        }

        public Builder driftAlertThreshold(double value) {
            config.driftAlertThreshold = value;
            return this;
        }

        public Builder driftIntrusionThreshold(double value) {
            config.driftIntrusionThreshold = value;
            return this;
        }

        public Builder driftSustainedWindows(int value) {
            config.driftSustainedWindows = value;
            return this;
        }

        public Builder recoveryWindows(int value) {
            config.recoveryWindows = value;
            return this;
        }

        public Builder lockAfterAnomalies(int value) {
            config.lockAfterAnomalies = value;
            return this;
        }

        public Builder maxSuspiciousWindows(int value) {
            config.maxSuspiciousWindows = value;
            return this;
        }

        public Builder historyLength(int value) {
            config.historyLength = value;
            return this;
        }

        public Builder profileLockTimeout(Duration value) {
            config.profileLockTimeout = value;
            return this;
        }

        public Builder modelWeights(Map<ModelKind, Double> weights) {
            Map<ModelKind, Double> copy = new EnumMap<>(ModelKind.class);
            copy.putAll(weights);
            config.modelWeights = Collections.unmodifiableMap(copy);
            return this;
        }

        public Builder sequenceLength(int value) {
            config.sequenceLength = value;
            return this;
        }

        public Builder reconstructionComponents(int value) {
            config.reconstructionComponents = value;
            return this;
        }

        public Builder boundaryPercentile(double value) {
            config.boundaryPercentile = value;
            return this;
        }

        public Builder boundarySteepness(double value) {
            config.boundarySteepness = value;
            return this;
        }

        public Builder neighborCapacity(int value) {
            config.neighborCapacity = value;
            return this;
        }

        public Builder neighborK(int value) {
            config.neighborK = value;
            return this;
        }

        public Builder linearAggressiveness(double value) {
            config.linearAggressiveness = value;
            return this;
        }

        public Builder linearEpochs(int value) {
            config.linearEpochs = value;
            return this;
        }

        public Builder isolationTrees(int value) {
            config.isolationTrees = value;
            return this;
        }

        public Builder isolationSampleSize(int value) {
            config.isolationSampleSize = value;
            return this;
        }

        public EngineConfig build() {
            config.validate();
            EngineConfig built = new EngineConfig();
            built.copyFrom(config);
            return built;
        }
    }
}
