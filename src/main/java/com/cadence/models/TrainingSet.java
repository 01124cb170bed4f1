package com.cadence.models;

import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.Modality;
import com.cadence.features.RunningStats;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Calibration windows of one user prepared for training: the selected features,
 * their baseline mean and standard deviation, and the standardized matrix the
 * models learn from. Window order is preserved. Gaps in the matrix are filled at
 * the baseline mean.
 */
public final class TrainingSet {

    private final String userId;
    private final List<FeatureWindow> windows;
    private final Set<Modality> modalities;
    private final int[] featureIndices;
    private final double[] means;
    private final double[] stdDevs;
    private final double[][] standardized;
    private final double calibrationSeconds;

    private TrainingSet(String userId, List<FeatureWindow> windows, Set<Modality> modalities,
                        int[] featureIndices, double[] means, double[] stdDevs) {
        this.userId = userId;
        this.windows = Collections.unmodifiableList(windows);
        this.modalities = Collections.unmodifiableSet(EnumSet.copyOf(modalities));
        this.featureIndices = featureIndices;
        this.means = means;
        this.stdDevs = stdDevs;
        this.standardized = new double[windows.size()][];
        for (int i = 0; i < windows.size(); i++) {
            standardized[i] = ModelSupport.imputed(
                ModelSupport.standardize(windows.get(i), featureIndices, means, stdDevs));
        }
        this.calibrationSeconds = windows.isEmpty()
            ? 0.0
            : (windows.get(windows.size() - 1).getEndTime() - windows.get(0).getStartTime()) / 1000.0;
    }

    /**
     * Builds a training set restricted to the features of {@code modalities}.
     *
     * @throws IllegalArgumentException if fewer than two windows are given or no modality is selected
     */
    public static TrainingSet of(String userId, List<FeatureWindow> windows, Set<Modality> modalities) {
        if (windows == null || windows.size() < 2) {
            throw new IllegalArgumentException("Training requires at least two windows");
        }
        if (modalities == null || modalities.isEmpty()) {
            throw new IllegalArgumentException("Training requires at least one modality");
        }
        int[] indices = FeatureSchema.indicesOf(modalities);
        double[] means = new double[indices.length];
        double[] stdDevs = new double[indices.length];
        for (int j = 0; j < indices.length; j++) {
            RunningStats stats = new RunningStats();
            for (FeatureWindow window : windows) {
                double value = window.get(indices[j]);
                if (!Double.isNaN(value)) {
                    stats.add(value);
                }
            }
            means[j] = stats.count() == 0 ? 0.0 : stats.mean();
            stdDevs[j] = ModelSupport.floorStdDev(stats.stdDev(), means[j]);
        }
        return new TrainingSet(userId, List.copyOf(windows), modalities, indices, means, stdDevs);
    }

    public String getUserId() {
        return userId;
    }

    public List<FeatureWindow> getWindows() {
        return windows;
    }

    public Set<Modality> getModalities() {
        return modalities;
    }

    public int[] getFeatureIndices() {
        return featureIndices.clone();
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getStdDevs() {
        return stdDevs.clone();
    }

    public int size() {
        return windows.size();
    }

    /**
     * Number of selected features
     */
    public int featureCount() {
        return featureIndices.length;
    }

    /**
     * Standardized row of window {@code i}; callers must not modify it
     */
    public double[] row(int i) {
        return standardized[i];
    }

    public double getCalibrationSeconds() {
        return calibrationSeconds;
    }
}
