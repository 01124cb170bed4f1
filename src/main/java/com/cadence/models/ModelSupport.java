package com.cadence.models;

import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.Modality;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.ModelParameters;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.EnumSet;

/**
 * Shared numeric helpers of the scoring models.
 */
public final class ModelSupport {

    /**
     * Standardized values are clipped to this magnitude
     */
    public static final double Z_CLIP = 6.0;

    static final double MIN_STD_DEV = 1e-3;
    static final double RELATIVE_STD_FLOOR = 0.05;
    static final double LN2 = Math.log(2.0);

    private ModelSupport() {
        throw new UnsupportedOperationException("ModelSupport is a utility class and cannot be instantiated");
    }

    public static double floorStdDev(double stdDev, double mean) {
        return Math.max(stdDev, Math.max(RELATIVE_STD_FLOOR * Math.abs(mean), MIN_STD_DEV));
    }

    /**
     * Standardizes the selected features of a window. Missing values stay NaN;
     * scoring leaves them out and training fills them with {@link #imputed(double[])}.
     */
    static double[] standardize(FeatureWindow window, int[] indices, double[] means, double[] stdDevs) {
        double[] z = new double[indices.length];
        for (int j = 0; j < indices.length; j++) {
            double value = window.get(indices[j]);
            if (Double.isNaN(value)) {
                z[j] = Double.NaN;
            } else {
                z[j] = clip((value - means[j]) / stdDevs[j]);
            }
        }
        return z;
    }

    /**
     * Validates the window against the profile and returns its standardized vector,
     * NaN where the window lacks a feature.
     *
     * @throws ModelScoreException on a dimension mismatch or when the window carries
     *         none of the profile's modalities
     */
    static double[] standardize(ModelProfile profile, FeatureWindow window) {
        if (window.dimension() != profile.getDimension()) {
            throw new ModelScoreException(profile.getModelKind(), profile.getDimension(), window.dimension());
        }
        int[] indices = profile.getFeatureIndices();
        double[] means = profile.getBaselineMeans();
        double[] stdDevs = profile.getBaselineStdDevs();
        if (indices == null || means == null || stdDevs == null
            || means.length != indices.length || stdDevs.length != indices.length) {
            throw new ModelScoreException(profile.getModelKind(), "Profile baseline is inconsistent");
        }
        for (int index : indices) {
            if (index < 0 || index >= window.dimension()) {
                throw new ModelScoreException(profile.getModelKind(), "Profile feature index out of range: " + index);
            }
        }
        boolean overlap = false;
        for (Modality modality : profile.getModalities()) {
            overlap |= window.hasModality(modality);
        }
        if (!overlap) {
            throw new ModelScoreException(profile.getModelKind(),
                "Window " + window.getWindowId() + " carries none of the profile modalities " + profile.getModalities());
        }
        return standardize(window, indices, means, stdDevs);
    }

    /**
     * Copy of {@code z} with missing features at the baseline mean (z = 0)
     */
    static double[] imputed(double[] z) {
        double[] filled = z.clone();
        for (int j = 0; j < filled.length; j++) {
            if (Double.isNaN(filled[j])) {
                filled[j] = 0.0;
            }
        }
        return filled;
    }

    static boolean isComplete(double[] z) {
        for (double v : z) {
            if (Double.isNaN(v)) {
                return false;
            }
        }
        return true;
    }

    static int presentCount(double[] z) {
        int count = 0;
        for (double v : z) {
            if (!Double.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the typed parameters of a trained profile.
     *
     * @throws ModelUntrainedException if the profile is absent or not trained
     */
    static <P extends ModelParameters> P requireParameters(ModelProfile profile, ModelKind kind, Class<P> type) {
        if (profile == null || !profile.isTrained() || profile.getParameters() == null) {
            throw new ModelUntrainedException(profile == null ? null : profile.getUserId(), kind);
        }
        if (profile.getModelKind() != kind || !type.isInstance(profile.getParameters())) {
            throw new ModelScoreException(kind, "Profile of kind " + profile.getModelKind()
                + " cannot be scored by model " + kind);
        }
        return type.cast(profile.getParameters());
    }

    /**
     * Creates a trained profile shell carrying the training set's baseline.
     */
    static ModelProfile newProfile(ModelKind kind, TrainingSet trainingSet, ModelParameters parameters) {
        ModelProfile profile = new ModelProfile(trainingSet.getUserId(), kind);
        profile.setTrained(true);
        profile.setVersion(1);
        profile.setDimension(FeatureSchema.DIMENSION);
        profile.setFeatureIndices(trainingSet.getFeatureIndices());
        profile.setModalities(EnumSet.copyOf(trainingSet.getModalities()));
        profile.setBaselineMeans(trainingSet.getMeans());
        profile.setBaselineStdDevs(trainingSet.getStdDevs());
        profile.setTrainingWindowCount(trainingSet.size());
        profile.setCalibrationSeconds(trainingSet.getCalibrationSeconds());
        profile.setParameters(parameters);
        return profile;
    }

    static double clip(double value) {
        return Math.max(-Z_CLIP, Math.min(Z_CLIP, value));
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Root-mean-square distance over the features present in both vectors,
     * comparable across feature counts
     */
    static double distance(double[] a, double[] b) {
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < a.length; i++) {
            if (Double.isNaN(a[i]) || Double.isNaN(b[i])) {
                continue;
            }
            double d = a[i] - b[i];
            sum += d * d;
            count++;
        }
        return count == 0 ? 0.0 : Math.sqrt(sum / count);
    }

    /**
     * Linear-interpolated percentile, {@code p} in [0, 1]
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty sample");
        }
        if (p <= 0.0) {
            return StatUtils.min(values);
        }
        return new Percentile()
            .withEstimationType(Percentile.EstimationType.R_7)
            .evaluate(values, Math.min(p, 1.0) * 100.0);
    }

    static double stdDev(double[] values) {
        return values.length > 1 ? new StandardDeviation().evaluate(values) : 0.0;
    }

    /**
     * Deterministic seed per user and model so retraining on the same data is reproducible
     */
    static long seed(String userId, ModelKind kind) {
        long h = userId == null ? 0L : userId.hashCode();
        return h * 0x9E3779B97F4A7C15L + kind.ordinal();
    }

    /**
     * Decay from 1 at {@code reference} to 0.5 at {@code reference + spread}
     */
    static double halfLifeScore(double value, double reference, double spread) {
        double excess = Math.max(0.0, value - reference);
        return Math.exp(-LN2 * excess / Math.max(spread, 1e-9));
    }
}
