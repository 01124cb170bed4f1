package com.cadence.domain;

import com.cadence.models.params.ModelParameters;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Learned parameters of one scoring model for one user.
 *
 * Besides the model-specific {@link ModelParameters} a profile records which
 * features it was trained on and their training-time mean and standard deviation,
 * which every model uses to standardize live windows. A profile is only usable for
 * scoring once {@link #isTrained()} is true.
 *
 * Published profiles are never mutated; updates work on a {@link #copy()}.
 */
public class ModelProfile {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("model_kind")
    private ModelKind modelKind;

    @JsonProperty("version")
    private long version;

    @JsonProperty("trained")
    private boolean trained;

    @JsonProperty("trained_at")
    private Instant trainedAt;

    @JsonProperty("training_window_count")
    private int trainingWindowCount;

    @JsonProperty("calibration_seconds")
    private double calibrationSeconds;

    /**
     * Length of the full feature vector the profile accepts
     */
    @JsonProperty("dimension")
    private int dimension;

    @JsonProperty("feature_indices")
    private int[] featureIndices;

    @JsonProperty("modalities")
    private Set<Modality> modalities = EnumSet.noneOf(Modality.class);

    @JsonProperty("baseline_means")
    private double[] baselineMeans;

    @JsonProperty("baseline_std_devs")
    private double[] baselineStdDevs;

    @JsonProperty("calibration")
    private CalibrationTransform calibration = CalibrationTransform.identity();

    @JsonProperty("parameters")
    private ModelParameters parameters;

    public ModelProfile() {
    }

    public ModelProfile(String userId, ModelKind modelKind) {
        this.userId = userId;
        this.modelKind = modelKind;
    }

    /**
     * Deep copy, used before any change to a published profile
     */
    public ModelProfile copy() {
        ModelProfile copy = new ModelProfile(userId, modelKind);
        copy.version = version;
        copy.trained = trained;
        copy.trainedAt = trainedAt;
        copy.trainingWindowCount = trainingWindowCount;
        copy.calibrationSeconds = calibrationSeconds;
        copy.dimension = dimension;
        copy.featureIndices = featureIndices == null ? null : featureIndices.clone();
        copy.modalities = modalities.isEmpty() ? EnumSet.noneOf(Modality.class) : EnumSet.copyOf(modalities);
        copy.baselineMeans = baselineMeans == null ? null : baselineMeans.clone();
        copy.baselineStdDevs = baselineStdDevs == null ? null : baselineStdDevs.clone();
        copy.calibration = calibration == null
            ? CalibrationTransform.identity()
            : new CalibrationTransform(calibration.getSlope(), calibration.getIntercept());
        copy.parameters = parameters == null ? null : parameters.copy();
        return copy;
    }

    @JsonIgnore
    public int getFeatureCount() {
        return featureIndices == null ? 0 : featureIndices.length;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }

    public void setModelKind(ModelKind modelKind) {
        this.modelKind = modelKind;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public boolean isTrained() {
        return trained;
    }

    public void setTrained(boolean trained) {
        this.trained = trained;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public void setTrainedAt(Instant trainedAt) {
        this.trainedAt = trainedAt;
    }

    public int getTrainingWindowCount() {
        return trainingWindowCount;
    }

    public void setTrainingWindowCount(int trainingWindowCount) {
        this.trainingWindowCount = trainingWindowCount;
    }

    public double getCalibrationSeconds() {
        return calibrationSeconds;
    }

    public void setCalibrationSeconds(double calibrationSeconds) {
        this.calibrationSeconds = calibrationSeconds;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int[] getFeatureIndices() {
        return featureIndices;
    }

    public void setFeatureIndices(int[] featureIndices) {
        this.featureIndices = featureIndices;
    }

    public Set<Modality> getModalities() {
        return modalities;
    }

    public void setModalities(Set<Modality> modalities) {
        this.modalities = modalities;
    }

    public double[] getBaselineMeans() {
        return baselineMeans;
    }

    public void setBaselineMeans(double[] baselineMeans) {
        this.baselineMeans = baselineMeans;
    }

    public double[] getBaselineStdDevs() {
        return baselineStdDevs;
    }

    public void setBaselineStdDevs(double[] baselineStdDevs) {
        this.baselineStdDevs = baselineStdDevs;
    }

    public CalibrationTransform getCalibration() {
        return calibration;
    }

    public void setCalibration(CalibrationTransform calibration) {
        this.calibration = calibration;
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public void setParameters(ModelParameters parameters) {
        this.parameters = parameters;
    }

    @Override
    public String toString() {
        return "ModelProfile{user=" + userId + ", kind=" + modelKind + ", version=" + version
            + ", trained=" + trained + ", modalities=" + modalities + "}";
    }
}
