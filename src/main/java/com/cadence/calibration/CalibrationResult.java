package com.cadence.calibration;

import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.Modality;
import com.cadence.domain.ReasonCode;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Profiles and drift baseline produced by one calibration run
 */
public final class CalibrationResult {

    private final String userId;
    private final Map<ModelKind, ModelProfile> profiles;
    private final DriftState driftBaseline;
    private final Set<Modality> trainedModalities;
    private final InsufficientModalityDataException degradation;
    private final int windowCount;
    private final Duration covered;
    private final long version;
    private final boolean persisted;

    CalibrationResult(String userId, Map<ModelKind, ModelProfile> profiles, DriftState driftBaseline,
                      Set<Modality> trainedModalities, InsufficientModalityDataException degradation,
                      int windowCount, Duration covered, long version, boolean persisted) {
        this.userId = userId;
        this.profiles = Collections.unmodifiableMap(new EnumMap<>(profiles));
        this.driftBaseline = driftBaseline;
        this.trainedModalities = Collections.unmodifiableSet(EnumSet.copyOf(trainedModalities));
        this.degradation = degradation;
        this.windowCount = windowCount;
        this.covered = covered;
        this.version = version;
        this.persisted = persisted;
    }

    public String getUserId() {
        return userId;
    }

    public Map<ModelKind, ModelProfile> getProfiles() {
        return profiles;
    }

    public DriftState getDriftBaseline() {
        return driftBaseline;
    }

    public Set<Modality> getTrainedModalities() {
        return trainedModalities;
    }

    /**
     * True when at least one modality was left out for lack of data
     */
    public boolean isDegraded() {
        return degradation != null;
    }

    /**
     * What was missing when {@link #isDegraded()}, otherwise null
     */
    public InsufficientModalityDataException getDegradation() {
        return degradation;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public Duration getCovered() {
        return covered;
    }

    public long getVersion() {
        return version;
    }

    /**
     * False when the profiles were published but could not be written to the store
     */
    public boolean isPersisted() {
        return persisted;
    }

    public ReasonCode getReasonCode() {
        return isDegraded() ? ReasonCode.CALIBRATION_DEGRADED : ReasonCode.CALIBRATION_COMPLETE;
    }

    @Override
    public String toString() {
        return "CalibrationResult{user=" + userId + ", version=" + version + ", windows=" + windowCount
            + ", modalities=" + trainedModalities + ", degraded=" + isDegraded() + "}";
    }
}
