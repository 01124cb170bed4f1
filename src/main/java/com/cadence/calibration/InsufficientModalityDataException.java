package com.cadence.calibration;

import com.cadence.domain.Modality;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Describes modalities that had too few calibration windows to be trained.
 * Thrown when no modality is trainable; otherwise attached to a degraded
 * {@link CalibrationResult}.
 */
public class InsufficientModalityDataException extends RuntimeException {

    private final String userId;
    private final Set<Modality> missing;
    private final Map<Modality, Integer> windowCounts;
    private final int requiredWindows;

    public InsufficientModalityDataException(String userId, Set<Modality> missing,
                                             Map<Modality, Integer> windowCounts, int requiredWindows) {
        super("Insufficient modality data");
        this.userId = userId;
        this.missing = missing.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(missing));
        this.windowCounts = Collections.unmodifiableMap(new EnumMap<>(windowCounts));
        this.requiredWindows = requiredWindows;
    }

    public String getUserId() {
        return userId;
    }

    public Set<Modality> getMissing() {
        return missing;
    }

    public Map<Modality, Integer> getWindowCounts() {
        return windowCounts;
    }

    public int getRequiredWindows() {
        return requiredWindows;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " for user " + userId + ": " + missing + " below " + requiredWindows
            + " windows (have " + windowCounts + ")";
    }
}
