package com.cadence.storage;

import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;

import java.util.Optional;

/**
 * Durable storage of trained profiles and drift state.
 */
public interface ProfileStore {

    /**
     * @return the stored profile, or empty when none was ever saved
     * @throws ModelLoadException if a stored profile cannot be decoded
     */
    Optional<ModelProfile> loadProfile(String userId, ModelKind kind);

    void saveProfile(ModelProfile profile);

    /**
     * @return the stored drift state, or empty when none was ever saved
     * @throws ModelLoadException if the stored state cannot be decoded
     */
    Optional<DriftState> loadBaselineStats(String userId);

    void saveDriftState(DriftState state);
}
