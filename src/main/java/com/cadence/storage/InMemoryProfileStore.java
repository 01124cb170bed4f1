package com.cadence.storage;

import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store, used when no external storage is configured and in tests.
 * Profiles are copied on the way in and out.
 */
public class InMemoryProfileStore implements ProfileStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final Map<String, ModelProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, DriftState> driftStates = new ConcurrentHashMap<>();

    @Override
    public Optional<ModelProfile> loadProfile(String userId, ModelKind kind) {
        ModelProfile profile = profiles.get(key(userId, kind));
        return profile == null ? Optional.empty() : Optional.of(profile.copy());
    }

    @Override
    public void saveProfile(ModelProfile profile) {
        profiles.put(key(profile.getUserId(), profile.getModelKind()), profile.copy());
        logger.debug("Stored {} profile v{} for user {}", profile.getModelKind(), profile.getVersion(),
            profile.getUserId());
    }

    @Override
    public Optional<DriftState> loadBaselineStats(String userId) {
        return Optional.ofNullable(driftStates.get(userId));
    }

    @Override
    public void saveDriftState(DriftState state) {
        driftStates.put(state.getUserId(), state);
    }

    private static String key(String userId, ModelKind kind) {
        return userId + ":" + kind.getValue();
    }
}
