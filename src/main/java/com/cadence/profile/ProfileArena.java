package com.cadence.profile;

import com.cadence.config.EngineConfig;
import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.storage.ModelLoadException;
import com.cadence.storage.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owner of every user's {@link UserProfileSet}. Sets are created on first use and
 * filled from the {@link ProfileStore} the first time a session opens them.
 */
public class ProfileArena {
    private static final Logger logger = LoggerFactory.getLogger(ProfileArena.class);

    private final ConcurrentMap<String, UserProfileSet> sets = new ConcurrentHashMap<>();
    private final ProfileStore store;
    private final EngineConfig config;

    public ProfileArena(ProfileStore store, EngineConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Returns the user's set, creating an empty one if needed.
     */
    public UserProfileSet get(String userId) {
        return sets.computeIfAbsent(userId, UserProfileSet::new);
    }

    public Optional<UserProfileSet> find(String userId) {
        return Optional.ofNullable(sets.get(userId));
    }

    /**
     * Returns the user's set, restoring persisted profiles on first access.
     *
     * @throws ModelLoadException if a persisted profile is corrupt
     * @throws ProfileLockTimeoutException if the set is busy being written
     */
    public UserProfileSet open(String userId) {
        UserProfileSet set = get(userId);
        if (set.isLoaded()) {
            return set;
        }
        return set.withWriteLock(config.getProfileLockTimeout(), () -> {
            if (!set.isLoaded()) {
                restore(set);
            }
            return set;
        });
    }

    private void restore(UserProfileSet set) {
        String userId = set.getUserId();
        Map<ModelKind, ModelProfile> restored = new EnumMap<>(ModelKind.class);
        for (ModelKind kind : ModelKind.values()) {
            Optional<ModelProfile> profile = store.loadProfile(userId, kind);
            profile.ifPresent(p -> restored.put(kind, p));
        }
        DriftState baseline = store.loadBaselineStats(userId).orElse(null);
        if (restored.isEmpty()) {
            logger.debug("No persisted profiles for user {}", userId);
            set.markLoaded();
            return;
        }
        set.publish(restored, baseline);
        logger.info("Restored {} profiles for user {}", restored.size(), userId);
    }

    public ProfileStore getStore() {
        return store;
    }

    public int size() {
        return sets.size();
    }
}
