package com.cadence.storage;

import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Profile store backed by Redis, one JSON document per user and model kind
 */
public class RedisProfileStore implements ProfileStore {
    private static final Logger logger = LoggerFactory.getLogger(RedisProfileStore.class);
    static final String PROFILE_KEY_PREFIX = "cba:profile:";
    static final String DRIFT_KEY_PREFIX = "cba:drift:";
    static final Duration TTL = Duration.ofDays(90);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisProfileStore(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ModelProfile> loadProfile(String userId, ModelKind kind) {
        String json = redisTemplate.opsForValue().get(profileKey(userId, kind));
        if (json == null) {
            return Optional.empty();
        }
        ModelProfile profile;
        try {
            profile = objectMapper.readValue(json, ModelProfile.class);
        } catch (JsonProcessingException e) {
            logger.error("Failed to decode {} profile for user: {}", kind, userId, e);
            throw new ModelLoadException(userId, kind, "Stored profile is corrupt", e);
        }
        if (profile.getModelKind() != kind) {
            throw new ModelLoadException(userId, kind, "Stored profile has kind " + profile.getModelKind());
        }
        return Optional.of(profile);
    }

    @Override
    public void saveProfile(ModelProfile profile) {
        try {
            String json = objectMapper.writeValueAsString(profile);
            redisTemplate.opsForValue().set(profileKey(profile.getUserId(), profile.getModelKind()), json, TTL);
            logger.debug("Saved {} profile v{} for user: {}", profile.getModelKind(), profile.getVersion(),
                profile.getUserId());
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode {} profile for user: {}", profile.getModelKind(), profile.getUserId(), e);
            throw new IllegalStateException("Profile save failed", e);
        }
    }

    @Override
    public Optional<DriftState> loadBaselineStats(String userId) {
        String json = redisTemplate.opsForValue().get(DRIFT_KEY_PREFIX + userId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, DriftState.class));
        } catch (JsonProcessingException e) {
            logger.error("Failed to decode drift state for user: {}", userId, e);
            throw new ModelLoadException(userId, null, "Stored drift state is corrupt", e);
        }
    }

    @Override
    public void saveDriftState(DriftState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            redisTemplate.opsForValue().set(DRIFT_KEY_PREFIX + state.getUserId(), json, TTL);
            logger.debug("Saved drift state for user: {}", state.getUserId());
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode drift state for user: {}", state.getUserId(), e);
            throw new IllegalStateException("Drift state save failed", e);
        }
    }

    static String profileKey(String userId, ModelKind kind) {
        return PROFILE_KEY_PREFIX + userId + ":" + kind.getValue();
    }
}
