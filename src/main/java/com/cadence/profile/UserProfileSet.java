package com.cadence.profile;

import com.cadence.domain.DriftState;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Model profiles and drift baseline of one user.
 *
 * Readers take the shared lock for the duration of a scoring pass; a writer
 * (calibration, recalibration, online learning) holds the exclusive lock while
 * it publishes. The published map is immutable and replaced as a whole, so
 * {@link #snapshot()} always returns a consistent prior version without locking.
 */
public class UserProfileSet {

    private final String userId;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean recalibrating = new AtomicBoolean(false);

    private volatile Map<ModelKind, ModelProfile> profiles = Collections.emptyMap();
    private volatile DriftState driftBaseline;
    private volatile long generation;
    private volatile boolean loaded;

    public UserProfileSet(String userId) {
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Runs {@code action} against the current profiles while holding the shared lock.
     *
     * @throws ProfileLockTimeoutException if the lock is not acquired within {@code timeout}
     */
    public <T> T withReadLock(Duration timeout, Function<Map<ModelKind, ModelProfile>, T> action) {
        Lock readLock = lock.readLock();
        acquire(readLock, timeout, false);
        try {
            return action.apply(profiles);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the exclusive lock.
     *
     * @throws ProfileLockTimeoutException if the lock is not acquired within {@code timeout}
     */
    public <T> T withWriteLock(Duration timeout, Supplier<T> action) {
        Lock writeLock = lock.writeLock();
        acquire(writeLock, timeout, true);
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    private void acquire(Lock target, Duration timeout, boolean exclusive) {
        try {
            if (!target.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ProfileLockTimeoutException(userId, timeout, exclusive);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProfileLockTimeoutException(userId, timeout, exclusive);
        }
    }

    /**
     * Replaces all profiles and the drift baseline. Caller must hold the write lock.
     */
    public void publish(Map<ModelKind, ModelProfile> trained, DriftState baseline) {
        requireWriteLock();
        this.profiles = freeze(trained);
        if (baseline != null) {
            this.driftBaseline = baseline;
        }
        this.loaded = true;
        this.generation++;
    }

    /**
     * Replaces one profile, keeping the others. Caller must hold the write lock.
     */
    public void replace(ModelProfile profile) {
        requireWriteLock();
        EnumMap<ModelKind, ModelProfile> next = new EnumMap<>(ModelKind.class);
        next.putAll(profiles);
        next.put(profile.getModelKind(), profile);
        this.profiles = Collections.unmodifiableMap(next);
    }

    /**
     * Records the drift state of an ended session. Caller must hold the write lock.
     */
    public void updateDriftState(DriftState state) {
        requireWriteLock();
        this.driftBaseline = state;
    }

    private void requireWriteLock() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Write lock of user " + userId + " is not held by the current thread");
        }
    }

    private static Map<ModelKind, ModelProfile> freeze(Map<ModelKind, ModelProfile> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    /**
     * Last published profiles, read without locking
     */
    public Map<ModelKind, ModelProfile> snapshot() {
        return profiles;
    }

    public DriftState getDriftBaseline() {
        return driftBaseline;
    }

    /**
     * Incremented on every full publication (calibration or recalibration)
     */
    public long getGeneration() {
        return generation;
    }

    /**
     * True once the profiles have been loaded from storage or trained
     */
    public boolean isLoaded() {
        return loaded;
    }

    public void markLoaded() {
        this.loaded = true;
    }

    /**
     * True when all kinds have a trained profile
     */
    public boolean isFullyTrained() {
        Map<ModelKind, ModelProfile> current = profiles;
        for (ModelKind kind : ModelKind.values()) {
            ModelProfile profile = current.get(kind);
            if (profile == null || !profile.isTrained()) {
                return false;
            }
        }
        return true;
    }

    public boolean tryBeginRecalibration() {
        return recalibrating.compareAndSet(false, true);
    }

    public void endRecalibration() {
        recalibrating.set(false);
    }

    public boolean isRecalibrating() {
        return recalibrating.get();
    }
}
