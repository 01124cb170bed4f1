package com.cadence.engine;

import com.cadence.calibration.CalibrationManager;
import com.cadence.config.EngineConfig;
import com.cadence.domain.BehavioralEvent;
import com.cadence.domain.ReasonCode;
import com.cadence.domain.SessionState;
import com.cadence.features.FeatureExtractor;
import com.cadence.models.ModelRegistry;
import com.cadence.profile.ProfileArena;
import com.cadence.profile.ProfileLockTimeoutException;
import com.cadence.profile.UserProfileSet;
import com.cadence.scoring.EnsembleScorer;
import com.cadence.session.Transition;
import com.cadence.storage.ModelLoadException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for the transport layer: opens sessions, feeds them events and
 * closes them. Decisions are delivered to the registered {@link DecisionListener}s.
 */
public class BehavioralAuthEngine {
    private static final Logger logger = LoggerFactory.getLogger(BehavioralAuthEngine.class);

    private final EngineConfig config;
    private final FeatureExtractor extractor;
    private final ModelRegistry registry;
    private final ProfileArena arena;
    private final EnsembleScorer scorer;
    private final CalibrationManager calibrationManager;
    private final SessionRegistry sessions;
    private final List<DecisionListener> listeners;
    private final EngineMetrics metrics;
    private final Executor sessionExecutor;

    public BehavioralAuthEngine(EngineConfig config, FeatureExtractor extractor, ModelRegistry registry,
                                ProfileArena arena, EnsembleScorer scorer, CalibrationManager calibrationManager,
                                SessionRegistry sessions, List<DecisionListener> listeners, EngineMetrics metrics,
                                Executor sessionExecutor) {
        this.config = config;
        this.extractor = extractor;
        this.registry = registry;
        this.arena = arena;
        this.scorer = scorer;
        this.calibrationManager = calibrationManager;
        this.sessions = sessions;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Opens a session. It starts TRUSTED when a complete profile set of the user
     * is available, otherwise CALIBRATING.
     *
     * @return the initial state
     * @throws IllegalStateException if the session id is already active
     */
    public SessionState startSession(String sessionId, String userId) {
        if (sessionId == null || userId == null) {
            throw new IllegalArgumentException("Session id and user id are required");
        }
        if (sessions.find(sessionId).isPresent()) {
            throw new IllegalStateException("Session already active: " + sessionId);
        }

        UserProfileSet profiles = arena.get(userId);
        Transition start;
        try {
            profiles = arena.open(userId);
            start = profiles.isFullyTrained()
                ? Transition.of(SessionState.CALIBRATING, SessionState.TRUSTED, ReasonCode.PROFILES_RESTORED)
                : Transition.stay(SessionState.CALIBRATING, ReasonCode.CALIBRATING);
        } catch (ModelLoadException e) {
            logger.warn("Profiles of user {} could not be loaded, session {} recalibrates: {}",
                userId, sessionId, e.getMessage());
            start = Transition.stay(SessionState.CALIBRATING, ReasonCode.PROFILE_LOAD_FAILED);
        } catch (ProfileLockTimeoutException e) {
            logger.warn("Profiles of user {} are busy, session {} starts calibrating: {}",
                userId, sessionId, e.getMessage());
            start = Transition.stay(SessionState.CALIBRATING, ReasonCode.CALIBRATING);
        }

        SessionWorker worker = new SessionWorker(sessionId, userId, start, config,
            extractor.newAssembler(sessionId), scorer, calibrationManager, registry, profiles, arena.getStore(),
            listeners, metrics, sessionExecutor);
        sessions.register(worker);
        metrics.recordSessionStarted();
        logger.info("Started session {} for user {} in state {} ({})", sessionId, userId, start.getTo(),
            start.getReason());
        worker.begin();
        return start.getTo();
    }

    /**
     * Queues an event for the session.
     *
     * @return false if the session is unknown or already ending
     */
    public boolean submit(String sessionId, BehavioralEvent event) {
        Optional<SessionWorker> worker = sessions.find(sessionId);
        if (worker.isEmpty()) {
            logger.debug("Dropping event for unknown session {}", sessionId);
            return false;
        }
        return worker.get().submit(event);
    }

    /**
     * Ends the session, discarding queued events and the partial window. The
     * future completes once the session's drift state has been saved.
     */
    public CompletableFuture<Void> endSession(String sessionId) {
        Optional<SessionWorker> worker = sessions.remove(sessionId);
        if (worker.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        metrics.recordSessionEnded();
        return worker.get().cancel();
    }

    public Optional<SessionState> state(String sessionId) {
        return sessions.find(sessionId).map(SessionWorker::getState);
    }

    public Set<String> activeSessions() {
        return sessions.sessionIds();
    }

    @PreDestroy
    public void shutdown() {
        Set<String> active = sessions.sessionIds();
        if (!active.isEmpty()) {
            logger.info("Ending {} active sessions", active.size());
        }
        for (String sessionId : active) {
            endSession(sessionId);
        }
    }
}
