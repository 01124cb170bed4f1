package com.cadence.engine;

import com.cadence.calibration.CalibrationIncompleteException;
import com.cadence.calibration.CalibrationManager;
import com.cadence.calibration.CalibrationResult;
import com.cadence.calibration.InsufficientModalityDataException;
import com.cadence.config.EngineConfig;
import com.cadence.domain.BehavioralEvent;
import com.cadence.domain.DecisionEvent;
import com.cadence.domain.DriftState;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.ReasonCode;
import com.cadence.domain.SessionState;
import com.cadence.drift.DriftAssessment;
import com.cadence.drift.DriftMonitor;
import com.cadence.features.WindowAssembler;
import com.cadence.models.ModelRegistry;
import com.cadence.models.ModelScoreException;
import com.cadence.models.ModelUntrainedException;
import com.cadence.models.ScoringModel;
import com.cadence.profile.ProfileLockTimeoutException;
import com.cadence.profile.UserProfileSet;
import com.cadence.scoring.AggregateResult;
import com.cadence.scoring.Aggregator;
import com.cadence.scoring.EnsembleScorer;
import com.cadence.scoring.ScoredWindow;
import com.cadence.session.SessionStateMachine;
import com.cadence.session.Transition;
import com.cadence.storage.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Processes the event stream of one session.
 *
 * <p>Events are queued by the transport and drained by at most one task at a
 * time on the shared session executor, so windows are handled strictly in
 * order while different sessions run in parallel. All per-session state
 * (assembler, aggregator, drift monitor, state machine) is confined to the
 * draining task.
 *
 * <p>Cancelling stops the drain between windows: queued events and the open
 * partial window are discarded, and no decision is emitted afterwards.
 */
public class SessionWorker {
    private static final Logger logger = LoggerFactory.getLogger(SessionWorker.class);

    private final String sessionId;
    private final String userId;
    private final EngineConfig config;
    private final WindowAssembler assembler;
    private final EnsembleScorer scorer;
    private final CalibrationManager calibrationManager;
    private final ModelRegistry registry;
    private final UserProfileSet profiles;
    private final ProfileStore store;
    private final List<DecisionListener> listeners;
    private final EngineMetrics metrics;
    private final Executor executor;

    private final Aggregator aggregator;
    private final DriftMonitor driftMonitor;
    private final SessionStateMachine stateMachine;

    private final Queue<BehavioralEvent> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile boolean cancelled;
    private volatile SessionState state;

    private final Deque<FeatureWindow> history = new ArrayDeque<>();
    private final List<FeatureWindow> calibrationWindows = new ArrayList<>();
    private final Deque<FeatureWindow> genuineWindows = new ArrayDeque<>();
    private final EnumSet<ModelKind> learnedKinds = EnumSet.noneOf(ModelKind.class);
    private Transition pendingStart;
    private long knownGeneration;

    SessionWorker(String sessionId, String userId, Transition start, EngineConfig config, WindowAssembler assembler,
                  EnsembleScorer scorer, CalibrationManager calibrationManager, ModelRegistry registry,
                  UserProfileSet profiles, ProfileStore store, List<DecisionListener> listeners,
                  EngineMetrics metrics, Executor executor) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.config = config;
        this.assembler = assembler;
        this.scorer = scorer;
        this.calibrationManager = calibrationManager;
        this.registry = registry;
        this.profiles = profiles;
        this.store = store;
        this.listeners = listeners;
        this.metrics = metrics;
        this.executor = executor;

        this.aggregator = new Aggregator(config);
        this.driftMonitor = new DriftMonitor(config, profiles.getDriftBaseline());
        this.stateMachine = new SessionStateMachine(sessionId, config, SessionState.CALIBRATING);
        if (start.isTransition()) {
            stateMachine.completeCalibration(start.getReason());
        }
        this.state = stateMachine.getState();
        this.knownGeneration = profiles.getGeneration();
        this.pendingStart = start;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * State after the last processed window
     */
    public SessionState getState() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Emits the session-start decision.
     */
    void begin() {
        schedule();
    }

    /**
     * Queues an event for processing.
     *
     * @return false if the session has been cancelled
     */
    public boolean submit(BehavioralEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }
        if (cancelled) {
            return false;
        }
        queue.add(event);
        schedule();
        return true;
    }

    /**
     * Cancels the session. The returned future completes once the worker has
     * discarded its pending input and saved its drift state.
     */
    public CompletableFuture<Void> cancel() {
        cancelled = true;
        queue.clear();
        schedule();
        return terminated;
    }

    private void schedule() {
        if (scheduled.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        try {
            if (pendingStart != null && !cancelled) {
                Transition start = pendingStart;
                pendingStart = null;
                emit(null, start, null, Collections.emptyMap(), driftMonitor.getDriftScore());
            }
            BehavioralEvent event;
            while (!cancelled && (event = queue.poll()) != null) {
                process(event);
            }
            if (cancelled) {
                finish();
            }
        } finally {
            scheduled.set(false);
            if (cancelled ? !finished.get() : !queue.isEmpty()) {
                schedule();
            }
        }
    }

    private void process(BehavioralEvent event) {
        try {
            for (FeatureWindow window : assembler.accept(event)) {
                if (cancelled) {
                    return;
                }
                handleWindow(window);
            }
        } catch (RuntimeException e) {
            logger.error("Session {} failed to process event at {}", sessionId, event.getTimestamp(), e);
        }
    }

    private void handleWindow(FeatureWindow window) {
        history.addLast(window);
        while (history.size() > config.getHistoryLength()) {
            history.removeFirst();
        }
        if (stateMachine.getState() == SessionState.CALIBRATING) {
            whileCalibrating(window);
        } else {
            score(window);
        }
    }

    private void whileCalibrating(FeatureWindow window) {
        if (profiles.isFullyTrained()) {
            Transition transition = stateMachine.completeCalibration(ReasonCode.PROFILES_RESTORED);
            rebaseline();
            calibrationWindows.clear();
            emit(window, transition, null, Collections.emptyMap(), driftMonitor.getDriftScore());
            return;
        }
        calibrationWindows.add(window);
        try {
            CalibrationResult result = calibrationManager.calibrate(userId, calibrationWindows);
            Transition transition = stateMachine.completeCalibration(result.getReasonCode());
            rebaseline();
            calibrationWindows.clear();
            emit(window, transition, null, Collections.emptyMap(), driftMonitor.getDriftScore());
            return;
        } catch (CalibrationIncompleteException e) {
            logger.debug("Session {} still calibrating: {}", sessionId, e.getMessage());
        } catch (InsufficientModalityDataException e) {
            logger.debug("Session {} waiting for modality data: {}", sessionId, e.getMessage());
        } catch (ProfileLockTimeoutException e) {
            logger.warn("Session {} could not lock profiles for calibration: {}", sessionId, e.getMessage());
        }
        emit(window, Transition.stay(SessionState.CALIBRATING, ReasonCode.CALIBRATING), null, Collections.emptyMap(), 0.0);
    }

    private void score(FeatureWindow window) {
        if (profiles.getGeneration() != knownGeneration) {
            rebaseline();
        }
        ScoredWindow scored = scorer.score(userId, new ArrayList<>(history));
        AggregateResult aggregate;
        try {
            aggregate = aggregator.aggregate(scored);
        } catch (ModelUntrainedException e) {
            logger.warn("Session {} window {} unscored: {}", sessionId, window.getWindowId(), e.getMessage());
            aggregate = aggregator.recordUnscored(scored.getRecord());
        }
        DriftAssessment drift = driftMonitor.update(window, aggregate.getAggregate());
        Transition transition = stateMachine.onWindow(aggregate, drift);
        if (transition.isTransition() && transition.getTo() == SessionState.TRUSTED) {
            aggregator.reset();
        }

        boolean genuine = aggregate.isScored() && !aggregate.isLowConfidence();
        if (genuine) {
            genuineWindows.addLast(window);
            while (genuineWindows.size() > config.getDriftDetectionWindow()) {
                genuineWindows.removeFirst();
            }
        }

        if (!transition.isTransition() && transition.getTo() == SessionState.TRUSTED) {
            if (drift.isRecalibrationSuggested() && startRecalibration()) {
                transition = Transition.stay(SessionState.TRUSTED, ReasonCode.RECALIBRATION_STARTED);
            } else if (genuine && !drift.isAboveAlert()) {
                learn(window);
            }
        }
        emit(window, transition, aggregate.getAggregate(), aggregate.getRecord().getCalibratedScores(),
            drift.getDriftScore());
    }

    private boolean startRecalibration() {
        List<FeatureWindow> windows = new ArrayList<>(genuineWindows);
        return calibrationManager.recalibrateAsync(userId, windows).isPresent();
    }

    private void learn(FeatureWindow window) {
        try {
            profiles.withWriteLock(config.getProfileLockTimeout(), () -> {
                if (profiles.getGeneration() != knownGeneration) {
                    return null;
                }
                Map<ModelKind, ModelProfile> current = profiles.snapshot();
                for (ScoringModel model : registry.all()) {
                    ModelProfile profile = current.get(model.kind());
                    if (profile == null) {
                        continue;
                    }
                    try {
                        ModelProfile updated = model.learn(profile, window);
                        if (updated != profile) {
                            updated.setVersion(profile.getVersion() + 1);
                            profiles.replace(updated);
                            learnedKinds.add(model.kind());
                        }
                    } catch (ModelScoreException | ModelUntrainedException e) {
                        logger.debug("Session {} skipped online update of {}: {}",
                            sessionId, model.kind(), e.getMessage());
                    }
                }
                return null;
            });
        } catch (ProfileLockTimeoutException e) {
            metrics.recordOnlineUpdateSkipped();
            logger.debug("Session {} skipped online update: {}", sessionId, e.getMessage());
        }
    }

    private void rebaseline() {
        DriftState baseline = profiles.getDriftBaseline();
        knownGeneration = profiles.getGeneration();
        driftMonitor.rebaseline(baseline);
        genuineWindows.clear();
        learnedKinds.clear();
        logger.debug("Session {} adopted profile generation {}", sessionId, knownGeneration);
    }

    private void emit(FeatureWindow window, Transition transition, Double aggregate,
                      Map<ModelKind, Double> modelScores, double driftScore) {
        DecisionEvent.Builder builder = DecisionEvent.builder()
            .sessionId(sessionId)
            .userId(userId)
            .state(transition.getTo())
            .aggregateScore(aggregate)
            .modelScores(modelScores)
            .driftScore(driftScore)
            .reasonCode(transition.getReason());
        if (window != null) {
            builder.windowId(window.getWindowId()).timestamp(window.getEndTime());
        }
        if (transition.isTransition()) {
            builder.previousState(transition.getFrom());
            metrics.recordTransition(transition.getFrom(), transition.getTo(), transition.getReason());
        }
        DecisionEvent event = builder.build();
        state = transition.getTo();
        metrics.recordDecision(event.getState());

        for (DecisionListener listener : listeners) {
            try {
                listener.onDecision(event);
            } catch (RuntimeException e) {
                logger.error("Decision listener {} failed for session {}", listener.getClass().getSimpleName(),
                    sessionId, e);
            }
        }
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        queue.clear();
        assembler.discardPartial();
        try {
            if (stateMachine.getState() != SessionState.CALIBRATING && profiles.getDriftBaseline() != null) {
                saveSessionState();
            }
        } finally {
            logger.info("Session {} of user {} ended in state {}", sessionId, userId, stateMachine.getState());
            terminated.complete(null);
        }
    }

    /**
     * Persists the drift state and the online-learned profiles, unless a
     * recalibration has published a newer generation since this session last
     * rebaselined. Store writes happen under the write lock.
     */
    private void saveSessionState() {
        DriftState snapshot = driftMonitor.snapshot(userId);
        try {
            boolean saved = profiles.withWriteLock(config.getProfileLockTimeout(), () -> {
                if (profiles.getGeneration() != knownGeneration) {
                    return false;
                }
                Map<ModelKind, ModelProfile> current = profiles.snapshot();
                for (ModelKind kind : learnedKinds) {
                    ModelProfile learned = current.get(kind);
                    if (learned != null) {
                        store.saveProfile(learned);
                    }
                }
                profiles.updateDriftState(snapshot);
                store.saveDriftState(snapshot);
                return true;
            });
            if (!saved) {
                logger.info("Session {} state superseded by profile generation {}, not saved",
                    sessionId, profiles.getGeneration());
            }
        } catch (RuntimeException e) {
            logger.error("Failed to save session state of session {} for user {}", sessionId, userId, e);
        }
    }
}
