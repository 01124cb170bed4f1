package com.cadence.session;

import com.cadence.config.EngineConfig;
import com.cadence.domain.ReasonCode;
import com.cadence.domain.SessionState;
import com.cadence.drift.DriftAssessment;
import com.cadence.scoring.AggregateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trust state of one session.
 *
 * <p>Allowed edges are CALIBRATING to TRUSTED, TRUSTED to SUSPICIOUS and
 * SUSPICIOUS to TRUSTED or LOCKED. LOCKED is terminal. Leaving CALIBRATING
 * happens only through {@link #completeCalibration(ReasonCode)}; every other
 * edge is driven by {@link #onWindow(AggregateResult, DriftAssessment)}.
 *
 * <p>Not thread-safe; one instance belongs to one session worker.
 */
public class SessionStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(SessionStateMachine.class);

    private final String sessionId;
    private final EngineConfig config;

    private SessionState state;
    private int recoveryStreak;
    private int anomalousStreak;
    private int suspiciousWindows;

    public SessionStateMachine(String sessionId, EngineConfig config, SessionState initial) {
        this.sessionId = sessionId;
        this.config = config;
        this.state = initial;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Applies the verdicts for one window and returns the resulting step.
     */
    public Transition onWindow(AggregateResult aggregate, DriftAssessment drift) {
        switch (state) {
            case CALIBRATING:
                return Transition.stay(state, ReasonCode.CALIBRATING);
            case TRUSTED:
                return whileTrusted(aggregate, drift);
            case SUSPICIOUS:
                return whileSuspicious(aggregate, drift);
            case LOCKED:
            default:
                return Transition.stay(state, ReasonCode.SESSION_LOCKED);
        }
    }

    private Transition whileTrusted(AggregateResult aggregate, DriftAssessment drift) {
        if (aggregate.isSevereAnomaly()) {
            return transitionTo(SessionState.SUSPICIOUS, ReasonCode.SEVERE_ANOMALY);
        }
        if (drift.isIntrusionSuspected()) {
            return transitionTo(SessionState.SUSPICIOUS, ReasonCode.DRIFT_WITH_LOW_CONFIDENCE);
        }
        if (aggregate.isTriggered()) {
            return transitionTo(SessionState.SUSPICIOUS, ReasonCode.CONSECUTIVE_LOW_CONFIDENCE);
        }
        return Transition.stay(state, verdictOf(aggregate));
    }

    private Transition whileSuspicious(AggregateResult aggregate, DriftAssessment drift) {
        suspiciousWindows++;
        ReasonCode reason;
        if (!aggregate.isLowConfidence()) {
            anomalousStreak = 0;
            if (drift.isAboveAlert()) {
                recoveryStreak = 0;
                reason = ReasonCode.RECOVERY_BLOCKED_BY_DRIFT;
            } else {
                recoveryStreak++;
                if (recoveryStreak >= config.getRecoveryWindows()) {
                    return transitionTo(SessionState.TRUSTED, ReasonCode.RECOVERED);
                }
                reason = ReasonCode.RECOVERING;
            }
        } else {
            recoveryStreak = 0;
            anomalousStreak++;
            if (anomalousStreak >= config.getLockAfterAnomalies()) {
                return transitionTo(SessionState.LOCKED, ReasonCode.ANOMALY_PERSISTED);
            }
            reason = verdictOf(aggregate);
        }
        if (suspiciousWindows >= config.getMaxSuspiciousWindows()) {
            return transitionTo(SessionState.LOCKED, ReasonCode.SUSPICIOUS_TIMEOUT);
        }
        return Transition.stay(state, reason);
    }

    /**
     * Leaves CALIBRATING once the profiles are trained or restored.
     *
     * @throws IllegalStateException if the session is not calibrating
     */
    public Transition completeCalibration(ReasonCode reason) {
        return transitionTo(SessionState.TRUSTED, reason);
    }

    private Transition transitionTo(SessionState target, ReasonCode reason) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Session " + sessionId + " cannot move from " + state + " to " + target);
        }
        SessionState previous = state;
        state = target;
        recoveryStreak = 0;
        anomalousStreak = 0;
        suspiciousWindows = 0;
        logger.info("Session {} {} -> {} ({})", sessionId, previous, target, reason);
        return new Transition(previous, target, reason);
    }

    private static ReasonCode verdictOf(AggregateResult aggregate) {
        if (!aggregate.isScored()) {
            return ReasonCode.NO_MODELS_AVAILABLE;
        }
        return aggregate.isLowConfidence() ? ReasonCode.LOW_CONFIDENCE : ReasonCode.GENUINE;
    }

    int getRecoveryStreak() {
        return recoveryStreak;
    }

    int getAnomalousStreak() {
        return anomalousStreak;
    }
}
