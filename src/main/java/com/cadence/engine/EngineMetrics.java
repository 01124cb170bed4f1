package com.cadence.engine;

import com.cadence.domain.ModelKind;
import com.cadence.domain.ReasonCode;
import com.cadence.domain.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for the authentication engine
 */
@Component
public class EngineMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter windowsScored;
    private final Counter windowsUnscored;
    private final Counter lockTimeouts;
    private final Counter onlineUpdatesSkipped;
    private final Counter recalibrations;
    private final Counter sessionsStarted;
    private final Counter sessionsEnded;
    private final Timer scoringLatency;
    private final Timer trainingLatency;

    @Autowired
    public EngineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.windowsScored = Counter.builder("cadence.windows.scored")
            .description("Windows scored by at least one model")
            .register(meterRegistry);

        this.windowsUnscored = Counter.builder("cadence.windows.unscored")
            .description("Windows no model could score")
            .register(meterRegistry);

        this.lockTimeouts = Counter.builder("cadence.profile.lock.timeouts")
            .description("Scoring passes that fell back to the prior profile version")
            .register(meterRegistry);

        this.onlineUpdatesSkipped = Counter.builder("cadence.profile.online.skipped")
            .description("Online profile updates skipped because the profile was busy")
            .register(meterRegistry);

        this.recalibrations = Counter.builder("cadence.recalibrations")
            .description("Background recalibrations started")
            .register(meterRegistry);

        this.sessionsStarted = Counter.builder("cadence.sessions.started")
            .description("Sessions started")
            .register(meterRegistry);

        this.sessionsEnded = Counter.builder("cadence.sessions.ended")
            .description("Sessions ended")
            .register(meterRegistry);

        this.scoringLatency = Timer.builder("cadence.scoring.latency")
            .description("Latency of scoring one window with the ensemble")
            .register(meterRegistry);

        this.trainingLatency = Timer.builder("cadence.training.latency")
            .description("Latency of training a full profile set")
            .register(meterRegistry);
    }

    public void recordWindowScored() {
        windowsScored.increment();
    }

    public void recordWindowUnscored() {
        windowsUnscored.increment();
    }

    public void recordModelFailure(ModelKind kind) {
        Counter.builder("cadence.model.failures")
            .description("Per-model scoring failures")
            .tag("model", kind.getValue())
            .register(meterRegistry)
            .increment();
    }

    public void recordDecision(SessionState state) {
        Counter.builder("cadence.decisions")
            .description("Decision events emitted")
            .tag("state", state.getValue())
            .register(meterRegistry)
            .increment();
    }

    public void recordTransition(SessionState from, SessionState to, ReasonCode reason) {
        Counter.builder("cadence.transitions")
            .description("Session state transitions")
            .tag("from", from.getValue())
            .tag("to", to.getValue())
            .tag("reason", reason.getCode())
            .register(meterRegistry)
            .increment();
    }

    public void recordLockTimeout() {
        lockTimeouts.increment();
    }

    public void recordOnlineUpdateSkipped() {
        onlineUpdatesSkipped.increment();
    }

    public void recordRecalibration() {
        recalibrations.increment();
    }

    public void recordSessionStarted() {
        sessionsStarted.increment();
    }

    public void recordSessionEnded() {
        sessionsEnded.increment();
    }

    public Timer.Sample startScoringTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordScoringLatency(Timer.Sample sample) {
        sample.stop(scoringLatency);
    }

    public Timer.Sample startTrainingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTrainingLatency(Timer.Sample sample) {
        sample.stop(trainingLatency);
    }
}
