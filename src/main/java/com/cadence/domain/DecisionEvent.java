package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Trust decision emitted for every completed window of a session.
 *
 * When the window moved the session to a new state, {@link #isTransition()} is
 * true and {@link #getPreviousState()} names the state it left. The aggregate
 * score is null for windows that were not scored (calibration, locked session,
 * no model available).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionEvent {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("window_id")
    private String windowId;

    @JsonProperty("timestamp")
    private long timestamp;

    @JsonProperty("state")
    private SessionState state;

    @JsonProperty("previous_state")
    private SessionState previousState;

    @JsonProperty("transition")
    private boolean transition;

    @JsonProperty("aggregate_score")
    private Double aggregateScore;

    @JsonProperty("model_scores")
    private Map<ModelKind, Double> modelScores = Collections.emptyMap();

    @JsonProperty("drift_score")
    private double driftScore;

    @JsonProperty("reason_code")
    private ReasonCode reasonCode;

    public DecisionEvent() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getWindowId() {
        return windowId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public SessionState getState() {
        return state;
    }

    public SessionState getPreviousState() {
        return previousState;
    }

    public boolean isTransition() {
        return transition;
    }

    public Double getAggregateScore() {
        return aggregateScore;
    }

    public Map<ModelKind, Double> getModelScores() {
        return modelScores;
    }

    public double getDriftScore() {
        return driftScore;
    }

    public ReasonCode getReasonCode() {
        return reasonCode;
    }

    @Override
    public String toString() {
        return "DecisionEvent{session=" + sessionId + ", window=" + windowId + ", state=" + state
            + (transition ? ", from=" + previousState : "")
            + ", aggregate=" + aggregateScore + ", drift=" + driftScore + ", reason=" + reasonCode + "}";
    }

    public static class Builder {
        private final DecisionEvent event;

        public Builder() {
            this.event = new DecisionEvent();
        }

        public Builder sessionId(String sessionId) {
            event.sessionId = sessionId;
            return this;
        }

        public Builder userId(String userId) {
            event.userId = userId;
            return this;
        }

        public Builder windowId(String windowId) {
            event.windowId = windowId;
            return this;
        }

        public Builder timestamp(long timestamp) {
            event.timestamp = timestamp;
            return this;
        }

        public Builder state(SessionState state) {
            event.state = state;
            return this;
        }

        public Builder previousState(SessionState previousState) {
            event.previousState = previousState;
            event.transition = previousState != null;
            return this;
        }

        public Builder aggregateScore(Double aggregateScore) {
            event.aggregateScore = aggregateScore;
            return this;
        }

        public Builder modelScores(Map<ModelKind, Double> modelScores) {
            event.modelScores = modelScores == null || modelScores.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(modelScores));
            return this;
        }

        public Builder driftScore(double driftScore) {
            event.driftScore = driftScore;
            return this;
        }

        public Builder reasonCode(ReasonCode reasonCode) {
            event.reasonCode = reasonCode;
            return this;
        }

        public DecisionEvent build() {
            if (event.sessionId == null) {
                throw new IllegalStateException("Decision event requires a session id");
            }
            if (event.state == null || event.reasonCode == null) {
                throw new IllegalStateException("Decision event requires a state and a reason code");
            }
            return event;
        }
    }
}
