package com.cadence.session;

import com.cadence.domain.ReasonCode;
import com.cadence.domain.SessionState;

/**
 * State of a session after one step, with the reason. When {@link #isTransition()}
 * is false the session stayed where it was.
 */
public final class Transition {

    private final SessionState from;
    private final SessionState to;
    private final ReasonCode reason;

    Transition(SessionState from, SessionState to, ReasonCode reason) {
        this.from = from;
        this.to = to;
        this.reason = reason;
    }

    public static Transition stay(SessionState state, ReasonCode reason) {
        return new Transition(state, state, reason);
    }

    /**
     * @throws IllegalStateException if the edge is not allowed
     */
    public static Transition of(SessionState from, SessionState to, ReasonCode reason) {
        if (from != to && !from.canTransitionTo(to)) {
            throw new IllegalStateException("No transition from " + from + " to " + to);
        }
        return new Transition(from, to, reason);
    }

    public SessionState getFrom() {
        return from;
    }

    public SessionState getTo() {
        return to;
    }

    public ReasonCode getReason() {
        return reason;
    }

    public boolean isTransition() {
        return from != to;
    }

    @Override
    public String toString() {
        return isTransition() ? from + "->" + to + " (" + reason + ")" : to + " (" + reason + ")";
    }
}
