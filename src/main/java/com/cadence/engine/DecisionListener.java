package com.cadence.engine;

import com.cadence.domain.DecisionEvent;

/**
 * Receives the decision stream. Called on the session's worker thread, in
 * window order; implementations must not block for long.
 */
public interface DecisionListener {

    void onDecision(DecisionEvent event);
}
