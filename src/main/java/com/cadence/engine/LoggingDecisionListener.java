package com.cadence.engine;

import com.cadence.domain.DecisionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes transitions at INFO and every other decision at DEBUG
 */
@Component
public class LoggingDecisionListener implements DecisionListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDecisionListener.class);

    @Override
    public void onDecision(DecisionEvent event) {
        if (event.isTransition()) {
            logger.info("Session {} of user {}: {} -> {} ({}), aggregate {}, drift {}",
                event.getSessionId(), event.getUserId(), event.getPreviousState(), event.getState(),
                event.getReasonCode(), event.getAggregateScore(), event.getDriftScore());
        } else if (logger.isDebugEnabled()) {
            logger.debug("Session {} window {}: {} ({}), aggregate {}, drift {}",
                event.getSessionId(), event.getWindowId(), event.getState(), event.getReasonCode(),
                event.getAggregateScore(), event.getDriftScore());
        }
    }
}
