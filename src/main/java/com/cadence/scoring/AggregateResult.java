package com.cadence.scoring;

import com.cadence.domain.ScoreRecord;

/**
 * Outcome of aggregating one window's scores
 */
public final class AggregateResult {

    private final ScoreRecord record;
    private final boolean scored;
    private final boolean lowConfidence;
    private final boolean severeAnomaly;
    private final int consecutiveLow;
    private final boolean triggered;

    public AggregateResult(ScoreRecord record, boolean scored, boolean lowConfidence, boolean severeAnomaly,
                    int consecutiveLow, boolean triggered) {
        this.record = record;
        this.scored = scored;
        this.lowConfidence = lowConfidence;
        this.severeAnomaly = severeAnomaly;
        this.consecutiveLow = consecutiveLow;
        this.triggered = triggered;
    }

    public ScoreRecord getRecord() {
        return record;
    }

    /**
     * Aggregate score, or null when no model scored the window
     */
    public Double getAggregate() {
        return record.getAggregate();
    }

    public boolean isScored() {
        return scored;
    }

    /**
     * Below the confidence threshold, or unscored
     */
    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public boolean isSevereAnomaly() {
        return severeAnomaly;
    }

    public int getConsecutiveLow() {
        return consecutiveLow;
    }

    /**
     * True once the consecutive low-confidence limit has been reached
     */
    public boolean isTriggered() {
        return triggered;
    }

    @Override
    public String toString() {
        return "AggregateResult{aggregate=" + getAggregate() + ", low=" + lowConfidence + ", severe=" + severeAnomaly
            + ", consecutiveLow=" + consecutiveLow + ", triggered=" + triggered + "}";
    }
}
