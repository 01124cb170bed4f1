package com.cadence.drift;

/**
 * Drift verdict for one window
 */
public final class DriftAssessment {

    private final double driftScore;
    private final boolean ready;
    private final boolean aboveAlert;
    private final int sustainedWindows;
    private final boolean recalibrationSuggested;
    private final boolean intrusionSuspected;

    public DriftAssessment(double driftScore, boolean ready, boolean aboveAlert, int sustainedWindows,
                    boolean recalibrationSuggested, boolean intrusionSuspected) {
        this.driftScore = driftScore;
        this.ready = ready;
        this.aboveAlert = aboveAlert;
        this.sustainedWindows = sustainedWindows;
        this.recalibrationSuggested = recalibrationSuggested;
        this.intrusionSuspected = intrusionSuspected;
    }

    public double getDriftScore() {
        return driftScore;
    }

    /**
     * False while too few windows have been seen to estimate drift
     */
    public boolean isReady() {
        return ready;
    }

    public boolean isAboveAlert() {
        return aboveAlert;
    }

    public int getSustainedWindows() {
        return sustainedWindows;
    }

    public boolean isRecalibrationSuggested() {
        return recalibrationSuggested;
    }

    public boolean isIntrusionSuspected() {
        return intrusionSuspected;
    }

    @Override
    public String toString() {
        return "DriftAssessment{drift=" + driftScore + ", ready=" + ready + ", sustained=" + sustainedWindows
            + ", recalibrate=" + recalibrationSuggested + ", intrusion=" + intrusionSuspected + "}";
    }
}
