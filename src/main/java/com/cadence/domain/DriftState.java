package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Behavioral drift bookkeeping for one user.
 *
 * The baseline statistics are captured at calibration and replaced on every
 * recalibration. The current statistics are the last persisted snapshot of the
 * rolling accumulator of a session.
 */
public class DriftState {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("baseline_means")
    private double[] baselineMeans;

    @JsonProperty("baseline_std_devs")
    private double[] baselineStdDevs;

    @JsonProperty("baseline_counts")
    private long[] baselineCounts;

    @JsonProperty("current_means")
    private double[] currentMeans;

    @JsonProperty("current_variances")
    private double[] currentVariances;

    @JsonProperty("current_counts")
    private long[] currentCounts;

    @JsonProperty("drift_score")
    private double driftScore;

    @JsonProperty("last_recalibration")
    private Instant lastRecalibration;

    public DriftState() {
    }

    public DriftState(String userId) {
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public double[] getBaselineMeans() {
        return baselineMeans;
    }

    public void setBaselineMeans(double[] baselineMeans) {
        this.baselineMeans = baselineMeans;
    }

    public double[] getBaselineStdDevs() {
        return baselineStdDevs;
    }

    public void setBaselineStdDevs(double[] baselineStdDevs) {
        this.baselineStdDevs = baselineStdDevs;
    }

    public long[] getBaselineCounts() {
        return baselineCounts;
    }

    public void setBaselineCounts(long[] baselineCounts) {
        this.baselineCounts = baselineCounts;
    }

    public double[] getCurrentMeans() {
        return currentMeans;
    }

    public void setCurrentMeans(double[] currentMeans) {
        this.currentMeans = currentMeans;
    }

    public double[] getCurrentVariances() {
        return currentVariances;
    }

    public void setCurrentVariances(double[] currentVariances) {
        this.currentVariances = currentVariances;
    }

    public long[] getCurrentCounts() {
        return currentCounts;
    }

    public void setCurrentCounts(long[] currentCounts) {
        this.currentCounts = currentCounts;
    }

    public double getDriftScore() {
        return driftScore;
    }

    public void setDriftScore(double driftScore) {
        this.driftScore = driftScore;
    }

    public Instant getLastRecalibration() {
        return lastRecalibration;
    }

    public void setLastRecalibration(Instant lastRecalibration) {
        this.lastRecalibration = lastRecalibration;
    }
}
