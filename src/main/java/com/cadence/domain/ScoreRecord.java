package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scores of every model for one window.
 *
 * Models that could not score the window appear in {@link #getFailures()} and are
 * absent from the score maps. The aggregate is null until the aggregator has
 * combined the record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScoreRecord {

    @JsonProperty("window_id")
    private final String windowId;

    @JsonProperty("timestamp")
    private final long timestamp;

    @JsonProperty("raw_scores")
    private final Map<ModelKind, Double> rawScores;

    @JsonProperty("calibrated_scores")
    private final Map<ModelKind, Double> calibratedScores;

    @JsonProperty("failures")
    private final Map<ModelKind, String> failures;

    @JsonProperty("aggregate")
    private final Double aggregate;

    public ScoreRecord(String windowId, long timestamp, Map<ModelKind, Double> rawScores,
                       Map<ModelKind, String> failures) {
        this(windowId, timestamp, rawScores, Collections.emptyMap(), failures, null);
    }

    private ScoreRecord(String windowId, long timestamp, Map<ModelKind, Double> rawScores,
                        Map<ModelKind, Double> calibratedScores, Map<ModelKind, String> failures,
                        Double aggregate) {
        this.windowId = windowId;
        this.timestamp = timestamp;
        this.rawScores = freeze(rawScores);
        this.calibratedScores = freeze(calibratedScores);
        this.failures = freeze(failures);
        this.aggregate = aggregate;
    }

    /**
     * Returns a copy carrying the calibrated per-model scores and the aggregate
     */
    public ScoreRecord withAggregate(Map<ModelKind, Double> calibrated, double aggregateScore) {
        return new ScoreRecord(windowId, timestamp, rawScores, calibrated, failures, aggregateScore);
    }

    private static <V> Map<ModelKind, V> freeze(Map<ModelKind, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public String getWindowId() {
        return windowId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<ModelKind, Double> getRawScores() {
        return rawScores;
    }

    public Map<ModelKind, Double> getCalibratedScores() {
        return calibratedScores;
    }

    public Map<ModelKind, String> getFailures() {
        return failures;
    }

    public Double getAggregate() {
        return aggregate;
    }

    @JsonIgnore
    public int availableModelCount() {
        return rawScores.size();
    }

    @Override
    public String toString() {
        return "ScoreRecord{window=" + windowId + ", raw=" + rawScores + ", failures=" + failures.keySet()
            + ", aggregate=" + aggregate + "}";
    }
}
