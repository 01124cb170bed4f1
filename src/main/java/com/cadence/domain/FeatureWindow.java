package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One completed window of a session reduced to a numeric feature vector.
 *
 * Features of a modality listed in {@link #getMissingModalities()} hold
 * {@code NaN}; they are never zero-filled. Instances are immutable.
 */
public final class FeatureWindow {

    @JsonProperty("window_id")
    private final String windowId;

    @JsonProperty("session_id")
    private final String sessionId;

    @JsonProperty("sequence")
    private final long sequence;

    @JsonProperty("start_time")
    private final long startTime;

    @JsonProperty("end_time")
    private final long endTime;

    @JsonProperty("values")
    private final double[] values;

    @JsonProperty("keystroke_count")
    private final int keystrokeCount;

    @JsonProperty("mouse_count")
    private final int mouseCount;

    @JsonProperty("missing_modalities")
    private final Set<Modality> missingModalities;

    public FeatureWindow(String sessionId, long sequence, long startTime, long endTime, double[] values,
                         int keystrokeCount, int mouseCount, Set<Modality> missingModalities) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.sequence = sequence;
        this.windowId = sessionId + ":" + sequence;
        this.startTime = startTime;
        this.endTime = endTime;
        this.values = Objects.requireNonNull(values, "values").clone();
        this.keystrokeCount = keystrokeCount;
        this.mouseCount = mouseCount;
        this.missingModalities = missingModalities.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(missingModalities));
    }

    public String getWindowId() {
        return windowId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getSequence() {
        return sequence;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] getValues() {
        return values.clone();
    }

    public int getKeystrokeCount() {
        return keystrokeCount;
    }

    public int getMouseCount() {
        return mouseCount;
    }

    public Set<Modality> getMissingModalities() {
        return missingModalities;
    }

    public boolean hasModality(Modality modality) {
        return !missingModalities.contains(modality);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureWindow)) return false;
        FeatureWindow that = (FeatureWindow) o;
        return sequence == that.sequence
            && startTime == that.startTime
            && endTime == that.endTime
            && keystrokeCount == that.keystrokeCount
            && mouseCount == that.mouseCount
            && sessionId.equals(that.sessionId)
            && Arrays.equals(values, that.values)
            && missingModalities.equals(that.missingModalities);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sessionId, sequence, startTime, endTime, keystrokeCount, mouseCount,
            missingModalities);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureWindow{id=" + windowId + ", start=" + startTime + ", end=" + endTime
            + ", keystrokes=" + keystrokeCount + ", mouse=" + mouseCount
            + ", missing=" + missingModalities + "}";
    }
}
