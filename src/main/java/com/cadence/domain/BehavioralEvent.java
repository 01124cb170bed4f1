package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single timestamped input event of one session.
 *
 * Keystrokes carry the key id with press and release times. Pointer events carry
 * the screen position; clicks additionally carry the button with press and release
 * times and scrolls carry the wheel delta. Instances are immutable and are created
 * through the static factories only. All times are epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BehavioralEvent {

    @JsonProperty("kind")
    private final EventKind kind;

    @JsonProperty("timestamp")
    private final long timestamp;

    @JsonProperty("key_id")
    private final String keyId;

    @JsonProperty("press_time")
    private final long pressTime;

    @JsonProperty("release_time")
    private final long releaseTime;

    @JsonProperty("x")
    private final double x;

    @JsonProperty("y")
    private final double y;

    @JsonProperty("button")
    private final int button;

    @JsonProperty("scroll_delta")
    private final double scrollDelta;

    private BehavioralEvent(EventKind kind, long timestamp, String keyId, long pressTime,
                            long releaseTime, double x, double y, int button, double scrollDelta) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.timestamp = timestamp;
        this.keyId = keyId;
        this.pressTime = pressTime;
        this.releaseTime = releaseTime;
        this.x = x;
        this.y = y;
        this.button = button;
        this.scrollDelta = scrollDelta;
    }

    public static BehavioralEvent keystroke(String keyId, long pressTime, long releaseTime) {
        if (releaseTime < pressTime) {
            throw new IllegalArgumentException("Key release precedes press for key " + keyId);
        }
        return new BehavioralEvent(EventKind.KEYSTROKE, pressTime, keyId, pressTime, releaseTime,
            0, 0, 0, 0);
    }

    public static BehavioralEvent mouseMove(double x, double y, long timestamp) {
        return new BehavioralEvent(EventKind.MOUSE_MOVE, timestamp, null, timestamp, timestamp,
            x, y, 0, 0);
    }

    public static BehavioralEvent mouseClick(double x, double y, int button, long pressTime, long releaseTime) {
        if (releaseTime < pressTime) {
            throw new IllegalArgumentException("Button release precedes press");
        }
        return new BehavioralEvent(EventKind.MOUSE_CLICK, pressTime, null, pressTime, releaseTime,
            x, y, button, 0);
    }

    public static BehavioralEvent scroll(double x, double y, double delta, long timestamp) {
        return new BehavioralEvent(EventKind.SCROLL, timestamp, null, timestamp, timestamp,
            x, y, 0, delta);
    }

    public EventKind getKind() {
        return kind;
    }

    public Modality getModality() {
        return kind.getModality();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getKeyId() {
        return keyId;
    }

    public long getPressTime() {
        return pressTime;
    }

    public long getReleaseTime() {
        return releaseTime;
    }

    /**
     * Time the key or button was held down
     */
    public long getHoldTime() {
        return releaseTime - pressTime;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public int getButton() {
        return button;
    }

    public double getScrollDelta() {
        return scrollDelta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BehavioralEvent)) return false;
        BehavioralEvent that = (BehavioralEvent) o;
        return timestamp == that.timestamp
            && pressTime == that.pressTime
            && releaseTime == that.releaseTime
            && Double.compare(that.x, x) == 0
            && Double.compare(that.y, y) == 0
            && button == that.button
            && Double.compare(that.scrollDelta, scrollDelta) == 0
            && kind == that.kind
            && Objects.equals(keyId, that.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, timestamp, keyId, pressTime, releaseTime, x, y, button, scrollDelta);
    }

    @Override
    public String toString() {
        return "BehavioralEvent{kind=" + kind + ", timestamp=" + timestamp + "}";
    }
}
