package com.cadence.features;

import com.cadence.config.EngineConfig;
import com.cadence.domain.BehavioralEvent;
import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Push-mode window builder for one session.
 *
 * Events are folded into running statistics as they arrive, so memory per window
 * is constant. A window closes when the next event falls at least the configured
 * window size after the window start (that event opens the next window), or when
 * every modality seen in the window has reached its minimum event count. Data that
 * never completes a window is simply never emitted.
 *
 * Not thread-safe: owned by a single session worker.
 */
public class WindowAssembler {

    private static final Logger logger = LoggerFactory.getLogger(WindowAssembler.class);

    static final int MIN_KEYSTROKES_FOR_FEATURES = 2;
    static final int MIN_MOVES_FOR_FEATURES = 3;

    private final String sessionId;
    private final long windowMillis;
    private final int minKeystrokeEvents;
    private final int minMouseEvents;

    private long nextSequence;
    private long droppedEvents;
    private long droppedWindows;

    private boolean open;
    private long windowStart;
    private long lastEventTime;

    // Keystroke accumulators
    private final RunningStats holdStats = new RunningStats();
    private final RunningStats flightStats = new RunningStats();
    private final RunningStats digraphStats = new RunningStats();
    private int keystrokeCount;
    private long lastKeyPress;
    private long lastKeyRelease;

    // Pointer accumulators
    private final RunningStats velocityStats = new RunningStats();
    private final RunningStats accelerationStats = new RunningStats();
    private final RunningStats curvatureStats = new RunningStats();
    private int moveCount;
    private int clickCount;
    private int scrollCount;
    private double lastX;
    private double lastY;
    private long lastMoveTime;
    private double lastVelocity = Double.NaN;
    private long lastVelocityTime;
    private double lastHeading = Double.NaN;

    public WindowAssembler(String sessionId, EngineConfig config) {
        this.sessionId = sessionId;
        this.windowMillis = config.getWindowSize().toMillis();
        this.minKeystrokeEvents = config.getMinKeystrokeEvents();
        this.minMouseEvents = config.getMinMouseEvents();
    }

    /**
     * Folds one event into the current window.
     *
     * @return the windows completed by this event, usually empty
     */
    public List<FeatureWindow> accept(BehavioralEvent event) {
        if (open && event.getTimestamp() < windowStart) {
            droppedEvents++;
            logger.debug("Dropping event at {} preceding window start {} in session {}",
                event.getTimestamp(), windowStart, sessionId);
            return Collections.emptyList();
        }

        List<FeatureWindow> completed = new ArrayList<>(1);
        if (open && event.getTimestamp() - windowStart >= windowMillis) {
            close(lastEventTime, completed);
        }

        if (!open) {
            open = true;
            windowStart = event.getTimestamp();
            lastEventTime = event.getTimestamp();
        }
        lastEventTime = Math.max(lastEventTime, event.getTimestamp());

        switch (event.getKind()) {
            case KEYSTROKE:
                addKeystroke(event);
                break;
            case MOUSE_MOVE:
                addMove(event);
                break;
            case MOUSE_CLICK:
                clickCount++;
                break;
            case SCROLL:
                scrollCount++;
                break;
            default:
                throw new IllegalArgumentException("Unsupported event kind: " + event.getKind());
        }

        if (countsReached()) {
            close(lastEventTime, completed);
        }
        return completed;
    }

    /**
     * Discards any partial window, e.g. at stream end.
     */
    public void discardPartial() {
        if (open) {
            logger.debug("Discarding partial window of session {} ({} keystrokes, {} mouse events)",
                sessionId, keystrokeCount, mouseCount());
        }
        resetWindow();
    }

    public long getDroppedEvents() {
        return droppedEvents;
    }

    public long getDroppedWindows() {
        return droppedWindows;
    }

    private void addKeystroke(BehavioralEvent event) {
        holdStats.add(event.getHoldTime());
        if (keystrokeCount > 0) {
            flightStats.add(event.getPressTime() - lastKeyRelease);
            digraphStats.add(event.getPressTime() - lastKeyPress);
        }
        lastKeyPress = event.getPressTime();
        lastKeyRelease = event.getReleaseTime();
        keystrokeCount++;
    }

    private void addMove(BehavioralEvent event) {
        if (moveCount > 0) {
            long dt = event.getTimestamp() - lastMoveTime;
            double dx = event.getX() - lastX;
            double dy = event.getY() - lastY;
            double distance = Math.hypot(dx, dy);
            if (dt > 0) {
                double velocity = distance / dt;
                velocityStats.add(velocity);
                if (!Double.isNaN(lastVelocity)) {
                    long dv = event.getTimestamp() - lastVelocityTime;
                    if (dv > 0) {
                        accelerationStats.add((velocity - lastVelocity) / dv);
                    }
                }
                lastVelocity = velocity;
                lastVelocityTime = event.getTimestamp();
            }
            if (distance > 0) {
                double heading = Math.atan2(dy, dx);
                if (!Double.isNaN(lastHeading)) {
                    curvatureStats.add(Math.abs(wrapAngle(heading - lastHeading)));
                }
                lastHeading = heading;
            }
        }
        lastX = event.getX();
        lastY = event.getY();
        lastMoveTime = event.getTimestamp();
        moveCount++;
    }

    private boolean countsReached() {
        boolean keysSeen = keystrokeCount > 0;
        boolean mouseSeen = mouseCount() > 0;
        if (!keysSeen && !mouseSeen) {
            return false;
        }
        return (!keysSeen || keystrokeCount >= minKeystrokeEvents)
            && (!mouseSeen || mouseCount() >= minMouseEvents);
    }

    private int mouseCount() {
        return moveCount + clickCount + scrollCount;
    }

    private void close(long endTime, List<FeatureWindow> sink) {
        Set<Modality> missing = EnumSet.noneOf(Modality.class);
        if (keystrokeCount < MIN_KEYSTROKES_FOR_FEATURES) {
            missing.add(Modality.KEYSTROKE);
        }
        if (moveCount < MIN_MOVES_FOR_FEATURES) {
            missing.add(Modality.MOUSE);
        }

        if (missing.size() == Modality.values().length) {
            droppedWindows++;
            logger.debug("Dropping window of session {} without a usable modality ({} keystrokes, {} moves)",
                sessionId, keystrokeCount, moveCount);
            resetWindow();
            return;
        }

        double seconds = Math.max(endTime - windowStart, 1L) / 1000.0;
        double[] values = new double[FeatureSchema.DIMENSION];
        if (missing.contains(Modality.KEYSTROKE)) {
            for (int i = FeatureSchema.KEY_HOLD_MEAN; i <= FeatureSchema.KEY_RATE; i++) {
                values[i] = Double.NaN;
            }
        } else {
            values[FeatureSchema.KEY_HOLD_MEAN] = holdStats.mean();
            values[FeatureSchema.KEY_HOLD_STD] = holdStats.stdDev();
            values[FeatureSchema.FLIGHT_MEAN] = flightStats.mean();
            values[FeatureSchema.FLIGHT_STD] = flightStats.stdDev();
            values[FeatureSchema.DIGRAPH_MEAN] = digraphStats.mean();
            values[FeatureSchema.DIGRAPH_STD] = digraphStats.stdDev();
            values[FeatureSchema.KEY_RATE] = keystrokeCount / seconds;
        }
        if (missing.contains(Modality.MOUSE)) {
            for (int i = FeatureSchema.VELOCITY_MEAN; i <= FeatureSchema.SCROLL_RATE; i++) {
                values[i] = Double.NaN;
            }
        } else {
            values[FeatureSchema.VELOCITY_MEAN] = orZero(velocityStats.mean());
            values[FeatureSchema.VELOCITY_STD] = velocityStats.stdDev();
            values[FeatureSchema.ACCELERATION_MEAN] = orZero(accelerationStats.mean());
            values[FeatureSchema.ACCELERATION_STD] = accelerationStats.stdDev();
            values[FeatureSchema.CURVATURE_MEAN] = orZero(curvatureStats.mean());
            values[FeatureSchema.CLICK_RATE] = clickCount / seconds;
            values[FeatureSchema.SCROLL_RATE] = scrollCount / seconds;
        }

        FeatureWindow window = new FeatureWindow(sessionId, nextSequence++, windowStart, endTime, values,
            keystrokeCount, mouseCount(), missing);
        logger.debug("Closed window {}", window);
        sink.add(window);
        resetWindow();
    }

    // A stationary pointer has no velocity samples; zero is the measured value there.
    private static double orZero(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    private static double wrapAngle(double angle) {
        double wrapped = angle % (2 * Math.PI);
        if (wrapped > Math.PI) {
            wrapped -= 2 * Math.PI;
        } else if (wrapped < -Math.PI) {
            wrapped += 2 * Math.PI;
        }
        return wrapped;
    }

    private void resetWindow() {
        open = false;
        holdStats.reset();
        flightStats.reset();
        digraphStats.reset();
        keystrokeCount = 0;
        velocityStats.reset();
        accelerationStats.reset();
        curvatureStats.reset();
        moveCount = 0;
        clickCount = 0;
        scrollCount = 0;
        lastVelocity = Double.NaN;
        lastHeading = Double.NaN;
    }
}
