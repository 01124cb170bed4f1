package com.cadence.support;

import com.cadence.config.EngineConfig;
import com.cadence.domain.BehavioralEvent;
import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.Modality;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

/**
 * Seeded synthetic behavior for tests: feature windows drawn around a fixed
 * genuine profile, a clearly different impostor profile, and raw event streams.
 */
public final class BehaviorFixtures {

    public static final long WINDOW_MILLIS = 30_000L;

    private static final double[] GENUINE_MEANS = {
        100.0, 15.0, 150.0, 30.0, 250.0, 35.0, 4.0,
        1.2, 0.4, 0.01, 0.005, 0.6, 0.3, 0.1
    };

    private static final double[] IMPOSTOR_MEANS = {
        190.0, 45.0, 60.0, 12.0, 140.0, 70.0, 7.5,
        3.0, 1.1, 0.04, 0.02, 1.4, 0.05, 0.6
    };

    private static final double RELATIVE_NOISE = 0.05;

    private BehaviorFixtures() {
    }

    public static List<FeatureWindow> genuineWindows(String sessionId, int count, long seed) {
        return windows(sessionId, count, 0L, GENUINE_MEANS, 0.0, seed);
    }

    public static List<FeatureWindow> genuineWindows(String sessionId, int count, long startMillis, long seed) {
        return windows(sessionId, count, startMillis, GENUINE_MEANS, 0.0, seed);
    }

    public static List<FeatureWindow> impostorWindows(String sessionId, int count, long seed) {
        return windows(sessionId, count, 0L, IMPOSTOR_MEANS, 0.0, seed);
    }

    /**
     * Genuine windows with every feature mean scaled by {@code 1 + shift}
     */
    public static List<FeatureWindow> shiftedWindows(String sessionId, int count, double shift, long seed) {
        return windows(sessionId, count, 0L, GENUINE_MEANS, shift, seed);
    }

    /**
     * Genuine windows carrying keystroke features only
     */
    public static List<FeatureWindow> keystrokeOnlyWindows(String sessionId, int count, long seed) {
        List<FeatureWindow> full = genuineWindows(sessionId, count, seed);
        List<FeatureWindow> result = new ArrayList<>(full.size());
        for (FeatureWindow window : full) {
            double[] values = window.getValues();
            for (int i = FeatureSchema.VELOCITY_MEAN; i < FeatureSchema.DIMENSION; i++) {
                values[i] = Double.NaN;
            }
            result.add(new FeatureWindow(sessionId, window.getSequence(), window.getStartTime(),
                window.getEndTime(), values, window.getKeystrokeCount(), 0, EnumSet.of(Modality.MOUSE)));
        }
        return result;
    }

    private static List<FeatureWindow> windows(String sessionId, int count, long startMillis, double[] means,
                                               double shift, long seed) {
        Random random = new Random(seed);
        List<FeatureWindow> windows = new ArrayList<>(count);
        for (int w = 0; w < count; w++) {
            double[] values = new double[FeatureSchema.DIMENSION];
            for (int i = 0; i < values.length; i++) {
                double mean = means[i] * (1.0 + shift);
                values[i] = mean + random.nextGaussian() * RELATIVE_NOISE * means[i];
            }
            long start = startMillis + w * WINDOW_MILLIS;
            windows.add(new FeatureWindow(sessionId, w, start, start + WINDOW_MILLIS, values, 40, 40,
                EnumSet.noneOf(Modality.class)));
        }
        return windows;
    }

    /**
     * Small-window configuration for event-level tests: 10 s windows closed on
     * time only, 100 s of calibration.
     */
    public static EngineConfig eventLevelConfig() {
        return EngineConfig.builder()
            .windowSize(Duration.ofSeconds(10))
            .minKeystrokeEvents(1000)
            .minMouseEvents(1000)
            .minCalibrationTime(Duration.ofSeconds(100))
            .minCalibrationWindows(8)
            .minModalityWindows(5)
            .isolationTrees(30)
            .build();
    }

    /**
     * Raw keystroke and pointer events covering {@code windows} windows of
     * {@code windowMillis}, in timestamp order.
     *
     * @param impostor typing faster with longer holds and moving the pointer erratically
     */
    public static List<BehavioralEvent> events(long startMillis, int windows, long windowMillis, boolean impostor,
                                               long seed) {
        Random random = new Random(seed);
        List<BehavioralEvent> events = new ArrayList<>();
        long keyInterval = impostor ? 250L : 400L;
        double holdMean = impostor ? 190.0 : 100.0;
        double stepMean = impostor ? 120.0 : 40.0;
        double turnSpread = impostor ? 1.5 : 0.2;
        double x = 500.0;
        double y = 500.0;
        double heading = 0.0;

        long end = startMillis + windows * windowMillis;
        for (long t = startMillis; t < end; t += keyInterval) {
            long press = t + random.nextInt(40);
            long hold = Math.max(10L, Math.round(holdMean + random.nextGaussian() * 8.0));
            events.add(BehavioralEvent.keystroke("k" + random.nextInt(26), press, press + hold));

            long moveTime = t + keyInterval / 2;
            heading += random.nextGaussian() * turnSpread;
            double step = stepMean + random.nextGaussian() * 4.0;
            x += Math.cos(heading) * step;
            y += Math.sin(heading) * step;
            events.add(BehavioralEvent.mouseMove(x, y, moveTime));
        }
        return events;
    }
}
