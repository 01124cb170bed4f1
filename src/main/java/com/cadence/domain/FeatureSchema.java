package com.cadence.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Fixed layout of the behavioral feature vector.
 *
 * Keystroke features occupy the first block, mouse features the second. Times are
 * milliseconds, distances pixels, rates events per second.
 */
public final class FeatureSchema {

    public static final int KEY_HOLD_MEAN = 0;
    public static final int KEY_HOLD_STD = 1;
    public static final int FLIGHT_MEAN = 2;
    public static final int FLIGHT_STD = 3;
    public static final int DIGRAPH_MEAN = 4;
    public static final int DIGRAPH_STD = 5;
    public static final int KEY_RATE = 6;
    public static final int VELOCITY_MEAN = 7;
    public static final int VELOCITY_STD = 8;
    public static final int ACCELERATION_MEAN = 9;
    public static final int ACCELERATION_STD = 10;
    public static final int CURVATURE_MEAN = 11;
    public static final int CLICK_RATE = 12;
    public static final int SCROLL_RATE = 13;

    public static final int DIMENSION = 14;

    private static final List<String> NAMES = Collections.unmodifiableList(List.of(
        "key_hold_mean",
        "key_hold_std",
        "flight_mean",
        "flight_std",
        "digraph_mean",
        "digraph_std",
        "key_rate",
        "velocity_mean",
        "velocity_std",
        "acceleration_mean",
        "acceleration_std",
        "curvature_mean",
        "click_rate",
        "scroll_rate"
    ));

    private FeatureSchema() {
        throw new UnsupportedOperationException("FeatureSchema is a utility class and cannot be instantiated");
    }

    public static List<String> names() {
        return NAMES;
    }

    public static String name(int index) {
        return NAMES.get(index);
    }

    public static Modality modalityOf(int index) {
        if (index < 0 || index >= DIMENSION) {
            throw new IndexOutOfBoundsException("Feature index out of range: " + index);
        }
        return index <= KEY_RATE ? Modality.KEYSTROKE : Modality.MOUSE;
    }

    /**
     * Indices of all features belonging to the given modalities, in schema order
     */
    public static int[] indicesOf(Set<Modality> modalities) {
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < DIMENSION; i++) {
            if (modalities.contains(modalityOf(i))) {
                selected.add(i);
            }
        }
        return selected.stream().mapToInt(Integer::intValue).toArray();
    }
}
