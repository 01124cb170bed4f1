package com.cadence.drift;

import com.cadence.config.EngineConfig;
import com.cadence.domain.DriftState;
import com.cadence.domain.FeatureWindow;
import com.cadence.support.BehaviorFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DriftMonitor Tests")
class DriftMonitorTest {

    private EngineConfig config;
    private DriftState baseline;

    @BeforeEach
    void setUp() {
        config = EngineConfig.builder()
            .driftMinWindows(2)
            .driftSustainedWindows(3)
            .driftDetectionWindow(20)
            .build();
        baseline = DriftMonitor.baselineOf("alice", BehaviorFixtures.genuineWindows("cal", 40, 1L),
            Instant.parse("2026-01-01T00:00:00Z"));
    }

    private double driftAfter(List<FeatureWindow> windows) {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        DriftAssessment last = null;
        for (FeatureWindow window : windows) {
            last = monitor.update(window, 0.9);
        }
        return last.getDriftScore();
    }

    @Test
    @DisplayName("Should grow drift score as the behavior shifts further from the baseline")
    void shouldIncreaseWithShift() {
        double none = driftAfter(BehaviorFixtures.shiftedWindows("s", 20, 0.0, 7L));
        double small = driftAfter(BehaviorFixtures.shiftedWindows("s", 20, 0.1, 7L));
        double medium = driftAfter(BehaviorFixtures.shiftedWindows("s", 20, 0.3, 7L));
        double large = driftAfter(BehaviorFixtures.shiftedWindows("s", 20, 0.6, 7L));

        assertThat(none).isLessThan(config.getDriftAlertThreshold());
        assertThat(small).isGreaterThan(none);
        assertThat(medium).isGreaterThan(small);
        assertThat(large).isGreaterThanOrEqualTo(medium);
    }

    @Test
    @DisplayName("Should not report drift before the minimum window count")
    void shouldNotBeReadyBelowMinimum() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);

        DriftAssessment first = monitor.update(BehaviorFixtures.shiftedWindows("s", 1, 0.6, 3L).get(0), 0.9);

        assertThat(first.isReady()).isFalse();
        assertThat(first.getDriftScore()).isZero();
        assertThat(monitor.getWindowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not report drift without a baseline")
    void shouldNotBeReadyWithoutBaseline() {
        DriftMonitor monitor = new DriftMonitor(config, null);
        DriftAssessment assessment = null;
        for (FeatureWindow window : BehaviorFixtures.shiftedWindows("s", 5, 0.6, 3L)) {
            assessment = monitor.update(window, 0.9);
        }

        assertThat(assessment.isReady()).isFalse();
        assertThat(assessment.isRecalibrationSuggested()).isFalse();
    }

    @Test
    @DisplayName("Should suggest recalibration after sustained drift with genuine scores")
    void shouldSuggestRecalibration() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        List<FeatureWindow> windows = BehaviorFixtures.shiftedWindows("s", 4, 0.3, 5L);

        DriftAssessment first = monitor.update(windows.get(0), 0.9);
        DriftAssessment second = monitor.update(windows.get(1), 0.9);
        DriftAssessment third = monitor.update(windows.get(2), 0.9);
        DriftAssessment fourth = monitor.update(windows.get(3), 0.9);

        assertThat(first.isReady()).isFalse();
        assertThat(second.isAboveAlert()).isTrue();
        assertThat(second.isRecalibrationSuggested()).isFalse();
        assertThat(third.isRecalibrationSuggested()).isFalse();
        assertThat(fourth.isRecalibrationSuggested()).isTrue();
        assertThat(fourth.isIntrusionSuspected()).isFalse();
    }

    @Test
    @DisplayName("Should flag intrusion when high drift coincides with low confidence")
    void shouldFlagIntrusion() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        DriftAssessment assessment = null;
        for (FeatureWindow window : BehaviorFixtures.shiftedWindows("s", 3, 0.6, 5L)) {
            assessment = monitor.update(window, 0.2);
        }

        assertThat(assessment.getDriftScore()).isGreaterThan(config.getDriftIntrusionThreshold());
        assertThat(assessment.isIntrusionSuspected()).isTrue();
        assertThat(assessment.isRecalibrationSuggested()).isFalse();
    }

    @Test
    @DisplayName("Should treat an unscored window as not genuine")
    void shouldTreatUnscoredAsNotGenuine() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        DriftAssessment assessment = null;
        for (FeatureWindow window : BehaviorFixtures.shiftedWindows("s", 3, 0.6, 5L)) {
            assessment = monitor.update(window, null);
        }

        assertThat(assessment.isIntrusionSuspected()).isTrue();
        assertThat(assessment.getSustainedWindows()).isZero();
    }

    @Test
    @DisplayName("Should restart the rolling window on rebaseline")
    void shouldRebaseline() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        List<FeatureWindow> shifted = BehaviorFixtures.shiftedWindows("s", 10, 0.6, 5L);
        for (FeatureWindow window : shifted) {
            monitor.update(window, 0.9);
        }
        assertThat(monitor.getDriftScore()).isGreaterThan(config.getDriftAlertThreshold());

        monitor.rebaseline(DriftMonitor.baselineOf("alice", shifted, Instant.parse("2026-02-01T00:00:00Z")));

        assertThat(monitor.getWindowCount()).isZero();
        assertThat(monitor.getDriftScore()).isZero();
        DriftAssessment after = null;
        for (FeatureWindow window : BehaviorFixtures.shiftedWindows("t", 5, 0.6, 9L)) {
            after = monitor.update(window, 0.9);
        }
        assertThat(after.getDriftScore()).isLessThan(config.getDriftAlertThreshold());
    }

    @Test
    @DisplayName("Should capture baseline and rolling statistics in a snapshot")
    void shouldSnapshotState() {
        DriftMonitor monitor = new DriftMonitor(config, baseline);
        for (FeatureWindow window : BehaviorFixtures.genuineWindows("s", 4, 5L)) {
            monitor.update(window, 0.9);
        }

        DriftState snapshot = monitor.snapshot("alice");

        assertThat(snapshot.getUserId()).isEqualTo("alice");
        assertThat(snapshot.getBaselineMeans()).isEqualTo(baseline.getBaselineMeans());
        assertThat(snapshot.getCurrentCounts()).isNotNull();
        assertThat(snapshot.getLastRecalibration()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should build baseline statistics from calibration windows")
    void shouldBuildBaseline() {
        for (long count : baseline.getBaselineCounts()) {
            assertThat(count).isEqualTo(40L);
        }
        for (double std : baseline.getBaselineStdDevs()) {
            assertThat(std).isPositive();
        }
    }
}
