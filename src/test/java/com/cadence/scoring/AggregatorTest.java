package com.cadence.scoring;

import com.cadence.config.EngineConfig;
import com.cadence.domain.CalibrationTransform;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ScoreRecord;
import com.cadence.models.ModelUntrainedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Aggregator Tests")
class AggregatorTest {

    private EngineConfig config;
    private Aggregator aggregator;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        aggregator = new Aggregator(config);
    }

    private static ScoredWindow uniform(double score, ModelKind... kinds) {
        Map<ModelKind, Double> scores = new EnumMap<>(ModelKind.class);
        for (ModelKind kind : kinds) {
            scores.put(kind, score);
        }
        return new ScoredWindow(new ScoreRecord("s:0", 0L, scores, Collections.emptyMap()), Collections.emptyMap());
    }

    @Test
    @DisplayName("Should aggregate six equal scores of 0.9 to 0.9 without triggering")
    void shouldAggregateEqualScores() {
        AggregateResult result = aggregator.aggregate(uniform(0.9, ModelKind.values()));

        assertThat(result.getAggregate()).isCloseTo(0.9, within(1e-12));
        assertThat(result.isLowConfidence()).isFalse();
        assertThat(result.isSevereAnomaly()).isFalse();
        assertThat(result.isTriggered()).isFalse();
        assertThat(result.getRecord().getCalibratedScores()).hasSize(6);
    }

    @Test
    @DisplayName("Should renormalize weights over the models that scored")
    void shouldRenormalizeOverPresentModels() {
        EngineConfig weighted = EngineConfig.builder()
            .modelWeights(Map.of(
                ModelKind.SEQUENCE, 3.0,
                ModelKind.RECONSTRUCTION, 1.0,
                ModelKind.BOUNDARY, 1.0,
                ModelKind.NEAREST_NEIGHBOR, 1.0,
                ModelKind.ONLINE_LINEAR, 1.0,
                ModelKind.ISOLATION, 1.0))
            .build();
        Map<ModelKind, Double> calibrated = new EnumMap<>(ModelKind.class);
        calibrated.put(ModelKind.SEQUENCE, 1.0);
        calibrated.put(ModelKind.BOUNDARY, 0.2);

        double aggregate = Aggregator.combine(calibrated, weighted);

        assertThat(aggregate).isCloseTo((3.0 * 1.0 + 1.0 * 0.2) / 4.0, within(1e-12));
    }

    @Test
    @DisplayName("Should raise ModelUntrainedException when no model scored")
    void shouldFailWithZeroModels() {
        assertThatThrownBy(() -> aggregator.aggregate(uniform(0.9)))
            .isInstanceOf(ModelUntrainedException.class);
        assertThatThrownBy(() -> Aggregator.combine(Collections.emptyMap(), config))
            .isInstanceOf(ModelUntrainedException.class);
    }

    @Test
    @DisplayName("Should trigger after three consecutive low-confidence windows")
    void shouldCountConsecutiveLowWindows() {
        assertThat(aggregator.aggregate(uniform(0.3, ModelKind.values())).isTriggered()).isFalse();
        assertThat(aggregator.aggregate(uniform(0.4, ModelKind.values())).isTriggered()).isFalse();
        AggregateResult third = aggregator.aggregate(uniform(0.5, ModelKind.values()));

        assertThat(third.getConsecutiveLow()).isEqualTo(3);
        assertThat(third.isTriggered()).isTrue();
    }

    @Test
    @DisplayName("Should reset the low-confidence streak on a confident window")
    void shouldResetStreak() {
        aggregator.aggregate(uniform(0.3, ModelKind.values()));
        aggregator.aggregate(uniform(0.3, ModelKind.values()));
        aggregator.aggregate(uniform(0.9, ModelKind.values()));
        AggregateResult result = aggregator.aggregate(uniform(0.3, ModelKind.values()));

        assertThat(result.getConsecutiveLow()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count unscored windows as low confidence")
    void shouldCountUnscoredAsLow() {
        ScoreRecord empty = new ScoreRecord("s:0", 0L, Collections.emptyMap(), Collections.emptyMap());
        aggregator.aggregate(uniform(0.5, ModelKind.values()));
        aggregator.recordUnscored(empty);
        AggregateResult third = aggregator.recordUnscored(empty);

        assertThat(third.isScored()).isFalse();
        assertThat(third.getAggregate()).isNull();
        assertThat(third.isTriggered()).isTrue();
    }

    @Test
    @DisplayName("Should flag a severe anomaly below the inverted anomaly threshold")
    void shouldFlagSevereAnomaly() {
        assertThat(aggregator.aggregate(uniform(0.15, ModelKind.values())).isSevereAnomaly()).isTrue();
        assertThat(aggregator.aggregate(uniform(0.25, ModelKind.values())).isSevereAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should not flag an aggregate exactly on the severe anomaly floor")
    void shouldExcludeSevereFloorItself() {
        Aggregator strict = new Aggregator(EngineConfig.builder().anomalyScoreThreshold(0.75).build());

        AggregateResult onFloor = strict.aggregate(uniform(0.25, ModelKind.values()));
        AggregateResult belowFloor = strict.aggregate(uniform(0.2499, ModelKind.values()));

        assertThat(onFloor.getAggregate()).isEqualTo(0.25);
        assertThat(onFloor.isSevereAnomaly()).isFalse();
        assertThat(belowFloor.isSevereAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should apply each profile's calibration transform before weighting")
    void shouldApplyCalibration() {
        Map<ModelKind, Double> raw = new EnumMap<>(ModelKind.class);
        raw.put(ModelKind.BOUNDARY, 0.5);
        raw.put(ModelKind.ISOLATION, 0.5);
        Map<ModelKind, CalibrationTransform> transforms = new EnumMap<>(ModelKind.class);
        transforms.put(ModelKind.ISOLATION, new CalibrationTransform(1.0, 0.4));
        ScoredWindow scored = new ScoredWindow(new ScoreRecord("s:0", 0L, raw, Collections.emptyMap()), transforms);

        AggregateResult result = aggregator.aggregate(scored);

        assertThat(result.getRecord().getCalibratedScores().get(ModelKind.ISOLATION)).isCloseTo(0.9, within(1e-12));
        assertThat(result.getAggregate()).isCloseTo(0.7, within(1e-12));
    }

    @Test
    @DisplayName("Should map the low percentile to 0.75 and the median to 0.95")
    void shouldFitTransform() {
        double[] scores = new double[101];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = 0.4 + 0.4 * i / 100.0;
        }

        CalibrationTransform transform = Aggregator.fitTransform(scores, config);

        assertThat(transform.apply(0.42)).isCloseTo(0.75, within(1e-9));
        assertThat(transform.apply(0.60)).isCloseTo(0.95, within(1e-9));
        assertThat(transform.apply(0.0)).isLessThan(0.75);
        assertThat(transform.apply(1.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back to a unit-slope shift when training scores do not spread")
    void shouldFallBackOnDegenerateSpread() {
        double[] scores = {0.8, 0.8, 0.8, 0.8};

        CalibrationTransform transform = Aggregator.fitTransform(scores, config);

        assertThat(transform.getSlope()).isEqualTo(1.0);
        assertThat(transform.apply(0.8)).isCloseTo(0.95, within(1e-9));
    }
}
