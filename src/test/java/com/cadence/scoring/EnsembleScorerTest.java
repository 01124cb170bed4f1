package com.cadence.scoring;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.Modality;
import com.cadence.engine.EngineMetrics;
import com.cadence.models.ModelRegistry;
import com.cadence.models.ScoringModel;
import com.cadence.models.TrainingSet;
import com.cadence.profile.ProfileArena;
import com.cadence.profile.UserProfileSet;
import com.cadence.storage.InMemoryProfileStore;
import com.cadence.support.BehaviorFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("EnsembleScorer Tests")
class EnsembleScorerTest {

    private EngineConfig config;
    private ModelRegistry registry;
    private ProfileArena arena;
    private MeterRegistry meterRegistry;
    private EnsembleScorer scorer;
    private Map<ModelKind, ModelProfile> trained;

    @BeforeEach
    void setUp() {
        config = EngineConfig.builder().profileLockTimeout(Duration.ofMillis(50)).build();
        registry = ModelRegistry.standard(config);
        arena = new ProfileArena(new InMemoryProfileStore(), config);
        meterRegistry = new SimpleMeterRegistry();
        scorer = new EnsembleScorer(registry, arena, config, new EngineMetrics(meterRegistry));

        TrainingSet trainingSet = TrainingSet.of("alice", BehaviorFixtures.genuineWindows("cal", 40, 1L),
            EnumSet.allOf(Modality.class));
        trained = new EnumMap<>(ModelKind.class);
        for (ScoringModel model : registry.all()) {
            trained.put(model.kind(), model.train(trainingSet));
        }
    }

    private void publish(Map<ModelKind, ModelProfile> profiles) {
        UserProfileSet set = arena.get("alice");
        set.withWriteLock(config.getProfileLockTimeout(), () -> {
            set.publish(profiles, null);
            return null;
        });
    }

    private static FeatureWindow liveWindow() {
        return BehaviorFixtures.genuineWindows("live", 1, 2L).get(0);
    }

    @Test
    @DisplayName("Should score a window with all six models")
    void shouldScoreWithAllModels() {
        publish(trained);

        ScoredWindow scored = scorer.score("alice", List.of(liveWindow()));

        assertThat(scored.getRecord().getRawScores()).hasSize(6);
        assertThat(scored.getRecord().getFailures()).isEmpty();
        assertThat(scored.getRecord().getWindowId()).isEqualTo("live:0");
    }

    @Test
    @DisplayName("Should isolate a model failing on dimension mismatch and aggregate the other five")
    void shouldIsolateFailingModel() {
        ModelProfile tampered = trained.get(ModelKind.NEAREST_NEIGHBOR).copy();
        tampered.setDimension(10);
        Map<ModelKind, ModelProfile> profiles = new EnumMap<>(trained);
        profiles.put(ModelKind.NEAREST_NEIGHBOR, tampered);
        publish(profiles);

        ScoredWindow scored = scorer.score("alice", List.of(liveWindow()));
        AggregateResult result = new Aggregator(config).aggregate(scored);

        assertThat(scored.getRecord().getRawScores()).hasSize(5).doesNotContainKey(ModelKind.NEAREST_NEIGHBOR);
        assertThat(scored.getRecord().getFailures()).containsOnlyKeys(ModelKind.NEAREST_NEIGHBOR);
        assertThat(scored.getRecord().getFailures().get(ModelKind.NEAREST_NEIGHBOR)).contains("dimension");
        double expected = 0.0;
        for (double score : result.getRecord().getCalibratedScores().values()) {
            expected += score / 5.0;
        }
        assertThat(result.getAggregate()).isCloseTo(expected, within(1e-12));
        assertThat(result.getAggregate()).isBetween(0.0, 1.0);
        assertThat(meterRegistry.get("cadence.model.failures").tag("model", "nearest_neighbor").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record every model as failed when the user has no profiles")
    void shouldReportMissingProfiles() {
        ScoredWindow scored = scorer.score("nobody", List.of(liveWindow()));

        assertThat(scored.getRecord().getRawScores()).isEmpty();
        assertThat(scored.getRecord().getFailures()).hasSize(6);
        assertThat(meterRegistry.get("cadence.windows.unscored").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back to the published profiles when the lock is held by a writer")
    void shouldFallBackOnLockTimeout() throws InterruptedException {
        publish(trained);
        UserProfileSet set = arena.get("alice");
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread writer = new Thread(() -> set.withWriteLock(Duration.ofSeconds(1), () -> {
            locked.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        writer.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            ScoredWindow scored = scorer.score("alice", List.of(liveWindow()));

            assertThat(scored.getRecord().getRawScores()).hasSize(6);
            assertThat(meterRegistry.get("cadence.profile.lock.timeouts").counter().count()).isEqualTo(1.0);
        } finally {
            release.countDown();
            writer.join(5_000);
        }
    }
}
