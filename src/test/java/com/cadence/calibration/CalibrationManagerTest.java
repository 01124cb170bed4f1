package com.cadence.calibration;

import com.cadence.config.EngineConfig;
import com.cadence.domain.Modality;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.ReasonCode;
import com.cadence.engine.EngineMetrics;
import com.cadence.models.ModelRegistry;
import com.cadence.profile.ProfileArena;
import com.cadence.storage.InMemoryProfileStore;
import com.cadence.storage.ProfileStore;
import com.cadence.support.BehaviorFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("CalibrationManager Tests")
class CalibrationManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private EngineConfig config;
    private InMemoryProfileStore store;
    private ProfileArena arena;
    private SimpleMeterRegistry meterRegistry;
    private List<Runnable> pending;
    private CalibrationManager manager;

    @BeforeEach
    void setUp() {
        config = EngineConfig.builder().isolationTrees(30).build();
        store = new InMemoryProfileStore();
        arena = new ProfileArena(store, config);
        meterRegistry = new SimpleMeterRegistry();
        pending = new ArrayList<>();
        manager = newManager(arena);
    }

    private CalibrationManager newManager(ProfileArena profileArena) {
        return new CalibrationManager(ModelRegistry.standard(config), profileArena, config,
            new EngineMetrics(meterRegistry), pending::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should refuse calibration covering too little time")
    void shouldRejectShortCalibration() {
        assertThatThrownBy(() -> manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 4, 1L)))
            .isInstanceOf(CalibrationIncompleteException.class)
            .satisfies(e -> {
                CalibrationIncompleteException incomplete = (CalibrationIncompleteException) e;
                assertThat(incomplete.getCovered()).isEqualTo(Duration.ofSeconds(120));
                assertThat(incomplete.getRequired()).isEqualTo(Duration.ofSeconds(300));
            });
        assertThat(arena.get("alice").isFullyTrained()).isFalse();
    }

    @Test
    @DisplayName("Should refuse calibration with too few windows even when time is covered")
    void shouldRejectTooFewWindows() {
        config = config.toBuilder().minCalibrationTime(Duration.ofSeconds(60)).minCalibrationWindows(8).build();
        manager = newManager(new ProfileArena(store, config));

        assertThatThrownBy(() -> manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 3, 1L)))
            .isInstanceOf(CalibrationIncompleteException.class)
            .hasMessageContaining("alice");
    }

    @Test
    @DisplayName("Should train, persist and publish all six models")
    void shouldCalibrate() {
        CalibrationResult result = manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 10, 1L));

        assertThat(result.getVersion()).isEqualTo(1L);
        assertThat(result.getCovered()).isEqualTo(Duration.ofSeconds(300));
        assertThat(result.getProfiles()).hasSize(6);
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.isPersisted()).isTrue();
        assertThat(result.getReasonCode()).isEqualTo(ReasonCode.CALIBRATION_COMPLETE);
        assertThat(result.getTrainedModalities()).containsExactlyInAnyOrder(Modality.KEYSTROKE, Modality.MOUSE);
        for (ModelProfile profile : result.getProfiles().values()) {
            assertThat(profile.getTrainedAt()).isEqualTo(NOW);
            assertThat(profile.getCalibration()).isNotNull();
        }
        for (ModelKind kind : ModelKind.values()) {
            assertThat(store.loadProfile("alice", kind)).isPresent();
        }
        assertThat(store.loadBaselineStats("alice")).isPresent();
        assertThat(arena.get("alice").isFullyTrained()).isTrue();
        assertThat(arena.get("alice").getGeneration()).isEqualTo(1L);
        assertThat(meterRegistry.get("cadence.training.latency").timer().count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should train degraded profiles when one modality is missing")
    void shouldCalibrateDegraded() {
        CalibrationResult result = manager.calibrate("alice", BehaviorFixtures.keystrokeOnlyWindows("s", 10, 1L));

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getReasonCode()).isEqualTo(ReasonCode.CALIBRATION_DEGRADED);
        assertThat(result.getTrainedModalities()).containsExactly(Modality.KEYSTROKE);
        assertThat(result.getDegradation().getMissing()).containsExactly(Modality.MOUSE);
        assertThat(result.getDegradation().getWindowCounts()).containsEntry(Modality.MOUSE, 0);
        assertThat(result.getProfiles()).hasSize(6);
    }

    @Test
    @DisplayName("Should fail when no modality has enough windows")
    void shouldFailWithoutAnyModality() {
        config = config.toBuilder().minModalityWindows(20).build();
        manager = newManager(new ProfileArena(store, config));

        assertThatThrownBy(() -> manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 10, 1L)))
            .isInstanceOf(InsufficientModalityDataException.class)
            .satisfies(e -> assertThat(((InsufficientModalityDataException) e).getMissing())
                .containsExactlyInAnyOrder(Modality.KEYSTROKE, Modality.MOUSE));
    }

    @Test
    @DisplayName("Should keep profiles in memory when persistence fails")
    void shouldSurvivePersistenceFailure() {
        ProfileStore failing = mock(ProfileStore.class);
        doThrow(new IllegalStateException("redis down")).when(failing).saveProfile(any());
        ProfileArena failingArena = new ProfileArena(failing, config);
        manager = newManager(failingArena);

        CalibrationResult result = manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 10, 1L));

        assertThat(result.isPersisted()).isFalse();
        assertThat(failingArena.get("alice").isFullyTrained()).isTrue();
    }

    @Test
    @DisplayName("Should recalibrate in the background with a new version")
    void shouldRecalibrateAsync() {
        manager.calibrate("alice", BehaviorFixtures.genuineWindows("s", 10, 1L));

        Optional<CompletableFuture<CalibrationResult>> first =
            manager.recalibrateAsync("alice", BehaviorFixtures.shiftedWindows("s", 10, 0.2, 2L));
        Optional<CompletableFuture<CalibrationResult>> second =
            manager.recalibrateAsync("alice", BehaviorFixtures.shiftedWindows("s", 10, 0.2, 3L));

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(arena.get("alice").isRecalibrating()).isTrue();

        pending.forEach(Runnable::run);

        CalibrationResult result = first.get().join();
        assertThat(result.getVersion()).isEqualTo(2L);
        assertThat(arena.get("alice").isRecalibrating()).isFalse();
        assertThat(arena.get("alice").getGeneration()).isEqualTo(2L);
        assertThat(meterRegistry.get("cadence.recalibrations").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should release the recalibration slot after a failed run")
    void shouldReleaseAfterFailedRecalibration() {
        Optional<CompletableFuture<CalibrationResult>> run =
            manager.recalibrateAsync("alice", BehaviorFixtures.genuineWindows("s", 2, 1L));
        pending.forEach(Runnable::run);

        assertThat(run.get()).isCompletedExceptionally();
        assertThat(arena.get("alice").isRecalibrating()).isFalse();
    }

    @Test
    @DisplayName("Should measure coverage from first start to last end")
    void shouldMeasureCoverage() {
        assertThat(CalibrationManager.coverage(List.of())).isEqualTo(Duration.ZERO);
        assertThat(CalibrationManager.coverage(BehaviorFixtures.genuineWindows("s", 3, 60_000L, 1L)))
            .isEqualTo(Duration.ofSeconds(90));
    }
}
