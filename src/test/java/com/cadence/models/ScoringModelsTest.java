package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureSchema;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.domain.Modality;
import com.cadence.models.params.LinearParameters;
import com.cadence.models.params.NearestNeighborParameters;
import com.cadence.support.BehaviorFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Scoring model Tests")
class ScoringModelsTest {

    private static final EnumSet<Modality> BOTH = EnumSet.allOf(Modality.class);

    private EngineConfig config;
    private ModelRegistry registry;
    private TrainingSet trainingSet;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        registry = ModelRegistry.standard(config);
        trainingSet = TrainingSet.of("alice", BehaviorFixtures.genuineWindows("cal", 40, 1L), BOTH);
    }

    private static double meanScore(ScoringModel model, ModelProfile profile, List<FeatureWindow> windows) {
        double sum = 0.0;
        for (FeatureWindow window : windows) {
            sum += model.score(profile, window);
        }
        return sum / windows.size();
    }

    @Test
    @DisplayName("Should register one model per kind")
    void shouldRegisterAllKinds() {
        assertThat(registry.size()).isEqualTo(ModelKind.values().length);
        for (ModelKind kind : ModelKind.values()) {
            assertThat(registry.get(kind).kind()).isEqualTo(kind);
        }
    }

    @Test
    @DisplayName("Should score genuine windows above impostor windows for every model")
    void shouldSeparateGenuineFromImpostor() {
        List<FeatureWindow> genuine = BehaviorFixtures.genuineWindows("live", 10, 2L);
        List<FeatureWindow> impostor = BehaviorFixtures.impostorWindows("live", 10, 3L);

        for (ScoringModel model : registry.all()) {
            ModelProfile profile = model.train(trainingSet);

            double genuineScore = meanScore(model, profile, genuine);
            double impostorScore = meanScore(model, profile, impostor);

            assertThat(genuineScore).as("%s genuine", model.kind()).isBetween(0.0, 1.0);
            assertThat(impostorScore).as("%s impostor", model.kind()).isBetween(0.0, 1.0);
            assertThat(genuineScore).as("%s separation", model.kind()).isGreaterThan(impostorScore);
        }
    }

    @Test
    @DisplayName("Should produce one training score per window in [0, 1]")
    void shouldProduceTrainingScores() {
        for (ScoringModel model : registry.all()) {
            ModelProfile profile = model.train(trainingSet);

            double[] scores = model.trainingScores(profile, trainingSet);

            assertThat(scores).as("%s", model.kind()).hasSize(trainingSet.size());
            for (double score : scores) {
                assertThat(score).as("%s", model.kind()).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    @DisplayName("Should train reproducibly from the same data")
    void shouldTrainDeterministically() {
        FeatureWindow live = BehaviorFixtures.genuineWindows("live", 1, 9L).get(0);
        for (ScoringModel model : registry.all()) {
            double first = model.score(model.train(trainingSet), live);
            double second = model.score(model.train(trainingSet), live);

            assertThat(second).as("%s", model.kind()).isCloseTo(first, within(1e-12));
        }
    }

    @Test
    @DisplayName("Should reject a missing or untrained profile")
    void shouldRejectUntrainedProfile() {
        FeatureWindow window = BehaviorFixtures.genuineWindows("live", 1, 2L).get(0);
        for (ScoringModel model : registry.all()) {
            ModelProfile untrained = new ModelProfile("alice", model.kind());

            assertThatThrownBy(() -> model.score(null, window))
                .as("%s", model.kind())
                .isInstanceOf(ModelUntrainedException.class);
            assertThatThrownBy(() -> model.score(untrained, window))
                .as("%s", model.kind())
                .isInstanceOf(ModelUntrainedException.class);
        }
    }

    @Test
    @DisplayName("Should raise ModelScoreException on a feature dimension mismatch")
    void shouldRejectDimensionMismatch() {
        FeatureWindow shortWindow = new FeatureWindow("live", 0, 0, 30_000, new double[10], 30, 30,
            EnumSet.noneOf(Modality.class));
        for (ScoringModel model : registry.all()) {
            ModelProfile profile = model.train(trainingSet);

            assertThatThrownBy(() -> model.score(profile, shortWindow))
                .as("%s", model.kind())
                .isInstanceOf(ModelScoreException.class)
                .hasMessageContaining("dimension");
        }
    }

    @Test
    @DisplayName("Should refuse windows sharing no modality with the profile")
    void shouldRejectWindowWithoutProfileModality() {
        TrainingSet keystrokeOnly = TrainingSet.of("alice",
            BehaviorFixtures.keystrokeOnlyWindows("cal", 20, 1L), EnumSet.of(Modality.KEYSTROKE));
        FeatureWindow mouseOnly = new FeatureWindow("live", 0, 0, 30_000, mouseOnlyValues(), 0, 40,
            EnumSet.of(Modality.KEYSTROKE));
        for (ScoringModel model : registry.all()) {
            ModelProfile profile = model.train(keystrokeOnly);

            assertThat(profile.getModalities()).containsExactly(Modality.KEYSTROKE);
            assertThatThrownBy(() -> model.score(profile, mouseOnly))
                .as("%s", model.kind())
                .isInstanceOf(ModelScoreException.class);
        }
    }

    private static double[] mouseOnlyValues() {
        double[] values = BehaviorFixtures.genuineWindows("live", 1, 4L).get(0).getValues();
        Arrays.fill(values, 0, 7, Double.NaN);
        return values;
    }

    @Test
    @DisplayName("Should require at least two training windows")
    void shouldRejectTinyTrainingSet() {
        List<FeatureWindow> one = BehaviorFixtures.genuineWindows("cal", 1, 1L);

        assertThatThrownBy(() -> TrainingSet.of("alice", one, BOTH))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TrainingSet.of("alice", BehaviorFixtures.genuineWindows("cal", 5, 1L),
            Collections.emptySet()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Nearest neighbour store")
    class NearestNeighbor {

        @Test
        @DisplayName("Should evict the oldest vectors once capacity is reached")
        void shouldEvictOldestFirst() {
            EngineConfig small = EngineConfig.builder().neighborCapacity(10).neighborK(3).build();
            NearestNeighborModel model = new NearestNeighborModel(small);
            TrainingSet ten = TrainingSet.of("alice", BehaviorFixtures.genuineWindows("cal", 10, 1L), BOTH);
            ModelProfile profile = model.train(ten);
            NearestNeighborParameters before = (NearestNeighborParameters) profile.getParameters();
            double[] fourthOldest = before.getVectors().get(3).clone();

            ModelProfile updated = profile;
            for (FeatureWindow window : BehaviorFixtures.genuineWindows("live", 3, 5L)) {
                updated = model.learn(updated, window);
            }

            NearestNeighborParameters after = (NearestNeighborParameters) updated.getParameters();
            assertThat(after.getVectors()).hasSize(10);
            assertThat(after.getVectors().get(0)).containsExactly(fourthOldest);
            assertThat(before.getVectors()).hasSize(10);
            assertThat(updated).isNotSameAs(profile);
        }

        @Test
        @DisplayName("Should keep only the most recent training windows up to capacity")
        void shouldCapTrainingStore() {
            EngineConfig small = EngineConfig.builder().neighborCapacity(15).build();
            ModelProfile profile = new NearestNeighborModel(small).train(trainingSet);

            assertThat(((NearestNeighborParameters) profile.getParameters()).getVectors()).hasSize(15);
        }
    }

    @Nested
    @DisplayName("Online linear classifier")
    class OnlineLinear {

        @Test
        @DisplayName("Should apply one genuine and one impostor update per learned window")
        void shouldUpdateIncrementally() {
            OnlineLinearModel model = new OnlineLinearModel(config);
            ModelProfile profile = model.train(trainingSet);
            long updatesBefore = ((LinearParameters) profile.getParameters()).getUpdates();
            FeatureWindow window = BehaviorFixtures.genuineWindows("live", 1, 6L).get(0);

            ModelProfile updated = model.learn(profile, window);

            assertThat(((LinearParameters) updated.getParameters()).getUpdates()).isEqualTo(updatesBefore + 2);
            assertThat(((LinearParameters) profile.getParameters()).getUpdates()).isEqualTo(updatesBefore);
        }

        @Test
        @DisplayName("Should never move the margin against a correctly classified sample")
        void shouldStayPassiveOnSatisfiedMargin() {
            LinearParameters parameters = new LinearParameters();
            parameters.setWeights(new double[] {-1.0, 5.0});
            parameters.setAggressiveness(0.5);

            OnlineLinearModel.update(parameters, new double[] {0.1, 1.0}, 1.0);

            assertThat(parameters.getWeights()).containsExactly(-1.0, 5.0);
            assertThat(parameters.getUpdates()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should use the standard isolation path normalizer")
    void shouldNormalizeIsolationPaths() {
        assertThat(IsolationForestModel.averagePathLength(1)).isZero();
        assertThat(IsolationForestModel.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestModel.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    @DisplayName("Should interpolate percentiles between order statistics")
    void shouldInterpolatePercentiles() {
        double[] values = {4.0, 1.0, 3.0, 2.0};

        assertThat(ModelSupport.percentile(values, 0.0)).isEqualTo(1.0);
        assertThat(ModelSupport.percentile(values, 0.5)).isCloseTo(2.5, within(1e-12));
        assertThat(ModelSupport.percentile(values, 0.95)).isCloseTo(3.85, within(1e-12));
        assertThat(ModelSupport.percentile(values, 1.0)).isEqualTo(4.0);
        assertThatThrownBy(() -> ModelSupport.percentile(new double[0], 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should keep orthonormal principal directions ordered by variance")
    void shouldExtractPrincipalComponents() {
        double[][] rows = {
            {-3.0, 0.2, 0.0},
            {-1.0, -0.2, 0.0},
            {1.0, -0.2, 0.0},
            {3.0, 0.2, 0.0}
        };

        double[][] components = ReconstructionModel.principalComponents(rows, 2);

        assertThat(components).hasNumberOfRows(2);
        assertThat(Math.abs(components[0][0])).isCloseTo(1.0, within(1e-9));
        assertThat(Math.abs(components[1][1])).isCloseTo(1.0, within(1e-9));
        double dot = 0.0;
        for (int i = 0; i < 3; i++) {
            dot += components[0][i] * components[1][i];
        }
        assertThat(dot).isCloseTo(0.0, within(1e-9));
        assertThat(ReconstructionModel.reconstructionError(components, new double[] {2.0, 0.1, 0.0}))
            .isCloseTo(0.0, within(1e-12));
        assertThat(ReconstructionModel.principalComponents(rows, 3))
            .as("the constant third feature carries no variance")
            .hasNumberOfRows(2);
    }

    @Test
    @DisplayName("Should judge a window by its present features only when a modality is missing")
    void shouldIgnoreMissingModalityFeatures() {
        FeatureWindow impostor = BehaviorFixtures.impostorWindows("x", 1, 9L).get(0);
        ScoringModel boundary = registry.get(ModelKind.BOUNDARY);
        ScoringModel neighbours = registry.get(ModelKind.NEAREST_NEIGHBOR);
        ModelProfile boundaryProfile = boundary.train(trainingSet);
        ModelProfile neighbourProfile = neighbours.train(trainingSet);

        double[] withoutMouse = impostor.getValues();
        double[] mouseAtBaseline = impostor.getValues();
        double[] means = boundaryProfile.getBaselineMeans();
        int[] indices = boundaryProfile.getFeatureIndices();
        for (int j = 0; j < indices.length; j++) {
            if (indices[j] >= FeatureSchema.VELOCITY_MEAN) {
                withoutMouse[indices[j]] = Double.NaN;
                mouseAtBaseline[indices[j]] = means[j];
            }
        }
        FeatureWindow partial = new FeatureWindow("x", 0, 0L, 30_000L, withoutMouse, 40, 0,
            EnumSet.of(Modality.MOUSE));
        FeatureWindow diluted = new FeatureWindow("x", 0, 0L, 30_000L, mouseAtBaseline, 40, 40,
            EnumSet.noneOf(Modality.class));

        double[] z = ModelSupport.standardize(boundaryProfile, partial);
        for (int j = 0; j < indices.length; j++) {
            assertThat(Double.isNaN(z[j])).isEqualTo(indices[j] >= FeatureSchema.VELOCITY_MEAN);
        }
        assertThat(boundary.score(boundaryProfile, partial))
            .isLessThan(boundary.score(boundaryProfile, diluted));
        assertThat(neighbours.score(neighbourProfile, partial))
            .isLessThan(neighbours.score(neighbourProfile, diluted));
        for (ScoringModel model : registry.all()) {
            assertThat(model.score(model.train(trainingSet), partial)).isBetween(0.0, 1.0);
        }
        assertThat(ModelSupport.distance(new double[] {1.0, Double.NaN}, new double[] {1.0, 5.0})).isZero();
    }

    @Test
    @DisplayName("Should not learn online from windows missing profile features")
    void shouldSkipIncompleteWindowsWhenLearning() {
        FeatureWindow partial = BehaviorFixtures.keystrokeOnlyWindows("x", 1, 4L).get(0);
        ScoringModel neighbours = registry.get(ModelKind.NEAREST_NEIGHBOR);
        ScoringModel linear = registry.get(ModelKind.ONLINE_LINEAR);
        ModelProfile neighbourProfile = neighbours.train(trainingSet);
        ModelProfile linearProfile = linear.train(trainingSet);

        assertThat(neighbours.learn(neighbourProfile, partial)).isSameAs(neighbourProfile);
        assertThat(linear.learn(linearProfile, partial)).isSameAs(linearProfile);
    }
}
