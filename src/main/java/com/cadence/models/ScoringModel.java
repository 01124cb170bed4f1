package com.cadence.models;

import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;

import java.util.Collections;
import java.util.List;

/**
 * Capability shared by every detector of the ensemble.
 *
 * Implementations are stateless: everything learned lives in the
 * {@link ModelProfile} they return, so one instance serves all users.
 * Scores are in [0, 1] with 1 meaning fully genuine.
 */
public interface ScoringModel {

    ModelKind kind();

    /**
     * Trains a new profile from genuine calibration windows.
     */
    ModelProfile train(TrainingSet trainingSet);

    /**
     * Scores the last window of {@code recent}; earlier entries are the session's
     * preceding windows in order and are only used by sequence-aware models.
     *
     * @throws ModelUntrainedException if the profile is missing or untrained
     * @throws ModelScoreException if the window does not fit the profile
     */
    double score(ModelProfile profile, List<FeatureWindow> recent);

    default double score(ModelProfile profile, FeatureWindow window) {
        return score(profile, Collections.singletonList(window));
    }

    /**
     * Folds a window accepted as genuine into the profile. Returns the profile
     * itself when the model does not learn online, otherwise a new profile.
     */
    default ModelProfile learn(ModelProfile profile, FeatureWindow window) {
        return profile;
    }

    /**
     * Scores of the training windows under the freshly trained profile, used to
     * fit the per-user calibration transform.
     */
    default double[] trainingScores(ModelProfile profile, TrainingSet trainingSet) {
        List<FeatureWindow> windows = trainingSet.getWindows();
        double[] scores = new double[windows.size()];
        for (int i = 0; i < windows.size(); i++) {
            scores[i] = score(profile, windows.get(i));
        }
        return scores;
    }
}
