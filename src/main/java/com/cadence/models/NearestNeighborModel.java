package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.NearestNeighborParameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Incremental k-nearest-neighbour classifier.
 *
 * Keeps the most recent genuine vectors up to a fixed capacity, evicting the
 * oldest first. The score decays from 1 to 0.5 as the mean distance to the k
 * nearest stored vectors grows from the typical training distance to twice that.
 */
public class NearestNeighborModel implements ScoringModel {

    private static final double MIN_TYPICAL_DISTANCE = 1e-3;

    private final int capacity;
    private final int k;

    public NearestNeighborModel(EngineConfig config) {
        this.capacity = config.getNeighborCapacity();
        this.k = config.getNeighborK();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.NEAREST_NEIGHBOR;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        List<double[]> vectors = new ArrayList<>();
        for (int t = Math.max(0, n - capacity); t < n; t++) {
            vectors.add(trainingSet.row(t).clone());
        }

        double[] leaveOneOut = leaveOneOutDistances(vectors, k);
        NearestNeighborParameters parameters = new NearestNeighborParameters();
        parameters.setCapacity(capacity);
        parameters.setK(k);
        parameters.setVectors(vectors);
        parameters.setTypicalDistance(Math.max(MIN_TYPICAL_DISTANCE, ModelSupport.percentile(leaveOneOut, 0.5)));
        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        NearestNeighborParameters parameters =
            ModelSupport.requireParameters(profile, kind(), NearestNeighborParameters.class);
        double[] z = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        if (parameters.getVectors().isEmpty()) {
            throw new ModelUntrainedException(profile.getUserId(), kind());
        }
        for (double[] vector : parameters.getVectors()) {
            if (vector.length != z.length) {
                throw new ModelScoreException(kind(), vector.length, z.length);
            }
        }
        double mean = meanNearestDistance(parameters.getVectors(), z, parameters.getK(), -1);
        return toScore(parameters, mean);
    }

    /**
     * Appends the window and evicts the oldest vectors beyond capacity. Windows
     * missing any profile feature are not stored.
     */
    @Override
    public ModelProfile learn(ModelProfile profile, FeatureWindow window) {
        ModelSupport.requireParameters(profile, kind(), NearestNeighborParameters.class);
        double[] z = ModelSupport.standardize(profile, window);
        if (!ModelSupport.isComplete(z)) {
            return profile;
        }
        ModelProfile updated = profile.copy();
        NearestNeighborParameters parameters = (NearestNeighborParameters) updated.getParameters();
        parameters.getVectors().add(z);
        while (parameters.getVectors().size() > parameters.getCapacity()) {
            parameters.getVectors().remove(0);
        }
        return updated;
    }

    /**
     * Leave-one-out scores, so a training vector is never its own neighbour
     */
    @Override
    public double[] trainingScores(ModelProfile profile, TrainingSet trainingSet) {
        NearestNeighborParameters parameters =
            ModelSupport.requireParameters(profile, kind(), NearestNeighborParameters.class);
        double[] distances = leaveOneOutDistances(parameters.getVectors(), parameters.getK());
        double[] scores = new double[distances.length];
        for (int i = 0; i < distances.length; i++) {
            scores[i] = toScore(parameters, distances[i]);
        }
        return scores;
    }

    private static double toScore(NearestNeighborParameters parameters, double meanDistance) {
        double typical = parameters.getTypicalDistance();
        return ModelSupport.halfLifeScore(meanDistance, typical, typical);
    }

    private static double[] leaveOneOutDistances(List<double[]> vectors, int k) {
        double[] result = new double[vectors.size()];
        for (int i = 0; i < vectors.size(); i++) {
            result[i] = meanNearestDistance(vectors, vectors.get(i), k, i);
        }
        return result;
    }

    static double meanNearestDistance(List<double[]> vectors, double[] z, int k, int excluded) {
        int candidates = excluded >= 0 ? vectors.size() - 1 : vectors.size();
        if (candidates <= 0) {
            return 0.0;
        }
        double[] distances = new double[candidates];
        int next = 0;
        for (int i = 0; i < vectors.size(); i++) {
            if (i != excluded) {
                distances[next++] = ModelSupport.distance(vectors.get(i), z);
            }
        }
        Arrays.sort(distances);
        int neighbours = Math.min(k, distances.length);
        double sum = 0.0;
        for (int i = 0; i < neighbours; i++) {
            sum += distances[i];
        }
        return sum / neighbours;
    }
}
