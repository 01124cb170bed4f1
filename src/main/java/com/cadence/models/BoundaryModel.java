package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.BoundaryParameters;

import java.util.List;

/**
 * One-class classifier with a hyperspherical decision boundary.
 *
 * The boundary encloses the configured fraction of genuine training vectors around
 * their centre. The signed distance to the boundary, positive inside and relative
 * to the radius, is squashed with a logistic function so a point on the boundary
 * scores 0.5.
 */
public class BoundaryModel implements ScoringModel {

    private static final double MIN_SCALE = 0.1;
    private static final double MIN_RADIUS = 1e-6;

    private final double percentile;
    private final double steepness;

    public BoundaryModel(EngineConfig config) {
        this.percentile = config.getBoundaryPercentile();
        this.steepness = config.getBoundarySteepness();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.BOUNDARY;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        int d = trainingSet.featureCount();
        double[] center = new double[d];
        for (int t = 0; t < n; t++) {
            double[] z = trainingSet.row(t);
            for (int j = 0; j < d; j++) {
                center[j] += z[j] / n;
            }
        }
        double[] scales = new double[d];
        for (int j = 0; j < d; j++) {
            double[] column = new double[n];
            for (int t = 0; t < n; t++) {
                column[t] = trainingSet.row(t)[j];
            }
            scales[j] = Math.max(MIN_SCALE, ModelSupport.stdDev(column));
        }

        BoundaryParameters parameters = new BoundaryParameters();
        parameters.setCenter(center);
        parameters.setScales(scales);
        parameters.setSteepness(steepness);

        double[] distances = new double[n];
        for (int t = 0; t < n; t++) {
            distances[t] = scaledDistance(parameters, trainingSet.row(t));
        }
        parameters.setRadius(Math.max(MIN_RADIUS, ModelSupport.percentile(distances, percentile)));
        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        BoundaryParameters parameters = ModelSupport.requireParameters(profile, kind(), BoundaryParameters.class);
        double[] z = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        double signed = (parameters.getRadius() - scaledDistance(parameters, z)) / parameters.getRadius();
        return ModelSupport.sigmoid(parameters.getSteepness() * signed);
    }

    private static double scaledDistance(BoundaryParameters parameters, double[] z) {
        double[] center = parameters.getCenter();
        double[] scales = parameters.getScales();
        double sum = 0.0;
        int present = 0;
        for (int j = 0; j < z.length; j++) {
            if (Double.isNaN(z[j])) {
                continue;
            }
            double d = (z[j] - center[j]) / scales[j];
            sum += d * d;
            present++;
        }
        return present == 0 ? 0.0 : Math.sqrt(sum / present);
    }
}
