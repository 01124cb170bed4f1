package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.LinearParameters;

import java.util.List;
import java.util.Random;

/**
 * Online linear classifier trained with passive-aggressive (PA-I) updates.
 *
 * Inputs are the absolute standardized deviations plus a bias term. Genuine
 * windows are the positive class; the negative class is synthetic impostor
 * vectors drawn with three times the genuine spread. The score is the logistic
 * of the margin.
 */
public class OnlineLinearModel implements ScoringModel {

    static final double IMPOSTOR_SPREAD = 3.0;

    private final double aggressiveness;
    private final int epochs;

    public OnlineLinearModel(EngineConfig config) {
        this.aggressiveness = config.getLinearAggressiveness();
        this.epochs = config.getLinearEpochs();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.ONLINE_LINEAR;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        int d = trainingSet.featureCount();
        long seed = ModelSupport.seed(trainingSet.getUserId(), kind());
        Random random = new Random(seed);

        LinearParameters parameters = new LinearParameters();
        parameters.setWeights(new double[d + 1]);
        parameters.setAggressiveness(aggressiveness);
        parameters.setSeed(seed);

        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int index : order) {
                update(parameters, features(trainingSet.row(index)), 1.0);
                update(parameters, features(impostor(d, random)), -1.0);
            }
        }
        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        LinearParameters parameters = ModelSupport.requireParameters(profile, kind(), LinearParameters.class);
        double[] z = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        if (z.length + 1 != parameters.getWeights().length) {
            throw new ModelScoreException(kind(), parameters.getWeights().length - 1, z.length);
        }
        return ModelSupport.sigmoid(presentMargin(parameters.getWeights(), z));
    }

    /**
     * One genuine update followed by one synthetic impostor update. Windows
     * missing any profile feature are not learned from.
     */
    @Override
    public ModelProfile learn(ModelProfile profile, FeatureWindow window) {
        ModelSupport.requireParameters(profile, kind(), LinearParameters.class);
        double[] z = ModelSupport.standardize(profile, window);
        if (!ModelSupport.isComplete(z)) {
            return profile;
        }
        ModelProfile updated = profile.copy();
        LinearParameters parameters = (LinearParameters) updated.getParameters();
        Random random = new Random(parameters.getSeed() + parameters.getUpdates());
        update(parameters, features(z), 1.0);
        update(parameters, features(impostor(z.length, random)), -1.0);
        return updated;
    }

    static void update(LinearParameters parameters, double[] x, double label) {
        double[] w = parameters.getWeights();
        double loss = Math.max(0.0, 1.0 - label * margin(w, x));
        if (loss > 0) {
            double normSquared = 0.0;
            for (double v : x) {
                normSquared += v * v;
            }
            double tau = Math.min(parameters.getAggressiveness(), loss / normSquared);
            for (int i = 0; i < w.length; i++) {
                w[i] += tau * label * x[i];
            }
        }
        parameters.setUpdates(parameters.getUpdates() + 1);
    }

    /**
     * Margin over the present features, rescaled to the full feature count
     */
    static double presentMargin(double[] w, double[] z) {
        int present = ModelSupport.presentCount(z);
        double sum = 0.0;
        for (int i = 0; i < z.length; i++) {
            if (!Double.isNaN(z[i])) {
                sum += w[i] * Math.abs(z[i]);
            }
        }
        double scale = present == 0 ? 0.0 : z.length / (double) present;
        return scale * sum + w[z.length];
    }

    private static double margin(double[] w, double[] x) {
        double sum = 0.0;
        for (int i = 0; i < w.length; i++) {
            sum += w[i] * x[i];
        }
        return sum;
    }

    private static double[] features(double[] z) {
        double[] x = new double[z.length + 1];
        for (int i = 0; i < z.length; i++) {
            x[i] = Math.abs(z[i]);
        }
        x[z.length] = 1.0;
        return x;
    }

    private static double[] impostor(int d, Random random) {
        double[] z = new double[d];
        for (int i = 0; i < d; i++) {
            z[i] = ModelSupport.clip(random.nextGaussian() * IMPOSTOR_SPREAD);
        }
        return z;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
